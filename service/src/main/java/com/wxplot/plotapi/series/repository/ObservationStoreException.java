package com.wxplot.plotapi.series.repository;

public class ObservationStoreException extends RuntimeException {
  public ObservationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
