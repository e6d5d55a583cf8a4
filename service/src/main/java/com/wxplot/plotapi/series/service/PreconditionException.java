package com.wxplot.plotapi.series.service;

public class PreconditionException extends RuntimeException {
  public PreconditionException(String message) {
    super(message);
  }
}
