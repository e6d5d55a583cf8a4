package com.wxplot.plotapi.series.controller;

/**
 * A query parameter of the plot endpoint that could not be used. Each error code has a page
 * under {@link #ERROR_DOCS_BASE}.
 */
public class InvalidParameterException extends RuntimeException {
  static final String ERROR_DOCS_BASE = "https://docs.wxplot.dev/errors/";

  private final String parameter;
  private final int errorCode;

  public InvalidParameterException(String parameter, String message, int errorCode) {
    super(message);
    this.parameter = parameter;
    this.errorCode = errorCode;
  }

  public String parameter() {
    return parameter;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
