package com.wxplot.plotapi.series.model;

import java.util.Locale;

public enum AggregationType {
  NONE,
  SUM,
  AVG,
  MIN,
  MAX,
  COUNT,
  LAST;

  public static AggregationType parse(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    return AggregationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  public boolean isAggregate() {
    return this != NONE;
  }
}
