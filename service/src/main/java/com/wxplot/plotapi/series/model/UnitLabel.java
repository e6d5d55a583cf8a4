package com.wxplot.plotapi.series.model;

public record UnitLabel(String unitType, String unitGroup) {
  public static final UnitLabel UNKNOWN = new UnitLabel(null, null);
  public static final UnitLabel EPOCH_SECONDS = new UnitLabel("unix_epoch", "group_time");
}
