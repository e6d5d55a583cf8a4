package com.wxplot.plotapi.series.model;

// One un-aggregated archive row; value is null when the column was not recorded
public record RawRecord(long timestamp, Double value, UnitSystem unitSystem,
    long recordedIntervalSeconds) {

  public long intervalStart() {
    return timestamp - recordedIntervalSeconds;
  }
}
