package com.wxplot.plotapi.series.model;

import com.wxplot.plotapi.series.service.PreconditionException;

public record AggregationSpec(AggregationType type, Long intervalSeconds, boolean unixTimeIntervals) {
  public AggregationSpec {
    if (type == null) {
      type = AggregationType.NONE;
    }
    if (intervalSeconds != null && intervalSeconds <= 0) {
      throw new PreconditionException("Aggregation interval must be positive: " + intervalSeconds);
    }
    if (type.isAggregate() && intervalSeconds == null) {
      throw new PreconditionException("Aggregation interval missing");
    }
  }
}
