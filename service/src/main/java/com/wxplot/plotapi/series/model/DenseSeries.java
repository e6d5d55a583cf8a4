package com.wxplot.plotapi.series.model;

import java.util.Collections;
import java.util.List;

public record DenseSeries(List<Double> values, String unit) {
  public DenseSeries {
    values = Collections.unmodifiableList(values);
  }
}
