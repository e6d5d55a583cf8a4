package com.wxplot.plotapi.series.model;

import java.util.Collections;
import java.util.List;

public record ValueTuple<T extends Number>(List<T> values, String unitType, String unitGroup) {
  public ValueTuple {
    values = Collections.unmodifiableList(values);
  }

  public ValueTuple(List<T> values, UnitLabel label) {
    this(values, label.unitType(), label.unitGroup());
  }

  public int size() {
    return values.size();
  }
}
