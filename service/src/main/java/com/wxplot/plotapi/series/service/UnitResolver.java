package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.UnitLabel;
import com.wxplot.plotapi.series.model.UnitSystem;

public interface UnitResolver {
  UnitLabel standardUnitFor(UnitSystem unitSystem, String observationType,
      AggregationType aggregationType);
}
