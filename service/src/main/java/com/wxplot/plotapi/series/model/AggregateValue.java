package com.wxplot.plotapi.series.model;

public record AggregateValue(double value, UnitSystem minUnitSystem, UnitSystem maxUnitSystem) {}
