package com.wxplot.plotapi.series.model;

public record LastValue(double value, UnitSystem unitSystem) {}
