package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.UnitSystem;

public class UnitInconsistencyException extends RuntimeException {
  private final UnitSystem expected;
  private final UnitSystem found;

  public UnitInconsistencyException(UnitSystem expected, UnitSystem minFound, UnitSystem maxFound) {
    super("Unit type cannot change within a time interval (" + expected + " vs " + minFound
        + " vs " + maxFound + ")");
    this.expected = expected;
    this.found = minFound == expected ? maxFound : minFound;
  }

  public UnitSystem expected() {
    return expected;
  }

  public UnitSystem found() {
    return found;
  }
}
