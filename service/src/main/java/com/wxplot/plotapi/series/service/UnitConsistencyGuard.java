package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.UnitSystem;
import java.util.Objects;
import java.util.Optional;

/**
 * Remembers the unit system of the first row of a series and rejects any later row reported in
 * another one. One instance per request.
 */
public class UnitConsistencyGuard {
  private UnitSystem observed;

  public void observe(UnitSystem unitSystem) {
    observe(unitSystem, unitSystem);
  }

  public void observe(UnitSystem min, UnitSystem max) {
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    UnitSystem expected = observed != null ? observed : min;
    if (min != max || min != expected) {
      throw new UnitInconsistencyException(expected, min, max);
    }
    observed = expected;
  }

  public Optional<UnitSystem> observed() {
    return Optional.ofNullable(observed);
  }
}
