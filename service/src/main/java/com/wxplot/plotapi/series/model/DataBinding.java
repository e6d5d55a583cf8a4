package com.wxplot.plotapi.series.model;

import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.regex.Pattern;

public record DataBinding(String name, String table, Set<String> observations,
    ChronoUnit recordIntervalUnit) {

  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  public DataBinding {
    requireIdentifier(table, "table");
    observations = Set.copyOf(observations);
    observations.forEach(column -> requireIdentifier(column, "observation"));
    if (recordIntervalUnit == null) {
      recordIntervalUnit = ChronoUnit.MINUTES;
    }
  }

  public boolean allows(String observationType) {
    return observations.contains(observationType);
  }

  public long recordIntervalSeconds(long recorded) {
    return recordIntervalUnit.getDuration().getSeconds() * recorded;
  }

  private static void requireIdentifier(String value, String what) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalArgumentException("Invalid " + what + " identifier: " + value);
    }
  }
}
