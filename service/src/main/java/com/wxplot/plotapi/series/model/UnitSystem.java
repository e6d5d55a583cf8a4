package com.wxplot.plotapi.series.model;

// Codes stored in the archive's usUnits column
public enum UnitSystem {
  US(0x01),
  METRIC(0x10),
  METRICWX(0x11);

  private final int code;

  UnitSystem(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static UnitSystem fromCode(int code) {
    for (UnitSystem system : values()) {
      if (system.code == code) {
        return system;
      }
    }
    throw new IllegalStateException("Unknown unit system code 0x" + Integer.toHexString(code));
  }
}
