package com.wxplot.plotapi.series.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a sparse series into one value per interval so that clients can rebuild the time axis
 * from the start time and the interval length alone.
 *
 * <p>Element {@code i} of the result belongs to the interval starting at
 * {@code start + i * intervalSeconds}. Intervals before the first point and between points are
 * filled with {@code null}. Nothing is emitted after the last point, so the result may be shorter
 * than the number of intervals in the requested span.
 *
 * <p>Calendar buckets do not have a constant length in seconds, so those are placed by their
 * position in the bucket sequence instead of by their start time.
 */
public final class GapFiller {
  private GapFiller() {
  }

  public static List<Double> densify(long start, long intervalSeconds, List<Long> intervalStarts,
      List<Double> values) {
    if (intervalSeconds <= 0) {
      throw new PreconditionException("Aggregation interval must be positive: " + intervalSeconds);
    }
    if (intervalStarts.size() != values.size()) {
      throw new IllegalArgumentException("interval starts and values must be index-aligned");
    }
    List<Double> out = new ArrayList<>(values.size());
    long t = start;
    for (int i = 0; i < values.size(); i++) {
      long intervalStart = intervalStarts.get(i);
      while (t < intervalStart) {
        out.add(null);
        t += intervalSeconds;
      }
      out.add(round(values.get(i)));
      t += intervalSeconds;
    }
    return out;
  }

  public static List<Double> densifyByPosition(List<Integer> positions, List<Double> values) {
    if (positions.size() != values.size()) {
      throw new IllegalArgumentException("positions and values must be index-aligned");
    }
    List<Double> out = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      int position = positions.get(i);
      if (position < out.size()) {
        throw new IllegalArgumentException("positions must be strictly increasing");
      }
      while (out.size() < position) {
        out.add(null);
      }
      out.add(round(values.get(i)));
    }
    return out;
  }

  static Double round(Double value) {
    if (value == null || value.isNaN() || value.isInfinite()) {
      return null;
    }
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
