package com.wxplot.plotapi.series.model;

import java.util.List;

/**
 * Index-aligned start, stop and value vectors. For aggregated series {@code bucketIndexes} holds
 * the position of each bucket in the generated interval sequence; it is empty for raw scans.
 */
public record SeriesResult(
    ValueTuple<Long> startTimes,
    ValueTuple<Long> stopTimes,
    ValueTuple<Double> data,
    List<Integer> bucketIndexes
) {
  public SeriesResult {
    if (startTimes.size() != data.size() || stopTimes.size() != data.size()) {
      throw new IllegalArgumentException("start, stop and data vectors must be index-aligned");
    }
    bucketIndexes = List.copyOf(bucketIndexes);
    if (!bucketIndexes.isEmpty() && bucketIndexes.size() != data.size()) {
      throw new IllegalArgumentException("bucket indexes must be aligned with the data vector");
    }
  }

  public SeriesResult(ValueTuple<Long> startTimes, ValueTuple<Long> stopTimes,
      ValueTuple<Double> data) {
    this(startTimes, stopTimes, data, List.of());
  }

  public boolean isEmpty() {
    return data.size() == 0;
  }

  public boolean isBucketed() {
    return !bucketIndexes.isEmpty();
  }
}
