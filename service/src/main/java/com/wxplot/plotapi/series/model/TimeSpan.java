package com.wxplot.plotapi.series.model;

// Epoch seconds, UTC. When used as an aggregation bucket: (start, stop]
public record TimeSpan(long start, long stop) {
  public TimeSpan {
    if (start > stop) {
      throw new IllegalArgumentException("start must be before or equal to stop");
    }
  }

  public long length() {
    return stop - start;
  }

  public boolean isEmpty() {
    return start == stop;
  }
}
