package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.TimeSpan;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.temporal.TemporalAmount;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Splits a time span into the buckets an aggregation runs over.
 *
 * <p>Both modes return an {@link Iterable} whose iterators recompute the buckets from the
 * arguments, so the same sequence can be walked any number of times.
 */
public final class IntervalGenerator {

  // 365.25 / 12 days; treated as "one calendar month" in local mode
  static final long NOMINAL_MONTH_SECONDS = 2_629_800L;

  private IntervalGenerator() {
  }

  public static Iterable<TimeSpan> generate(TimeSpan span, long intervalSeconds,
      boolean unixTimeIntervals, ZoneId zone) {
    requirePositive(intervalSeconds);
    if (span.isEmpty()) {
      return List.of();
    }
    return unixTimeIntervals
        ? unixIntervals(span, intervalSeconds)
        : localIntervals(span, intervalSeconds, zone);
  }

  /**
   * Back-to-back buckets of constant length starting at {@code span.start()}. The final bucket
   * may extend past {@code span.stop()}.
   */
  public static Iterable<TimeSpan> unixIntervals(TimeSpan span, long intervalSeconds) {
    requirePositive(intervalSeconds);
    return () -> Stream.iterate(span.start(), t -> t < span.stop(), t -> t + intervalSeconds)
        .map(t -> new TimeSpan(t, t + intervalSeconds))
        .iterator();
  }

  /**
   * Buckets of constant wall-clock length in {@code zone}. Their length in elapsed seconds
   * changes across daylight saving transitions: a 3 hour bucket spanning a spring-forward
   * transition covers 2 real hours. The final bucket is clipped to {@code span.stop()}.
   */
  public static Iterable<TimeSpan> localIntervals(TimeSpan span, long intervalSeconds,
      ZoneId zone) {
    requirePositive(intervalSeconds);
    TemporalAmount step = intervalSeconds == NOMINAL_MONTH_SECONDS
        ? Period.ofMonths(1)
        : Duration.ofSeconds(intervalSeconds);
    return () -> new LocalIntervalIterator(span, step, zone);
  }

  private static void requirePositive(long intervalSeconds) {
    if (intervalSeconds <= 0) {
      throw new PreconditionException("Aggregation interval must be positive: " + intervalSeconds);
    }
  }

  private static final class LocalIntervalIterator implements Iterator<TimeSpan> {
    private final ZoneId zone;
    private final TemporalAmount step;
    private final LocalDateTime stop;
    private LocalDateTime cursor;
    private long lastStart = Long.MIN_VALUE;
    private TimeSpan next;

    LocalIntervalIterator(TimeSpan span, TemporalAmount step, ZoneId zone) {
      this.zone = zone;
      this.step = step;
      this.cursor = toLocal(span.start());
      this.stop = toLocal(span.stop());
      this.next = advance();
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public TimeSpan next() {
      if (next == null) {
        throw new NoSuchElementException();
      }
      TimeSpan current = next;
      next = advance();
      return current;
    }

    private TimeSpan advance() {
      while (cursor.isBefore(stop)) {
        LocalDateTime end = cursor.plus(step);
        if (end.isAfter(stop)) {
          end = stop;
        }
        long startStamp = toEpoch(cursor);
        long stopStamp = toEpoch(end);
        cursor = end;
        // wall-clock buckets can collapse or run backwards around a fall-back transition
        if (stopStamp > startStamp && startStamp > lastStart) {
          lastStart = startStamp;
          return new TimeSpan(startStamp, stopStamp);
        }
      }
      return null;
    }

    private LocalDateTime toLocal(long epochSecond) {
      return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSecond), zone);
    }

    private long toEpoch(LocalDateTime local) {
      return local.atZone(zone).toEpochSecond();
    }
  }
}
