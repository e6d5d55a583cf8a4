package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.config.PlotProperties;
import com.wxplot.plotapi.series.model.AggregateValue;
import com.wxplot.plotapi.series.model.AggregationSpec;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.RawRecord;
import com.wxplot.plotapi.series.model.SeriesResult;
import com.wxplot.plotapi.series.model.TimeSpan;
import com.wxplot.plotapi.series.model.UnitLabel;
import com.wxplot.plotapi.series.model.ValueTuple;
import com.wxplot.plotapi.series.repository.ObservationStore;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads an observation column over a time span as three index-aligned vectors: bucket start
 * times, bucket stop times and values.
 *
 * <p>With an aggregation type every bucket is left-exclusive and right-inclusive, and buckets
 * without data are left out; the position of each remaining bucket in the generated sequence is
 * kept alongside. Without one, every archive row is returned as is, its start time
 * derived from the recorded archive interval. Either way the unit system must not change within
 * the span.
 */
@Component
public class SeriesAggregator {
  private static final Logger log = LoggerFactory.getLogger(SeriesAggregator.class);

  private final UnitResolver unitResolver;
  private final ZoneId zone;

  public SeriesAggregator(UnitResolver unitResolver, PlotProperties properties) {
    this.unitResolver = unitResolver;
    this.zone = properties.timeZone();
  }

  public SeriesResult aggregate(ObservationStore store, DataBinding binding,
      String observationType, TimeSpan span, AggregationSpec spec) {
    AggregationQueryExecutor executor =
        new AggregationQueryExecutor(store, binding, observationType);
    UnitConsistencyGuard guard = new UnitConsistencyGuard();
    List<Long> starts = new ArrayList<>();
    List<Long> stops = new ArrayList<>();
    List<Double> data = new ArrayList<>();
    List<Integer> bucketIndexes = new ArrayList<>();

    if (spec.type().isAggregate()) {
      int buckets = 0;
      for (TimeSpan bucket : IntervalGenerator.generate(span, spec.intervalSeconds(),
          spec.unixTimeIntervals(), zone)) {
        int index = buckets++;
        Optional<AggregateValue> result = executor.evaluate(bucket, spec.type());
        if (result.isEmpty()) {
          continue;
        }
        AggregateValue value = result.get();
        guard.observe(value.minUnitSystem(), value.maxUnitSystem());
        bucketIndexes.add(index);
        starts.add(bucket.start());
        stops.add(bucket.stop());
        data.add(value.value());
      }
      log.debug("Aggregated {} of {} in binding {}: {} bucket(s), {} with data",
          spec.type(), observationType, binding.name(), buckets, data.size());
    } else {
      for (RawRecord record : executor.scan(span)) {
        guard.observe(record.unitSystem());
        starts.add(record.intervalStart());
        stops.add(record.timestamp());
        data.add(record.value());
      }
      log.debug("Read {} raw row(s) of {} in binding {}", data.size(), observationType,
          binding.name());
    }

    UnitLabel dataUnit = guard.observed()
        .map(system -> unitResolver.standardUnitFor(system, observationType, spec.type()))
        .orElse(UnitLabel.UNKNOWN);
    UnitLabel timeUnit = guard.observed().isPresent()
        ? UnitLabel.EPOCH_SECONDS
        : UnitLabel.UNKNOWN;
    return new SeriesResult(
        new ValueTuple<>(starts, timeUnit),
        new ValueTuple<>(stops, timeUnit),
        new ValueTuple<>(data, dataUnit),
        bucketIndexes);
  }
}
