package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.AggregateValue;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.LastValue;
import com.wxplot.plotapi.series.model.RawRecord;
import com.wxplot.plotapi.series.model.UnitSystem;
import com.wxplot.plotapi.series.repository.ObservationStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

// Single-column archive; record intervals are kept in seconds
class InMemoryObservationStore implements ObservationStore {
  private final List<RawRecord> rows = new ArrayList<>();
  private int queries;

  InMemoryObservationStore add(long timestamp, Double value, UnitSystem unitSystem,
      long intervalSeconds) {
    rows.add(new RawRecord(timestamp, value, unitSystem, intervalSeconds));
    rows.sort(Comparator.comparingLong(RawRecord::timestamp));
    return this;
  }

  InMemoryObservationStore add(long timestamp, double value, UnitSystem unitSystem) {
    return add(timestamp, value, unitSystem, 300);
  }

  int queries() {
    return queries;
  }

  @Override
  public Optional<AggregateValue> queryAggregate(DataBinding binding, String column,
      AggregationType type, long startExclusive, long stopInclusive) {
    queries++;
    List<RawRecord> bucket = bucket(startExclusive, stopInclusive);
    if (bucket.isEmpty()) {
      return Optional.empty();
    }
    var stats = bucket.stream().mapToDouble(RawRecord::value).summaryStatistics();
    double value = switch (type) {
      case SUM -> stats.getSum();
      case AVG -> stats.getAverage();
      case MIN -> stats.getMin();
      case MAX -> stats.getMax();
      case COUNT -> stats.getCount();
      case NONE, LAST -> throw new IllegalArgumentException(type.name());
    };
    Comparator<UnitSystem> byCode = Comparator.comparingInt(UnitSystem::code);
    List<UnitSystem> systems = bucket.stream().map(RawRecord::unitSystem).sorted(byCode).toList();
    return Optional.of(new AggregateValue(value, systems.get(0), systems.get(systems.size() - 1)));
  }

  @Override
  public Optional<LastValue> queryLast(DataBinding binding, String column, long startExclusive,
      long stopInclusive) {
    queries++;
    List<RawRecord> bucket = bucket(startExclusive, stopInclusive);
    if (bucket.isEmpty()) {
      return Optional.empty();
    }
    RawRecord last = bucket.get(bucket.size() - 1);
    return Optional.of(new LastValue(last.value(), last.unitSystem()));
  }

  @Override
  public List<RawRecord> scanRaw(DataBinding binding, String column, long startInclusive,
      long stopInclusive) {
    queries++;
    return rows.stream()
        .filter(r -> r.timestamp() >= startInclusive && r.timestamp() <= stopInclusive)
        .collect(Collectors.toList());
  }

  private List<RawRecord> bucket(long startExclusive, long stopInclusive) {
    return rows.stream()
        .filter(r -> r.timestamp() > startExclusive && r.timestamp() <= stopInclusive)
        .filter(r -> r.value() != null)
        .collect(Collectors.toList());
  }
}
