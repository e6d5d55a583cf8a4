package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.AggregateValue;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.RawRecord;
import com.wxplot.plotapi.series.model.TimeSpan;
import com.wxplot.plotapi.series.repository.ObservationStore;
import java.util.List;
import java.util.Optional;

// One store query per bucket, or one scan for raw rows
class AggregationQueryExecutor {
  private final ObservationStore store;
  private final DataBinding binding;
  private final String observationType;

  AggregationQueryExecutor(ObservationStore store, DataBinding binding, String observationType) {
    this.store = store;
    this.binding = binding;
    this.observationType = observationType;
  }

  Optional<AggregateValue> evaluate(TimeSpan bucket, AggregationType type) {
    return switch (type) {
      case LAST -> store.queryLast(binding, observationType, bucket.start(), bucket.stop())
          .map(last -> new AggregateValue(last.value(), last.unitSystem(), last.unitSystem()));
      case SUM, AVG, MIN, MAX, COUNT ->
          store.queryAggregate(binding, observationType, type, bucket.start(), bucket.stop());
      case NONE -> throw new IllegalArgumentException(
          "Raw rows are read with scan(), not per bucket");
    };
  }

  List<RawRecord> scan(TimeSpan span) {
    return store.scanRaw(binding, observationType, span.start(), span.stop());
  }
}
