package com.wxplot.plotapi.series.repository;

import com.wxplot.plotapi.series.model.AggregateValue;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.LastValue;
import com.wxplot.plotapi.series.model.RawRecord;
import java.util.List;
import java.util.Optional;

/**
 * Read access to an observation archive. Implementations throw
 * {@link ObservationStoreException} when the store itself fails; a bucket without data is an
 * empty result, not an error.
 */
public interface ObservationStore {

  /** Aggregate of the non-null {@code column} values with {@code start < dateTime <= stop}. */
  Optional<AggregateValue> queryAggregate(DataBinding binding, String column,
      AggregationType type, long startExclusive, long stopInclusive);

  /** Most recent non-null {@code column} value with {@code start < dateTime <= stop}. */
  Optional<LastValue> queryLast(DataBinding binding, String column, long startExclusive,
      long stopInclusive);

  /** Every row with {@code start <= dateTime <= stop}, oldest first. */
  List<RawRecord> scanRaw(DataBinding binding, String column, long startInclusive,
      long stopInclusive);
}
