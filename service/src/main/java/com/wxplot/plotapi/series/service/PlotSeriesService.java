package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.AggregationSpec;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.DenseSeries;
import com.wxplot.plotapi.series.model.SeriesResult;
import com.wxplot.plotapi.series.model.TimeSpan;
import com.wxplot.plotapi.series.repository.DataBindingRegistry;
import com.wxplot.plotapi.series.repository.ObservationStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PlotSeriesService {
  private static final Logger log = LoggerFactory.getLogger(PlotSeriesService.class);

  private final DataBindingRegistry bindings;
  private final ObservationStore store;
  private final SeriesAggregator aggregator;

  public PlotSeriesService(DataBindingRegistry bindings, ObservationStore store,
      SeriesAggregator aggregator) {
    this.bindings = bindings;
    this.store = store;
    this.aggregator = aggregator;
  }

  // One read-only transaction keeps a single connection for every bucket query of the request.
  @Transactional(readOnly = true)
  public DenseSeries getSeries(String bindingName, String observationType, TimeSpan span,
      AggregationType aggregationType, Long aggregateInterval, boolean unixTimeIntervals) {
    DataBinding binding = bindings.observation(bindingName, observationType);
    if (aggregateInterval == null) {
      throw new PreconditionException("Aggregation interval missing");
    }
    AggregationSpec spec = new AggregationSpec(aggregationType, aggregateInterval,
        unixTimeIntervals);

    SeriesResult result = aggregator.aggregate(store, binding, observationType, span, spec);
    List<Double> values = result.isBucketed()
        ? GapFiller.densifyByPosition(result.bucketIndexes(), result.data().values())
        : GapFiller.densify(span.start(), aggregateInterval, result.startTimes().values(),
            result.data().values());
    DenseSeries series = new DenseSeries(values, result.data().unitType());

    log.debug("Series {}/{} [{}, {}] {} every {}s: {} value(s), unit {}", bindingName,
        observationType, span.start(), span.stop(), spec.type(), aggregateInterval,
        series.values().size(), series.unit());
    return series;
  }
}
