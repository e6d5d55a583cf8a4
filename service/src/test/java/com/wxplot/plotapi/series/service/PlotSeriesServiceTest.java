package com.wxplot.plotapi.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.wxplot.plotapi.config.PlotProperties;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DenseSeries;
import com.wxplot.plotapi.series.model.TimeSpan;
import com.wxplot.plotapi.series.model.UnitSystem;
import com.wxplot.plotapi.series.repository.DataBindingRegistry;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlotSeriesServiceTest {

  private InMemoryObservationStore store;
  private PlotSeriesService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryObservationStore();
    service = serviceIn(ZoneOffset.UTC);
  }

  private PlotSeriesService serviceIn(ZoneId zone) {
    var properties = new PlotProperties(zone, Map.of("archive",
        new PlotProperties.Binding("archive", Set.of("outTemp", "rain"), ChronoUnit.SECONDS)));
    return new PlotSeriesService(new DataBindingRegistry(properties), store,
        new SeriesAggregator(new StandardUnitResolver(), properties));
  }

  private void fill(long start, long stop, long step) {
    for (long t = start + step; t <= stop; t += step) {
      store.add(t, 1.0, UnitSystem.US);
    }
  }

  @Test
  void densifiesAggregatedBucketsWithLeadingAndInnerGaps() {
    store.add(7500, 3.456, UnitSystem.US).add(19000, 7.001, UnitSystem.US);

    DenseSeries series = service.getSeries("archive", "outTemp", new TimeSpan(0, 21600),
        AggregationType.AVG, 3600L, true);

    assertEquals(Arrays.asList(null, null, 3.46, null, null, 7.0), series.values());
    assertEquals("degree_F", series.unit());
  }

  @Test
  void trailingEmptyBucketsAreOmitted() {
    store.add(600, 0.25, UnitSystem.METRICWX);

    DenseSeries series = service.getSeries("archive", "rain", new TimeSpan(0, 86400),
        AggregationType.SUM, 3600L, true);

    assertEquals(List.of(0.25), series.values());
    assertEquals("mm", series.unit());
  }

  @Test
  void rawRowsAreAlignedOnTheRequestedInterval() {
    store.add(300, 1.0, UnitSystem.US, 300).add(900, 3.0, UnitSystem.US, 300);

    DenseSeries series = service.getSeries("archive", "outTemp", new TimeSpan(0, 900),
        AggregationType.NONE, 300L, true);

    assertEquals(Arrays.asList(1.0, null, 3.0), series.values());
  }

  @Test
  void noDataGivesEmptyValuesAndNoUnit() {
    DenseSeries series = service.getSeries("archive", "outTemp", new TimeSpan(0, 3600),
        AggregationType.AVG, 600L, true);

    assertTrue(series.values().isEmpty());
    assertNull(series.unit());
  }

  @Test
  void unitSystemChangeFailsWithoutPartialResult() {
    store.add(100, 1.0, UnitSystem.US).add(4000, 2.0, UnitSystem.METRIC);

    assertThrows(UnitInconsistencyException.class, () -> service.getSeries("archive", "outTemp",
        new TimeSpan(0, 7200), AggregationType.AVG, 3600L, true));
  }

  @Test
  void missingIntervalIsAPreconditionFailure() {
    assertThrows(PreconditionException.class, () -> service.getSeries("archive", "outTemp",
        new TimeSpan(0, 7200), AggregationType.MAX, null, true));
    assertEquals(0, store.queries());
  }

  @Test
  void unknownBindingOrObservationIsNotFound() {
    assertThrows(NoSuchElementException.class, () -> service.getSeries("nope", "outTemp",
        new TimeSpan(0, 7200), AggregationType.AVG, 3600L, true));
    assertThrows(NoSuchElementException.class, () -> service.getSeries("archive", "usUnits",
        new TimeSpan(0, 7200), AggregationType.AVG, 3600L, true));
  }

  @Test
  void localBucketsAcrossFallBackKeepOneValuePerBucket() {
    ZoneId newYork = ZoneId.of("America/New_York");
    long start = LocalDate.of(2024, 11, 3).atStartOfDay(newYork).toEpochSecond();
    long stop = LocalDate.of(2024, 11, 4).atStartOfDay(newYork).toEpochSecond();
    fill(start, stop, 1800);

    DenseSeries series = serviceIn(newYork).getSeries("archive", "outTemp",
        new TimeSpan(start, stop), AggregationType.AVG, 10800L, false);

    assertEquals(List.of(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0), series.values());
  }

  @Test
  void calendarMonthsKeepOneValuePerMonth() {
    long start = LocalDate.of(2024, 1, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    long stop = LocalDate.of(2024, 7, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    fill(start, stop, 86400);

    DenseSeries series = service.getSeries("archive", "outTemp", new TimeSpan(start, stop),
        AggregationType.AVG, IntervalGenerator.NOMINAL_MONTH_SECONDS, false);

    assertEquals(6, series.values().size());
    assertFalse(series.values().contains(null));
  }

  @Test
  void emptyCalendarMonthIsNullAtItsOwnPosition() {
    long start = LocalDate.of(2024, 1, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    long march = LocalDate.of(2024, 3, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    long stop = LocalDate.of(2024, 5, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    store.add(start + 86400, 2.0, UnitSystem.US).add(march + 86400, 4.0, UnitSystem.US);

    DenseSeries series = service.getSeries("archive", "outTemp", new TimeSpan(start, stop),
        AggregationType.MAX, IntervalGenerator.NOMINAL_MONTH_SECONDS, false);

    assertEquals(Arrays.asList(2.0, null, 4.0), series.values());
  }
}
