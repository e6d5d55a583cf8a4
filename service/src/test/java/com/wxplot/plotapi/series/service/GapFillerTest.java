package com.wxplot.plotapi.series.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GapFillerTest {

  @Test
  void fillsLeadingAndInnerGapsWithNull() {
    var out = GapFiller.densify(0, 3600, List.of(7200L, 18000L), List.of(3.456, 7.001));

    assertEquals(Arrays.asList(null, null, 3.46, null, null, 7.0), out);
  }

  @Test
  void doesNotPadTrailingIntervals() {
    var out = GapFiller.densify(0, 60, List.of(0L, 60L), List.of(1d, 2d));

    assertEquals(List.of(1d, 2d), out);
    assertNotNull(out.get(out.size() - 1));
  }

  @Test
  void denseInputIsOnlyRounded() {
    var out = GapFiller.densify(100, 10, List.of(100L, 110L, 120L), List.of(1.234, 5.678, 9d));

    assertEquals(List.of(1.23, 5.68, 9d), out);
    assertEquals(out, GapFiller.densify(100, 10, List.of(100L, 110L, 120L), out));
  }

  @Test
  void lengthIsBoundedByLastIntervalStart() {
    long start = 1000;
    long interval = 300;
    long last = 1000 + 7 * 300;

    var out = GapFiller.densify(start, interval, List.of(1300L, last), List.of(1d, 2d));

    assertTrue(out.size() <= Math.ceil((double) (last - start) / interval) + 1);
    assertEquals(8, out.size());
    assertEquals(2d, out.get(7));
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertTrue(GapFiller.densify(0, 60, List.of(), List.of()).isEmpty());
  }

  @Test
  void missingRawValuesStayNull() {
    var out = GapFiller.densify(0, 300, List.of(0L, 300L), Arrays.asList(null, 4.5));

    assertEquals(Arrays.asList(null, 4.5), out);
  }

  @Test
  void roundsHalfAwayFromZero() {
    assertEquals(2.35, GapFiller.round(2.345));
    assertEquals(-2.35, GapFiller.round(-2.345));
    assertNull(GapFiller.round(Double.NaN));
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(PreconditionException.class,
        () -> GapFiller.densify(0, 0, List.of(0L), List.of(1d)));
  }

  @Test
  void positionalDensifyFillsMissingBucketsOnly() {
    var out = GapFiller.densifyByPosition(List.of(2, 3, 5), List.of(1.005, 2d, 3d));

    assertEquals(Arrays.asList(null, null, 1.01, 2d, null, 3d), out);
  }

  @Test
  void positionalDensifyRejectsOutOfOrderPositions() {
    assertThrows(IllegalArgumentException.class,
        () -> GapFiller.densifyByPosition(List.of(1, 1), List.of(1d, 2d)));
  }
}
