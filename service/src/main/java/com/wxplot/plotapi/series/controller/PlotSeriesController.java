package com.wxplot.plotapi.series.controller;

import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.PlotSeriesResponse;
import com.wxplot.plotapi.series.model.TimeSpan;
import com.wxplot.plotapi.series.service.PlotSeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/plot")
@Validated
@Tag(name = "Plot")
public class PlotSeriesController {
  private static final String IDENTIFIER_REGEX = "^[A-Za-z_][A-Za-z0-9_]{0,63}$";
  // 2024-03-10, 2024-03-10T05:00, 2024-03-10T05:00:00.000Z, 2024-03-10T00:00-05:00
  private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .appendLiteral('T')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .optionalEnd()
      .toFormatter();

  private final PlotSeriesService svc;
  // Every aggregated bucket is one store query
  private final long maxBuckets;

  public PlotSeriesController(PlotSeriesService svc,
      @Value("${wxplot.max-buckets:100000}") long maxBuckets) {
    this.svc = svc;
    this.maxBuckets = maxBuckets;
  }

  @GetMapping("/{binding}/{observation}")
  @Operation(summary = "Get plot values",
      description = "Aggregate an observation over consecutive intervals starting at start. "
          + "Element i of values belongs to the i-th interval: [start + i*aggregateInterval, "
          + "start + (i+1)*aggregateInterval) in unix time, or the i-th local calendar "
          + "interval when unixTimeIntervals is false. Intervals without data are null and "
          + "trailing empty intervals are omitted.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dense value array",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = PlotSeriesResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Unknown binding or observation",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "500", description = "Unit system changed within the span",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "503", description = "Observation store unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public PlotSeriesResponse values(
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX)
      @Parameter(description = "Data binding", example = "archive") String binding,
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX)
      @Parameter(description = "Observation type", example = "outTemp") String observation,
      @RequestParam @Parameter(description = "Start of the span, ISO-8601 (UTC)",
          example = "2024-03-10T00:00:00Z") String start,
      @RequestParam @Parameter(description = "End of the span, ISO-8601 (UTC)",
          example = "2024-03-11T00:00:00Z") String end,
      @RequestParam(required = false) @Parameter(description = "Aggregation function",
          schema = @Schema(allowableValues = {"none", "sum", "avg", "min", "max", "count",
              "last"})) String aggregateType,
      @RequestParam(required = false) @Parameter(description = "Interval length in seconds",
          example = "3600") String aggregateInterval,
      @RequestParam(defaultValue = "true") @Parameter(description =
          "Fixed-length intervals in unix time instead of local calendar intervals")
      boolean unixTimeIntervals) {

    long startStamp = parseTimestamp("start", start, 2001);
    long endStamp = parseTimestamp("end", end, 2001);
    if (startStamp > endStamp) {
      throw invalidParameter("start",
          "Invalid time span. start must be before or equal to end.", 2002);
    }
    AggregationType type = parseAggregationType(aggregateType);
    Long interval = parseInterval(aggregateInterval);
    if (interval != null && bucketCount(startStamp, endStamp, interval) > maxBuckets) {
      throw invalidParameter("aggregateInterval", "Too many intervals in the requested span. "
          + "At most " + maxBuckets + " intervals are allowed; use a larger aggregateInterval.",
          2004);
    }

    return PlotSeriesResponse.from(svc.getSeries(binding, observation,
        new TimeSpan(startStamp, endStamp), type, interval, unixTimeIntervals));
  }

  static long parseTimestamp(String name, String value, int errorCode) {
    try {
      TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(value.trim(), OffsetDateTime::from,
          LocalDateTime::from, LocalDate::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return offsetDateTime.toEpochSecond();
      }
      if (parsed instanceof LocalDateTime localDateTime) {
        return localDateTime.toEpochSecond(ZoneOffset.UTC);
      }
      return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    } catch (DateTimeParseException ex) {
      throw invalidParameter(name,
          "Invalid " + name + " parameter. Expected an ISO-8601 date-time.", errorCode);
    }
  }

  private static AggregationType parseAggregationType(String value) {
    try {
      return AggregationType.parse(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("aggregateType",
          "Invalid aggregateType. Supported values: none,sum,avg,min,max,count,last.", 2003);
    }
  }

  private static Long parseInterval(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    long interval;
    try {
      interval = Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw invalidInterval();
    }
    if (interval <= 0) {
      throw invalidInterval();
    }
    return interval;
  }

  private static long bucketCount(long start, long end, long interval) {
    long span = end - start;
    return span / interval + (span % interval == 0 ? 0 : 1);
  }

  private static InvalidParameterException invalidInterval() {
    return invalidParameter("aggregateInterval",
        "Invalid aggregateInterval. Must be a positive whole number of seconds.", 2004);
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode);
  }
}
