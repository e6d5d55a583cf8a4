package com.wxplot.plotapi.series.model;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

public record PlotSeriesResponse(
    @ArraySchema(schema = @Schema(type = "number", nullable = true,
        description = "Aggregated value of one interval, null when the interval has no data"))
    List<Double> values,
    @Schema(description = "Unit of the values", example = "degree_F", nullable = true)
    String unit
) {
  public static PlotSeriesResponse from(DenseSeries series) {
    return new PlotSeriesResponse(series.values(), series.unit());
  }
}
