package com.wxplot.plotapi.config;

import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "wxplot")
public record PlotProperties(ZoneId timeZone, Map<String, Binding> bindings) {

  public PlotProperties {
    if (timeZone == null) {
      timeZone = ZoneId.systemDefault();
    }
    bindings = bindings == null ? Map.of() : Map.copyOf(bindings);
  }

  /**
   * @param table archive table holding one row per archive period
   * @param observations columns clients may request
   * @param recordIntervalUnit unit of the table's {@code interval} column
   */
  public record Binding(String table, Set<String> observations, ChronoUnit recordIntervalUnit) {
    public Binding {
      observations = observations == null ? Set.of() : observations;
    }
  }
}
