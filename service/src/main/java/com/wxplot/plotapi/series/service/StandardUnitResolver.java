package com.wxplot.plotapi.series.service;

import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.UnitLabel;
import com.wxplot.plotapi.series.model.UnitSystem;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

// Standard unit tables of the weather station archive
@Component
public class StandardUnitResolver implements UnitResolver {

  private static final String GROUP_TIME = "group_time";
  private static final String GROUP_COUNT = "group_count";

  private static final Map<String, String> OBSERVATION_GROUPS = new HashMap<>();
  private static final Map<UnitSystem, Map<String, String>> GROUP_UNITS =
      new EnumMap<>(UnitSystem.class);

  static {
    OBSERVATION_GROUPS.put("dateTime", GROUP_TIME);
    OBSERVATION_GROUPS.put("interval", "group_interval");
    for (String temperature : new String[] {"outTemp", "inTemp", "dewpoint", "inDewpoint",
        "windchill", "heatindex", "appTemp", "humidex", "heatingTemp", "extraTemp1", "extraTemp2",
        "extraTemp3", "soilTemp1", "soilTemp2", "soilTemp3", "soilTemp4", "leafTemp1",
        "leafTemp2"}) {
      OBSERVATION_GROUPS.put(temperature, "group_temperature");
    }
    for (String percent : new String[] {"outHumidity", "inHumidity", "extraHumid1",
        "extraHumid2", "rxCheckPercent"}) {
      OBSERVATION_GROUPS.put(percent, "group_percent");
    }
    for (String pressure : new String[] {"barometer", "pressure", "altimeter"}) {
      OBSERVATION_GROUPS.put(pressure, "group_pressure");
    }
    for (String speed : new String[] {"windSpeed", "windGust", "windSpeed10"}) {
      OBSERVATION_GROUPS.put(speed, "group_speed");
    }
    for (String direction : new String[] {"windDir", "windGustDir"}) {
      OBSERVATION_GROUPS.put(direction, "group_direction");
    }
    for (String volt : new String[] {"consBatteryVoltage", "heatingVoltage", "referenceVoltage",
        "supplyVoltage"}) {
      OBSERVATION_GROUPS.put(volt, "group_volt");
    }
    OBSERVATION_GROUPS.put("rain", "group_rain");
    OBSERVATION_GROUPS.put("ET", "group_rain");
    OBSERVATION_GROUPS.put("hail", "group_rain");
    OBSERVATION_GROUPS.put("rainRate", "group_rainrate");
    OBSERVATION_GROUPS.put("hailRate", "group_rainrate");
    OBSERVATION_GROUPS.put("radiation", "group_radiation");
    OBSERVATION_GROUPS.put("maxSolarRad", "group_radiation");
    OBSERVATION_GROUPS.put("UV", "group_uv");
    OBSERVATION_GROUPS.put("cloudbase", "group_altitude");
    OBSERVATION_GROUPS.put("windrun", "group_distance");
    OBSERVATION_GROUPS.put("soilMoist1", "group_moisture");
    OBSERVATION_GROUPS.put("soilMoist2", "group_moisture");

    Map<String, String> common = new HashMap<>();
    common.put(GROUP_TIME, "unix_epoch");
    common.put(GROUP_COUNT, "count");
    common.put("group_interval", "minute");
    common.put("group_percent", "percent");
    common.put("group_direction", "degree_compass");
    common.put("group_volt", "volt");
    common.put("group_radiation", "watt_per_meter_squared");
    common.put("group_uv", "uv_index");
    common.put("group_moisture", "centibar");

    Map<String, String> us = new HashMap<>(common);
    us.put("group_temperature", "degree_F");
    us.put("group_pressure", "inHg");
    us.put("group_speed", "mile_per_hour");
    us.put("group_rain", "inch");
    us.put("group_rainrate", "inch_per_hour");
    us.put("group_altitude", "foot");
    us.put("group_distance", "mile");

    Map<String, String> metric = new HashMap<>(common);
    metric.put("group_temperature", "degree_C");
    metric.put("group_pressure", "mbar");
    metric.put("group_speed", "km_per_hour");
    metric.put("group_rain", "cm");
    metric.put("group_rainrate", "cm_per_hour");
    metric.put("group_altitude", "meter");
    metric.put("group_distance", "km");

    Map<String, String> metricWx = new HashMap<>(metric);
    metricWx.put("group_speed", "meter_per_second");
    metricWx.put("group_rain", "mm");
    metricWx.put("group_rainrate", "mm_per_hour");

    GROUP_UNITS.put(UnitSystem.US, Map.copyOf(us));
    GROUP_UNITS.put(UnitSystem.METRIC, Map.copyOf(metric));
    GROUP_UNITS.put(UnitSystem.METRICWX, Map.copyOf(metricWx));
  }

  @Override
  public UnitLabel standardUnitFor(UnitSystem unitSystem, String observationType,
      AggregationType aggregationType) {
    if (unitSystem == null) {
      return UnitLabel.UNKNOWN;
    }
    String group = aggregationType == AggregationType.COUNT
        ? GROUP_COUNT
        : OBSERVATION_GROUPS.get(observationType);
    if (group == null) {
      return UnitLabel.UNKNOWN;
    }
    return new UnitLabel(GROUP_UNITS.get(unitSystem).get(group), group);
  }
}
