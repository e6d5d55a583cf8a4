package com.wxplot.plotapi.series.repository;

import com.wxplot.plotapi.series.model.AggregateValue;
import com.wxplot.plotapi.series.model.AggregationType;
import com.wxplot.plotapi.series.model.DataBinding;
import com.wxplot.plotapi.series.model.LastValue;
import com.wxplot.plotapi.series.model.RawRecord;
import com.wxplot.plotapi.series.model.UnitSystem;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcObservationStore implements ObservationStore {

  // Identifiers are filled in from the binding whitelist only; all values are bound parameters.
  private static final String AGGREGATE_SQL = """
      SELECT %1$s("%3$s"), MIN("usUnits"), MAX("usUnits")
      FROM "%2$s"
      WHERE "dateTime" > ? AND "dateTime" <= ? AND "%3$s" IS NOT NULL
      """;

  private static final String LAST_SQL = """
      SELECT "%2$s", "usUnits"
      FROM "%1$s"
      WHERE "dateTime" > ? AND "dateTime" <= ? AND "%2$s" IS NOT NULL
      ORDER BY "dateTime" DESC
      LIMIT 1
      """;

  private static final String RAW_SQL = """
      SELECT "dateTime", "%2$s", "usUnits", "interval"
      FROM "%1$s"
      WHERE "dateTime" >= ? AND "dateTime" <= ?
      ORDER BY "dateTime"
      """;

  private final JdbcTemplate jdbc;

  public JdbcObservationStore(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Optional<AggregateValue> queryAggregate(DataBinding binding, String column,
      AggregationType type, long startExclusive, long stopInclusive) {
    String sql = AGGREGATE_SQL.formatted(sqlFunction(type), binding.table(),
        checked(binding, column));
    List<AggregateValue> rows = run(binding, column, () -> jdbc.query(sql,
        (rs, i) -> toAggregate(rs), startExclusive, stopInclusive));
    return rows.stream().filter(Objects::nonNull).findFirst();
  }

  @Override
  public Optional<LastValue> queryLast(DataBinding binding, String column, long startExclusive,
      long stopInclusive) {
    String sql = LAST_SQL.formatted(binding.table(), checked(binding, column));
    List<LastValue> rows = run(binding, column, () -> jdbc.query(sql,
        (rs, i) -> new LastValue(rs.getDouble(1), unitSystem(rs, 2)),
        startExclusive, stopInclusive));
    return rows.stream().findFirst();
  }

  @Override
  public List<RawRecord> scanRaw(DataBinding binding, String column, long startInclusive,
      long stopInclusive) {
    String sql = RAW_SQL.formatted(binding.table(), checked(binding, column));
    return run(binding, column, () -> jdbc.query(sql,
        (rs, i) -> new RawRecord(
            rs.getLong(1),
            nullableDouble(rs, 2),
            unitSystem(rs, 3),
            binding.recordIntervalSeconds(rs.getLong(4))),
        startInclusive, stopInclusive));
  }

  private static String sqlFunction(AggregationType type) {
    return switch (type) {
      case SUM -> "SUM";
      case AVG -> "AVG";
      case MIN -> "MIN";
      case MAX -> "MAX";
      case COUNT -> "COUNT";
      case NONE, LAST -> throw new IllegalArgumentException(
          "No aggregate function for aggregation type " + type);
    };
  }

  private static String checked(DataBinding binding, String column) {
    if (!binding.allows(column)) {
      throw new IllegalArgumentException(
          "Observation " + column + " is not available in binding " + binding.name());
    }
    return column;
  }

  // MIN(usUnits) is NULL exactly when no row contributed to the aggregate
  private static AggregateValue toAggregate(ResultSet rs) throws SQLException {
    Double value = nullableDouble(rs, 1);
    int minUnits = rs.getInt(2);
    if (rs.wasNull() || value == null) {
      return null;
    }
    return new AggregateValue(value, UnitSystem.fromCode(minUnits), unitSystem(rs, 3));
  }

  private static UnitSystem unitSystem(ResultSet rs, int column) throws SQLException {
    return UnitSystem.fromCode(rs.getInt(column));
  }

  private static Double nullableDouble(ResultSet rs, int column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static <T> T run(DataBinding binding, String column, StoreCall<T> call) {
    try {
      return call.execute();
    } catch (DataAccessException ex) {
      throw new ObservationStoreException("Query for " + column + " in binding "
          + binding.name() + " failed", ex);
    }
  }

  @FunctionalInterface
  private interface StoreCall<T> {
    T execute();
  }
}
