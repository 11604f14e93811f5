/*
 * Where: common utilities
 * What: Converts between Instant and JDBC Timestamp explicitly
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.monsoonfire.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are always UTC, so Timestamp.from keeps them in UTC regardless of the DB session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
