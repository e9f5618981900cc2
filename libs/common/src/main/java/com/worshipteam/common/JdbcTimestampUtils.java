/*
 * Where: common utilities
 * What: Converts between Instant and java.sql.Timestamp at the JDBC boundary
 * Why: The PostgreSQL driver cannot always infer a SQL type for a bare Instant
 */
package com.worshipteam.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
