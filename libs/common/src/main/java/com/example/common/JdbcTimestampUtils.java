/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp を相互変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを避け、NULL 列も安全に読むため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp へ渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant readInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }
}
