package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class JdbcTimestampUtilsTest {

  @Test
  void toTimestampKeepsNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
  }

  @Test
  void readInstantConvertsStoredTimestamp() throws SQLException {
    final Instant stored = Instant.parse("2026-02-24T12:00:00Z");
    final ResultSet rs = Mockito.mock(ResultSet.class);
    when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(stored));
    when(rs.getTimestamp("updated_at")).thenReturn(null);

    assertThat(JdbcTimestampUtils.readInstant(rs, "created_at")).isEqualTo(stored);
    assertThat(JdbcTimestampUtils.readInstant(rs, "updated_at")).isNull();
  }
}
