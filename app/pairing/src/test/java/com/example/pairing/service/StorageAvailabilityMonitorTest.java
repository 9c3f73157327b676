package com.example.pairing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.pairing.config.StorageProbeProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

class StorageAvailabilityMonitorTest {

  private final JdbcTemplate jdbcTemplate = Mockito.mock(JdbcTemplate.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
  private StorageAvailabilityMonitor monitor;

  @BeforeEach
  void setUp() {
    monitor =
        new StorageAvailabilityMonitor(
            jdbcTemplate,
            new StorageProbeProperties(Duration.ofSeconds(1), Duration.ofSeconds(8)),
            new PairingMetrics(registry),
            clock);
  }

  @Test
  void gateStartsOpen() {
    assertThat(monitor.isAvailable()).isTrue();
  }

  @Test
  void failedProbeClosesGateAndSuccessReopensIt() {
    doThrow(new CannotGetJdbcConnectionException("refused"))
        .when(jdbcTemplate)
        .queryForObject("SELECT 1", Integer.class);

    monitor.probe();

    assertThat(monitor.isAvailable()).isFalse();
    assertThat(
            registry
                .get("pairing.dependency.error.total")
                .tag("type", "storage_probe")
                .counter()
                .count())
        .isEqualTo(1.0);

    doReturn(1).when(jdbcTemplate).queryForObject("SELECT 1", Integer.class);
    clock.advance(Duration.ofSeconds(1));
    monitor.probe();

    assertThat(monitor.isAvailable()).isTrue();
  }

  @Test
  void probesAreSkippedDuringBackoff() {
    doThrow(new CannotGetJdbcConnectionException("refused"))
        .when(jdbcTemplate)
        .queryForObject("SELECT 1", Integer.class);

    monitor.probe();
    clock.advance(Duration.ofSeconds(1));
    monitor.probe();
    // 2 回目の失敗で次回は 2 秒後
    clock.advance(Duration.ofSeconds(1));
    monitor.probe();

    verify(jdbcTemplate, times(2)).queryForObject("SELECT 1", Integer.class);
  }

  @Test
  void backoffDoublesUntilCapped() {
    assertThat(monitor.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(monitor.backoffFor(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(monitor.backoffFor(4)).isEqualTo(Duration.ofSeconds(8));
    assertThat(monitor.backoffFor(10)).isEqualTo(Duration.ofSeconds(8));
    assertThat(monitor.backoffFor(200)).isEqualTo(Duration.ofSeconds(8));
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
