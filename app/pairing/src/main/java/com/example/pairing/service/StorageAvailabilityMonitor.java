package com.example.pairing.service;

import com.example.pairing.config.StorageProbeProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 役割: 定期的に {@code SELECT 1} を投げ、DB への疎通可否を {@link StorageGate} として公開する。
 * 動作: 失敗が続く間は initialBackoff から 2 倍ずつ maxBackoff まで間隔を空け、成功で即座にリセットする。
 * 前提: 接続の張り直し自体はコネクションプールが行う。ここはゲートを開け直すだけ。
 */
@Component
public class StorageAvailabilityMonitor implements StorageGate {

  private static final Logger logger = LoggerFactory.getLogger(StorageAvailabilityMonitor.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JdbcTemplate は Spring 管理の共有コンポーネントのため")
  private final JdbcTemplate jdbcTemplate;

  private final StorageProbeProperties properties;
  private final PairingMetrics metrics;
  private final Clock clock;
  private final AtomicBoolean available = new AtomicBoolean(true);
  private int consecutiveFailures;
  private Instant nextProbeAt = Instant.EPOCH;

  public StorageAvailabilityMonitor(
      JdbcTemplate jdbcTemplate,
      StorageProbeProperties properties,
      PairingMetrics metrics,
      Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public boolean isAvailable() {
    return available.get();
  }

  @Scheduled(fixedDelayString = "${pairing.storage.probe-interval:1s}")
  public synchronized void probe() {
    final Instant now = Instant.now(clock);
    if (now.isBefore(nextProbeAt)) {
      return;
    }
    try {
      jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      if (!available.getAndSet(true)) {
        logger.info("storage reachable again after {} failed probes", consecutiveFailures);
      }
      consecutiveFailures = 0;
      nextProbeAt = now;
    } catch (RuntimeException ex) {
      consecutiveFailures++;
      final Duration backoff = backoffFor(consecutiveFailures);
      nextProbeAt = now.plus(backoff);
      if (available.getAndSet(false)) {
        logger.warn("storage probe failed, closing gate", ex);
      } else {
        logger.warn(
            "storage probe failed failures={} nextProbeIn={}", consecutiveFailures, backoff);
      }
      metrics.recordDependencyError("storage_probe");
    }
  }

  Duration backoffFor(int failures) {
    final Duration max = properties.maxBackoff();
    Duration backoff = properties.initialBackoff();
    for (int i = 1; i < failures; i++) {
      backoff = backoff.multipliedBy(2);
      if (backoff.compareTo(max) >= 0) {
        return max;
      }
    }
    return backoff.compareTo(max) > 0 ? max : backoff;
  }
}
