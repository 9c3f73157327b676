package com.example.pairing.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class PairingMetrics {

  private final MeterRegistry meterRegistry;
  private final Counter claimConflictCounter;
  private final AtomicLong unmatched = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> registrationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> selfHealCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public PairingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.claimConflictCounter =
        Counter.builder("pairing.claim.conflict.total")
            .description("Pair claims lost to a concurrent registration")
            .register(meterRegistry);
    Gauge.builder("pairing.registrants.unmatched", unmatched, AtomicLong::get)
        .description("Registrants waiting for a partner")
        .register(meterRegistry);
  }

  /** result: matched / pending / existing */
  public void recordRegistration(String result) {
    registrationCounters
        .computeIfAbsent(result, r -> counter("pairing.registration.total", "result", r))
        .increment();
  }

  public void recordClaimConflict() {
    claimConflictCounter.increment();
  }

  /** source: read / reconcile */
  public void recordSelfHeal(String source) {
    selfHealCounters
        .computeIfAbsent(source, s -> counter("pairing.self_heal.total", "source", s))
        .increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, t -> counter("pairing.dependency.error.total", "type", t))
        .increment();
  }

  public void updateUnmatched(long count) {
    unmatched.set(Math.max(0, count));
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
