package com.example.pairing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 疎通確認の間隔（{@code pairing.storage.probe-interval}）は {@code @Scheduled} が直接読む。 */
@ConfigurationProperties(prefix = "pairing.storage")
public record StorageProbeProperties(Duration initialBackoff, Duration maxBackoff) {

  public StorageProbeProperties {
    initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
    maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
  }
}
