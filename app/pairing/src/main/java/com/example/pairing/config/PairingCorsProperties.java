package com.example.pairing.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pairing.cors")
public record PairingCorsProperties(List<String> allowedOrigins) {

  public PairingCorsProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
  }
}
