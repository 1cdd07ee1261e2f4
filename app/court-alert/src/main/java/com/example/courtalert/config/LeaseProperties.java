/*
 * Where: Court alert configuration binding
 * What: Selects how an instance claims the right to run a cycle
 * Why: Several replicas polling the same sources would dispatch the same digests twice
 */
package com.example.courtalert.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "court-alert.engine.lease")
public record LeaseProperties(String mode, String name, Duration ttl) {

  public static final String MODE_LOCAL = "local";
  public static final String MODE_JDBC = "jdbc";

  public LeaseProperties {
    mode = mode == null || mode.isBlank() ? MODE_LOCAL : mode;
    name = name == null || name.isBlank() ? "court-alert-engine" : name;
    ttl = ttl == null ? Duration.ofMinutes(5) : ttl;
  }
}
