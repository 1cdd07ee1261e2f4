package com.example.courtalert.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "court-alert.dispatch")
public record DispatchProperties(String mode, String from, String fromName, String subjectPrefix) {

  public static final String MODE_LOCAL = "local";
  public static final String MODE_MAIL = "mail";

  public DispatchProperties {
    mode = mode == null || mode.isBlank() ? MODE_LOCAL : mode;
    subjectPrefix = subjectPrefix == null ? "Court alert" : subjectPrefix;
  }
}
