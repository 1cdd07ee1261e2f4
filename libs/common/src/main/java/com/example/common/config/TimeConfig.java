/*
 * Where: Shared configuration
 * What: Exposes the Clock used for every time read
 * Why: Tests replace it with a fixed clock, production uses UTC
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
