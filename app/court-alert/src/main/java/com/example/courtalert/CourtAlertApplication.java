/*
 * Where: Court alert application entry point
 * What: Boots Spring, binds configuration records and enables the scheduled worker
 */
package com.example.courtalert;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class CourtAlertApplication {

  public static void main(String[] args) {
    SpringApplication.run(CourtAlertApplication.class, args);
  }
}
