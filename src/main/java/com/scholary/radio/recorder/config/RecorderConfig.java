package com.scholary.radio.recorder.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for recorder-wide beans.
 *
 * <p>Enables the RecorderProperties to be loaded from application.yml and exposes the recording
 * time zone and clock, so that "today" means the same day everywhere.
 */
@Configuration
@EnableConfigurationProperties(RecorderProperties.class)
public class RecorderConfig {

  @Bean
  public ZoneId recorderZone(RecorderProperties properties) {
    return properties.zoneId();
  }

  @Bean
  public Clock clock(ZoneId recorderZone) {
    return Clock.system(recorderZone);
  }
}
