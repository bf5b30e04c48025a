/*
 * Where: Shared service wiring
 * What: The UTC clock behind every scheduled_at, no-show and queue timestamp
 * Why: Report zones are applied in SQL, so the clock itself never carries a clinic zone
 */
package com.clinicqueue.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock shared by the lifecycle, queue and no-show services.
 *
 * <p>Unit tests build those services with {@link Clock#fixed} instead of loading this class.
 */
@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
