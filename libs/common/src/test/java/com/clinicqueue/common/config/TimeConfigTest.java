package com.clinicqueue.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

class TimeConfigTest {

  @Test
  void clockBeanTicksInUtc() {
    try (AnnotationConfigApplicationContext context =
        new AnnotationConfigApplicationContext(TimeConfig.class)) {
      assertThat(context.getBean(Clock.class).getZone()).isEqualTo(ZoneOffset.UTC);
    }
  }
}
