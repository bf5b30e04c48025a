/*
 * Where: Appointment service composition root
 * What: Starts the no-show scheduler once the application is ready and stops it on shutdown
 * Why: Auto-start is opt-in per deployment through appointment.no-show.auto-start
 */
package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.config.NoShowSchedulerProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NoShowSchedulerBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(NoShowSchedulerBootstrap.class);

  private final NoShowScheduler noShowScheduler;
  private final NoShowSchedulerProperties properties;

  @EventListener(ApplicationReadyEvent.class)
  public void startIfEnabled() {
    if (!properties.autoStart()) {
      logger.info("no-show scheduler auto-start is off; use the control API to start it");
      return;
    }
    noShowScheduler.start();
  }

  @PreDestroy
  public void shutdown() {
    noShowScheduler.stop();
  }
}
