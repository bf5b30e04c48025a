/*
 * Where: Appointment service layer
 * What: Periodic scan that marks overdue SCHEDULED appointments as no-show
 * Why: Missed visits must leave SCHEDULED without staff action; one bad row must not stop the scan
 */
package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.config.NoShowSchedulerProperties;
import com.clinicqueue.appointment.model.AppointmentRecord;
import com.clinicqueue.appointment.repository.AppointmentRepository;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "TaskScheduler and Clock are shared Spring-managed components")
public class NoShowScheduler {

  private static final Logger logger = LoggerFactory.getLogger(NoShowScheduler.class);

  private static final int EXECUTION_SAMPLE_SIZE = 10;
  private static final String TRIGGER_TIMER = "timer";
  private static final String TRIGGER_MANUAL = "manual";

  private final AppointmentRepository appointmentRepository;
  private final AppointmentLifecycleService lifecycleService;
  private final AppointmentMetrics metrics;
  private final TaskScheduler taskScheduler;
  private final Clock clock;

  // shared by timer and manual runs
  private final AtomicBoolean processing = new AtomicBoolean(false);
  // guards everything below
  private final Object lock = new Object();

  private NoShowSchedulerConfig config;
  private ScheduledFuture<?> scheduledTask;
  private Instant lastRun;
  private Instant nextRun;
  private long totalMarked;
  private long totalErrors;
  private final Deque<Long> executionMillis = new ArrayDeque<>();

  public NoShowScheduler(
      AppointmentRepository appointmentRepository,
      AppointmentLifecycleService lifecycleService,
      AppointmentMetrics metrics,
      TaskScheduler taskScheduler,
      NoShowSchedulerProperties properties,
      Clock clock) {
    this.appointmentRepository = appointmentRepository;
    this.lifecycleService = lifecycleService;
    this.metrics = metrics;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
    this.config = NoShowSchedulerConfig.from(properties);
  }

  /** Schedules the scan at the configured interval with the first run immediately. */
  public void start() {
    synchronized (lock) {
      if (!config.enabled()) {
        logger.info("no-show scheduler is disabled, not starting");
        return;
      }
      if (scheduledTask != null) {
        logger.info("no-show scheduler is already running");
        return;
      }
      final Instant firstRun = Instant.now(clock);
      final Duration interval = Duration.ofMinutes(config.intervalMinutes());
      scheduledTask = taskScheduler.scheduleWithFixedDelay(this::runScheduled, firstRun, interval);
      nextRun = firstRun;
      logger.info(
          "no-show scheduler started interval_minutes={} grace_time_minutes={}",
          config.intervalMinutes(),
          config.graceTimeMinutes());
    }
  }

  /** Cancels future scans; a scan already executing finishes normally. */
  public void stop() {
    synchronized (lock) {
      if (scheduledTask == null) {
        return;
      }
      scheduledTask.cancel(false);
      scheduledTask = null;
      nextRun = null;
      logger.info("no-show scheduler stopped");
    }
  }

  /**
   * Validates and applies a partial update. An invalid update leaves the current configuration in
   * place; a running scheduler is restarted with the new interval.
   */
  public NoShowSchedulerConfig updateConfig(NoShowSchedulerConfig.Update update) {
    synchronized (lock) {
      final NoShowSchedulerConfig updated = config.merge(update);
      final boolean wasRunning = scheduledTask != null;
      if (wasRunning) {
        stop();
      }
      config = updated;
      logger.info(
          "no-show scheduler configuration updated interval_minutes={} grace_time_minutes={} enabled={}",
          updated.intervalMinutes(),
          updated.graceTimeMinutes(),
          updated.enabled());
      if (wasRunning) {
        start();
      }
      return updated;
    }
  }

  public NoShowSchedulerConfig getConfig() {
    synchronized (lock) {
      return config;
    }
  }

  public NoShowSchedulerStats getStats() {
    synchronized (lock) {
      final double average =
          executionMillis.stream().mapToLong(Long::longValue).average().orElse(0d);
      return new NoShowSchedulerStats(
          lastRun,
          nextRun,
          totalMarked,
          totalErrors,
          average,
          scheduledTask != null,
          processing.get());
    }
  }

  public void resetStats() {
    synchronized (lock) {
      totalMarked = 0;
      totalErrors = 0;
      lastRun = null;
      executionMillis.clear();
    }
    logger.info("no-show scheduler statistics reset");
  }

  /** Runs one scan now on the caller's thread; skipped if a scan is already executing. */
  public NoShowRunResult executeManually() {
    return runScan(TRIGGER_MANUAL);
  }

  private void runScheduled() {
    try {
      runScan(TRIGGER_TIMER);
    } catch (RuntimeException ex) {
      // keep the recurring task alive
      logger.error("no-show scan failed unexpectedly", ex);
      metrics.recordScanError("unexpected");
    }
  }

  @VisibleForTesting
  NoShowRunResult runScan(String trigger) {
    if (!processing.compareAndSet(false, true)) {
      logger.info("no-show scan skipped, previous scan still processing trigger={}", trigger);
      return NoShowRunResult.skippedRun();
    }
    final long startedNanos = System.nanoTime();
    int found = 0;
    int marked = 0;
    int errors = 0;
    try {
      final NoShowSchedulerConfig current = getConfig();
      final Instant now = Instant.now(clock);
      final Instant cutoff = now.minus(Duration.ofMinutes(current.graceTimeMinutes()));
      final List<AppointmentRecord> overdue;
      try {
        overdue = appointmentRepository.findOverdueScheduled(cutoff);
      } catch (RuntimeException ex) {
        logger.error("no-show scan could not select overdue appointments cutoff={}", cutoff, ex);
        metrics.recordScanError("selection");
        synchronized (lock) {
          totalErrors++;
        }
        return new NoShowRunResult(false, 0, 0, 1, elapsedMillis(startedNanos));
      }
      found = overdue.size();
      for (AppointmentRecord appointment : overdue) {
        try {
          if (lifecycleService.markNoShow(appointment, true)) {
            marked++;
          }
        } catch (RuntimeException ex) {
          errors++;
          metrics.recordScanError("row");
          logger.warn(
              "no-show scan failed to mark appointment_id={}, continuing", appointment.id(), ex);
        }
      }
      synchronized (lock) {
        totalMarked += marked;
        totalErrors += errors;
        lastRun = Instant.now(clock);
        if (scheduledTask != null) {
          nextRun = lastRun.plus(Duration.ofMinutes(current.intervalMinutes()));
        }
      }
      logger.info(
          "no-show scan finished trigger={} found={} marked={} errors={}",
          trigger,
          found,
          marked,
          errors);
      return new NoShowRunResult(false, found, marked, errors, elapsedMillis(startedNanos));
    } finally {
      final long elapsed = elapsedMillis(startedNanos);
      synchronized (lock) {
        executionMillis.addLast(elapsed);
        while (executionMillis.size() > EXECUTION_SAMPLE_SIZE) {
          executionMillis.removeFirst();
        }
      }
      metrics.recordScanRun(Duration.ofMillis(elapsed), found);
      processing.set(false);
    }
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
