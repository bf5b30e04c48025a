/*
 * Where: Appointment service layer
 * What: Application metrics for transitions, no-show marking, scan runs and rejected samples
 * Why: Operators watch scan health and data quality without reading logs
 */
package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.analytics.InvalidSampleReason;
import com.clinicqueue.appointment.model.AppointmentAction;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class AppointmentMetrics {

  private static final String METRIC_TRANSITION_TOTAL = "appointment.transition.total";
  private static final String METRIC_NO_SHOW_MARKED = "appointment.no_show.marked.total";
  private static final String METRIC_SCAN_RUN = "appointment.no_show.scan.duration";
  private static final String METRIC_SCAN_ERRORS = "appointment.no_show.scan.errors.total";
  private static final String METRIC_SCAN_LAST_FOUND = "appointment.no_show.scan.last_found";
  private static final String METRIC_SAMPLE_REJECTED = "appointment.analytics.sample.rejected.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger lastFound = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer scanRunTimer;

  public AppointmentMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SCAN_LAST_FOUND, lastFound, AtomicInteger::get)
        .description("Overdue appointments found by the latest no-show scan")
        .register(meterRegistry);
    this.scanRunTimer =
        Timer.builder(METRIC_SCAN_RUN)
            .description("Duration of one no-show scan")
            .register(meterRegistry);
  }

  public void recordTransition(AppointmentAction action, String result) {
    increment(
        METRIC_TRANSITION_TOTAL,
        "Appointment lifecycle transitions by outcome",
        Tags.of("action", action.metricName(), "result", result));
  }

  public void recordNoShowMarked(boolean automatic) {
    increment(
        METRIC_NO_SHOW_MARKED,
        "Appointments marked as no-show",
        Tags.of("mode", automatic ? "auto" : "manual"));
  }

  public void recordScanRun(Duration elapsed, int found) {
    scanRunTimer.record(elapsed);
    lastFound.set(Math.max(found, 0));
  }

  public void recordScanError(String stage) {
    increment(METRIC_SCAN_ERRORS, "No-show scan failures", Tags.of("stage", stage));
  }

  public void recordRejectedSample(InvalidSampleReason reason) {
    increment(
        METRIC_SAMPLE_REJECTED,
        "Queue timing rows excluded from wait-time analytics",
        Tags.of("reason", reason.name().toLowerCase(Locale.ROOT)));
  }

  private void increment(String name, String description, Tags tags) {
    final String key =
        tags.stream()
            .map(tag -> tag.getKey() + "=" + tag.getValue())
            .collect(Collectors.joining(",", name + ":", ""));
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
