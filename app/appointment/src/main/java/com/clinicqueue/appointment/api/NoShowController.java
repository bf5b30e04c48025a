/*
 * Where: No-show API
 * What: Admin controls for the no-show scheduler and the no-show report
 * Why: Operators tune the scan interval and grace time without a restart
 */
package com.clinicqueue.appointment.api;

import com.clinicqueue.appointment.analytics.AppointmentAnalyticsService;
import com.clinicqueue.appointment.analytics.ReportFilterFactory;
import com.clinicqueue.appointment.analytics.model.NoShowReport;
import com.clinicqueue.appointment.api.request.NoShowConfigRequest;
import com.clinicqueue.appointment.api.response.NoShowRunResponse;
import com.clinicqueue.appointment.api.response.NoShowSchedulerStatusResponse;
import com.clinicqueue.appointment.service.NoShowScheduler;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/no-show")
@RequiredArgsConstructor
@Validated
public class NoShowController {

  private static final Logger logger = LoggerFactory.getLogger(NoShowController.class);

  private final NoShowScheduler noShowScheduler;
  private final AppointmentAnalyticsService analyticsService;
  private final ReportFilterFactory filterFactory;

  @GetMapping("/stats")
  public NoShowSchedulerStatusResponse stats() {
    return status();
  }

  @PutMapping("/config")
  public ResponseEntity<NoShowSchedulerStatusResponse> updateConfig(
      @RequestBody NoShowConfigRequest request) {
    noShowScheduler.updateConfig(request.toUpdate());
    return ResponseEntity.ok(status());
  }

  @PostMapping("/execute")
  public ResponseEntity<NoShowRunResponse> execute() {
    logger.info("manual no-show scan requested");
    return ResponseEntity.ok(NoShowRunResponse.from(noShowScheduler.executeManually()));
  }

  @PostMapping("/start")
  public ResponseEntity<NoShowSchedulerStatusResponse> start() {
    noShowScheduler.start();
    return ResponseEntity.ok(status());
  }

  @PostMapping("/stop")
  public ResponseEntity<NoShowSchedulerStatusResponse> stop() {
    noShowScheduler.stop();
    return ResponseEntity.ok(status());
  }

  @PostMapping("/reset-stats")
  public ResponseEntity<NoShowSchedulerStatusResponse> resetStats() {
    noShowScheduler.resetStats();
    return ResponseEntity.ok(status());
  }

  @GetMapping("/report")
  public NoShowReport report(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId,
      @RequestParam(value = "autoMarked", required = false) Boolean autoMarked) {
    return analyticsService.getNoShowReport(
        filterFactory.create(startDate, endDate, branchId, serviceId, null), autoMarked);
  }

  private NoShowSchedulerStatusResponse status() {
    return NoShowSchedulerStatusResponse.of(
        noShowScheduler.getStats(), noShowScheduler.getConfig());
  }
}
