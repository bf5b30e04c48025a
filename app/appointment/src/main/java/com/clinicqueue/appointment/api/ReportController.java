/*
 * Where: Reporting API
 * What: Read-only dashboards for queue wait times and appointment outcomes
 * Why: Query parameters are turned into one filter shape before reaching the analytics engines
 */
package com.clinicqueue.appointment.api;

import com.clinicqueue.appointment.analytics.AppointmentAnalyticsService;
import com.clinicqueue.appointment.analytics.ReportFilterFactory;
import com.clinicqueue.appointment.analytics.WaitTimeAnalyticsService;
import com.clinicqueue.appointment.analytics.model.AppointmentSummary;
import com.clinicqueue.appointment.analytics.model.AppointmentTrend;
import com.clinicqueue.appointment.analytics.model.AppointmentsByBranch;
import com.clinicqueue.appointment.analytics.model.AppointmentsByService;
import com.clinicqueue.appointment.analytics.model.HourlyDistribution;
import com.clinicqueue.appointment.analytics.model.QueueStatistics;
import com.clinicqueue.appointment.analytics.model.ReschedulingStats;
import com.clinicqueue.appointment.analytics.model.WaitTimeByBranch;
import com.clinicqueue.appointment.analytics.model.WaitTimeByService;
import com.clinicqueue.appointment.analytics.model.WaitTimeByServicePoint;
import com.clinicqueue.appointment.analytics.model.WaitTimeSummary;
import com.clinicqueue.appointment.model.ReportFilters;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

  private final WaitTimeAnalyticsService waitTimeAnalytics;
  private final AppointmentAnalyticsService appointmentAnalytics;
  private final ReportFilterFactory filterFactory;

  @GetMapping("/wait-times/branches")
  public List<WaitTimeByBranch> waitTimesByBranch(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId,
      @RequestParam(value = "servicePointId", required = false) Long servicePointId) {
    return waitTimeAnalytics.getWaitTimesByBranch(
        filters(startDate, endDate, branchId, serviceId, servicePointId));
  }

  @GetMapping("/wait-times/services")
  public List<WaitTimeByService> waitTimesByService(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId,
      @RequestParam(value = "servicePointId", required = false) Long servicePointId) {
    return waitTimeAnalytics.getWaitTimesByService(
        filters(startDate, endDate, branchId, serviceId, servicePointId));
  }

  @GetMapping("/wait-times/service-points")
  public List<WaitTimeByServicePoint> waitTimesByServicePoint(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId,
      @RequestParam(value = "servicePointId", required = false) Long servicePointId) {
    return waitTimeAnalytics.getWaitTimesByServicePoint(
        filters(startDate, endDate, branchId, serviceId, servicePointId));
  }

  @GetMapping("/wait-times/summary")
  public WaitTimeSummary waitTimesSummary(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId,
      @RequestParam(value = "servicePointId", required = false) Long servicePointId) {
    return waitTimeAnalytics.getWaitTimesSummary(
        filters(startDate, endDate, branchId, serviceId, servicePointId));
  }

  @GetMapping("/appointments/summary")
  public AppointmentSummary appointmentsSummary(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getAppointmentsSummary(
        filters(startDate, endDate, branchId, serviceId, null));
  }

  @GetMapping("/appointments/branches")
  public List<AppointmentsByBranch> appointmentsByBranch(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getAppointmentsByBranch(
        filters(startDate, endDate, null, serviceId, null));
  }

  @GetMapping("/appointments/services")
  public List<AppointmentsByService> appointmentsByService(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId) {
    return appointmentAnalytics.getAppointmentsByService(
        filters(startDate, endDate, branchId, null, null));
  }

  @GetMapping("/appointments/queues")
  public QueueStatistics queueStatistics(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getQueueStatistics(
        filters(startDate, endDate, branchId, serviceId, null));
  }

  @GetMapping("/appointments/rescheduling")
  public ReschedulingStats reschedulingStats(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getReschedulingStats(
        filters(startDate, endDate, branchId, serviceId, null));
  }

  @GetMapping("/appointments/hourly")
  public List<HourlyDistribution> hourlyDistribution(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getHourlyDistribution(
        filters(startDate, endDate, branchId, serviceId, null));
  }

  @GetMapping("/appointments/trends")
  public List<AppointmentTrend> appointmentTrends(
      @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(value = "branchId", required = false) Long branchId,
      @RequestParam(value = "serviceId", required = false) Long serviceId) {
    return appointmentAnalytics.getAppointmentTrends(
        filters(startDate, endDate, branchId, serviceId, null));
  }

  private ReportFilters filters(
      LocalDate startDate, LocalDate endDate, Long branchId, Long serviceId, Long servicePointId) {
    return filterFactory.create(startDate, endDate, branchId, serviceId, servicePointId);
  }
}
