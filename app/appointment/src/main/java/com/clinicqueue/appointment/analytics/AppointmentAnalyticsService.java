/*
 * Where: Appointment analytics
 * What: Outcome counts, rates and breakdowns over a report window
 * Why: Attendance and no-show rates drive staffing and reminder decisions per branch and service
 */
package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.analytics.model.AppointmentSummary;
import com.clinicqueue.appointment.analytics.model.AppointmentTrend;
import com.clinicqueue.appointment.analytics.model.AppointmentsByBranch;
import com.clinicqueue.appointment.analytics.model.AppointmentsByService;
import com.clinicqueue.appointment.analytics.model.BranchOutcomeRow;
import com.clinicqueue.appointment.analytics.model.HourlyDistribution;
import com.clinicqueue.appointment.analytics.model.NoShowReport;
import com.clinicqueue.appointment.analytics.model.NoShowReportRow;
import com.clinicqueue.appointment.analytics.model.QueueStatistics;
import com.clinicqueue.appointment.analytics.model.QueueStatusRow;
import com.clinicqueue.appointment.analytics.model.RescheduleReasonCount;
import com.clinicqueue.appointment.analytics.model.ReschedulingStats;
import com.clinicqueue.appointment.analytics.model.ServiceOutcomeRow;
import com.clinicqueue.appointment.analytics.model.StatusCountRow;
import com.clinicqueue.appointment.config.ReportProperties;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.ReportFilters;
import com.clinicqueue.appointment.repository.AppointmentReportRepository;
import com.clinicqueue.appointment.repository.AppointmentReportRepository.RescheduleTotals;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AppointmentAnalyticsService {

  private final AppointmentReportRepository reportRepository;
  private final ReportProperties reportProperties;

  public AppointmentSummary getAppointmentsSummary(ReportFilters filters) {
    final Map<AppointmentStatus, Long> counts = countByStatus(filters);
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    final long checkedIn = counts.get(AppointmentStatus.CHECKED_IN);
    final long completed = counts.get(AppointmentStatus.COMPLETED);
    final long noShow = counts.get(AppointmentStatus.NO_SHOW);
    return new AppointmentSummary(
        total,
        counts.get(AppointmentStatus.SCHEDULED),
        checkedIn,
        completed,
        counts.get(AppointmentStatus.CANCELLED),
        noShow,
        reportRepository.countRescheduled(filters),
        attendanceRate(completed, checkedIn, total),
        ReportMath.percentage(completed, total),
        ReportMath.percentage(noShow, total));
  }

  /** Every branch in the window; a branch filter does not narrow this breakdown. */
  public List<AppointmentsByBranch> getAppointmentsByBranch(ReportFilters filters) {
    final ReportFilters scoped = filters.withoutBranch();
    final Map<Long, Long> rescheduled = reportRepository.countRescheduledByBranch(scoped);
    final long days = scoped.dateRange().dayCount();
    final List<AppointmentsByBranch> result = new ArrayList<>();
    for (BranchOutcomeRow row : reportRepository.countByBranch(scoped)) {
      result.add(
          new AppointmentsByBranch(
              row.branchId(),
              row.branchName(),
              row.total(),
              row.completed(),
              row.cancelled(),
              row.noShow(),
              rescheduled.getOrDefault(row.branchId(), 0L),
              attendanceRate(row.completed(), row.checkedIn(), row.total()),
              ReportMath.round2(row.total() / (double) days)));
    }
    return result;
  }

  /**
   * Every service in the window ranked by appointment count; a service filter does not narrow
   * this breakdown. The demand trend is a position label, see {@link DemandTrendHeuristic}.
   */
  public List<AppointmentsByService> getAppointmentsByService(ReportFilters filters) {
    final List<ServiceOutcomeRow> rows = reportRepository.countByService(filters.withoutService());
    final List<AppointmentsByService> result = new ArrayList<>(rows.size());
    for (int index = 0; index < rows.size(); index++) {
      final ServiceOutcomeRow row = rows.get(index);
      result.add(
          new AppointmentsByService(
              row.serviceId(),
              row.serviceName(),
              row.total(),
              row.completed(),
              ReportMath.round2OrZero(row.averageCompletionMinutes()),
              index + 1,
              DemandTrendHeuristic.fromPosition(index, rows.size())));
    }
    return result;
  }

  /** Averages are taken over completed entries only. */
  public QueueStatistics getQueueStatistics(ReportFilters filters) {
    long total = 0;
    long waiting = 0;
    long serving = 0;
    long complete = 0;
    double averageWait = 0d;
    double averageService = 0d;
    for (QueueStatusRow row : reportRepository.queueStatusCounts(filters)) {
      total += row.count();
      switch (row.status()) {
        case WAITING -> waiting = row.count();
        case SERVING -> serving = row.count();
        case COMPLETE -> {
          complete = row.count();
          averageWait = row.averageWaitMinutes() == null ? 0d : row.averageWaitMinutes();
          averageService = row.averageServiceMinutes() == null ? 0d : row.averageServiceMinutes();
        }
      }
    }
    return new QueueStatistics(
        total,
        waiting,
        serving,
        complete,
        ReportMath.round2(averageWait),
        ReportMath.round2(averageService),
        ReportMath.percentage(complete, total));
  }

  /** Reschedules recorded in the window; the rate is against appointments scheduled in it. */
  public ReschedulingStats getReschedulingStats(ReportFilters filters) {
    final RescheduleTotals totals = reportRepository.rescheduleTotals(filters);
    final long appointmentsInWindow =
        countByStatus(filters).values().stream().mapToLong(Long::longValue).sum();
    final List<RescheduleReasonCount> reasons =
        reportRepository.topRescheduleReasons(filters).stream()
            .map(
                reason ->
                    new RescheduleReasonCount(
                        reason.reason(),
                        reason.count(),
                        ReportMath.percentage(reason.count(), totals.total())))
            .toList();
    return new ReschedulingStats(
        totals.total(),
        ReportMath.percentage(totals.total(), appointmentsInWindow),
        ReportMath.round2OrZero(totals.averageLeadDays()),
        reasons,
        reportRepository.dailyReschedules(filters, reportProperties.zone()));
  }

  /** Hours in the report zone; hours without appointments are omitted. */
  public List<HourlyDistribution> getHourlyDistribution(ReportFilters filters) {
    return reportRepository.hourlyCounts(filters, reportProperties.zone()).stream()
        .map(
            row ->
                new HourlyDistribution(
                    row.hour(),
                    row.total(),
                    ReportMath.percentage(row.completed(), row.total()),
                    ReportMath.round2OrZero(row.averageMinutesToAttend())))
        .toList();
  }

  public List<AppointmentTrend> getAppointmentTrends(ReportFilters filters) {
    return reportRepository.dailyCounts(filters, reportProperties.zone()).stream()
        .map(
            row ->
                new AppointmentTrend(
                    row.date(),
                    row.total(),
                    row.completed(),
                    row.cancelled(),
                    row.noShow(),
                    attendanceRate(row.completed(), row.checkedIn(), row.total())))
        .toList();
  }

  /** No-shows marked inside the window, optionally only automatic or only manual ones. */
  public NoShowReport getNoShowReport(ReportFilters filters, Boolean autoMarked) {
    final List<NoShowReportRow> rows = reportRepository.findNoShows(filters, autoMarked);
    return new NoShowReport(rows, rows.size());
  }

  private Map<AppointmentStatus, Long> countByStatus(ReportFilters filters) {
    final Map<AppointmentStatus, Long> counts = new EnumMap<>(AppointmentStatus.class);
    for (AppointmentStatus status : AppointmentStatus.values()) {
      counts.put(status, 0L);
    }
    for (StatusCountRow row : reportRepository.countByStatus(filters)) {
      counts.put(row.status(), row.count());
    }
    return counts;
  }

  /** Checked-in visitors count as attended. */
  static double attendanceRate(long completed, long checkedIn, long total) {
    return ReportMath.percentage(completed + checkedIn, total);
  }
}
