package com.clinicqueue.appointment.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.clinicqueue.appointment.analytics.model.AppointmentSummary;
import com.clinicqueue.appointment.analytics.model.AppointmentTrend;
import com.clinicqueue.appointment.analytics.model.AppointmentsByBranch;
import com.clinicqueue.appointment.analytics.model.AppointmentsByService;
import com.clinicqueue.appointment.analytics.model.BranchOutcomeRow;
import com.clinicqueue.appointment.analytics.model.DailyCount;
import com.clinicqueue.appointment.analytics.model.DailyOutcomeRow;
import com.clinicqueue.appointment.analytics.model.DemandTrend;
import com.clinicqueue.appointment.analytics.model.HourlyDistribution;
import com.clinicqueue.appointment.analytics.model.HourlyRow;
import com.clinicqueue.appointment.analytics.model.QueueStatistics;
import com.clinicqueue.appointment.analytics.model.QueueStatusRow;
import com.clinicqueue.appointment.analytics.model.RescheduleReasonCount;
import com.clinicqueue.appointment.analytics.model.ReschedulingStats;
import com.clinicqueue.appointment.analytics.model.ServiceOutcomeRow;
import com.clinicqueue.appointment.analytics.model.StatusCountRow;
import com.clinicqueue.appointment.config.ReportProperties;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.DateRange;
import com.clinicqueue.appointment.model.QueueStatus;
import com.clinicqueue.appointment.model.ReportFilters;
import com.clinicqueue.appointment.repository.AppointmentReportRepository;
import com.clinicqueue.appointment.repository.AppointmentReportRepository.RescheduleTotals;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class AppointmentAnalyticsServiceTest {

  private static final ReportFilters WEEK =
      new ReportFilters(
          DateRange.ofDays(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 7), ZoneOffset.UTC),
          10L,
          20L,
          null);

  private AppointmentReportRepository repository;
  private AppointmentAnalyticsService service;

  @BeforeEach
  void setUp() {
    repository = Mockito.mock(AppointmentReportRepository.class);
    service = new AppointmentAnalyticsService(repository, new ReportProperties("America/Bogota"));
  }

  @Test
  void summaryCountsCheckedInAsAttended() {
    when(repository.countByStatus(WEEK))
        .thenReturn(
            List.of(
                new StatusCountRow(AppointmentStatus.SCHEDULED, 2),
                new StatusCountRow(AppointmentStatus.CHECKED_IN, 1),
                new StatusCountRow(AppointmentStatus.COMPLETED, 4),
                new StatusCountRow(AppointmentStatus.NO_SHOW, 1)));
    when(repository.countRescheduled(WEEK)).thenReturn(3L);

    final AppointmentSummary summary = service.getAppointmentsSummary(WEEK);

    assertThat(summary.totalAppointments()).isEqualTo(8L);
    assertThat(summary.cancelledAppointments()).isZero();
    assertThat(summary.rescheduledAppointments()).isEqualTo(3L);
    assertThat(summary.attendanceRate()).isEqualTo(62.5d);
    assertThat(summary.completionRate()).isEqualTo(50.0d);
    assertThat(summary.noShowRate()).isEqualTo(12.5d);
  }

  @Test
  void emptyWindowYieldsZeroRates() {
    when(repository.countByStatus(WEEK)).thenReturn(List.of());

    final AppointmentSummary summary = service.getAppointmentsSummary(WEEK);

    assertThat(summary.totalAppointments()).isZero();
    assertThat(summary.attendanceRate()).isZero();
    assertThat(summary.noShowRate()).isZero();
  }

  @Test
  void byBranchIgnoresBranchFilterAndAveragesPerDay() {
    final ReportFilters withoutBranch = WEEK.withoutBranch();
    when(repository.countByBranch(withoutBranch))
        .thenReturn(List.of(new BranchOutcomeRow(10L, "Centro", 10, 1, 6, 2, 1)));
    when(repository.countRescheduledByBranch(withoutBranch)).thenReturn(Map.of(10L, 2L));

    final List<AppointmentsByBranch> result = service.getAppointmentsByBranch(WEEK);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).rescheduledAppointments()).isEqualTo(2L);
    assertThat(result.get(0).attendanceRate()).isEqualTo(70.0d);
    // 10 appointments over 7 days
    assertThat(result.get(0).averageAppointmentsPerDay()).isEqualTo(1.43d);
    verify(repository).countByBranch(withoutBranch);
  }

  @Test
  void byServiceRanksAndLabelsDemand() {
    when(repository.countByService(WEEK.withoutService()))
        .thenReturn(
            List.of(
                new ServiceOutcomeRow(20L, "Consulta", 30, 20, 12.346d),
                new ServiceOutcomeRow(21L, "Vacunas", 12, 10, null),
                new ServiceOutcomeRow(22L, "Laboratorio", 3, 1, 40d)));

    final List<AppointmentsByService> result = service.getAppointmentsByService(WEEK);

    assertThat(result).extracting(AppointmentsByService::popularityRank).containsExactly(1, 2, 3);
    assertThat(result)
        .extracting(AppointmentsByService::demandTrend)
        .containsExactly(DemandTrend.INCREASING, DemandTrend.STABLE, DemandTrend.STABLE);
    assertThat(result.get(0).averageCompletionTime()).isEqualTo(12.35d);
    assertThat(result.get(1).averageCompletionTime()).isZero();
  }

  @Test
  void queueStatisticsUsesCompletedAverages() {
    when(repository.queueStatusCounts(WEEK))
        .thenReturn(
            List.of(
                new QueueStatusRow(QueueStatus.WAITING, 2, null, null),
                new QueueStatusRow(QueueStatus.SERVING, 1, null, null),
                new QueueStatusRow(QueueStatus.COMPLETE, 5, 11.256d, 7.5d)));

    final QueueStatistics stats = service.getQueueStatistics(WEEK);

    assertThat(stats.totalQueues()).isEqualTo(8L);
    assertThat(stats.waitingQueues()).isEqualTo(2L);
    assertThat(stats.completedQueues()).isEqualTo(5L);
    assertThat(stats.averageWaitTime()).isEqualTo(11.26d);
    assertThat(stats.averageServiceTime()).isEqualTo(7.5d);
    assertThat(stats.queueEfficiency()).isEqualTo(62.5d);
  }

  @Test
  void reschedulingStatsRateAgainstAppointmentsInWindow() {
    when(repository.rescheduleTotals(WEEK)).thenReturn(new RescheduleTotals(4, 2.666d));
    when(repository.countByStatus(WEEK))
        .thenReturn(List.of(new StatusCountRow(AppointmentStatus.SCHEDULED, 16)));
    when(repository.topRescheduleReasons(WEEK))
        .thenReturn(List.of(new RescheduleReasonCount("patient asked", 3, 0d)));
    final List<DailyCount> daily = List.of(new DailyCount(LocalDate.of(2026, 3, 2), 4));
    when(repository.dailyReschedules(eq(WEEK), any(ZoneId.class))).thenReturn(daily);

    final ReschedulingStats stats = service.getReschedulingStats(WEEK);

    assertThat(stats.totalReschedules()).isEqualTo(4L);
    assertThat(stats.rescheduleRate()).isEqualTo(25.0d);
    assertThat(stats.averageLeadDays()).isEqualTo(2.67d);
    assertThat(stats.topReasons().get(0).percentage()).isEqualTo(75.0d);
    assertThat(stats.dailyTrend()).isEqualTo(daily);
    verify(repository).dailyReschedules(WEEK, ZoneId.of("America/Bogota"));
  }

  @Test
  void hourlyDistributionComputesCompletionRate() {
    when(repository.hourlyCounts(eq(WEEK), any(ZoneId.class)))
        .thenReturn(List.of(new HourlyRow(9, 3, 1, 4.444d), new HourlyRow(14, 0, 0, null)));

    final List<HourlyDistribution> result = service.getHourlyDistribution(WEEK);

    assertThat(result.get(0).completionRate()).isEqualTo(33.33d);
    assertThat(result.get(0).averageMinutesToAttend()).isEqualTo(4.44d);
    assertThat(result.get(1).completionRate()).isZero();
  }

  @Test
  void trendsUseAttendanceRatePerDay() {
    when(repository.dailyCounts(eq(WEEK), any(ZoneId.class)))
        .thenReturn(List.of(new DailyOutcomeRow(LocalDate.of(2026, 3, 3), 4, 1, 2, 1, 0)));

    final List<AppointmentTrend> result = service.getAppointmentTrends(WEEK);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).attendanceRate()).isEqualTo(75.0d);
    assertThat(result.get(0).cancelledAppointments()).isEqualTo(1L);
  }
}
