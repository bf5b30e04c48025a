/*
 * Where: WaitTimeAnalyticsService unit tests
 * What: Grouping, invalid sample exclusion, zero-metric groups and the wait distribution
 * Why: Reports must skip corrupt timestamps without failing or skewing the metrics
 */
package com.clinicqueue.appointment.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.clinicqueue.appointment.analytics.model.QueueTimingRow;
import com.clinicqueue.appointment.analytics.model.RankedWaitTime;
import com.clinicqueue.appointment.analytics.model.TimeMetrics;
import com.clinicqueue.appointment.analytics.model.WaitTimeBucket;
import com.clinicqueue.appointment.analytics.model.WaitTimeByBranch;
import com.clinicqueue.appointment.analytics.model.WaitTimeByService;
import com.clinicqueue.appointment.analytics.model.WaitTimeByServicePoint;
import com.clinicqueue.appointment.analytics.model.WaitTimeSummary;
import com.clinicqueue.appointment.model.DateRange;
import com.clinicqueue.appointment.model.ReportFilters;
import com.clinicqueue.appointment.repository.QueueTimingRepository;
import com.clinicqueue.appointment.service.AppointmentMetrics;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class WaitTimeAnalyticsServiceTest {

  private static final Instant BASE = Instant.parse("2026-03-02T09:00:00Z");
  private static final ReportFilters FILTERS =
      ReportFilters.of(
          DateRange.ofDays(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 7), ZoneOffset.UTC));

  private QueueTimingRepository repository;
  private WaitTimeAnalyticsService service;

  @BeforeEach
  void setUp() {
    repository = Mockito.mock(QueueTimingRepository.class);
    service =
        new WaitTimeAnalyticsService(
            repository, new WaitTimeSampleValidator(Mockito.mock(AppointmentMetrics.class)));
  }

  @Test
  void branchMetricsMatchWorkedExample() {
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(
            List.of(
                row(1L, 10L, "Centro", 20L, "Consulta", 5 * 60, 10 * 60),
                row(2L, 10L, "Centro", 20L, "Consulta", 10 * 60, 20 * 60),
                // 20 seconds rounds to a zero-minute wait
                row(3L, 10L, "Centro", 20L, "Consulta", 20, 5 * 60)));

    final List<WaitTimeByBranch> result = service.getWaitTimesByBranch(FILTERS);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).waitTime()).isEqualTo(new TimeMetrics(5, 5, 0, 10, 3));
    assertThat(result.get(0).totalProcessed()).isEqualTo(3);
  }

  @Test
  void invalidSampleDoesNotAffectCount() {
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(
            List.of(
                row(1L, 10L, "Centro", 20L, "Consulta", 5 * 60, 10 * 60),
                row(2L, 10L, "Centro", 20L, "Consulta", -60, 10 * 60)));

    final WaitTimeByBranch branch = service.getWaitTimesByBranch(FILTERS).get(0);

    assertThat(branch.waitTime().count()).isEqualTo(1);
    assertThat(branch.waitTime().average()).isEqualTo(5);
    assertThat(branch.totalProcessed()).isEqualTo(1);
  }

  @Test
  void groupWithOnlyInvalidSamplesReportsZeros() {
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(List.of(row(1L, 11L, "Norte", 20L, "Consulta", 2000 * 60, 2010 * 60)));

    final List<WaitTimeByBranch> result = service.getWaitTimesByBranch(FILTERS);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).waitTime()).isEqualTo(TimeMetrics.ZERO);
    assertThat(result.get(0).serviceTime()).isEqualTo(TimeMetrics.ZERO);
  }

  @Test
  void servicesAreGroupedPerBranchAndSortedByName() {
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(
            List.of(
                row(1L, 10L, "Centro", 21L, "Vacunas", 60, 120),
                row(2L, 11L, "Norte", 20L, "Consulta", 60, 120),
                row(3L, 10L, "Centro", 20L, "Consulta", 60, 120)));

    final List<WaitTimeByService> result = service.getWaitTimesByService(FILTERS);

    assertThat(result).extracting(WaitTimeByService::serviceName)
        .containsExactly("Consulta", "Consulta", "Vacunas");
    assertThat(result).extracting(WaitTimeByService::branchId).contains(10L, 11L);
  }

  @Test
  void servicePointReportSkipsUnroutedEntries() {
    final Instant created = BASE;
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(
            List.of(
                new QueueTimingRow(
                    1L, 10L, "Centro", 20L, "Consulta", 5L, "Desk 5", created,
                    created.plusSeconds(300), created.plusSeconds(600)),
                row(2L, 10L, "Centro", 20L, "Consulta", 60, 120)));

    final List<WaitTimeByServicePoint> result = service.getWaitTimesByServicePoint(FILTERS);

    assertThat(result).hasSize(1);
    assertThat(result.get(0).servicePointName()).isEqualTo("Desk 5");
    assertThat(result.get(0).waitTime().average()).isEqualTo(5);
  }

  @Test
  void summaryRanksFastestBranchesAndBucketsWaits() {
    when(repository.countEntries(FILTERS)).thenReturn(6L);
    when(repository.findCompletedTimings(FILTERS))
        .thenReturn(
            List.of(
                row(1L, 10L, "Centro", 20L, "Consulta", 3 * 60, 13 * 60),
                row(2L, 10L, "Centro", 20L, "Consulta", 12 * 60, 22 * 60),
                row(3L, 11L, "Norte", 20L, "Consulta", 40 * 60, 50 * 60),
                row(4L, 11L, "Norte", 20L, "Consulta", 90 * 60, 100 * 60),
                row(5L, 11L, "Norte", 20L, "Consulta", -60, 60)));

    final WaitTimeSummary summary = service.getWaitTimesSummary(FILTERS);

    assertThat(summary.totalQueues()).isEqualTo(6L);
    assertThat(summary.completedQueues()).isEqualTo(5);
    // waits 3, 12, 40, 90
    assertThat(summary.averageWaitTime()).isEqualTo(36);
    assertThat(summary.averageServiceTime()).isEqualTo(10);
    assertThat(summary.topBranches())
        .extracting(RankedWaitTime::name)
        .containsExactly("Centro", "Norte");
    // the negative-wait row for Norte is rejected before grouping
    assertThat(summary.topBranches())
        .extracting(RankedWaitTime::totalProcessed)
        .containsExactly(2, 2);
    assertThat(summary.topServices())
        .singleElement()
        .satisfies(
            top -> {
              assertThat(top.name()).isEqualTo("Consulta");
              assertThat(top.totalProcessed()).isEqualTo(4);
            });
    assertThat(summary.waitTimeDistribution())
        .extracting(WaitTimeBucket::range)
        .containsExactly("0-5 min", "6-15 min", "16-30 min", "31-60 min", "60+ min");
    assertThat(summary.waitTimeDistribution())
        .extracting(WaitTimeBucket::count)
        .containsExactly(1, 1, 0, 1, 1);
    assertThat(summary.waitTimeDistribution())
        .extracting(WaitTimeBucket::percentage)
        .containsExactly(25, 25, 0, 25, 25);
  }

  @Test
  void emptyWindowYieldsZeroSummary() {
    when(repository.countEntries(FILTERS)).thenReturn(0L);
    when(repository.findCompletedTimings(FILTERS)).thenReturn(List.of());

    final WaitTimeSummary summary = service.getWaitTimesSummary(FILTERS);

    assertThat(summary.averageWaitTime()).isZero();
    assertThat(summary.topBranches()).isEmpty();
    assertThat(summary.waitTimeDistribution()).allSatisfy(bucket -> {
      assertThat(bucket.count()).isZero();
      assertThat(bucket.percentage()).isZero();
    });
  }

  private static QueueTimingRow row(
      long entryId,
      long branchId,
      String branchName,
      long serviceId,
      String serviceName,
      long waitSeconds,
      long completedAfterSeconds) {
    return new QueueTimingRow(
        entryId,
        branchId,
        branchName,
        serviceId,
        serviceName,
        null,
        null,
        BASE,
        BASE.plusSeconds(waitSeconds),
        BASE.plusSeconds(completedAfterSeconds));
  }
}
