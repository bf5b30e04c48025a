/*
 * Where: Wait-time analytics
 * What: Wait and service time statistics per branch, service and service point, plus a summary
 * Why: Branch managers compare waiting experience across locations and desks
 */
package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.analytics.model.QueueTimingRow;
import com.clinicqueue.appointment.analytics.model.RankedWaitTime;
import com.clinicqueue.appointment.analytics.model.TimeMetrics;
import com.clinicqueue.appointment.analytics.model.WaitTimeBucket;
import com.clinicqueue.appointment.analytics.model.WaitTimeByBranch;
import com.clinicqueue.appointment.analytics.model.WaitTimeByService;
import com.clinicqueue.appointment.analytics.model.WaitTimeByServicePoint;
import com.clinicqueue.appointment.analytics.model.WaitTimeSample;
import com.clinicqueue.appointment.analytics.model.WaitTimeSummary;
import com.clinicqueue.appointment.model.ReportFilters;
import com.clinicqueue.appointment.repository.QueueTimingRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WaitTimeAnalyticsService {

  private static final Logger logger = LoggerFactory.getLogger(WaitTimeAnalyticsService.class);

  private static final int TOP_LIMIT = 5;
  private static final List<Bucket> WAIT_BUCKETS =
      List.of(
          new Bucket("0-5 min", 0, 5),
          new Bucket("6-15 min", 6, 15),
          new Bucket("16-30 min", 16, 30),
          new Bucket("31-60 min", 31, 60),
          new Bucket("60+ min", 61, Integer.MAX_VALUE));

  private final QueueTimingRepository queueTimingRepository;
  private final WaitTimeSampleValidator sampleValidator;

  public List<WaitTimeByBranch> getWaitTimesByBranch(ReportFilters filters) {
    final Map<Long, Group> groups = new LinkedHashMap<>();
    for (QueueTimingRow row : queueTimingRepository.findCompletedTimings(filters)) {
      groups
          .computeIfAbsent(row.branchId(), ignored -> new Group(row))
          .add(sampleValidator.validate(row));
    }
    return groups.values().stream()
        .map(
            group ->
                new WaitTimeByBranch(
                    group.first.branchId(),
                    group.first.branchName(),
                    group.waitMetrics(),
                    group.serviceMetrics(),
                    group.processed()))
        .sorted(byName(WaitTimeByBranch::branchName))
        .toList();
  }

  /** Grouped by service within a branch. */
  public List<WaitTimeByService> getWaitTimesByService(ReportFilters filters) {
    final Map<String, Group> groups = new LinkedHashMap<>();
    for (QueueTimingRow row : queueTimingRepository.findCompletedTimings(filters)) {
      groups
          .computeIfAbsent(row.serviceId() + "-" + row.branchId(), ignored -> new Group(row))
          .add(sampleValidator.validate(row));
    }
    return groups.values().stream()
        .map(
            group ->
                new WaitTimeByService(
                    group.first.serviceId(),
                    group.first.serviceName(),
                    group.first.branchId(),
                    group.first.branchName(),
                    group.waitMetrics(),
                    group.serviceMetrics(),
                    group.processed()))
        .sorted(byName(WaitTimeByService::serviceName))
        .toList();
  }

  /** Grouped by service point within a branch; entries never routed to a desk are left out. */
  public List<WaitTimeByServicePoint> getWaitTimesByServicePoint(ReportFilters filters) {
    final Map<String, Group> groups = new LinkedHashMap<>();
    for (QueueTimingRow row : queueTimingRepository.findCompletedTimings(filters)) {
      if (row.servicePointId() == null) {
        continue;
      }
      groups
          .computeIfAbsent(row.servicePointId() + "-" + row.branchId(), ignored -> new Group(row))
          .add(sampleValidator.validate(row));
    }
    return groups.values().stream()
        .map(
            group ->
                new WaitTimeByServicePoint(
                    group.first.servicePointId(),
                    group.first.servicePointName(),
                    group.first.branchId(),
                    group.first.branchName(),
                    group.waitMetrics(),
                    group.serviceMetrics(),
                    group.processed()))
        .sorted(byName(WaitTimeByServicePoint::servicePointName))
        .toList();
  }

  public WaitTimeSummary getWaitTimesSummary(ReportFilters filters) {
    final long totalQueues = queueTimingRepository.countEntries(filters);
    final List<QueueTimingRow> rows = queueTimingRepository.findCompletedTimings(filters);
    final List<Integer> waitTimes = new ArrayList<>();
    final List<Integer> serviceTimes = new ArrayList<>();
    final Map<Long, Group> branches = new LinkedHashMap<>();
    final Map<Long, Group> services = new LinkedHashMap<>();
    for (QueueTimingRow row : rows) {
      final Optional<WaitTimeSample> sample = sampleValidator.validate(row);
      if (sample.isEmpty()) {
        continue;
      }
      waitTimes.add(sample.get().waitMinutes());
      serviceTimes.add(sample.get().serviceMinutes());
      branches.computeIfAbsent(row.branchId(), ignored -> new Group(row)).add(sample);
      services.computeIfAbsent(row.serviceId(), ignored -> new Group(row)).add(sample);
    }
    final List<RankedWaitTime> topBranches =
        rank(branches, group -> group.first.branchId(), group -> group.first.branchName());
    final List<RankedWaitTime> topServices =
        rank(services, group -> group.first.serviceId(), group -> group.first.serviceName());
    logger.debug(
        "wait-time summary computed total_queues={} completed_queues={} valid_samples={}",
        totalQueues,
        rows.size(),
        waitTimes.size());
    return new WaitTimeSummary(
        totalQueues,
        rows.size(),
        TimeMetricsCalculator.calculate(waitTimes).average(),
        TimeMetricsCalculator.calculate(serviceTimes).average(),
        topBranches,
        topServices,
        distribution(waitTimes));
  }

  static List<WaitTimeBucket> distribution(List<Integer> waitTimes) {
    final int total = waitTimes.size();
    final List<WaitTimeBucket> buckets = new ArrayList<>(WAIT_BUCKETS.size());
    for (Bucket bucket : WAIT_BUCKETS) {
      final int count =
          (int) waitTimes.stream().filter(time -> time >= bucket.min && time <= bucket.max).count();
      final int percentage = total > 0 ? (int) Math.round(count * 100.0 / total) : 0;
      buckets.add(new WaitTimeBucket(bucket.label, count, percentage));
    }
    return buckets;
  }

  private static List<RankedWaitTime> rank(
      Map<Long, Group> groups, Function<Group, Long> id, Function<Group, String> name) {
    return groups.values().stream()
        .map(
            group ->
                new RankedWaitTime(
                    id.apply(group),
                    name.apply(group),
                    group.waitMetrics().average(),
                    group.processed()))
        .sorted(Comparator.comparingInt(RankedWaitTime::averageWaitTime))
        .limit(TOP_LIMIT)
        .toList();
  }

  private static <T> Comparator<T> byName(Function<T, String> name) {
    return Comparator.comparing(name, Comparator.nullsLast(String::compareTo));
  }

  private record Bucket(String label, int min, int max) {}

  /** Valid samples of one grouping key; the first row supplies ids and names. */
  private static final class Group {
    private final QueueTimingRow first;
    private final List<Integer> waitTimes = new ArrayList<>();
    private final List<Integer> serviceTimes = new ArrayList<>();

    private Group(QueueTimingRow first) {
      this.first = first;
    }

    private void add(Optional<WaitTimeSample> sample) {
      sample.ifPresent(
          value -> {
            waitTimes.add(value.waitMinutes());
            serviceTimes.add(value.serviceMinutes());
          });
    }

    private TimeMetrics waitMetrics() {
      return TimeMetricsCalculator.calculate(waitTimes);
    }

    private TimeMetrics serviceMetrics() {
      return TimeMetricsCalculator.calculate(serviceTimes);
    }

    private int processed() {
      return waitTimes.size();
    }
  }
}
