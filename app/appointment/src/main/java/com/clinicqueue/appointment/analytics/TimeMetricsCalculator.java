package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.analytics.model.TimeMetrics;
import java.util.List;

/** Mean, median and extremes of whole-minute durations; an empty input yields all zeros. */
public final class TimeMetricsCalculator {

  private TimeMetricsCalculator() {}

  public static TimeMetrics calculate(List<Integer> minutes) {
    final int[] sorted =
        minutes.stream()
            .filter(value -> value != null && value >= 0)
            .mapToInt(Integer::intValue)
            .sorted()
            .toArray();
    if (sorted.length == 0) {
      return TimeMetrics.ZERO;
    }
    long sum = 0;
    for (int value : sorted) {
      sum += value;
    }
    final int average = (int) Math.round(sum / (double) sorted.length);
    final int middle = sorted.length / 2;
    final int median =
        sorted.length % 2 == 0
            ? (int) Math.round((sorted[middle - 1] + sorted[middle]) / 2.0)
            : sorted[middle];
    return new TimeMetrics(average, median, sorted[0], sorted[sorted.length - 1], sorted.length);
  }
}
