package com.clinicqueue.appointment.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.clinicqueue.appointment.analytics.model.TimeMetrics;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeMetricsCalculatorTest {

  @Test
  void computesMetricsForOddSampleCount() {
    final TimeMetrics metrics = TimeMetricsCalculator.calculate(List.of(5, 10, 0));

    assertThat(metrics).isEqualTo(new TimeMetrics(5, 5, 0, 10, 3));
  }

  @Test
  void medianOfEvenSampleCountAveragesMiddlePair() {
    final TimeMetrics metrics = TimeMetricsCalculator.calculate(List.of(4, 1, 8, 3));

    // sorted 1,3,4,8: median (3+4)/2 = 3.5 rounds to 4, mean 4
    assertThat(metrics.median()).isEqualTo(4);
    assertThat(metrics.average()).isEqualTo(4);
    assertThat(metrics.minimum()).isEqualTo(1);
    assertThat(metrics.maximum()).isEqualTo(8);
    assertThat(metrics.count()).isEqualTo(4);
  }

  @Test
  void emptyInputYieldsZeros() {
    assertThat(TimeMetricsCalculator.calculate(List.of())).isEqualTo(TimeMetrics.ZERO);
  }

  @Test
  void negativeAndMissingValuesAreIgnored() {
    final TimeMetrics metrics = TimeMetricsCalculator.calculate(Arrays.asList(-3, null, 6));

    assertThat(metrics).isEqualTo(new TimeMetrics(6, 6, 6, 6, 1));
  }
}
