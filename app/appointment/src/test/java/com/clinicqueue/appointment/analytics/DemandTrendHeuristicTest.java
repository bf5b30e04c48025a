package com.clinicqueue.appointment.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.clinicqueue.appointment.analytics.model.DemandTrend;
import org.junit.jupiter.api.Test;

class DemandTrendHeuristicTest {

  @Test
  void labelsThirdsOfRanking() {
    assertThat(DemandTrendHeuristic.fromPosition(0, 6)).isEqualTo(DemandTrend.INCREASING);
    assertThat(DemandTrendHeuristic.fromPosition(1, 6)).isEqualTo(DemandTrend.INCREASING);
    assertThat(DemandTrendHeuristic.fromPosition(2, 6)).isEqualTo(DemandTrend.STABLE);
    assertThat(DemandTrendHeuristic.fromPosition(4, 6)).isEqualTo(DemandTrend.STABLE);
    assertThat(DemandTrendHeuristic.fromPosition(5, 6)).isEqualTo(DemandTrend.DECREASING);
  }

  @Test
  void singleServiceIsIncreasing() {
    assertThat(DemandTrendHeuristic.fromPosition(0, 1)).isEqualTo(DemandTrend.INCREASING);
  }
}
