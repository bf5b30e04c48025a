package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.analytics.model.DemandTrend;

/**
 * Labels a service by its position in a list sorted by popularity: the first third is
 * INCREASING, the last third DECREASING, the rest STABLE. This is a ranking label, not a forecast.
 */
public final class DemandTrendHeuristic {

  private DemandTrendHeuristic() {}

  public static DemandTrend fromPosition(int index, int size) {
    if (index < size / 3.0) {
      return DemandTrend.INCREASING;
    }
    if (index > size * 2 / 3.0) {
      return DemandTrend.DECREASING;
    }
    return DemandTrend.STABLE;
  }
}
