package com.clinicqueue.appointment.analytics;

final class ReportMath {

  private ReportMath() {}

  /** part/total as a percentage with two decimals; zero when total is zero. */
  static double percentage(long part, long total) {
    if (total <= 0) {
      return 0d;
    }
    return round2(part * 100.0 / total);
  }

  static double round2(double value) {
    return Math.round(value * 100) / 100.0;
  }

  static double round2OrZero(Double value) {
    return value == null ? 0d : round2(value);
  }
}
