package com.clinicqueue.appointment.analytics.model;

public enum DemandTrend {
  INCREASING,
  STABLE,
  DECREASING
}
