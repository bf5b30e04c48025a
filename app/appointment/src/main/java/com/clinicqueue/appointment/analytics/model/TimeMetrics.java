package com.clinicqueue.appointment.analytics.model;

/** Whole-minute statistics over a set of durations. */
public record TimeMetrics(int average, int median, int minimum, int maximum, int count) {

  public static final TimeMetrics ZERO = new TimeMetrics(0, 0, 0, 0, 0);
}
