package com.clinicqueue.appointment.service;

/** Outcome of one scan; {@code skipped} means another scan held the guard. */
public record NoShowRunResult(
    boolean skipped, int found, int marked, int errors, long executionMillis) {

  static NoShowRunResult skippedRun() {
    return new NoShowRunResult(true, 0, 0, 0, 0L);
  }
}
