package com.clinicqueue.appointment.service;

import java.time.Instant;

/**
 * @param averageExecutionMillis mean duration of the last ten scans
 * @param running a recurring scan is scheduled
 * @param processing a scan is executing right now
 */
public record NoShowSchedulerStats(
    Instant lastRun,
    Instant nextRun,
    long totalMarkedAsNoShow,
    long totalErrors,
    double averageExecutionMillis,
    boolean running,
    boolean processing) {}
