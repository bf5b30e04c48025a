package com.clinicqueue.appointment.analytics.model;

import java.time.Instant;

/** A called and completed queue entry joined to the names of its grouping keys. */
public record QueueTimingRow(
    long queueEntryId,
    long branchId,
    String branchName,
    long serviceId,
    String serviceName,
    Long servicePointId,
    String servicePointName,
    Instant createdAt,
    Instant calledAt,
    Instant completedAt) {}
