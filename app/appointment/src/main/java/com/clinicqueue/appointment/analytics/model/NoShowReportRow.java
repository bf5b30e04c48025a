package com.clinicqueue.appointment.analytics.model;

import java.time.Instant;

public record NoShowReportRow(
    long appointmentId,
    String confirmationCode,
    Instant scheduledAt,
    Instant noShowMarkedAt,
    boolean autoMarked,
    long branchId,
    String branchName,
    long serviceId,
    String serviceName,
    Long userId,
    String guestName,
    String guestEmail) {}
