/*
 * Where: Appointment domain model
 * What: Audit row written for every reschedule
 * Why: Lets staff see the full chain of moves for one visit
 */
package com.clinicqueue.appointment.model;

import java.time.Instant;

public record RescheduleHistoryRecord(
    Long id,
    long fromAppointmentId,
    long toAppointmentId,
    Instant originalScheduledAt,
    Instant newScheduledAt,
    long rescheduledById,
    String reason,
    Instant createdAt) {}
