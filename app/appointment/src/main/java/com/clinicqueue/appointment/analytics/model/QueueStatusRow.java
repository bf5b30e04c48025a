package com.clinicqueue.appointment.analytics.model;

import com.clinicqueue.appointment.model.QueueStatus;

/** Averages are over entries with both stamps and are null when there are none. */
public record QueueStatusRow(
    QueueStatus status, long count, Double averageWaitMinutes, Double averageServiceMinutes) {}
