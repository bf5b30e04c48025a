package com.clinicqueue.appointment.analytics.model;

public record QueueStatistics(
    long totalQueues,
    long waitingQueues,
    long servingQueues,
    long completedQueues,
    double averageWaitTime,
    double averageServiceTime,
    double queueEfficiency) {}
