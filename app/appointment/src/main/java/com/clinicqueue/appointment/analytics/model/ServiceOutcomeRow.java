package com.clinicqueue.appointment.analytics.model;

/** @param averageCompletionMinutes null when no appointment of the service was attended */
public record ServiceOutcomeRow(
    long serviceId,
    String serviceName,
    long total,
    long completed,
    Double averageCompletionMinutes) {}
