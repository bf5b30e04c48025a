package com.clinicqueue.appointment.analytics.model;

public record WaitTimeByServicePoint(
    long servicePointId,
    String servicePointName,
    long branchId,
    String branchName,
    TimeMetrics waitTime,
    TimeMetrics serviceTime,
    int totalProcessed) {}
