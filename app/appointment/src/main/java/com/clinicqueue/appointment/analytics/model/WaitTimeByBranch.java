package com.clinicqueue.appointment.analytics.model;

public record WaitTimeByBranch(
    long branchId,
    String branchName,
    TimeMetrics waitTime,
    TimeMetrics serviceTime,
    int totalProcessed) {}
