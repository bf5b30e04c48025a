package com.clinicqueue.appointment.analytics.model;

public record WaitTimeByService(
    long serviceId,
    String serviceName,
    long branchId,
    String branchName,
    TimeMetrics waitTime,
    TimeMetrics serviceTime,
    int totalProcessed) {}
