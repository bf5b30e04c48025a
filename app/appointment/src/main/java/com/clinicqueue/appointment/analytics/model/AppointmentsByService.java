package com.clinicqueue.appointment.analytics.model;

public record AppointmentsByService(
    long serviceId,
    String serviceName,
    long totalAppointments,
    long completedAppointments,
    double averageCompletionTime,
    int popularityRank,
    DemandTrend demandTrend) {}
