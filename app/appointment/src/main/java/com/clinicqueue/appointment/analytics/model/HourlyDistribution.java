package com.clinicqueue.appointment.analytics.model;

public record HourlyDistribution(
    int hour, long totalAppointments, double completionRate, double averageMinutesToAttend) {}
