package com.clinicqueue.appointment.analytics.model;

public record HourlyRow(int hour, long total, long completed, Double averageMinutesToAttend) {}
