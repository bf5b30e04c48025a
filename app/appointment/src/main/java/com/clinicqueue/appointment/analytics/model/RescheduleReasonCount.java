package com.clinicqueue.appointment.analytics.model;

public record RescheduleReasonCount(String reason, long count, double percentage) {}
