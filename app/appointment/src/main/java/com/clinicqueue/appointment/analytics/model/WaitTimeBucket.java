package com.clinicqueue.appointment.analytics.model;

public record WaitTimeBucket(String range, int count, int percentage) {}
