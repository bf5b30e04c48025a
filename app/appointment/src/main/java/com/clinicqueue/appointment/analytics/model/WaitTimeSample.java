package com.clinicqueue.appointment.analytics.model;

public record WaitTimeSample(int waitMinutes, int serviceMinutes) {}
