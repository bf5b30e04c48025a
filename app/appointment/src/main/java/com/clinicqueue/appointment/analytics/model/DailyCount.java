package com.clinicqueue.appointment.analytics.model;

import java.time.LocalDate;

public record DailyCount(LocalDate date, long count) {}
