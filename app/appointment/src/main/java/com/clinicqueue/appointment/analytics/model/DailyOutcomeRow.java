package com.clinicqueue.appointment.analytics.model;

import java.time.LocalDate;

public record DailyOutcomeRow(
    LocalDate date, long total, long checkedIn, long completed, long cancelled, long noShow) {}
