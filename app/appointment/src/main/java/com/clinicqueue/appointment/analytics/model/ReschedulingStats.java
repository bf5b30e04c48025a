package com.clinicqueue.appointment.analytics.model;

import java.util.List;

/**
 * @param averageLeadDays mean days between the moment of rescheduling and the slot it replaced
 */
public record ReschedulingStats(
    long totalReschedules,
    double rescheduleRate,
    double averageLeadDays,
    List<RescheduleReasonCount> topReasons,
    List<DailyCount> dailyTrend) {}
