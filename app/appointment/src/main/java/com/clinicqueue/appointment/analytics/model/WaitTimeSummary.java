package com.clinicqueue.appointment.analytics.model;

import java.util.List;

public record WaitTimeSummary(
    long totalQueues,
    int completedQueues,
    int averageWaitTime,
    int averageServiceTime,
    List<RankedWaitTime> topBranches,
    List<RankedWaitTime> topServices,
    List<WaitTimeBucket> waitTimeDistribution) {}
