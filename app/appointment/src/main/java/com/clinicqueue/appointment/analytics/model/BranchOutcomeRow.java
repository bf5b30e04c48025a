package com.clinicqueue.appointment.analytics.model;

public record BranchOutcomeRow(
    long branchId,
    String branchName,
    long total,
    long checkedIn,
    long completed,
    long cancelled,
    long noShow) {}
