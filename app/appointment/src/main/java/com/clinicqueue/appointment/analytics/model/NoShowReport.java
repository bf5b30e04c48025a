package com.clinicqueue.appointment.analytics.model;

import java.util.List;

public record NoShowReport(List<NoShowReportRow> appointments, int total) {}
