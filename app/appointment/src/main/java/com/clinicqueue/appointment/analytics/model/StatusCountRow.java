package com.clinicqueue.appointment.analytics.model;

import com.clinicqueue.appointment.model.AppointmentStatus;

public record StatusCountRow(AppointmentStatus status, long count) {}
