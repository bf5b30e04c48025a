package com.clinicqueue.appointment.analytics.model;

public record AppointmentsByBranch(
    long branchId,
    String branchName,
    long totalAppointments,
    long completedAppointments,
    long cancelledAppointments,
    long noShowAppointments,
    long rescheduledAppointments,
    double attendanceRate,
    double averageAppointmentsPerDay) {}
