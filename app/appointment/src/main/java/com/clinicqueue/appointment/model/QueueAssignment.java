package com.clinicqueue.appointment.model;

/**
 * Result of putting an appointment in line.
 *
 * @param position number of entries still waiting ahead of this one
 * @param estimatedWaitMinutes position times the historical average service time
 */
public record QueueAssignment(QueueEntryRecord entry, int position, long estimatedWaitMinutes) {}
