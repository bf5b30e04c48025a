/*
 * Where: Queue domain model
 * What: The context a turn counter is unique within
 * Why: Counters restart per branch, service and business day
 */
package com.clinicqueue.appointment.model;

import java.time.LocalDate;

public record QueueScope(long branchId, long serviceId, LocalDate businessDate) {}
