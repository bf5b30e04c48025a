/*
 * Where: Queue service layer
 * What: Puts checked-in appointments in line and moves entries through call and finish
 * Why: Turn numbers, position and wait estimates come from one place
 */
package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.api.InvalidTransitionException;
import com.clinicqueue.appointment.api.QueueEntryNotFoundException;
import com.clinicqueue.appointment.config.QueueProperties;
import com.clinicqueue.appointment.model.AppointmentRecord;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.QueueAssignment;
import com.clinicqueue.appointment.model.QueueEntryRecord;
import com.clinicqueue.appointment.model.QueueScope;
import com.clinicqueue.appointment.model.QueueStatus;
import com.clinicqueue.appointment.repository.AppointmentRepository;
import com.clinicqueue.appointment.repository.QueueEntryRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class QueueAssignerService {

  private static final Logger logger = LoggerFactory.getLogger(QueueAssignerService.class);

  private final QueueEntryRepository queueEntryRepository;
  private final AppointmentRepository appointmentRepository;
  private final AppointmentLifecycleService lifecycleService;
  private final QueueProperties queueProperties;
  private final Clock clock;

  @Transactional
  public QueueAssignment enqueue(long appointmentId, Long servicePointId) {
    return enqueue(lifecycleService.get(appointmentId), servicePointId);
  }

  @Transactional
  public QueueAssignment enqueue(AppointmentRecord appointment, Long servicePointId) {
    if (appointment.status() != AppointmentStatus.CHECKED_IN) {
      throw new InvalidTransitionException(
          "appointment "
              + appointment.id()
              + " must be checked in before joining the queue, status is "
              + appointment.status());
    }
    if (queueEntryRepository.findByAppointmentId(appointment.id()).isPresent()) {
      throw new InvalidTransitionException("appointment " + appointment.id() + " is already queued");
    }
    final Instant now = Instant.now(clock);
    final LocalDate businessDate = LocalDate.ofInstant(now, queueProperties.zone());
    final QueueScope scope =
        new QueueScope(appointment.branchId(), appointment.serviceId(), businessDate);
    final int counter = queueEntryRepository.nextCounter(scope);
    final QueueEntryRecord entry =
        queueEntryRepository.insert(
            new QueueEntryRecord(
                null,
                appointment.id(),
                scope.branchId(),
                scope.serviceId(),
                scope.businessDate(),
                counter,
                QueueStatus.WAITING,
                now,
                null,
                null));
    if (servicePointId != null) {
      appointmentRepository.assignServicePoint(appointment.id(), servicePointId, now);
    }
    final int position = queueEntryRepository.countWaitingAhead(entry);
    final double averageServiceMinutes =
        queueEntryRepository
            .averageServiceMinutes(
                appointment.serviceId(), now.minus(queueProperties.serviceTimeLookback()))
            .orElse((double) queueProperties.defaultServiceMinutes());
    final long estimatedWaitMinutes = Math.round(position * averageServiceMinutes);
    logger.info(
        "appointment queued appointment_id={} entry_id={} counter={} position={} estimated_wait_minutes={}",
        appointment.id(),
        entry.id(),
        counter,
        position,
        estimatedWaitMinutes);
    return new QueueAssignment(entry, position, estimatedWaitMinutes);
  }

  public QueueEntryRecord call(long entryId) {
    final QueueEntryRecord entry = get(entryId);
    if (entry.status() != QueueStatus.WAITING) {
      throw new InvalidTransitionException(
          "queue entry " + entryId + " cannot be called in status " + entry.status());
    }
    final QueueEntryRecord called =
        queueEntryRepository
            .markServing(entryId, Instant.now(clock))
            .orElseThrow(
                () -> new InvalidTransitionException("queue entry " + entryId + " was already called"));
    logger.info("queue entry called entry_id={} counter={}", entryId, called.counter());
    return called;
  }

  /** SERVING -> COMPLETE, then completes the owning appointment if it is still checked in. */
  @Transactional
  public QueueEntryRecord finish(long entryId) {
    final QueueEntryRecord entry = get(entryId);
    if (entry.status() != QueueStatus.SERVING) {
      throw new InvalidTransitionException(
          "queue entry " + entryId + " cannot be finished in status " + entry.status());
    }
    final QueueEntryRecord finished =
        queueEntryRepository
            .markComplete(entryId, Instant.now(clock))
            .orElseThrow(
                () ->
                    new InvalidTransitionException("queue entry " + entryId + " was already finished"));
    final AppointmentRecord appointment = lifecycleService.get(finished.appointmentId());
    if (appointment.status() == AppointmentStatus.CHECKED_IN) {
      lifecycleService.complete(appointment);
    }
    logger.info(
        "queue entry finished entry_id={} appointment_id={}", entryId, finished.appointmentId());
    return finished;
  }

  public QueueEntryRecord get(long entryId) {
    return queueEntryRepository
        .findById(entryId)
        .orElseThrow(() -> new QueueEntryNotFoundException(entryId));
  }
}
