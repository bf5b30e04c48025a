/*
 * Where: Appointment service layer
 * What: The only write path for appointment status (check-in, complete, cancel, reschedule, no-show)
 * Why: Staff actions, the queue and the no-show scan must all go through the same transition rules
 */
package com.clinicqueue.appointment.service;

import com.clinicqueue.appointment.api.AppointmentNotFoundException;
import com.clinicqueue.appointment.api.AppointmentPolicyViolationException;
import com.clinicqueue.appointment.api.AppointmentPolicyViolationException.Rule;
import com.clinicqueue.appointment.api.AppointmentSlotConflictException;
import com.clinicqueue.appointment.api.InvalidTransitionException;
import com.clinicqueue.appointment.config.CancellationPolicyProperties;
import com.clinicqueue.appointment.config.ReschedulePolicyProperties;
import com.clinicqueue.appointment.model.AppointmentAction;
import com.clinicqueue.appointment.model.AppointmentRecord;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.RescheduleHistoryRecord;
import com.clinicqueue.appointment.model.RescheduleResult;
import com.clinicqueue.appointment.repository.AppointmentRepository;
import com.clinicqueue.appointment.repository.RescheduleHistoryRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AppointmentLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(AppointmentLifecycleService.class);

  private static final String RESULT_OK = "ok";
  private static final String RESULT_REJECTED = "rejected";
  private static final String RESULT_CONFLICT = "conflict";

  private final AppointmentRepository appointmentRepository;
  private final RescheduleHistoryRepository rescheduleHistoryRepository;
  private final ReschedulePolicyProperties reschedulePolicy;
  private final CancellationPolicyProperties cancellationPolicy;
  private final AppointmentMetrics metrics;
  private final Clock clock;

  public AppointmentRecord get(long appointmentId) {
    return appointmentRepository
        .findById(appointmentId)
        .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
  }

  public AppointmentRecord checkIn(long appointmentId) {
    return checkIn(get(appointmentId));
  }

  public AppointmentRecord checkIn(AppointmentRecord appointment) {
    requireAllowed(appointment, AppointmentAction.CHECK_IN);
    final Instant now = Instant.now(clock);
    return applied(
        AppointmentAction.CHECK_IN,
        appointment,
        appointmentRepository.markCheckedIn(appointment.id(), now));
  }

  public AppointmentRecord complete(long appointmentId) {
    return complete(get(appointmentId));
  }

  public AppointmentRecord complete(AppointmentRecord appointment) {
    requireAllowed(appointment, AppointmentAction.COMPLETE);
    final Instant now = Instant.now(clock);
    return applied(
        AppointmentAction.COMPLETE,
        appointment,
        appointmentRepository.markCompleted(appointment.id(), now));
  }

  public AppointmentRecord cancel(long appointmentId, String reason) {
    return cancel(get(appointmentId), reason);
  }

  public AppointmentRecord cancel(AppointmentRecord appointment, String reason) {
    requireAllowed(appointment, AppointmentAction.CANCEL);
    final Instant now = Instant.now(clock);
    if (appointment.status() == AppointmentStatus.SCHEDULED) {
      requireCancellationNotice(appointment, now);
    }
    return applied(
        AppointmentAction.CANCEL,
        appointment,
        appointmentRepository.markCancelled(appointment.id(), appointment.status(), reason, now));
  }

  @Transactional
  public RescheduleResult reschedule(
      long appointmentId, Instant newScheduledAt, long actorId, String reason) {
    return reschedule(get(appointmentId), newScheduledAt, actorId, reason);
  }

  /**
   * Replaces a SCHEDULED appointment by a new row at {@code newScheduledAt}. The old row keeps
   * SCHEDULED and is marked superseded; the new row links back through rescheduledFromId.
   */
  @Transactional
  public RescheduleResult reschedule(
      AppointmentRecord appointment, Instant newScheduledAt, long actorId, String reason) {
    requireAllowed(appointment, AppointmentAction.RESCHEDULE);
    final Instant now = Instant.now(clock);
    if (newScheduledAt == null || !newScheduledAt.isAfter(now)) {
      metrics.recordTransition(AppointmentAction.RESCHEDULE, RESULT_REJECTED);
      throw new IllegalArgumentException("new scheduled time must be in the future");
    }
    requireReschedulePolicy(appointment, newScheduledAt, now);
    if (!appointment.hasConsistentContact()) {
      metrics.recordTransition(AppointmentAction.RESCHEDULE, RESULT_REJECTED);
      throw new IllegalArgumentException(
          "public appointment " + appointment.id() + " needs guest name and email and no user");
    }
    if (appointmentRepository.existsActiveAtSlot(
        appointment.serviceId(), appointment.branchId(), newScheduledAt, appointment.id())) {
      metrics.recordTransition(AppointmentAction.RESCHEDULE, RESULT_REJECTED);
      throw new AppointmentSlotConflictException(
          appointment.serviceId(), appointment.branchId(), newScheduledAt);
    }
    final AppointmentRecord superseded =
        applied(
            AppointmentAction.RESCHEDULE,
            appointment,
            appointmentRepository.markSuperseded(
                appointment.id(), actorId, reason, appointment.firstScheduledAt(), now));
    final AppointmentRecord replacement =
        appointmentRepository.insert(
            appointment.rescheduledTo(newScheduledAt, actorId, reason, now));
    rescheduleHistoryRepository.insert(
        new RescheduleHistoryRecord(
            null,
            superseded.id(),
            replacement.id(),
            appointment.scheduledAt(),
            newScheduledAt,
            actorId,
            reason,
            now));
    logger.info(
        "appointment rescheduled from_id={} to_id={} scheduled_at={} actor_id={}",
        superseded.id(),
        replacement.id(),
        newScheduledAt,
        actorId);
    return new RescheduleResult(superseded, replacement);
  }

  /**
   * Marks a SCHEDULED appointment as no-show. Returns false without touching the row when it is
   * not SCHEDULED, already marked, superseded, or was claimed concurrently.
   */
  public boolean markNoShow(AppointmentRecord appointment, boolean automatic) {
    return tryMarkNoShow(appointment, automatic).isPresent();
  }

  /** Staff variant: a state that cannot be marked is an error instead of a no-op. */
  public AppointmentRecord markNoShowManually(long appointmentId) {
    final AppointmentRecord appointment = get(appointmentId);
    requireAllowed(appointment, AppointmentAction.MARK_NO_SHOW);
    if (appointment.noShowMarkedAt() != null) {
      metrics.recordTransition(AppointmentAction.MARK_NO_SHOW, RESULT_REJECTED);
      throw new InvalidTransitionException(
          "appointment " + appointmentId + " is already marked as no-show");
    }
    return tryMarkNoShow(appointment, false)
        .orElseThrow(
            () -> {
              metrics.recordTransition(AppointmentAction.MARK_NO_SHOW, RESULT_CONFLICT);
              return new InvalidTransitionException(
                  "appointment " + appointmentId + " changed while marking no-show");
            });
  }

  /** All reschedule history rows of the chain that contains the appointment, oldest first. */
  public List<RescheduleHistoryRecord> rescheduleHistory(long appointmentId) {
    final AppointmentRecord appointment = get(appointmentId);
    final List<Long> chainIds = new ArrayList<>();
    final Set<Long> visited = new HashSet<>();
    AppointmentRecord cursor = appointment;
    // walk back to the first booking
    while (cursor.rescheduledFromId() != null && visited.add(cursor.id())) {
      final Optional<AppointmentRecord> previous =
          appointmentRepository.findById(cursor.rescheduledFromId());
      if (previous.isEmpty()) {
        break;
      }
      cursor = previous.get();
    }
    visited.clear();
    // then forward through every replacement
    Optional<AppointmentRecord> next = Optional.of(cursor);
    while (next.isPresent() && visited.add(next.get().id())) {
      chainIds.add(next.get().id());
      next = appointmentRepository.findByRescheduledFromId(next.get().id());
    }
    return rescheduleHistoryRepository.findByToAppointmentIds(chainIds);
  }

  private Optional<AppointmentRecord> tryMarkNoShow(
      AppointmentRecord appointment, boolean automatic) {
    if (appointment.status() != AppointmentStatus.SCHEDULED
        || appointment.noShowMarkedAt() != null
        || appointment.isSuperseded()) {
      logger.debug(
          "no-show mark skipped appointment_id={} status={} superseded={}",
          appointment.id(),
          appointment.status(),
          appointment.isSuperseded());
      return Optional.empty();
    }
    final Instant now = Instant.now(clock);
    final Optional<AppointmentRecord> marked =
        appointmentRepository.markNoShow(appointment.id(), automatic, now);
    if (marked.isPresent()) {
      metrics.recordTransition(AppointmentAction.MARK_NO_SHOW, RESULT_OK);
      metrics.recordNoShowMarked(automatic);
      logger.info(
          "appointment marked as no-show appointment_id={} scheduled_at={} automatic={}",
          appointment.id(),
          appointment.scheduledAt(),
          automatic);
    } else {
      logger.debug("no-show mark lost to a concurrent update appointment_id={}", appointment.id());
    }
    return marked;
  }

  private void requireCancellationNotice(AppointmentRecord appointment, Instant now) {
    if (!appointment.scheduledAt().isAfter(now)) {
      throw policyViolation(
          AppointmentAction.CANCEL,
          Rule.PAST_APPOINTMENT,
          "appointment " + appointment.id() + " has already started");
    }
    if (appointment.scheduledAt().isBefore(now.plus(cancellationPolicy.minNotice()))) {
      throw policyViolation(
          AppointmentAction.CANCEL,
          Rule.INSUFFICIENT_CANCELLATION_NOTICE,
          "appointments must be cancelled at least "
              + cancellationPolicy.minHours()
              + " hours in advance");
    }
  }

  private void requireReschedulePolicy(
      AppointmentRecord appointment, Instant newScheduledAt, Instant now) {
    if (!appointment.scheduledAt().isAfter(now)) {
      throw policyViolation(
          AppointmentAction.RESCHEDULE,
          Rule.PAST_APPOINTMENT,
          "appointment " + appointment.id() + " has already started");
    }
    final Instant earliest = now.plus(reschedulePolicy.minNotice());
    if (newScheduledAt.isBefore(earliest)) {
      throw policyViolation(
          AppointmentAction.RESCHEDULE,
          Rule.INSUFFICIENT_RESCHEDULE_TIME,
          "new scheduled time must be at least " + reschedulePolicy.minHours() + " hours away");
    }
    if (appointment.scheduledAt().isBefore(earliest)) {
      throw policyViolation(
          AppointmentAction.RESCHEDULE,
          Rule.TOO_LATE_TO_RESCHEDULE,
          "appointment "
              + appointment.id()
              + " starts in less than "
              + reschedulePolicy.minHours()
              + " hours");
    }
    final int previous = rescheduleHistoryRepository.countPriorReschedules(appointment.id());
    if (previous >= reschedulePolicy.maxPerChain()) {
      throw policyViolation(
          AppointmentAction.RESCHEDULE,
          Rule.MAX_RESCHEDULES_EXCEEDED,
          "appointment was already rescheduled " + previous + " times");
    }
  }

  private AppointmentPolicyViolationException policyViolation(
      AppointmentAction action, Rule rule, String message) {
    metrics.recordTransition(action, RESULT_REJECTED);
    return new AppointmentPolicyViolationException(rule, message);
  }

  private void requireAllowed(AppointmentRecord appointment, AppointmentAction action) {
    if (appointment.isSuperseded()) {
      metrics.recordTransition(action, RESULT_REJECTED);
      throw new InvalidTransitionException(
          "appointment " + appointment.id() + " was replaced by a reschedule");
    }
    if (!action.isAllowedFrom(appointment.status())) {
      metrics.recordTransition(action, RESULT_REJECTED);
      throw new InvalidTransitionException(
          "cannot "
              + action.label()
              + " appointment "
              + appointment.id()
              + " in status "
              + appointment.status());
    }
  }

  private AppointmentRecord applied(
      AppointmentAction action, AppointmentRecord before, Optional<AppointmentRecord> after) {
    if (after.isEmpty()) {
      metrics.recordTransition(action, RESULT_CONFLICT);
      throw new InvalidTransitionException(
          "appointment " + before.id() + " changed before it could " + action.label());
    }
    metrics.recordTransition(action, RESULT_OK);
    logger.info(
        "appointment transition applied appointment_id={} action={} from={} to={}",
        before.id(),
        action.metricName(),
        before.status(),
        after.get().status());
    return after.get();
  }
}
