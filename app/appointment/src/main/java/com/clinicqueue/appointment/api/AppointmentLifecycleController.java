/*
 * Where: Appointment API
 * What: Staff endpoints for check-in, completion, cancellation, reschedule and manual no-show
 * Why: Every status change goes through the lifecycle service so the transition table holds
 */
package com.clinicqueue.appointment.api;

import com.clinicqueue.appointment.api.request.CancelAppointmentRequest;
import com.clinicqueue.appointment.api.request.RescheduleAppointmentRequest;
import com.clinicqueue.appointment.api.response.AppointmentResponse;
import com.clinicqueue.appointment.api.response.RescheduleHistoryResponse;
import com.clinicqueue.appointment.api.response.RescheduleResponse;
import com.clinicqueue.appointment.config.RequestMdcInterceptor;
import com.clinicqueue.appointment.service.AppointmentLifecycleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/appointments/{appointment_id}")
@RequiredArgsConstructor
@Validated
public class AppointmentLifecycleController {

  private final AppointmentLifecycleService lifecycleService;

  @GetMapping
  public AppointmentResponse get(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId) {
    return AppointmentResponse.from(lifecycleService.get(appointmentId));
  }

  @PostMapping("/check-in")
  public ResponseEntity<AppointmentResponse> checkIn(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId) {
    return ResponseEntity.ok(AppointmentResponse.from(lifecycleService.checkIn(appointmentId)));
  }

  @PostMapping("/complete")
  public ResponseEntity<AppointmentResponse> complete(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId) {
    return ResponseEntity.ok(AppointmentResponse.from(lifecycleService.complete(appointmentId)));
  }

  @PostMapping("/cancel")
  public ResponseEntity<AppointmentResponse> cancel(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId,
      @Valid @RequestBody(required = false) CancelAppointmentRequest request) {
    final String reason = request == null ? null : request.reason();
    return ResponseEntity.ok(
        AppointmentResponse.from(lifecycleService.cancel(appointmentId, reason)));
  }

  @PostMapping("/reschedule")
  public ResponseEntity<RescheduleResponse> reschedule(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId,
      @RequestHeader(RequestMdcInterceptor.STAFF_ID_HEADER)
          @Positive(message = "X-Staff-Id must be positive")
          long staffId,
      @Valid @RequestBody RescheduleAppointmentRequest request) {
    return ResponseEntity.ok(
        RescheduleResponse.from(
            lifecycleService.reschedule(
                appointmentId, request.newScheduledAt(), staffId, request.reason())));
  }

  @PostMapping("/mark-no-show")
  public ResponseEntity<AppointmentResponse> markNoShow(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId) {
    return ResponseEntity.ok(
        AppointmentResponse.from(lifecycleService.markNoShowManually(appointmentId)));
  }

  @GetMapping("/reschedule-history")
  public RescheduleHistoryResponse rescheduleHistory(
      @PathVariable("appointment_id") @Positive(message = "appointment_id must be positive")
          long appointmentId) {
    return RescheduleHistoryResponse.of(
        appointmentId, lifecycleService.rescheduleHistory(appointmentId));
  }
}
