/*
 * Where: Queue API
 * What: Puts checked-in appointments in line and moves entries through serving
 * Why: Counter numbers and wait estimates are only issued by the queue assigner
 */
package com.clinicqueue.appointment.api;

import com.clinicqueue.appointment.api.request.EnqueueRequest;
import com.clinicqueue.appointment.api.response.QueueEntryResponse;
import com.clinicqueue.appointment.service.QueueAssignerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
@Validated
public class QueueController {

  private final QueueAssignerService queueAssignerService;

  @PostMapping
  public ResponseEntity<QueueEntryResponse> enqueue(@Valid @RequestBody EnqueueRequest request) {
    final QueueEntryResponse response =
        QueueEntryResponse.from(
            queueAssignerService.enqueue(request.appointmentId(), request.servicePointId()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{entry_id}")
  public QueueEntryResponse get(
      @PathVariable("entry_id") @Positive(message = "entry_id must be positive") long entryId) {
    return QueueEntryResponse.from(queueAssignerService.get(entryId));
  }

  @PostMapping("/{entry_id}/call")
  public ResponseEntity<QueueEntryResponse> call(
      @PathVariable("entry_id") @Positive(message = "entry_id must be positive") long entryId) {
    return ResponseEntity.ok(QueueEntryResponse.from(queueAssignerService.call(entryId)));
  }

  @PostMapping("/{entry_id}/finish")
  public ResponseEntity<QueueEntryResponse> finish(
      @PathVariable("entry_id") @Positive(message = "entry_id must be positive") long entryId) {
    return ResponseEntity.ok(QueueEntryResponse.from(queueAssignerService.finish(entryId)));
  }
}
