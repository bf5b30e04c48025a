package com.clinicqueue.appointment.api;

public class QueueEntryNotFoundException extends RuntimeException {

  public QueueEntryNotFoundException(long entryId) {
    super("queue entry not found: " + entryId);
  }
}
