package com.clinicqueue.appointment.model;

public enum QueueStatus {
  WAITING,
  SERVING,
  COMPLETE
}
