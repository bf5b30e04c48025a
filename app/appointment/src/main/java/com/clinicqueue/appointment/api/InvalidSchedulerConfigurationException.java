package com.clinicqueue.appointment.api;

public class InvalidSchedulerConfigurationException extends RuntimeException {

  public InvalidSchedulerConfigurationException(String message) {
    super(message);
  }
}
