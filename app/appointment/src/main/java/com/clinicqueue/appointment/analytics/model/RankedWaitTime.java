package com.clinicqueue.appointment.analytics.model;

/** One of the fastest branches or services, with the valid samples its average came from. */
public record RankedWaitTime(long id, String name, int averageWaitTime, int totalProcessed) {}
