package com.clinicqueue.appointment.analytics;

import com.clinicqueue.appointment.config.ReportProperties;
import com.clinicqueue.appointment.model.DateRange;
import com.clinicqueue.appointment.model.ReportFilters;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds report filters from calendar dates in the configured report zone. */
@Component
@RequiredArgsConstructor
public class ReportFilterFactory {

  private final ReportProperties reportProperties;

  public ReportFilters create(
      LocalDate startDate, LocalDate endDate, Long branchId, Long serviceId, Long servicePointId) {
    return new ReportFilters(
        DateRange.ofDays(startDate, endDate, reportProperties.zone()),
        branchId,
        serviceId,
        servicePointId);
  }
}
