package com.clinicqueue.appointment.model;

import java.util.Objects;

/** Report window plus optional narrowing by branch, service and service point. */
public record ReportFilters(
    DateRange dateRange, Long branchId, Long serviceId, Long servicePointId) {

  public ReportFilters {
    Objects.requireNonNull(dateRange, "dateRange");
  }

  public static ReportFilters of(DateRange dateRange) {
    return new ReportFilters(dateRange, null, null, null);
  }

  public ReportFilters withoutBranch() {
    return new ReportFilters(dateRange, null, serviceId, servicePointId);
  }

  public ReportFilters withoutService() {
    return new ReportFilters(dateRange, branchId, null, servicePointId);
  }
}
