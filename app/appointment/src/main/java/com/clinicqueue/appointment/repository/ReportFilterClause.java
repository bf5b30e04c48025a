package com.clinicqueue.appointment.repository;

import com.clinicqueue.appointment.model.ReportFilters;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/** Appends the optional branch/service/service point conditions of a report to a WHERE clause. */
final class ReportFilterClause {

  private ReportFilterClause() {}

  static String conditions(
      ReportFilters filters, String appointmentAlias, MapSqlParameterSource params) {
    final StringBuilder sql = new StringBuilder();
    if (filters.branchId() != null) {
      sql.append(" AND ").append(appointmentAlias).append(".branch_id = :branchId");
      params.addValue("branchId", filters.branchId());
    }
    if (filters.serviceId() != null) {
      sql.append(" AND ").append(appointmentAlias).append(".service_id = :serviceId");
      params.addValue("serviceId", filters.serviceId());
    }
    if (filters.servicePointId() != null) {
      sql.append(" AND ").append(appointmentAlias).append(".service_point_id = :servicePointId");
      params.addValue("servicePointId", filters.servicePointId());
    }
    return sql.toString();
  }
}
