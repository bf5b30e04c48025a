/*
 * Where: Wait-time analytics data access
 * What: Loads called and completed queue entries with their grouping names
 * Why: Sample validation and grouping happen in Java so rejected rows can be logged and counted
 */
package com.clinicqueue.appointment.repository;

import static com.clinicqueue.common.JdbcTimestampUtils.getInstant;
import static com.clinicqueue.common.JdbcTimestampUtils.getNullableLong;
import static com.clinicqueue.common.JdbcTimestampUtils.toTimestamp;

import com.clinicqueue.appointment.analytics.model.QueueTimingRow;
import com.clinicqueue.appointment.model.ReportFilters;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QueueTimingRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Entries created in the window that have both a call and a completion stamp. */
  public List<QueueTimingRow> findCompletedTimings(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT q.id,
               a.branch_id,
               b.name AS branch_name,
               a.service_id,
               s.name AS service_name,
               a.service_point_id,
               sp.name AS service_point_name,
               q.created_at,
               q.called_at,
               q.completed_at
        FROM queue_entries q
        JOIN appointments a ON a.id = q.appointment_id
        JOIN branches b ON b.id = a.branch_id
        JOIN services s ON s.id = a.service_id
        LEFT JOIN service_points sp ON sp.id = a.service_point_id
        WHERE q.created_at BETWEEN :start AND :end
          AND q.called_at IS NOT NULL
          AND q.completed_at IS NOT NULL
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " ORDER BY q.created_at, q.id";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** All entries created in the window, whatever their status. */
  public long countEntries(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT COUNT(*)
        FROM queue_entries q
        JOIN appointments a ON a.id = q.appointment_id
        WHERE q.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private MapSqlParameterSource windowParams(ReportFilters filters) {
    return new MapSqlParameterSource()
        .addValue("start", toTimestamp(filters.dateRange().start()))
        .addValue("end", toTimestamp(filters.dateRange().end()));
  }

  private QueueTimingRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QueueTimingRow(
        rs.getLong("id"),
        rs.getLong("branch_id"),
        rs.getString("branch_name"),
        rs.getLong("service_id"),
        rs.getString("service_name"),
        getNullableLong(rs, "service_point_id"),
        rs.getString("service_point_name"),
        getInstant(rs, "created_at"),
        getInstant(rs, "called_at"),
        getInstant(rs, "completed_at"));
  }
}
