/*
 * Where: Appointment analytics data access
 * What: Grouped outcome counts for reports and the no-show listing
 * Why: One typed row per query shape; rates and rankings are derived in the service
 */
package com.clinicqueue.appointment.repository;

import static com.clinicqueue.common.JdbcTimestampUtils.getInstant;
import static com.clinicqueue.common.JdbcTimestampUtils.getNullableLong;
import static com.clinicqueue.common.JdbcTimestampUtils.toTimestamp;

import com.clinicqueue.appointment.analytics.model.BranchOutcomeRow;
import com.clinicqueue.appointment.analytics.model.DailyCount;
import com.clinicqueue.appointment.analytics.model.DailyOutcomeRow;
import com.clinicqueue.appointment.analytics.model.HourlyRow;
import com.clinicqueue.appointment.analytics.model.NoShowReportRow;
import com.clinicqueue.appointment.analytics.model.QueueStatusRow;
import com.clinicqueue.appointment.analytics.model.RescheduleReasonCount;
import com.clinicqueue.appointment.analytics.model.ServiceOutcomeRow;
import com.clinicqueue.appointment.analytics.model.StatusCountRow;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.QueueStatus;
import com.clinicqueue.appointment.model.ReportFilters;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AppointmentReportRepository {

  private static final int TOP_REASON_LIMIT = 5;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<StatusCountRow> countByStatus(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT a.status, COUNT(*) AS total
        FROM appointments a
        WHERE a.scheduled_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY a.status";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new StatusCountRow(
                AppointmentStatus.valueOf(rs.getString("status")), rs.getLong("total")));
  }

  /** Replacement rows created by a reschedule inside the window. */
  public long countRescheduled(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT COUNT(*)
        FROM appointments a
        WHERE a.rescheduled_from_id IS NOT NULL
          AND a.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public Map<Long, Long> countRescheduledByBranch(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT a.branch_id, COUNT(*) AS total
        FROM appointments a
        WHERE a.rescheduled_from_id IS NOT NULL
          AND a.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY a.branch_id";
    final Map<Long, Long> counts = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(rs.getLong("branch_id"), rs.getLong("total"));
        });
    return counts;
  }

  public List<BranchOutcomeRow> countByBranch(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT a.branch_id,
               b.name AS branch_name,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE a.status = 'CHECKED_IN') AS checked_in,
               COUNT(*) FILTER (WHERE a.status = 'COMPLETED') AS completed,
               COUNT(*) FILTER (WHERE a.status = 'CANCELLED') AS cancelled,
               COUNT(*) FILTER (WHERE a.status = 'NO_SHOW') AS no_show
        FROM appointments a
        JOIN branches b ON b.id = a.branch_id
        WHERE a.scheduled_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY a.branch_id, b.name ORDER BY total DESC, a.branch_id";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new BranchOutcomeRow(
                rs.getLong("branch_id"),
                rs.getString("branch_name"),
                rs.getLong("total"),
                rs.getLong("checked_in"),
                rs.getLong("completed"),
                rs.getLong("cancelled"),
                rs.getLong("no_show")));
  }

  /** Ordered by appointment count, most requested first. */
  public List<ServiceOutcomeRow> countByService(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT a.service_id,
               s.name AS service_name,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE a.status = 'COMPLETED') AS completed,
               AVG(EXTRACT(EPOCH FROM (a.attended_at - a.scheduled_at)) / 60.0)
                 FILTER (WHERE a.attended_at IS NOT NULL) AS avg_completion_minutes
        FROM appointments a
        JOIN services s ON s.id = a.service_id
        WHERE a.scheduled_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY a.service_id, s.name ORDER BY total DESC, a.service_id";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new ServiceOutcomeRow(
                rs.getLong("service_id"),
                rs.getString("service_name"),
                rs.getLong("total"),
                rs.getLong("completed"),
                getNullableDouble(rs, "avg_completion_minutes")));
  }

  /** Queue entries created in the window, per status. */
  public List<QueueStatusRow> queueStatusCounts(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT q.status,
               COUNT(*) AS total,
               AVG(EXTRACT(EPOCH FROM (q.called_at - q.created_at)) / 60.0)
                 FILTER (WHERE q.called_at IS NOT NULL) AS avg_wait_minutes,
               AVG(EXTRACT(EPOCH FROM (q.completed_at - q.called_at)) / 60.0)
                 FILTER (WHERE q.called_at IS NOT NULL AND q.completed_at IS NOT NULL)
                 AS avg_service_minutes
        FROM queue_entries q
        JOIN appointments a ON a.id = q.appointment_id
        WHERE q.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY q.status";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new QueueStatusRow(
                QueueStatus.valueOf(rs.getString("status")),
                rs.getLong("total"),
                getNullableDouble(rs, "avg_wait_minutes"),
                getNullableDouble(rs, "avg_service_minutes")));
  }

  /** Count of reschedules recorded in the window and their mean lead time in days. */
  public RescheduleTotals rescheduleTotals(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters);
    final String sql =
        """
        SELECT COUNT(*) AS total,
               AVG(EXTRACT(EPOCH FROM (h.original_scheduled_at - h.created_at)) / 86400.0)
                 AS avg_lead_days
        FROM appointment_reschedules h
        JOIN appointments a ON a.id = h.to_appointment_id
        WHERE h.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params);
    final List<RescheduleTotals> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new RescheduleTotals(rs.getLong("total"), getNullableDouble(rs, "avg_lead_days")));
    return rows.isEmpty() ? new RescheduleTotals(0L, null) : rows.get(0);
  }

  /** Most frequent non-null reasons; percentage is left to the caller. */
  public List<RescheduleReasonCount> topRescheduleReasons(ReportFilters filters) {
    final MapSqlParameterSource params = windowParams(filters).addValue("limit", TOP_REASON_LIMIT);
    final String sql =
        """
        SELECT h.reason, COUNT(*) AS total
        FROM appointment_reschedules h
        JOIN appointments a ON a.id = h.to_appointment_id
        WHERE h.created_at BETWEEN :start AND :end
          AND h.reason IS NOT NULL
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY h.reason ORDER BY total DESC, h.reason LIMIT :limit";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new RescheduleReasonCount(rs.getString("reason"), rs.getLong("total"), 0d));
  }

  public List<DailyCount> dailyReschedules(ReportFilters filters, ZoneId zone) {
    final MapSqlParameterSource params = windowParams(filters).addValue("zone", zone.getId());
    final String sql =
        """
        SELECT CAST(h.created_at AT TIME ZONE :zone AS DATE) AS day, COUNT(*) AS total
        FROM appointment_reschedules h
        JOIN appointments a ON a.id = h.to_appointment_id
        WHERE h.created_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY 1 ORDER BY 1";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new DailyCount(rs.getDate("day").toLocalDate(), rs.getLong("total")));
  }

  public List<HourlyRow> hourlyCounts(ReportFilters filters, ZoneId zone) {
    final MapSqlParameterSource params = windowParams(filters).addValue("zone", zone.getId());
    final String sql =
        """
        SELECT CAST(EXTRACT(HOUR FROM a.scheduled_at AT TIME ZONE :zone) AS INTEGER) AS hour_of_day,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE a.status = 'COMPLETED') AS completed,
               AVG(EXTRACT(EPOCH FROM (a.attended_at - a.scheduled_at)) / 60.0)
                 FILTER (WHERE a.attended_at IS NOT NULL) AS avg_minutes_to_attend
        FROM appointments a
        WHERE a.scheduled_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY 1 ORDER BY 1";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new HourlyRow(
                rs.getInt("hour_of_day"),
                rs.getLong("total"),
                rs.getLong("completed"),
                getNullableDouble(rs, "avg_minutes_to_attend")));
  }

  public List<DailyOutcomeRow> dailyCounts(ReportFilters filters, ZoneId zone) {
    final MapSqlParameterSource params = windowParams(filters).addValue("zone", zone.getId());
    final String sql =
        """
        SELECT CAST(a.scheduled_at AT TIME ZONE :zone AS DATE) AS day,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE a.status = 'CHECKED_IN') AS checked_in,
               COUNT(*) FILTER (WHERE a.status = 'COMPLETED') AS completed,
               COUNT(*) FILTER (WHERE a.status = 'CANCELLED') AS cancelled,
               COUNT(*) FILTER (WHERE a.status = 'NO_SHOW') AS no_show
        FROM appointments a
        WHERE a.scheduled_at BETWEEN :start AND :end
        """
            + ReportFilterClause.conditions(filters, "a", params)
            + " GROUP BY 1 ORDER BY 1";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new DailyOutcomeRow(
                rs.getDate("day").toLocalDate(),
                rs.getLong("total"),
                rs.getLong("checked_in"),
                rs.getLong("completed"),
                rs.getLong("cancelled"),
                rs.getLong("no_show")));
  }

  /** NO_SHOW rows marked inside the window, newest mark first. */
  public List<NoShowReportRow> findNoShows(ReportFilters filters, Boolean autoMarked) {
    final MapSqlParameterSource params = windowParams(filters);
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT a.id,
                   a.confirmation_code,
                   a.scheduled_at,
                   a.no_show_marked_at,
                   a.auto_marked_as_no_show,
                   a.branch_id,
                   b.name AS branch_name,
                   a.service_id,
                   s.name AS service_name,
                   a.user_id,
                   a.guest_name,
                   a.guest_email
            FROM appointments a
            JOIN branches b ON b.id = a.branch_id
            JOIN services s ON s.id = a.service_id
            WHERE a.status = 'NO_SHOW'
              AND a.no_show_marked_at BETWEEN :start AND :end
            """);
    sql.append(ReportFilterClause.conditions(filters, "a", params));
    if (autoMarked != null) {
      sql.append(" AND a.auto_marked_as_no_show = :autoMarked");
      params.addValue("autoMarked", autoMarked);
    }
    sql.append(" ORDER BY a.no_show_marked_at DESC, a.id DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapNoShowRow);
  }

  private MapSqlParameterSource windowParams(ReportFilters filters) {
    return new MapSqlParameterSource()
        .addValue("start", toTimestamp(filters.dateRange().start()))
        .addValue("end", toTimestamp(filters.dateRange().end()));
  }

  private NoShowReportRow mapNoShowRow(ResultSet rs, int rowNum) throws SQLException {
    return new NoShowReportRow(
        rs.getLong("id"),
        rs.getString("confirmation_code"),
        getInstant(rs, "scheduled_at"),
        getInstant(rs, "no_show_marked_at"),
        rs.getBoolean("auto_marked_as_no_show"),
        rs.getLong("branch_id"),
        rs.getString("branch_name"),
        rs.getLong("service_id"),
        rs.getString("service_name"),
        getNullableLong(rs, "user_id"),
        rs.getString("guest_name"),
        rs.getString("guest_email"));
  }

  private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
    final double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  public record RescheduleTotals(long total, Double averageLeadDays) {}
}
