package com.clinicqueue.appointment.repository;

import static com.clinicqueue.common.JdbcTimestampUtils.getInstant;
import static com.clinicqueue.common.JdbcTimestampUtils.toTimestamp;

import com.clinicqueue.appointment.model.RescheduleHistoryRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RescheduleHistoryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public RescheduleHistoryRecord insert(RescheduleHistoryRecord history) {
    final String sql =
        """
        INSERT INTO appointment_reschedules (
          from_appointment_id, to_appointment_id, original_scheduled_at, new_scheduled_at,
          rescheduled_by_id, reason, created_at
        ) VALUES (
          :fromId, :toId, :originalScheduledAt, :newScheduledAt,
          :rescheduledById, :reason, :createdAt
        )
        RETURNING id, from_appointment_id, to_appointment_id, original_scheduled_at,
          new_scheduled_at, rescheduled_by_id, reason, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fromId", history.fromAppointmentId())
            .addValue("toId", history.toAppointmentId())
            .addValue("originalScheduledAt", toTimestamp(history.originalScheduledAt()))
            .addValue("newScheduledAt", toTimestamp(history.newScheduledAt()))
            .addValue("rescheduledById", history.rescheduledById())
            .addValue("reason", history.reason())
            .addValue("createdAt", toTimestamp(history.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /** Reschedules that led up to {@code appointmentId}, following the chain back to the first booking. */
  public int countPriorReschedules(long appointmentId) {
    final String sql =
        """
        WITH RECURSIVE chain (from_appointment_id) AS (
          SELECT from_appointment_id
          FROM appointment_reschedules
          WHERE to_appointment_id = :id
          UNION ALL
          SELECT h.from_appointment_id
          FROM appointment_reschedules h
          JOIN chain c ON h.to_appointment_id = c.from_appointment_id
        )
        SELECT COUNT(*) FROM chain
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", appointmentId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** History rows that produced any of {@code appointmentIds}, oldest first. */
  public List<RescheduleHistoryRecord> findByToAppointmentIds(Collection<Long> appointmentIds) {
    if (appointmentIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT id, from_appointment_id, to_appointment_id, original_scheduled_at,
          new_scheduled_at, rescheduled_by_id, reason, created_at
        FROM appointment_reschedules
        WHERE to_appointment_id IN (:ids)
        ORDER BY created_at, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", appointmentIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private RescheduleHistoryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RescheduleHistoryRecord(
        rs.getLong("id"),
        rs.getLong("from_appointment_id"),
        rs.getLong("to_appointment_id"),
        getInstant(rs, "original_scheduled_at"),
        getInstant(rs, "new_scheduled_at"),
        rs.getLong("rescheduled_by_id"),
        rs.getString("reason"),
        getInstant(rs, "created_at"));
  }
}
