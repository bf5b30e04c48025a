/*
 * Where: Appointment data access
 * What: Reads appointments and applies status transitions as conditional updates
 * Why: The expected current status sits in the WHERE clause, so a lost race returns no row
 */
package com.clinicqueue.appointment.repository;

import static com.clinicqueue.common.JdbcTimestampUtils.getInstant;
import static com.clinicqueue.common.JdbcTimestampUtils.getNullableLong;
import static com.clinicqueue.common.JdbcTimestampUtils.toTimestamp;

import com.clinicqueue.appointment.model.AppointmentRecord;
import com.clinicqueue.appointment.model.AppointmentStatus;
import com.clinicqueue.appointment.model.AppointmentType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AppointmentRepository {

  private static final String COLUMNS =
      """
      id, user_id, service_id, branch_id, service_point_id, type, status,
      confirmation_code, form_data_json::text AS form_data_json_text,
      guest_name, guest_email, guest_phone, guest_notes,
      scheduled_at, attended_at, no_show_marked_at, auto_marked_as_no_show,
      cancellation_reason, rescheduled_from_id, rescheduled_by_id, rescheduled_at,
      rescheduled_reason, original_scheduled_at, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<AppointmentRecord> findById(long appointmentId) {
    final String sql = "SELECT " + COLUMNS + " FROM appointments WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<AppointmentRecord> findByRescheduledFromId(long appointmentId) {
    final String sql = "SELECT " + COLUMNS + " FROM appointments WHERE rescheduled_from_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** SCHEDULED, unmarked, not superseded and scheduled strictly before {@code cutoff}. */
  public List<AppointmentRecord> findOverdueScheduled(Instant cutoff) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM appointments
            WHERE status = 'SCHEDULED'
              AND no_show_marked_at IS NULL
              AND rescheduled_at IS NULL
              AND scheduled_at < :cutoff
            ORDER BY scheduled_at, id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean existsActiveAtSlot(
      long serviceId, long branchId, Instant scheduledAt, long excludedAppointmentId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM appointments
          WHERE service_id = :serviceId
            AND branch_id = :branchId
            AND scheduled_at = :scheduledAt
            AND status <> 'CANCELLED'
            AND rescheduled_at IS NULL
            AND id <> :excludedId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serviceId", serviceId)
            .addValue("branchId", branchId)
            .addValue("scheduledAt", toTimestamp(scheduledAt))
            .addValue("excludedId", excludedAppointmentId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public AppointmentRecord insert(AppointmentRecord appointment) {
    final String sql =
        """
        INSERT INTO appointments (
          user_id, service_id, branch_id, service_point_id, type, status,
          confirmation_code, form_data_json,
          guest_name, guest_email, guest_phone, guest_notes,
          scheduled_at, attended_at, no_show_marked_at, auto_marked_as_no_show,
          cancellation_reason, rescheduled_from_id, rescheduled_by_id, rescheduled_at,
          rescheduled_reason, original_scheduled_at, created_at, updated_at
        ) VALUES (
          :userId, :serviceId, :branchId, :servicePointId, :type, :status,
          :confirmationCode, CAST(:formDataJson AS jsonb),
          :guestName, :guestEmail, :guestPhone, :guestNotes,
          :scheduledAt, :attendedAt, :noShowMarkedAt, :autoMarkedAsNoShow,
          :cancellationReason, :rescheduledFromId, :rescheduledById, :rescheduledAt,
          :rescheduledReason, :originalScheduledAt, :createdAt, :updatedAt
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", appointment.userId())
            .addValue("serviceId", appointment.serviceId())
            .addValue("branchId", appointment.branchId())
            .addValue("servicePointId", appointment.servicePointId())
            .addValue("type", appointment.type().name())
            .addValue("status", appointment.status().name())
            .addValue("confirmationCode", appointment.confirmationCode())
            .addValue("formDataJson", appointment.formDataJson())
            .addValue("guestName", appointment.guestName())
            .addValue("guestEmail", appointment.guestEmail())
            .addValue("guestPhone", appointment.guestPhone())
            .addValue("guestNotes", appointment.guestNotes())
            .addValue("scheduledAt", toTimestamp(appointment.scheduledAt()))
            .addValue("attendedAt", toTimestamp(appointment.attendedAt()))
            .addValue("noShowMarkedAt", toTimestamp(appointment.noShowMarkedAt()))
            .addValue("autoMarkedAsNoShow", appointment.autoMarkedAsNoShow())
            .addValue("cancellationReason", appointment.cancellationReason())
            .addValue("rescheduledFromId", appointment.rescheduledFromId())
            .addValue("rescheduledById", appointment.rescheduledById())
            .addValue("rescheduledAt", toTimestamp(appointment.rescheduledAt()))
            .addValue("rescheduledReason", appointment.rescheduledReason())
            .addValue("originalScheduledAt", toTimestamp(appointment.originalScheduledAt()))
            .addValue("createdAt", toTimestamp(appointment.createdAt()))
            .addValue("updatedAt", toTimestamp(appointment.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<AppointmentRecord> markCheckedIn(long appointmentId, Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET status = 'CHECKED_IN',
            attended_at = :now,
            updated_at = :now
        WHERE id = :id
          AND status = 'SCHEDULED'
          AND rescheduled_at IS NULL
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, transitionParams(appointmentId, now));
  }

  public Optional<AppointmentRecord> markCompleted(long appointmentId, Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET status = 'COMPLETED',
            updated_at = :now
        WHERE id = :id
          AND status = 'CHECKED_IN'
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, transitionParams(appointmentId, now));
  }

  public Optional<AppointmentRecord> markCancelled(
      long appointmentId, AppointmentStatus expectedStatus, String reason, Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET status = 'CANCELLED',
            cancellation_reason = :reason,
            updated_at = :now
        WHERE id = :id
          AND status = :expectedStatus
          AND rescheduled_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        transitionParams(appointmentId, now)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("reason", reason);
    return updateReturning(sql, params);
  }

  /** Closes a SCHEDULED row that has just been replaced by a reschedule. */
  public Optional<AppointmentRecord> markSuperseded(
      long appointmentId,
      long actorId,
      String reason,
      Instant originalScheduledAt,
      Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET rescheduled_by_id = :actorId,
            rescheduled_at = :now,
            rescheduled_reason = :reason,
            original_scheduled_at = :originalScheduledAt,
            updated_at = :now
        WHERE id = :id
          AND status = 'SCHEDULED'
          AND rescheduled_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        transitionParams(appointmentId, now)
            .addValue("actorId", actorId)
            .addValue("reason", reason)
            .addValue("originalScheduledAt", toTimestamp(originalScheduledAt));
    return updateReturning(sql, params);
  }

  /** Marks at most once; a second caller (another replica or a manual run) gets no row. */
  public Optional<AppointmentRecord> markNoShow(
      long appointmentId, boolean automatic, Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET status = 'NO_SHOW',
            no_show_marked_at = :now,
            auto_marked_as_no_show = :automatic,
            updated_at = :now
        WHERE id = :id
          AND status = 'SCHEDULED'
          AND no_show_marked_at IS NULL
          AND rescheduled_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        transitionParams(appointmentId, now).addValue("automatic", automatic);
    return updateReturning(sql, params);
  }

  public int assignServicePoint(long appointmentId, long servicePointId, Instant now) {
    final String sql =
        """
        UPDATE appointments
        SET service_point_id = :servicePointId,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        transitionParams(appointmentId, now).addValue("servicePointId", servicePointId);
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource transitionParams(long appointmentId, Instant now) {
    return new MapSqlParameterSource()
        .addValue("id", appointmentId)
        .addValue("now", toTimestamp(now));
  }

  private Optional<AppointmentRecord> updateReturning(String sql, MapSqlParameterSource params) {
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private AppointmentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AppointmentRecord(
        rs.getLong("id"),
        getNullableLong(rs, "user_id"),
        rs.getLong("service_id"),
        rs.getLong("branch_id"),
        getNullableLong(rs, "service_point_id"),
        AppointmentType.valueOf(rs.getString("type")),
        AppointmentStatus.valueOf(rs.getString("status")),
        rs.getString("confirmation_code"),
        rs.getString("form_data_json_text"),
        rs.getString("guest_name"),
        rs.getString("guest_email"),
        rs.getString("guest_phone"),
        rs.getString("guest_notes"),
        getInstant(rs, "scheduled_at"),
        getInstant(rs, "attended_at"),
        getInstant(rs, "no_show_marked_at"),
        rs.getBoolean("auto_marked_as_no_show"),
        rs.getString("cancellation_reason"),
        getNullableLong(rs, "rescheduled_from_id"),
        getNullableLong(rs, "rescheduled_by_id"),
        getInstant(rs, "rescheduled_at"),
        rs.getString("rescheduled_reason"),
        getInstant(rs, "original_scheduled_at"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
