/*
 * Where: Queue data access
 * What: Counter allocation, entry insert and the WAITING -> SERVING -> COMPLETE updates
 * Why: Counter uniqueness per scope is guaranteed by the database, not by the caller
 */
package com.clinicqueue.appointment.repository;

import static com.clinicqueue.common.JdbcTimestampUtils.getInstant;
import static com.clinicqueue.common.JdbcTimestampUtils.toTimestamp;

import com.clinicqueue.appointment.model.QueueEntryRecord;
import com.clinicqueue.appointment.model.QueueScope;
import com.clinicqueue.appointment.model.QueueStatus;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QueueEntryRepository {

  private static final String COLUMNS =
      """
      id, appointment_id, branch_id, service_id, business_date, counter, status,
      created_at, called_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Allocates the next turn number of the scope; the first call of a day returns 1. */
  public int nextCounter(QueueScope scope) {
    final String sql =
        """
        INSERT INTO queue_counters (branch_id, service_id, business_date, last_value)
        VALUES (:branchId, :serviceId, :businessDate, 1)
        ON CONFLICT (branch_id, service_id, business_date)
        DO UPDATE SET last_value = queue_counters.last_value + 1
        RETURNING last_value
        """;
    final Integer value = jdbcTemplate.queryForObject(sql, scopeParams(scope), Integer.class);
    if (value == null) {
      throw new IllegalStateException("queue counter allocation returned no value");
    }
    return value;
  }

  public QueueEntryRecord insert(QueueEntryRecord entry) {
    final String sql =
        """
        INSERT INTO queue_entries (
          appointment_id, branch_id, service_id, business_date, counter, status,
          created_at, called_at, completed_at
        ) VALUES (
          :appointmentId, :branchId, :serviceId, :businessDate, :counter, :status,
          :createdAt, :calledAt, :completedAt
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        scopeParams(entry.scope())
            .addValue("appointmentId", entry.appointmentId())
            .addValue("counter", entry.counter())
            .addValue("status", entry.status().name())
            .addValue("createdAt", toTimestamp(entry.createdAt()))
            .addValue("calledAt", toTimestamp(entry.calledAt()))
            .addValue("completedAt", toTimestamp(entry.completedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<QueueEntryRecord> findById(long entryId) {
    final String sql = "SELECT " + COLUMNS + " FROM queue_entries WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", entryId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<QueueEntryRecord> findByAppointmentId(long appointmentId) {
    final String sql = "SELECT " + COLUMNS + " FROM queue_entries WHERE appointment_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** WAITING entries of the same scope that joined before {@code entry}. */
  public int countWaitingAhead(QueueEntryRecord entry) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM queue_entries
        WHERE branch_id = :branchId
          AND service_id = :serviceId
          AND business_date = :businessDate
          AND status = 'WAITING'
          AND (created_at < :createdAt OR (created_at = :createdAt AND id < :id))
        """;
    final MapSqlParameterSource params =
        scopeParams(entry.scope())
            .addValue("createdAt", toTimestamp(entry.createdAt()))
            .addValue("id", entry.id());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** Mean minutes between call and completion for a service, empty when there is no history. */
  public Optional<Double> averageServiceMinutes(long serviceId, Instant since) {
    final String sql =
        """
        SELECT AVG(EXTRACT(EPOCH FROM (completed_at - called_at)) / 60.0)
        FROM queue_entries
        WHERE service_id = :serviceId
          AND status = 'COMPLETE'
          AND completed_at >= :since
          AND called_at IS NOT NULL
          AND completed_at > called_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("serviceId", serviceId)
            .addValue("since", toTimestamp(since));
    return Optional.ofNullable(jdbcTemplate.queryForObject(sql, params, Double.class));
  }

  public Optional<QueueEntryRecord> markServing(long entryId, Instant now) {
    final String sql =
        """
        UPDATE queue_entries
        SET status = 'SERVING',
            called_at = :now
        WHERE id = :id
          AND status = 'WAITING'
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, entryId, now);
  }

  public Optional<QueueEntryRecord> markComplete(long entryId, Instant now) {
    final String sql =
        """
        UPDATE queue_entries
        SET status = 'COMPLETE',
            completed_at = :now
        WHERE id = :id
          AND status = 'SERVING'
        RETURNING
        """
            + COLUMNS;
    return updateReturning(sql, entryId, now);
  }

  private Optional<QueueEntryRecord> updateReturning(String sql, long entryId, Instant now) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", entryId).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private MapSqlParameterSource scopeParams(QueueScope scope) {
    return new MapSqlParameterSource()
        .addValue("branchId", scope.branchId())
        .addValue("serviceId", scope.serviceId())
        .addValue("businessDate", Date.valueOf(scope.businessDate()));
  }

  private QueueEntryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QueueEntryRecord(
        rs.getLong("id"),
        rs.getLong("appointment_id"),
        rs.getLong("branch_id"),
        rs.getLong("service_id"),
        rs.getDate("business_date").toLocalDate(),
        rs.getInt("counter"),
        QueueStatus.valueOf(rs.getString("status")),
        getInstant(rs, "created_at"),
        getInstant(rs, "called_at"),
        getInstant(rs, "completed_at"));
  }
}
