/*
 * どこで: Assignment データアクセス
 * 何を: assignments テーブルの追記/状態更新/履歴検索を担う
 * なぜ: 割当ルール・送信処理・履歴出力を支えるため
 */
package com.taskmeister.assignment.repository;

import static com.taskmeister.common.JdbcTimeUtils.toInstant;
import static com.taskmeister.common.JdbcTimeUtils.toLocalDate;
import static com.taskmeister.common.JdbcTimeUtils.toText;

import com.taskmeister.assignment.model.AssignmentFilter;
import com.taskmeister.assignment.model.AssignmentRecord;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.AssignmentView;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AssignmentRepository {

  private static final String VIEW_COLUMNS =
      """
      SELECT a.assignment_id, a.worker_id, w.name AS worker_name, w.email AS worker_email,
             a.house_id, h.name AS house_name, a.assignment_date, a.quantity, a.comment,
             a.status, a.failure_reason, a.created_at, a.sent_at
      FROM assignments a
      JOIN workers w ON w.worker_id = a.worker_id
      JOIN houses h ON h.house_id = a.house_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AssignmentRecord record) {
    final String sql =
        """
        INSERT INTO assignments (
          assignment_id,
          worker_id,
          house_id,
          assignment_date,
          quantity,
          comment,
          status,
          failure_reason,
          created_at,
          sent_at
        ) VALUES (
          :assignmentId,
          :workerId,
          :houseId,
          :assignmentDate,
          :quantity,
          :comment,
          :status,
          :failureReason,
          :createdAt,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignmentId", record.assignmentId())
            .addValue("workerId", record.workerId())
            .addValue("houseId", record.houseId())
            .addValue("assignmentDate", toText(record.assignmentDate()))
            .addValue("quantity", record.quantity())
            .addValue("comment", record.comment())
            .addValue("status", record.status().name())
            .addValue("failureReason", record.failureReason())
            .addValue("createdAt", toText(record.createdAt()))
            .addValue("sentAt", toText(record.sentAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<AssignmentRecord> findById(String assignmentId) {
    final String sql =
        """
        SELECT assignment_id, worker_id, house_id, assignment_date, quantity, comment,
               status, failure_reason, created_at, sent_at
        FROM assignments
        WHERE assignment_id = :assignmentId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("assignmentId", assignmentId);
    return jdbcTemplate.query(sql, params, this::mapRecord).stream().findFirst();
  }

  /** Joined rows for the given ids, in insertion order. */
  public List<AssignmentView> findViewsByIds(Collection<String> assignmentIds) {
    if (assignmentIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        VIEW_COLUMNS
            + """
            WHERE a.assignment_id IN (:assignmentIds)
            ORDER BY a.rowid
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("assignmentIds", assignmentIds);
    return jdbcTemplate.query(sql, params, this::mapView);
  }

  /**
   * Whether a PENDING or SENT assignment holds {@code houseId} on {@code date}. {@code
   * excludeAssignmentId} may be null.
   */
  public boolean existsActive(String houseId, LocalDate date, String excludeAssignmentId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM assignments
        WHERE house_id = :houseId
          AND assignment_date = :assignmentDate
          AND status <> 'FAILED'
          AND (:excludeId IS NULL OR assignment_id <> :excludeId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("houseId", houseId)
            .addValue("assignmentDate", toText(date))
            .addValue("excludeId", excludeAssignmentId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public int countByWorkerId(String workerId) {
    final String sql = "SELECT COUNT(*) FROM assignments WHERE worker_id = :workerId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("workerId", workerId), Integer.class);
    return count == null ? 0 : count;
  }

  public int countByHouseId(String houseId) {
    final String sql = "SELECT COUNT(*) FROM assignments WHERE house_id = :houseId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("houseId", houseId), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * Claims a PENDING assignment for one sender. A claim whose lease has run out can be taken over.
   *
   * @return 1 when {@code lockedBy} now holds the row, 0 otherwise
   */
  public int claimForDispatch(
      String assignmentId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE assignments
        SET locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        WHERE assignment_id = :assignmentId
          AND status = 'PENDING'
          AND (lease_until IS NULL OR lease_until <= :nowMillis)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignmentId", assignmentId)
            .addValue("lockedBy", lockedBy)
            .addValue("now", toText(now))
            .addValue("nowMillis", now.toEpochMilli())
            .addValue("leaseUntil", leaseUntil.toEpochMilli());
    return jdbcTemplate.update(sql, params);
  }

  public int markSent(String assignmentId, Instant sentAt, String lockedBy) {
    // claim を持つ送信者だけが結果を書ける
    final String sql =
        """
        UPDATE assignments
        SET status = 'SENT',
            sent_at = :sentAt,
            failure_reason = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE assignment_id = :assignmentId
          AND status = 'PENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignmentId", assignmentId)
            .addValue("sentAt", toText(sentAt))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Takes a FAILED assignment back to PENDING so that it holds its house during a resend. */
  public int markPending(String assignmentId) {
    final String sql =
        """
        UPDATE assignments
        SET status = 'PENDING',
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE assignment_id = :assignmentId
          AND status = 'FAILED'
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("assignmentId", assignmentId));
  }

  public int markFailed(String assignmentId, String failureReason, String lockedBy) {
    final String sql =
        """
        UPDATE assignments
        SET status = 'FAILED',
            sent_at = NULL,
            failure_reason = :failureReason,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE assignment_id = :assignmentId
          AND status = 'PENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("assignmentId", assignmentId)
            .addValue("failureReason", failureReason)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * History search. Structured criteria are evaluated in SQL; the comment text match is applied
   * afterwards because SQLite's {@code lower()} only folds ASCII.
   */
  public List<AssignmentView> search(AssignmentFilter filter) {
    final StringBuilder sql = new StringBuilder(VIEW_COLUMNS).append("WHERE 1 = 1\n");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (hasText(filter.workerId())) {
      sql.append("  AND a.worker_id = :workerId\n");
      params.addValue("workerId", filter.workerId());
    }
    if (hasText(filter.houseId())) {
      sql.append("  AND a.house_id = :houseId\n");
      params.addValue("houseId", filter.houseId());
    }
    if (filter.from() != null) {
      sql.append("  AND a.assignment_date >= :fromDate\n");
      params.addValue("fromDate", toText(filter.from()));
    }
    if (filter.to() != null) {
      sql.append("  AND a.assignment_date <= :toDate\n");
      params.addValue("toDate", toText(filter.to()));
    }
    if (filter.status() != null) {
      sql.append("  AND a.status = :status\n");
      params.addValue("status", filter.status().name());
    }
    sql.append("ORDER BY a.assignment_date DESC, a.rowid ASC");

    final List<AssignmentView> rows = jdbcTemplate.query(sql.toString(), params, this::mapView);
    if (!hasText(filter.text())) {
      return rows;
    }
    final String needle = filter.text().toLowerCase(Locale.ROOT);
    return rows.stream()
        .filter(row -> row.comment() != null)
        .filter(row -> row.comment().toLowerCase(Locale.ROOT).contains(needle))
        .toList();
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private AssignmentRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new AssignmentRecord(
        rs.getString("assignment_id"),
        rs.getString("worker_id"),
        rs.getString("house_id"),
        toLocalDate(rs.getString("assignment_date")),
        rs.getInt("quantity"),
        rs.getString("comment"),
        AssignmentStatus.valueOf(rs.getString("status")),
        rs.getString("failure_reason"),
        toInstant(rs.getString("created_at")),
        toInstant(rs.getString("sent_at")));
  }

  private AssignmentView mapView(ResultSet rs, int rowNum) throws SQLException {
    return new AssignmentView(
        rs.getString("assignment_id"),
        rs.getString("worker_id"),
        rs.getString("worker_name"),
        rs.getString("worker_email"),
        rs.getString("house_id"),
        rs.getString("house_name"),
        toLocalDate(rs.getString("assignment_date")),
        rs.getInt("quantity"),
        rs.getString("comment"),
        AssignmentStatus.valueOf(rs.getString("status")),
        rs.getString("failure_reason"),
        toInstant(rs.getString("created_at")),
        toInstant(rs.getString("sent_at")));
  }
}
