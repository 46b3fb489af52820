package com.taskmeister.assignment.repository;

import static com.taskmeister.common.JdbcTimeUtils.toInstant;
import static com.taskmeister.common.JdbcTimeUtils.toText;

import com.taskmeister.assignment.model.WorkerRecord;
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
public class WorkerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<WorkerRecord> findAll() {
    final String sql =
        """
        SELECT worker_id, name, email, phone, created_at, updated_at
        FROM workers
        ORDER BY name COLLATE NOCASE, worker_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<WorkerRecord> findById(String workerId) {
    final String sql =
        """
        SELECT worker_id, name, email, phone, created_at, updated_at
        FROM workers
        WHERE worker_id = :workerId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("workerId", workerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public WorkerRecord insert(WorkerRecord worker) {
    final String sql =
        """
        INSERT INTO workers (worker_id, name, email, phone, created_at, updated_at)
        VALUES (:workerId, :name, :email, :phone, :createdAt, :updatedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", worker.workerId())
            .addValue("name", worker.name())
            .addValue("email", worker.email())
            .addValue("phone", worker.phone())
            .addValue("createdAt", toText(worker.createdAt()))
            .addValue("updatedAt", toText(worker.updatedAt()));
    jdbcTemplate.update(sql, params);
    return worker;
  }

  public Optional<WorkerRecord> update(
      String workerId, String name, String email, String phone, Instant updatedAt) {
    final String sql =
        """
        UPDATE workers
        SET name = :name,
            email = :email,
            phone = :phone,
            updated_at = :updatedAt
        WHERE worker_id = :workerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("name", name)
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("updatedAt", toText(updatedAt));
    if (jdbcTemplate.update(sql, params) == 0) {
      return Optional.empty();
    }
    return findById(workerId);
  }

  public int deleteById(String workerId) {
    final String sql = "DELETE FROM workers WHERE worker_id = :workerId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("workerId", workerId));
  }

  public boolean existsById(String workerId) {
    final String sql = "SELECT COUNT(*) FROM workers WHERE worker_id = :workerId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("workerId", workerId), Integer.class);
    return count != null && count > 0;
  }

  private WorkerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WorkerRecord(
        rs.getString("worker_id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("phone"),
        toInstant(rs.getString("created_at")),
        toInstant(rs.getString("updated_at")));
  }
}
