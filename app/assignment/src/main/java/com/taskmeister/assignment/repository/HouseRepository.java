package com.taskmeister.assignment.repository;

import static com.taskmeister.common.JdbcTimeUtils.toInstant;
import static com.taskmeister.common.JdbcTimeUtils.toText;

import com.taskmeister.assignment.model.HouseRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class HouseRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<HouseRecord> findAll() {
    final String sql =
        """
        SELECT house_id, name, comment, created_at, updated_at
        FROM houses
        ORDER BY name COLLATE NOCASE, house_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /** Houses without a PENDING or SENT assignment on {@code date}. */
  public List<HouseRecord> findEligible(LocalDate date) {
    final String sql =
        """
        SELECT h.house_id, h.name, h.comment, h.created_at, h.updated_at
        FROM houses h
        WHERE NOT EXISTS (
          SELECT 1
          FROM assignments a
          WHERE a.house_id = h.house_id
            AND a.assignment_date = :assignmentDate
            AND a.status <> 'FAILED'
        )
        ORDER BY h.name COLLATE NOCASE, h.house_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("assignmentDate", toText(date));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<HouseRecord> findById(String houseId) {
    final String sql =
        """
        SELECT house_id, name, comment, created_at, updated_at
        FROM houses
        WHERE house_id = :houseId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("houseId", houseId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public HouseRecord insert(HouseRecord house) {
    final String sql =
        """
        INSERT INTO houses (house_id, name, comment, created_at, updated_at)
        VALUES (:houseId, :name, :comment, :createdAt, :updatedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("houseId", house.houseId())
            .addValue("name", house.name())
            .addValue("comment", house.comment())
            .addValue("createdAt", toText(house.createdAt()))
            .addValue("updatedAt", toText(house.updatedAt()));
    jdbcTemplate.update(sql, params);
    return house;
  }

  public Optional<HouseRecord> update(
      String houseId, String name, String comment, Instant updatedAt) {
    final String sql =
        """
        UPDATE houses
        SET name = :name,
            comment = :comment,
            updated_at = :updatedAt
        WHERE house_id = :houseId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("houseId", houseId)
            .addValue("name", name)
            .addValue("comment", comment)
            .addValue("updatedAt", toText(updatedAt));
    if (jdbcTemplate.update(sql, params) == 0) {
      return Optional.empty();
    }
    return findById(houseId);
  }

  public int deleteById(String houseId) {
    final String sql = "DELETE FROM houses WHERE house_id = :houseId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("houseId", houseId));
  }

  private HouseRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new HouseRecord(
        rs.getString("house_id"),
        rs.getString("name"),
        rs.getString("comment"),
        toInstant(rs.getString("created_at")),
        toInstant(rs.getString("updated_at")));
  }
}
