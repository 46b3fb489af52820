/*
 * どこで: Assignment テスト基盤
 * 何を: 一時ディレクトリ上の SQLite ファイルと Flyway 適用済みストアを提供する
 * なぜ: 本番と同じマイグレーションと接続設定でテストするため
 */
package com.taskmeister.assignment;

import com.taskmeister.assignment.model.HouseRecord;
import com.taskmeister.assignment.model.WorkerRecord;
import com.taskmeister.assignment.repository.HouseRepository;
import com.taskmeister.assignment.repository.WorkerRepository;
import com.taskmeister.common.Ids;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

public abstract class AbstractSqliteStoreTest {

  // JVM 内のテスト全体で同じファイルを使い、コンテキストキャッシュを効かせる
  static final Path DATABASE_FILE;

  static {
    try {
      DATABASE_FILE =
          Files.createTempDirectory("taskmeister-test").resolve("store/task_assignments.db");
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("taskmeister.store.database-path", DATABASE_FILE::toString);
  }

  @Autowired protected NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired protected WorkerRepository workerRepository;
  @Autowired protected HouseRepository houseRepository;

  @BeforeEach
  void cleanStore() {
    // 参照される側を後に消す
    jdbcTemplate.update("DELETE FROM assignments", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM houses", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM workers", new MapSqlParameterSource());
  }

  protected WorkerRecord givenWorker(String name, String email) {
    final Instant now = Instant.now();
    return workerRepository.insert(new WorkerRecord(Ids.newId(), name, email, null, now, now));
  }

  protected HouseRecord givenHouse(String name) {
    final Instant now = Instant.now();
    return houseRepository.insert(new HouseRecord(Ids.newId(), name, null, now, now));
  }

  // 送信を経由せずに FAILED 状態を作る
  protected void givenFailed(String assignmentId, String failureReason) {
    jdbcTemplate.update(
        "UPDATE assignments SET status = 'FAILED', failure_reason = :reason"
            + " WHERE assignment_id = :assignmentId",
        new MapSqlParameterSource()
            .addValue("assignmentId", assignmentId)
            .addValue("reason", failureReason));
  }

  protected static LocalDate daysFromToday(int days) {
    return LocalDate.now(ZoneOffset.UTC).plusDays(days);
  }

  protected int countAssignments() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM assignments", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
