package com.taskmeister.assignment.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreConfigTest {

  @TempDir Path tempDir;

  private final StoreConfig storeConfig = new StoreConfig();

  @Test
  void createsMissingParentDirectories() {
    final Path databaseFile = tempDir.resolve("nested/data/task_assignments.db");

    try (HikariDataSource dataSource =
        storeConfig.dataSource(new StoreProperties(databaseFile.toString(), 5000))) {
      assertThat(dataSource.getMaximumPoolSize()).isEqualTo(1);
      assertThat(Files.isDirectory(databaseFile.getParent())).isTrue();
      assertThat(Files.exists(databaseFile)).isTrue();
    }
  }

  @Test
  void unusableLocationFailsWithStoreInitializationException() throws Exception {
    final Path blocker = Files.createFile(tempDir.resolve("blocker"));
    final Path databaseFile = blocker.resolve("task_assignments.db");

    assertThatThrownBy(
            () -> storeConfig.dataSource(new StoreProperties(databaseFile.toString(), 5000)))
        .isInstanceOf(StoreInitializationException.class)
        .hasMessageContaining("blocker");
  }
}
