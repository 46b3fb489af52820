/*
 * どこで: Assignment 永続化設定
 * 何を: SQLite ファイルへの接続プールとマイグレーション戦略を構成する
 * なぜ: 単一ライターの前提をプールサイズ 1 で担保し、起動失敗を明確に報告するため
 */
package com.taskmeister.assignment.config;

import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

  private static final Logger logger = LoggerFactory.getLogger(StoreConfig.class);

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(StoreProperties properties) {
    final Path databaseFile = Path.of(properties.databasePath()).toAbsolutePath().normalize();
    createParentDirectories(databaseFile);

    final HikariDataSource dataSource = new HikariDataSource();
    dataSource.setPoolName("taskmeister-store");
    dataSource.setDriverClassName("org.sqlite.JDBC");
    dataSource.setJdbcUrl("jdbc:sqlite:" + databaseFile);
    // 書き込みは 1 接続に直列化する
    dataSource.setMaximumPoolSize(1);
    dataSource.setMinimumIdle(1);
    dataSource.addDataSourceProperty("foreign_keys", "true");
    dataSource.addDataSourceProperty(
        "busy_timeout", String.valueOf(properties.busyTimeoutMillis()));

    try (Connection connection = dataSource.getConnection()) {
      logger.info(
          "store opened path={} driver={}",
          databaseFile,
          connection.getMetaData().getDriverVersion());
    } catch (SQLException | RuntimeException ex) {
      dataSource.close();
      throw new StoreInitializationException("failed to open store at " + databaseFile, ex);
    }
    return dataSource;
  }

  @Bean
  public FlywayMigrationStrategy flywayMigrationStrategy() {
    return flyway -> {
      try {
        final int applied = flyway.migrate().migrationsExecuted;
        logger.info("store schema migrated appliedMigrations={}", applied);
      } catch (FlywayException ex) {
        throw new StoreInitializationException("failed to migrate store schema", ex);
      }
    };
  }

  private void createParentDirectories(Path databaseFile) {
    final Path parent = databaseFile.getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new StoreInitializationException("failed to create store directory " + parent, ex);
    }
  }
}
