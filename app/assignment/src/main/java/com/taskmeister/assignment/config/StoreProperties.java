/*
 * どこで: Assignment アプリの設定バインド
 * 何を: SQLite ストアのファイルパスを保持する
 * なぜ: 保存先を作業ディレクトリに依存させず明示的に指定するため
 */
package com.taskmeister.assignment.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "taskmeister.store")
public record StoreProperties(
    @NotBlank @DefaultValue("./data/task_assignments.db") String databasePath,
    @DefaultValue("5000") int busyTimeoutMillis) {}
