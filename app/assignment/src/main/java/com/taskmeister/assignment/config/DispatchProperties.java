/*
 * どこで: Assignment アプリの設定バインド
 * 何を: 送信スレッドのキュー長、失敗理由の最大長、送信 claim の lease を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.taskmeister.assignment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Dispatch settings.
 *
 * @param claimLease how long a sender holds its claim; must outlast the SMTP timeouts
 */
@ConfigurationProperties(prefix = "taskmeister.dispatch")
public record DispatchProperties(
    @DefaultValue("100") int queueCapacity,
    @DefaultValue("500") int errorMessageMaxLength,
    @DefaultValue("2m") Duration claimLease) {}
