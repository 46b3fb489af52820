/*
 * どこで: Assignment アプリの設定バインド
 * 何を: SMTP 接続先・認証・タイムアウト・文面の数量単位を保持する
 * なぜ: 送信処理をグローバル状態に依存させず、明示的な設定で差し替えられるようにするため
 */
package com.taskmeister.assignment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "taskmeister.mail")
public record NotificationMailProperties(
    @DefaultValue("false") boolean enabled,
    String host,
    @DefaultValue("587") int port,
    String username,
    String password,
    String from,
    @DefaultValue("true") boolean starttls,
    @DefaultValue("10s") Duration connectionTimeout,
    @DefaultValue("10s") Duration readTimeout,
    @DefaultValue("10s") Duration writeTimeout,
    @DefaultValue("bedding sets") String quantityUnit) {

  @Override
  public String toString() {
    // password はログへ出さない
    return "NotificationMailProperties[enabled=%s, host=%s, port=%d, username=%s, from=%s]"
        .formatted(enabled, host, port, username, from);
  }
}
