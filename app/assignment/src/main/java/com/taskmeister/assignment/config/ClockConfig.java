/*
 * どこで: Assignment 共通設定
 * 何を: 業務タイムゾーンを持つ Clock を DI 可能にする
 * なぜ: 作成日時・送信日時・過去日付の判定で同一の時刻注入を使うため
 */
package com.taskmeister.assignment.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  // Instant は常に UTC。zone は LocalDate.now(clock) の日付境界にだけ効く
  @Bean
  public Clock clock(AssignmentRuleProperties ruleProperties) {
    return Clock.system(ruleProperties.zone());
  }
}
