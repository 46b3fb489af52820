/*
 * どこで: Assignment 送信設定
 * 何を: メール送信専用の単一スレッド Executor を定義する
 * なぜ: 送信中に呼び出し側をブロックせず、同時送信を 1 件に抑えるため
 */
package com.taskmeister.assignment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchConfig {

  @Bean(name = "dispatchExecutor")
  public ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("dispatch-");
    // 送信中のタスクは中断せず完了を待つ
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
