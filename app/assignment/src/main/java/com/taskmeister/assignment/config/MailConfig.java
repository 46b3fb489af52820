/*
 * どこで: Assignment 送信設定
 * 何を: taskmeister.mail.* から JavaMailSender を組み立てる
 * なぜ: 送信が無期限にブロックしないよう接続/読込/書込タイムアウトを必ず設定するため
 */
package com.taskmeister.assignment.config;

import java.util.Properties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

@Configuration
@ConditionalOnProperty(prefix = "taskmeister.mail", name = "enabled", havingValue = "true")
public class MailConfig {

  @Bean
  public JavaMailSender assignmentMailSender(NotificationMailProperties properties) {
    final JavaMailSenderImpl sender = new JavaMailSenderImpl();
    sender.setHost(properties.host());
    sender.setPort(properties.port());
    sender.setUsername(properties.username());
    sender.setPassword(properties.password());
    sender.setDefaultEncoding("UTF-8");

    final Properties javaMail = sender.getJavaMailProperties();
    javaMail.put("mail.transport.protocol", "smtp");
    javaMail.put("mail.smtp.auth", String.valueOf(hasText(properties.username())));
    javaMail.put("mail.smtp.starttls.enable", String.valueOf(properties.starttls()));
    javaMail.put(
        "mail.smtp.connectiontimeout", String.valueOf(properties.connectionTimeout().toMillis()));
    javaMail.put("mail.smtp.timeout", String.valueOf(properties.readTimeout().toMillis()));
    javaMail.put("mail.smtp.writetimeout", String.valueOf(properties.writeTimeout().toMillis()));
    return sender;
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
