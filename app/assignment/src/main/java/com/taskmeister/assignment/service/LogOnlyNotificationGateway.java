/*
 * どこで: Assignment サービス層
 * 何を: メール送信を行わず文面をログへ出すだけの実装
 * なぜ: SMTP 未設定のローカル環境でも状態遷移を確認できるようにするため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.model.AssignmentNotification;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "taskmeister.mail",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LogOnlyNotificationGateway implements NotificationGateway {

  private static final Logger logger = LoggerFactory.getLogger(LogOnlyNotificationGateway.class);

  private final AssignmentMessageFormatter formatter;

  @Override
  public void send(AssignmentNotification notification) {
    final AssignmentMessageFormatter.FormattedMessage message = formatter.format(notification);
    logger.info(
        "assignment mail simulated recipient={} subject={}\n{}",
        notification.recipientEmail(),
        message.subject(),
        message.body());
  }
}
