/*
 * どこで: Assignment サービス層
 * 何を: Test 専用で送信失敗を注入する Gateway
 * なぜ: 実コード経路を汚さずに FAILED -> 再送 -> SENT を再現するため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.model.AssignmentNotification;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile("test")
@ConditionalOnProperty(
    prefix = "taskmeister.mail.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationGateway implements NotificationGateway {

  private final LogOnlyNotificationGateway delegate;

  @Value("${taskmeister.mail.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Override
  public void send(AssignmentNotification notification) {
    if (shouldInjectFailure(notification.recipientEmail())) {
      throw new TransportException(
          "simulated transport failure for recipient=" + notification.recipientEmail());
    }
    delegate.send(notification);
  }

  private boolean shouldInjectFailure(String recipient) {
    if (recipientPrefix == null || recipientPrefix.isBlank()) {
      return false;
    }
    return recipient != null && recipient.startsWith(recipientPrefix);
  }
}
