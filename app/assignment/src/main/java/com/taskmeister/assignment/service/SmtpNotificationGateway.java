/*
 * どこで: Assignment サービス層
 * 何を: JavaMailSender で割当通知をプレーンテキストメールとして送る
 * なぜ: 送信失敗を TransportException へ正規化し、FAILED 記録へつなげるため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.config.NotificationMailProperties;
import com.taskmeister.assignment.model.AssignmentNotification;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "taskmeister.mail", name = "enabled", havingValue = "true")
public class SmtpNotificationGateway implements NotificationGateway {

  private static final Logger logger = LoggerFactory.getLogger(SmtpNotificationGateway.class);

  private final JavaMailSender mailSender;
  private final NotificationMailProperties properties;
  private final AssignmentMessageFormatter formatter;

  @Override
  public void send(AssignmentNotification notification) {
    final AssignmentMessageFormatter.FormattedMessage message = formatter.format(notification);
    final SimpleMailMessage mail = new SimpleMailMessage();
    mail.setFrom(resolveFrom());
    mail.setTo(notification.recipientEmail());
    mail.setSubject(message.subject());
    mail.setText(message.body());
    try {
      mailSender.send(mail);
    } catch (MailException ex) {
      throw new TransportException(
          "mail delivery to " + notification.recipientEmail() + " failed: " + ex.getMessage(), ex);
    }
    logger.info(
        "assignment mail sent recipient={} date={} lines={}",
        notification.recipientEmail(),
        notification.assignmentDate(),
        notification.lines().size());
  }

  private String resolveFrom() {
    final String from = properties.from();
    if (from != null && !from.isBlank()) {
      return from;
    }
    return properties.username();
  }
}
