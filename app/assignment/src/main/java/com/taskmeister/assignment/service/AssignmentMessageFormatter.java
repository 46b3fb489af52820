/*
 * どこで: Assignment サービス層
 * 何を: 割当通知の件名と本文を組み立てる
 * なぜ: SMTP/ログ出力のどちらでも同じ文面を使うため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.config.NotificationMailProperties;
import com.taskmeister.assignment.model.AssignmentNotification;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AssignmentMessageFormatter {

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private final NotificationMailProperties properties;

  public FormattedMessage format(AssignmentNotification notification) {
    final String date = DATE_FORMAT.format(notification.assignmentDate());
    final String lines =
        notification.lines().stream().map(this::formatLine).collect(Collectors.joining("\n"));
    final String body =
        "Hello "
            + notification.workerName()
            + ",\n\n"
            + "Date: "
            + date
            + "\n"
            + "You have been assigned to the following houses:\n\n"
            + lines
            + "\n\nGood luck with your work!";
    return new FormattedMessage("Work Assignment - " + date, body);
  }

  private String formatLine(AssignmentNotification.Line line) {
    final StringBuilder builder =
        new StringBuilder("- ")
            .append(line.houseName())
            .append(" → ")
            .append(line.quantity())
            .append(' ')
            .append(properties.quantityUnit());
    if (line.comment() != null && !line.comment().isBlank()) {
      builder.append(" | Note: ").append(line.comment());
    }
    return builder.toString();
  }

  public record FormattedMessage(String subject, String body) {}
}
