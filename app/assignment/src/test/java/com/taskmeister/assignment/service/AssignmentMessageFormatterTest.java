package com.taskmeister.assignment.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.taskmeister.assignment.config.NotificationMailProperties;
import com.taskmeister.assignment.model.AssignmentNotification;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssignmentMessageFormatterTest {

  @Test
  void formatsSubjectAndBodyWithOneLinePerHouse() {
    final AssignmentMessageFormatter formatter = new AssignmentMessageFormatter(properties("bedding sets"));
    final AssignmentNotification notification =
        new AssignmentNotification(
            "anna@example.com",
            "Anna",
            LocalDate.parse("2026-03-05"),
            List.of(
                new AssignmentNotification.Line("Oak Street 1", 3, "Ring twice"),
                new AssignmentNotification.Line("Elm Street 2", 1, null)));

    final AssignmentMessageFormatter.FormattedMessage message = formatter.format(notification);

    assertThat(message.subject()).isEqualTo("Work Assignment - 05.03.2026");
    assertThat(message.body())
        .isEqualTo(
            "Hello Anna,\n\n"
                + "Date: 05.03.2026\n"
                + "You have been assigned to the following houses:\n\n"
                + "- Oak Street 1 → 3 bedding sets | Note: Ring twice\n"
                + "- Elm Street 2 → 1 bedding sets\n\n"
                + "Good luck with your work!");
  }

  @Test
  void usesConfiguredQuantityUnit() {
    final AssignmentMessageFormatter formatter = new AssignmentMessageFormatter(properties("boxes"));

    final String body =
        formatter
            .format(
                new AssignmentNotification(
                    "ben@example.com",
                    "Ben",
                    LocalDate.parse("2026-12-24"),
                    List.of(new AssignmentNotification.Line("Pine Street 3", 2, " "))))
            .body();

    assertThat(body).contains("- Pine Street 3 → 2 boxes\n").doesNotContain("Note:");
  }

  private NotificationMailProperties properties(String unit) {
    return new NotificationMailProperties(
        false,
        "localhost",
        25,
        null,
        null,
        "dispatch@example.com",
        false,
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        unit);
  }
}
