package com.taskmeister.assignment.model;

import java.time.LocalDate;

/**
 * History search criteria. Every component is optional; supplied components are combined with
 * AND. {@code from} and {@code to} are inclusive, {@code text} is matched case-insensitively
 * against the assignment comment.
 */
public record AssignmentFilter(
    String workerId,
    String houseId,
    LocalDate from,
    LocalDate to,
    String text,
    AssignmentStatus status) {

  public static AssignmentFilter none() {
    return new AssignmentFilter(null, null, null, null, null, null);
  }

  public static AssignmentFilter byText(String text) {
    return new AssignmentFilter(null, null, null, null, text, null);
  }
}
