package com.taskmeister.assignment.model;

import java.time.Instant;
import java.util.List;

/** Outcome of one send attempt covering one or more assignments. */
public record DispatchResult(
    List<String> assignmentIds,
    AssignmentStatus status,
    Instant sentAt,
    String failureReason) {

  public DispatchResult {
    assignmentIds = List.copyOf(assignmentIds);
  }

  public boolean sent() {
    return status == AssignmentStatus.SENT;
  }
}
