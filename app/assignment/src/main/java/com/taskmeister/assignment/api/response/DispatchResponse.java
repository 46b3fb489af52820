package com.taskmeister.assignment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.DispatchResult;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchResponse(
    List<String> assignmentIds, AssignmentStatus status, Instant sentAt, String failureReason) {

  public DispatchResponse {
    assignmentIds = List.copyOf(assignmentIds);
  }

  public static DispatchResponse from(DispatchResult result) {
    return new DispatchResponse(
        result.assignmentIds(), result.status(), result.sentAt(), result.failureReason());
  }
}
