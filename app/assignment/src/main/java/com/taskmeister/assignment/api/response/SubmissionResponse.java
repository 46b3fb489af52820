package com.taskmeister.assignment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Assignments created by one submission; their notification is still in flight. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmissionResponse(List<AssignmentResponse> assignments) {

  public SubmissionResponse {
    assignments = List.copyOf(assignments);
  }
}
