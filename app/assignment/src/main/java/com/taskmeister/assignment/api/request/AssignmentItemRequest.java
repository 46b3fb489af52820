package com.taskmeister.assignment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskmeister.assignment.model.NewAssignment;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssignmentItemRequest(String houseId, Integer quantity, String comment) {

  public NewAssignment toNewAssignment() {
    return new NewAssignment(houseId, quantity, comment);
  }
}
