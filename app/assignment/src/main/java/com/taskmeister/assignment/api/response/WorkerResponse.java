package com.taskmeister.assignment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskmeister.assignment.model.WorkerRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerResponse(
    String workerId, String name, String email, String phone, Instant createdAt, Instant updatedAt) {

  public static WorkerResponse from(WorkerRecord worker) {
    return new WorkerResponse(
        worker.workerId(),
        worker.name(),
        worker.email(),
        worker.phone(),
        worker.createdAt(),
        worker.updatedAt());
  }
}
