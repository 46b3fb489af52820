package com.taskmeister.assignment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskmeister.assignment.model.HouseRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HouseResponse(
    String houseId, String name, String comment, Instant createdAt, Instant updatedAt) {

  public static HouseResponse from(HouseRecord house) {
    return new HouseResponse(
        house.houseId(), house.name(), house.comment(), house.createdAt(), house.updatedAt());
  }
}
