/*
 * どこで: Assignment API
 * 何を: POST/PUT /v1/houses の入力 DTO
 * なぜ: 住宅の登録/編集で受け付ける項目を限定するため
 */
package com.taskmeister.assignment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HouseRequest(
    @NotBlank(message = "name is required") @Size(max = 200) String name,
    @Size(max = 1000) String comment) {}
