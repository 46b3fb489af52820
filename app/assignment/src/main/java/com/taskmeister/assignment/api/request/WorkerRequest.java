/*
 * どこで: Assignment API
 * 何を: POST/PUT /v1/workers の入力 DTO
 * なぜ: 作業者の登録/編集で受け付ける項目を限定するため
 */
package com.taskmeister.assignment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerRequest(
    @NotBlank(message = "name is required") @Size(max = 200) String name,
    @NotBlank(message = "email is required") @Email(message = "email is invalid") String email,
    @Size(max = 50) String phone) {}
