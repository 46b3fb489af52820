/*
 * どこで: Assignment API
 * 何を: 割当 1 件の出力 DTO (作業者名/住宅名を含む)
 * なぜ: 履歴一覧と登録結果で同じ形を返すため
 */
package com.taskmeister.assignment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.AssignmentView;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssignmentResponse(
    String assignmentId,
    String workerId,
    String workerName,
    String houseId,
    String houseName,
    LocalDate assignmentDate,
    int quantity,
    String comment,
    AssignmentStatus status,
    String failureReason,
    Instant createdAt,
    Instant sentAt) {

  public static AssignmentResponse from(AssignmentView view) {
    return new AssignmentResponse(
        view.assignmentId(),
        view.workerId(),
        view.workerName(),
        view.houseId(),
        view.houseName(),
        view.assignmentDate(),
        view.quantity(),
        view.comment(),
        view.status(),
        view.failureReason(),
        view.createdAt(),
        view.sentAt());
  }
}
