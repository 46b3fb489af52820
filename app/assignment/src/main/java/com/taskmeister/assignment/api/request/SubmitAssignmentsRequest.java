/*
 * どこで: Assignment API
 * 何を: POST /v1/assignments の入力 DTO
 * なぜ: 1 作業者 x 1 日分の住宅選択をまとめて受け付けるため
 */
package com.taskmeister.assignment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.List;

// 値の検証はルールエンジン側で行い、エラー文言を一か所にそろえる
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitAssignmentsRequest(
    String workerId, LocalDate assignmentDate, List<AssignmentItemRequest> items) {}
