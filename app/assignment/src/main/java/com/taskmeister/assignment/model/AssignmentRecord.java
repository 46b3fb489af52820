/*
 * どこで: Assignment ドメインモデル
 * 何を: assignments テーブルの 1 行
 * なぜ: 割当ルールと送信処理で同じ形を使うため
 */
package com.taskmeister.assignment.model;

import java.time.Instant;
import java.time.LocalDate;

public record AssignmentRecord(
    String assignmentId,
    String workerId,
    String houseId,
    LocalDate assignmentDate,
    int quantity,
    String comment,
    AssignmentStatus status,
    String failureReason,
    Instant createdAt,
    Instant sentAt) {}
