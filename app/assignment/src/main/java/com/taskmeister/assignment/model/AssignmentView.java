/*
 * どこで: Assignment ドメインモデル
 * 何を: 割当と作業者名/宛先/住宅名を結合した参照用レコード
 * なぜ: 履歴一覧・CSV 出力・通知文面の組み立てで同じ結合結果を使うため
 */
package com.taskmeister.assignment.model;

import java.time.Instant;
import java.time.LocalDate;

public record AssignmentView(
    String assignmentId,
    String workerId,
    String workerName,
    String workerEmail,
    String houseId,
    String houseName,
    LocalDate assignmentDate,
    int quantity,
    String comment,
    AssignmentStatus status,
    String failureReason,
    Instant createdAt,
    Instant sentAt) {}
