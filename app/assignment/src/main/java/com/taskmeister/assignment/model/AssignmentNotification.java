/*
 * どこで: Notification ゲートウェイの入力
 * 何を: 1 通のメールに載せる宛先と割当行をまとめる
 * なぜ: 送信手段 (SMTP/ログ) に依存せず文面を組み立てるため
 */
package com.taskmeister.assignment.model;

import java.time.LocalDate;
import java.util.List;

public record AssignmentNotification(
    String recipientEmail,
    String workerName,
    LocalDate assignmentDate,
    List<Line> lines) {

  public AssignmentNotification {
    lines = List.copyOf(lines);
  }

  public record Line(String houseName, int quantity, String comment) {}
}
