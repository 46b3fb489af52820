/*
 * どこで: Assignment ドメインモデル
 * 何を: 割当通知の状態を表す列挙
 * なぜ: DB の status 列と送信処理の状態遷移を一致させるため
 */
package com.taskmeister.assignment.model;

public enum AssignmentStatus {
  PENDING,
  SENT,
  FAILED
}
