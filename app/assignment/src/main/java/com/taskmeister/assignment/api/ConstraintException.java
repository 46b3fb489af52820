/*
 * どこで: Assignment API
 * 何を: 割当履歴から参照されている作業者/住宅の削除を表す
 * なぜ: 履歴を壊す削除を 409 で拒否するため
 */
package com.taskmeister.assignment.api;

public class ConstraintException extends RuntimeException {

  public ConstraintException(String message) {
    super(message);
  }
}
