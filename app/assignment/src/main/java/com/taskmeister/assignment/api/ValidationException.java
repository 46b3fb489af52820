/*
 * どこで: Assignment API
 * 何を: 入力値の不正 (数量・必須項目・日付) を表す
 * なぜ: 400 応答へ変換するため
 */
package com.taskmeister.assignment.api;

public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
