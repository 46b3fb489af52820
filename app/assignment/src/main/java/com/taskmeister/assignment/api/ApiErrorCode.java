/*
 * どこで: Assignment API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.taskmeister.assignment.api;

public enum ApiErrorCode {
    NOT_FOUND,
    VALIDATION_FAILED,
    ALREADY_ASSIGNED,
    CONSTRAINT_VIOLATION,
    TRANSPORT_FAILED,
    INTERNAL_ERROR
}
