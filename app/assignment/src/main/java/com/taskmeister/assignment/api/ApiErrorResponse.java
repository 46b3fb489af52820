/*
 * どこで: Assignment API
 * 何を: API エラー応答の共通 DTO
 * なぜ: 画面側がメッセージをそのまま利用者へ表示できる形に統一するため
 */
package com.taskmeister.assignment.api;

public record ApiErrorResponse(
        ApiErrorCode code,
        String message) {
}
