/*
 * どこで: Worker ドメインモデル
 * 何を: workers テーブルのスナップショット
 * なぜ: API/Service/Repository 間で作業者情報の受け渡しを明確にするため
 */
package com.taskmeister.assignment.model;

import java.time.Instant;

public record WorkerRecord(
    String workerId,
    String name,
    String email,
    String phone,
    Instant createdAt,
    Instant updatedAt) {}
