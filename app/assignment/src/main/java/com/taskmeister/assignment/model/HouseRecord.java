/*
 * どこで: House ドメインモデル
 * 何を: houses テーブルのスナップショット
 * なぜ: 割当候補の一覧と CRUD で共通化するため
 */
package com.taskmeister.assignment.model;

import java.time.Instant;

public record HouseRecord(
    String houseId,
    String name,
    String comment,
    Instant createdAt,
    Instant updatedAt) {}
