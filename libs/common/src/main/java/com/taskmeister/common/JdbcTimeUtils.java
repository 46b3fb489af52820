/*
 * どこで: 共通ユーティリティ
 * 何を: Instant / LocalDate を SQLite の TEXT 列と相互変換する
 * なぜ: SQLite JDBC の日時型推論 (epoch ミリ秒と文字列の混在) に依存しないため
 */
package com.taskmeister.common;

import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimeUtils {
  private JdbcTimeUtils() {}

  // 前提: Instant は UTC の ISO-8601 (例: 2026-01-17T00:00:00Z) で保存する
  public static String toText(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  // 前提: 日付は yyyy-MM-dd で保存し、文字列比較で範囲検索できる形にそろえる
  public static String toText(LocalDate date) {
    return date == null ? null : date.toString();
  }

  public static Instant toInstant(String text) {
    return text == null || text.isBlank() ? null : Instant.parse(text);
  }

  public static LocalDate toLocalDate(String text) {
    return text == null || text.isBlank() ? null : LocalDate.parse(text);
  }
}
