/*
 * どこで: Notification ゲートウェイ
 * 何を: メール送信の失敗 (タイムアウト/認証/接続) を表す
 * なぜ: 送信失敗を FAILED 状態と失敗理由へ記録するため
 */
package com.taskmeister.assignment.service;

public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
