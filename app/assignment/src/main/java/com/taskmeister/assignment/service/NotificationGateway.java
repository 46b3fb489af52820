/*
 * どこで: Assignment サービス層
 * 何を: 作業者への割当通知を送る抽象化インターフェース
 * なぜ: SMTP/ログ出力/失敗注入を送信処理から切り替えられるようにするため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.model.AssignmentNotification;

public interface NotificationGateway {

  /**
   * Transmits one message to the worker.
   *
   * @throws TransportException when the message could not be handed to the mail endpoint
   */
  void send(AssignmentNotification notification);
}
