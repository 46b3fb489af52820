/*
 * どこで: Assignment サービス層
 * 何を: 割当通知を 1 回送信し、結果に応じて SENT/FAILED へ遷移させる
 * なぜ: 送信 IO をトランザクション外で行い、状態更新だけを短いトランザクションにまとめるため
 */
package com.taskmeister.assignment.service;

import com.google.common.annotations.VisibleForTesting;
import com.taskmeister.assignment.api.AlreadyAssignedException;
import com.taskmeister.assignment.api.ConstraintException;
import com.taskmeister.assignment.api.NotFoundException;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.config.DispatchProperties;
import com.taskmeister.assignment.model.AssignmentNotification;
import com.taskmeister.assignment.model.AssignmentRecord;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.assignment.model.DispatchResult;
import com.taskmeister.assignment.repository.AssignmentRepository;
import com.taskmeister.common.Ids;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AssignmentDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(AssignmentDispatchService.class);

  private final AssignmentRepository assignmentRepository;
  private final NotificationGateway gateway;
  private final DispatchMetrics metrics;
  private final DispatchProperties properties;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;
  private final Executor dispatchExecutor;

  public AssignmentDispatchService(
      AssignmentRepository assignmentRepository,
      NotificationGateway gateway,
      DispatchMetrics metrics,
      DispatchProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager,
      @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
    this.assignmentRepository = assignmentRepository;
    this.gateway = gateway;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.dispatchExecutor = dispatchExecutor;
  }

  /**
   * Sends one message covering every given assignment. They must belong to the same worker and
   * date and must be PENDING; FAILED ones go through {@link #resend} so that their house is
   * checked again. A transport failure is recorded, not thrown.
   *
   * @throws ConstraintException when another sender already holds every given assignment
   */
  public DispatchResult dispatch(List<String> assignmentIds) {
    if (assignmentIds == null || assignmentIds.isEmpty()) {
      throw new ValidationException("at least one assignment is required");
    }
    final Set<String> uniqueIds = new LinkedHashSet<>(assignmentIds);
    final List<AssignmentView> views = assignmentRepository.findViewsByIds(uniqueIds);
    if (views.size() != uniqueIds.size()) {
      final Set<String> found = new LinkedHashSet<>();
      views.forEach(view -> found.add(view.assignmentId()));
      final String missing =
          uniqueIds.stream().filter(id -> !found.contains(id)).findFirst().orElse("?");
      throw new NotFoundException("assignment", missing);
    }
    final AssignmentView first = views.get(0);
    for (AssignmentView view : views) {
      if (!view.workerId().equals(first.workerId())
          || !view.assignmentDate().equals(first.assignmentDate())) {
        throw new ValidationException("assignments of one dispatch must share worker and date");
      }
      if (view.status() == AssignmentStatus.SENT) {
        throw new ValidationException("assignment " + view.assignmentId() + " is already sent");
      }
      if (view.status() != AssignmentStatus.PENDING) {
        throw new ValidationException(
            "assignment " + view.assignmentId() + " is not pending, resend it instead");
      }
    }
    return send(views);
  }

  /**
   * Manual resend of a single PENDING or FAILED assignment. The record is updated in place.
   *
   * @throws AlreadyAssignedException when the house was given to another assignment after this
   *     one failed
   * @throws ConstraintException when another send of this assignment is in flight
   */
  public DispatchResult resend(String assignmentId) {
    final AssignmentRecord record =
        assignmentRepository
            .findById(assignmentId)
            .orElseThrow(() -> new NotFoundException("assignment", assignmentId));
    if (record.status() == AssignmentStatus.SENT) {
      throw new ValidationException("assignment " + assignmentId + " is already sent");
    }
    if (record.status() == AssignmentStatus.FAILED) {
      // 失敗中は住宅が空いているため、再度確保してから送る
      transactionTemplate.executeWithoutResult(
          status -> {
            if (assignmentRepository.existsActive(
                record.houseId(), record.assignmentDate(), assignmentId)) {
              throw new AlreadyAssignedException(record.houseId(), record.assignmentDate());
            }
            assignmentRepository.markPending(assignmentId);
          });
    }
    logger.info("assignment resend requested assignmentId={}", assignmentId);
    return send(assignmentRepository.findViewsByIds(List.of(assignmentId)));
  }

  /** Runs {@link #dispatch} on the dispatch thread. */
  public CompletableFuture<DispatchResult> dispatchAsync(List<String> assignmentIds) {
    final List<String> ids = List.copyOf(assignmentIds);
    try {
      return CompletableFuture.supplyAsync(() -> dispatch(ids), dispatchExecutor)
          .whenComplete(
              (result, ex) -> {
                if (ex == null) {
                  return;
                }
                final Throwable cause = ex instanceof CompletionException ? ex.getCause() : ex;
                // 再送などで先に状態が変わった場合は送らずに終える
                if (cause instanceof ValidationException || cause instanceof ConstraintException) {
                  logger.warn(
                      "assignment dispatch skipped ids={} reason={}", ids, cause.getMessage());
                } else {
                  logger.error("assignment dispatch aborted ids={}", ids, cause);
                }
              });
    } catch (TaskRejectedException ex) {
      // 割当は PENDING のまま残り、再送で回復できる
      logger.warn("assignment dispatch rejected ids={}", ids, ex);
      return CompletableFuture.failedFuture(ex);
    }
  }

  private DispatchResult send(List<AssignmentView> views) {
    final String lockedBy = Ids.newId();
    final List<AssignmentView> claimed = claim(views, lockedBy);
    if (claimed.isEmpty()) {
      throw new ConstraintException(
          "assignment(s) "
              + views.stream().map(AssignmentView::assignmentId).toList()
              + " are already being dispatched");
    }
    final List<String> ids = claimed.stream().map(AssignmentView::assignmentId).toList();
    if (claimed.size() < views.size()) {
      logger.warn("assignment dispatch skipped rows held by another sender sending={}", ids);
    }
    final AssignmentNotification notification = toNotification(claimed);
    final long startedNanos = System.nanoTime();
    try {
      gateway.send(notification);
    } catch (TransportException ex) {
      metrics.recordTransportDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
      final String reason = truncateError(ex.getMessage());
      transactionTemplate.executeWithoutResult(
          status -> ids.forEach(id -> assignmentRepository.markFailed(id, reason, lockedBy)));
      metrics.recordDispatchResult(DispatchMetrics.RESULT_FAILED, ids.size());
      logger.warn(
          "assignment dispatch failed ids={} recipient={}",
          ids,
          notification.recipientEmail(),
          ex);
      return new DispatchResult(ids, AssignmentStatus.FAILED, null, reason);
    }
    metrics.recordTransportDuration(Duration.ofNanos(System.nanoTime() - startedNanos));

    final Instant sentAt = Instant.now(clock);
    final Integer updated =
        transactionTemplate.execute(
            status ->
                ids.stream()
                    .mapToInt(id -> assignmentRepository.markSent(id, sentAt, lockedBy))
                    .sum());
    if (updated == null || updated != ids.size()) {
      // lease 切れで別の送信者に引き継がれた行は上書きしない
      logger.warn("assignment sent but some rows were not updated ids={} updated={}", ids, updated);
    }
    metrics.recordDispatchResult(DispatchMetrics.RESULT_SENT, ids.size());
    logger.info("assignment dispatch sent ids={} recipient={}", ids, notification.recipientEmail());
    return new DispatchResult(ids, AssignmentStatus.SENT, sentAt, null);
  }

  // 送信 IO の前に claim だけを短いトランザクションで確定させる
  private List<AssignmentView> claim(List<AssignmentView> views, String lockedBy) {
    final Instant now = Instant.now(clock);
    final Instant leaseUntil = now.plus(properties.claimLease());
    final List<AssignmentView> claimed =
        transactionTemplate.execute(
            status ->
                views.stream()
                    .filter(
                        view ->
                            assignmentRepository.claimForDispatch(
                                    view.assignmentId(), now, leaseUntil, lockedBy)
                                == 1)
                    .toList());
    return claimed == null ? List.of() : claimed;
  }

  private AssignmentNotification toNotification(List<AssignmentView> views) {
    final AssignmentView first = views.get(0);
    return new AssignmentNotification(
        first.workerEmail(),
        first.workerName(),
        first.assignmentDate(),
        views.stream()
            .map(
                view ->
                    new AssignmentNotification.Line(
                        view.houseName(), view.quantity(), view.comment()))
            .toList());
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null || message.isBlank()) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
