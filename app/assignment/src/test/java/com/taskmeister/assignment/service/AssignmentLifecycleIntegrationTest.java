/*
 * どこで: Assignment 送信ライフサイクルの統合テスト
 * 何を: 登録 -> 送信失敗 (注入) -> 再送成功 の状態遷移、履歴件数、送信 claim の排他を検証する
 * なぜ: 失敗状態が記録され、手動再送で同じ行が SENT になることを保証するため
 */
package com.taskmeister.assignment.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taskmeister.assignment.AbstractSqliteStoreTest;
import com.taskmeister.assignment.api.AlreadyAssignedException;
import com.taskmeister.assignment.api.ConstraintException;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.model.AssignmentFilter;
import com.taskmeister.assignment.model.AssignmentRecord;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.assignment.model.DispatchResult;
import com.taskmeister.assignment.model.HouseRecord;
import com.taskmeister.assignment.model.NewAssignment;
import com.taskmeister.assignment.model.WorkerRecord;
import com.taskmeister.assignment.repository.AssignmentRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AssignmentLifecycleIntegrationTest extends AbstractSqliteStoreTest {

  @Autowired private AssignmentSubmissionService submissionService;
  @Autowired private AssignmentDispatchService dispatchService;
  @Autowired private AssignmentRulesService rulesService;
  @Autowired private AssignmentRepository assignmentRepository;

  private HouseRecord oakStreet;
  private HouseRecord elmStreet;
  private LocalDate date;

  @BeforeEach
  void setUpReferences() {
    oakStreet = givenHouse("Oak Street 1");
    elmStreet = givenHouse("Elm Street 2");
    date = daysFromToday(3);
  }

  @Test
  void submissionSendsOneMessageAndMarksEveryAssignmentSent() throws Exception {
    final WorkerRecord anna = givenWorker("Anna", "anna@example.com");

    final AssignmentSubmissionService.Submission submission =
        submissionService.submit(
            anna.workerId(),
            date,
            List.of(
                new NewAssignment(oakStreet.houseId(), 2, "Ring twice"),
                new NewAssignment(elmStreet.houseId(), 1, null)));
    assertThat(submission.assignments())
        .extracting(AssignmentView::status)
        .containsOnly(AssignmentStatus.PENDING);

    final DispatchResult result = submission.dispatch().get(10, TimeUnit.SECONDS);

    assertThat(result.sent()).isTrue();
    final List<AssignmentView> rows = assignmentRepository.search(AssignmentFilter.none());
    assertThat(rows).hasSize(2);
    assertThat(rows).extracting(AssignmentView::status).containsOnly(AssignmentStatus.SENT);
    assertThat(rows).extracting(AssignmentView::sentAt).containsOnly(result.sentAt());
  }

  @Test
  void transportFailureIsRecordedAndResendAfterFixingAddressSucceeds() throws Exception {
    final WorkerRecord anna = givenWorker("Anna", "fail-anna@example.com");
    final AssignmentSubmissionService.Submission submission =
        submissionService.submit(
            anna.workerId(), date, List.of(new NewAssignment(oakStreet.houseId(), 2, null)));
    final String assignmentId = submission.assignments().get(0).assignmentId();

    final DispatchResult failed = submission.dispatch().get(10, TimeUnit.SECONDS);

    assertThat(failed.status()).isEqualTo(AssignmentStatus.FAILED);
    final AssignmentRecord afterFailure = assignmentRepository.findById(assignmentId).orElseThrow();
    assertThat(afterFailure.status()).isEqualTo(AssignmentStatus.FAILED);
    assertThat(afterFailure.sentAt()).isNull();
    assertThat(afterFailure.failureReason()).contains("simulated transport failure");

    workerRepository.update(
        anna.workerId(), anna.name(), "anna@example.com", null, Instant.now());
    final DispatchResult resent = dispatchService.resend(assignmentId);

    assertThat(resent.sent()).isTrue();
    final AssignmentRecord afterResend = assignmentRepository.findById(assignmentId).orElseThrow();
    assertThat(afterResend.status()).isEqualTo(AssignmentStatus.SENT);
    assertThat(afterResend.sentAt()).isEqualTo(resent.sentAt());
    assertThat(afterResend.failureReason()).isNull();
    assertThat(countAssignments()).isEqualTo(1);
  }

  @Test
  void failedResendKeepsAssignmentFailedWithFreshReason() {
    final WorkerRecord anna = givenWorker("Anna", "fail-anna@example.com");
    final AssignmentRecord record =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    dispatchService.dispatch(List.of(record.assignmentId()));

    final DispatchResult again = dispatchService.resend(record.assignmentId());

    assertThat(again.status()).isEqualTo(AssignmentStatus.FAILED);
    assertThat(again.failureReason()).contains("fail-anna@example.com");
    assertThat(assignmentRepository.findById(record.assignmentId()).orElseThrow().status())
        .isEqualTo(AssignmentStatus.FAILED);
  }

  @Test
  void resendOfSentAssignmentIsRejected() {
    final WorkerRecord anna = givenWorker("Anna", "anna@example.com");
    final AssignmentRecord record =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    dispatchService.dispatch(List.of(record.assignmentId()));

    assertThatThrownBy(() -> dispatchService.resend(record.assignmentId()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void resendIsRejectedWhenHouseWasReassignedAfterFailure() {
    final WorkerRecord anna = givenWorker("Anna", "fail-anna@example.com");
    final WorkerRecord ben = givenWorker("Ben", "ben@example.com");
    final AssignmentRecord failed =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    dispatchService.dispatch(List.of(failed.assignmentId()));
    rulesService.createAssignment(ben.workerId(), oakStreet.houseId(), date, 1, null);

    assertThatThrownBy(() -> dispatchService.resend(failed.assignmentId()))
        .isInstanceOf(AlreadyAssignedException.class);
    assertThat(assignmentRepository.findById(failed.assignmentId()).orElseThrow().status())
        .isEqualTo(AssignmentStatus.FAILED);
  }

  @Test
  void dispatchOfFailedAssignmentDoesNotNotifyAboutHouseHeldByAnotherWorker() {
    final WorkerRecord anna = givenWorker("Anna", "fail-anna@example.com");
    final WorkerRecord ben = givenWorker("Ben", "ben@example.com");
    final AssignmentRecord failed =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    dispatchService.dispatch(List.of(failed.assignmentId()));
    final AssignmentRecord taken =
        rulesService.createAssignment(ben.workerId(), oakStreet.houseId(), date, 1, null);
    workerRepository.update(
        anna.workerId(), anna.name(), "anna@example.com", null, Instant.now());

    assertThatThrownBy(() -> dispatchService.dispatch(List.of(failed.assignmentId())))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not pending");

    assertThat(assignmentRepository.findById(failed.assignmentId()).orElseThrow().status())
        .isEqualTo(AssignmentStatus.FAILED);
    assertThat(assignmentRepository.findById(taken.assignmentId()).orElseThrow().status())
        .isEqualTo(AssignmentStatus.PENDING);
  }

  @Test
  void resendIsRejectedWhileAnotherSenderHoldsTheAssignment() {
    final WorkerRecord anna = givenWorker("Anna", "anna@example.com");
    final AssignmentRecord pending =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    final Instant now = Instant.now();
    assertThat(
            assignmentRepository.claimForDispatch(
                pending.assignmentId(), now, now.plusSeconds(120), "submission-sender"))
        .isEqualTo(1);

    assertThatThrownBy(() -> dispatchService.resend(pending.assignmentId()))
        .isInstanceOf(ConstraintException.class)
        .hasMessageContaining("already being dispatched");

    final AssignmentRecord stored =
        assignmentRepository.findById(pending.assignmentId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(AssignmentStatus.PENDING);
    assertThat(stored.sentAt()).isNull();
  }

  @Test
  void resendTakesOverClaimWhoseLeaseHasExpired() {
    final WorkerRecord anna = givenWorker("Anna", "anna@example.com");
    final AssignmentRecord pending =
        rulesService.createAssignment(anna.workerId(), oakStreet.houseId(), date, 1, null);
    final Instant longAgo = Instant.now().minusSeconds(3600);
    assignmentRepository.claimForDispatch(
        pending.assignmentId(), longAgo, longAgo.plusSeconds(120), "crashed-sender");

    final DispatchResult result = dispatchService.resend(pending.assignmentId());

    assertThat(result.sent()).isTrue();
    assertThat(assignmentRepository.findById(pending.assignmentId()).orElseThrow().status())
        .isEqualTo(AssignmentStatus.SENT);
  }
}
