/*
 * どこで: Assignment ルールエンジンのユニットテスト
 * 何を: 入力検証の分岐と、検証失敗時に登録しないことを検証する
 * なぜ: 画面へ返すエラー種別の回帰を防ぐため
 */
package com.taskmeister.assignment.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.taskmeister.assignment.api.AlreadyAssignedException;
import com.taskmeister.assignment.api.NotFoundException;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.config.AssignmentRuleProperties;
import com.taskmeister.assignment.model.AssignmentRecord;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.HouseRecord;
import com.taskmeister.assignment.model.NewAssignment;
import com.taskmeister.assignment.repository.AssignmentRepository;
import com.taskmeister.assignment.repository.HouseRepository;
import com.taskmeister.assignment.repository.WorkerRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AssignmentRulesServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-10T09:00:00Z");
  private static final LocalDate TODAY = LocalDate.parse("2026-03-10");
  private static final LocalDate DATE = LocalDate.parse("2026-03-12");

  @Mock private WorkerRepository workerRepository;
  @Mock private HouseRepository houseRepository;
  @Mock private AssignmentRepository assignmentRepository;

  private AssignmentRulesService service;

  @BeforeEach
  void setUp() {
    service =
        new AssignmentRulesService(
            workerRepository,
            houseRepository,
            assignmentRepository,
            new AssignmentRuleProperties(20, ZoneOffset.UTC),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void createAssignmentStoresPendingRecordWithTrimmedComment() {
    when(workerRepository.existsById("worker-1")).thenReturn(true);
    when(houseRepository.findById("house-1")).thenReturn(Optional.of(house("house-1", "Oak")));
    when(assignmentRepository.existsActive("house-1", DATE, null)).thenReturn(false);

    final AssignmentRecord created =
        service.createAssignment("worker-1", "house-1", DATE, 4, "  back door  ");

    final ArgumentCaptor<AssignmentRecord> captor = ArgumentCaptor.forClass(AssignmentRecord.class);
    verify(assignmentRepository).insert(captor.capture());
    assertThat(captor.getValue()).isEqualTo(created);
    assertThat(created.status()).isEqualTo(AssignmentStatus.PENDING);
    assertThat(created.comment()).isEqualTo("back door");
    assertThat(created.quantity()).isEqualTo(4);
    assertThat(created.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(created.sentAt()).isNull();
  }

  @Test
  void blankCommentIsStoredAsNull() {
    when(workerRepository.existsById("worker-1")).thenReturn(true);
    when(houseRepository.findById("house-1")).thenReturn(Optional.of(house("house-1", "Oak")));

    final AssignmentRecord created = service.createAssignment("worker-1", "house-1", DATE, 1, "   ");

    assertThat(created.comment()).isNull();
  }

  @Test
  void zeroQuantityIsRejectedWithoutInsert() {
    assertThatThrownBy(() -> service.createAssignment("worker-1", "house-1", DATE, 0, null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("quantity");

    verify(assignmentRepository, never()).insert(any());
  }

  @Test
  void missingQuantityIsRejected() {
    assertThatThrownBy(() -> service.createAssignment("worker-1", "house-1", DATE, null, null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void pastDateIsRejected() {
    assertThatThrownBy(
            () -> service.createAssignment("worker-1", "house-1", TODAY.minusDays(1), 1, null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("past");
  }

  @Test
  void todayIsDecidedInConfiguredZone() {
    // 2026-03-10T09:00Z は UTC-10 ではまだ 03-09
    final AssignmentRulesService hawaii =
        new AssignmentRulesService(
            workerRepository,
            houseRepository,
            assignmentRepository,
            new AssignmentRuleProperties(20, ZoneId.of("Pacific/Honolulu")),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    when(workerRepository.existsById("worker-1")).thenReturn(true);
    when(houseRepository.findById("house-1")).thenReturn(Optional.of(house("house-1", "Oak")));

    final AssignmentRecord created =
        hawaii.createAssignment("worker-1", "house-1", LocalDate.parse("2026-03-09"), 1, null);

    assertThat(created.assignmentDate()).isEqualTo(LocalDate.parse("2026-03-09"));
  }

  @Test
  void missingDateIsRejected() {
    assertThatThrownBy(() -> service.createAssignment("worker-1", "house-1", null, 1, null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void overlongCommentIsRejected() {
    assertThatThrownBy(
            () -> service.createAssignment("worker-1", "house-1", DATE, 1, "x".repeat(21)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("20");
  }

  @Test
  void emptySelectionIsRejected() {
    assertThatThrownBy(() -> service.createAssignments("worker-1", DATE, List.of()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void houseSelectedTwiceIsRejected() {
    final List<NewAssignment> items =
        List.of(new NewAssignment("house-1", 1, null), new NewAssignment("house-1", 2, null));

    assertThatThrownBy(() -> service.createAssignments("worker-1", DATE, items))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("twice");
  }

  @Test
  void unknownWorkerIsNotFound() {
    when(workerRepository.existsById("missing")).thenReturn(false);

    assertThatThrownBy(() -> service.createAssignment("missing", "house-1", DATE, 1, null))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("worker");
  }

  @Test
  void unknownHouseIsNotFound() {
    when(workerRepository.existsById("worker-1")).thenReturn(true);
    when(houseRepository.findById("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.createAssignment("worker-1", "missing", DATE, 1, null))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("house");
  }

  @Test
  void occupiedHouseIsAlreadyAssigned() {
    when(workerRepository.existsById("worker-1")).thenReturn(true);
    when(houseRepository.findById("house-1")).thenReturn(Optional.of(house("house-1", "Oak")));
    when(assignmentRepository.existsActive("house-1", DATE, null)).thenReturn(true);

    assertThatThrownBy(() -> service.createAssignment("worker-1", "house-1", DATE, 1, null))
        .isInstanceOf(AlreadyAssignedException.class)
        .satisfies(
            ex -> {
              final AlreadyAssignedException already = (AlreadyAssignedException) ex;
              assertThat(already.getHouseId()).isEqualTo("house-1");
              assertThat(already.getAssignmentDate()).isEqualTo(DATE);
            });
    verify(assignmentRepository, never()).insert(any());
  }

  @Test
  void findEligibleHousesFiltersByNameIgnoringCase() {
    when(houseRepository.findEligible(DATE))
        .thenReturn(
            List.of(house("h1", "Oak Street 1"), house("h2", "Elm Street 2"), house("h3", "Oakwood")));

    assertThat(service.findEligibleHouses(DATE, " oak "))
        .extracting(HouseRecord::houseId)
        .containsExactly("h1", "h3");
    assertThat(service.findEligibleHouses(DATE, null)).hasSize(3);
  }

  private HouseRecord house(String id, String name) {
    return new HouseRecord(id, name, null, FIXED_NOW, FIXED_NOW);
  }
}
