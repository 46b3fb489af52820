/*
 * どこで: Assignment サービス層
 * 何を: 日付ごとの割当可能住宅の算出と、割当の検証/登録を行う
 * なぜ: 同一住宅・同一日の二重割当を登録トランザクション内で確実に防ぐため
 */
package com.taskmeister.assignment.service;

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
import com.taskmeister.common.Ids;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AssignmentRulesService {

  private static final Logger logger = LoggerFactory.getLogger(AssignmentRulesService.class);

  private final WorkerRepository workerRepository;
  private final HouseRepository houseRepository;
  private final AssignmentRepository assignmentRepository;
  private final AssignmentRuleProperties properties;
  private final Clock clock;

  /** Houses without a PENDING or SENT assignment on {@code date}, ordered by name. */
  public List<HouseRecord> computeEligibleHouses(LocalDate date) {
    if (date == null) {
      throw new ValidationException("date is required");
    }
    return houseRepository.findEligible(date);
  }

  /** {@link #computeEligibleHouses} narrowed to names containing {@code query}, ignoring case. */
  public List<HouseRecord> findEligibleHouses(LocalDate date, String query) {
    final List<HouseRecord> eligible = computeEligibleHouses(date);
    if (query == null || query.isBlank()) {
      return eligible;
    }
    final String needle = query.trim().toLowerCase(Locale.ROOT);
    return eligible.stream()
        .filter(house -> house.name().toLowerCase(Locale.ROOT).contains(needle))
        .toList();
  }

  @Transactional
  public AssignmentRecord createAssignment(
      String workerId, String houseId, LocalDate date, Integer quantity, String comment) {
    return insertAll(workerId, date, List.of(new NewAssignment(houseId, quantity, comment)))
        .get(0);
  }

  /**
   * Creates one PENDING assignment per item, all for the same worker and date. Either every item
   * is stored or none is.
   */
  @Transactional
  public List<AssignmentRecord> createAssignments(
      String workerId, LocalDate date, List<NewAssignment> items) {
    return insertAll(workerId, date, items);
  }

  private List<AssignmentRecord> insertAll(
      String workerId, LocalDate date, List<NewAssignment> items) {
    validateDate(date);
    if (items == null || items.isEmpty()) {
      throw new ValidationException("at least one house must be selected");
    }
    final List<NewAssignment> normalized = new ArrayList<>(items.size());
    final Set<String> houseIds = new HashSet<>();
    for (NewAssignment item : items) {
      final NewAssignment checked = validateItem(item);
      if (!houseIds.add(checked.houseId())) {
        throw new ValidationException("house " + checked.houseId() + " is selected twice");
      }
      normalized.add(checked);
    }
    if (workerId == null || workerId.isBlank()) {
      throw new ValidationException("worker_id is required");
    }
    if (!workerRepository.existsById(workerId)) {
      throw new NotFoundException("worker", workerId);
    }

    // 判定と登録は同じトランザクション (単一接続) 上で行う
    final Instant now = Instant.now(clock);
    final List<AssignmentRecord> created = new ArrayList<>(normalized.size());
    for (NewAssignment item : normalized) {
      if (houseRepository.findById(item.houseId()).isEmpty()) {
        throw new NotFoundException("house", item.houseId());
      }
      if (assignmentRepository.existsActive(item.houseId(), date, null)) {
        throw new AlreadyAssignedException(item.houseId(), date);
      }
      final AssignmentRecord record =
          new AssignmentRecord(
              Ids.newId(),
              workerId,
              item.houseId(),
              date,
              item.quantity(),
              item.comment(),
              AssignmentStatus.PENDING,
              null,
              now,
              null);
      assignmentRepository.insert(record);
      created.add(record);
    }
    logger.info(
        "assignments created workerId={} date={} count={}", workerId, date, created.size());
    return created;
  }

  private void validateDate(LocalDate date) {
    if (date == null) {
      throw new ValidationException("assignment_date is required");
    }
    final LocalDate today = LocalDate.now(clock.withZone(properties.zone()));
    if (date.isBefore(today)) {
      throw new ValidationException("assignment_date must not be in the past");
    }
  }

  private NewAssignment validateItem(NewAssignment item) {
    if (item == null || item.houseId() == null || item.houseId().isBlank()) {
      throw new ValidationException("house_id is required");
    }
    if (item.quantity() == null || item.quantity() < 1) {
      throw new ValidationException("quantity must be at least 1");
    }
    String comment = item.comment();
    if (comment != null) {
      comment = comment.strip();
      if (comment.isEmpty()) {
        comment = null;
      } else if (comment.length() > properties.commentMaxLength()) {
        throw new ValidationException(
            "comment must be at most " + properties.commentMaxLength() + " characters");
      }
    }
    return new NewAssignment(item.houseId().trim(), item.quantity(), comment);
  }
}
