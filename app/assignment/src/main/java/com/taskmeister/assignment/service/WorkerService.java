/*
 * どこで: Assignment サービス層
 * 何を: 作業者の登録/参照/編集/削除を扱う
 * なぜ: 割当履歴から参照される作業者の削除を拒否し、履歴を壊さないため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.api.ConstraintException;
import com.taskmeister.assignment.api.NotFoundException;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.api.request.WorkerRequest;
import com.taskmeister.assignment.api.response.WorkerResponse;
import com.taskmeister.assignment.model.WorkerRecord;
import com.taskmeister.assignment.repository.AssignmentRepository;
import com.taskmeister.assignment.repository.WorkerRepository;
import com.taskmeister.common.Ids;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class WorkerService {

  private static final Logger logger = LoggerFactory.getLogger(WorkerService.class);
  private static final String RESOURCE = "worker";
  private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  private final WorkerRepository workerRepository;
  private final AssignmentRepository assignmentRepository;
  private final Clock clock;

  public List<WorkerResponse> listWorkers() {
    return workerRepository.findAll().stream().map(WorkerResponse::from).toList();
  }

  public WorkerResponse getWorker(String workerId) {
    return workerRepository
        .findById(workerId)
        .map(WorkerResponse::from)
        .orElseThrow(() -> new NotFoundException(RESOURCE, workerId));
  }

  public WorkerResponse createWorker(@NonNull WorkerRequest request) {
    final Instant now = Instant.now(clock);
    final WorkerRecord created =
        workerRepository.insert(
            new WorkerRecord(
                Ids.newId(),
                requireName(request.name()),
                requireEmail(request.email()),
                blankToNull(request.phone()),
                now,
                now));
    logger.info("worker created workerId={}", created.workerId());
    return WorkerResponse.from(created);
  }

  public WorkerResponse updateWorker(String workerId, @NonNull WorkerRequest request) {
    final WorkerRecord updated =
        workerRepository
            .update(
                workerId,
                requireName(request.name()),
                requireEmail(request.email()),
                blankToNull(request.phone()),
                Instant.now(clock))
            .orElseThrow(() -> new NotFoundException(RESOURCE, workerId));
    logger.info("worker updated workerId={}", workerId);
    return WorkerResponse.from(updated);
  }

  @Transactional
  public void deleteWorker(String workerId) {
    if (!workerRepository.existsById(workerId)) {
      throw new NotFoundException(RESOURCE, workerId);
    }
    final int references = assignmentRepository.countByWorkerId(workerId);
    if (references > 0) {
      throw new ConstraintException(
          "worker " + workerId + " is referenced by " + references + " assignment(s)");
    }
    workerRepository.deleteById(workerId);
    logger.info("worker deleted workerId={}", workerId);
  }

  private String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("name is required");
    }
    return name.trim();
  }

  private String requireEmail(String email) {
    if (email == null || email.isBlank()) {
      throw new ValidationException("email is required");
    }
    final String trimmed = email.trim();
    if (!EMAIL_PATTERN.matcher(trimmed).matches()) {
      throw new ValidationException("email is invalid");
    }
    return trimmed;
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
