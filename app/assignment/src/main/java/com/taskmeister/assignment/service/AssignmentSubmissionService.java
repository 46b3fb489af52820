/*
 * どこで: Assignment サービス層
 * 何を: 1 作業者 x 1 日分の住宅選択を登録し、通知を送信スレッドへ渡す
 * なぜ: ルール違反は即時に返しつつ、メール送信で呼び出し側を待たせないため
 */
package com.taskmeister.assignment.service;

import com.taskmeister.assignment.model.AssignmentRecord;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.assignment.model.DispatchResult;
import com.taskmeister.assignment.model.NewAssignment;
import com.taskmeister.assignment.repository.AssignmentRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AssignmentSubmissionService {

  private final AssignmentRulesService rulesService;
  private final AssignmentDispatchService dispatchService;
  private final AssignmentRepository assignmentRepository;

  public Submission submit(String workerId, LocalDate date, List<NewAssignment> items) {
    final List<String> ids =
        rulesService.createAssignments(workerId, date, items).stream()
            .map(AssignmentRecord::assignmentId)
            .toList();
    // 送信スレッドが状態を書き換える前の PENDING を返す
    final List<AssignmentView> created = assignmentRepository.findViewsByIds(ids);
    return new Submission(created, dispatchService.dispatchAsync(ids));
  }

  public record Submission(
      List<AssignmentView> assignments, CompletableFuture<DispatchResult> dispatch) {

    public Submission {
      assignments = List.copyOf(assignments);
    }
  }
}
