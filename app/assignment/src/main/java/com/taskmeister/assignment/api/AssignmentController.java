/*
 * どこで: Assignment API
 * 何を: 割当の登録/再送/履歴一覧/CSV 出力を提供するコントローラー
 * なぜ: 画面のコマンド (Submit/Resend/Filter/Export) をサービス呼び出しへ写すため
 */
package com.taskmeister.assignment.api;

import com.taskmeister.assignment.api.request.AssignmentItemRequest;
import com.taskmeister.assignment.api.request.SubmitAssignmentsRequest;
import com.taskmeister.assignment.api.response.AssignmentResponse;
import com.taskmeister.assignment.api.response.DispatchResponse;
import com.taskmeister.assignment.api.response.SubmissionResponse;
import com.taskmeister.assignment.model.AssignmentFilter;
import com.taskmeister.assignment.model.AssignmentStatus;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.assignment.model.NewAssignment;
import com.taskmeister.assignment.service.AssignmentDispatchService;
import com.taskmeister.assignment.service.AssignmentHistoryService;
import com.taskmeister.assignment.service.AssignmentSubmissionService;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/assignments")
@RequiredArgsConstructor
public class AssignmentController {

  private final AssignmentSubmissionService submissionService;
  private final AssignmentDispatchService dispatchService;
  private final AssignmentHistoryService historyService;

  /**
   * 役割:
   * - 1 作業者 x 1 日分の住宅選択を一括登録する。
   *
   * 期待動作:
   * - ルール違反は 400/404/409 で即時に返し、1 件も登録しない。
   * - 登録済みの PENDING 割当を 202 で返し、メール送信は送信スレッドで続行する。
   */
  @PostMapping
  public ResponseEntity<SubmissionResponse> submit(@RequestBody SubmitAssignmentsRequest request) {
    final List<NewAssignment> items =
        request.items() == null
            ? List.of()
            : request.items().stream().map(this::toNewAssignment).toList();
    final AssignmentSubmissionService.Submission submission =
        submissionService.submit(request.workerId(), request.assignmentDate(), items);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new SubmissionResponse(
                submission.assignments().stream().map(AssignmentResponse::from).toList()));
  }

  /**
   * 役割:
   * - PENDING/FAILED の割当を 1 件だけ再送する。
   *
   * 期待動作:
   * - 送信結果 (SENT/FAILED と失敗理由) を 200 で返す。
   * - SENT 済みは 400、住宅が別の割当で埋まっている場合は 409 とする。
   * - 同じ割当を送信中の場合は 409 (CONSTRAINT_VIOLATION) とし、二重に送らない。
   */
  @PostMapping("/{assignmentId}:resend")
  public ResponseEntity<DispatchResponse> resend(
      @PathVariable("assignmentId") String assignmentId) {
    return ResponseEntity.ok(DispatchResponse.from(dispatchService.resend(assignmentId)));
  }

  @GetMapping
  public ResponseEntity<List<AssignmentResponse>> list(
      @RequestParam(name = "worker_id", required = false) String workerId,
      @RequestParam(name = "house_id", required = false) String houseId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate to,
      @RequestParam(name = "text", required = false) String text,
      @RequestParam(name = "status", required = false) AssignmentStatus status) {
    final AssignmentFilter filter = new AssignmentFilter(workerId, houseId, from, to, text, status);
    return ResponseEntity.ok(
        historyService.list(filter).stream().map(AssignmentResponse::from).toList());
  }

  @GetMapping("/export")
  public void export(
      @RequestParam(name = "worker_id", required = false) String workerId,
      @RequestParam(name = "house_id", required = false) String houseId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate to,
      @RequestParam(name = "text", required = false) String text,
      @RequestParam(name = "status", required = false) AssignmentStatus status,
      HttpServletResponse response)
      throws IOException {
    final AssignmentFilter filter = new AssignmentFilter(workerId, houseId, from, to, text, status);
    // 検証エラーを JSON で返せるよう、ヘッダ設定より先に絞り込む
    final List<AssignmentView> rows = historyService.list(filter);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setContentType("text/csv; charset=UTF-8");
    response.setHeader(
        HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"assignments.csv\"");
    historyService.writeCsv(rows, response.getWriter());
  }

  private NewAssignment toNewAssignment(AssignmentItemRequest item) {
    return item == null ? new NewAssignment(null, null, null) : item.toNewAssignment();
  }
}
