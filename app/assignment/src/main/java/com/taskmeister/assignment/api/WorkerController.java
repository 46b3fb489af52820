/*
 * どこで: Assignment API
 * 何を: 作業者の CRUD API を提供するコントローラー
 * なぜ: 画面の作業者ダイアログ操作をサービス呼び出しへ写すため
 */
package com.taskmeister.assignment.api;

import com.taskmeister.assignment.api.request.WorkerRequest;
import com.taskmeister.assignment.api.response.WorkerResponse;
import com.taskmeister.assignment.service.WorkerService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/workers")
@RequiredArgsConstructor
public class WorkerController {

  private final WorkerService workerService;

  @GetMapping
  public ResponseEntity<List<WorkerResponse>> listWorkers() {
    return ResponseEntity.ok(workerService.listWorkers());
  }

  @GetMapping("/{workerId}")
  public ResponseEntity<WorkerResponse> getWorker(@PathVariable("workerId") String workerId) {
    return ResponseEntity.ok(workerService.getWorker(workerId));
  }

  @PostMapping
  public ResponseEntity<WorkerResponse> createWorker(@Valid @RequestBody WorkerRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(workerService.createWorker(request));
  }

  @PutMapping("/{workerId}")
  public ResponseEntity<WorkerResponse> updateWorker(
      @PathVariable("workerId") String workerId, @Valid @RequestBody WorkerRequest request) {
    return ResponseEntity.ok(workerService.updateWorker(workerId, request));
  }

  /** 割当履歴から参照されている場合は 409 を返す。 */
  @DeleteMapping("/{workerId}")
  public ResponseEntity<Void> deleteWorker(@PathVariable("workerId") String workerId) {
    workerService.deleteWorker(workerId);
    return ResponseEntity.noContent().build();
  }
}
