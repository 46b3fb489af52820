/*
 * どこで: Assignment API
 * 何を: 住宅の CRUD と日付別の割当可能住宅一覧を提供するコントローラー
 * なぜ: 画面の住宅ダイアログと住宅選択リストをサービス呼び出しへ写すため
 */
package com.taskmeister.assignment.api;

import com.taskmeister.assignment.api.request.HouseRequest;
import com.taskmeister.assignment.api.response.HouseResponse;
import com.taskmeister.assignment.service.AssignmentRulesService;
import com.taskmeister.assignment.service.HouseService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/houses")
@RequiredArgsConstructor
public class HouseController {

  private final HouseService houseService;
  private final AssignmentRulesService rulesService;

  @GetMapping
  public ResponseEntity<List<HouseResponse>> listHouses() {
    return ResponseEntity.ok(houseService.listHouses());
  }

  /**
   * 役割:
   * - 指定日に PENDING/SENT の割当を持たない住宅を返す。
   *
   * 期待動作:
   * - query 指定時は住宅名の部分一致 (大文字小文字無視) で絞り込む。
   */
  @GetMapping("/eligible")
  public ResponseEntity<List<HouseResponse>> listEligibleHouses(
      @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
      @RequestParam(name = "query", required = false) String query) {
    return ResponseEntity.ok(
        rulesService.findEligibleHouses(date, query).stream().map(HouseResponse::from).toList());
  }

  @GetMapping("/{houseId}")
  public ResponseEntity<HouseResponse> getHouse(@PathVariable("houseId") String houseId) {
    return ResponseEntity.ok(houseService.getHouse(houseId));
  }

  @PostMapping
  public ResponseEntity<HouseResponse> createHouse(@Valid @RequestBody HouseRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(houseService.createHouse(request));
  }

  @PutMapping("/{houseId}")
  public ResponseEntity<HouseResponse> updateHouse(
      @PathVariable("houseId") String houseId, @Valid @RequestBody HouseRequest request) {
    return ResponseEntity.ok(houseService.updateHouse(houseId, request));
  }

  @DeleteMapping("/{houseId}")
  public ResponseEntity<Void> deleteHouse(@PathVariable("houseId") String houseId) {
    houseService.deleteHouse(houseId);
    return ResponseEntity.noContent().build();
  }
}
