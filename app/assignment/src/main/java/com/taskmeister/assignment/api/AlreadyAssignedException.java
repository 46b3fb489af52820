/*
 * どこで: Assignment API
 * 何を: 同一住宅・同一日の二重割当を表す
 * なぜ: 409 応答へ変換し、画面側に最新の候補一覧を取り直させるため
 */
package com.taskmeister.assignment.api;

import java.time.LocalDate;

public class AlreadyAssignedException extends RuntimeException {

  private final String houseId;
  private final LocalDate assignmentDate;

  public AlreadyAssignedException(String houseId, LocalDate assignmentDate) {
    super("house " + houseId + " is already assigned for " + assignmentDate);
    this.houseId = houseId;
    this.assignmentDate = assignmentDate;
  }

  public String getHouseId() {
    return houseId;
  }

  public LocalDate getAssignmentDate() {
    return assignmentDate;
  }
}
