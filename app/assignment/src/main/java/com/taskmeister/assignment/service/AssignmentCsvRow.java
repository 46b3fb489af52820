package com.taskmeister.assignment.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.common.JdbcTimeUtils;

/** One line of the history export. Column order is part of the file format. */
@JsonPropertyOrder({"date", "worker", "house", "quantity", "comment", "status", "sent_at"})
public record AssignmentCsvRow(
    String date,
    String worker,
    String house,
    int quantity,
    String comment,
    String status,
    @JsonProperty("sent_at") String sentAt) {

  public static AssignmentCsvRow from(AssignmentView view) {
    return new AssignmentCsvRow(
        JdbcTimeUtils.toText(view.assignmentDate()),
        view.workerName(),
        view.houseName(),
        view.quantity(),
        view.comment(),
        view.status().name(),
        JdbcTimeUtils.toText(view.sentAt()));
  }
}
