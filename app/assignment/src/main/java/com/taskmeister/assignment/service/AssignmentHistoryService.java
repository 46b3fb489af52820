/*
 * どこで: Assignment サービス層
 * 何を: 割当履歴の絞り込み一覧と CSV 出力を提供する
 * なぜ: 一覧と出力で同じ条件・同じ並び順を保証するため
 */
package com.taskmeister.assignment.service;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.model.AssignmentFilter;
import com.taskmeister.assignment.model.AssignmentView;
import com.taskmeister.assignment.repository.AssignmentRepository;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AssignmentHistoryService {

  private static final Logger logger = LoggerFactory.getLogger(AssignmentHistoryService.class);

  private final AssignmentRepository assignmentRepository;
  private final CsvMapper csvMapper;
  private final CsvSchema schema;
  private final String headerLine;

  public AssignmentHistoryService(AssignmentRepository assignmentRepository) {
    this.assignmentRepository = assignmentRepository;
    // 出力先 Writer のクローズは呼び出し側に任せる
    this.csvMapper = CsvMapper.builder().disable(StreamWriteFeature.AUTO_CLOSE_TARGET).build();
    this.schema = csvMapper.schemaFor(AssignmentCsvRow.class).withoutHeader();
    // 0 件でもヘッダ行は必ず出す
    final StringJoiner header = new StringJoiner(",", "", "\n");
    schema.forEach(column -> header.add(column.getName()));
    this.headerLine = header.toString();
  }

  /** Newest date first; rows of the same date keep their creation order. */
  public List<AssignmentView> list(AssignmentFilter filter) {
    final AssignmentFilter effective = filter == null ? AssignmentFilter.none() : filter;
    if (effective.from() != null
        && effective.to() != null
        && effective.from().isAfter(effective.to())) {
      throw new ValidationException("from must not be after to");
    }
    return assignmentRepository.search(effective);
  }

  /** Writes the rows of {@link #list} as CSV with a header line. Returns the row count. */
  public int exportCsv(AssignmentFilter filter, Writer writer) throws IOException {
    return writeCsv(list(filter), writer);
  }

  public int writeCsv(List<AssignmentView> rows, Writer writer) throws IOException {
    writer.write(headerLine);
    try (SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
      for (AssignmentView row : rows) {
        sequence.write(AssignmentCsvRow.from(row));
      }
    }
    writer.flush();
    logger.info("assignment history exported rows={}", rows.size());
    return rows.size();
  }
}
