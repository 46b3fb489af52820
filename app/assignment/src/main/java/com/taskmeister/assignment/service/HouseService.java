package com.taskmeister.assignment.service;

import com.taskmeister.assignment.api.ConstraintException;
import com.taskmeister.assignment.api.NotFoundException;
import com.taskmeister.assignment.api.ValidationException;
import com.taskmeister.assignment.api.request.HouseRequest;
import com.taskmeister.assignment.api.response.HouseResponse;
import com.taskmeister.assignment.model.HouseRecord;
import com.taskmeister.assignment.repository.AssignmentRepository;
import com.taskmeister.assignment.repository.HouseRepository;
import com.taskmeister.common.Ids;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class HouseService {

  private static final Logger logger = LoggerFactory.getLogger(HouseService.class);
  private static final String RESOURCE = "house";

  private final HouseRepository houseRepository;
  private final AssignmentRepository assignmentRepository;
  private final Clock clock;

  public List<HouseResponse> listHouses() {
    return houseRepository.findAll().stream().map(HouseResponse::from).toList();
  }

  public HouseResponse getHouse(String houseId) {
    return houseRepository
        .findById(houseId)
        .map(HouseResponse::from)
        .orElseThrow(() -> new NotFoundException(RESOURCE, houseId));
  }

  public HouseResponse createHouse(@NonNull HouseRequest request) {
    final Instant now = Instant.now(clock);
    final HouseRecord created =
        houseRepository.insert(
            new HouseRecord(
                Ids.newId(),
                requireName(request.name()),
                blankToNull(request.comment()),
                now,
                now));
    logger.info("house created houseId={}", created.houseId());
    return HouseResponse.from(created);
  }

  public HouseResponse updateHouse(String houseId, @NonNull HouseRequest request) {
    final HouseRecord updated =
        houseRepository
            .update(
                houseId,
                requireName(request.name()),
                blankToNull(request.comment()),
                Instant.now(clock))
            .orElseThrow(() -> new NotFoundException(RESOURCE, houseId));
    logger.info("house updated houseId={}", houseId);
    return HouseResponse.from(updated);
  }

  @Transactional
  public void deleteHouse(String houseId) {
    if (houseRepository.findById(houseId).isEmpty()) {
      throw new NotFoundException(RESOURCE, houseId);
    }
    final int references = assignmentRepository.countByHouseId(houseId);
    if (references > 0) {
      throw new ConstraintException(
          "house " + houseId + " is referenced by " + references + " assignment(s)");
    }
    houseRepository.deleteById(houseId);
    logger.info("house deleted houseId={}", houseId);
  }

  private String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("name is required");
    }
    return name.trim();
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
