package com.taskmeister.assignment.model;

/** One selected house of a submission, before validation. */
public record NewAssignment(String houseId, Integer quantity, String comment) {}
