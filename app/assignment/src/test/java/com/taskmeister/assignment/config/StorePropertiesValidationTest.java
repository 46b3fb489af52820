/*
 * どこで: Assignment 設定のバリデーションテスト
 * 何を: StoreProperties の Bean Validation を検証する
 * なぜ: 保存先未指定のまま起動しないことを保証するため
 */
package com.taskmeister.assignment.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StorePropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesForConfiguredPath() {
    assertThat(validator.validate(new StoreProperties("./data/store.db", 5000))).isEmpty();
  }

  @Test
  void validationFailsForBlankPath() {
    assertThat(validator.validate(new StoreProperties(" ", 5000))).isNotEmpty();
  }
}
