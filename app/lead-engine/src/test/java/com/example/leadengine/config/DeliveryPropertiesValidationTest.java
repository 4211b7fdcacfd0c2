package com.example.leadengine.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void localProviderNeedsNoBaseUrl() {
    final DeliveryProperties properties = new DeliveryProperties(null, null, null, null, null);

    assertThat(properties.provider()).isEqualTo(DeliveryProperties.PROVIDER_LOCAL);
    assertThat(properties.apiKeyHeaderName()).isEqualTo("X-Api-Key");
    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void httpProviderRequiresBaseUrl() {
    final DeliveryProperties properties = new DeliveryProperties("http", " ", "key", null, null);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void unknownProviderIsRejected() {
    final DeliveryProperties properties = new DeliveryProperties("smtp", null, null, null, null);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void dispatchLeaseMustBePositive() {
    final OutboundDispatchProperties properties =
        new OutboundDispatchProperties(true, Duration.ofSeconds(30), 10, Duration.ZERO, "c-1", 500);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void approvalThresholdMustNotBeNegative() {
    final ReplyProperties properties =
        new ReplyProperties(-1, "https://book.example/slot", null, null, null, null, null, null);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
