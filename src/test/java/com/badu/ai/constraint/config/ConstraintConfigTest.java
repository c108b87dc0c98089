package com.badu.ai.constraint.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConstraintConfig builder and validation.
 */
class ConstraintConfigTest {

  @Test
  @DisplayName("Builder creates valid config with defaults")
  void builder_defaults_createsValidConfig() {
    ConstraintConfig config = ConstraintConfig.builder().build();

    assertEquals(512, config.getMaxSteps());
    assertEquals(4, config.getMaxBacktrackDepth());
    assertEquals(64, config.getMaxTotalBacktracks());
    assertEquals(Float.NEGATIVE_INFINITY, config.getLogitFloor());
    assertFalse(config.isStopOnFirstAccept());
    assertEquals(ExhaustionPolicy.FAIL, config.getExhaustionPolicy());
    assertEquals(16, config.getForcedCompletionMaxTokens());
    assertTrue(config.getParallelism() >= 1);
    assertTrue(config.isRecoveryEnabled());
    assertTrue(config.isEnabled(Feature.FORCED_COMPLETION));
  }

  @Test
  @DisplayName("Builder validates maxSteps range")
  void builder_zeroMaxSteps_throwsException() {
    IllegalStateException exception = assertThrows(IllegalStateException.class,
        () -> ConstraintConfig.builder().maxSteps(0).build());

    assertTrue(exception.getMessage().contains("maxSteps must be in range [1, 65536]"));
  }

  @Test
  @DisplayName("Builder validates maxBacktrackDepth range")
  void builder_negativeBacktrackDepth_throwsException() {
    IllegalStateException exception = assertThrows(IllegalStateException.class,
        () -> ConstraintConfig.builder().maxBacktrackDepth(-1).build());

    assertTrue(exception.getMessage().contains("maxBacktrackDepth must be in range [0, 64]"));
  }

  @Test
  @DisplayName("Builder rejects NaN and positive infinity as logit floor")
  void builder_invalidLogitFloor_throwsException() {
    assertThrows(IllegalStateException.class, () -> ConstraintConfig.builder().logitFloor(Float.NaN).build());
    assertThrows(IllegalStateException.class,
        () -> ConstraintConfig.builder().logitFloor(Float.POSITIVE_INFINITY).build());
    assertEquals(-1e9f, ConstraintConfig.builder().logitFloor(-1e9f).build().getLogitFloor());
  }

  @Test
  @DisplayName("Builder rejects missing policy and flags")
  void builder_nullFields_throwsException() {
    assertThrows(IllegalStateException.class, () -> ConstraintConfig.builder().exhaustionPolicy(null).build());
    assertThrows(IllegalStateException.class, () -> ConstraintConfig.builder().featureFlags(null).build());
    assertThrows(IllegalStateException.class, () -> ConstraintConfig.builder().parallelism(0).build());
  }

  @Test
  @DisplayName("Depth zero disables recovery")
  void isRecoveryEnabled_depthZero_false() {
    assertFalse(ConstraintConfig.builder().maxBacktrackDepth(0).build().isRecoveryEnabled());
  }

  @Test
  @DisplayName("Environment overrides step and backtrack limits")
  void fromEnvironment_overridesLimits() {
    ConstraintConfig config = ConstraintConfig.fromEnvironment(Map.of(
        ConstraintConfig.ENV_MAX_STEPS, "64",
        ConstraintConfig.ENV_MAX_BACKTRACK_DEPTH, " 2 ",
        "CONSTRAINT_FEATURE_FORCED_COMPLETION", "false"));

    assertEquals(64, config.getMaxSteps());
    assertEquals(2, config.getMaxBacktrackDepth());
    assertFalse(config.isEnabled(Feature.FORCED_COMPLETION));
    assertTrue(config.isEnabled(Feature.SEMANTIC_VALIDATION));
  }

  @Test
  @DisplayName("Non-numeric environment values are rejected")
  void fromEnvironment_notANumber_throwsException() {
    IllegalStateException exception = assertThrows(IllegalStateException.class,
        () -> ConstraintConfig.fromEnvironment(Map.of(ConstraintConfig.ENV_MAX_STEPS, "lots")));

    assertTrue(exception.getMessage().contains("CONSTRAINT_MAX_STEPS must be an integer"));
  }

  @Test
  @DisplayName("Out-of-range environment values fail validation")
  void fromEnvironment_outOfRange_throwsException() {
    assertThrows(IllegalStateException.class,
        () -> ConstraintConfig.fromEnvironment(Map.of(ConstraintConfig.ENV_MAX_STEPS, "100000")));
  }
}
