package com.badu.ai.constraint.config;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable configuration of the constraint engine and the decoding loops.
 *
 * <p>Builder pattern usage:
 * <pre>{@code
 * ConstraintConfig config = ConstraintConfig.builder()
 *     .maxSteps(256)
 *     .maxBacktrackDepth(2)
 *     .exhaustionPolicy(ExhaustionPolicy.FORCE_TERMINATE)
 *     .build();
 * }</pre>
 */
@Value
@Builder
public class ConstraintConfig {

  /** Environment variable overriding {@link #maxSteps}. */
  public static final String ENV_MAX_STEPS = "CONSTRAINT_MAX_STEPS";

  /** Environment variable overriding {@link #maxBacktrackDepth}. */
  public static final String ENV_MAX_BACKTRACK_DEPTH = "CONSTRAINT_MAX_BACKTRACK_DEPTH";

  /**
   * Default configuration.
   * maxSteps: 512, maxBacktrackDepth: 4, maxTotalBacktracks: 64, logitFloor: -inf
   */
  public static final ConstraintConfig DEFAULT = builder().build();

  /**
   * Maximum tokens a sequence may emit.
   * Range: [1, 65536]
   * Default: 512
   */
  @Builder.Default
  int maxSteps = 512;

  /**
   * Backtracks allowed within one dead-end episode (0 disables recovery).
   * Range: [0, 64]
   * Default: 4
   */
  @Builder.Default
  int maxBacktrackDepth = 4;

  /**
   * Backtracks allowed over the whole life of a sequence.
   * Range: [0, 4096]
   * Default: 64
   *
   * <p>Bounds the total work of recovery even when episodes keep recurring.
   */
  @Builder.Default
  int maxTotalBacktracks = 64;

  /**
   * Value written to disallowed logit positions.
   * Default: negative infinity. NaN and positive infinity are rejected.
   */
  @Builder.Default
  float logitFloor = Float.NEGATIVE_INFINITY;

  /**
   * Finish a sequence as soon as it first reaches an accepting configuration.
   * Default: false (acceptance is advisory, generation may continue)
   */
  @Builder.Default
  boolean stopOnFirstAccept = false;

  /**
   * Behaviour when {@link #maxSteps} is reached without acceptance.
   * Default: {@link ExhaustionPolicy#FAIL}
   */
  @Builder.Default
  ExhaustionPolicy exhaustionPolicy = ExhaustionPolicy.FAIL;

  /**
   * Maximum tokens appended by forced completion.
   * Range: [1, 1024]
   * Default: 16
   */
  @Builder.Default
  int forcedCompletionMaxTokens = 16;

  /**
   * Worker threads used for batch masking.
   * Range: [1, 256]
   * Default: available processors
   */
  @Builder.Default
  int parallelism = Runtime.getRuntime().availableProcessors();

  /**
   * Feature switches.
   * Default: {@link FeatureFlags#defaults()}
   */
  @Builder.Default
  FeatureFlags featureFlags = FeatureFlags.defaults();

  /**
   * Builds a configuration from environment variables ({@value #ENV_MAX_STEPS},
   * {@value #ENV_MAX_BACKTRACK_DEPTH} and the feature flag variables), defaults elsewhere.
   *
   * @param environment variables, typically {@code System.getenv()}
   * @return validated configuration
   * @throws IllegalStateException if a variable is not a valid number or out of range
   */
  public static ConstraintConfig fromEnvironment(Map<String, String> environment) {
    ConstraintConfigBuilder builder = builder().featureFlags(FeatureFlags.fromEnvironment(environment));
    if (environment.containsKey(ENV_MAX_STEPS)) {
      builder.maxSteps(parseInt(environment, ENV_MAX_STEPS));
    }
    if (environment.containsKey(ENV_MAX_BACKTRACK_DEPTH)) {
      builder.maxBacktrackDepth(parseInt(environment, ENV_MAX_BACKTRACK_DEPTH));
    }
    return builder.build();
  }

  private static int parseInt(Map<String, String> environment, String name) {
    String value = environment.get(name);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException(name + " must be an integer, got: " + value, e);
    }
  }

  /**
   * Custom builder with validation logic.
   */
  public static class ConstraintConfigBuilder {
    /**
     * Builds the ConstraintConfig with validation.
     *
     * @return validated ConstraintConfig instance
     * @throws IllegalStateException if validation fails
     */
    public ConstraintConfig build() {
      if (!this.maxSteps$set) {
        this.maxSteps$value = 512;
      }
      if (!this.maxBacktrackDepth$set) {
        this.maxBacktrackDepth$value = 4;
      }
      if (!this.maxTotalBacktracks$set) {
        this.maxTotalBacktracks$value = 64;
      }
      if (!this.logitFloor$set) {
        this.logitFloor$value = Float.NEGATIVE_INFINITY;
      }
      if (!this.stopOnFirstAccept$set) {
        this.stopOnFirstAccept$value = false;
      }
      if (!this.exhaustionPolicy$set) {
        this.exhaustionPolicy$value = ExhaustionPolicy.FAIL;
      }
      if (!this.forcedCompletionMaxTokens$set) {
        this.forcedCompletionMaxTokens$value = 16;
      }
      if (!this.parallelism$set) {
        this.parallelism$value = Runtime.getRuntime().availableProcessors();
      }
      if (!this.featureFlags$set) {
        this.featureFlags$value = FeatureFlags.defaults();
      }

      if (this.maxSteps$value < 1 || this.maxSteps$value > 65536) {
        throw new IllegalStateException(
            "maxSteps must be in range [1, 65536], got: " + this.maxSteps$value);
      }

      if (this.maxBacktrackDepth$value < 0 || this.maxBacktrackDepth$value > 64) {
        throw new IllegalStateException(
            "maxBacktrackDepth must be in range [0, 64], got: " + this.maxBacktrackDepth$value);
      }

      if (this.maxTotalBacktracks$value < 0 || this.maxTotalBacktracks$value > 4096) {
        throw new IllegalStateException(
            "maxTotalBacktracks must be in range [0, 4096], got: " + this.maxTotalBacktracks$value);
      }

      if (Float.isNaN(this.logitFloor$value) || this.logitFloor$value == Float.POSITIVE_INFINITY) {
        throw new IllegalStateException(
            "logitFloor must be a number or negative infinity, got: " + this.logitFloor$value);
      }

      if (this.exhaustionPolicy$value == null) {
        throw new IllegalStateException("exhaustionPolicy cannot be null");
      }

      if (this.forcedCompletionMaxTokens$value < 1 || this.forcedCompletionMaxTokens$value > 1024) {
        throw new IllegalStateException(
            "forcedCompletionMaxTokens must be in range [1, 1024], got: " + this.forcedCompletionMaxTokens$value);
      }

      if (this.parallelism$value < 1 || this.parallelism$value > 256) {
        throw new IllegalStateException(
            "parallelism must be in range [1, 256], got: " + this.parallelism$value);
      }

      if (this.featureFlags$value == null) {
        throw new IllegalStateException("featureFlags cannot be null (use FeatureFlags.defaults())");
      }

      return new ConstraintConfig(this.maxSteps$value, this.maxBacktrackDepth$value,
          this.maxTotalBacktracks$value, this.logitFloor$value, this.stopOnFirstAccept$value,
          this.exhaustionPolicy$value, this.forcedCompletionMaxTokens$value, this.parallelism$value,
          this.featureFlags$value);
    }
  }

  /**
   * Checks if dead-end recovery can backtrack at all.
   *
   * @return true if maxBacktrackDepth > 0
   */
  public boolean isRecoveryEnabled() {
    return maxBacktrackDepth > 0 && maxTotalBacktracks > 0;
  }

  public boolean isEnabled(Feature feature) {
    return featureFlags.isEnabled(feature);
  }
}
