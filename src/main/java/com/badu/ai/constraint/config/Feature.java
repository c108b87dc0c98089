package com.badu.ai.constraint.config;

/**
 * Optional engine behaviours that can be switched on or off.
 *
 * @see FeatureFlags
 */
public enum Feature {
  /** Try to complete a step-exhausted sequence with the shortest path to acceptance. */
  FORCED_COMPLETION(true, "Forced completion is disabled; exhausted sequences are rewound to their last accepting prefix or fail."),

  /** Run the semantic validator on accepted output. */
  SEMANTIC_VALIDATION(true, "Semantic validation is disabled; structurally valid output is reported as success without value checks."),

  /** Mask and advance batch sequences on the engine's worker pool. */
  PARALLEL_BATCH_MASKING(true, "Parallel batch masking is disabled; batch sequences are masked one after another.");

  private final boolean enabledByDefault;
  private final String disabledMessage;

  Feature(boolean enabledByDefault, String disabledMessage) {
    this.enabledByDefault = enabledByDefault;
    this.disabledMessage = disabledMessage;
  }

  public boolean isEnabledByDefault() {
    return enabledByDefault;
  }

  /**
   * Message shown to users when this feature is off.
   */
  public String getDisabledMessage() {
    return disabledMessage;
  }

  /**
   * Environment variable controlling this feature, e.g. {@code CONSTRAINT_FEATURE_FORCED_COMPLETION}.
   */
  public String environmentVariable() {
    return FeatureFlags.ENV_PREFIX + name();
  }
}
