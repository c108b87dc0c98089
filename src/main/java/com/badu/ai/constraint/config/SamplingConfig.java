package com.badu.ai.constraint.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of the reference sampler.
 *
 * <p>Decoding logic:
 * <ul>
 *   <li>If temperature == 0.0: greedy decoding (argmax)</li>
 *   <li>Else if topK > 0: apply temperature, sample from the top-K tokens</li>
 *   <li>Else if topP > 0: apply temperature, nucleus sampling (cumulative prob ≥ topP)</li>
 *   <li>Else: apply temperature, sample from the full distribution</li>
 * </ul>
 * Masked positions carry the logit floor, so they receive zero probability in every mode.
 */
@Value
@Builder
public class SamplingConfig {

  /** Temperature 0.7, topK 50, topP 0.9, unseeded. */
  public static final SamplingConfig DEFAULT = builder().build();

  /** Greedy decoding. */
  public static final SamplingConfig GREEDY = builder().temperature(0.0f).build();

  /**
   * Sampling temperature (0.0 = greedy).
   * Range: [0.0, 2.0]
   * Default: 0.7
   */
  @Builder.Default
  float temperature = 0.7f;

  /**
   * Top-K sampling (0 = disabled).
   * Range: [0, 1000]
   * Default: 50
   */
  @Builder.Default
  int topK = 50;

  /**
   * Nucleus sampling threshold (0.0 = disabled).
   * Range: [0.0, 1.0]
   * Default: 0.9
   */
  @Builder.Default
  float topP = 0.9f;

  /**
   * Random seed for reproducible sampling (null = nondeterministic).
   */
  Long seed;

  /**
   * Custom builder with validation logic.
   */
  public static class SamplingConfigBuilder {
    public SamplingConfig build() {
      if (!this.temperature$set) {
        this.temperature$value = 0.7f;
      }
      if (!this.topK$set) {
        this.topK$value = 50;
      }
      if (!this.topP$set) {
        this.topP$value = 0.9f;
      }

      if (this.temperature$value < 0.0f || this.temperature$value > 2.0f) {
        throw new IllegalStateException(
            "temperature must be in range [0.0, 2.0], got: " + this.temperature$value);
      }

      if (this.topK$value < 0 || this.topK$value > 1000) {
        throw new IllegalStateException(
            "topK must be in range [0, 1000], got: " + this.topK$value);
      }

      if (this.topP$value < 0.0f || this.topP$value > 1.0f) {
        throw new IllegalStateException(
            "topP must be in range [0.0, 1.0], got: " + this.topP$value);
      }

      return new SamplingConfig(this.temperature$value, this.topK$value, this.topP$value, this.seed);
    }
  }

  public boolean isGreedy() {
    return temperature == 0.0f;
  }

  public boolean isTopKEnabled() {
    return topK > 0;
  }

  public boolean isTopPEnabled() {
    return topP > 0.0f;
  }
}
