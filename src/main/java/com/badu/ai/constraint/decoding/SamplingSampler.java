package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.config.SamplingConfig;

import java.util.Random;

/**
 * Reference {@link Sampler}: greedy, top-K, top-P or full-distribution sampling per
 * {@link SamplingConfig}.
 *
 * <p>Not thread-safe when sampling (shares one {@link Random}); use one instance per thread
 * or per sequence for reproducible seeded runs.
 */
public class SamplingSampler implements Sampler {

  private final SamplingConfig config;
  private final Random rng;

  public SamplingSampler(SamplingConfig config) {
    this.config = config;
    this.rng = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
  }

  /**
   * Greedy sampler.
   */
  public static SamplingSampler greedy() {
    return new SamplingSampler(SamplingConfig.GREEDY);
  }

  @Override
  public int sample(float[] maskedLogits) {
    if (config.isGreedy()) {
      return SamplingUtils.argmax(maskedLogits);
    }

    float[] scaled = SamplingUtils.applyTemperature(maskedLogits.clone(), config.getTemperature());
    if (config.isTopKEnabled()) {
      return SamplingUtils.sampleTopK(scaled, config.getTopK(), rng);
    }
    if (config.isTopPEnabled()) {
      return SamplingUtils.sampleTopP(scaled, config.getTopP(), rng);
    }
    return SamplingUtils.sampleFromDistribution(scaled, rng);
  }
}
