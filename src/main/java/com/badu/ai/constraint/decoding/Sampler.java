package com.badu.ai.constraint.decoding;

/**
 * Chooses the next token from masked logits.
 *
 * <p>Contract: the returned id must be a position the mask left above the logit floor.
 * Returning a masked position is reported by the engine as a sampler contract violation.
 */
@FunctionalInterface
public interface Sampler {

  /**
   * @param maskedLogits logits after masking, length V
   * @return chosen token id
   */
  int sample(float[] maskedLogits);
}
