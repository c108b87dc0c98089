package com.badu.ai.constraint.decoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Sampling primitives over (masked) logits.
 *
 * <p>Provides:
 * <ul>
 *   <li>Greedy decoding (argmax)</li>
 *   <li>Temperature scaling</li>
 *   <li>Top-K sampling</li>
 *   <li>Top-P (nucleus) sampling</li>
 * </ul>
 *
 * <p>Positions at negative infinity get probability zero, so a masked vector can never yield a
 * masked token. All methods are stateless and thread-safe.
 */
public final class SamplingUtils {

  private SamplingUtils() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Selects the token with the highest logit; ties go to the lowest id.
   *
   * @param logits logits [vocab_size]
   * @return index of the maximum
   */
  public static int argmax(float[] logits) {
    if (logits == null || logits.length == 0) {
      throw new IllegalArgumentException("Logits cannot be null or empty");
    }

    int maxIndex = 0;
    float maxValue = logits[0];
    for (int i = 1; i < logits.length; i++) {
      if (logits[i] > maxValue) {
        maxValue = logits[i];
        maxIndex = i;
      }
    }
    return maxIndex;
  }

  /**
   * Divides logits by the temperature, in place.
   *
   * @param logits logits [vocab_size]
   * @param temperature temperature (&gt; 0; use {@link #argmax(float[])} for 0)
   * @return the same array
   */
  public static float[] applyTemperature(float[] logits, float temperature) {
    if (temperature <= 0.0f) {
      throw new IllegalArgumentException("Temperature must be > 0.0 (use argmax for greedy)");
    }

    if (temperature == 1.0f) {
      return logits;
    }

    for (int i = 0; i < logits.length; i++) {
      logits[i] = logits[i] / temperature;
    }
    return logits;
  }

  /**
   * Softmax: p(i) = exp(logit[i]) / sum(exp(logit[j])).
   *
   * @param logits logits [vocab_size], at least one finite
   * @return probabilities summing to 1.0
   */
  public static float[] softmax(float[] logits) {
    if (logits == null || logits.length == 0) {
      throw new IllegalArgumentException("Logits cannot be null or empty");
    }

    // subtract the max so exp never overflows
    float maxLogit = logits[0];
    for (int i = 1; i < logits.length; i++) {
      if (logits[i] > maxLogit) {
        maxLogit = logits[i];
      }
    }
    if (maxLogit == Float.NEGATIVE_INFINITY) {
      throw new IllegalArgumentException("All logits are negative infinity");
    }

    float[] probs = new float[logits.length];
    float sum = 0.0f;
    for (int i = 0; i < logits.length; i++) {
      probs[i] = (float) Math.exp(logits[i] - maxLogit);
      sum += probs[i];
    }
    for (int i = 0; i < probs.length; i++) {
      probs[i] = probs[i] / sum;
    }
    return probs;
  }

  /**
   * Samples among the K highest logits.
   *
   * @param logits logits [vocab_size]
   * @param k number of candidates (&gt; 0)
   * @param rng random source
   * @return sampled token id
   */
  public static int sampleTopK(float[] logits, int k, Random rng) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be > 0");
    }

    if (k >= logits.length) {
      return sampleFromDistribution(logits, rng);
    }

    List<IndexValue> indexed = sortedDescending(logits);
    float[] filtered = new float[logits.length];
    Arrays.fill(filtered, Float.NEGATIVE_INFINITY);
    for (int i = 0; i < k; i++) {
      IndexValue iv = indexed.get(i);
      filtered[iv.index] = iv.value;
    }
    return sampleFromDistribution(filtered, rng);
  }

  /**
   * Nucleus sampling: samples from the smallest set of tokens whose probability mass is ≥ p.
   *
   * @param logits logits [vocab_size]
   * @param p mass threshold in (0.0, 1.0]
   * @param rng random source
   * @return sampled token id
   */
  public static int sampleTopP(float[] logits, float p, Random rng) {
    if (p <= 0.0f || p > 1.0f) {
      throw new IllegalArgumentException("p must be in (0.0, 1.0]");
    }

    float[] probs = softmax(logits);
    List<IndexValue> indexed = sortedDescending(probs);

    float cumulative = 0.0f;
    float[] filtered = new float[logits.length];
    Arrays.fill(filtered, Float.NEGATIVE_INFINITY);
    for (IndexValue iv : indexed) {
      if (iv.value == 0.0f) {
        break;
      }
      filtered[iv.index] = logits[iv.index];
      cumulative += iv.value;
      if (cumulative >= p) {
        break;
      }
    }
    return sampleFromDistribution(filtered, rng);
  }

  /**
   * Samples from softmax(logits).
   */
  public static int sampleFromDistribution(float[] logits, Random rng) {
    float[] probs = softmax(logits);

    float randomValue = rng.nextFloat();
    float cumulative = 0.0f;
    for (int i = 0; i < probs.length; i++) {
      if (probs[i] == 0.0f) {
        continue;
      }
      cumulative += probs[i];
      if (randomValue <= cumulative) {
        return i;
      }
    }

    // rounding left the cumulative mass just below randomValue
    return argmax(logits);
  }

  private static List<IndexValue> sortedDescending(float[] values) {
    List<IndexValue> indexed = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      indexed.add(new IndexValue(i, values[i]));
    }
    indexed.sort((a, b) -> Float.compare(b.value, a.value));
    return indexed;
  }

  private static class IndexValue {
    final int index;
    final float value;

    IndexValue(int index, float value) {
      this.index = index;
      this.value = value;
    }
  }
}
