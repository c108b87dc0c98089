package com.badu.ai.constraint.metrics;

/**
 * Accumulates timings and constraint statistics while one sequence is decoded.
 * <p>
 * Durations are recorded in nanoseconds; getters return milliseconds. Not thread-safe: each
 * sequence owns its tracker.
 */
public class DecodingTracker {

  private long decodingStart = 0;
  private long decodingEnd = 0;
  private long modelNanos = 0;
  private long maskNanos = 0;
  private long advanceNanos = 0;
  private int maskCount = 0;
  private long allowedTotal = 0;
  private int minAllowed = 0;
  private int deadEnds = 0;
  private int backtracks = 0;
  private int outputTokenCount = 0;

  /**
   * Marks the start of the decoding loop.
   */
  public void startDecoding() {
    this.decodingStart = System.nanoTime();
  }

  /**
   * Marks the end of the decoding loop.
   *
   * @param outputTokenCount tokens in the final output
   */
  public void endDecoding(int outputTokenCount) {
    this.decodingEnd = System.nanoTime();
    this.outputTokenCount = outputTokenCount;
  }

  public void recordModel(long nanos) {
    this.modelNanos += nanos;
  }

  /**
   * Records a successful mask.
   *
   * @param nanos time spent
   * @param allowedTokens size of the allowed set
   */
  public void recordMask(long nanos, int allowedTokens) {
    this.maskNanos += nanos;
    this.maskCount++;
    this.allowedTotal += allowedTokens;
    if (minAllowed == 0 || allowedTokens < minAllowed) {
      this.minAllowed = allowedTokens;
    }
  }

  public void recordDeadEnd(long nanos) {
    this.maskNanos += nanos;
    this.deadEnds++;
  }

  public void recordAdvance(long nanos) {
    this.advanceNanos += nanos;
  }

  public void recordBacktrack() {
    this.backtracks++;
  }

  public int getDeadEnds() {
    return deadEnds;
  }

  public int getBacktracks() {
    return backtracks;
  }

  /**
   * Gets the wall-clock time of the loop in milliseconds (0 until it has ended).
   */
  public long getTotalTimeMs() {
    if (decodingStart == 0 || decodingEnd == 0) {
      return 0;
    }
    return (decodingEnd - decodingStart) / 1_000_000;
  }

  /**
   * Gets output throughput in tokens per second.
   *
   * @return tokens per second (0.0 if nothing was emitted)
   */
  public double getTokensPerSecond() {
    if (decodingStart == 0 || decodingEnd == 0 || outputTokenCount == 0) {
      return 0.0;
    }
    long elapsed = decodingEnd - decodingStart;
    if (elapsed == 0) {
      return 0.0;
    }
    return outputTokenCount / (elapsed / 1_000_000_000.0);
  }

  /**
   * Builds an immutable snapshot.
   */
  public DecodingMetrics toMetrics() {
    return DecodingMetrics.builder()
        .modelTimeMs(modelNanos / 1_000_000)
        .maskTimeMs(maskNanos / 1_000_000)
        .advanceTimeMs(advanceNanos / 1_000_000)
        .totalTimeMs(getTotalTimeMs())
        .tokensPerSecond((float) getTokensPerSecond())
        .outputTokenCount(outputTokenCount)
        .maskCount(maskCount)
        .deadEnds(deadEnds)
        .backtracks(backtracks)
        .averageAllowedTokens(maskCount == 0 ? 0.0f : (float) allowedTotal / maskCount)
        .minAllowedTokens(minAllowed)
        .build();
  }
}
