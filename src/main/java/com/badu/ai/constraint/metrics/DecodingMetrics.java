package com.badu.ai.constraint.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable timing and constraint statistics of one decoded sequence.
 *
 * <p>Times are accumulated over all steps:
 * <ul>
 *   <li><b>Model</b>: time spent in the language model collaborator</li>
 *   <li><b>Mask</b>: allowed-set lookup and logit masking</li>
 *   <li><b>Advance</b>: automaton transitions for the sampled tokens</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @see DecodingTracker
 */
@Value
@Builder
public class DecodingMetrics {
    long modelTimeMs;
    long maskTimeMs;
    long advanceTimeMs;

    /**
     * Wall-clock time of the whole decoding loop in milliseconds.
     */
    long totalTimeMs;

    /**
     * Emitted tokens per second of wall-clock time.
     */
    float tokensPerSecond;

    /** Tokens in the final output. */
    int outputTokenCount;

    /** Mask calls, including those repeated after a backtrack. */
    int maskCount;

    int deadEnds;
    int backtracks;

    /**
     * Mean size of the allowed set over all successful masks.
     */
    float averageAllowedTokens;

    /**
     * Smallest non-empty allowed set seen (0 when nothing was masked).
     */
    int minAllowedTokens;

    /**
     * Fills in derived fields left unset.
     */
    public static class DecodingMetricsBuilder {
        public DecodingMetrics build() {
            if (totalTimeMs == 0) {
                totalTimeMs = modelTimeMs + maskTimeMs + advanceTimeMs;
            }

            if (tokensPerSecond == 0.0f && totalTimeMs > 0) {
                tokensPerSecond = outputTokenCount / (totalTimeMs / 1000.0f);
            }

            return new DecodingMetrics(
                    modelTimeMs,
                    maskTimeMs,
                    advanceTimeMs,
                    totalTimeMs,
                    tokensPerSecond,
                    outputTokenCount,
                    maskCount,
                    deadEnds,
                    backtracks,
                    averageAllowedTokens,
                    minAllowedTokens
            );
        }
    }
}
