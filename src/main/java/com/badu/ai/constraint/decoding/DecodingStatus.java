package com.badu.ai.constraint.decoding;

/**
 * Final status of a decoded sequence.
 */
public enum DecodingStatus {
  /** The output is a complete instance of the format and passed semantic validation. */
  SUCCESS,

  /** Recovery gave up, the model or sampler failed, or forced termination found no accepting output. */
  SEQUENCE_FAILED,

  /** The step bound was reached without acceptance (exhaustion policy {@code FAIL}). */
  EXHAUSTED,

  /** The output is structurally valid but the semantic validator rejected it. */
  SEMANTIC_INVALID,

  /** The sequence was cancelled at a step boundary. */
  CANCELLED
}
