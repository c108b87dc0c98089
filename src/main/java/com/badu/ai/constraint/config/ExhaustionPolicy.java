package com.badu.ai.constraint.config;

/**
 * What the decoder does when a sequence reaches its step bound without accepting.
 */
public enum ExhaustionPolicy {
  /** Report the sequence as exhausted. */
  FAIL,

  /** Complete or rewind the sequence to an accepting prefix, or fail if neither is possible. */
  FORCE_TERMINATE
}
