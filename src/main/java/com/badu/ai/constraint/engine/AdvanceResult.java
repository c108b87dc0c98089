package com.badu.ai.constraint.engine;

/**
 * Outcome of {@link ConstraintEngine#advance(ConstraintState, int)}.
 */
public enum AdvanceResult {
  /** Token consumed; the output is not (yet) a complete instance of the format. */
  ADVANCED,

  /** Token consumed; the output is now complete. Generation may continue. */
  ACCEPTED,

  /** The sequence is finished (end-of-sequence token, or stop on first acceptance). */
  FINISHED,

  /** The token was rejected and the sequence failed. Only reported by batch advancing. */
  FAILED
}
