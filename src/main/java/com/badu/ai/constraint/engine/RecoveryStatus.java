package com.badu.ai.constraint.engine;

/**
 * Dead-end recovery state of a sequence.
 */
public enum RecoveryStatus {
  /** Decoding normally. */
  NORMAL,

  /** Backtracking after a dead end; the next mask re-samples an earlier position. */
  RECOVERING,

  /** Terminal: the sequence cannot be completed. */
  FAILED
}
