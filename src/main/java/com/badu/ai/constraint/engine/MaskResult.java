package com.badu.ai.constraint.engine;

import lombok.Value;

/**
 * Outcome of {@link ConstraintEngine#mask(ConstraintState, float[])}.
 *
 * <p>Only {@link Status#MASKED} carries logits: a copy of the model's logits where every
 * token that would leave the format is set to the configured floor and every admissible
 * token keeps its original value. The other statuses are sentinels; the engine never
 * returns an all-floor vector.
 */
@Value
public class MaskResult {

  public enum Status {
    /** At least one token is admissible. */
    MASKED,

    /** No token is admissible from the current state; recovery decides what happens next. */
    DEAD_END,

    /** The step bound was reached without acceptance. */
    EXHAUSTED,

    /** The sequence has finished. */
    FINISHED,

    /** The sequence has failed. */
    FAILED
  }

  private static final MaskResult DEAD_END = new MaskResult(Status.DEAD_END, null, 0);
  private static final MaskResult EXHAUSTED = new MaskResult(Status.EXHAUSTED, null, 0);
  private static final MaskResult FINISHED = new MaskResult(Status.FINISHED, null, 0);
  private static final MaskResult FAILED = new MaskResult(Status.FAILED, null, 0);

  Status status;
  float[] logits;
  int allowedCount;

  static MaskResult masked(float[] logits, int allowedCount) {
    return new MaskResult(Status.MASKED, logits, allowedCount);
  }

  static MaskResult of(Status status) {
    return switch (status) {
      case DEAD_END -> DEAD_END;
      case EXHAUSTED -> EXHAUSTED;
      case FINISHED -> FINISHED;
      case FAILED -> FAILED;
      case MASKED -> throw new IllegalArgumentException("Masked results need logits");
    };
  }

  public boolean isMasked() {
    return status == Status.MASKED;
  }

  @Override
  public String toString() {
    return isMasked() ? "MaskResult{MASKED, allowed=" + allowedCount + "}" : "MaskResult{" + status + "}";
  }
}
