package com.badu.ai.constraint;

/**
 * Exception thrown when a constrained decoding operation cannot proceed, with context-rich
 * error messages.
 *
 * <p>Structural outcomes that the engine handles itself (dead ends, step exhaustion, failed
 * sequences) are reported as result statuses, not as this exception. It is reserved for:
 * <ul>
 *   <li>Sampler contract violations (a token outside the allowed set was chosen)</li>
 *   <li>Failures of the model collaborator</li>
 *   <li>API misuse, e.g. advancing a sequence that was never masked</li>
 *   <li>Vocabulary loading problems</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * try {
 *   engine.advance(state, tokenId);
 * } catch (ConstraintException e) {
 *   System.err.println("Decoding failed: " + e.getMessage());
 *   System.err.println("Sequence: " + e.getSequenceId());
 *   System.err.println("Corrective action: " + e.getCorrectiveAction());
 * }
 * }</pre>
 */
public class ConstraintException extends RuntimeException {

  private final ErrorType errorType;
  private final String sequenceId;
  private final Integer stepCount;
  private final String correctiveAction;

  /**
   * Error types for categorizing constrained decoding failures.
   */
  public enum ErrorType {
    /** The sampler returned a token that the mask suppressed */
    SAMPLER_CONTRACT,

    /** The language model collaborator failed to produce logits */
    MODEL,

    /** The engine was driven in an order its state machine does not allow */
    INVALID_STATE,

    /** The vocabulary could not be loaded or does not match the logits */
    VOCABULARY,

    /** Unknown error type */
    UNKNOWN
  }

  /**
   * Creates a ConstraintException with full context.
   *
   * @param message Error message
   * @param errorType Type of error
   * @param sequenceId Sequence the error belongs to (null if not sequence specific)
   * @param stepCount Step at which the error occurred (null if unknown)
   * @param correctiveAction Suggested corrective action
   * @param cause Root cause exception
   */
  public ConstraintException(String message, ErrorType errorType, String sequenceId,
                             Integer stepCount, String correctiveAction, Throwable cause) {
    super(buildFullMessage(message, errorType, sequenceId, stepCount, correctiveAction), cause);
    this.errorType = errorType;
    this.sequenceId = sequenceId;
    this.stepCount = stepCount;
    this.correctiveAction = correctiveAction;
  }

  /**
   * Creates a ConstraintException with sequence context and no cause.
   */
  public ConstraintException(String message, ErrorType errorType, String sequenceId,
                             Integer stepCount, String correctiveAction) {
    this(message, errorType, sequenceId, stepCount, correctiveAction, null);
  }

  /**
   * Creates a ConstraintException with minimal context.
   */
  public ConstraintException(String message, ErrorType errorType, String correctiveAction,
                             Throwable cause) {
    this(message, errorType, null, null, correctiveAction, cause);
  }

  /**
   * Creates a ConstraintException with just message and type.
   */
  public ConstraintException(String message, ErrorType errorType, Throwable cause) {
    this(message, errorType, null, cause);
  }

  /**
   * Creates a ConstraintException with just message and type (no cause).
   */
  public ConstraintException(String message, ErrorType errorType) {
    this(message, errorType, null, null);
  }

  private static String buildFullMessage(String message, ErrorType errorType, String sequenceId,
                                         Integer stepCount, String correctiveAction) {
    StringBuilder sb = new StringBuilder();
    sb.append("[").append(errorType).append("] ").append(message);

    if (sequenceId != null) {
      sb.append("\n  Sequence: ").append(sequenceId);
    }

    if (stepCount != null) {
      sb.append("\n  Step: ").append(stepCount);
    }

    if (correctiveAction != null) {
      sb.append("\n  Corrective action: ").append(correctiveAction);
    }

    return sb.toString();
  }

  /**
   * Gets the error type.
   *
   * @return error type
   */
  public ErrorType getErrorType() {
    return errorType;
  }

  /**
   * Gets the id of the sequence that failed.
   *
   * @return sequence id (may be null)
   */
  public String getSequenceId() {
    return sequenceId;
  }

  /**
   * Gets the step count at the time of failure.
   *
   * @return step count (may be null)
   */
  public Integer getStepCount() {
    return stepCount;
  }

  /**
   * Gets the suggested corrective action.
   *
   * @return corrective action (may be null)
   */
  public String getCorrectiveAction() {
    return correctiveAction;
  }
}
