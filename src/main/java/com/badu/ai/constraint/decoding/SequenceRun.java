package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.config.ExhaustionPolicy;
import com.badu.ai.constraint.config.Feature;
import com.badu.ai.constraint.engine.AdvanceResult;
import com.badu.ai.constraint.engine.ConstraintEngine;
import com.badu.ai.constraint.engine.ConstraintState;
import com.badu.ai.constraint.engine.ForcedTermination;
import com.badu.ai.constraint.engine.MaskResult;
import com.badu.ai.constraint.engine.RecoveryStatus;
import com.badu.ai.constraint.metrics.DecodingTracker;
import com.badu.ai.constraint.validation.SemanticValidator;
import com.badu.ai.constraint.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One sequence inside a decoding loop: its constraint state, metrics and final status.
 * Shared by {@link ConstrainedDecoder} and {@link BatchDecoder}, which differ only in how
 * they call the model and the engine.
 */
final class SequenceRun {

  private static final Logger logger = LoggerFactory.getLogger(SequenceRun.class);

  private final ConstraintEngine engine;
  private final SemanticValidator validator;
  private final ConstraintState state;
  private final DecodingTracker tracker = new DecodingTracker();

  private DecodingStatus status;
  private String error;
  private ValidationResult validation;
  private ForcedTermination.Outcome termination;

  SequenceRun(ConstraintEngine engine, SemanticValidator validator, String sequenceId) {
    this.engine = engine;
    this.validator = validator;
    this.state = engine.newSequence(sequenceId);
    tracker.startDecoding();
  }

  String sequenceId() {
    return state.getSequenceId();
  }

  ConstraintState state() {
    return state;
  }

  DecodingTracker tracker() {
    return tracker;
  }

  boolean isActive() {
    return status == null;
  }

  List<Integer> context() {
    return state.getTokenIds();
  }

  /**
   * Applies a mask outcome.
   *
   * @return true if the caller should sample from {@code result}'s logits and advance
   */
  boolean onMask(MaskResult result, long nanos) {
    switch (result.getStatus()) {
      case MASKED:
        tracker.recordMask(nanos, result.getAllowedCount());
        return true;
      case DEAD_END:
        tracker.recordDeadEnd(nanos);
        if (engine.recover(state) == RecoveryStatus.RECOVERING) {
          tracker.recordBacktrack();
        } else {
          complete(DecodingStatus.SEQUENCE_FAILED, state.getFailureReason());
        }
        return false;
      case EXHAUSTED:
        onExhausted();
        return false;
      case FINISHED:
        onFinished();
        return false;
      case FAILED:
      default:
        complete(DecodingStatus.SEQUENCE_FAILED, failureReason("masking failed"));
        return false;
    }
  }

  void onAdvance(AdvanceResult result, long nanos) {
    tracker.recordAdvance(nanos);
    if (result == AdvanceResult.FINISHED) {
      onFinished();
    } else if (result == AdvanceResult.FAILED) {
      complete(DecodingStatus.SEQUENCE_FAILED, failureReason("advance failed"));
    }
  }

  void onModelTime(long nanos) {
    tracker.recordModel(nanos);
  }

  void cancel() {
    if (isActive()) {
      engine.fail(state, "cancelled");
      complete(DecodingStatus.CANCELLED, "cancelled at step " + state.getStepCount());
    }
  }

  /**
   * Fails the sequence after a collaborator error.
   */
  void fail(String reason) {
    if (isActive()) {
      engine.fail(state, reason);
      complete(DecodingStatus.SEQUENCE_FAILED, reason);
    }
  }

  DecodingResult toResult() {
    return DecodingResult.builder()
        .sequenceId(state.getSequenceId())
        .status(status)
        .bytes(state.getBytes())
        .tokenIds(state.getTokenIds())
        .backtracks(state.getTotalBacktracks())
        .error(error)
        .validation(validation)
        .termination(termination)
        .metrics(tracker.toMetrics())
        .build();
  }

  private void onExhausted() {
    if (engine.getConfig().getExhaustionPolicy() == ExhaustionPolicy.FAIL) {
      String reason = "step bound of " + state.getMaxSteps() + " reached without acceptance";
      engine.fail(state, reason);
      complete(DecodingStatus.EXHAUSTED, reason);
      return;
    }
    termination = engine.forceTerminate(state);
    if (termination == ForcedTermination.Outcome.FAILED) {
      complete(DecodingStatus.SEQUENCE_FAILED, failureReason("forced termination failed"));
    } else {
      onFinished();
    }
  }

  private void onFinished() {
    if (!engine.isAccepting(state)) {
      complete(DecodingStatus.SEQUENCE_FAILED, "sequence finished without a complete output");
      return;
    }
    if (validator != null && engine.getConfig().isEnabled(Feature.SEMANTIC_VALIDATION)) {
      validation = validator.validate(state.getBytes());
      if (!validation.isValid()) {
        complete(DecodingStatus.SEMANTIC_INVALID, String.join("; ", validation.getErrors()));
        return;
      }
    }
    complete(DecodingStatus.SUCCESS, null);
  }

  private String failureReason(String fallback) {
    return state.getFailureReason() != null ? state.getFailureReason() : fallback;
  }

  private void complete(DecodingStatus finalStatus, String message) {
    this.status = finalStatus;
    this.error = message;
    tracker.endDecoding(state.getStepCount());
    if (finalStatus == DecodingStatus.SUCCESS) {
      logger.debug("Sequence '{}' decoded in {} step(s), {} backtrack(s)", state.getSequenceId(),
          state.getStepCount(), state.getTotalBacktracks());
    } else {
      logger.info("Sequence '{}' ended {}: {}", state.getSequenceId(), finalStatus, message);
    }
  }
}
