package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.config.ConstraintConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backtracking recovery from dead ends.
 *
 * <p>State machine per sequence:
 * <ul>
 *   <li>{@code NORMAL → RECOVERING}: a mask reported a dead end. The last token is undone and
 *       excluded at its position; the caller masks and samples that position again.</li>
 *   <li>{@code RECOVERING → RECOVERING}: another dead end inside the same episode undoes one
 *       more token. Exclusions at deeper positions are dropped with them.</li>
 *   <li>{@code RECOVERING → NORMAL}: a mask succeeds at or beyond the step where the episode's
 *       first dead end happened.</li>
 *   <li>{@code → FAILED}: the episode used {@code maxBacktrackDepth} backtracks, the sequence
 *       used {@code maxTotalBacktracks}, or there is nothing left to undo. Terminal.</li>
 * </ul>
 * The total cap bounds recovery work, so every sequence terminates.
 */
public class DeadEndRecovery {

  private static final Logger logger = LoggerFactory.getLogger(DeadEndRecovery.class);

  private final int maxBacktrackDepth;
  private final int maxTotalBacktracks;

  public DeadEndRecovery(ConstraintConfig config) {
    this.maxBacktrackDepth = config.getMaxBacktrackDepth();
    this.maxTotalBacktracks = config.getMaxTotalBacktracks();
  }

  /**
   * Handles a dead end reported for the state's current position.
   *
   * @return {@link RecoveryStatus#RECOVERING} if a token was undone, {@link RecoveryStatus#FAILED} otherwise
   */
  public RecoveryStatus onDeadEnd(ConstraintState state) {
    if (state.isFailed()) {
      return RecoveryStatus.FAILED;
    }
    if (state.getRecoveryStatus() == RecoveryStatus.NORMAL) {
      state.beginRecovery();
      logger.debug("Sequence '{}' hit a dead end at step {}", state.getSequenceId(), state.getStepCount());
    }

    if (state.episodeBacktracks() >= maxBacktrackDepth) {
      return fail(state, String.format("dead end at step %d, backtrack depth %d exhausted",
          state.getStepCount(), maxBacktrackDepth));
    }
    if (state.getTotalBacktracks() >= maxTotalBacktracks) {
      return fail(state, String.format("dead end at step %d, total backtrack budget %d exhausted",
          state.getStepCount(), maxTotalBacktracks));
    }
    if (!state.hasHistory()) {
      return fail(state, "dead end at the first position, nothing to undo");
    }

    ConstraintState.Step step = state.undo();
    state.exclude(ConstraintState.union(step.exclusionsBefore, step.tokenId));
    state.countBacktrack();
    logger.debug("Sequence '{}' backtracked to step {}, excluding token {} ({} excluded there)",
        state.getSequenceId(), state.getStepCount(), step.tokenId, state.getExclusions().size());
    return RecoveryStatus.RECOVERING;
  }

  /**
   * Called after every successful mask.
   */
  public void onMaskSucceeded(ConstraintState state) {
    if (state.getRecoveryStatus() == RecoveryStatus.RECOVERING && state.getStepCount() >= state.deadEndStep()) {
      logger.info("Sequence '{}' recovered from dead end at step {} after {} backtrack(s)",
          state.getSequenceId(), state.deadEndStep(), state.episodeBacktracks());
      state.endRecovery();
    }
  }

  private RecoveryStatus fail(ConstraintState state, String reason) {
    logger.info("Sequence '{}' failed: {}", state.getSequenceId(), reason);
    state.fail(reason);
    return RecoveryStatus.FAILED;
  }
}
