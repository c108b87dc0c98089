package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.automaton.RuntimeState;
import com.badu.ai.constraint.cache.ResolvedTokens;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-sequence constraint state: automaton configuration, emitted output, step count,
 * recovery bookkeeping and undo history.
 *
 * <p>Created by {@link ConstraintEngine#newSequence(String)} and changed only through the
 * engine. One state belongs to one sequence and is not thread-safe; different states may be
 * driven concurrently.
 */
public final class ConstraintState {

  /** One undoable advance. */
  static final class Step {
    final RuntimeState before;
    final int tokenId;
    final int byteLengthBefore;
    final Set<Integer> exclusionsBefore;

    Step(RuntimeState before, int tokenId, int byteLengthBefore, Set<Integer> exclusionsBefore) {
      this.before = before;
      this.tokenId = tokenId;
      this.byteLengthBefore = byteLengthBefore;
      this.exclusionsBefore = exclusionsBefore;
    }
  }

  private final String sequenceId;
  private final int maxSteps;

  private RuntimeState runtimeState;
  private byte[] bytes = new byte[64];
  private int byteLength = 0;
  private final List<Integer> tokenIds = new ArrayList<>();
  private final Deque<Step> history = new ArrayDeque<>();

  private RecoveryStatus recoveryStatus = RecoveryStatus.NORMAL;
  private Set<Integer> exclusions = Collections.emptySet();
  private int deadEndStep = -1;
  private int episodeBacktracks = 0;
  private int totalBacktracks = 0;

  private ResolvedTokens pendingAllowed;
  private boolean pendingEos;

  private boolean finished = false;
  private String failureReason;

  ConstraintState(String sequenceId, RuntimeState start, int maxSteps) {
    this.sequenceId = sequenceId;
    this.runtimeState = start;
    this.maxSteps = maxSteps;
  }

  public String getSequenceId() {
    return sequenceId;
  }

  public RuntimeState getRuntimeState() {
    return runtimeState;
  }

  /** Number of tokens currently emitted. */
  public int getStepCount() {
    return tokenIds.size();
  }

  public int getMaxSteps() {
    return maxSteps;
  }

  public RecoveryStatus getRecoveryStatus() {
    return recoveryStatus;
  }

  /** Backtracks over the life of the sequence. */
  public int getTotalBacktracks() {
    return totalBacktracks;
  }

  public List<Integer> getTokenIds() {
    return List.copyOf(tokenIds);
  }

  public byte[] getBytes() {
    return Arrays.copyOf(bytes, byteLength);
  }

  /**
   * Emitted output decoded as UTF-8 (malformed trailing bytes are replaced).
   */
  public String getText() {
    return new String(bytes, 0, byteLength, StandardCharsets.UTF_8);
  }

  public boolean isFinished() {
    return finished;
  }

  public boolean isFailed() {
    return recoveryStatus == RecoveryStatus.FAILED;
  }

  /** True once the sequence is finished or failed. */
  public boolean isTerminal() {
    return finished || isFailed();
  }

  /**
   * Why the sequence failed, or null.
   */
  public String getFailureReason() {
    return failureReason;
  }

  /**
   * Tokens excluded at the current position by earlier backtracks.
   */
  public Set<Integer> getExclusions() {
    return Collections.unmodifiableSet(exclusions);
  }

  @Override
  public String toString() {
    return "ConstraintState{id='" + sequenceId + "', step=" + getStepCount() + "/" + maxSteps
        + ", runtime=" + runtimeState + ", recovery=" + recoveryStatus
        + (finished ? ", finished" : "") + "}";
  }

  // ---------------------------------------------------------------- engine-side mutation

  ResolvedTokens pendingAllowed() {
    return pendingAllowed;
  }

  boolean pendingEos() {
    return pendingEos;
  }

  void setPending(ResolvedTokens allowed, boolean eosAllowed) {
    this.pendingAllowed = allowed;
    this.pendingEos = eosAllowed;
  }

  void clearPending() {
    this.pendingAllowed = null;
    this.pendingEos = false;
  }

  /**
   * Appends a token and moves to its successor configuration.
   */
  void push(int tokenId, byte[] piece, RuntimeState next) {
    history.push(new Step(runtimeState, tokenId, byteLength, exclusions));
    ensureCapacity(byteLength + piece.length);
    System.arraycopy(piece, 0, bytes, byteLength, piece.length);
    byteLength += piece.length;
    tokenIds.add(tokenId);
    runtimeState = next;
    exclusions = Collections.emptySet();
    clearPending();
  }

  boolean hasHistory() {
    return !history.isEmpty();
  }

  /**
   * Removes the last token, restoring the configuration and exclusions before it.
   *
   * @return the undone step
   */
  Step undo() {
    Step step = history.pop();
    runtimeState = step.before;
    byteLength = step.byteLengthBefore;
    tokenIds.remove(tokenIds.size() - 1);
    exclusions = step.exclusionsBefore;
    clearPending();
    return step;
  }

  void exclude(Set<Integer> excluded) {
    this.exclusions = excluded;
  }

  void beginRecovery() {
    recoveryStatus = RecoveryStatus.RECOVERING;
    deadEndStep = getStepCount();
    episodeBacktracks = 0;
  }

  void endRecovery() {
    recoveryStatus = RecoveryStatus.NORMAL;
    deadEndStep = -1;
    episodeBacktracks = 0;
  }

  int deadEndStep() {
    return deadEndStep;
  }

  int episodeBacktracks() {
    return episodeBacktracks;
  }

  void countBacktrack() {
    episodeBacktracks++;
    totalBacktracks++;
  }

  void finish() {
    finished = true;
    clearPending();
  }

  void fail(String reason) {
    recoveryStatus = RecoveryStatus.FAILED;
    failureReason = reason;
    clearPending();
  }

  static Set<Integer> union(Set<Integer> exclusions, int tokenId) {
    Set<Integer> result = new HashSet<>(exclusions);
    result.add(tokenId);
    return result;
  }

  private void ensureCapacity(int required) {
    if (required > bytes.length) {
      bytes = Arrays.copyOf(bytes, Math.max(required, bytes.length * 2));
    }
  }
}
