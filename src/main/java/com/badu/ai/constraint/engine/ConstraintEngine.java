package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.ConstraintException;
import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.RuntimeState;
import com.badu.ai.constraint.cache.ResolvedTokens;
import com.badu.ai.constraint.cache.TokenTransitionCache;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.config.Feature;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies a compiled format to a model's per-step logits.
 *
 * <p>Per sequence the caller alternates {@link #mask(ConstraintState, float[])} and
 * {@link #advance(ConstraintState, int)}:
 * <pre>{@code
 * ConstraintState state = engine.newSequence("seq-1");
 * while (!state.isTerminal()) {
 *   MaskResult mask = engine.mask(state, model.nextTokenLogits(context));
 *   switch (mask.getStatus()) {
 *     case MASKED -> engine.advance(state, sampler.sample(mask.getLogits()));
 *     case DEAD_END -> engine.recover(state);
 *     case EXHAUSTED -> engine.forceTerminate(state);
 *     default -> { }
 *   }
 * }
 * }</pre>
 *
 * <p>Masking is sound and complete: a token survives the mask iff appending its bytes keeps
 * the output a prefix of some string of the format. The end-of-sequence token, when the
 * vocabulary has one, survives only in accepting configurations.
 *
 * <p>The engine is thread-safe; states are not. Different sequences may be masked on
 * different threads, and {@link #maskBatch(List, List)} does so on the engine's worker pool.
 */
public class ConstraintEngine implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ConstraintEngine.class);

  private final TokenTransitionCache cache;
  private final ConstraintAutomaton automaton;
  private final VocabularyIndex vocabulary;
  private final ConstraintConfig config;
  private final DeadEndRecovery recovery;
  private final ForcedTermination termination;
  private final ExecutorService executor;

  public ConstraintEngine(TokenTransitionCache cache) {
    this(cache, ConstraintConfig.DEFAULT);
  }

  public ConstraintEngine(TokenTransitionCache cache, ConstraintConfig config) {
    this.cache = cache;
    this.automaton = cache.getAutomaton();
    this.vocabulary = cache.getVocabulary();
    this.config = config;
    this.recovery = new DeadEndRecovery(config);
    this.termination = new ForcedTermination(cache, config);
    this.executor = Executors.newFixedThreadPool(config.getParallelism(), new MaskingThreadFactory());
    logger.debug("Constraint engine for '{}' created: vocabulary {}, {}", automaton.getName(),
        vocabulary.size(), config);
  }

  public ConstraintConfig getConfig() {
    return config;
  }

  public ConstraintAutomaton getAutomaton() {
    return automaton;
  }

  public VocabularyIndex getVocabulary() {
    return vocabulary;
  }

  /**
   * Creates the state of a new sequence at the automaton's start configuration.
   */
  public ConstraintState newSequence(String sequenceId) {
    return new ConstraintState(sequenceId, automaton.start(), config.getMaxSteps());
  }

  /**
   * Whether the sequence's output is currently a complete instance of the format.
   */
  public boolean isAccepting(ConstraintState state) {
    return automaton.isAccepting(state.getRuntimeState());
  }

  /**
   * Masks the logits for the sequence's next position.
   *
   * @param state sequence state
   * @param logits model logits of length V (not modified)
   * @return masked copy, or a sentinel status
   * @throws ConstraintException if the logits do not match the vocabulary
   */
  public MaskResult mask(ConstraintState state, float[] logits) {
    if (state.isFailed()) {
      return MaskResult.of(MaskResult.Status.FAILED);
    }
    if (state.isFinished()) {
      return MaskResult.of(MaskResult.Status.FINISHED);
    }
    if (logits == null || logits.length != vocabulary.size()) {
      throw new ConstraintException(
          "Logits length " + (logits == null ? "null" : logits.length) + " does not match vocabulary size " + vocabulary.size(),
          ConstraintException.ErrorType.VOCABULARY, state.getSequenceId(), state.getStepCount(),
          "Build the vocabulary index from the same tokenizer as the model", null);
    }

    RuntimeState runtimeState = state.getRuntimeState();
    boolean accepting = automaton.isAccepting(runtimeState);
    if (state.getStepCount() >= state.getMaxSteps()) {
      if (accepting) {
        state.finish();
        return MaskResult.of(MaskResult.Status.FINISHED);
      }
      logger.debug("Sequence '{}' exhausted {} steps without acceptance", state.getSequenceId(), state.getMaxSteps());
      return MaskResult.of(MaskResult.Status.EXHAUSTED);
    }

    ResolvedTokens allowed = cache.allowed(runtimeState).without(state.getExclusions());
    boolean eosAllowed = accepting && vocabulary.hasEos() && !state.getExclusions().contains(vocabulary.eosTokenId());

    if (allowed.isEmpty() && !eosAllowed) {
      state.clearPending();
      if (accepting) {
        // complete output that admits no continuation
        state.finish();
        return MaskResult.of(MaskResult.Status.FINISHED);
      }
      if (state.getExclusions().isEmpty()) {
        logger.warn("Dead end for sequence '{}' at step {} in state {} (rule '{}')", state.getSequenceId(),
            state.getStepCount(), runtimeState, automaton.stateLabel(runtimeState.getState()));
      } else {
        logger.debug("Dead end for sequence '{}' at step {}: all {} remaining tokens excluded",
            state.getSequenceId(), state.getStepCount(), state.getExclusions().size());
      }
      return MaskResult.of(MaskResult.Status.DEAD_END);
    }

    float[] masked = new float[logits.length];
    Arrays.fill(masked, config.getLogitFloor());
    for (int tokenId : allowed.tokenIds()) {
      masked[tokenId] = logits[tokenId];
    }
    if (eosAllowed) {
      masked[vocabulary.eosTokenId()] = logits[vocabulary.eosTokenId()];
    }
    int allowedCount = allowed.size() + (eosAllowed ? 1 : 0);

    state.setPending(allowed, eosAllowed);
    recovery.onMaskSucceeded(state);
    logger.trace("Sequence '{}' step {}: {} admissible token(s)", state.getSequenceId(), state.getStepCount(),
        allowedCount);
    return MaskResult.masked(masked, allowedCount);
  }

  /**
   * Consumes the token the sampler chose from the last mask.
   *
   * @param state sequence state
   * @param tokenId sampled token
   * @return advance outcome
   * @throws ConstraintException {@code SAMPLER_CONTRACT} if the token was masked out,
   *     {@code INVALID_STATE} if there is no preceding mask or the sequence is terminal
   */
  public AdvanceResult advance(ConstraintState state, int tokenId) {
    if (state.isTerminal()) {
      throw new ConstraintException("Cannot advance a " + (state.isFailed() ? "failed" : "finished") + " sequence",
          ConstraintException.ErrorType.INVALID_STATE, state.getSequenceId(), state.getStepCount(),
          "Stop sampling once a sequence is terminal", null);
    }
    ResolvedTokens allowed = state.pendingAllowed();
    if (allowed == null) {
      throw new ConstraintException("advance called without a preceding successful mask",
          ConstraintException.ErrorType.INVALID_STATE, state.getSequenceId(), state.getStepCount(),
          "Call mask() and sample from its logits before each advance()", null);
    }

    if (state.pendingEos() && tokenId == vocabulary.eosTokenId()) {
      state.finish();
      logger.debug("Sequence '{}' finished by end-of-sequence token after {} step(s)", state.getSequenceId(),
          state.getStepCount());
      return AdvanceResult.FINISHED;
    }

    RuntimeState next = allowed.successor(tokenId);
    if (next == null) {
      String piece = tokenId >= 0 && tokenId < vocabulary.size() ? vocabulary.pieceText(tokenId) : "?";
      throw new ConstraintException(
          String.format("Token %d ('%s') was not admissible at this position", tokenId, piece),
          ConstraintException.ErrorType.SAMPLER_CONTRACT, state.getSequenceId(), state.getStepCount(),
          "Sample only from positions the mask left above the logit floor", null);
    }

    state.push(tokenId, vocabulary.piece(tokenId), next);
    if (automaton.isAccepting(next)) {
      if (config.isStopOnFirstAccept()) {
        state.finish();
        return AdvanceResult.FINISHED;
      }
      return AdvanceResult.ACCEPTED;
    }
    return AdvanceResult.ADVANCED;
  }

  /**
   * Handles a {@link MaskResult.Status#DEAD_END} by backtracking.
   *
   * @return {@link RecoveryStatus#RECOVERING} if the caller should mask again, {@link RecoveryStatus#FAILED} otherwise
   */
  public RecoveryStatus recover(ConstraintState state) {
    return recovery.onDeadEnd(state);
  }

  /**
   * Ends an exhausted sequence: forced completion, rewind to an accepting prefix, or failure.
   */
  public ForcedTermination.Outcome forceTerminate(ConstraintState state) {
    return termination.terminate(state);
  }

  /**
   * Marks a sequence failed, e.g. after a collaborator error. Terminal.
   */
  public void fail(ConstraintState state, String reason) {
    if (!state.isTerminal()) {
      state.fail(reason);
    }
  }

  /**
   * Masks several sequences, in parallel when {@link Feature#PARALLEL_BATCH_MASKING} is on.
   *
   * <p>Failures are isolated: a sequence whose masking throws is marked failed and reported
   * as {@link MaskResult.Status#FAILED}; the others are unaffected.
   *
   * @param states sequence states
   * @param logits one logits vector per state
   * @return one result per state, in order
   */
  public List<MaskResult> maskBatch(List<ConstraintState> states, List<float[]> logits) {
    if (states.size() != logits.size()) {
      throw new IllegalArgumentException("Got " + states.size() + " states but " + logits.size() + " logits vectors");
    }
    List<MaskResult> results = new ArrayList<>(states.size());
    if (states.size() < 2 || !config.isEnabled(Feature.PARALLEL_BATCH_MASKING)) {
      for (int i = 0; i < states.size(); i++) {
        results.add(maskIsolated(states.get(i), logits.get(i)));
      }
      return results;
    }

    List<CompletableFuture<MaskResult>> futures = new ArrayList<>(states.size());
    for (int i = 0; i < states.size(); i++) {
      ConstraintState state = states.get(i);
      float[] vector = logits.get(i);
      futures.add(CompletableFuture.supplyAsync(() -> maskIsolated(state, vector), executor));
    }
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).join());
      } catch (CompletionException e) {
        ConstraintState state = states.get(i);
        logger.error("Masking failed for sequence '{}'", state.getSequenceId(), e.getCause());
        fail(state, "masking failed: " + e.getCause());
        results.add(MaskResult.of(MaskResult.Status.FAILED));
      }
    }
    return results;
  }

  /**
   * Advances several sequences. A rejected token fails only its own sequence, reported as
   * {@link AdvanceResult#FAILED}.
   *
   * @param states sequence states
   * @param tokenIds one sampled token per state
   * @return one result per state, in order
   */
  public List<AdvanceResult> advanceBatch(List<ConstraintState> states, int[] tokenIds) {
    if (states.size() != tokenIds.length) {
      throw new IllegalArgumentException("Got " + states.size() + " states but " + tokenIds.length + " tokens");
    }
    List<AdvanceResult> results = new ArrayList<>(states.size());
    for (int i = 0; i < states.size(); i++) {
      ConstraintState state = states.get(i);
      try {
        results.add(advance(state, tokenIds[i]));
      } catch (ConstraintException e) {
        logger.error("Advancing sequence '{}' failed: {}", state.getSequenceId(), e.getMessage());
        fail(state, e.getMessage());
        results.add(AdvanceResult.FAILED);
      }
    }
    return results;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    logger.debug("Constraint engine for '{}' closed, cache: {}", automaton.getName(), cache.getStatistics());
  }

  private MaskResult maskIsolated(ConstraintState state, float[] logits) {
    try {
      return mask(state, logits);
    } catch (ConstraintException e) {
      logger.error("Masking failed for sequence '{}': {}", state.getSequenceId(), e.getMessage());
      fail(state, e.getMessage());
      return MaskResult.of(MaskResult.Status.FAILED);
    }
  }

  private static final class MaskingThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, "constraint-mask-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
