package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.RuntimeState;
import com.badu.ai.constraint.cache.ResolvedTokens;
import com.badu.ai.constraint.cache.TokenTransitionCache;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.config.Feature;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ends a sequence that ran out of steps without acceptance.
 *
 * <ol>
 *   <li>Forced completion (feature {@link Feature#FORCED_COMPLETION}): breadth-first search
 *       over cached token transitions for the shortest token path to an accepting
 *       configuration, at most {@code forcedCompletionMaxTokens} tokens long. The path is
 *       appended even though it goes past the step bound.</li>
 *   <li>Otherwise the output is rewound to its most recent accepting prefix.</li>
 *   <li>If neither exists the sequence fails.</li>
 * </ol>
 */
public class ForcedTermination {

  private static final Logger logger = LoggerFactory.getLogger(ForcedTermination.class);

  /** Search nodes visited before forced completion gives up. */
  static final int MAX_SEARCH_NODES = 50_000;

  public enum Outcome {
    /** Completion tokens were appended (possibly none) and the output is accepted. */
    COMPLETED,

    /** Trailing tokens were removed to reach an accepting prefix. */
    REWOUND,

    /** No accepting output is reachable; the sequence failed. */
    FAILED
  }

  private final TokenTransitionCache cache;
  private final ConstraintAutomaton automaton;
  private final VocabularyIndex vocabulary;
  private final ConstraintConfig config;

  public ForcedTermination(TokenTransitionCache cache, ConstraintConfig config) {
    this.cache = cache;
    this.automaton = cache.getAutomaton();
    this.vocabulary = cache.getVocabulary();
    this.config = config;
  }

  public Outcome terminate(ConstraintState state) {
    if (state.isFailed()) {
      return Outcome.FAILED;
    }
    if (automaton.isAccepting(state.getRuntimeState())) {
      state.finish();
      return Outcome.COMPLETED;
    }

    if (config.isEnabled(Feature.FORCED_COMPLETION)) {
      List<Integer> path = shortestCompletion(state.getRuntimeState(), config.getForcedCompletionMaxTokens());
      if (path != null) {
        for (int tokenId : path) {
          RuntimeState next = cache.allowed(state.getRuntimeState()).successor(tokenId);
          state.push(tokenId, vocabulary.piece(tokenId), next);
        }
        state.finish();
        logger.info("Sequence '{}' force-completed with {} token(s)", state.getSequenceId(), path.size());
        return Outcome.COMPLETED;
      }
    }

    int removed = 0;
    while (state.hasHistory() && !automaton.isAccepting(state.getRuntimeState())) {
      state.undo();
      removed++;
    }
    state.exclude(Collections.emptySet());
    if (automaton.isAccepting(state.getRuntimeState())) {
      state.finish();
      logger.info("Sequence '{}' rewound {} token(s) to an accepting prefix", state.getSequenceId(), removed);
      return Outcome.REWOUND;
    }

    state.fail("step bound reached and no accepting output is reachable");
    logger.info("Sequence '{}' could not be terminated: {}", state.getSequenceId(), state.getFailureReason());
    return Outcome.FAILED;
  }

  /**
   * Returns the shortest token path from {@code from} to acceptance, or null when there is
   * none within {@code maxTokens} tokens (or the search budget).
   */
  List<Integer> shortestCompletion(RuntimeState from, int maxTokens) {
    Map<RuntimeState, RuntimeState> parent = new HashMap<>();
    Map<RuntimeState, Integer> viaToken = new HashMap<>();
    Map<RuntimeState, Integer> depth = new HashMap<>();
    Deque<RuntimeState> queue = new ArrayDeque<>();
    parent.put(from, null);
    depth.put(from, 0);
    queue.add(from);

    while (!queue.isEmpty()) {
      RuntimeState current = queue.poll();
      if (automaton.isAccepting(current)) {
        List<Integer> path = new ArrayList<>();
        for (RuntimeState s = current; parent.get(s) != null; s = parent.get(s)) {
          path.add(viaToken.get(s));
        }
        Collections.reverse(path);
        return path;
      }
      int d = depth.get(current);
      if (d >= maxTokens) {
        continue;
      }
      ResolvedTokens allowed = cache.allowed(current);
      for (int tokenId : allowed.tokenIds()) {
        RuntimeState next = allowed.successor(tokenId);
        if (parent.containsKey(next)) {
          continue;
        }
        if (parent.size() >= MAX_SEARCH_NODES) {
          logger.debug("Forced completion search budget of {} nodes exhausted", MAX_SEARCH_NODES);
          return null;
        }
        parent.put(next, current);
        viaToken.put(next, tokenId);
        depth.put(next, d + 1);
        queue.add(next);
      }
    }
    return null;
  }
}
