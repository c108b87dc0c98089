package com.badu.ai.constraint.cache;

import com.badu.ai.constraint.ConstraintException;
import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.RuntimeState;
import com.badu.ai.constraint.automaton.StackOp;
import com.badu.ai.constraint.automaton.Transition;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoised map from {@code (automaton state, top-of-stack symbol)} to the tokens whose bytes
 * the automaton accepts from there.
 *
 * <p>For each key every non-special token piece is walked byte by byte. A token is kept iff
 * every byte has a transition. Pops that go below the key's top symbol cannot be decided
 * from the key alone, so the walk branches over the guard symbols present on that byte and
 * records the expectation; {@link AllowedTokens#resolve(RuntimeState)} checks it against the
 * real stack. The number of entries is bounded by {@code states × (stack symbols + 1)}.
 *
 * <p>Each key is computed at most once, also under concurrent access: the first caller runs
 * the computation and concurrent callers for the same key wait for it. A failed computation
 * is removed so a later query retries it.
 *
 * <p>This class is thread-safe; one instance is shared by all sequences that use the same
 * automaton and vocabulary.
 */
public class TokenTransitionCache {

  private static final Logger logger = LoggerFactory.getLogger(TokenTransitionCache.class);

  private final ConstraintAutomaton automaton;
  private final VocabularyIndex vocabulary;
  private final ConcurrentMap<CacheKey, Future<AllowedTokens>> entries = new ConcurrentHashMap<>();

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong computations = new AtomicLong();
  private final AtomicLong computeNanos = new AtomicLong();

  public TokenTransitionCache(ConstraintAutomaton automaton, VocabularyIndex vocabulary) {
    if (automaton == null || vocabulary == null) {
      throw new IllegalArgumentException("Automaton and vocabulary are required");
    }
    this.automaton = automaton;
    this.vocabulary = vocabulary;
  }

  public ConstraintAutomaton getAutomaton() {
    return automaton;
  }

  public VocabularyIndex getVocabulary() {
    return vocabulary;
  }

  /**
   * Returns the tokens admissible from a concrete runtime state, with their successors.
   */
  public ResolvedTokens allowed(RuntimeState runtimeState) {
    return query(runtimeState.getState(), runtimeState.topSymbol()).resolve(runtimeState);
  }

  /**
   * Returns the cached transitions for {@code (state, topSymbol)}, computing them on a miss.
   *
   * @param state automaton state
   * @param topSymbol top-of-stack symbol, or {@link ConstraintAutomaton#NO_SYMBOL} for an empty stack
   */
  public AllowedTokens query(int state, int topSymbol) {
    return query(new CacheKey(state, topSymbol));
  }

  public AllowedTokens query(CacheKey key) {
    Future<AllowedTokens> future = entries.get(key);
    if (future == null) {
      FutureTask<AllowedTokens> task = new FutureTask<>(() -> compute(key));
      future = entries.putIfAbsent(key, task);
      if (future == null) {
        future = task;
        misses.incrementAndGet();
        task.run();
      } else {
        hits.incrementAndGet();
      }
    } else {
      hits.incrementAndGet();
    }

    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConstraintException("Interrupted while waiting for allowed tokens of " + key,
          ConstraintException.ErrorType.INVALID_STATE, e);
    } catch (ExecutionException e) {
      entries.remove(key, future);
      throw new ConstraintException("Failed to compute allowed tokens for " + key,
          ConstraintException.ErrorType.UNKNOWN, e.getCause());
    }
  }

  /** Number of computed (or in-flight) keys. */
  public int size() {
    return entries.size();
  }

  public CacheStatistics getStatistics() {
    return CacheStatistics.builder()
        .hits(hits.get())
        .misses(misses.get())
        .computations(computations.get())
        .entries(entries.size())
        .computeTimeMs(computeNanos.get() / 1_000_000)
        .build();
  }

  private AllowedTokens compute(CacheKey key) {
    long start = System.nanoTime();
    List<TokenTransition> transitions = new ArrayList<>();
    for (int tokenId = 0; tokenId < vocabulary.size(); tokenId++) {
      if (vocabulary.isSpecial(tokenId)) {
        continue;
      }
      byte[] piece = vocabulary.piece(tokenId);
      walk(tokenId, piece, 0, key.getState(), key.getTopSymbol(),
          new int[piece.length], 0, new int[piece.length], 0, transitions);
    }
    long elapsed = System.nanoTime() - start;
    computations.incrementAndGet();
    computeNanos.addAndGet(elapsed);

    if (transitions.isEmpty() && automaton.isAcceptingState(key.getState())
        && key.getTopSymbol() == ConstraintAutomaton.NO_SYMBOL) {
      logger.debug("No continuation from accepting {} in '{}'", key, automaton.getName());
    } else if (transitions.isEmpty()) {
      logger.warn("No token is admissible from {} in '{}' (state rule '{}'); tokenizer and grammar do not fit",
          key, automaton.getName(), automaton.stateLabel(key.getState()));
    } else {
      logger.debug("Computed {} token transitions for {} in '{}' in {} us",
          transitions.size(), key, automaton.getName(), elapsed / 1_000);
    }
    return new AllowedTokens(key, transitions);
  }

  private void walk(int tokenId, byte[] bytes, int from, int state, int keyTop,
                    int[] popped, int poppedCount, int[] pushed, int pushedCount,
                    List<TokenTransition> out) {
    for (int i = from; i < bytes.length; i++) {
      int b = bytes[i] & 0xFF;

      Transition t = automaton.unguardedTransition(state, b);
      if (t != null) {
        if (t.getOp() == StackOp.PUSH) {
          pushed[pushedCount++] = t.getSymbol();
        }
        state = t.getTarget();
        continue;
      }

      if (pushedCount > 0) {
        t = automaton.guardedTransition(state, b, pushed[pushedCount - 1]);
        if (t == null) {
          return;
        }
        pushedCount--;
        state = t.getTarget();
        continue;
      }

      if (poppedCount == 0) {
        t = automaton.guardedTransition(state, b, keyTop);
        if (t == null) {
          return;
        }
        popped[poppedCount++] = keyTop;
        state = t.getTarget();
        continue;
      }

      // below the key's top: one candidate per guard symbol
      for (int symbol : automaton.guardSymbols(state, b)) {
        popped[poppedCount] = symbol;
        walk(tokenId, bytes, i + 1, automaton.guardedTransition(state, b, symbol).getTarget(), keyTop,
            popped, poppedCount + 1, pushed, pushedCount, out);
      }
      return;
    }
    out.add(new TokenTransition(tokenId, state, Arrays.copyOf(popped, poppedCount), Arrays.copyOf(pushed, pushedCount)));
  }
}
