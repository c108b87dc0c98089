package com.badu.ai.constraint.cache;

import com.badu.ai.constraint.automaton.RuntimeState;

import java.util.Collections;
import java.util.List;

/**
 * Cached token transitions for one {@link CacheKey}. Immutable.
 */
public final class AllowedTokens {

  private final CacheKey key;
  private final List<TokenTransition> transitions;

  AllowedTokens(CacheKey key, List<TokenTransition> transitions) {
    this.key = key;
    this.transitions = Collections.unmodifiableList(transitions);
  }

  public CacheKey getKey() {
    return key;
  }

  /**
   * Returns all cached transitions, including candidates whose deeper-pop expectations may
   * not hold for a particular stack.
   */
  public List<TokenTransition> getTransitions() {
    return transitions;
  }

  public int size() {
    return transitions.size();
  }

  public boolean isEmpty() {
    return transitions.isEmpty();
  }

  /**
   * Resolves the cached transitions against a concrete runtime state whose state and top
   * symbol equal this entry's key.
   */
  public ResolvedTokens resolve(RuntimeState runtimeState) {
    if (runtimeState.getState() != key.getState() || runtimeState.topSymbol() != key.getTopSymbol()) {
      throw new IllegalArgumentException("Runtime state " + runtimeState + " does not match cache key " + key);
    }
    ResolvedTokens.Builder builder = ResolvedTokens.builder(transitions.size());
    for (TokenTransition transition : transitions) {
      if (transition.matches(runtimeState.getStack())) {
        builder.add(transition.getTokenId(),
            new RuntimeState(transition.getTarget(), transition.apply(runtimeState.getStack())));
      }
    }
    return builder.build();
  }
}
