package com.badu.ai.constraint.cache;

import com.badu.ai.constraint.automaton.RuntimeState;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Tokens admissible from one concrete runtime state, each with its successor state.
 *
 * <p>Lookups are O(1). Token ids are kept in ascending order. Immutable.
 */
public final class ResolvedTokens {

  private static final ResolvedTokens EMPTY = new ResolvedTokens(new int[0], Map.of());

  private final int[] tokenIds;
  private final Map<Integer, RuntimeState> successors;

  private ResolvedTokens(int[] tokenIds, Map<Integer, RuntimeState> successors) {
    this.tokenIds = tokenIds;
    this.successors = successors;
  }

  public static ResolvedTokens empty() {
    return EMPTY;
  }

  static Builder builder(int expectedSize) {
    return new Builder(expectedSize);
  }

  public int size() {
    return tokenIds.length;
  }

  public boolean isEmpty() {
    return tokenIds.length == 0;
  }

  public boolean contains(int tokenId) {
    return successors.containsKey(tokenId);
  }

  /**
   * Returns the state after the token, or null when the token is not admissible.
   */
  public RuntimeState successor(int tokenId) {
    return successors.get(tokenId);
  }

  /**
   * Returns the admissible token ids in ascending order.
   */
  public int[] tokenIds() {
    return tokenIds.clone();
  }

  /**
   * Returns a copy without the given tokens.
   */
  public ResolvedTokens without(Collection<Integer> excluded) {
    if (excluded.isEmpty()) {
      return this;
    }
    Builder builder = new Builder(tokenIds.length);
    for (int tokenId : tokenIds) {
      if (!excluded.contains(tokenId)) {
        builder.add(tokenId, successors.get(tokenId));
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    int shown = Math.min(tokenIds.length, 16);
    return "ResolvedTokens{size=" + tokenIds.length + ", ids=" + Arrays.toString(Arrays.copyOf(tokenIds, shown))
        + (shown < tokenIds.length ? "..." : "") + "}";
  }

  static final class Builder {
    private final Map<Integer, RuntimeState> successors;

    private Builder(int expectedSize) {
      this.successors = new HashMap<>(Math.max(16, expectedSize * 2));
    }

    Builder add(int tokenId, RuntimeState successor) {
      RuntimeState previous = successors.putIfAbsent(tokenId, successor);
      if (previous != null && !previous.equals(successor)) {
        throw new IllegalStateException("Token " + tokenId + " resolves to both " + previous + " and " + successor);
      }
      return this;
    }

    ResolvedTokens build() {
      if (successors.isEmpty()) {
        return EMPTY;
      }
      int[] ids = successors.keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
      return new ResolvedTokens(ids, Map.copyOf(successors));
    }
  }
}
