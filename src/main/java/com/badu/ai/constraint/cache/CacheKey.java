package com.badu.ai.constraint.cache;

import lombok.Value;

/**
 * Cache key: automaton state plus top-of-stack symbol ({@code -1} for an empty stack).
 */
@Value
public class CacheKey {
  int state;
  int topSymbol;

  @Override
  public String toString() {
    return "(" + state + ", " + (topSymbol < 0 ? "empty" : String.valueOf(topSymbol)) + ")";
  }
}
