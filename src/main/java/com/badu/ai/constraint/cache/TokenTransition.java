package com.badu.ai.constraint.cache;

import com.badu.ai.constraint.automaton.SymbolStack;
import lombok.Value;

import java.util.Arrays;

/**
 * Effect of consuming one token's bytes from a cache key configuration.
 *
 * <p>{@code popped} lists the pre-existing stack symbols the token consumes, top first. Its
 * first element, when present, is the key's top symbol; any further elements are expectations
 * about deeper symbols, checked against the real stack by {@link #matches(SymbolStack)}.
 * {@code pushed} lists the symbols left on top afterwards, bottom first.
 */
@Value
public class TokenTransition {
  int tokenId;
  int target;
  int[] popped;
  int[] pushed;

  public int[] getPopped() {
    return popped.clone();
  }

  public int[] getPushed() {
    return pushed.clone();
  }

  /**
   * Checks the deeper-pop expectations against an actual stack.
   */
  public boolean matches(SymbolStack stack) {
    for (int i = 0; i < popped.length; i++) {
      if (stack.peek(i) != popped[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the stack after this token, given a stack it {@link #matches(SymbolStack) matches}.
   */
  public SymbolStack apply(SymbolStack stack) {
    SymbolStack result = stack.pop(popped.length);
    for (int symbol : pushed) {
      result = result.push(symbol);
    }
    return result;
  }

  @Override
  public String toString() {
    return "TokenTransition{token=" + tokenId + ", target=" + target + ", popped="
        + Arrays.toString(popped) + ", pushed=" + Arrays.toString(pushed) + "}";
  }
}
