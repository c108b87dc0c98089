package com.badu.ai.constraint.automaton;

import lombok.Value;

/**
 * Full runtime configuration of a {@link ConstraintAutomaton}: the current state plus the
 * stack contents.
 *
 * <p>This class is immutable and thread-safe.
 */
@Value
public class RuntimeState {

  /** Current automaton state id. */
  int state;

  /** Current stack contents. */
  SymbolStack stack;

  /**
   * Returns the top-of-stack symbol, or {@link ConstraintAutomaton#NO_SYMBOL} when the stack
   * is empty.
   */
  public int topSymbol() {
    return stack.peek();
  }

  @Override
  public String toString() {
    return "(" + state + ", " + stack + ")";
  }
}
