package com.badu.ai.constraint.automaton;

import lombok.Value;

/**
 * A single byte transition of a {@link ConstraintAutomaton}.
 *
 * <p>{@code symbol} is the pushed symbol for {@link StackOp#PUSH}, the required (and removed)
 * top-of-stack symbol for {@link StackOp#POP}, and {@link ConstraintAutomaton#NO_SYMBOL}
 * otherwise.
 */
@Value
public class Transition {

  int target;
  StackOp op;
  int symbol;

  public static Transition plain(int target) {
    return new Transition(target, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL);
  }

  public static Transition push(int target, int symbol) {
    return new Transition(target, StackOp.PUSH, symbol);
  }

  public static Transition pop(int target, int symbol) {
    return new Transition(target, StackOp.POP, symbol);
  }

  /**
   * Applies this transition's stack operation.
   *
   * @param stack stack before the transition
   * @return stack after the transition
   */
  public SymbolStack apply(SymbolStack stack) {
    return switch (op) {
      case NONE -> stack;
      case PUSH -> stack.push(symbol);
      case POP -> stack.pop();
    };
  }
}
