package com.badu.ai.constraint.automaton;

/**
 * Stack operation attached to an automaton transition.
 */
public enum StackOp {
  /** Stack untouched; the transition fires regardless of the top symbol */
  NONE,

  /** Pushes the transition symbol; fires regardless of the top symbol */
  PUSH,

  /** Fires only when the top symbol equals the transition symbol, and removes it */
  POP
}
