package com.badu.ai.constraint.automaton;

/**
 * Immutable, persistent stack of automaton stack symbols.
 *
 * <p>Every push or pop returns a new stack that shares its tail with the old one, so runtime
 * states can be kept in undo history without copying. Equality is structural.
 */
public final class SymbolStack {

  /** The empty stack. */
  public static final SymbolStack EMPTY = new SymbolStack(ConstraintAutomaton.NO_SYMBOL, null, 0, 1);

  private final int top;
  private final SymbolStack below;
  private final int depth;
  private final int hash;

  private SymbolStack(int top, SymbolStack below, int depth, int hash) {
    this.top = top;
    this.below = below;
    this.depth = depth;
    this.hash = hash;
  }

  /**
   * Returns a stack with the given symbol on top of this one.
   *
   * @param symbol stack symbol (non-negative)
   * @return new stack
   */
  public SymbolStack push(int symbol) {
    if (symbol < 0) {
      throw new IllegalArgumentException("Stack symbol must be >= 0, got: " + symbol);
    }
    return new SymbolStack(symbol, this, depth + 1, 31 * hash + symbol);
  }

  /**
   * Returns the stack below the top symbol.
   *
   * @return new stack
   * @throws IllegalStateException if the stack is empty
   */
  public SymbolStack pop() {
    if (isEmpty()) {
      throw new IllegalStateException("Cannot pop an empty stack");
    }
    return below;
  }

  /**
   * Pops {@code count} symbols.
   *
   * @param count number of symbols to remove
   * @return new stack
   * @throws IllegalStateException if fewer than {@code count} symbols are present
   */
  public SymbolStack pop(int count) {
    SymbolStack current = this;
    for (int i = 0; i < count; i++) {
      current = current.pop();
    }
    return current;
  }

  /**
   * Returns the top symbol, or {@link ConstraintAutomaton#NO_SYMBOL} when empty.
   */
  public int peek() {
    return top;
  }

  /**
   * Returns the symbol {@code offset} positions below the top (0 is the top), or
   * {@link ConstraintAutomaton#NO_SYMBOL} when the stack is not that deep.
   */
  public int peek(int offset) {
    SymbolStack current = this;
    for (int i = 0; i < offset && !current.isEmpty(); i++) {
      current = current.below;
    }
    return current.top;
  }

  public boolean isEmpty() {
    return depth == 0;
  }

  public int depth() {
    return depth;
  }

  /**
   * Returns the symbols top first.
   */
  public int[] toArray() {
    int[] symbols = new int[depth];
    SymbolStack current = this;
    for (int i = 0; i < depth; i++) {
      symbols[i] = current.top;
      current = current.below;
    }
    return symbols;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SymbolStack)) {
      return false;
    }
    SymbolStack a = this;
    SymbolStack b = (SymbolStack) o;
    if (a.depth != b.depth || a.hash != b.hash) {
      return false;
    }
    while (a != b && !a.isEmpty()) {
      if (a.top != b.top) {
        return false;
      }
      a = a.below;
      b = b.below;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    int[] symbols = toArray();
    // bottom first reads like the text that produced it
    for (int i = symbols.length - 1; i >= 0; i--) {
      sb.append(symbols[i]);
      if (i > 0) {
        sb.append(", ");
      }
    }
    return sb.append("]").toString();
  }
}
