package com.badu.ai.constraint.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic pushdown automaton over bytes that a grammar compiles to.
 *
 * <p>Transitions are keyed by {@code (state, byte)}. A transition is either:
 * <ul>
 *   <li><b>unguarded</b>: fires whatever the stack holds, optionally pushing a symbol</li>
 *   <li><b>guarded</b>: fires only when the top-of-stack symbol matches, and pops it</li>
 * </ul>
 * An unguarded transition never coexists with guarded ones for the same {@code (state, byte)},
 * so the next configuration is a function of {@code (state, byte, top-of-stack)}. The stack
 * alphabet is finite and known when the automaton is built.
 *
 * <p>A runtime configuration is accepting when its state is marked accepting and its stack is
 * empty.
 *
 * <p>Instances are immutable and may be shared by any number of threads.
 *
 * @see com.badu.ai.constraint.grammar.GrammarCompiler
 */
public final class ConstraintAutomaton {

  /** Marker for "no stack symbol" (empty stack, or transition without symbol). */
  public static final int NO_SYMBOL = -1;

  private static final int ALPHABET = 256;

  private final String name;
  private final int startState;
  private final boolean[] accepting;
  private final String[] stateLabels;
  private final List<String> symbolLabels;
  private final Transition[][] unguarded;
  private final Map<Integer, Transition[]> guarded;

  private ConstraintAutomaton(Builder builder) {
    this.name = builder.name;
    this.startState = builder.startState;
    int stateCount = builder.accepting.size();
    this.accepting = new boolean[stateCount];
    this.stateLabels = new String[stateCount];
    this.unguarded = new Transition[stateCount][];
    for (int s = 0; s < stateCount; s++) {
      accepting[s] = builder.accepting.get(s);
      stateLabels[s] = builder.stateLabels.get(s);
      unguarded[s] = builder.unguarded.get(s);
    }
    this.symbolLabels = Collections.unmodifiableList(new ArrayList<>(builder.symbolLabels));
    Map<Integer, Transition[]> copy = new HashMap<>();
    builder.guarded.forEach((key, row) -> copy.put(key, row.clone()));
    this.guarded = copy;
  }

  /**
   * Creates a builder for an automaton with the given name.
   *
   * @param name automaton (format) name, used in diagnostics
   * @return new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public int getStartState() {
    return startState;
  }

  public int stateCount() {
    return accepting.length;
  }

  public int stackAlphabetSize() {
    return symbolLabels.size();
  }

  public String symbolLabel(int symbol) {
    return symbolLabels.get(symbol);
  }

  /**
   * Returns the label of a state, normally the grammar rule it was compiled from.
   */
  public String stateLabel(int state) {
    return stateLabels[state];
  }

  public boolean isAcceptingState(int state) {
    return accepting[state];
  }

  /**
   * Checks whether a runtime configuration is accepting (accepting state and empty stack).
   */
  public boolean isAccepting(RuntimeState runtimeState) {
    return accepting[runtimeState.getState()] && runtimeState.getStack().isEmpty();
  }

  /**
   * Returns the initial runtime configuration.
   */
  public RuntimeState start() {
    return new RuntimeState(startState, SymbolStack.EMPTY);
  }

  /**
   * Returns the unguarded transition for {@code (state, b)}, or null.
   */
  public Transition unguardedTransition(int state, int b) {
    Transition[] row = unguarded[state];
    return row == null ? null : row[b & 0xFF];
  }

  /**
   * Returns the transition guarded by {@code symbol} for {@code (state, b)}, or null.
   */
  public Transition guardedTransition(int state, int b, int symbol) {
    if (symbol < 0) {
      return null;
    }
    Transition[] row = guarded.get(key(state, b));
    return row == null || symbol >= row.length ? null : row[symbol];
  }

  /**
   * Returns the symbols that guard a transition out of {@code (state, b)}, in ascending order.
   */
  public int[] guardSymbols(int state, int b) {
    Transition[] row = guarded.get(key(state, b));
    if (row == null) {
      return new int[0];
    }
    int[] symbols = new int[row.length];
    int count = 0;
    for (int symbol = 0; symbol < row.length; symbol++) {
      if (row[symbol] != null) {
        symbols[count++] = symbol;
      }
    }
    return Arrays.copyOf(symbols, count);
  }

  /**
   * Returns the transition that fires for {@code (state, b)} with {@code top} on the stack.
   *
   * @param state current state
   * @param b input byte
   * @param top top-of-stack symbol or {@link #NO_SYMBOL}
   * @return transition, or null when none fires
   */
  public Transition transition(int state, int b, int top) {
    Transition t = unguardedTransition(state, b);
    if (t != null) {
      return t;
    }
    return guardedTransition(state, b, top);
  }

  /**
   * Consumes one byte.
   *
   * @return successor configuration, or null when the byte has no transition
   */
  public RuntimeState step(RuntimeState from, int b) {
    Transition t = transition(from.getState(), b, from.topSymbol());
    if (t == null) {
      return null;
    }
    return new RuntimeState(t.getTarget(), t.apply(from.getStack()));
  }

  /**
   * Consumes a byte sequence.
   *
   * @return successor configuration, or null when some byte has no transition
   */
  public RuntimeState walk(RuntimeState from, byte[] bytes) {
    RuntimeState current = from;
    for (int i = 0; i < bytes.length && current != null; i++) {
      current = step(current, bytes[i]);
    }
    return current;
  }

  /**
   * Checks whether the automaton accepts the complete input from its start configuration.
   */
  public boolean accepts(byte[] input) {
    RuntimeState end = walk(start(), input);
    return end != null && isAccepting(end);
  }

  /**
   * Visits every transition. Used for structural checks and diagnostics.
   */
  public void forEachTransition(TransitionVisitor visitor) {
    for (int s = 0; s < unguarded.length; s++) {
      if (unguarded[s] == null) {
        continue;
      }
      for (int b = 0; b < ALPHABET; b++) {
        if (unguarded[s][b] != null) {
          visitor.visit(s, b, unguarded[s][b]);
        }
      }
    }
    guarded.forEach((key, row) -> {
      for (Transition t : row) {
        if (t != null) {
          visitor.visit(key / ALPHABET, key % ALPHABET, t);
        }
      }
    });
  }

  @Override
  public String toString() {
    return "ConstraintAutomaton{name='" + name + "', states=" + stateCount()
        + ", stackSymbols=" + stackAlphabetSize() + "}";
  }

  private static int key(int state, int b) {
    return state * ALPHABET + (b & 0xFF);
  }

  /** Callback for {@link #forEachTransition(TransitionVisitor)}. */
  @FunctionalInterface
  public interface TransitionVisitor {
    void visit(int fromState, int b, Transition transition);
  }

  /**
   * Mutable builder. Rejects non-deterministic additions with {@link IllegalStateException}.
   */
  public static final class Builder {
    private final String name;
    private int startState = -1;
    private final List<Boolean> accepting = new ArrayList<>();
    private final List<String> stateLabels = new ArrayList<>();
    private final List<Transition[]> unguarded = new ArrayList<>();
    private final Map<Integer, Transition[]> guarded = new HashMap<>();
    private final List<String> symbolLabels = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public int addState(String label, boolean isAccepting) {
      accepting.add(isAccepting);
      stateLabels.add(label);
      unguarded.add(null);
      return accepting.size() - 1;
    }

    public Builder start(int state) {
      checkState(state);
      this.startState = state;
      return this;
    }

    public int addSymbol(String label) {
      symbolLabels.add(label);
      return symbolLabels.size() - 1;
    }

    public Builder addTransition(int from, int b, int target) {
      return putUnguarded(from, b, Transition.plain(target));
    }

    public Builder addPush(int from, int b, int target, int symbol) {
      checkSymbol(symbol);
      return putUnguarded(from, b, Transition.push(target, symbol));
    }

    public Builder addPop(int from, int b, int symbol, int target) {
      checkState(from);
      checkState(target);
      checkSymbol(symbol);
      int k = key(from, b);
      if (unguardedRow(from) != null && unguardedRow(from)[b & 0xFF] != null) {
        throw new IllegalStateException("State " + from + " already has an unguarded transition on byte "
            + (b & 0xFF));
      }
      Transition[] row = guarded.computeIfAbsent(k, ignored -> new Transition[symbolLabels.size()]);
      if (row.length < symbolLabels.size()) {
        row = Arrays.copyOf(row, symbolLabels.size());
        guarded.put(k, row);
      }
      if (row[symbol] != null) {
        throw new IllegalStateException("State " + from + " already has a transition on byte "
            + (b & 0xFF) + " guarded by symbol " + symbol);
      }
      row[symbol] = Transition.pop(target, symbol);
      return this;
    }

    public ConstraintAutomaton build() {
      if (accepting.isEmpty()) {
        throw new IllegalStateException("Automaton '" + name + "' has no states");
      }
      if (startState < 0) {
        throw new IllegalStateException("Automaton '" + name + "' has no start state");
      }
      return new ConstraintAutomaton(this);
    }

    private Builder putUnguarded(int from, int b, Transition t) {
      checkState(from);
      checkState(t.getTarget());
      if (guarded.containsKey(key(from, b))) {
        throw new IllegalStateException("State " + from + " already has guarded transitions on byte "
            + (b & 0xFF));
      }
      Transition[] row = unguardedRow(from);
      if (row == null) {
        row = new Transition[ALPHABET];
        unguarded.set(from, row);
      }
      if (row[b & 0xFF] != null && !row[b & 0xFF].equals(t)) {
        throw new IllegalStateException("State " + from + " already has a transition on byte " + (b & 0xFF));
      }
      row[b & 0xFF] = t;
      return this;
    }

    private Transition[] unguardedRow(int state) {
      return unguarded.get(state);
    }

    private void checkState(int state) {
      if (state < 0 || state >= accepting.size()) {
        throw new IllegalArgumentException("Unknown state: " + state);
      }
    }

    private void checkSymbol(int symbol) {
      if (symbol < 0 || symbol >= symbolLabels.size()) {
        throw new IllegalArgumentException("Unknown stack symbol: " + symbol);
      }
    }
  }
}
