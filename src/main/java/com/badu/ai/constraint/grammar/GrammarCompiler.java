package com.badu.ai.constraint.grammar;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.StackOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Compiles a {@link GrammarSpec} into a {@link ConstraintAutomaton}.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Validate rules: defined references, non-empty literals/classes/choices, sane repeat
 *       bounds, no unbounded repetition of an expression that matches the empty string.</li>
 *   <li>Build a byte NFA (Thompson construction). Rule references are inlined; a reference
 *       cycle that does not pass through a {@link GrammarExpr.Nest} is rejected.</li>
 *   <li>Each distinct nest body becomes a region, built once. Each nest occurrence is a call
 *       site with its own stack symbol: the last open byte pushes it, the last close byte pops
 *       it and continues after that occurrence. The close prefix is matched inside the region.</li>
 *   <li>Subset construction turns the NFA into the deterministic automaton.</li>
 *   <li>Every state must reach acceptance.</li>
 * </ol>
 *
 * <p><b>Ambiguity policy:</b> nondeterminism between plain byte moves is resolved exactly by the
 * subset construction, so no alternative is ever dropped. Conflicting stack operations on the
 * same byte from the same subset (two different pushes, a push and a plain move, a pop and any
 * other move) are rejected with a {@link CompileException} naming the rules involved. There is
 * no longest-match or priority fallback.
 *
 * <p>Compilation is pure. Results are memoised by spec equality, so registering the same format
 * twice returns the same automaton. This class is thread-safe.
 */
public class GrammarCompiler {

  private static final Logger logger = LoggerFactory.getLogger(GrammarCompiler.class);

  /** Default limit on automaton states. */
  public static final int DEFAULT_MAX_STATES = 20_000;

  private static final int ALPHABET = 256;

  private final int maxStates;
  private final ConcurrentMap<GrammarSpec, ConstraintAutomaton> compiled = new ConcurrentHashMap<>();

  public GrammarCompiler() {
    this(DEFAULT_MAX_STATES);
  }

  /**
   * Creates a compiler with a custom state limit.
   *
   * @param maxStates maximum number of automaton states before compilation is aborted
   */
  public GrammarCompiler(int maxStates) {
    if (maxStates < 1) {
      throw new IllegalArgumentException("maxStates must be positive, got: " + maxStates);
    }
    this.maxStates = maxStates;
  }

  /**
   * Compiles a grammar specification.
   *
   * @param spec grammar specification
   * @return compiled automaton (cached for equal specs)
   * @throws CompileException if the spec is malformed or ambiguous
   */
  public ConstraintAutomaton compile(GrammarSpec spec) throws CompileException {
    ConstraintAutomaton cached = compiled.get(spec);
    if (cached != null) {
      return cached;
    }

    long start = System.nanoTime();
    ConstraintAutomaton automaton = new Compilation(spec).run();
    ConstraintAutomaton existing = compiled.putIfAbsent(spec, automaton);

    logger.debug("Compiled grammar '{}' in {} ms: {} states, {} stack symbols",
        spec.getName(), (System.nanoTime() - start) / 1_000_000, automaton.stateCount(),
        automaton.stackAlphabetSize());
    return existing != null ? existing : automaton;
  }

  /** Number of memoised automata. */
  public int cachedCount() {
    return compiled.size();
  }

  // ------------------------------------------------------------------ NFA model

  private static final class NfaState {
    final String rule;
    final List<NfaEdge> edges = new ArrayList<>();

    NfaState(String rule) {
      this.rule = rule;
    }
  }

  private static final class NfaEdge {
    final BitSet bytes; // null for epsilon
    final int target;
    final StackOp op;
    final int symbol;
    final String rule;

    NfaEdge(BitSet bytes, int target, StackOp op, int symbol, String rule) {
      this.bytes = bytes;
      this.target = target;
      this.op = op;
      this.symbol = symbol;
      this.rule = rule;
    }
  }

  private static final class Fragment {
    final int start;
    final int end;

    Fragment(int start, int end) {
      this.start = start;
      this.end = end;
    }
  }

  private static final class Region {
    final GrammarExpr body;
    final String rule;
    int entry;
    int exit;
    int closeLast;

    Region(GrammarExpr body, String rule) {
      this.body = body;
      this.rule = rule;
    }
  }

  // ------------------------------------------------------------------ compilation

  private final class Compilation {
    private final GrammarSpec spec;
    private final String grammarName;
    private final List<NfaState> nfa = new ArrayList<>();
    private final Map<String, Boolean> nullable = new HashMap<>();
    private final Map<GrammarExpr.Nest, Region> regions = new LinkedHashMap<>();
    private final Deque<Region> pending = new ArrayDeque<>();
    private final List<String> symbolLabels = new ArrayList<>();
    private final int nfaLimit;
    private int rootFinal;

    Compilation(GrammarSpec spec) {
      this.spec = spec;
      this.grammarName = spec.getName();
      this.nfaLimit = maxStates * 16;
    }

    ConstraintAutomaton run() throws CompileException {
      validate();

      Region root = new Region(GrammarExpr.ref(spec.getRoot()), spec.getRoot());
      root.entry = newState(root.rule);
      root.exit = newState(root.rule);
      rootFinal = root.exit;
      buildRegion(root);
      while (!pending.isEmpty()) {
        buildRegion(pending.poll());
      }

      ConstraintAutomaton automaton = determinize(root.entry);
      checkLiveness(automaton);
      return automaton;
    }

    // ---------------------------------------------------------------- validation

    private void validate() throws CompileException {
      if (spec.rule(spec.getRoot()) == null) {
        throw new CompileException(grammarName, spec.getRoot(), "root rule is not defined");
      }
      for (Map.Entry<String, GrammarExpr> rule : spec.getRules().entrySet()) {
        validateExpr(rule.getKey(), rule.getValue());
      }
      computeNullable();
      for (Map.Entry<String, GrammarExpr> rule : spec.getRules().entrySet()) {
        checkRepeats(rule.getKey(), rule.getValue());
      }
    }

    private void validateExpr(String rule, GrammarExpr expr) throws CompileException {
      if (expr == null) {
        throw new CompileException(grammarName, rule, "expression cannot be null");
      }
      if (expr instanceof GrammarExpr.Literal literal) {
        if (literal.length() == 0) {
          throw new CompileException(grammarName, rule, "empty literal");
        }
      } else if (expr instanceof GrammarExpr.CharClass charClass) {
        if (charClass.isEmpty()) {
          throw new CompileException(grammarName, rule, "empty character class");
        }
      } else if (expr instanceof GrammarExpr.Sequence sequence) {
        if (sequence.getParts().isEmpty()) {
          throw new CompileException(grammarName, rule, "empty sequence");
        }
        for (GrammarExpr part : sequence.getParts()) {
          validateExpr(rule, part);
        }
      } else if (expr instanceof GrammarExpr.Choice choice) {
        if (choice.getAlternatives().isEmpty()) {
          throw new CompileException(grammarName, rule, "choice without alternatives");
        }
        for (GrammarExpr alternative : choice.getAlternatives()) {
          validateExpr(rule, alternative);
        }
      } else if (expr instanceof GrammarExpr.Repeat repeat) {
        if (repeat.getMin() < 0) {
          throw new CompileException(grammarName, rule, "repeat minimum must be >= 0, got: " + repeat.getMin());
        }
        if (!repeat.isUnbounded() && (repeat.getMax() < 1 || repeat.getMax() < repeat.getMin())) {
          throw new CompileException(grammarName, rule,
              "repeat bounds must satisfy 1 <= max and min <= max, got: {" + repeat.getMin() + ","
                  + repeat.getMax() + "}");
        }
        validateExpr(rule, repeat.getBody());
      } else if (expr instanceof GrammarExpr.Ref ref) {
        if (spec.rule(ref.getRule()) == null) {
          throw new CompileException(grammarName, rule, "references undefined rule '" + ref.getRule() + "'");
        }
      } else if (expr instanceof GrammarExpr.Nest nest) {
        if (nest.getOpen().length() == 0 || nest.getClose().length() == 0) {
          throw new CompileException(grammarName, rule, "nested construct needs non-empty open and close");
        }
        validateExpr(rule, nest.getBody());
      } else {
        throw new CompileException(grammarName, rule, "unsupported expression " + expr.getClass().getSimpleName());
      }
    }

    private void computeNullable() {
      for (String rule : spec.getRules().keySet()) {
        nullable.put(rule, false);
      }
      boolean changed = true;
      while (changed) {
        changed = false;
        for (Map.Entry<String, GrammarExpr> rule : spec.getRules().entrySet()) {
          if (!nullable.get(rule.getKey()) && isNullable(rule.getValue())) {
            nullable.put(rule.getKey(), true);
            changed = true;
          }
        }
      }
    }

    private boolean isNullable(GrammarExpr expr) {
      if (expr instanceof GrammarExpr.Sequence sequence) {
        return sequence.getParts().stream().allMatch(this::isNullable);
      } else if (expr instanceof GrammarExpr.Choice choice) {
        return choice.getAlternatives().stream().anyMatch(this::isNullable);
      } else if (expr instanceof GrammarExpr.Repeat repeat) {
        return repeat.getMin() == 0 || isNullable(repeat.getBody());
      } else if (expr instanceof GrammarExpr.Ref ref) {
        return nullable.getOrDefault(ref.getRule(), false);
      }
      return false;
    }

    private void checkRepeats(String rule, GrammarExpr expr) throws CompileException {
      if (expr instanceof GrammarExpr.Sequence sequence) {
        for (GrammarExpr part : sequence.getParts()) {
          checkRepeats(rule, part);
        }
      } else if (expr instanceof GrammarExpr.Choice choice) {
        for (GrammarExpr alternative : choice.getAlternatives()) {
          checkRepeats(rule, alternative);
        }
      } else if (expr instanceof GrammarExpr.Repeat repeat) {
        if (repeat.isUnbounded() && isNullable(repeat.getBody())) {
          throw new CompileException(grammarName, rule,
              "unbounded repetition of an expression that can match the empty string: " + repeat.getBody());
        }
        checkRepeats(rule, repeat.getBody());
      } else if (expr instanceof GrammarExpr.Nest nest) {
        checkRepeats(rule, nest.getBody());
      }
    }

    // ---------------------------------------------------------------- NFA construction

    private void buildRegion(Region region) throws CompileException {
      Fragment body = build(region.body, region.rule, new ArrayDeque<>());
      epsilon(region.entry, body.start);
      epsilon(body.end, region.exit);
    }

    private Fragment build(GrammarExpr expr, String rule, Deque<String> refStack) throws CompileException {
      if (nfa.size() > nfaLimit) {
        throw new CompileException(grammarName, rule, "grammar expands to more than " + nfaLimit + " NFA states");
      }

      if (expr instanceof GrammarExpr.Literal literal) {
        int start = newState(rule);
        int current = start;
        for (int i = 0; i < literal.length(); i++) {
          int next = newState(rule);
          edge(current, singleByte(literal.byteAt(i)), next, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL, rule);
          current = next;
        }
        return new Fragment(start, current);
      }

      if (expr instanceof GrammarExpr.CharClass charClass) {
        int start = newState(rule);
        int end = newState(rule);
        edge(start, charClass.getBytes(), end, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL, rule);
        return new Fragment(start, end);
      }

      if (expr instanceof GrammarExpr.Sequence sequence) {
        int start = newState(rule);
        int current = start;
        for (GrammarExpr part : sequence.getParts()) {
          Fragment fragment = build(part, rule, refStack);
          epsilon(current, fragment.start);
          current = fragment.end;
        }
        return new Fragment(start, current);
      }

      if (expr instanceof GrammarExpr.Choice choice) {
        int start = newState(rule);
        int end = newState(rule);
        for (GrammarExpr alternative : choice.getAlternatives()) {
          Fragment fragment = build(alternative, rule, refStack);
          epsilon(start, fragment.start);
          epsilon(fragment.end, end);
        }
        return new Fragment(start, end);
      }

      if (expr instanceof GrammarExpr.Repeat repeat) {
        int start = newState(rule);
        int current = start;
        for (int i = 0; i < repeat.getMin(); i++) {
          Fragment fragment = build(repeat.getBody(), rule, refStack);
          epsilon(current, fragment.start);
          current = fragment.end;
        }
        int end = newState(rule);
        if (repeat.isUnbounded()) {
          int loop = newState(rule);
          epsilon(current, loop);
          Fragment fragment = build(repeat.getBody(), rule, refStack);
          epsilon(loop, fragment.start);
          epsilon(fragment.end, loop);
          epsilon(loop, end);
        } else {
          for (int i = repeat.getMin(); i < repeat.getMax(); i++) {
            epsilon(current, end);
            Fragment fragment = build(repeat.getBody(), rule, refStack);
            epsilon(current, fragment.start);
            current = fragment.end;
          }
          epsilon(current, end);
        }
        return new Fragment(start, end);
      }

      if (expr instanceof GrammarExpr.Ref ref) {
        String target = ref.getRule();
        if (refStack.contains(target)) {
          List<String> path = new ArrayList<>(refStack);
          Collections.reverse(path);
          path.add(target);
          throw new CompileException(grammarName, target,
              "recursion must pass through a nested construct: " + String.join(" -> ", path));
        }
        refStack.push(target);
        Fragment fragment = build(spec.rule(target), target, refStack);
        refStack.pop();
        return fragment;
      }

      if (expr instanceof GrammarExpr.Nest nest) {
        return buildNest(nest, rule);
      }

      throw new CompileException(grammarName, rule, "unsupported expression " + expr);
    }

    private Fragment buildNest(GrammarExpr.Nest nest, String rule) {
      Region region = regions.get(nest);
      if (region == null) {
        region = new Region(nest.getBody(), rule);
        region.entry = newState(rule);
        region.exit = newState(rule);
        int current = region.exit;
        GrammarExpr.Literal close = nest.getClose();
        for (int i = 0; i < close.length() - 1; i++) {
          int next = newState(rule);
          edge(current, singleByte(close.byteAt(i)), next, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL, rule);
          current = next;
        }
        region.closeLast = current;
        regions.put(nest, region);
        pending.add(region);
      }

      int symbol = symbolLabels.size();
      symbolLabels.add(rule + ":" + nest.getOpen() + "..." + nest.getClose() + "#" + symbol);

      GrammarExpr.Literal open = nest.getOpen();
      int start = newState(rule);
      int current = start;
      for (int i = 0; i < open.length() - 1; i++) {
        int next = newState(rule);
        edge(current, singleByte(open.byteAt(i)), next, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL, rule);
        current = next;
      }
      edge(current, singleByte(open.byteAt(open.length() - 1)), region.entry, StackOp.PUSH, symbol, rule);

      int end = newState(rule);
      GrammarExpr.Literal close = nest.getClose();
      edge(region.closeLast, singleByte(close.byteAt(close.length() - 1)), end, StackOp.POP, symbol, rule);
      return new Fragment(start, end);
    }

    private int newState(String rule) {
      nfa.add(new NfaState(rule));
      return nfa.size() - 1;
    }

    private void epsilon(int from, int to) {
      nfa.get(from).edges.add(new NfaEdge(null, to, StackOp.NONE, ConstraintAutomaton.NO_SYMBOL, null));
    }

    private void edge(int from, BitSet bytes, int to, StackOp op, int symbol, String rule) {
      nfa.get(from).edges.add(new NfaEdge(bytes, to, op, symbol, rule));
    }

    private BitSet singleByte(int b) {
      BitSet bytes = new BitSet(ALPHABET);
      bytes.set(b);
      return bytes;
    }

    // ---------------------------------------------------------------- subset construction

    private ConstraintAutomaton determinize(int nfaStart) throws CompileException {
      ConstraintAutomaton.Builder builder = ConstraintAutomaton.builder(grammarName);
      for (String label : symbolLabels) {
        builder.addSymbol(label);
      }

      Map<BitSet, Integer> ids = new HashMap<>();
      List<BitSet> subsets = new ArrayList<>();
      BitSet startSet = new BitSet();
      startSet.set(nfaStart);
      idOf(closure(startSet), ids, subsets, builder);
      builder.start(0);

      for (int d = 0; d < subsets.size(); d++) {
        BitSet subset = subsets.get(d);
        BitSet[] plain = new BitSet[ALPHABET];
        BitSet[] pushed = new BitSet[ALPHABET];
        int[] pushSymbol = new int[ALPHABET];
        Arrays.fill(pushSymbol, ConstraintAutomaton.NO_SYMBOL);
        @SuppressWarnings("unchecked")
        Map<Integer, BitSet>[] pops = new Map[ALPHABET];

        for (int s = subset.nextSetBit(0); s >= 0; s = subset.nextSetBit(s + 1)) {
          for (NfaEdge e : nfa.get(s).edges) {
            if (e.bytes == null) {
              continue;
            }
            for (int b = e.bytes.nextSetBit(0); b >= 0 && b < ALPHABET; b = e.bytes.nextSetBit(b + 1)) {
              switch (e.op) {
                case NONE -> {
                  if (plain[b] == null) {
                    plain[b] = new BitSet();
                  }
                  plain[b].set(e.target);
                }
                case PUSH -> {
                  if (pushSymbol[b] != ConstraintAutomaton.NO_SYMBOL && pushSymbol[b] != e.symbol) {
                    throw conflict(subset, b, "two nested constructs open on the same input");
                  }
                  pushSymbol[b] = e.symbol;
                  if (pushed[b] == null) {
                    pushed[b] = new BitSet();
                  }
                  pushed[b].set(e.target);
                }
                case POP -> {
                  if (pops[b] == null) {
                    pops[b] = new TreeMap<>();
                  }
                  pops[b].computeIfAbsent(e.symbol, ignored -> new BitSet()).set(e.target);
                }
              }
            }
          }
        }

        for (int b = 0; b < ALPHABET; b++) {
          boolean hasPlain = plain[b] != null;
          boolean hasPush = pushed[b] != null;
          boolean hasPop = pops[b] != null;
          if (hasPush && hasPlain) {
            throw conflict(subset, b, "a nested construct opens on input that also continues the enclosing text");
          }
          if (hasPop && (hasPlain || hasPush)) {
            throw conflict(subset, b, "a nested construct closes on input that is also valid content");
          }
          if (hasPlain) {
            builder.addTransition(d, b, idOf(closure(plain[b]), ids, subsets, builder));
          } else if (hasPush) {
            builder.addPush(d, b, idOf(closure(pushed[b]), ids, subsets, builder), pushSymbol[b]);
          } else if (hasPop) {
            for (Map.Entry<Integer, BitSet> pop : pops[b].entrySet()) {
              builder.addPop(d, b, pop.getKey(), idOf(closure(pop.getValue()), ids, subsets, builder));
            }
          }
        }
      }
      return builder.build();
    }

    private int idOf(BitSet subset, Map<BitSet, Integer> ids, List<BitSet> subsets,
                     ConstraintAutomaton.Builder builder) throws CompileException {
      Integer id = ids.get(subset);
      if (id != null) {
        return id;
      }
      if (subsets.size() >= maxStates) {
        throw new CompileException(grammarName, null, "automaton exceeds " + maxStates + " states");
      }
      int newId = builder.addState(nfa.get(subset.nextSetBit(0)).rule, subset.get(rootFinal));
      ids.put(subset, newId);
      subsets.add(subset);
      return newId;
    }

    private BitSet closure(BitSet states) {
      BitSet result = (BitSet) states.clone();
      Deque<Integer> work = new ArrayDeque<>();
      for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
        work.push(s);
      }
      while (!work.isEmpty()) {
        int s = work.pop();
        for (NfaEdge e : nfa.get(s).edges) {
          if (e.bytes == null && !result.get(e.target)) {
            result.set(e.target);
            work.push(e.target);
          }
        }
      }
      return result;
    }

    private CompileException conflict(BitSet subset, int b, String reason) {
      Set<String> rules = new LinkedHashSet<>();
      for (int s = subset.nextSetBit(0); s >= 0; s = subset.nextSetBit(s + 1)) {
        for (NfaEdge e : nfa.get(s).edges) {
          if (e.bytes != null && e.bytes.get(b)) {
            rules.add(e.rule);
          }
        }
      }
      String first = rules.isEmpty() ? null : rules.iterator().next();
      return new CompileException(grammarName, first,
          "ambiguous grammar: " + reason + " (byte " + describe(b) + ", rules " + rules + ")");
    }

    // ---------------------------------------------------------------- liveness

    private void checkLiveness(ConstraintAutomaton automaton) throws CompileException {
      int n = automaton.stateCount();
      List<List<Integer>> reverse = new ArrayList<>(n);
      for (int s = 0; s < n; s++) {
        reverse.add(new ArrayList<>());
      }
      automaton.forEachTransition((from, b, t) -> reverse.get(t.getTarget()).add(from));

      BitSet live = new BitSet(n);
      Deque<Integer> work = new ArrayDeque<>();
      for (int s = 0; s < n; s++) {
        if (automaton.isAcceptingState(s)) {
          live.set(s);
          work.push(s);
        }
      }
      while (!work.isEmpty()) {
        int s = work.pop();
        for (int predecessor : reverse.get(s)) {
          if (!live.get(predecessor)) {
            live.set(predecessor);
            work.push(predecessor);
          }
        }
      }

      int dead = live.nextClearBit(0);
      if (dead < n) {
        throw new CompileException(grammarName, automaton.stateLabel(dead),
            "state " + dead + " cannot reach an accepting state");
      }
    }
  }

  private static String describe(int b) {
    if (b >= 0x20 && b < 0x7F) {
      return "'" + (char) b + "'";
    }
    return String.format("0x%02X", b);
  }
}
