package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.cache.TokenTransitionCache;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.config.ExhaustionPolicy;
import com.badu.ai.constraint.config.Feature;
import com.badu.ai.constraint.config.FeatureFlags;
import com.badu.ai.constraint.grammar.CompileException;
import com.badu.ai.constraint.grammar.GrammarCompiler;
import com.badu.ai.constraint.grammar.GrammarExpr;
import com.badu.ai.constraint.grammar.GrammarSpec;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static com.badu.ai.constraint.grammar.GrammarExpr.seq;
import static com.badu.ai.constraint.grammar.GrammarExpr.zeroOrMore;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ending sequences that ran out of steps.
 */
class ForcedTerminationTest {

  private ConstraintEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.close();
    }
  }

  private ConstraintEngine engine(GrammarExpr root, VocabularyIndex vocabulary, ConstraintConfig config)
      throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("termination").rule("root", root).build();
    engine = new ConstraintEngine(new TokenTransitionCache(new GrammarCompiler().compile(spec), vocabulary), config);
    return engine;
  }

  private static void emitAll(ConstraintEngine engine, ConstraintState state, String... pieces) {
    for (String piece : pieces) {
      assertEquals(MaskResult.Status.MASKED, engine.mask(state, new float[engine.getVocabulary().size()]).getStatus());
      engine.advance(state, engine.getVocabulary().tokenId(piece));
    }
  }

  private static ConstraintConfig config(int maxSteps, boolean forcedCompletion) {
    return ConstraintConfig.builder()
        .maxSteps(maxSteps)
        .exhaustionPolicy(ExhaustionPolicy.FORCE_TERMINATE)
        .featureFlags(FeatureFlags.defaults().with(Feature.FORCED_COMPLETION, forcedCompletion))
        .build();
  }

  @Test
  @DisplayName("Forced completion appends the shortest path to acceptance")
  void terminate_forcedCompletion_appendsShortestPath() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("go", "x", ".");
    ConstraintEngine engine = engine(seq(literal("go"), zeroOrMore(literal("x")), literal(".")), vocabulary,
        config(3, true));
    ConstraintState state = engine.newSequence("complete");
    emitAll(engine, state, "go", "x", "x");
    assertEquals(MaskResult.Status.EXHAUSTED, engine.mask(state, new float[3]).getStatus());

    assertEquals(ForcedTermination.Outcome.COMPLETED, engine.forceTerminate(state));

    assertEquals("goxx.", state.getText());
    assertTrue(state.isFinished());
    assertTrue(engine.isAccepting(state));
    assertEquals(4, state.getStepCount());
  }

  @Test
  @DisplayName("Without forced completion the output is rewound to its last accepting prefix")
  void terminate_noCompletion_rewinds() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintEngine engine = engine(oneOrMore(literal("ab")), vocabulary, config(3, false));
    ConstraintState state = engine.newSequence("rewind");
    emitAll(engine, state, "a", "b", "a");
    assertEquals(MaskResult.Status.EXHAUSTED, engine.mask(state, new float[2]).getStatus());

    assertEquals(ForcedTermination.Outcome.REWOUND, engine.forceTerminate(state));

    assertEquals("ab", state.getText());
    assertEquals(List.of(0, 1), state.getTokenIds());
    assertTrue(state.isFinished());
  }

  @Test
  @DisplayName("No accepting prefix and no completion fails the sequence")
  void terminate_nothingReachable_fails() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("go", "x", ".");
    ConstraintEngine engine = engine(seq(literal("go"), zeroOrMore(literal("x")), literal(".")), vocabulary,
        config(2, false));
    ConstraintState state = engine.newSequence("stuck");
    emitAll(engine, state, "go", "x");

    assertEquals(ForcedTermination.Outcome.FAILED, engine.forceTerminate(state));

    assertTrue(state.isFailed());
    assertEquals("step bound reached and no accepting output is reachable", state.getFailureReason());
  }

  @Test
  @DisplayName("An accepting sequence is completed without extra tokens")
  void terminate_accepting_completesAsIs() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintEngine engine = engine(oneOrMore(literal("ab")), vocabulary, config(8, true));
    ConstraintState state = engine.newSequence("done");
    emitAll(engine, state, "a", "b");

    assertEquals(ForcedTermination.Outcome.COMPLETED, engine.forceTerminate(state));
    assertEquals("ab", state.getText());
  }

  @Test
  @DisplayName("Completion longer than the token allowance is not found")
  void shortestCompletion_respectsMaxTokens() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b", "c");
    ConstraintEngine engine = engine(literal("abc"), vocabulary, config(8, true));
    ForcedTermination termination = new ForcedTermination(
        new TokenTransitionCache(engine.getAutomaton(), vocabulary), engine.getConfig());
    ConstraintState state = engine.newSequence("search");

    assertEquals(List.of(0, 1, 2), termination.shortestCompletion(state.getRuntimeState(), 3));
    assertNull(termination.shortestCompletion(state.getRuntimeState(), 2));
  }
}
