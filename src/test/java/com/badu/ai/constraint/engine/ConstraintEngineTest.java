package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.ConstraintException;
import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.cache.TokenTransitionCache;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.formats.JsonFormat;
import com.badu.ai.constraint.formats.KeyValueBlockFormat;
import com.badu.ai.constraint.grammar.CompileException;
import com.badu.ai.constraint.grammar.GrammarCompiler;
import com.badu.ai.constraint.grammar.GrammarExpr;
import com.badu.ai.constraint.grammar.GrammarSpec;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConstraintEngine masking and advancing.
 */
class ConstraintEngineTest {

  private final List<ConstraintEngine> engines = new ArrayList<>();

  @AfterEach
  void tearDown() {
    engines.forEach(ConstraintEngine::close);
  }

  private ConstraintEngine engine(GrammarSpec spec, VocabularyIndex vocabulary, ConstraintConfig config)
      throws CompileException {
    ConstraintAutomaton automaton = new GrammarCompiler().compile(spec);
    ConstraintEngine engine = new ConstraintEngine(new TokenTransitionCache(automaton, vocabulary), config);
    engines.add(engine);
    return engine;
  }

  private static GrammarSpec single(GrammarExpr root) {
    return GrammarSpec.builder("test").rule("root", root).build();
  }

  private static AdvanceResult emit(ConstraintEngine engine, ConstraintState state, String piece) {
    MaskResult mask = engine.mask(state, new float[engine.getVocabulary().size()]);
    assertEquals(MaskResult.Status.MASKED, mask.getStatus(), "mask before '" + piece + "'");
    int tokenId = engine.getVocabulary().tokenId(piece);
    assertTrue(mask.getLogits()[tokenId] > Float.NEGATIVE_INFINITY, "'" + piece + "' should be allowed");
    return engine.advance(state, tokenId);
  }

  private static boolean allowed(MaskResult mask, VocabularyIndex vocabulary, String piece) {
    return mask.getLogits()[vocabulary.tokenId(piece)] > Float.NEGATIVE_INFINITY;
  }

  @Test
  @DisplayName("Byte-level pieces inside a JSON string only form complete UTF-8 characters")
  void mask_jsonString_onlyWellFormedUtf8() throws Exception {
    byte[] continuation = {(byte) 0x80};
    byte[] lead = {(byte) 0xC3};
    byte[] eAcuteTail = {(byte) 0xA9};
    VocabularyIndex vocabulary = VocabularyIndex.builder()
        .add("\"")
        .add("a")
        .addBytes(continuation)
        .addBytes(lead)
        .addBytes(eAcuteTail)
        .build();
    ConstraintEngine engine = engine(JsonFormat.value().toGrammar(), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("utf8");

    assertEquals(AdvanceResult.ADVANCED, emit(engine, state, "\""));

    MaskResult inString = engine.mask(state, new float[vocabulary.size()]);
    assertTrue(allowed(inString, vocabulary, "a"));
    assertTrue(inString.getLogits()[vocabulary.tokenId(lead)] > Float.NEGATIVE_INFINITY);
    assertEquals(Float.NEGATIVE_INFINITY, inString.getLogits()[vocabulary.tokenId(continuation)]);
    assertEquals(Float.NEGATIVE_INFINITY, inString.getLogits()[vocabulary.tokenId(eAcuteTail)]);
    assertEquals(AdvanceResult.ADVANCED, engine.advance(state, vocabulary.tokenId(lead)));

    MaskResult afterLead = engine.mask(state, new float[vocabulary.size()]);
    assertEquals(2, afterLead.getAllowedCount());
    assertFalse(allowed(afterLead, vocabulary, "\""));
    assertFalse(allowed(afterLead, vocabulary, "a"));
    assertTrue(afterLead.getLogits()[vocabulary.tokenId(continuation)] > Float.NEGATIVE_INFINITY);
    assertEquals(AdvanceResult.ADVANCED, engine.advance(state, vocabulary.tokenId(eAcuteTail)));

    assertEquals(AdvanceResult.ACCEPTED, emit(engine, state, "\""));
    JsonNode parsed = new ObjectMapper().readTree(state.getBytes());
    assertEquals("\u00e9", parsed.textValue());
  }

  @Test
  @DisplayName("Metadata lines stay in normal state, exclude bad keys and accept after the marker")
  void scenarioA_keyValueLines() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("bpm", ": ", "120", "\n", "keyscale", "C", " major",
        "</think>", "bpmx", "x", "1200");
    ConstraintEngine engine = engine(KeyValueBlockFormat.musicMetadata().toGrammar(), vocabulary,
        ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("scenario-a");

    MaskResult first = engine.mask(state, new float[vocabulary.size()]);
    assertTrue(allowed(first, vocabulary, "bpm"));
    assertTrue(allowed(first, vocabulary, "keyscale"));
    assertFalse(allowed(first, vocabulary, "bpmx"));
    assertFalse(allowed(first, vocabulary, "</think>"));
    engine.advance(state, vocabulary.tokenId("bpm"));

    MaskResult afterKey = engine.mask(state, new float[vocabulary.size()]);
    assertTrue(allowed(afterKey, vocabulary, ": "));
    assertFalse(allowed(afterKey, vocabulary, "x"));
    assertFalse(allowed(afterKey, vocabulary, "bpmx"));
    assertEquals(1, afterKey.getAllowedCount());
    engine.advance(state, vocabulary.tokenId(": "));

    MaskResult value = engine.mask(state, new float[vocabulary.size()]);
    assertTrue(allowed(value, vocabulary, "120"));
    assertFalse(allowed(value, vocabulary, "1200"));
    assertEquals(AdvanceResult.ADVANCED, engine.advance(state, vocabulary.tokenId("120")));

    for (String piece : List.of("\n", "keyscale", ": ", "C", " major", "\n")) {
      assertEquals(AdvanceResult.ADVANCED, emit(engine, state, piece));
      assertEquals(RecoveryStatus.NORMAL, state.getRecoveryStatus());
    }
    assertEquals(AdvanceResult.ACCEPTED, emit(engine, state, "</think>"));
    assertTrue(engine.isAccepting(state));

    assertEquals(MaskResult.Status.FINISHED, engine.mask(state, new float[vocabulary.size()]).getStatus());
    assertTrue(state.isFinished());
    assertEquals("bpm: 120\nkeyscale: C major\n</think>", state.getText());
    assertEquals(RecoveryStatus.NORMAL, state.getRecoveryStatus());
    assertEquals(0, state.getTotalBacktracks());
  }

  @Test
  @DisplayName("Closing an object while an array is open is excluded by the stack")
  void scenarioB_nestedBrackets() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("{", "}", "[", "]", "\"", "a", ":", "1", "2", "3", ",");
    ConstraintEngine engine = engine(JsonFormat.value().toGrammar(), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("scenario-b");

    for (char c : "{\"a\":[1,2,3".toCharArray()) {
      emit(engine, state, String.valueOf(c));
    }

    MaskResult mask = engine.mask(state, new float[vocabulary.size()]);
    assertFalse(allowed(mask, vocabulary, "}"));
    assertTrue(allowed(mask, vocabulary, "]"));
    assertEquals(Float.NEGATIVE_INFINITY, mask.getLogits()[vocabulary.tokenId("}")]);

    assertEquals(AdvanceResult.ADVANCED, engine.advance(state, vocabulary.tokenId("]")));
    assertEquals(AdvanceResult.ACCEPTED, emit(engine, state, "}"));
    assertEquals("{\"a\":[1,2,3]}", state.getText());
    assertEquals(0, state.getRuntimeState().getStack().depth());
  }

  @Test
  @DisplayName("EOS is admitted only in accepting states and finishes without bytes")
  void eos_onlyWhenAccepting() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.builder().add("a").addEos("</s>").build();
    ConstraintEngine engine = engine(single(oneOrMore(literal("a"))), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("eos");

    MaskResult first = engine.mask(state, new float[] {0f, 5f});
    assertEquals(Float.NEGATIVE_INFINITY, first.getLogits()[1]);
    assertEquals(1, first.getAllowedCount());
    assertEquals(AdvanceResult.ACCEPTED, engine.advance(state, 0));

    MaskResult second = engine.mask(state, new float[] {0f, 5f});
    assertEquals(5f, second.getLogits()[1]);
    assertEquals(2, second.getAllowedCount());
    assertEquals(AdvanceResult.FINISHED, engine.advance(state, 1));

    assertTrue(state.isFinished());
    assertEquals("a", state.getText());
    assertEquals(1, state.getStepCount());
    assertEquals(MaskResult.Status.FINISHED, engine.mask(state, new float[2]).getStatus());
  }

  @Test
  @DisplayName("Step bound without acceptance reports EXHAUSTED")
  void mask_stepBoundNotAccepting_exhausted() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintConfig config = ConstraintConfig.builder().maxSteps(2).build();
    ConstraintEngine engine = engine(single(literal("aaa")), vocabulary, config);
    ConstraintState state = engine.newSequence("exhausted");

    emit(engine, state, "a");
    emit(engine, state, "a");

    assertEquals(MaskResult.Status.EXHAUSTED, engine.mask(state, new float[1]).getStatus());
    assertFalse(state.isTerminal());
  }

  @Test
  @DisplayName("Step bound in an accepting state finishes the sequence")
  void mask_stepBoundAccepting_finished() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintConfig config = ConstraintConfig.builder().maxSteps(2).build();
    ConstraintEngine engine = engine(single(oneOrMore(literal("a"))), vocabulary, config);
    ConstraintState state = engine.newSequence("bounded");

    emit(engine, state, "a");
    emit(engine, state, "a");

    assertEquals(MaskResult.Status.FINISHED, engine.mask(state, new float[1]).getStatus());
    assertTrue(state.isFinished());
  }

  @Test
  @DisplayName("stopOnFirstAccept finishes at the first accepting state")
  void advance_stopOnFirstAccept_finishes() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintConfig config = ConstraintConfig.builder().stopOnFirstAccept(true).build();
    ConstraintEngine engine = engine(single(oneOrMore(literal("a"))), vocabulary, config);
    ConstraintState state = engine.newSequence("first-accept");

    assertEquals(AdvanceResult.FINISHED, emit(engine, state, "a"));
    assertTrue(state.isFinished());
  }

  @Test
  @DisplayName("Sampling a masked-out token is a sampler contract violation")
  void advance_disallowedToken_throwsSamplerContract() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintEngine engine = engine(single(literal("ab")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("contract");
    engine.mask(state, new float[2]);

    ConstraintException exception = assertThrows(ConstraintException.class, () -> engine.advance(state, 1));

    assertEquals(ConstraintException.ErrorType.SAMPLER_CONTRACT, exception.getErrorType());
    assertEquals("contract", exception.getSequenceId());
    assertEquals(0, state.getStepCount());
  }

  @Test
  @DisplayName("Advance without a preceding mask is an invalid state")
  void advance_withoutMask_throwsInvalidState() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("no-mask");

    ConstraintException exception = assertThrows(ConstraintException.class, () -> engine.advance(state, 0));

    assertEquals(ConstraintException.ErrorType.INVALID_STATE, exception.getErrorType());
  }

  @Test
  @DisplayName("Advancing a finished sequence is an invalid state")
  void advance_finishedSequence_throwsInvalidState() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintConfig config = ConstraintConfig.builder().stopOnFirstAccept(true).build();
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, config);
    ConstraintState state = engine.newSequence("done");
    emit(engine, state, "a");

    ConstraintException exception = assertThrows(ConstraintException.class, () -> engine.advance(state, 0));

    assertEquals(ConstraintException.ErrorType.INVALID_STATE, exception.getErrorType());
  }

  @Test
  @DisplayName("Logits of the wrong length are a vocabulary error")
  void mask_wrongLength_throwsVocabularyError() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("length");

    ConstraintException exception = assertThrows(ConstraintException.class,
        () -> engine.mask(state, new float[3]));

    assertEquals(ConstraintException.ErrorType.VOCABULARY, exception.getErrorType());
  }

  @Test
  @DisplayName("Mask returns a copy and keeps allowed values unchanged")
  void mask_copiesLogits() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintConfig config = ConstraintConfig.builder().logitFloor(-100f).build();
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, config);
    ConstraintState state = engine.newSequence("copy");
    float[] logits = {1.5f, 2.5f};

    MaskResult mask = engine.mask(state, logits);

    assertNotSame(logits, mask.getLogits());
    assertArrayEquals(new float[] {1.5f, 2.5f}, logits);
    assertArrayEquals(new float[] {1.5f, -100f}, mask.getLogits());
  }

  @Test
  @DisplayName("No admissible token yields a DEAD_END sentinel, not an empty mask")
  void mask_noAdmissibleToken_deadEnd() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintEngine engine = engine(single(literal("ab")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("dead-end");
    emit(engine, state, "a");

    MaskResult mask = engine.mask(state, new float[1]);

    assertEquals(MaskResult.Status.DEAD_END, mask.getStatus());
    assertFalse(mask.isMasked());
    assertNull(mask.getLogits());
  }

  @Test
  @DisplayName("Failed sequences report FAILED from mask")
  void fail_marksSequenceFailed() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState state = engine.newSequence("failing");

    engine.fail(state, "model crashed");

    assertTrue(state.isFailed());
    assertEquals("model crashed", state.getFailureReason());
    assertEquals(MaskResult.Status.FAILED, engine.mask(state, new float[1]).getStatus());
  }

  @Test
  @DisplayName("Batch masking isolates a failing sequence")
  void maskBatch_isolatesFailures() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintConfig config = ConstraintConfig.builder().parallelism(2).build();
    ConstraintEngine engine = engine(single(literal("ab")), vocabulary, config);
    ConstraintState good = engine.newSequence("good");
    ConstraintState bad = engine.newSequence("bad");

    List<MaskResult> masks = engine.maskBatch(List.of(good, bad), List.of(new float[2], new float[5]));

    assertEquals(MaskResult.Status.MASKED, masks.get(0).getStatus());
    assertEquals(MaskResult.Status.FAILED, masks.get(1).getStatus());
    assertTrue(bad.isFailed());
    assertFalse(good.isTerminal());
  }

  @Test
  @DisplayName("Batch advance fails only the sequence with a rejected token")
  void advanceBatch_isolatesRejectedToken() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a", "b");
    ConstraintEngine engine = engine(single(literal("ab")), vocabulary, ConstraintConfig.DEFAULT);
    ConstraintState good = engine.newSequence("good");
    ConstraintState bad = engine.newSequence("bad");
    engine.maskBatch(List.of(good, bad), List.of(new float[2], new float[2]));

    List<AdvanceResult> results = engine.advanceBatch(List.of(good, bad), new int[] {0, 1});

    assertEquals(AdvanceResult.ADVANCED, results.get(0));
    assertEquals(AdvanceResult.FAILED, results.get(1));
    assertEquals("a", good.getText());
    assertTrue(bad.isFailed());
  }

  @Test
  @DisplayName("Batch sizes must match")
  void maskBatch_sizeMismatch_throwsException() throws CompileException {
    VocabularyIndex vocabulary = VocabularyIndex.of("a");
    ConstraintEngine engine = engine(single(literal("a")), vocabulary, ConstraintConfig.DEFAULT);

    assertThrows(IllegalArgumentException.class,
        () -> engine.maskBatch(List.of(engine.newSequence("x")), List.of()));
  }
}
