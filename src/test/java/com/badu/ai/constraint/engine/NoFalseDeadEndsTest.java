package com.badu.ai.constraint.engine;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.formats.FormatRegistry;
import com.badu.ai.constraint.grammar.CompileException;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random walks through the built-in formats with a character-level vocabulary. Every
 * reachable configuration must offer a token (or be complete), and every offered token must
 * keep the output extendable.
 */
class NoFalseDeadEndsTest {

  private static final FormatRegistry REGISTRY = FormatRegistry.withBuiltInFormats();

  private static VocabularyIndex characterVocabulary() {
    VocabularyIndex.Builder builder = VocabularyIndex.builder();
    for (char c = 0x20; c < 0x7F; c++) {
      builder.add(String.valueOf(c));
    }
    builder.add("\n");
    for (String piece : List.of("\": ", "\"}", "]}", "</verse>", "bpm: ", "</think>", "true", "nul")) {
      builder.add(piece);
    }
    return builder.build();
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "json-object", "lyrics", "metadata"})
  @DisplayName("Random walks never reach a dead end")
  void randomWalk_neverDeadEnds(String format) throws CompileException {
    VocabularyIndex vocabulary = characterVocabulary();
    ConstraintAutomaton automaton = REGISTRY.automaton(format);
    Random rng = new Random(format.hashCode());

    try (ConstraintEngine engine = REGISTRY.newEngine(format, vocabulary, ConstraintConfig.DEFAULT)) {
      for (int walk = 0; walk < 25; walk++) {
        ConstraintState state = engine.newSequence(format + "-" + walk);
        for (int step = 0; step < 80 && !state.isTerminal(); step++) {
          MaskResult mask = engine.mask(state, new float[vocabulary.size()]);
          assertNotEquals(MaskResult.Status.DEAD_END, mask.getStatus(),
              "dead end after '" + state.getText() + "'");
          if (!mask.isMasked()) {
            break;
          }

          List<Integer> allowed = new ArrayList<>();
          float[] logits = mask.getLogits();
          for (int id = 0; id < logits.length; id++) {
            if (logits[id] != Float.NEGATIVE_INFINITY) {
              allowed.add(id);
            }
          }
          assertEquals(mask.getAllowedCount(), allowed.size());
          for (int id : allowed) {
            assertNotNull(automaton.walk(state.getRuntimeState(), vocabulary.piece(id)),
                "token '" + vocabulary.pieceText(id) + "' offered after '" + state.getText() + "'");
          }
          engine.advance(state, allowed.get(rng.nextInt(allowed.size())));
        }
        assertFalse(state.isFailed());
      }
    }
  }
}
