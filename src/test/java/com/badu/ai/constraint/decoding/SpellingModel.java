package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.vocabulary.VocabularyIndex;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Test model that steers greedy decoding towards a target text: the longest token that
 * continues the target gets logit 10, everything else 0.
 */
class SpellingModel implements LanguageModel {

  private final VocabularyIndex vocabulary;
  private final byte[] target;
  private int calls;

  SpellingModel(VocabularyIndex vocabulary, String target) {
    this.vocabulary = vocabulary;
    this.target = target.getBytes(StandardCharsets.UTF_8);
  }

  int getCalls() {
    return calls;
  }

  @Override
  public float[] nextTokenLogits(List<Integer> context) {
    calls++;
    byte[] emitted = vocabulary.concat(context);
    float[] logits = new float[vocabulary.size()];
    int best = -1;
    for (int id = 0; id < vocabulary.size(); id++) {
      if (vocabulary.isSpecial(id)) {
        continue;
      }
      byte[] piece = vocabulary.piece(id);
      if (continuesTarget(emitted, piece) && (best < 0 || piece.length > vocabulary.pieceLength(best))) {
        best = id;
      }
    }
    if (best >= 0) {
      logits[best] = 10f;
    }
    return logits;
  }

  private boolean continuesTarget(byte[] emitted, byte[] piece) {
    int start = emitted.length;
    if (start + piece.length > target.length
        || !Arrays.equals(emitted, 0, start, target, 0, start)) {
      return false;
    }
    return Arrays.equals(piece, 0, piece.length, target, start, start + piece.length);
  }
}
