package com.badu.ai.constraint.decoding;

import java.util.ArrayList;
import java.util.List;

/**
 * The model collaborator: next-token logits for a context.
 *
 * <p>Implementations wrap an inference runtime. The engine never calls the model itself;
 * the decoders do, once per step and sequence.
 */
public interface LanguageModel {

  /**
   * Returns logits over the vocabulary for the token following {@code context}.
   *
   * @param context token ids emitted so far (prompt handling is up to the implementation)
   * @return logits of length V
   * @throws Exception if inference fails; decoders report it as a model error
   */
  float[] nextTokenLogits(List<Integer> context) throws Exception;

  /**
   * Batch variant; the default calls {@link #nextTokenLogits(List)} once per context.
   */
  default List<float[]> nextTokenLogitsBatch(List<List<Integer>> contexts) throws Exception {
    List<float[]> result = new ArrayList<>(contexts.size());
    for (List<Integer> context : contexts) {
      result.add(nextTokenLogits(context));
    }
    return result;
  }
}
