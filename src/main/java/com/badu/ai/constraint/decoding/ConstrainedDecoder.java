package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.ConstraintException;
import com.badu.ai.constraint.engine.ConstraintEngine;
import com.badu.ai.constraint.engine.MaskResult;
import com.badu.ai.constraint.validation.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decodes one sequence under a format: model logits, mask, sample, advance, until the
 * sequence finishes, fails or exhausts its step bound.
 * <p>
 * Dead ends are handed to the engine's recovery and the same position is masked again with
 * a fresh model call for the shortened context. Exhaustion follows the configured
 * {@link com.badu.ai.constraint.config.ExhaustionPolicy}. A finished output is validated by
 * the semantic validator when {@code SEMANTIC_VALIDATION} is enabled.
 * <p>
 * Usage:
 * <pre>{@code
 * ConstrainedDecoder decoder = new ConstrainedDecoder(engine, model, SamplingSampler.greedy());
 * DecodingResult result = decoder.decode("request-1");
 * if (result.isSuccess()) {
 *   System.out.println(result.getText());
 * }
 * }</pre>
 */
public class ConstrainedDecoder {

  private static final Logger logger = LoggerFactory.getLogger(ConstrainedDecoder.class);

  private final ConstraintEngine engine;
  private final LanguageModel model;
  private final Sampler sampler;
  private final SemanticValidator validator;

  public ConstrainedDecoder(ConstraintEngine engine, LanguageModel model, Sampler sampler) {
    this(engine, model, sampler, SemanticValidator.NONE);
  }

  public ConstrainedDecoder(ConstraintEngine engine, LanguageModel model, Sampler sampler,
                            SemanticValidator validator) {
    if (engine == null || model == null || sampler == null) {
      throw new IllegalArgumentException("Engine, model and sampler are required");
    }
    this.engine = engine;
    this.model = model;
    this.sampler = sampler;
    this.validator = validator;
  }

  /**
   * Decodes one sequence.
   *
   * @param sequenceId id used in logs and the result
   * @return the decoding result; {@link DecodingStatus#SUCCESS} only for an accepted output
   * @throws ConstraintException {@code MODEL} if the model fails, {@code SAMPLER_CONTRACT}
   *     if the sampler picks a masked-out token
   */
  public DecodingResult decode(String sequenceId) {
    SequenceRun run = new SequenceRun(engine, validator, sequenceId);
    logger.debug("Decoding sequence '{}' under '{}'", sequenceId, engine.getAutomaton().getName());

    while (run.isActive()) {
      float[] logits = nextLogits(run);

      long maskStart = System.nanoTime();
      MaskResult mask = engine.mask(run.state(), logits);
      if (!run.onMask(mask, System.nanoTime() - maskStart)) {
        continue;
      }

      int tokenId = sampler.sample(mask.getLogits());
      long advanceStart = System.nanoTime();
      run.onAdvance(engine.advance(run.state(), tokenId), System.nanoTime() - advanceStart);
    }

    DecodingResult result = run.toResult();
    logger.debug("Decoded {}", result);
    return result;
  }

  private float[] nextLogits(SequenceRun run) {
    List<Integer> context = run.context();
    long start = System.nanoTime();
    try {
      float[] logits = model.nextTokenLogits(context);
      run.onModelTime(System.nanoTime() - start);
      return logits;
    } catch (Exception e) {
      run.fail("model failed: " + e.getMessage());
      throw new ConstraintException("Model failed for sequence '" + run.sequenceId() + "': " + e.getMessage(),
          ConstraintException.ErrorType.MODEL, run.sequenceId(), context.size(),
          "Check the model runtime; the sequence has been marked failed", e);
    }
  }
}
