package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.ConstraintException;
import com.badu.ai.constraint.engine.AdvanceResult;
import com.badu.ai.constraint.engine.ConstraintEngine;
import com.badu.ai.constraint.engine.ConstraintState;
import com.badu.ai.constraint.engine.MaskResult;
import com.badu.ai.constraint.validation.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Decodes several sequences step by step: one batched model call, one
 * {@link ConstraintEngine#maskBatch} and one {@link ConstraintEngine#advanceBatch} per step
 * for all sequences still active.
 * <p>
 * Sequences are isolated: a dead end, a rejected token or a failure in one sequence never
 * affects the others. {@link #cancel(String)} may be called from any thread and takes
 * effect at the next step boundary.
 */
public class BatchDecoder {

  private static final Logger logger = LoggerFactory.getLogger(BatchDecoder.class);

  private final ConstraintEngine engine;
  private final LanguageModel model;
  private final Sampler sampler;
  private final SemanticValidator validator;
  private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

  public BatchDecoder(ConstraintEngine engine, LanguageModel model, Sampler sampler) {
    this(engine, model, sampler, SemanticValidator.NONE);
  }

  public BatchDecoder(ConstraintEngine engine, LanguageModel model, Sampler sampler,
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
   * Requests cancellation of a sequence. Its result reports {@link DecodingStatus#CANCELLED}
   * with the output emitted so far.
   */
  public void cancel(String sequenceId) {
    cancelled.add(sequenceId);
  }

  /**
   * Decodes the sequences together.
   *
   * @param sequenceIds distinct sequence ids
   * @return one result per id, in input order
   * @throws IllegalArgumentException if ids repeat
   * @throws ConstraintException {@code MODEL} if the batched model call fails
   */
  public List<DecodingResult> decode(List<String> sequenceIds) {
    if (new HashSet<>(sequenceIds).size() != sequenceIds.size()) {
      throw new IllegalArgumentException("Sequence ids must be distinct: " + sequenceIds);
    }
    List<SequenceRun> runs = new ArrayList<>(sequenceIds.size());
    for (String id : sequenceIds) {
      runs.add(new SequenceRun(engine, validator, id));
    }
    logger.info("Decoding batch of {} sequence(s) under '{}'", runs.size(), engine.getAutomaton().getName());

    try {
      int steps = 0;
      while (true) {
        for (SequenceRun run : runs) {
          if (run.isActive() && cancelled.remove(run.sequenceId())) {
            run.cancel();
          }
        }
        List<SequenceRun> active = runs.stream().filter(SequenceRun::isActive).collect(Collectors.toList());
        if (active.isEmpty()) {
          break;
        }
        step(active);
        steps++;
        logger.trace("Batch step {}: {} active sequence(s)", steps, active.size());
      }
    } finally {
      sequenceIds.forEach(cancelled::remove);
    }

    List<DecodingResult> results = new ArrayList<>(runs.size());
    for (SequenceRun run : runs) {
      results.add(run.toResult());
    }
    logger.info("Batch finished: {} of {} succeeded", results.stream().filter(DecodingResult::isSuccess).count(),
        results.size());
    return results;
  }

  private void step(List<SequenceRun> active) {
    List<ConstraintState> states = new ArrayList<>(active.size());
    List<List<Integer>> contexts = new ArrayList<>(active.size());
    for (SequenceRun run : active) {
      states.add(run.state());
      contexts.add(run.context());
    }

    List<float[]> logits = nextLogits(active, contexts);

    long maskStart = System.nanoTime();
    List<MaskResult> masks = engine.maskBatch(states, logits);
    long maskNanos = (System.nanoTime() - maskStart) / active.size();

    List<SequenceRun> sampling = new ArrayList<>();
    List<Integer> tokens = new ArrayList<>();
    for (int i = 0; i < active.size(); i++) {
      SequenceRun run = active.get(i);
      MaskResult mask = masks.get(i);
      if (run.onMask(mask, maskNanos)) {
        sampling.add(run);
        tokens.add(sampler.sample(mask.getLogits()));
      }
    }
    if (sampling.isEmpty()) {
      return;
    }

    long advanceStart = System.nanoTime();
    List<AdvanceResult> advances = engine.advanceBatch(
        sampling.stream().map(SequenceRun::state).collect(Collectors.toList()),
        tokens.stream().mapToInt(Integer::intValue).toArray());
    long advanceNanos = (System.nanoTime() - advanceStart) / sampling.size();
    for (int i = 0; i < sampling.size(); i++) {
      sampling.get(i).onAdvance(advances.get(i), advanceNanos);
    }
  }

  private List<float[]> nextLogits(List<SequenceRun> active, List<List<Integer>> contexts) {
    long start = System.nanoTime();
    List<float[]> logits;
    try {
      logits = model.nextTokenLogitsBatch(contexts);
    } catch (Exception e) {
      for (SequenceRun run : active) {
        run.fail("model failed: " + e.getMessage());
      }
      throw new ConstraintException("Batched model call failed: " + e.getMessage(),
          ConstraintException.ErrorType.MODEL, "Check the model runtime; the active sequences have been marked failed", e);
    }
    if (logits == null || logits.size() != active.size()) {
      for (SequenceRun run : active) {
        run.fail("model returned a wrong number of logits vectors");
      }
      throw new ConstraintException("Model returned " + (logits == null ? "no" : logits.size()) + " logits vectors for "
          + active.size() + " sequences", ConstraintException.ErrorType.MODEL);
    }
    long perSequence = (System.nanoTime() - start) / active.size();
    for (SequenceRun run : active) {
      run.onModelTime(perSequence);
    }
    return logits;
  }
}
