package com.badu.ai.constraint.validation;

/**
 * Value-level check applied to output the automaton has accepted.
 *
 * <p>Structure is guaranteed by the automaton; a validator checks what a grammar cannot
 * express cheaply (numeric ranges, cross-field rules). Decoders report a failed check as
 * {@code SEMANTIC_INVALID} and never retry on their own.
 */
@FunctionalInterface
public interface SemanticValidator {

  /** Validator that accepts everything. */
  SemanticValidator NONE = emitted -> ValidationResult.valid();

  /**
   * Validates the complete emitted bytes of a sequence.
   *
   * @param emitted UTF-8 bytes accepted by the automaton
   * @return findings
   */
  ValidationResult validate(byte[] emitted);

  /**
   * Validates and throws on blocking errors.
   *
   * @return the result, when valid (possibly with warnings)
   * @throws ValidationException if the result has errors
   */
  default ValidationResult validateOrThrow(byte[] emitted) throws ValidationException {
    ValidationResult result = validate(emitted);
    if (!result.isValid()) {
      throw new ValidationException(result);
    }
    return result;
  }
}
