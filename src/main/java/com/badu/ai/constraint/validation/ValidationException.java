package com.badu.ai.constraint.validation;

/**
 * Exception thrown by {@link SemanticValidator#validateOrThrow(byte[])} when output is
 * structurally valid but semantically unusable.
 *
 * <p>Carries the full {@link ValidationResult}.
 */
public class ValidationException extends Exception {

  private final ValidationResult validationResult;

  public ValidationException(ValidationResult validationResult) {
    super(buildMessage(validationResult));
    this.validationResult = validationResult;
  }

  public ValidationResult getValidationResult() {
    return validationResult;
  }

  private static String buildMessage(ValidationResult result) {
    if (result == null || result.getErrors().isEmpty()) {
      return "Semantic validation failed";
    }

    StringBuilder message = new StringBuilder("Semantic validation failed with ")
        .append(result.getErrors().size()).append(" error(s):");
    for (int i = 0; i < result.getErrors().size(); i++) {
      message.append("\n  ").append(i + 1).append(". ").append(result.getErrors().get(i));
    }
    for (String warning : result.getWarnings()) {
      message.append("\n  - ").append(warning);
    }
    return message.toString();
  }
}
