package com.badu.ai.constraint.validation;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable findings of a semantic check on structurally valid output.
 *
 * <ul>
 *   <li><b>valid</b>: no blocking errors</li>
 *   <li><b>errors</b>: values the application cannot use, e.g. {@code "bpm 500 is outside [30, 300]"}</li>
 *   <li><b>warnings</b>: findings that do not block, e.g. unknown keys</li>
 * </ul>
 *
 * @see SemanticValidator
 */
@Value
@Builder
public class ValidationResult {
    boolean valid;
    List<String> errors;
    List<String> warnings;

    /**
     * A result with no findings.
     */
    public static ValidationResult valid() {
        return ValidationResult.builder()
                .valid(true)
                .errors(List.of())
                .warnings(List.of())
                .build();
    }

    public static ValidationResult validWithWarnings(List<String> warnings) {
        return ValidationResult.builder()
                .valid(true)
                .errors(List.of())
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static ValidationResult invalid(List<String> errors) {
        return invalid(errors, List.of());
    }

    public static ValidationResult invalid(List<String> errors, List<String> warnings) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return ValidationResult.builder()
                .valid(false)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Result for the collected findings: valid iff {@code errors} is empty.
     */
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return errors.isEmpty() ? validWithWarnings(warnings) : invalid(errors, warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Combines the findings of two checks on the same output.
     */
    public ValidationResult and(ValidationResult other) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.addAll(other.errors);
        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings);
        return of(allErrors, allWarnings);
    }
}
