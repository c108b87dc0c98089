package com.badu.ai.constraint.decoding;

import com.badu.ai.constraint.engine.ForcedTermination;
import com.badu.ai.constraint.metrics.DecodingMetrics;
import com.badu.ai.constraint.validation.ValidationResult;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable outcome of decoding one sequence. Created via Builder pattern with validation.
 * <p>
 * {@link DecodingStatus#SUCCESS} guarantees the output is accepted by the format's automaton.
 * Every other status carries an error message; the partial output is still available.
 */
public final class DecodingResult {

  private final String sequenceId;
  private final DecodingStatus status;
  private final byte[] bytes;
  private final List<Integer> tokenIds;
  private final int backtracks;
  private final String error;
  private final ValidationResult validation;
  private final ForcedTermination.Outcome termination;
  private final DecodingMetrics metrics;

  private DecodingResult(Builder builder) {
    this.sequenceId = builder.sequenceId;
    this.status = builder.status;
    this.bytes = builder.bytes.clone();
    this.tokenIds = List.copyOf(builder.tokenIds);
    this.backtracks = builder.backtracks;
    this.error = builder.error;
    this.validation = builder.validation;
    this.termination = builder.termination;
    this.metrics = builder.metrics;
  }

  public String getSequenceId() {
    return sequenceId;
  }

  public DecodingStatus getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return status == DecodingStatus.SUCCESS;
  }

  /**
   * Returns the emitted output as UTF-8 text.
   */
  public String getText() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  public List<Integer> getTokenIds() {
    return tokenIds;
  }

  public int getSteps() {
    return tokenIds.size();
  }

  public int getBacktracks() {
    return backtracks;
  }

  /**
   * Returns the error message (null on success).
   */
  public String getError() {
    return error;
  }

  /**
   * Returns the semantic validation findings (null when validation did not run).
   */
  public ValidationResult getValidation() {
    return validation;
  }

  /**
   * Returns how an exhausted sequence was terminated (null when it was not).
   */
  public ForcedTermination.Outcome getTermination() {
    return termination;
  }

  public DecodingMetrics getMetrics() {
    return metrics;
  }

  @Override
  public String toString() {
    String text = getText();
    StringBuilder sb = new StringBuilder();
    sb.append("DecodingResult{");
    sb.append("id='").append(sequenceId).append("'");
    sb.append(", status=").append(status);
    sb.append(", text='").append(text.length() > 100 ? text.substring(0, 100) + "..." : text).append("'");
    sb.append(", steps=").append(getSteps());
    sb.append(", backtracks=").append(backtracks);
    if (error != null) {
      sb.append(", error='").append(error).append("'");
    }
    if (termination != null) {
      sb.append(", termination=").append(termination);
    }
    if (metrics != null) {
      sb.append(", total=").append(metrics.getTotalTimeMs()).append("ms");
    }
    sb.append("}");
    return sb.toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for DecodingResult with validation.
   */
  public static class Builder {
    private String sequenceId;
    private DecodingStatus status;
    private byte[] bytes = new byte[0];
    private List<Integer> tokenIds = List.of();
    private int backtracks;
    private String error;
    private ValidationResult validation;
    private ForcedTermination.Outcome termination;
    private DecodingMetrics metrics;

    public Builder sequenceId(String sequenceId) {
      this.sequenceId = sequenceId;
      return this;
    }

    public Builder status(DecodingStatus status) {
      this.status = status;
      return this;
    }

    public Builder bytes(byte[] bytes) {
      this.bytes = bytes;
      return this;
    }

    public Builder tokenIds(List<Integer> tokenIds) {
      this.tokenIds = tokenIds;
      return this;
    }

    public Builder backtracks(int backtracks) {
      this.backtracks = backtracks;
      return this;
    }

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public Builder validation(ValidationResult validation) {
      this.validation = validation;
      return this;
    }

    public Builder termination(ForcedTermination.Outcome termination) {
      this.termination = termination;
      return this;
    }

    public Builder metrics(DecodingMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds DecodingResult with validation.
     *
     * @throws IllegalStateException if the status and error are inconsistent
     */
    public DecodingResult build() {
      if (status == null) {
        throw new IllegalStateException("status is required");
      }
      if (status == DecodingStatus.SUCCESS && error != null) {
        throw new IllegalStateException("SUCCESS cannot carry an error: " + error);
      }
      if (status != DecodingStatus.SUCCESS && (error == null || error.isEmpty())) {
        throw new IllegalStateException(status + " requires a non-empty error message");
      }
      if (bytes == null || tokenIds == null) {
        throw new IllegalStateException("bytes and tokenIds cannot be null");
      }
      return new DecodingResult(this);
    }
  }
}
