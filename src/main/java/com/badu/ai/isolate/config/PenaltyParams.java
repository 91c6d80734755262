package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable repetition penalty settings.
 */
@Value
@Builder
public class PenaltyParams {

  /**
   * Penalty for tokens that already appeared.
   * Range: [0.0, 2.0]
   * Default: 0.5
   */
  @Builder.Default
  float presencePenalty = 0.5f;

  /**
   * Penalty proportional to how often a token appeared.
   * Range: [0.0, 2.0]
   * Default: 0.5
   */
  @Builder.Default
  float frequencyPenalty = 0.5f;

  /**
   * Per-token decay applied to accumulated penalties.
   * Range: [0.990, 0.999]
   * Default: 0.996
   */
  @Builder.Default
  float penaltyDecay = 0.996f;

  /**
   * Returns the penalty settings the engine starts with.
   */
  public static PenaltyParams initial() {
    return builder().build();
  }

  /**
   * Custom builder with validation logic.
   */
  public static class PenaltyParamsBuilder {
    /**
     * Builds the PenaltyParams with validation.
     *
     * @return validated PenaltyParams instance
     * @throws IllegalStateException if validation fails
     */
    public PenaltyParams build() {
      if (!this.presencePenalty$set) {
        this.presencePenalty$value = 0.5f;
        this.presencePenalty$set = true;
      }
      if (!this.frequencyPenalty$set) {
        this.frequencyPenalty$value = 0.5f;
        this.frequencyPenalty$set = true;
      }
      if (!this.penaltyDecay$set) {
        this.penaltyDecay$value = 0.996f;
        this.penaltyDecay$set = true;
      }

      if (this.presencePenalty$value < 0.0f || this.presencePenalty$value > 2.0f) {
        throw new IllegalStateException(
            "presencePenalty must be in range [0.0, 2.0], got: " + this.presencePenalty$value);
      }

      if (this.frequencyPenalty$value < 0.0f || this.frequencyPenalty$value > 2.0f) {
        throw new IllegalStateException(
            "frequencyPenalty must be in range [0.0, 2.0], got: " + this.frequencyPenalty$value);
      }

      if (this.penaltyDecay$value < 0.990f || this.penaltyDecay$value > 0.999f) {
        throw new IllegalStateException(
            "penaltyDecay must be in range [0.990, 0.999], got: " + this.penaltyDecay$value);
      }

      return new PenaltyParams(this.presencePenalty$value, this.frequencyPenalty$value,
          this.penaltyDecay$value);
    }
  }
}
