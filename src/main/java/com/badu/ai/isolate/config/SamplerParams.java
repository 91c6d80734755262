package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable sampler settings applied to the next generation.
 *
 * <p>Builder pattern usage:
 * <pre>{@code
 * SamplerParams params = SamplerParams.builder()
 *     .temperature(0.8f)
 *     .topK(40)
 *     .build();
 * }</pre>
 */
@Value
@Builder
public class SamplerParams {

  /**
   * Sampling temperature.
   * Range: [0.0, 3.0]
   * Default: 1.0
   */
  @Builder.Default
  float temperature = 1.0f;

  /**
   * Top-K sampling.
   * Range: [0, 128]
   * Default: 1
   */
  @Builder.Default
  int topK = 1;

  /**
   * Nucleus sampling threshold.
   * Range: [0.0, 1.0]
   * Default: 0.5
   */
  @Builder.Default
  float topP = 0.5f;

  /**
   * Returns the sampler settings the engine starts with.
   */
  public static SamplerParams initial() {
    return builder().build();
  }

  /**
   * Custom builder with validation logic.
   */
  public static class SamplerParamsBuilder {
    /**
     * Builds the SamplerParams with validation.
     *
     * @return validated SamplerParams instance
     * @throws IllegalStateException if validation fails
     */
    public SamplerParams build() {
      if (!this.temperature$set) {
        this.temperature$value = 1.0f;
        this.temperature$set = true;
      }
      if (!this.topK$set) {
        this.topK$value = 1;
        this.topK$set = true;
      }
      if (!this.topP$set) {
        this.topP$value = 0.5f;
        this.topP$set = true;
      }

      if (this.temperature$value < 0.0f || this.temperature$value > 3.0f) {
        throw new IllegalStateException(
            "temperature must be in range [0.0, 3.0], got: " + this.temperature$value);
      }

      if (this.topK$value < 0 || this.topK$value > 128) {
        throw new IllegalStateException(
            "topK must be in range [0, 128], got: " + this.topK$value);
      }

      if (this.topP$value < 0.0f || this.topP$value > 1.0f) {
        throw new IllegalStateException(
            "topP must be in range [0.0, 1.0], got: " + this.topP$value);
      }

      return new SamplerParams(this.temperature$value, this.topK$value, this.topP$value);
    }
  }
}
