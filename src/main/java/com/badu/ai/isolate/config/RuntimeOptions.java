package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link com.badu.ai.isolate.InferenceService#initRuntime(RuntimeOptions)}: which
 * model and tokenizer to load, and on which backend.
 *
 * <p>Builder pattern usage:
 * <pre>{@code
 * RuntimeOptions options = RuntimeOptions.builder()
 *     .modelPath("models/rwkv7-g1-0.4b.gguf")
 *     .tokenizerPath("models/rwkv_vocab_v20230424.txt")
 *     .backend("llama.cpp")
 *     .build();
 * }</pre>
 */
@Value
@Builder
public class RuntimeOptions {

  /** Path to the model file. */
  String modelPath;

  /** Path to the tokenizer vocabulary file. */
  String tokenizerPath;

  /** Backend to load the model with. */
  Backend backend;

  /**
   * Custom builder with validation logic.
   */
  public static class RuntimeOptionsBuilder {

    /**
     * Sets the backend from a free-form name.
     *
     * @param name backend name, parsed with {@link Backend#fromString(String)}
     * @return this builder
     */
    public RuntimeOptionsBuilder backend(String name) {
      return backend(Backend.fromString(name));
    }

    /**
     * Sets the backend.
     *
     * @param backend backend
     * @return this builder
     */
    public RuntimeOptionsBuilder backend(Backend backend) {
      this.backend = backend;
      return this;
    }

    /**
     * Builds the RuntimeOptions with validation.
     *
     * @return validated RuntimeOptions instance
     * @throws IllegalStateException if validation fails
     */
    public RuntimeOptions build() {
      if (modelPath == null || modelPath.trim().isEmpty()) {
        throw new IllegalStateException("modelPath cannot be null or empty");
      }
      if (tokenizerPath == null || tokenizerPath.trim().isEmpty()) {
        throw new IllegalStateException("tokenizerPath cannot be null or empty");
      }
      if (backend == null) {
        throw new IllegalStateException("backend cannot be null");
      }
      return new RuntimeOptions(modelPath, tokenizerPath, backend);
    }
  }
}
