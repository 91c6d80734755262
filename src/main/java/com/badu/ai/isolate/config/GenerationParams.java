package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable generation settings: token budget, reasoning mode and the system prompt.
 *
 * <p>Prompt presets:
 * <ul>
 *   <li>{@link #PROMPT_THINKING}: bare end-of-document marker, lets the model reason freely</li>
 *   <li>{@link #PROMPT_NO_THINKING_EN} / {@link #PROMPT_NO_THINKING_CN}: a primed assistant
 *       turn that answers directly</li>
 * </ul>
 *
 * <p>Thinking-token presets select how the chat template opens the reasoning block:
 * {@link #THINKING_TOKEN_NONE}, {@link #THINKING_TOKEN_LIGHT}, {@link #THINKING_TOKEN_FREE},
 * {@link #THINKING_TOKEN_ZH}.
 *
 * <p>Builder pattern usage:
 * <pre>{@code
 * GenerationParams params = GenerationParams.initial().toBuilder()
 *     .maxTokens(500)
 *     .chatReasoning(true)
 *     .thinkingToken(GenerationParams.THINKING_TOKEN_FREE)
 *     .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class GenerationParams {

  public static final String PROMPT_THINKING = "<EOD>";

  public static final String PROMPT_NO_THINKING_EN = "<EOD>User: hi\n\n"
      + "Assistant: Hi. I am your assistant and I will provide expert full response in full "
      + "details. Please feel free to ask any question and I will always answer it.\n\n";

  public static final String PROMPT_NO_THINKING_CN = "<EOD>User: 你好\n\n"
      + "Assistant: 你好，我是你的助手，我会提供专家级的完整回答。请随时提问，我会一直回答。\n\n";

  public static final String THINKING_TOKEN_NONE = "";
  public static final String THINKING_TOKEN_LIGHT = "<think>\\n</think>";
  public static final String THINKING_TOKEN_FREE = "<think>";
  public static final String THINKING_TOKEN_ZH = "<think>嗯";

  /**
   * Maximum tokens to generate.
   * Default: 2000
   */
  @Builder.Default
  int maxTokens = 2000;

  /**
   * Whether chat replies open a reasoning block.
   * Default: false
   */
  @Builder.Default
  boolean chatReasoning = false;

  /**
   * Token id that ends a completion (0 = end of document).
   * Default: 0
   */
  @Builder.Default
  int completionStopToken = 0;

  /**
   * Text that opens the reasoning block when {@link #chatReasoning} is on.
   * Default: {@link #THINKING_TOKEN_NONE}
   */
  @Builder.Default
  String thinkingToken = THINKING_TOKEN_NONE;

  /**
   * System prompt prepended to chat histories.
   * Default: {@link #PROMPT_THINKING}
   */
  @Builder.Default
  String prompt = PROMPT_THINKING;

  /**
   * Returns the generation settings the engine starts with.
   */
  public static GenerationParams initial() {
    return builder().build();
  }

  /**
   * Custom builder with validation logic.
   */
  public static class GenerationParamsBuilder {
    /**
     * Builds the GenerationParams with validation.
     *
     * @return validated GenerationParams instance
     * @throws IllegalStateException if validation fails
     */
    public GenerationParams build() {
      if (!this.maxTokens$set) {
        this.maxTokens$value = 2000;
        this.maxTokens$set = true;
      }
      if (!this.chatReasoning$set) {
        this.chatReasoning$value = false;
        this.chatReasoning$set = true;
      }
      if (!this.completionStopToken$set) {
        this.completionStopToken$value = 0;
        this.completionStopToken$set = true;
      }
      if (!this.thinkingToken$set) {
        this.thinkingToken$value = THINKING_TOKEN_NONE;
        this.thinkingToken$set = true;
      }
      if (!this.prompt$set) {
        this.prompt$value = PROMPT_THINKING;
        this.prompt$set = true;
      }

      if (this.maxTokens$value <= 0) {
        throw new IllegalStateException(
            "maxTokens must be positive, got: " + this.maxTokens$value);
      }

      if (this.completionStopToken$value < 0) {
        throw new IllegalStateException(
            "completionStopToken must be >= 0, got: " + this.completionStopToken$value);
      }

      if (this.thinkingToken$value == null) {
        throw new IllegalStateException("thinkingToken cannot be null (use THINKING_TOKEN_NONE)");
      }

      if (this.prompt$value == null) {
        throw new IllegalStateException("prompt cannot be null");
      }

      return new GenerationParams(this.maxTokens$value, this.chatReasoning$value,
          this.completionStopToken$value, this.thinkingToken$value, this.prompt$value);
    }
  }

  /**
   * Checks if chat replies start with a non-empty reasoning block.
   *
   * @return true if reasoning is on and a thinking token is set
   */
  public boolean opensReasoningBlock() {
    return chatReasoning && !thinkingToken.isEmpty();
  }
}
