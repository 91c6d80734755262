package com.badu.ai.isolate.protocol;

import com.badu.ai.isolate.config.GenerationParams;
import com.badu.ai.isolate.config.InitOptions;
import com.badu.ai.isolate.config.PenaltyParams;
import com.badu.ai.isolate.config.RuntimeOptions;
import com.badu.ai.isolate.config.SamplerParams;
import com.badu.ai.isolate.config.SimilarityParams;
import com.badu.ai.isolate.metrics.GenerationState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of operations in the inference service contract.
 *
 * <p>This is the one definition both endpoints agree on: the proxy encodes requests with
 * {@link #identifier()} and the worker builds its method registry from the same constants, so
 * a renamed or missing operation shows up as a registry coverage failure in tests rather than
 * as a runtime lookup miss.
 *
 * <p>Each constant is typed by its argument {@code A} and result {@code R}. The proxy API is
 * written against these types; the single cast from the untyped envelope payload happens in
 * {@link #castResult(Object)}. Operations without an argument or result use {@link Void}.
 *
 * <p>Usage example:
 * <pre>{@code
 * CompletableFuture<List<Double>> vector = handle.call(Operation.EMBED, "hello");
 * Flow.Publisher<String> tokens = handle.stream(Operation.COMPLETION, "hi");
 * }</pre>
 *
 * @param <A> argument type
 * @param <R> result type (element type for streaming operations)
 */
public final class Operation<A, R> {

  public static final Operation<InitOptions, Void> INIT =
      single("init", InitOptions.class, Void.class);

  public static final Operation<RuntimeOptions, Void> INIT_RUNTIME =
      single("initRuntime", RuntimeOptions.class, Void.class);

  public static final Operation<String, Void> LOAD_EMBEDDING =
      single("loadEmbedding", String.class, Void.class);

  public static final Operation<String, List<Double>> EMBED =
      single("embed", String.class, List.class);

  public static final Operation<SimilarityParams, Double> SIMILARITY =
      single("similarity", SimilarityParams.class, Double.class);

  public static final Operation<String, String> COMPLETION =
      streaming("completion", String.class, String.class);

  public static final Operation<List<String>, String> CHAT =
      streaming("chat", List.class, String.class);

  public static final Operation<SamplerParams, Void> SET_SAMPLER_PARAMS =
      single("setSamplerParams", SamplerParams.class, Void.class);

  public static final Operation<PenaltyParams, Void> SET_PENALTY_PARAMS =
      single("setPenaltyParams", PenaltyParams.class, Void.class);

  public static final Operation<GenerationParams, Void> SET_GENERATION_PARAMS =
      single("setGenerationParams", GenerationParams.class, Void.class);

  public static final Operation<Void, GenerationState> GET_GENERATION_STATE =
      single("getGenerationState", Void.class, GenerationState.class);

  public static final Operation<String, Void> SET_IMAGE =
      single("setImage", String.class, Void.class);

  public static final Operation<String, Void> SET_AUDIO =
      single("setAudio", String.class, Void.class);

  public static final Operation<Void, Void> CLEAR_STATE =
      single("clearState", Void.class, Void.class);

  public static final Operation<Void, Void> STOP =
      single("stop", Void.class, Void.class);

  private static final List<Operation<?, ?>> VALUES = List.of(
      INIT, INIT_RUNTIME, LOAD_EMBEDDING, EMBED, SIMILARITY, COMPLETION, CHAT,
      SET_SAMPLER_PARAMS, SET_PENALTY_PARAMS, SET_GENERATION_PARAMS, GET_GENERATION_STATE,
      SET_IMAGE, SET_AUDIO, CLEAR_STATE, STOP);

  private static final Map<String, Operation<?, ?>> BY_IDENTIFIER = indexByIdentifier();

  private final String identifier;
  private final CallKind kind;
  private final Class<?> argumentType;
  private final Class<?> resultType;

  private Operation(String identifier, CallKind kind, Class<?> argumentType, Class<?> resultType) {
    this.identifier = identifier;
    this.kind = kind;
    this.argumentType = argumentType;
    this.resultType = resultType;
  }

  private static <A, R> Operation<A, R> single(String identifier, Class<?> argumentType,
                                               Class<?> resultType) {
    return new Operation<>(identifier, CallKind.SINGLE, argumentType, resultType);
  }

  private static <A, R> Operation<A, R> streaming(String identifier, Class<?> argumentType,
                                                  Class<?> resultType) {
    return new Operation<>(identifier, CallKind.STREAMING, argumentType, resultType);
  }

  private static Map<String, Operation<?, ?>> indexByIdentifier() {
    Map<String, Operation<?, ?>> index = new LinkedHashMap<>();
    for (Operation<?, ?> operation : VALUES) {
      if (index.put(operation.identifier, operation) != null) {
        throw new ExceptionInInitializerError("Duplicate operation identifier: " + operation.identifier);
      }
    }
    return Map.copyOf(index);
  }

  /**
   * Returns every operation of the contract, in declaration order.
   */
  public static List<Operation<?, ?>> values() {
    return VALUES;
  }

  /**
   * Looks up an operation by its wire identifier.
   *
   * @param identifier wire identifier, e.g. {@code "embed"}
   * @return the operation, or empty if the contract has no such operation
   */
  public static Optional<Operation<?, ?>> forIdentifier(String identifier) {
    return Optional.ofNullable(BY_IDENTIFIER.get(identifier));
  }

  /**
   * Stable wire identifier used as {@link Envelope#method()}.
   */
  public String identifier() {
    return identifier;
  }

  public CallKind kind() {
    return kind;
  }

  public boolean isStreaming() {
    return kind == CallKind.STREAMING;
  }

  public Class<?> argumentType() {
    return argumentType;
  }

  public Class<?> resultType() {
    return resultType;
  }

  /**
   * Checks whether a request payload is a valid argument for this operation.
   * An absent payload is always accepted; it means "call without argument".
   */
  public boolean acceptsArgument(Object payload) {
    return payload == null || argumentType.isInstance(payload);
  }

  /**
   * Converts a reply payload into this operation's result type.
   *
   * @param payload reply payload, may be null
   * @return typed result
   * @throws ClassCastException if the payload does not match the declared result type
   */
  @SuppressWarnings("unchecked")
  public R castResult(Object payload) {
    return (R) resultType.cast(payload);
  }

  @Override
  public String toString() {
    return identifier + "(" + kind + ")";
  }
}
