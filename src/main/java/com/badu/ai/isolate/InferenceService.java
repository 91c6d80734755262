package com.badu.ai.isolate;

import com.badu.ai.isolate.config.GenerationParams;
import com.badu.ai.isolate.config.InitOptions;
import com.badu.ai.isolate.config.PenaltyParams;
import com.badu.ai.isolate.config.RuntimeOptions;
import com.badu.ai.isolate.config.SamplerParams;
import com.badu.ai.isolate.config.SimilarityParams;
import com.badu.ai.isolate.metrics.GenerationState;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * Contract of an inference engine: model loading, embeddings, similarity scoring and
 * token-streaming text generation.
 *
 * <p>The same interface is implemented by the engine itself and by
 * {@link com.badu.ai.isolate.proxy.InferenceServiceProxy}, which runs an engine on a dedicated
 * worker thread. Call sites cannot tell the two apart:
 * <pre>{@code
 * InferenceService service = InferenceServiceFactory.isolated(MyEngine::new);
 * service.init(InitOptions.DEFAULT).join();
 * service.initRuntime(RuntimeOptions.builder()
 *     .modelPath("models/rwkv7-g1-0.4b.gguf")
 *     .tokenizerPath("models/rwkv_vocab_v20230424.txt")
 *     .backend(Backend.LLAMA_CPP)
 *     .build()).join();
 *
 * for (String fragment : TokenStreams.iterable(service.completion("Once upon a time"))) {
 *     System.out.print(fragment);
 * }
 * }</pre>
 *
 * <p>Single-result operations return a {@link CompletableFuture}. Generation operations return
 * a {@link Flow.Publisher} of text fragments; each returned publisher is one generation and may
 * be subscribed once.
 *
 * <p>Thread Safety: implementations used behind the proxy are only ever called from the worker
 * thread, so the engine itself does not need to be thread-safe. The proxy is thread-safe.
 */
public interface InferenceService {

    /**
     * Initializes the engine's native library. Must be called before any other method.
     *
     * <p>On the proxy this also starts the worker and performs the bootstrap handshake.
     *
     * @param options library directory and log level
     * @return future completing when the engine is ready for {@link #initRuntime}
     */
    CompletableFuture<Void> init(InitOptions options);

    /**
     * Initializes the backend runtime and loads the model and tokenizer.
     *
     * @param options model path, tokenizer path and backend
     * @return future completing when the model is loaded
     */
    CompletableFuture<Void> initRuntime(RuntimeOptions options);

    /**
     * Loads an embedding model.
     *
     * @param path path to the embedding model file
     * @return future completing when the embedding model is loaded
     */
    CompletableFuture<Void> loadEmbedding(String path);

    /**
     * Computes the embedding vector of a text.
     *
     * @param text input text
     * @return future of the embedding vector
     */
    CompletableFuture<List<Double>> embed(String text);

    /**
     * Scores the similarity of two embedding vectors.
     *
     * @param params the two vectors
     * @return future of the similarity score
     */
    CompletableFuture<Double> similarity(SimilarityParams params);

    CompletableFuture<Void> setSamplerParams(SamplerParams params);

    CompletableFuture<Void> setPenaltyParams(PenaltyParams params);

    CompletableFuture<Void> setGenerationParams(GenerationParams params);

    /**
     * Generates a continuation of a raw prompt.
     *
     * @param prompt prompt text
     * @return publisher of generated text fragments
     */
    Flow.Publisher<String> completion(String prompt);

    /**
     * Generates the next assistant turn of a conversation.
     *
     * @param history alternating user and assistant messages, oldest first
     * @return publisher of generated text fragments
     */
    Flow.Publisher<String> chat(List<String> history);

    /**
     * Returns a snapshot of the current generation progress.
     */
    CompletableFuture<GenerationState> getGenerationState();

    CompletableFuture<Void> setImage(String path);

    CompletableFuture<Void> setAudio(String path);

    /**
     * Clears the backend runtime state (conversation cache).
     */
    CompletableFuture<Void> clearState();

    /**
     * Asks a running generation to stop.
     */
    CompletableFuture<Void> stop();
}
