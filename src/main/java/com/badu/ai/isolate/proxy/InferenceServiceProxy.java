package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.InferenceService;
import com.badu.ai.isolate.config.BridgeConfig;
import com.badu.ai.isolate.config.GenerationParams;
import com.badu.ai.isolate.config.InitOptions;
import com.badu.ai.isolate.config.PenaltyParams;
import com.badu.ai.isolate.config.RuntimeOptions;
import com.badu.ai.isolate.config.SamplerParams;
import com.badu.ai.isolate.config.SimilarityParams;
import com.badu.ai.isolate.metrics.GenerationState;
import com.badu.ai.isolate.protocol.Operation;
import com.badu.ai.isolate.streaming.TokenStreams;
import com.badu.ai.isolate.worker.InferenceWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Supplier;

/**
 * {@link InferenceService} that runs the real service on a dedicated worker thread.
 *
 * <p>{@link #init(InitOptions)} starts the worker and performs the handshake before forwarding
 * the init call itself. Calling it again reuses the existing connection; after a failed
 * handshake the next {@code init} starts a fresh worker. Every other method requires a
 * successful {@code init} and fails with {@link IllegalStateException} before it.
 *
 * <p>Closing the proxy stops the worker. Calls still waiting, and every call made afterwards,
 * fail with {@link InferenceException.ErrorType#TRANSPORT}.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (InferenceServiceProxy service = new InferenceServiceProxy(MyEngine::new, BridgeConfig.DEFAULT)) {
 *     service.init(InitOptions.DEFAULT).join();
 *     List<Double> vector = service.embed("hello").join();
 * }
 * }</pre>
 *
 * @see com.badu.ai.isolate.InferenceServiceFactory
 */
public class InferenceServiceProxy implements InferenceService, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InferenceServiceProxy.class);

    private final WorkerLauncher launcher;
    private final BridgeConfig config;
    private final Object lock = new Object();

    // Guarded by lock
    private CompletableFuture<ServiceHandle> connection;
    private boolean closed;

    /**
     * Creates a proxy whose worker owns the service built by {@code serviceFactory}. The
     * factory runs on the worker thread during {@link #init(InitOptions)}.
     *
     * @param serviceFactory creates the real service
     * @param config bridge configuration
     */
    public InferenceServiceProxy(Supplier<? extends InferenceService> serviceFactory, BridgeConfig config) {
        this(launcherFor(serviceFactory, config), config);
    }

    /**
     * Creates a proxy with a custom worker launcher.
     *
     * @param launcher starts the worker with the bootstrap envelope
     * @param config bridge configuration
     */
    public InferenceServiceProxy(WorkerLauncher launcher, BridgeConfig config) {
        if (launcher == null) {
            throw new IllegalArgumentException("Worker launcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("BridgeConfig cannot be null");
        }
        this.launcher = launcher;
        this.config = config;
    }

    private static WorkerLauncher launcherFor(Supplier<? extends InferenceService> serviceFactory,
                                              BridgeConfig config) {
        if (serviceFactory == null) {
            throw new IllegalArgumentException("Service factory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("BridgeConfig cannot be null");
        }
        return bootstrap -> InferenceWorker.spawn(bootstrap, serviceFactory, config.getWorkerName());
    }

    /**
     * Gets the bridge configuration this proxy connects with.
     *
     * @return bridge configuration
     */
    public BridgeConfig getConfig() {
        return config;
    }

    /**
     * Connects to the worker, starting it on first use.
     *
     * @return future of the connected handle
     */
    public CompletableFuture<ServiceHandle> connect() {
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.failedFuture(InferenceException.closed(Operation.INIT.identifier(), null));
            }
            if (connection == null || connection.isCompletedExceptionally()) {
                logger.info("Starting worker {}", config.getWorkerName());
                connection = ServiceHandle.open(launcher, config);
            } else {
                logger.debug("Reusing connection to worker {}", config.getWorkerName());
            }
            return connection;
        }
    }

    @Override
    public CompletableFuture<Void> init(InitOptions options) {
        InitOptions effective = options == null ? InitOptions.DEFAULT : options;
        return connect().thenCompose(handle -> handle.call(Operation.INIT, effective));
    }

    @Override
    public CompletableFuture<Void> initRuntime(RuntimeOptions options) {
        return call(Operation.INIT_RUNTIME, options);
    }

    @Override
    public CompletableFuture<Void> loadEmbedding(String path) {
        return call(Operation.LOAD_EMBEDDING, path);
    }

    @Override
    public CompletableFuture<List<Double>> embed(String text) {
        return call(Operation.EMBED, text);
    }

    @Override
    public CompletableFuture<Double> similarity(SimilarityParams params) {
        return call(Operation.SIMILARITY, params);
    }

    @Override
    public CompletableFuture<Void> setSamplerParams(SamplerParams params) {
        return call(Operation.SET_SAMPLER_PARAMS, params);
    }

    @Override
    public CompletableFuture<Void> setPenaltyParams(PenaltyParams params) {
        return call(Operation.SET_PENALTY_PARAMS, params);
    }

    @Override
    public CompletableFuture<Void> setGenerationParams(GenerationParams params) {
        return call(Operation.SET_GENERATION_PARAMS, params);
    }

    @Override
    public Flow.Publisher<String> completion(String prompt) {
        return stream(Operation.COMPLETION, prompt);
    }

    @Override
    public Flow.Publisher<String> chat(List<String> history) {
        if (history == null) {
            throw new IllegalArgumentException("Chat history cannot be null");
        }
        return stream(Operation.CHAT, List.copyOf(history));
    }

    @Override
    public CompletableFuture<GenerationState> getGenerationState() {
        return call(Operation.GET_GENERATION_STATE, null);
    }

    @Override
    public CompletableFuture<Void> setImage(String path) {
        return call(Operation.SET_IMAGE, path);
    }

    @Override
    public CompletableFuture<Void> setAudio(String path) {
        return call(Operation.SET_AUDIO, path);
    }

    @Override
    public CompletableFuture<Void> clearState() {
        return call(Operation.CLEAR_STATE, null);
    }

    @Override
    public CompletableFuture<Void> stop() {
        return call(Operation.STOP, null);
    }

    private <A, R> CompletableFuture<R> call(Operation<A, R> operation, A argument) {
        CompletableFuture<ServiceHandle> current;
        try {
            current = requireConnection(operation);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (current.isDone() && !current.isCompletedExceptionally()) {
            return current.join().call(operation, argument);
        }
        return current.thenCompose(handle -> handle.call(operation, argument));
    }

    private <A, R> Flow.Publisher<R> stream(Operation<A, R> operation, A argument) {
        CompletableFuture<ServiceHandle> current;
        try {
            current = requireConnection(operation);
        } catch (RuntimeException e) {
            return TokenStreams.failed(e);
        }
        if (!current.isDone() || current.isCompletedExceptionally()) {
            return TokenStreams.failed(new IllegalStateException(
                "init() must complete before " + operation.identifier() + " is called"));
        }
        return current.join().stream(operation, argument);
    }

    private CompletableFuture<ServiceHandle> requireConnection(Operation<?, ?> operation) {
        synchronized (lock) {
            if (closed) {
                throw InferenceException.closed(operation.identifier(), null);
            }
            if (connection == null || connection.isCompletedExceptionally()) {
                throw new IllegalStateException(
                    "init() must be called before " + operation.identifier());
            }
            return connection;
        }
    }

    /**
     * Stops the worker and fails every call still waiting. Idempotent.
     */
    @Override
    public void close() {
        CompletableFuture<ServiceHandle> current;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            current = connection;
        }
        if (current != null) {
            // Aborts a handshake still in progress, no-op once connected
            current.completeExceptionally(InferenceException.closed(Operation.INIT.identifier(), null));
            current.thenAccept(ServiceHandle::close);
        }
        logger.info("Inference service proxy closed");
    }
}
