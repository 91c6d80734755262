package com.badu.ai.isolate.worker;

import com.badu.ai.isolate.InferenceService;
import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.transport.ReceivePort;
import com.badu.ai.isolate.transport.SendPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.function.Supplier;

/**
 * Worker endpoint: owns the real service on its own event loop and answers request envelopes.
 *
 * <p>The worker has a single state, listening. For every incoming envelope, on the worker loop:
 * <ol>
 *   <li>Bootstrap: remember the proxy's port and reply with the worker's own port</li>
 *   <li>Cancellation: cancel the named in-flight call (no registry lookup)</li>
 *   <li>Unknown method: reply with an error, the service is not called</li>
 *   <li>Otherwise invoke the handler and answer according to the result shape:
 *     <ul>
 *       <li>immediate value: one reply</li>
 *       <li>completion stage: one reply when it settles, value or error</li>
 *       <li>publisher: one reply per element, then {@code done} or {@code error}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>Dispatch never waits for a previous call: settlements and stream elements come back to the
 * loop as fresh events, so calls complete independently and in any order relative to each
 * other. Every reply for a given call is sent from the loop thread, which keeps the replies of
 * one correlation id in order. A handler that throws produces an error reply; the loop keeps
 * listening.
 *
 * <p>Usage example (what {@link com.badu.ai.isolate.proxy.ServiceHandle} does):
 * <pre>{@code
 * ReceivePort proxyPort = new ReceivePort("inference-proxy");
 * InferenceWorker worker = InferenceWorker.spawn(
 *     Envelope.bootstrap(proxyPort.sendPort()), MyEngine::new, "inference-worker");
 * }</pre>
 */
public final class InferenceWorker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InferenceWorker.class);

    static final String CANCELLED_DESCRIPTION = "Call cancelled";

    private final ReceivePort receivePort;

    // Loop-confined
    private MethodRegistry registry;
    private SendPort replyPort;
    private final Map<Long, InFlightCall> inFlight = new HashMap<>();

    private InferenceWorker(String name) {
        this.receivePort = new ReceivePort(name);
    }

    /**
     * Spawns a worker owning the service created by {@code serviceFactory}.
     *
     * <p>The factory runs on the worker thread. If it throws, the worker answers the bootstrap
     * with an error reply and shuts down.
     *
     * @param bootstrap bootstrap envelope carrying the proxy's send port
     * @param serviceFactory creates the real service
     * @param name worker thread name
     * @return the running worker
     */
    public static InferenceWorker spawn(Envelope bootstrap,
                                        Supplier<? extends InferenceService> serviceFactory,
                                        String name) {
        if (serviceFactory == null) {
            throw new IllegalArgumentException("Service factory cannot be null");
        }
        return spawnWithRegistry(bootstrap, () -> ServiceBindings.registryFor(serviceFactory.get()), name);
    }

    /**
     * Spawns a worker dispatching to a registry created on the worker thread.
     *
     * @param bootstrap bootstrap envelope carrying the proxy's send port
     * @param registryFactory creates the method registry
     * @param name worker thread name
     * @return the running worker
     */
    public static InferenceWorker spawnWithRegistry(Envelope bootstrap,
                                                    Supplier<MethodRegistry> registryFactory,
                                                    String name) {
        if (bootstrap == null || !bootstrap.isBootstrap() || !(bootstrap.payload() instanceof SendPort)) {
            throw new IllegalArgumentException("Worker must be spawned with a bootstrap envelope carrying a SendPort");
        }
        if (registryFactory == null) {
            throw new IllegalArgumentException("Registry factory cannot be null");
        }

        InferenceWorker worker = new InferenceWorker(name);
        worker.receivePort.execute(() -> worker.start(bootstrap, registryFactory));
        return worker;
    }

    private void start(Envelope bootstrap, Supplier<MethodRegistry> registryFactory) {
        SendPort proxyPort = (SendPort) bootstrap.payload();
        try {
            registry = registryFactory.get();
        } catch (Throwable e) {
            logger.error("Worker {} failed to start", receivePort.getName(), e);
            proxyPort.send(bootstrap.withError("Worker spawn failed: " + describe(e)));
            receivePort.close();
            return;
        }

        logger.info("Worker {} started with {} registered methods", receivePort.getName(), registry.size());
        handshake(bootstrap);
        receivePort.listen(this::onEnvelope);
    }

    private void onEnvelope(Envelope message) {
        if (message.isBootstrap()) {
            handshake(message);
            return;
        }

        if (message.isCancellation()) {
            cancel(message.correlationId());
            return;
        }

        MethodHandler handler = registry.find(message.method()).orElse(null);
        if (handler == null) {
            logger.warn("Unknown method {} (correlation id {})", message.method(), message.correlationId());
            reply(message.withError("Unknown method: " + message.method()));
            return;
        }

        logger.trace("Dispatching {} (correlation id {})", message.method(), message.correlationId());
        try {
            Object result = handler.invoke(message.payload());
            if (result instanceof CompletionStage) {
                awaitSettlement(message, (CompletionStage<?>) result);
            } else if (result instanceof Flow.Publisher) {
                forwardStream(message, (Flow.Publisher<?>) result);
            } else {
                reply(message.withPayload(result));
            }
        } catch (Throwable e) {
            // Errors included, e.g. UnsatisfiedLinkError from a native engine
            logger.error("Method {} failed (correlation id {})", message.method(), message.correlationId(), e);
            inFlight.remove(message.correlationId());
            reply(message.withError(describe(e)));
        }
    }

    private void handshake(Envelope bootstrap) {
        if (!(bootstrap.payload() instanceof SendPort)) {
            logger.warn("Ignoring bootstrap envelope without a SendPort: {}", bootstrap);
            return;
        }
        SendPort proxyPort = (SendPort) bootstrap.payload();
        if (replyPort != null && replyPort != proxyPort) {
            logger.info("Worker {} re-bound to a new proxy port", receivePort.getName());
        }
        replyPort = proxyPort;
        replyPort.send(bootstrap.withPayload(receivePort.sendPort()));
        logger.debug("Worker {} completed bootstrap handshake", receivePort.getName());
    }

    private void awaitSettlement(Envelope request, CompletionStage<?> stage) {
        CompletableFuture<?> future = stage.toCompletableFuture();
        long id = request.correlationId();
        inFlight.put(id, new InFlightCall(request, () -> future.cancel(true)));

        future.whenComplete((value, failure) -> receivePort.execute(() -> {
            inFlight.remove(id);
            if (failure == null) {
                reply(request.withPayload(value));
            } else if (unwrap(failure) instanceof CancellationException) {
                reply(request.withError(CANCELLED_DESCRIPTION));
            } else {
                logger.error("Method {} failed (correlation id {})", request.method(), id, unwrap(failure));
                reply(request.withError(describe(failure)));
            }
        }));
    }

    private void forwardStream(Envelope request, Flow.Publisher<?> publisher) {
        StreamForwarder forwarder = new StreamForwarder(request);
        inFlight.put(request.correlationId(), new InFlightCall(request, forwarder::cancel));
        try {
            publisher.subscribe(forwarder);
        } catch (Throwable e) {
            forwarder.terminated = true;
            throw e;
        }
    }

    private void cancel(long correlationId) {
        InFlightCall call = inFlight.remove(correlationId);
        if (call == null) {
            logger.debug("Ignoring cancellation of unknown or finished call {}", correlationId);
            return;
        }
        logger.debug("Cancelling {} (correlation id {})", call.request().method(), correlationId);
        call.canceller().run();
    }

    private void reply(Envelope envelope) {
        replyPort.send(envelope);
    }

    /**
     * Number of calls still waiting for their terminal reply. Only valid on the worker loop.
     */
    int inFlightCount() {
        return inFlight.size();
    }

    ReceivePort receivePort() {
        return receivePort;
    }

    /**
     * Flattens a failure to the single description string carried by error replies.
     *
     * @param failure failure, possibly wrapped in a CompletionException or ExecutionException
     * @return "SimpleClassName: message" of the underlying failure
     */
    static String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName()
            : cause.getClass().getSimpleName() + ": " + message;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Stops the worker loop. Replies still queued are discarded and running streams are
     * cancelled. Idempotent.
     */
    @Override
    public void close() {
        receivePort.execute(() -> {
            for (InFlightCall call : inFlight.values()) {
                call.canceller().run();
            }
            inFlight.clear();
            receivePort.close();
        });
        logger.info("Worker {} closing", receivePort.getName());
    }

    private record InFlightCall(Envelope request, Runnable canceller) {
    }

    /**
     * Forwards the elements of a result publisher as reply envelopes. Every signal hops to the
     * worker loop before anything is sent.
     */
    private final class StreamForwarder implements Flow.Subscriber<Object> {

        private final Envelope request;
        private Flow.Subscription subscription;
        private boolean terminated;

        private StreamForwarder(Envelope request) {
            this.request = request;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            receivePort.execute(() -> {
                if (terminated) {
                    subscription.cancel();
                    return;
                }
                this.subscription = subscription;
            });
            // No backpressure towards the engine: the proxy buffers for its consumer.
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(Object item) {
            receivePort.execute(() -> {
                if (!terminated) {
                    reply(request.withPayload(item));
                }
            });
        }

        @Override
        public void onError(Throwable throwable) {
            receivePort.execute(() -> {
                if (terminated) {
                    return;
                }
                terminated = true;
                inFlight.remove(request.correlationId());
                logger.error("Stream {} failed (correlation id {})", request.method(), request.correlationId(), throwable);
                reply(request.withError(describe(throwable)));
            });
        }

        @Override
        public void onComplete() {
            receivePort.execute(() -> {
                if (terminated) {
                    return;
                }
                terminated = true;
                inFlight.remove(request.correlationId());
                logger.debug("Stream {} completed (correlation id {})", request.method(), request.correlationId());
                reply(request.completed());
            });
        }

        private void cancel() {
            if (terminated) {
                return;
            }
            terminated = true;
            if (subscription != null) {
                subscription.cancel();
            }
            reply(request.withError(CANCELLED_DESCRIPTION));
        }
    }
}
