package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.config.BridgeConfig;
import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.CorrelationIdGenerator;
import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.protocol.Operation;
import com.badu.ai.isolate.transport.ReceivePort;
import com.badu.ai.isolate.transport.SendPort;
import com.badu.ai.isolate.worker.InferenceWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Flow;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Proxy side of an established connection to one worker.
 *
 * <p>A handle is obtained through {@link #open(WorkerLauncher, BridgeConfig)}, which starts the
 * worker, performs the bootstrap handshake and completes once the worker's send port is known.
 * After that the handle issues calls:
 * <ul>
 *   <li>{@link #call(Operation, Object)}: single-result call, settled by the first reply</li>
 *   <li>{@link #stream(Operation, Object)}: streaming call, one element per reply until
 *       {@code done} or {@code error}</li>
 * </ul>
 *
 * <p>Every call gets a fresh correlation id and a route in the correlation table. Replies are
 * delivered on the proxy loop and looked up by correlation id; a reply nobody waits for is
 * dropped. At most {@link BridgeConfig#getMaxInFlightCalls()} calls may wait for their terminal
 * reply at the same time, further calls fail with
 * {@link InferenceException.ErrorType#OVERLOADED}.
 *
 * <p>Cancelling a returned future, or the subscription of a returned publisher, sends a
 * cancellation control message to the worker and frees the route.
 *
 * <p>Usage example:
 * <pre>{@code
 * ServiceHandle handle = ServiceHandle.open(
 *     bootstrap -> InferenceWorker.spawn(bootstrap, MyEngine::new, "inference-worker"),
 *     BridgeConfig.DEFAULT).join();
 * List<Double> vector = handle.call(Operation.EMBED, "hello").join();
 * handle.close();
 * }</pre>
 */
public final class ServiceHandle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServiceHandle.class);

    private final BridgeConfig config;
    private final ReceivePort receivePort;
    private final CorrelationIdGenerator correlationIds = new CorrelationIdGenerator();
    private final Map<Long, ReplyRoute> routes = new ConcurrentHashMap<>();
    private final Semaphore admission;
    private final CompletableFuture<SendPort> handshake = new CompletableFuture<>();

    private volatile SendPort workerPort;
    private volatile InferenceWorker worker;
    private volatile boolean closed;

    private ServiceHandle(BridgeConfig config) {
        this.config = config;
        this.receivePort = new ReceivePort(config.getProxyName());
        this.admission = new Semaphore(config.getMaxInFlightCalls());
    }

    /**
     * Starts a worker and completes when the bootstrap handshake has finished.
     *
     * <p>The returned future fails with {@link InferenceException.ErrorType#HANDSHAKE} if the
     * launcher throws, the worker answers the bootstrap with an error, or no answer arrives
     * within {@link BridgeConfig#getHandshakeTimeout()}. In all those cases the ports are closed.
     * Completing the returned future exceptionally before the handshake finishes closes the
     * handle and stops the worker.
     *
     * @param launcher starts the worker with the bootstrap envelope
     * @param config bridge configuration
     * @return future of the connected handle
     */
    public static CompletableFuture<ServiceHandle> open(WorkerLauncher launcher, BridgeConfig config) {
        if (launcher == null) {
            throw new IllegalArgumentException("Worker launcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("BridgeConfig cannot be null");
        }
        return new ServiceHandle(config).connect(launcher);
    }

    private CompletableFuture<ServiceHandle> connect(WorkerLauncher launcher) {
        receivePort.listen(this::onEnvelope);

        try {
            worker = launcher.launch(Envelope.bootstrap(receivePort.sendPort()));
        } catch (RuntimeException e) {
            logger.error("Failed to launch worker for {}", receivePort.getName(), e);
            close();
            return CompletableFuture.failedFuture(new InferenceException(
                "Worker launch failed: " + e.getMessage(), InferenceException.ErrorType.HANDSHAKE,
                "Check the service factory passed to the proxy.", e));
        }

        Duration timeout = config.getHandshakeTimeout();
        CompletableFuture<ServiceHandle> connected = handshake
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((port, failure) -> {
                if (failure == null) {
                    workerPort = port;
                    logger.info("Connected {} to worker (handshake timeout {}ms, max in-flight calls {})",
                        receivePort.getName(), timeout.toMillis(), config.getMaxInFlightCalls());
                    return this;
                }

                close();
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
                if (cause instanceof TimeoutException) {
                    logger.error("Handshake with worker timed out after {}ms", timeout.toMillis());
                    throw InferenceException.handshakeTimeout(timeout);
                }
                if (cause instanceof InferenceException) {
                    throw (InferenceException) cause;
                }
                throw new InferenceException("Handshake failed: " + cause.getMessage(),
                    InferenceException.ErrorType.HANDSHAKE, null, cause);
            });
        // Completing it early from outside aborts the handshake
        connected.whenComplete((handle, failure) -> {
            if (failure != null) {
                close();
            }
        });
        return connected;
    }

    private void onEnvelope(Envelope envelope) {
        if (envelope.isBootstrap()) {
            onBootstrapReply(envelope);
            return;
        }

        long id = envelope.correlationId();
        ReplyRoute route = routes.get(id);
        if (route == null) {
            logger.debug("Dropping reply without a waiting call: {}", envelope);
            return;
        }

        if (route.kind() == CallKind.SINGLE || envelope.isTerminal()) {
            release(id);
        }
        route.onReply(envelope);
    }

    private void onBootstrapReply(Envelope reply) {
        if (reply.hasError()) {
            logger.error("Worker rejected bootstrap: {}", reply.error());
            handshake.completeExceptionally(new InferenceException(reply.error(),
                InferenceException.ErrorType.HANDSHAKE,
                "Check the worker log for the failure of the service factory.", null));
        } else if (reply.payload() instanceof SendPort) {
            if (!handshake.complete((SendPort) reply.payload())) {
                logger.debug("Ignoring repeated bootstrap reply");
            }
        } else {
            logger.warn("Ignoring bootstrap reply without a SendPort: {}", reply);
        }
    }

    /**
     * Issues a single-result call.
     *
     * @param operation single-result operation
     * @param argument request payload
     * @return future of the decoded result
     * @throws IllegalArgumentException if the operation is a streaming one
     */
    public <A, R> CompletableFuture<R> call(Operation<A, R> operation, A argument) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }
        if (operation.isStreaming()) {
            throw new IllegalArgumentException("Operation " + operation.identifier()
                + " is streaming, use stream() instead");
        }
        return request(operation.identifier(), argument, operation::castResult);
    }

    /**
     * Issues a single-result call by wire identifier, without payload or result typing.
     *
     * <p>Useful for identifiers the worker may not know: the returned future then fails with
     * the worker's "Unknown method" description.
     */
    public CompletableFuture<Object> request(String method, Object payload) {
        if (method == null || method.isEmpty() || method.startsWith("$")) {
            throw new IllegalArgumentException("Invalid method identifier: " + method);
        }
        return request(method, payload, Function.identity());
    }

    private <R> CompletableFuture<R> request(String method, Object payload, Function<Object, R> decoder) {
        if (closed) {
            return CompletableFuture.failedFuture(InferenceException.closed(method, null));
        }
        if (!admission.tryAcquire()) {
            logger.warn("Rejecting {}: {} calls already in flight", method, config.getMaxInFlightCalls());
            return CompletableFuture.failedFuture(
                InferenceException.overloaded(method, config.getMaxInFlightCalls()));
        }

        long id = correlationIds.next();
        CompletableFuture<R> result = new CompletableFuture<>();
        routes.put(id, new SingleReplyRoute<>(method, result, decoder));
        if (closed) {
            release(id);
            result.completeExceptionally(InferenceException.closed(method, id));
            return result;
        }

        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                cancelRemote(id);
            }
        });
        workerPort.send(Envelope.request(id, method, payload));
        return result;
    }

    /**
     * Issues a streaming call.
     *
     * <p>The call is lazy: nothing is sent until the returned publisher is subscribed. The
     * publisher accepts a single subscriber.
     *
     * @param operation streaming operation
     * @param argument request payload
     * @return publisher of the decoded elements
     * @throws IllegalArgumentException if the operation is a single-result one
     */
    public <A, R> Flow.Publisher<R> stream(Operation<A, R> operation, A argument) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }
        if (!operation.isStreaming()) {
            throw new IllegalArgumentException("Operation " + operation.identifier()
                + " is single-result, use call() instead");
        }
        return new RemoteStreamPublisher<>(this, operation.identifier(), argument, operation::castResult);
    }

    /**
     * Registers a stream route and sends its request. Runs on the proxy loop.
     *
     * @return the correlation id, or -1 if the call was rejected and the route already failed
     */
    long openStream(String method, Object payload, ReplyRoute route) {
        if (closed) {
            route.onClosed(InferenceException.closed(method, null));
            return -1;
        }
        if (!admission.tryAcquire()) {
            logger.warn("Rejecting {}: {} calls already in flight", method, config.getMaxInFlightCalls());
            route.onClosed(InferenceException.overloaded(method, config.getMaxInFlightCalls()));
            return -1;
        }

        long id = correlationIds.next();
        routes.put(id, route);
        workerPort.send(Envelope.request(id, method, payload));
        return id;
    }

    /**
     * Frees the route of a call the caller gave up on and tells the worker to stop it.
     */
    void cancelRemote(long correlationId) {
        if (release(correlationId) && !closed) {
            logger.debug("Cancelling call {}", correlationId);
            workerPort.send(Envelope.cancel(correlationId));
        }
    }

    /**
     * Runs a task on the proxy loop. A task the loop no longer runs, because the handle was
     * closed in the meantime, still runs, inline or as the loop's last work.
     */
    void runOnLoop(Runnable task) {
        receivePort.executeOrElse(task, task);
    }

    private boolean release(long correlationId) {
        if (routes.remove(correlationId) != null) {
            admission.release();
            return true;
        }
        return false;
    }

    /**
     * Number of calls waiting for their terminal reply.
     */
    public int inFlightCount() {
        return routes.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the handle. Calls still waiting fail with
     * {@link InferenceException.ErrorType#TRANSPORT}, the worker is stopped and later calls fail
     * immediately. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        List<Long> pending = new ArrayList<>(routes.keySet());
        for (Long id : pending) {
            ReplyRoute route = routes.remove(id);
            if (route != null) {
                admission.release();
                route.onClosed(InferenceException.closed(route.method(), id));
            }
        }
        handshake.completeExceptionally(InferenceException.closed(null, null));

        InferenceWorker current = worker;
        if (current != null) {
            current.close();
        }
        // Queued behind the failure signals of open streams
        runOnLoop(receivePort::close);
        logger.info("Service handle {} closed ({} pending calls failed)", receivePort.getName(), pending.size());
    }
}
