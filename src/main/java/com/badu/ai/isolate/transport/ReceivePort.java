package com.badu.ai.isolate.transport;

import com.badu.ai.isolate.protocol.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Receive side of an in-process channel, backed by a single-threaded event loop.
 *
 * <p>Every port owns one named daemon thread and an unbounded FIFO queue. Envelopes sent through
 * {@link #sendPort()} and tasks passed to {@link #execute(Runnable)} run on that thread one at a
 * time, in submission order, so state touched only from the loop needs no locking.
 *
 * <p>Envelopes that arrive before a listener is attached are buffered and replayed in order when
 * {@link #listen(EnvelopeListener)} is called. A listener that throws is logged and the loop
 * carries on with the next event.
 *
 * <p>Usage example:
 * <pre>{@code
 * ReceivePort port = new ReceivePort("inference-proxy");
 * port.listen(envelope -> logger.info("Received {}", envelope));
 * otherSide.send(Envelope.bootstrap(port.sendPort()));
 * ...
 * port.close();
 * }</pre>
 */
public final class ReceivePort implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ReceivePort.class);

    private final String name;
    private final ExecutorService loop;
    private final SendPort sendPort;
    private final AtomicBoolean listening = new AtomicBoolean(false);
    private volatile boolean closed;
    private volatile Thread loopThread;

    // Loop-confined
    private final Queue<Envelope> backlog = new ArrayDeque<>();
    private EnvelopeListener listener;

    /**
     * Creates a port and starts its event loop thread.
     *
     * @param name name of the port, also used as the loop thread name
     */
    public ReceivePort(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Port name cannot be null or empty");
        }
        this.name = name;
        this.loop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.sendPort = this::deliver;
    }

    /**
     * Returns the send capability of this port.
     */
    public SendPort sendPort() {
        return sendPort;
    }

    public String getName() {
        return name;
    }

    /**
     * Attaches the listener and replays any buffered envelopes to it.
     *
     * @param listener listener invoked on the loop thread for every envelope
     * @throws IllegalStateException if a listener is already attached
     */
    public void listen(EnvelopeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        if (!listening.compareAndSet(false, true)) {
            throw new IllegalStateException("Port " + name + " already has a listener");
        }
        execute(() -> {
            this.listener = listener;
            while (!backlog.isEmpty()) {
                dispatch(backlog.poll());
            }
        });
    }

    /**
     * Runs a task on this port's event loop.
     *
     * @param task task to run after every previously queued event
     * @return false if the port is closed and the task was dropped
     */
    public boolean execute(Runnable task) {
        return submit(task, null);
    }

    /**
     * Runs a task on this port's event loop, or {@code fallback} if the port closes before the
     * task gets to run. The fallback runs inline when the port is already closed, otherwise on
     * the loop thread in place of the skipped task.
     *
     * @param task task to run after every previously queued event
     * @param fallback task to run instead once the port is closed
     */
    public void executeOrElse(Runnable task, Runnable fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("Fallback cannot be null");
        }
        if (!submit(task, fallback)) {
            fallback.run();
        }
    }

    private boolean submit(Runnable task, Runnable fallback) {
        if (closed) {
            logger.debug("Port {} is closed, dropping task", name);
            return false;
        }
        try {
            loop.execute(() -> {
                Runnable next = closed ? fallback : task;
                if (next == null) {
                    return;
                }
                try {
                    next.run();
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    logger.error("Unhandled failure on event loop {}", name, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Port {} is closed, dropping task", name);
            return false;
        }
    }

    /**
     * Returns true if the calling thread is this port's event loop thread.
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isClosed() {
        return closed;
    }

    private void deliver(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("Envelope cannot be null");
        }
        if (!execute(() -> dispatch(envelope))) {
            logger.debug("Port {} dropped {}", name, envelope);
        }
    }

    private void dispatch(Envelope envelope) {
        if (listener == null) {
            backlog.add(envelope);
            return;
        }
        listener.onEnvelope(envelope);
    }

    /**
     * Stops the event loop. Queued events that have not started are discarded; envelopes sent
     * afterwards are dropped. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        loop.shutdown();
        logger.debug("Port {} closed", name);
    }

    /**
     * Closes the port and waits for the running event, if any, to finish.
     *
     * @param timeoutMs maximum time to wait
     * @return true if the loop terminated in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean closeAndAwait(long timeoutMs) throws InterruptedException {
        close();
        if (isLoopThread()) {
            return false;
        }
        return loop.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
