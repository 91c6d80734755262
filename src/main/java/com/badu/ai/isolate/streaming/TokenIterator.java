package com.badu.ai.isolate.streaming;

import com.badu.ai.isolate.InferenceException;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking, forward-only iterator over a stream.
 *
 * <p>Requests one element at a time, so the publisher buffers whatever the consumer has not
 * reached yet. {@link #hasNext()} blocks until the next element, the end of the stream or a
 * failure arrives; a failure is rethrown as an unchecked exception. Closing the iterator before
 * the end cancels the stream.
 *
 * <p>Not thread-safe: iterate from one thread.
 */
public final class TokenIterator<T> implements Iterator<T>, AutoCloseable {

    private static final Object COMPLETE = new Object();

    private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
    private final Duration elementTimeout;
    private volatile Flow.Subscription subscription;
    private Object pending;
    private boolean finished;

    TokenIterator(Flow.Publisher<T> publisher, Duration elementTimeout) {
        this.elementTimeout = elementTimeout;
        publisher.subscribe(new Flow.Subscriber<T>() {
            @Override
            public void onSubscribe(Flow.Subscription s) {
                subscription = s;
                s.request(1);
            }

            @Override
            public void onNext(T item) {
                signals.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                signals.add(new Failure(throwable));
            }

            @Override
            public void onComplete() {
                signals.add(COMPLETE);
            }
        });
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }

        Object signal = awaitSignal();
        if (signal == COMPLETE) {
            finished = true;
            return false;
        }
        if (signal instanceof Failure) {
            finished = true;
            throw TokenStreams.propagate(((Failure) signal).cause());
        }
        pending = signal;
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream has ended");
        }
        T item = (T) pending;
        pending = null;
        subscription.request(1);
        return item;
    }

    private Object awaitSignal() {
        try {
            if (elementTimeout == null) {
                return signals.take();
            }
            Object signal = signals.poll(elementTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (signal == null) {
                close();
                throw new InferenceException("No stream element within " + elementTimeout.toMillis() + "ms",
                    InferenceException.ErrorType.TIMEOUT);
            }
            return signal;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new InferenceException("Interrupted while waiting for a stream element",
                InferenceException.ErrorType.TRANSPORT, null, e);
        }
    }

    /**
     * Cancels the stream if it has not ended. Idempotent.
     */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        finished = true;
        pending = null;
        Flow.Subscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        signals.clear();
    }

    private record Failure(Throwable cause) {
    }
}
