package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.streaming.TokenStreams;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Publisher of the elements of one streaming call.
 *
 * <p>The request is sent when the first subscriber arrives, so creating the publisher is free.
 * Each publisher stands for one call and accepts one subscriber; a second subscriber receives
 * {@code onError(IllegalStateException)}. Elements that arrive faster than the subscriber
 * requests them are buffered in arrival order.
 *
 * <p>All signals after {@code onSubscribe} are delivered on the proxy loop.
 */
final class RemoteStreamPublisher<R> implements Flow.Publisher<R> {

    private final ServiceHandle handle;
    private final String method;
    private final Object payload;
    private final Function<Object, R> decoder;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    RemoteStreamPublisher(ServiceHandle handle, String method, Object payload, Function<Object, R> decoder) {
        this.handle = handle;
        this.method = method;
        this.payload = payload;
        this.decoder = decoder;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super R> subscriber) {
        if (subscriber == null) {
            throw new NullPointerException("Subscriber cannot be null");
        }
        if (!subscribed.compareAndSet(false, true)) {
            TokenStreams.<R>failed(new IllegalStateException("Stream of " + method
                + " is already subscribed, issue the call again for a new stream")).subscribe(subscriber);
            return;
        }
        if (handle.isClosed()) {
            TokenStreams.<R>failed(InferenceException.closed(method, null)).subscribe(subscriber);
            return;
        }

        StreamSubscription subscription = new StreamSubscription(subscriber);
        subscriber.onSubscribe(subscription);
        handle.runOnLoop(subscription::open);
    }

    /**
     * Route and subscription of the call. Every field is confined to the proxy loop.
     */
    private final class StreamSubscription implements Flow.Subscription, ReplyRoute {

        private final Flow.Subscriber<? super R> subscriber;
        private final Queue<R> buffer = new ArrayDeque<>();
        private long correlationId = -1;
        private long demand;
        private boolean cancelled;
        private boolean finished;
        private boolean completed;
        private Throwable failure;

        private StreamSubscription(Flow.Subscriber<? super R> subscriber) {
            this.subscriber = subscriber;
        }

        private void open() {
            if (cancelled || finished) {
                return;
            }
            correlationId = handle.openStream(method, payload, this);
        }

        @Override
        public void request(long n) {
            handle.runOnLoop(() -> {
                if (cancelled || finished) {
                    return;
                }
                if (n <= 0) {
                    abandon();
                    finished = true;
                    subscriber.onError(new IllegalArgumentException(
                        "Subscription request must be positive, got: " + n));
                    return;
                }
                demand += n;
                if (demand < 0) {
                    demand = Long.MAX_VALUE;
                }
                drain();
            });
        }

        @Override
        public void cancel() {
            handle.runOnLoop(() -> {
                if (cancelled || finished) {
                    return;
                }
                abandon();
            });
        }

        private void abandon() {
            cancelled = true;
            buffer.clear();
            if (correlationId > 0) {
                handle.cancelRemote(correlationId);
            }
        }

        @Override
        public CallKind kind() {
            return CallKind.STREAMING;
        }

        @Override
        public String method() {
            return method;
        }

        @Override
        public void onReply(Envelope reply) {
            if (cancelled || finished) {
                return;
            }
            if (reply.hasError()) {
                failure = InferenceException.remoteFailure(reply);
            } else if (reply.done()) {
                completed = true;
            } else {
                try {
                    buffer.add(decoder.apply(reply.payload()));
                } catch (ClassCastException e) {
                    failure = new InferenceException(
                        "Stream element does not match the result type: " + e.getMessage(),
                        InferenceException.ErrorType.TRANSPORT, method, reply.correlationId(), null, e);
                    buffer.clear();
                    handle.cancelRemote(reply.correlationId());
                }
            }
            drain();
        }

        @Override
        public void onClosed(InferenceException closedFailure) {
            handle.runOnLoop(() -> {
                if (cancelled || finished || failure != null) {
                    return;
                }
                failure = closedFailure;
                drain();
            });
        }

        private void drain() {
            while (demand > 0 && !buffer.isEmpty()) {
                demand--;
                subscriber.onNext(buffer.poll());
                if (cancelled) {
                    return;
                }
            }
            if (!buffer.isEmpty() || finished) {
                return;
            }
            if (failure != null) {
                finished = true;
                subscriber.onError(failure);
            } else if (completed) {
                finished = true;
                subscriber.onComplete();
            }
        }
    }
}
