package com.badu.ai.isolate.transport;

import com.badu.ai.isolate.protocol.Envelope;

/**
 * Send capability of a {@link ReceivePort}.
 *
 * <p>Sending never blocks and never fails: the envelope is queued on the owning port's event
 * loop. Envelopes sent to a closed port are dropped. Safe to call from any thread; envelopes
 * sent from one thread are delivered in the order they were sent.
 */
@FunctionalInterface
public interface SendPort {

    /**
     * Queues an envelope for delivery.
     *
     * @param envelope envelope to deliver
     */
    void send(Envelope envelope);
}
