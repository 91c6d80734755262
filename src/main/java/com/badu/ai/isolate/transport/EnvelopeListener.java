package com.badu.ai.isolate.transport;

import com.badu.ai.isolate.protocol.Envelope;

/**
 * Receives envelopes on the event loop thread of a {@link ReceivePort}.
 */
@FunctionalInterface
public interface EnvelopeListener {

    void onEnvelope(Envelope envelope);
}
