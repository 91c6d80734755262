package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.worker.InferenceWorker;

/**
 * Starts the worker side of a {@link ServiceHandle}.
 *
 * <p>The launcher receives the bootstrap envelope carrying the proxy's send port and must hand
 * it to the new worker. Returning {@code null} is allowed for workers whose lifecycle is managed
 * elsewhere; the handle then has nothing to close on the worker side.
 */
@FunctionalInterface
public interface WorkerLauncher {

    InferenceWorker launch(Envelope bootstrap);
}
