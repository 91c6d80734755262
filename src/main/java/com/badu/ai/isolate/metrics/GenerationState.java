package com.badu.ai.isolate.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the engine's text generation progress.
 *
 * <p>Reported by {@link com.badu.ai.isolate.InferenceService#getGenerationState()}:
 * <ul>
 *   <li><b>Generating</b>: whether a completion or chat is currently running</li>
 *   <li><b>Prefill progress</b>: fraction of the prompt already processed, 0.0 to 1.0</li>
 *   <li><b>Prefill speed</b>: prompt tokens processed per second</li>
 *   <li><b>Decode speed</b>: tokens generated per second</li>
 *   <li><b>Timestamp</b>: epoch milliseconds when the snapshot was taken</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 */
@Value
@Builder
public class GenerationState {
    /**
     * True while a generation is running.
     */
    boolean generating;

    /**
     * Fraction of the prompt processed so far.
     */
    double prefillProgress;

    /**
     * Prefill throughput in tokens per second.
     */
    double prefillSpeed;

    /**
     * Decode throughput in tokens per second.
     */
    double decodeSpeed;

    /**
     * Epoch milliseconds of the snapshot.
     */
    long timestamp;

    /**
     * Returns the state of an engine that has not generated anything yet.
     */
    public static GenerationState initial() {
        return builder().build();
    }

    /**
     * Checks if the prompt has been fully processed.
     *
     * @return true if prefill progress reached 1.0
     */
    public boolean isPrefillComplete() {
        return prefillProgress >= 1.0;
    }
}
