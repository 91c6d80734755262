package com.badu.ai.isolate.worker;

/**
 * Callable bound to one operation in a {@link MethodRegistry}.
 *
 * <p>The returned value decides how the worker answers:
 * <ul>
 *   <li>{@link java.util.concurrent.CompletionStage}: one reply once the stage settles</li>
 *   <li>{@link java.util.concurrent.Flow.Publisher}: one reply per element, then a terminal reply</li>
 *   <li>anything else, including null: one reply carrying the value immediately</li>
 * </ul>
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * Invokes the bound method.
     *
     * @param argument request payload, null when the call has no argument
     * @return immediate value, completion stage or publisher
     * @throws Exception any failure; the worker turns it into an error reply
     */
    Object invoke(Object argument) throws Exception;
}
