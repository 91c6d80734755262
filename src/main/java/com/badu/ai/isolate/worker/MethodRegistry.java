package com.badu.ai.isolate.worker;

import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.Operation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.function.Function;

/**
 * Immutable mapping from wire identifier to the handler the worker dispatches to.
 *
 * <p>Built once per worker, before the worker starts listening. Typed bindings check the
 * request payload against {@link Operation#argumentType()} before calling the bound method, so a
 * malformed request fails only its own call.
 *
 * <p>Usage example:
 * <pre>{@code
 * MethodRegistry registry = MethodRegistry.builder()
 *     .bind(Operation.EMBED, engine::embed)
 *     .bindStream(Operation.COMPLETION, engine::completion)
 *     .build();
 * }</pre>
 *
 * @see ServiceBindings
 */
public final class MethodRegistry {

    private final Map<String, MethodHandler> handlers;
    private final Map<String, CallKind> kinds;

    private MethodRegistry(Map<String, MethodHandler> handlers, Map<String, CallKind> kinds) {
        this.handlers = Map.copyOf(handlers);
        this.kinds = Map.copyOf(kinds);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the handler for a wire identifier.
     *
     * @param method wire identifier
     * @return handler, or empty if nothing is registered under that identifier
     */
    public Optional<MethodHandler> find(String method) {
        return Optional.ofNullable(handlers.get(method));
    }

    /**
     * Gets the call kind the handler was registered with.
     *
     * @param method wire identifier
     * @return call kind, or empty if nothing is registered under that identifier
     */
    public Optional<CallKind> kindOf(String method) {
        return Optional.ofNullable(kinds.get(method));
    }

    public boolean contains(String method) {
        return handlers.containsKey(method);
    }

    /**
     * Returns all registered wire identifiers.
     */
    public Set<String> methods() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Builder collecting bindings. Rejects duplicate identifiers and bindings whose call kind
     * disagrees with the operation.
     */
    public static final class Builder {

        private final Map<String, MethodHandler> handlers = new LinkedHashMap<>();
        private final Map<String, CallKind> kinds = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Binds a single-result operation.
         *
         * @param operation contract operation, must be {@link CallKind#SINGLE}
         * @param method method returning a completion stage of the result
         * @return this builder
         */
        public <A, R> Builder bind(Operation<A, R> operation,
                                   Function<A, ? extends CompletionStage<? extends R>> method) {
            requireKind(operation, CallKind.SINGLE);
            return register(operation.identifier(), CallKind.SINGLE, typed(operation, method));
        }

        /**
         * Binds a streaming operation.
         *
         * @param operation contract operation, must be {@link CallKind#STREAMING}
         * @param method method returning a publisher of result elements
         * @return this builder
         */
        public <A, R> Builder bindStream(Operation<A, R> operation,
                                         Function<A, ? extends Flow.Publisher<? extends R>> method) {
            requireKind(operation, CallKind.STREAMING);
            return register(operation.identifier(), CallKind.STREAMING, typed(operation, method));
        }

        /**
         * Binds an untyped handler under an arbitrary identifier. The handler may return an
         * immediate value, a completion stage or a publisher.
         *
         * @param method wire identifier, must not start with '$'
         * @param kind call kind the proxy will use for this identifier
         * @param handler handler
         * @return this builder
         */
        public Builder bindHandler(String method, CallKind kind, MethodHandler handler) {
            if (method == null || method.isEmpty()) {
                throw new IllegalArgumentException("Method identifier cannot be null or empty");
            }
            if (handler == null || kind == null) {
                throw new IllegalArgumentException("Handler and kind cannot be null for " + method);
            }
            return register(method, kind, handler);
        }

        public MethodRegistry build() {
            return new MethodRegistry(handlers, kinds);
        }

        private Builder register(String method, CallKind kind, MethodHandler handler) {
            if (method.startsWith("$")) {
                throw new IllegalArgumentException("Identifier " + method + " is reserved for control messages");
            }
            if (handlers.containsKey(method)) {
                throw new IllegalStateException("Duplicate binding for method: " + method);
            }
            handlers.put(method, handler);
            kinds.put(method, kind);
            return this;
        }

        private static void requireKind(Operation<?, ?> operation, CallKind expected) {
            if (operation == null) {
                throw new IllegalArgumentException("Operation cannot be null");
            }
            if (operation.kind() != expected) {
                throw new IllegalArgumentException("Operation " + operation.identifier()
                    + " is " + operation.kind() + " but was bound as " + expected);
            }
        }

        @SuppressWarnings("unchecked")
        private static <A> MethodHandler typed(Operation<A, ?> operation, Function<A, ?> method) {
            if (method == null) {
                throw new IllegalArgumentException("Method cannot be null for " + operation.identifier());
            }
            return argument -> {
                if (!operation.acceptsArgument(argument)) {
                    throw new IllegalArgumentException("Argument type mismatch for "
                        + operation.identifier() + ": expected " + operation.argumentType().getSimpleName()
                        + ", got " + argument.getClass().getSimpleName());
                }
                return method.apply((A) argument);
            };
        }
    }
}
