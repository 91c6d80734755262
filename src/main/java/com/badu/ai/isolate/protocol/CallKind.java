package com.badu.ai.isolate.protocol;

/**
 * Caller-visible result shape of a contract operation.
 */
public enum CallKind {
  /** One reply envelope; surfaced as a {@link java.util.concurrent.CompletableFuture}. */
  SINGLE,

  /** Zero or more elements then a terminal envelope; surfaced as a {@link java.util.concurrent.Flow.Publisher}. */
  STREAMING
}
