package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.Envelope;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Route of a single-result call: the first reply settles the future.
 */
final class SingleReplyRoute<R> implements ReplyRoute {

  private final String method;
  private final CompletableFuture<R> result;
  private final Function<Object, R> decoder;

  SingleReplyRoute(String method, CompletableFuture<R> result, Function<Object, R> decoder) {
    this.method = method;
    this.result = result;
    this.decoder = decoder;
  }

  @Override
  public CallKind kind() {
    return CallKind.SINGLE;
  }

  @Override
  public String method() {
    return method;
  }

  @Override
  public void onReply(Envelope reply) {
    if (reply.hasError()) {
      result.completeExceptionally(InferenceException.remoteFailure(reply));
      return;
    }

    R value;
    try {
      value = decoder.apply(reply.payload());
    } catch (ClassCastException e) {
      result.completeExceptionally(new InferenceException(
          "Reply payload does not match the result type: " + e.getMessage(),
          InferenceException.ErrorType.TRANSPORT, method, reply.correlationId(), null, e));
      return;
    }
    result.complete(value);
  }

  @Override
  public void onClosed(InferenceException failure) {
    result.completeExceptionally(failure);
  }
}
