package com.badu.ai.isolate.protocol;

import com.badu.ai.isolate.transport.SendPort;

/**
 * One request or reply unit travelling between the proxy and the worker.
 *
 * <p>A call is exactly one request envelope followed by zero or more reply envelopes that
 * share its correlation id. The reply stream ends with exactly one terminal envelope: either
 * {@code done = true} (normal end of a stream) or a non-null {@code error}. Single-result calls
 * are answered with a single payload-bearing envelope which the proxy treats as terminal.
 *
 * <p>Envelopes are immutable. The worker stamps its replies with
 * {@link #withPayload(Object)}, {@link #withError(String)} and {@link #completed()}, which keep
 * the correlation id and method of the request.
 *
 * <p>Two control messages are reserved:
 * <ul>
 *   <li>bootstrap: correlation id {@value #BOOTSTRAP_ID}, carries a {@link SendPort}</li>
 *   <li>cancellation: method {@value #CANCEL_METHOD}, names the call to cancel by id</li>
 * </ul>
 *
 * @param correlationId identifier shared by a request and all of its replies
 * @param method wire identifier of the invoked operation
 * @param payload call argument on the request leg, partial or final result on the reply leg
 * @param error failure description, {@code null} when the exchange did not fail
 * @param done true on the final envelope of a successfully completed reply stream
 */
public record Envelope(long correlationId, String method, Object payload, String error,
                       boolean done) {

  /** Correlation id reserved for the bootstrap handshake. */
  public static final long BOOTSTRAP_ID = 0L;

  /** Method identifier of the bootstrap handshake. */
  public static final String BOOTSTRAP_METHOD = "$bootstrap";

  /** Method identifier of the cancellation control message. */
  public static final String CANCEL_METHOD = "$cancel";

  public Envelope {
    if (method == null || method.isEmpty()) {
      throw new IllegalArgumentException("Envelope method cannot be null or empty");
    }
  }

  /**
   * Creates a request envelope.
   *
   * @param correlationId fresh id issued by {@link CorrelationIdGenerator}
   * @param method wire identifier of the operation
   * @param payload call argument, {@code null} for operations without one
   * @return request envelope
   */
  public static Envelope request(long correlationId, String method, Object payload) {
    if (correlationId == BOOTSTRAP_ID) {
      throw new IllegalArgumentException("Correlation id " + BOOTSTRAP_ID + " is reserved");
    }
    return new Envelope(correlationId, method, payload, null, false);
  }

  /**
   * Creates the bootstrap envelope carrying the sender's own port.
   */
  public static Envelope bootstrap(SendPort senderPort) {
    return new Envelope(BOOTSTRAP_ID, BOOTSTRAP_METHOD, senderPort, null, false);
  }

  /**
   * Creates the control message cancelling the call with the given id.
   */
  public static Envelope cancel(long correlationId) {
    return new Envelope(correlationId, CANCEL_METHOD, null, null, false);
  }

  public boolean isBootstrap() {
    return correlationId == BOOTSTRAP_ID;
  }

  public boolean isCancellation() {
    return !isBootstrap() && CANCEL_METHOD.equals(method);
  }

  public boolean hasError() {
    return error != null;
  }

  /**
   * Returns true if no further envelope follows this one for the same correlation id.
   */
  public boolean isTerminal() {
    return done || error != null;
  }

  /**
   * Copies this envelope with a new payload, clearing error and completion flags.
   */
  public Envelope withPayload(Object newPayload) {
    return new Envelope(correlationId, method, newPayload, null, false);
  }

  /**
   * Copies this envelope as a failed terminal reply. The payload is dropped.
   */
  public Envelope withError(String description) {
    if (description == null) {
      throw new IllegalArgumentException("Error description cannot be null");
    }
    return new Envelope(correlationId, method, null, description, false);
  }

  /**
   * Copies this envelope as the successful end of a reply stream. The payload is dropped.
   */
  public Envelope completed() {
    return new Envelope(correlationId, method, null, null, true);
  }

  /**
   * Returns true if both envelopes belong to the same exchange.
   */
  public boolean correlatesWith(Envelope other) {
    return other != null && other.correlationId == correlationId;
  }

  @Override
  public String toString() {
    return "Envelope{id=" + correlationId + ", method=" + method
        + ", payload=" + payload + ", done=" + done + ", error=" + error + "}";
  }
}
