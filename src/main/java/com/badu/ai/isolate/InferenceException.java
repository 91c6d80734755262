package com.badu.ai.isolate;

import com.badu.ai.isolate.protocol.Envelope;

import java.time.Duration;

/**
 * Exception thrown to callers of the isolated inference service with context-rich error
 * messages.
 *
 * <p>This exception provides detailed context about the failure including:
 * <ul>
 *   <li>Error type (handshake, remote invocation, transport, ...)</li>
 *   <li>Wire identifier of the operation that failed (if any)</li>
 *   <li>Correlation id of the failed call (if any)</li>
 *   <li>Corrective actions for common issues</li>
 * </ul>
 *
 * <p>Remote failures arrive as a single description string produced by the worker; that string
 * becomes the message of a {@link ErrorType#REMOTE_INVOCATION} exception on the caller side.
 *
 * <p>Usage example:
 * <pre>{@code
 * try {
 *   List<Double> vector = service.embed("hello").join();
 * } catch (CompletionException e) {
 *   InferenceException cause = (InferenceException) e.getCause();
 *   System.err.println("Embedding failed: " + cause.getMessage());
 *   System.err.println("Operation: " + cause.getOperation());
 *   System.err.println("Corrective action: " + cause.getCorrectiveAction());
 * }
 * }</pre>
 *
 * @see com.badu.ai.isolate.proxy.InferenceServiceProxy
 */
public class InferenceException extends RuntimeException {

  private final ErrorType errorType;
  private final String operation;
  private final Long correlationId;
  private final String correctiveAction;

  /**
   * Error types for categorizing failures across the isolation boundary.
   */
  public enum ErrorType {
    /** Worker did not start or did not answer the bootstrap handshake in time */
    HANDSHAKE,

    /** Worker answered the call with an error (unknown method, engine failure, cancellation) */
    REMOTE_INVOCATION,

    /** Service handle closed, or call on a closed handle */
    TRANSPORT,

    /** Too many calls in flight */
    OVERLOADED,

    /** Blocking consumption of a stream gave up waiting */
    TIMEOUT,

    /** Invalid configuration (unknown backend, malformed bridge config) */
    CONFIGURATION
  }

  /**
   * Creates an InferenceException with full context.
   *
   * @param message Error message
   * @param errorType Type of error
   * @param operation Wire identifier of the operation (null if not call-specific)
   * @param correlationId Correlation id of the call (null if not call-specific)
   * @param correctiveAction Suggested corrective action
   * @param cause Root cause exception
   */
  public InferenceException(String message, ErrorType errorType, String operation,
                            Long correlationId, String correctiveAction, Throwable cause) {
    super(buildFullMessage(message, errorType, operation, correlationId, correctiveAction), cause);
    this.errorType = errorType;
    this.operation = operation;
    this.correlationId = correlationId;
    this.correctiveAction = correctiveAction;
  }

  /**
   * Creates an InferenceException with minimal context.
   */
  public InferenceException(String message, ErrorType errorType, String correctiveAction,
                            Throwable cause) {
    this(message, errorType, null, null, correctiveAction, cause);
  }

  /**
   * Creates an InferenceException with just message and type.
   */
  public InferenceException(String message, ErrorType errorType) {
    this(message, errorType, null, null);
  }

  /**
   * Creates the caller-side exception for an error-bearing reply envelope.
   *
   * @param reply terminal reply with {@link Envelope#error()} set
   * @return exception carrying the worker's description
   */
  public static InferenceException remoteFailure(Envelope reply) {
    return new InferenceException(reply.error(), ErrorType.REMOTE_INVOCATION, reply.method(),
        reply.correlationId(), null, null);
  }

  /**
   * Creates the exception for a handshake that did not complete in time.
   *
   * @param timeout handshake timeout that elapsed
   * @return exception with a corrective action
   */
  public static InferenceException handshakeTimeout(Duration timeout) {
    return new InferenceException(
        "Worker did not complete the bootstrap handshake within " + timeout.toMillis() + "ms",
        ErrorType.HANDSHAKE,
        "Check the worker log for a failed service factory. Slow engine construction may need "
            + "a larger handshake_timeout_ms in the bridge configuration.",
        null);
  }

  /**
   * Creates the exception for a call rejected by admission control.
   */
  public static InferenceException overloaded(String operation, int maxInFlightCalls) {
    return new InferenceException(
        "Too many calls in flight (limit " + maxInFlightCalls + ")",
        ErrorType.OVERLOADED, operation, null,
        "Wait for outstanding calls to finish or raise max_in_flight_calls.", null);
  }

  /**
   * Creates the exception for a call that cannot complete because the handle is closed.
   */
  public static InferenceException closed(String operation, Long correlationId) {
    return new InferenceException("Service handle is closed", ErrorType.TRANSPORT, operation,
        correlationId, null, null);
  }

  /**
   * Builds the full error message with all available context.
   */
  private static String buildFullMessage(String message, ErrorType errorType, String operation,
                                         Long correlationId, String correctiveAction) {
    StringBuilder sb = new StringBuilder();
    sb.append("[").append(errorType).append("] ").append(message);

    if (operation != null) {
      sb.append("\n  Operation: ").append(operation);
    }

    if (correlationId != null) {
      sb.append("\n  Correlation id: ").append(correlationId);
    }

    if (correctiveAction != null) {
      sb.append("\n  Corrective action: ").append(correctiveAction);
    }

    return sb.toString();
  }

  /**
   * Gets the error type.
   *
   * @return error type
   */
  public ErrorType getErrorType() {
    return errorType;
  }

  /**
   * Gets the wire identifier of the failed operation.
   *
   * @return operation identifier (may be null)
   */
  public String getOperation() {
    return operation;
  }

  /**
   * Gets the correlation id of the failed call.
   *
   * @return correlation id (may be null)
   */
  public Long getCorrelationId() {
    return correlationId;
  }

  /**
   * Gets the suggested corrective action.
   *
   * @return corrective action (may be null)
   */
  public String getCorrectiveAction() {
    return correctiveAction;
  }
}
