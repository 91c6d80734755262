package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.Envelope;

/**
 * Correlation bookkeeping entry for one outstanding call.
 *
 * <p>Registered in {@link ServiceHandle} when the request is sent and removed when the reply
 * stream terminates, the caller cancels, or the handle closes.
 */
interface ReplyRoute {

  CallKind kind();

  /**
   * Wire identifier of the call this route belongs to.
   */
  String method();

  /**
   * Handles a reply carrying this route's correlation id. Runs on the proxy loop.
   */
  void onReply(Envelope reply);

  /**
   * Fails the call because the handle closed before the reply stream terminated.
   */
  void onClosed(InferenceException failure);
}
