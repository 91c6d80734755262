package com.badu.ai.isolate.support;

import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.transport.SendPort;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Send port that records every envelope, for driving an endpoint at envelope level.
 */
public final class RecordingSendPort implements SendPort {

  private static final Duration DEFAULT_WAIT = Duration.ofSeconds(5);

  private final BlockingQueue<Envelope> received = new LinkedBlockingQueue<>();

  @Override
  public void send(Envelope envelope) {
    received.add(envelope);
  }

  /**
   * Waits for the next envelope, failing if none arrives within five seconds.
   */
  public Envelope next() throws InterruptedException {
    Envelope envelope = received.poll(DEFAULT_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    if (envelope == null) {
      throw new AssertionError("No envelope received within " + DEFAULT_WAIT.toMillis() + "ms");
    }
    return envelope;
  }

  /**
   * Waits briefly for an envelope that should not come.
   *
   * @return the unexpected envelope, or null if nothing arrived
   */
  public Envelope poll(Duration wait) throws InterruptedException {
    return received.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
  }

  public int pending() {
    return received.size();
  }
}
