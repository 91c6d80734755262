package com.badu.ai.isolate.protocol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues correlation ids for one proxy.
 *
 * <p>Ids increase monotonically from 1 and are never reused for the lifetime of the generator.
 * {@link Envelope#BOOTSTRAP_ID} is never issued. Ids only need to be unique per proxy.
 */
public class CorrelationIdGenerator {

  private final AtomicLong lastId = new AtomicLong(Envelope.BOOTSTRAP_ID);

  /**
   * Returns the next correlation id.
   *
   * @return id greater than every id returned before
   */
  public long next() {
    return lastId.incrementAndGet();
  }

  /**
   * Returns the most recently issued id, or {@link Envelope#BOOTSTRAP_ID} if none was issued.
   */
  public long last() {
    return lastId.get();
  }
}
