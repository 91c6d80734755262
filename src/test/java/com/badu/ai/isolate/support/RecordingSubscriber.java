package com.badu.ai.isolate.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Subscriber that records every signal. Requests {@code initialRequest} elements on subscribe;
 * more can be requested through {@link #request(long)}.
 */
public final class RecordingSubscriber<T> implements Flow.Subscriber<T> {

  private final long initialRequest;
  private final List<T> items = new ArrayList<>();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private volatile Flow.Subscription subscription;
  private volatile Throwable error;
  private volatile boolean completed;

  public RecordingSubscriber(long initialRequest) {
    this.initialRequest = initialRequest;
  }

  public static <T> RecordingSubscriber<T> unbounded() {
    return new RecordingSubscriber<>(Long.MAX_VALUE);
  }

  @Override
  public void onSubscribe(Flow.Subscription subscription) {
    this.subscription = subscription;
    if (initialRequest > 0) {
      subscription.request(initialRequest);
    }
  }

  @Override
  public synchronized void onNext(T item) {
    items.add(item);
  }

  @Override
  public void onError(Throwable throwable) {
    error = throwable;
    terminated.countDown();
  }

  @Override
  public void onComplete() {
    completed = true;
    terminated.countDown();
  }

  public void request(long n) {
    subscription.request(n);
  }

  public void cancel() {
    subscription.cancel();
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Waits until at least {@code count} elements arrived.
   */
  public boolean awaitItems(int count, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (System.nanoTime() < deadline) {
      if (items().size() >= count) {
        return true;
      }
      Thread.sleep(5);
    }
    return items().size() >= count;
  }

  public synchronized List<T> items() {
    return List.copyOf(items);
  }

  public Throwable error() {
    return error;
  }

  public boolean isCompleted() {
    return completed;
  }
}
