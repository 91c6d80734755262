package com.badu.ai.isolate.streaming;

import com.badu.ai.isolate.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Helpers for consuming generation streams from blocking code.
 *
 * <p>The service returns {@link Flow.Publisher}s. These helpers cover the common ways of
 * reading one:
 * <ul>
 *   <li>{@link #iterator(Flow.Publisher)} / {@link #iterable(Flow.Publisher)}: pull fragments
 *       one by one in a for-each loop</li>
 *   <li>{@link #collect(Flow.Publisher, Duration)}: wait for the whole stream</li>
 *   <li>{@link #subscribe(Flow.Publisher, TokenCallback)}: push fragments to a callback</li>
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * String text = TokenStreams.join(service.completion("hi"), Duration.ofSeconds(30));
 * }</pre>
 */
public final class TokenStreams {

  private static final Logger logger = LoggerFactory.getLogger(TokenStreams.class);

  private TokenStreams() {
  }

  /**
   * Subscribes a blocking iterator that waits indefinitely for each element.
   */
  public static <T> TokenIterator<T> iterator(Flow.Publisher<T> publisher) {
    return iterator(publisher, null);
  }

  /**
   * Subscribes a blocking iterator.
   *
   * @param publisher stream to read
   * @param elementTimeout maximum wait for each element, {@code null} to wait indefinitely
   * @return iterator over the stream
   */
  public static <T> TokenIterator<T> iterator(Flow.Publisher<T> publisher, Duration elementTimeout) {
    if (publisher == null) {
      throw new IllegalArgumentException("Publisher cannot be null");
    }
    if (elementTimeout != null && (elementTimeout.isNegative() || elementTimeout.isZero())) {
      throw new IllegalArgumentException("Element timeout must be positive, got: " + elementTimeout);
    }
    return new TokenIterator<>(publisher, elementTimeout);
  }

  /**
   * Wraps a stream for use in a for-each loop. The stream can be iterated once.
   */
  public static <T> Iterable<T> iterable(Flow.Publisher<T> publisher) {
    if (publisher == null) {
      throw new IllegalArgumentException("Publisher cannot be null");
    }
    AtomicBoolean used = new AtomicBoolean(false);
    return () -> {
      if (!used.compareAndSet(false, true)) {
        throw new IllegalStateException("Stream can only be iterated once");
      }
      return iterator(publisher);
    };
  }

  /**
   * Waits for the stream to complete and returns all of its elements.
   *
   * @param publisher stream to read
   * @param timeout maximum wait for the whole stream
   * @return elements in stream order
   * @throws InferenceException with type TIMEOUT if the stream did not end in time (the stream
   *     is cancelled), or the failure that ended the stream
   */
  public static <T> List<T> collect(Flow.Publisher<T> publisher, Duration timeout) {
    if (publisher == null) {
      throw new IllegalArgumentException("Publisher cannot be null");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
    }

    CompletableFuture<List<T>> result = new CompletableFuture<>();
    AtomicReference<Flow.Subscription> subscription = new AtomicReference<>();
    publisher.subscribe(new Flow.Subscriber<T>() {
      private final List<T> items = new ArrayList<>();

      @Override
      public void onSubscribe(Flow.Subscription s) {
        subscription.set(s);
        s.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(T item) {
        items.add(item);
      }

      @Override
      public void onError(Throwable throwable) {
        result.completeExceptionally(throwable);
      }

      @Override
      public void onComplete() {
        result.complete(List.copyOf(items));
      }
    });

    try {
      return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      cancel(subscription.get());
      throw new InferenceException("Stream did not complete within " + timeout.toMillis() + "ms",
          InferenceException.ErrorType.TIMEOUT, null, e);
    } catch (ExecutionException e) {
      throw propagate(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(subscription.get());
      throw new InferenceException("Interrupted while collecting stream",
          InferenceException.ErrorType.TRANSPORT, null, e);
    }
  }

  /**
   * Waits for a text stream to complete and concatenates its fragments.
   */
  public static String join(Flow.Publisher<String> publisher, Duration timeout) {
    return String.join("", collect(publisher, timeout));
  }

  /**
   * Pushes the fragments of a text stream to a callback.
   *
   * <p>The returned future completes with the full text after {@link TokenCallback#onComplete}
   * has run, or exceptionally after {@link TokenCallback#onError}. Cancelling the future cancels
   * the stream.
   *
   * @param publisher stream to read
   * @param callback receives fragments and the final outcome
   * @return future of the complete text
   */
  public static CompletableFuture<String> subscribe(Flow.Publisher<String> publisher, TokenCallback callback) {
    if (publisher == null) {
      throw new IllegalArgumentException("Publisher cannot be null");
    }
    if (callback == null) {
      throw new IllegalArgumentException("TokenCallback cannot be null");
    }

    CompletableFuture<String> done = new CompletableFuture<>();
    publisher.subscribe(new Flow.Subscriber<String>() {
      private final StringBuilder text = new StringBuilder();
      private Flow.Subscription subscription;
      private int position;

      @Override
      public void onSubscribe(Flow.Subscription s) {
        subscription = s;
        done.whenComplete((value, failure) -> {
          if (done.isCancelled()) {
            s.cancel();
          }
        });
        s.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(String fragment) {
        if (done.isDone()) {
          return;
        }
        try {
          callback.onToken(fragment, position);
        } catch (RuntimeException e) {
          logger.warn("Token callback failed at position {}, cancelling stream", position, e);
          subscription.cancel();
          fail(e);
          return;
        }
        text.append(fragment);
        position++;
      }

      @Override
      public void onError(Throwable throwable) {
        fail(throwable);
      }

      @Override
      public void onComplete() {
        if (done.isDone()) {
          return;
        }
        String result = text.toString();
        try {
          callback.onComplete(result, position);
        } catch (RuntimeException e) {
          logger.warn("Token callback failed on completion", e);
          fail(e);
          return;
        }
        done.complete(result);
      }

      private void fail(Throwable throwable) {
        if (done.isDone()) {
          return;
        }
        RuntimeException failure = propagate(throwable);
        callback.onError(failure);
        done.completeExceptionally(failure);
      }
    });
    return done;
  }

  /**
   * Returns a publisher that fails every subscriber immediately.
   */
  public static <T> Flow.Publisher<T> failed(Throwable failure) {
    if (failure == null) {
      throw new IllegalArgumentException("Failure cannot be null");
    }
    return subscriber -> {
      subscriber.onSubscribe(new Flow.Subscription() {
        @Override
        public void request(long n) {
          // Nothing to deliver
        }

        @Override
        public void cancel() {
          // Already terminated
        }
      });
      subscriber.onError(failure);
    };
  }

  /**
   * Converts a stream failure to the unchecked exception thrown to blocking consumers.
   */
  static RuntimeException propagate(Throwable failure) {
    if (failure instanceof RuntimeException) {
      return (RuntimeException) failure;
    }
    if (failure instanceof Error) {
      throw (Error) failure;
    }
    return new InferenceException("Stream failed: " + failure.getMessage(),
        InferenceException.ErrorType.REMOTE_INVOCATION, null, failure);
  }

  private static void cancel(Flow.Subscription subscription) {
    if (subscription != null) {
      subscription.cancel();
    }
  }
}
