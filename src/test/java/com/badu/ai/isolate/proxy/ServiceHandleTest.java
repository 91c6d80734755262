package com.badu.ai.isolate.proxy;

import com.badu.ai.isolate.InferenceException;
import com.badu.ai.isolate.config.BridgeConfig;
import com.badu.ai.isolate.protocol.Operation;
import com.badu.ai.isolate.support.EndlessPublisher;
import com.badu.ai.isolate.support.FakeInferenceService;
import com.badu.ai.isolate.support.RecordingSubscriber;
import com.badu.ai.isolate.worker.InferenceWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ServiceHandle call routing and the remote stream publisher.
 */
class ServiceHandleTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private FakeInferenceService engine;
  private ServiceHandle handle;

  @BeforeEach
  void setUp() throws Exception {
    engine = new FakeInferenceService();
    handle = ServiceHandle.open(
        bootstrap -> InferenceWorker.spawn(bootstrap, () -> engine, "handle-test-worker"),
        BridgeConfig.builder().proxyName("handle-test-proxy").build()).get(5, TimeUnit.SECONDS);
  }

  @AfterEach
  void tearDown() {
    handle.close();
  }

  @Test
  @DisplayName("Typed call decodes the reply payload")
  void call_decodesResult() throws Exception {
    List<Double> vector = handle.call(Operation.EMBED, "hello").get(5, TimeUnit.SECONDS);

    assertEquals(List.of(0.1, 0.2), vector);
    assertEquals(0, handle.inFlightCount());
  }

  @Test
  @DisplayName("Streaming operation cannot be called as single-result")
  void call_streamingOperation_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> handle.call(Operation.COMPLETION, "hi"));
    assertThrows(IllegalArgumentException.class, () -> handle.stream(Operation.EMBED, "hello"));
  }

  @Test
  @DisplayName("Control identifiers cannot be requested")
  void request_reservedIdentifier_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> handle.request("$cancel", null));
  }

  @Test
  @DisplayName("Nothing is sent until the stream is subscribed")
  void stream_isLazy() throws Exception {
    Flow.Publisher<String> publisher = handle.stream(Operation.COMPLETION, "hi");
    Thread.sleep(100);
    assertFalse(engine.calls().contains("completion"));

    RecordingSubscriber<String> subscriber = RecordingSubscriber.unbounded();
    publisher.subscribe(subscriber);

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    assertEquals(List.of("He", "llo"), subscriber.items());
    assertTrue(subscriber.isCompleted());
  }

  @Test
  @DisplayName("Elements are held back until the subscriber requests them")
  void stream_honoursDemand() throws Exception {
    RecordingSubscriber<String> subscriber = new RecordingSubscriber<>(1);
    handle.stream(Operation.COMPLETION, "hi").subscribe(subscriber);

    assertTrue(subscriber.awaitItems(1, TIMEOUT));
    Thread.sleep(100);
    assertEquals(List.of("He"), subscriber.items());
    assertFalse(subscriber.isCompleted());

    subscriber.request(1);

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    assertEquals(List.of("He", "llo"), subscriber.items());
    assertTrue(subscriber.isCompleted());
  }

  @Test
  @DisplayName("Second subscriber is rejected")
  void stream_secondSubscriber_receivesError() throws Exception {
    Flow.Publisher<String> publisher = handle.stream(Operation.COMPLETION, "hi");
    publisher.subscribe(RecordingSubscriber.unbounded());

    RecordingSubscriber<String> second = RecordingSubscriber.unbounded();
    publisher.subscribe(second);

    assertTrue(second.awaitTermination(TIMEOUT));
    assertInstanceOf(IllegalStateException.class, second.error());
  }

  @Test
  @DisplayName("Non-positive request ends the stream with an error")
  void stream_nonPositiveRequest_signalsError() throws Exception {
    RecordingSubscriber<String> subscriber = new RecordingSubscriber<>(0);
    handle.stream(Operation.COMPLETION, "endless").subscribe(subscriber);

    subscriber.request(0);

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    assertInstanceOf(IllegalArgumentException.class, subscriber.error());
  }

  @Test
  @DisplayName("Cancelling the subscription stops the remote stream")
  void stream_cancel_stopsRemoteStream() throws Exception {
    RecordingSubscriber<String> subscriber = RecordingSubscriber.unbounded();
    handle.stream(Operation.COMPLETION, "endless").subscribe(subscriber);
    assertTrue(subscriber.awaitItems(1, TIMEOUT));

    subscriber.cancel();

    assertTrue(engine.endless().awaitCancelled(TIMEOUT));
    assertEquals(List.of(EndlessPublisher.TICK), subscriber.items());
    assertNull(subscriber.error());
  }

  @Test
  @DisplayName("Closing the handle fails an open stream with a transport error")
  void close_failsOpenStream() throws Exception {
    RecordingSubscriber<String> subscriber = RecordingSubscriber.unbounded();
    handle.stream(Operation.COMPLETION, "endless").subscribe(subscriber);
    assertTrue(subscriber.awaitItems(1, TIMEOUT));

    handle.close();

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    InferenceException failure = assertInstanceOf(InferenceException.class, subscriber.error());
    assertEquals(InferenceException.ErrorType.TRANSPORT, failure.getErrorType());
    assertTrue(handle.isClosed());
  }

  @Test
  @DisplayName("Stream subscribed while close is queued ends with a transport error")
  void close_racingSubscribe_failsStream() throws Exception {
    Flow.Publisher<String> publisher = handle.stream(Operation.COMPLETION, "hi");
    CountDownLatch blocker = new CountDownLatch(1);
    handle.runOnLoop(() -> {
      try {
        blocker.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });

    RecordingSubscriber<String> subscriber = RecordingSubscriber.unbounded();
    publisher.subscribe(subscriber);
    handle.close();
    blocker.countDown();

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    InferenceException failure = assertInstanceOf(InferenceException.class, subscriber.error());
    assertEquals(InferenceException.ErrorType.TRANSPORT, failure.getErrorType());
    assertEquals(List.of(), subscriber.items());
  }

  @Test
  @DisplayName("Stream subscribed after close fails immediately")
  void close_thenSubscribe_failsStream() throws Exception {
    Flow.Publisher<String> publisher = handle.stream(Operation.COMPLETION, "hi");
    handle.close();

    RecordingSubscriber<String> subscriber = RecordingSubscriber.unbounded();
    publisher.subscribe(subscriber);

    assertTrue(subscriber.awaitTermination(TIMEOUT));
    InferenceException failure = assertInstanceOf(InferenceException.class, subscriber.error());
    assertEquals(InferenceException.ErrorType.TRANSPORT, failure.getErrorType());
    assertFalse(engine.calls().contains("completion"));
  }

  @Test
  @DisplayName("Launcher failure fails the handshake")
  void open_launcherThrows_failsWithHandshakeError() {
    CompletionException exception = assertThrows(CompletionException.class,
        () -> ServiceHandle.open(bootstrap -> {
          throw new IllegalStateException("cannot start thread");
        }, BridgeConfig.DEFAULT).join());

    InferenceException cause = assertInstanceOf(InferenceException.class, exception.getCause());
    assertEquals(InferenceException.ErrorType.HANDSHAKE, cause.getErrorType());
    assertTrue(cause.getMessage().contains("cannot start thread"));
  }
}
