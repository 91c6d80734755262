package com.badu.ai.isolate.worker;

import com.badu.ai.isolate.protocol.CallKind;
import com.badu.ai.isolate.protocol.Envelope;
import com.badu.ai.isolate.support.EndlessPublisher;
import com.badu.ai.isolate.support.FakeInferenceService;
import com.badu.ai.isolate.support.RecordingSendPort;
import com.badu.ai.isolate.transport.SendPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the worker at envelope level through a recording proxy port.
 */
class InferenceWorkerTest {

  private static final Duration QUIET = Duration.ofMillis(200);

  private FakeInferenceService engine;
  private RecordingSendPort proxyPort;
  private InferenceWorker worker;
  private SendPort workerPort;

  @BeforeEach
  void setUp() throws Exception {
    engine = new FakeInferenceService();
    proxyPort = new RecordingSendPort();
    worker = InferenceWorker.spawn(Envelope.bootstrap(proxyPort), () -> engine, "test-worker");

    Envelope bootstrapReply = proxyPort.next();
    assertTrue(bootstrapReply.isBootstrap());
    assertInstanceOf(SendPort.class, bootstrapReply.payload());
    workerPort = (SendPort) bootstrapReply.payload();
  }

  @AfterEach
  void tearDown() {
    worker.close();
  }

  @Test
  @DisplayName("Single-result call is answered by exactly one reply")
  void singleCall_repliesOnce() throws Exception {
    workerPort.send(Envelope.request(1, "embed", "hello"));

    Envelope reply = proxyPort.next();
    assertEquals(1, reply.correlationId());
    assertEquals("embed", reply.method());
    assertEquals(FakeInferenceService.HELLO_EMBEDDING, reply.payload());
    assertNull(reply.error());
    assertFalse(reply.done());
    assertNull(proxyPort.poll(QUIET));
  }

  @Test
  @DisplayName("Stream elements are followed by one done envelope and nothing else")
  void streamingCall_repliesElementsThenDone() throws Exception {
    workerPort.send(Envelope.request(2, "completion", "hi"));

    Envelope first = proxyPort.next();
    Envelope second = proxyPort.next();
    Envelope end = proxyPort.next();

    assertEquals("He", first.payload());
    assertEquals("llo", second.payload());
    assertTrue(end.done());
    assertNull(end.error());
    assertEquals(2, end.correlationId());
    assertNull(proxyPort.poll(QUIET));
  }

  @Test
  @DisplayName("Failing stream ends with an error envelope and no done envelope")
  void streamingCall_failure_repliesErrorWithoutDone() throws Exception {
    workerPort.send(Envelope.request(3, "completion", "fail"));

    Envelope element = proxyPort.next();
    Envelope failure = proxyPort.next();

    assertEquals("a", element.payload());
    assertFalse(failure.done());
    assertEquals("IllegalStateException: decoder crashed", failure.error());
    assertNull(proxyPort.poll(QUIET));
  }

  @Test
  @DisplayName("Unknown method fails only its own call")
  void unknownMethod_repliesError_workerKeepsServing() throws Exception {
    workerPort.send(Envelope.request(4, "foo", null));
    workerPort.send(Envelope.request(5, "embed", "hello"));

    Envelope failure = proxyPort.next();
    Envelope success = proxyPort.next();

    assertEquals(4, failure.correlationId());
    assertEquals("Unknown method: foo", failure.error());
    assertEquals(5, success.correlationId());
    assertEquals(FakeInferenceService.HELLO_EMBEDDING, success.payload());
  }

  @Test
  @DisplayName("Argument of the wrong type is reported to its own call")
  void argumentMismatch_repliesError() throws Exception {
    workerPort.send(Envelope.request(6, "embed", 42));

    Envelope failure = proxyPort.next();

    assertEquals(6, failure.correlationId());
    assertTrue(failure.error().contains("Argument type mismatch for embed"));
    assertTrue(failure.error().contains("Integer"));
  }

  @Test
  @DisplayName("Handler that throws synchronously produces an error reply")
  void synchronousThrow_repliesError() throws Exception {
    workerPort.send(Envelope.request(7, "setImage", null));

    Envelope failure = proxyPort.next();

    assertEquals("IllegalArgumentException: Image path cannot be null", failure.error());
  }

  @Test
  @DisplayName("Failed future produces an error reply with the root cause")
  void failedFuture_repliesError() throws Exception {
    workerPort.send(Envelope.request(8, "embed", "boom"));

    Envelope failure = proxyPort.next();

    assertEquals("IllegalStateException: embedding model not loaded", failure.error());
  }

  @Test
  @DisplayName("Engine Error is answered with an error reply")
  void engineError_repliesError_workerKeepsServing() throws Exception {
    workerPort.send(Envelope.request(20, "embed", "unlinked"));
    workerPort.send(Envelope.request(21, "embed", "hello"));

    Envelope failure = proxyPort.next();
    Envelope success = proxyPort.next();

    assertEquals(20, failure.correlationId());
    assertEquals("UnsatisfiedLinkError: no rwkv_mobile in java.library.path", failure.error());
    assertEquals(21, success.correlationId());
  }

  @Test
  @DisplayName("Publisher that fails on subscribe is answered with an error reply")
  void publisherSubscribeError_repliesError() throws Exception {
    workerPort.send(Envelope.request(22, "completion", "unlinked"));

    Envelope failure = proxyPort.next();

    assertEquals(22, failure.correlationId());
    assertEquals("NoSuchMethodError: rwkv_mobile.generate", failure.error());
    assertNull(proxyPort.poll(QUIET));

    CompletableFuture<Integer> count = new CompletableFuture<>();
    worker.receivePort().execute(() -> count.complete(worker.inFlightCount()));
    assertEquals(0, count.get(5, TimeUnit.SECONDS));
  }

  @Test
  @DisplayName("A slow call does not hold back a later one")
  void slowCall_doesNotBlockLaterCall() throws Exception {
    workerPort.send(Envelope.request(10, "embed", "slow"));
    workerPort.send(Envelope.request(11, "embed", "hello"));

    Envelope fast = proxyPort.next();
    assertEquals(11, fast.correlationId());

    engine.slowEmbedding().complete(List.of(9.0));
    Envelope slow = proxyPort.next();
    assertEquals(10, slow.correlationId());
    assertEquals(List.of(9.0), slow.payload());
  }

  @Test
  @DisplayName("Repeated bootstrap re-binds the reply port and keeps the registry")
  void repeatedBootstrap_rebindsReplyPort() throws Exception {
    RecordingSendPort secondProxy = new RecordingSendPort();
    workerPort.send(Envelope.bootstrap(secondProxy));

    Envelope reply = secondProxy.next();
    assertTrue(reply.isBootstrap());
    assertSame(workerPort, reply.payload());

    workerPort.send(Envelope.request(12, "embed", "hello"));
    Envelope answer = secondProxy.next();
    assertEquals(FakeInferenceService.HELLO_EMBEDDING, answer.payload());
    assertNull(proxyPort.poll(QUIET));
  }

  @Test
  @DisplayName("Cancelling a pending future cancels it in the engine")
  void cancel_pendingFuture_cancelsEngineFuture() throws Exception {
    workerPort.send(Envelope.request(13, "embed", "slow"));
    workerPort.send(Envelope.cancel(13));

    Envelope reply = proxyPort.next();
    assertEquals(13, reply.correlationId());
    assertEquals(InferenceWorker.CANCELLED_DESCRIPTION, reply.error());
    assertTrue(engine.slowEmbedding().isCancelled());
  }

  @Test
  @DisplayName("Cancelling a running stream cancels the engine publisher")
  void cancel_runningStream_cancelsPublisher() throws Exception {
    workerPort.send(Envelope.request(14, "completion", "endless"));
    assertEquals(EndlessPublisher.TICK, proxyPort.next().payload());

    workerPort.send(Envelope.cancel(14));

    Envelope reply = proxyPort.next();
    assertEquals(InferenceWorker.CANCELLED_DESCRIPTION, reply.error());
    assertTrue(engine.endless().awaitCancelled(Duration.ofSeconds(5)));
    assertNull(proxyPort.poll(QUIET));
  }

  @Test
  @DisplayName("Cancellation of an unknown call is ignored")
  void cancel_unknownCall_isIgnored() throws Exception {
    workerPort.send(Envelope.cancel(99));
    workerPort.send(Envelope.request(15, "embed", "hello"));

    assertEquals(15, proxyPort.next().correlationId());
  }

  @Test
  @DisplayName("In-flight table is empty once every call has finished")
  void inFlight_emptyAfterCompletion() throws Exception {
    workerPort.send(Envelope.request(16, "completion", "hi"));
    proxyPort.next();
    proxyPort.next();
    proxyPort.next();

    CompletableFuture<Integer> count = new CompletableFuture<>();
    worker.receivePort().execute(() -> count.complete(worker.inFlightCount()));
    assertEquals(0, count.get(5, TimeUnit.SECONDS));
  }

  @Test
  @DisplayName("Service factory failure is reported through the bootstrap reply")
  void spawn_factoryThrows_repliesBootstrapError() throws Exception {
    RecordingSendPort port = new RecordingSendPort();
    InferenceWorker failed = InferenceWorker.spawn(Envelope.bootstrap(port), () -> {
      throw new IllegalStateException("no native library");
    }, "failing-worker");

    Envelope reply = port.next();
    assertTrue(reply.isBootstrap());
    assertTrue(reply.hasError());
    assertTrue(reply.error().contains("Worker spawn failed"));
    assertTrue(reply.error().contains("no native library"));
    failed.close();
  }

  @Test
  @DisplayName("Service factory Error is reported through the bootstrap reply")
  void spawn_factoryThrowsError_repliesBootstrapError() throws Exception {
    RecordingSendPort port = new RecordingSendPort();
    InferenceWorker failed = InferenceWorker.spawn(Envelope.bootstrap(port), () -> {
      throw new UnsatisfiedLinkError("no rwkv_mobile in java.library.path");
    }, "unlinked-worker");

    Envelope reply = port.next();
    assertTrue(reply.isBootstrap());
    assertTrue(reply.error().contains("UnsatisfiedLinkError"));
    failed.close();
  }

  @Test
  @DisplayName("Handlers may return immediate values")
  void spawnWithRegistry_immediateValue_repliesDirectly() throws Exception {
    RecordingSendPort port = new RecordingSendPort();
    MethodRegistry registry = MethodRegistry.builder()
        .bindHandler("echo", CallKind.SINGLE, argument -> argument)
        .build();
    InferenceWorker echo = InferenceWorker.spawnWithRegistry(Envelope.bootstrap(port), () -> registry, "echo-worker");
    SendPort echoPort = (SendPort) port.next().payload();

    echoPort.send(Envelope.request(1, "echo", "ping"));

    assertEquals("ping", port.next().payload());
    echo.close();
  }

  @Test
  @DisplayName("Spawn requires a bootstrap envelope carrying a send port")
  void spawn_withoutBootstrap_throwsException() {
    assertThrows(IllegalArgumentException.class,
        () -> InferenceWorker.spawn(Envelope.request(1, "init", null), FakeInferenceService::new, "w"));
  }

  @Test
  @DisplayName("Failure description uses the root cause")
  void describe_unwrapsCompletionException() {
    Exception wrapped = new CompletionException(new IllegalStateException("inner"));

    assertEquals("IllegalStateException: inner", InferenceWorker.describe(wrapped));
    assertEquals("UnsupportedOperationException", InferenceWorker.describe(new UnsupportedOperationException()));
  }
}
