package com.badu.ai.isolate.config;

import com.badu.ai.isolate.InferenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BridgeConfigParser.
 */
class BridgeConfigParserTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("Parses all recognised keys from a file")
  void parse_file_readsAllKeys() throws IOException {
    Path file = tempDir.resolve("bridge.json");
    Files.writeString(file, "{\n"
        + "  \"handshake_timeout_ms\": 30000,\n"
        + "  \"max_in_flight_calls\": 32,\n"
        + "  \"worker_name\": \"llm-worker\",\n"
        + "  \"proxy_name\": \"llm-proxy\"\n"
        + "}");

    BridgeConfig config = BridgeConfigParser.parse(file);

    assertEquals(30_000L, config.getHandshakeTimeoutMs());
    assertEquals(32, config.getMaxInFlightCalls());
    assertEquals("llm-worker", config.getWorkerName());
    assertEquals("llm-proxy", config.getProxyName());
  }

  @Test
  @DisplayName("Missing keys keep their defaults")
  void parse_partialObject_keepsDefaults() {
    BridgeConfig config = BridgeConfigParser.parse("{\"max_in_flight_calls\": 8}");

    assertEquals(8, config.getMaxInFlightCalls());
    assertEquals(BridgeConfig.DEFAULT.getHandshakeTimeoutMs(), config.getHandshakeTimeoutMs());
    assertEquals(BridgeConfig.DEFAULT.getWorkerName(), config.getWorkerName());
  }

  @Test
  @DisplayName("Unknown keys are ignored")
  void parse_unknownKey_isIgnored() {
    BridgeConfig config = BridgeConfigParser.parse("{\"handshake_timeout_ms\": 500, \"retries\": 3}");

    assertEquals(500L, config.getHandshakeTimeoutMs());
  }

  @Test
  @DisplayName("Missing file is an IOException")
  void parse_missingFile_throwsIOException() {
    IOException exception = assertThrows(IOException.class,
        () -> BridgeConfigParser.parse(tempDir.resolve("absent.json")));

    assertTrue(exception.getMessage().contains("does not exist"));
  }

  @Test
  @DisplayName("Value of the wrong type is a configuration error")
  void parse_wrongType_throwsConfigurationError() {
    InferenceException exception = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("{\"max_in_flight_calls\": \"many\"}"));

    assertEquals(InferenceException.ErrorType.CONFIGURATION, exception.getErrorType());
    assertTrue(exception.getMessage().contains("max_in_flight_calls"));
    assertTrue(exception.getMessage().contains("must be an integer"));
  }

  @Test
  @DisplayName("Out-of-range value is a configuration error")
  void parse_outOfRange_throwsConfigurationError() {
    InferenceException exception = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("{\"handshake_timeout_ms\": 0}"));

    assertEquals(InferenceException.ErrorType.CONFIGURATION, exception.getErrorType());
    assertInstanceOf(IllegalStateException.class, exception.getCause());
  }

  @Test
  @DisplayName("Integers beyond the field's range are configuration errors")
  void parse_integerOverflow_throwsConfigurationError() {
    InferenceException inFlight = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("{\"max_in_flight_calls\": 4294967297}"));
    InferenceException timeout = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("{\"handshake_timeout_ms\": 18446744073709551617}"));

    assertEquals(InferenceException.ErrorType.CONFIGURATION, inFlight.getErrorType());
    assertTrue(inFlight.getMessage().contains("out of integer range"));
    assertEquals(InferenceException.ErrorType.CONFIGURATION, timeout.getErrorType());
    assertTrue(timeout.getMessage().contains("out of long range"));
  }

  @Test
  @DisplayName("Malformed JSON and non-object roots are configuration errors")
  void parse_invalidJson_throwsConfigurationError() {
    InferenceException malformed = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("{\"handshake_timeout_ms\": "));
    InferenceException array = assertThrows(InferenceException.class,
        () -> BridgeConfigParser.parse("[1, 2]"));

    assertEquals(InferenceException.ErrorType.CONFIGURATION, malformed.getErrorType());
    assertEquals(InferenceException.ErrorType.CONFIGURATION, array.getErrorType());
  }
}
