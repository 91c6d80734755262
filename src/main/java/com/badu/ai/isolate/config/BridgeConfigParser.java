package com.badu.ai.isolate.config;

import com.badu.ai.isolate.InferenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;

/**
 * Parses a bridge configuration JSON file into a {@link BridgeConfig}.
 *
 * <p>Recognised keys (all optional, missing keys keep the {@link BridgeConfig} default):
 * <ul>
 *   <li>"handshake_timeout_ms" - integer</li>
 *   <li>"max_in_flight_calls" - integer</li>
 *   <li>"worker_name" - string</li>
 *   <li>"proxy_name" - string</li>
 * </ul>
 * Unknown keys are ignored with a warning.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // bridge.json: {"handshake_timeout_ms": 30000, "max_in_flight_calls": 32}
 * BridgeConfig config = BridgeConfigParser.parse(Paths.get("config/bridge.json"));
 * }</pre>
 */
public class BridgeConfigParser {
  private static final Logger logger = LoggerFactory.getLogger(BridgeConfigParser.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final Set<String> KNOWN_KEYS =
      Set.of("handshake_timeout_ms", "max_in_flight_calls", "worker_name", "proxy_name");

  private BridgeConfigParser() {
  }

  /**
   * Reads and parses a bridge configuration file.
   *
   * @param configPath path to the JSON file
   * @return validated bridge configuration
   * @throws IOException if the file cannot be read or is not valid JSON
   * @throws InferenceException of type CONFIGURATION if a value has the wrong type or range
   */
  public static BridgeConfig parse(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      throw new IOException("Config file does not exist: " + configPath);
    }

    String jsonContent = Files.readString(configPath);
    BridgeConfig config = parse(MAPPER.readTree(jsonContent));
    logger.debug("Parsed bridge config from: {}", configPath);
    return config;
  }

  /**
   * Parses a bridge configuration from JSON text.
   *
   * @param json JSON object text
   * @return validated bridge configuration
   * @throws InferenceException of type CONFIGURATION if the text is not a valid configuration
   */
  public static BridgeConfig parse(String json) {
    try {
      return parse(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new InferenceException("Bridge config is not valid JSON: " + e.getOriginalMessage(),
          InferenceException.ErrorType.CONFIGURATION, null, e);
    }
  }

  private static BridgeConfig parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new InferenceException("Bridge config must be a JSON object",
          InferenceException.ErrorType.CONFIGURATION);
    }

    Iterator<String> names = root.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!KNOWN_KEYS.contains(name)) {
        logger.warn("Ignoring unknown bridge config key: {}", name);
      }
    }

    BridgeConfig.BridgeConfigBuilder builder = BridgeConfig.builder();

    if (root.has("handshake_timeout_ms")) {
      builder.handshakeTimeoutMs(requireLong(root, "handshake_timeout_ms"));
    }
    if (root.has("max_in_flight_calls")) {
      builder.maxInFlightCalls(requireInt(root, "max_in_flight_calls"));
    }
    if (root.has("worker_name")) {
      builder.workerName(requireText(root, "worker_name"));
    }
    if (root.has("proxy_name")) {
      builder.proxyName(requireText(root, "proxy_name"));
    }

    try {
      return builder.build();
    } catch (IllegalStateException e) {
      throw new InferenceException("Invalid bridge config: " + e.getMessage(),
          InferenceException.ErrorType.CONFIGURATION, null, e);
    }
  }

  private static JsonNode requireInteger(JsonNode root, String key) {
    JsonNode node = root.get(key);
    if (!node.isIntegralNumber()) {
      throw new InferenceException("Bridge config key '" + key + "' must be an integer, got: " + node,
          InferenceException.ErrorType.CONFIGURATION);
    }
    return node;
  }

  private static int requireInt(JsonNode root, String key) {
    JsonNode node = requireInteger(root, key);
    if (!node.canConvertToInt()) {
      throw new InferenceException("Bridge config key '" + key + "' is out of integer range: " + node,
          InferenceException.ErrorType.CONFIGURATION);
    }
    return node.intValue();
  }

  private static long requireLong(JsonNode root, String key) {
    JsonNode node = requireInteger(root, key);
    if (!node.canConvertToLong()) {
      throw new InferenceException("Bridge config key '" + key + "' is out of long range: " + node,
          InferenceException.ErrorType.CONFIGURATION);
    }
    return node.longValue();
  }

  private static String requireText(JsonNode root, String key) {
    JsonNode node = root.get(key);
    if (!node.isTextual()) {
      throw new InferenceException("Bridge config key '" + key + "' must be a string, got: " + node,
          InferenceException.ErrorType.CONFIGURATION);
    }
    return node.asText();
  }
}
