package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable configuration of the proxy/worker bridge.
 *
 * <p>Controls how long the proxy waits for the worker to come up, how many calls may be in
 * flight at once, and the names of the two event loop threads.
 *
 * <p>Builder pattern usage:
 * <pre>{@code
 * BridgeConfig config = BridgeConfig.builder()
 *     .handshakeTimeoutMs(30_000)
 *     .maxInFlightCalls(32)
 *     .build();
 * }</pre>
 *
 * @see BridgeConfigParser
 */
@Value
@Builder
public class BridgeConfig {

  /**
   * Default bridge configuration.
   * handshakeTimeoutMs: 10000, maxInFlightCalls: 256
   */
  public static final BridgeConfig DEFAULT = builder().build();

  /**
   * Maximum time to wait for the worker's bootstrap reply.
   * Range: [1, 600000]
   * Default: 10000
   */
  @Builder.Default
  long handshakeTimeoutMs = 10_000L;

  /**
   * Maximum number of calls awaiting their terminal reply. Further calls are rejected.
   * Range: [1, 65536]
   * Default: 256
   */
  @Builder.Default
  int maxInFlightCalls = 256;

  /**
   * Name of the worker event loop thread.
   * Default: "inference-worker"
   */
  @Builder.Default
  String workerName = "inference-worker";

  /**
   * Name of the proxy event loop thread.
   * Default: "inference-proxy"
   */
  @Builder.Default
  String proxyName = "inference-proxy";

  /**
   * Custom builder with validation logic.
   */
  public static class BridgeConfigBuilder {
    /**
     * Builds the BridgeConfig with validation.
     *
     * @return validated BridgeConfig instance
     * @throws IllegalStateException if validation fails
     */
    public BridgeConfig build() {
      if (!this.handshakeTimeoutMs$set) {
        this.handshakeTimeoutMs$value = 10_000L;
        this.handshakeTimeoutMs$set = true;
      }
      if (!this.maxInFlightCalls$set) {
        this.maxInFlightCalls$value = 256;
        this.maxInFlightCalls$set = true;
      }
      if (!this.workerName$set) {
        this.workerName$value = "inference-worker";
        this.workerName$set = true;
      }
      if (!this.proxyName$set) {
        this.proxyName$value = "inference-proxy";
        this.proxyName$set = true;
      }

      if (this.handshakeTimeoutMs$value < 1 || this.handshakeTimeoutMs$value > 600_000) {
        throw new IllegalStateException(
            "handshakeTimeoutMs must be in range [1, 600000], got: " + this.handshakeTimeoutMs$value);
      }

      if (this.maxInFlightCalls$value < 1 || this.maxInFlightCalls$value > 65_536) {
        throw new IllegalStateException(
            "maxInFlightCalls must be in range [1, 65536], got: " + this.maxInFlightCalls$value);
      }

      if (this.workerName$value == null || this.workerName$value.trim().isEmpty()) {
        throw new IllegalStateException("workerName cannot be null or empty");
      }

      if (this.proxyName$value == null || this.proxyName$value.trim().isEmpty()) {
        throw new IllegalStateException("proxyName cannot be null or empty");
      }

      if (this.workerName$value.equals(this.proxyName$value)) {
        throw new IllegalStateException(
            "workerName and proxyName must differ, both are: " + this.workerName$value);
      }

      return new BridgeConfig(this.handshakeTimeoutMs$value, this.maxInFlightCalls$value,
          this.workerName$value, this.proxyName$value);
    }
  }

  /**
   * Gets the handshake timeout as a duration.
   *
   * @return handshake timeout
   */
  public Duration getHandshakeTimeout() {
    return Duration.ofMillis(handshakeTimeoutMs);
  }
}
