package com.badu.ai.isolate.config;

/**
 * Log level the engine's native library is initialized with.
 */
public enum LogLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR
}
