package com.badu.ai.isolate.config;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link com.badu.ai.isolate.InferenceService#init(InitOptions)}.
 */
@Value
@Builder
public class InitOptions {

  /** Default options: library from the system search path, DEBUG logging. */
  public static final InitOptions DEFAULT = builder().build();

  /**
   * Directory holding the engine's dynamic libraries.
   * Default: null (use the platform library search path)
   */
  String dynamicLibDir;

  /**
   * Log level of the native library.
   * Default: DEBUG
   */
  @Builder.Default
  LogLevel logLevel = LogLevel.DEBUG;
}
