package com.badu.ai.isolate.config;

import com.badu.ai.isolate.InferenceException;

import java.util.Locale;

/**
 * Inference backend the engine loads the model with.
 *
 * <p>Backends differ in platform support and in the model sizes they suit:
 * <ul>
 *   <li><b>NCNN</b>: Android, Windows, Linux. Suited to small models, not to large chat models</li>
 *   <li><b>LLAMA_CPP</b>: Android, Windows, Linux, macOS. General llama-style backend</li>
 *   <li><b>WEB_RWKV</b>: dedicated WebGPU backend (iOS, macOS)</li>
 *   <li><b>QNN</b>: Qualcomm Neural Network</li>
 *   <li><b>MNN</b>: generic alternate backend</li>
 *   <li><b>COREML</b>: Apple CoreML</li>
 * </ul>
 *
 * @see RuntimeOptions
 */
public enum Backend {
  NCNN("ncnn"),
  LLAMA_CPP("llama.cpp"),
  WEB_RWKV("web-rwkv"),
  QNN("qnn"),
  MNN("mnn"),
  COREML("coreml");

  private final String argument;

  Backend(String argument) {
    this.argument = argument;
  }

  /**
   * Gets the backend name as the engine expects it on its command line.
   *
   * @return backend argument, e.g. "llama.cpp"
   */
  public String asArgument() {
    return argument;
  }

  /**
   * Parses a free-form backend name.
   *
   * <p>Matching is case-insensitive and by substring, checked in this order: "ncnn",
   * "web" together with "rwkv", "llama", "qnn", "mnn", "coreml". So "NCNN-int8" is
   * {@link #NCNN} and "web-rwkv" is {@link #WEB_RWKV}.
   *
   * @param value backend name
   * @return matching backend
   * @throws InferenceException of type CONFIGURATION if nothing matches
   */
  public static Backend fromString(String value) {
    if (value == null) {
      throw new InferenceException("Unknown backend: null", InferenceException.ErrorType.CONFIGURATION);
    }

    String lower = value.toLowerCase(Locale.ROOT);
    if (lower.contains("ncnn")) {
      return NCNN;
    }
    if (lower.contains("web") && lower.contains("rwkv")) {
      return WEB_RWKV;
    }
    if (lower.contains("llama")) {
      return LLAMA_CPP;
    }
    if (lower.contains("qnn")) {
      return QNN;
    }
    if (lower.contains("mnn")) {
      return MNN;
    }
    if (lower.contains("coreml")) {
      return COREML;
    }

    throw new InferenceException("Unknown backend: " + value,
        InferenceException.ErrorType.CONFIGURATION,
        "Use one of: ncnn, llama.cpp, web-rwkv, qnn, mnn, coreml", null);
  }
}
