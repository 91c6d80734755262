package com.badu.ai.isolate.config;

import java.util.List;

/**
 * Two embedding vectors to score against each other.
 *
 * @param a first vector
 * @param b second vector
 */
public record SimilarityParams(List<Double> a, List<Double> b) {

  /**
   * Creates SimilarityParams holding immutable copies of both vectors.
   */
  public SimilarityParams {
    if (a == null || b == null) {
      throw new IllegalArgumentException("Similarity vectors cannot be null");
    }
    a = List.copyOf(a);
    b = List.copyOf(b);
  }
}
