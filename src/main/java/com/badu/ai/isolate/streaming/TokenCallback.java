package com.badu.ai.isolate.streaming;

/**
 * Callback interface for consuming a generation stream fragment by fragment.
 *
 * <p>Allows progressive display of generated text as fragments arrive from the worker, instead
 * of waiting for the whole completion.
 *
 * <p>Usage example:
 * <pre>{@code
 * TokenCallback callback = new TokenCallback() {
 *   @Override
 *   public void onToken(String fragment, int position) {
 *     System.out.print(fragment); // Progressive display
 *   }
 *
 *   @Override
 *   public void onComplete(String text, int fragmentCount) {
 *     System.out.println("\nComplete! " + fragmentCount + " fragments");
 *   }
 *
 *   @Override
 *   public void onError(Exception e) {
 *     System.err.println("Error: " + e.getMessage());
 *   }
 * };
 *
 * TokenStreams.subscribe(service.completion("Once upon a time"), callback);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Callbacks are invoked sequentially from the proxy loop thread.
 * Implementations should avoid blocking operations, every other reply of the same proxy waits
 * behind them.
 *
 * <p><b>Error Handling:</b> If {@link #onToken} throws, the stream is cancelled and
 * {@link #onError(Exception)} is invoked with the exception.
 *
 * @see TokenStreams#subscribe(java.util.concurrent.Flow.Publisher, TokenCallback)
 */
public interface TokenCallback {

  /**
   * Called for each fragment of generated text, in stream order.
   *
   * @param fragment the text fragment (may be empty)
   * @param position zero-based position of the fragment in the stream
   */
  void onToken(String fragment, int position);

  /**
   * Called when the stream completes successfully.
   *
   * <p><b>Consistency Guarantee:</b> {@code text} is the concatenation of all fragments passed
   * to {@link #onToken}.
   *
   * @param text the complete generated text
   * @param fragmentCount number of fragments delivered
   */
  void onComplete(String text, int fragmentCount);

  /**
   * Called when the stream fails: engine error on the worker, cancellation, closed service, or
   * an exception thrown by {@link #onToken}.
   *
   * <p>After {@code onError()} is called, no further callbacks will be invoked.
   *
   * @param e the exception that ended the stream
   */
  void onError(Exception e);
}
