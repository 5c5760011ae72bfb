package io.firewatch.watch;

/**
 * Handle returned by a subscription. Removing it stops the listener.
 */
public interface ListenerRegistration {

  /**
   * Stops the subscription. No snapshot or error is delivered after this method returns, except for a callback that
   * is already running. Calling it more than once is a no-op.
   */
  void remove();
}
