package io.firewatch.watch;

import com.google.firestore.v1.Target;

/**
 * {@code ListenStream} is the outbound side of an open listen stream.
 */
public interface ListenStream {

  /**
   * Asks the server to start listening to the given target.
   */
  void addTarget(Target target);

  /**
   * Asks the server to stop listening to the target with the given id.
   */
  void removeTarget(int targetId);

  /**
   * Closes the stream. No events are delivered to the observer once the stream is closed. Closing a stream that is
   * already closed is a no-op.
   */
  void close();
}
