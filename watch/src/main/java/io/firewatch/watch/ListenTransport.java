package io.firewatch.watch;

/**
 * {@code ListenTransport} opens listen streams to the backend.
 */
public interface ListenTransport {

  /**
   * Opens a new listen stream. Events received on the stream are passed to {@code observer} in arrival order.
   *
   * @param observer receives the events, the error or the completion of the stream
   * @return the outbound side of the stream
   * @throws RuntimeException if the stream cannot be opened
   */
  ListenStream openStream(ListenStreamObserver observer);
}
