package io.firewatch.watch;

/**
 * {@code ListenStreamObserver} receives the inbound side of a listen stream. After {@link #onError} or
 * {@link #onCompleted} no further calls are made.
 */
public interface ListenStreamObserver {

  void onEvent(ListenEvent event);

  void onError(Throwable error);

  void onCompleted();
}
