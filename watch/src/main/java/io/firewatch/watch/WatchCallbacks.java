package io.firewatch.watch;

import io.firewatch.model.DocumentChange;
import io.grpc.Status;
import java.util.List;
import javax.annotation.Nullable;

/**
 * {@code WatchCallbacks} defines the lifecycle hooks of a {@link Watch}. The callbacks give consumers the opportunity
 * to add their own application-specific logs/metrics. They run on the watch's delivery executor and must not block.
 */
public interface WatchCallbacks {

  WatchCallbacks NOOP = new WatchCallbacks() {
  };

  /**
   * {@code onStreamOpen} is called each time a listen stream is opened for a watch, including reconnects.
   *
   * @param watchId an ID for the watch that is unique within this process
   */
  default void onStreamOpen(long watchId) {

  }

  /**
   * {@code onStreamRetry} is called when a listen stream failed with a retryable error and is about to be reopened.
   *
   * @param watchId an ID for the watch that is unique within this process
   * @param status  the status the stream failed with
   */
  default void onStreamRetry(long watchId, Status status) {

  }

  /**
   * {@code onSnapshot} is called just before a snapshot is delivered to the listener.
   *
   * @param watchId an ID for the watch that is unique within this process
   * @param size    the number of documents in the snapshot
   * @param changes the changes relative to the previous snapshot
   */
  default void onSnapshot(long watchId, int size, List<DocumentChange> changes) {

  }

  /**
   * {@code onClose} is called once when the watch stops.
   *
   * @param watchId an ID for the watch that is unique within this process
   * @param error   the terminal error, or {@code null} if the watch was cancelled
   */
  default void onClose(long watchId, @Nullable Throwable error) {

  }
}
