package io.firewatch.client;

import io.firewatch.watch.WatchException;

/**
 * Receives the snapshots of a listen registered with a {@link WatchClient}.
 *
 * @param <T> the snapshot type
 */
public interface SnapshotListener<T> {

  /**
   * Called with every new consistent snapshot. Calls for one listen never overlap.
   */
  void onSnapshot(T snapshot);

  /**
   * Called at most once, when the listen stops because of an error. No snapshot follows.
   */
  void onError(WatchException error);
}
