package io.firewatch.client;

import java.util.concurrent.Executor;

/**
 * The {@link ExecutorGroup} chooses the {@link Executor} each new watch processes its events and delivers its
 * snapshots on. Work for one watch is serialized on top of the chosen executor.
 */
public interface ExecutorGroup {
  /**
   * Returns the executor for the next watch.
   */
  Executor next();
}
