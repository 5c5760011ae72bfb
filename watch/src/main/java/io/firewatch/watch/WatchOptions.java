package io.firewatch.watch;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * {@code WatchOptions} holds the collaborators and settings shared by the watches of a client.
 */
@AutoValue
public abstract class WatchOptions {

  /**
   * Returns a builder with a direct executor, the shared reconnect scheduler, the default backoff and no callbacks.
   */
  public static Builder builder() {
    return new AutoValue_WatchOptions.Builder()
        .executor(MoreExecutors.directExecutor())
        .scheduler(SharedScheduler.INSTANCE)
        .backoffSettings(BackoffSettings.defaults())
        .callbacks(WatchCallbacks.NOOP);
  }

  public static WatchOptions defaults() {
    return builder().build();
  }

  /**
   * Returns the executor events are processed and snapshots are delivered on. Work for a single watch is serialized
   * on top of it.
   */
  public abstract Executor executor();

  /**
   * Returns the scheduler used to delay reconnect attempts.
   */
  public abstract ScheduledExecutorService scheduler();

  public abstract BackoffSettings backoffSettings();

  public abstract WatchCallbacks callbacks();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder executor(Executor executor);

    public abstract Builder scheduler(ScheduledExecutorService scheduler);

    public abstract Builder backoffSettings(BackoffSettings backoffSettings);

    public abstract Builder callbacks(WatchCallbacks callbacks);

    public abstract WatchOptions build();
  }

  private static final class SharedScheduler {
    static final ScheduledExecutorService INSTANCE = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("firewatch-reconnect-%d")
            .build());
  }
}
