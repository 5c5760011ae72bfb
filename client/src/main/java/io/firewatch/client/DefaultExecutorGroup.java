package io.firewatch.client;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of {@link ExecutorGroup} which hands out its executors in round-robin order. Without
 * executors it always returns {@link MoreExecutors#directExecutor}, so watches run on the gRPC threads that deliver
 * their responses.
 */
public class DefaultExecutorGroup implements ExecutorGroup {

  private final ImmutableList<Executor> executors;
  private final AtomicInteger nextIndex = new AtomicInteger();

  public DefaultExecutorGroup() {
    this(ImmutableList.of(MoreExecutors.directExecutor()));
  }

  public DefaultExecutorGroup(List<? extends Executor> executors) {
    checkArgument(!executors.isEmpty(), "an executor group needs at least one executor");
    this.executors = ImmutableList.copyOf(executors);
  }

  /**
   * Returns the next {@link Executor} to use.
   */
  @Override
  public Executor next() {
    return executors.get(Math.floorMod(nextIndex.getAndIncrement(), executors.size()));
  }
}
