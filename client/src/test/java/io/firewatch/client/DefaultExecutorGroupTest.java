package io.firewatch.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.Executor;
import org.junit.Test;

public class DefaultExecutorGroupTest {

  @Test
  public void defaultsToDirectExecutor() {
    DefaultExecutorGroup group = new DefaultExecutorGroup();

    assertThat(group.next()).isSameAs(MoreExecutors.directExecutor());
    assertThat(group.next()).isSameAs(MoreExecutors.directExecutor());
  }

  @Test
  public void handsOutExecutorsInRoundRobinOrder() {
    Executor first = Runnable::run;
    Executor second = Runnable::run;
    DefaultExecutorGroup group = new DefaultExecutorGroup(ImmutableList.of(first, second));

    assertThat(group.next()).isSameAs(first);
    assertThat(group.next()).isSameAs(second);
    assertThat(group.next()).isSameAs(first);
  }

  @Test
  public void rejectsEmptyGroup() {
    assertThatThrownBy(() -> new DefaultExecutorGroup(ImmutableList.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
