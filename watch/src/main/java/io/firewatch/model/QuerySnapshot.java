package io.firewatch.model;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;
import java.util.List;

/**
 * {@code QuerySnapshot} is the ordered result set of a listen target at a consistent read time, along with the
 * changes relative to the previously delivered snapshot.
 */
@AutoValue
public abstract class QuerySnapshot {

  public static QuerySnapshot create(Timestamp readTime, List<DocumentSnapshot> documents,
      List<DocumentChange> changes) {
    return new AutoValue_QuerySnapshot(readTime, ImmutableList.copyOf(documents), ImmutableList.copyOf(changes));
  }

  public abstract Timestamp readTime();

  public abstract ImmutableList<DocumentSnapshot> documents();

  public abstract ImmutableList<DocumentChange> changes();

  public int size() {
    return documents().size();
  }

  public boolean isEmpty() {
    return documents().isEmpty();
  }
}
