package io.firewatch.watch;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.firestore.v1.Document;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.grpc.Status;
import java.util.List;
import javax.annotation.Nullable;

/**
 * {@code ListenEvent} is a single message received on a listen stream. Exactly one of the nested variants is used per
 * message; {@link #kind()} tells them apart.
 */
public abstract class ListenEvent {

  public enum Kind {
    TARGET_CHANGED,
    DOCUMENT_UPDATED,
    DOCUMENT_DELETED,
    DOCUMENT_REMOVED,
    EXISTENCE_FILTER
  }

  private ListenEvent() {
  }

  public abstract Kind kind();

  /**
   * A target moved to a new state.
   */
  @AutoValue
  public abstract static class TargetChanged extends ListenEvent {

    /**
     * Creates a target change.
     *
     * @param type        the kind of transition
     * @param targetIds   the targets the change applies to, empty for all targets
     * @param resumeToken the token to resume the stream from, empty if none was sent
     * @param cause       the error that caused a target removal, if any
     * @param readTime    the time at which the targets are consistent, if any
     */
    public static TargetChanged create(TargetChangeType type, List<Integer> targetIds, ByteString resumeToken,
        @Nullable Status cause, @Nullable Timestamp readTime) {
      return new AutoValue_ListenEvent_TargetChanged(type, ImmutableList.copyOf(targetIds), resumeToken, cause,
          readTime);
    }

    @Override
    public Kind kind() {
      return Kind.TARGET_CHANGED;
    }

    public abstract TargetChangeType type();

    public abstract ImmutableList<Integer> targetIds();

    public abstract ByteString resumeToken();

    @Nullable
    public abstract Status cause();

    @Nullable
    public abstract Timestamp readTime();

    /**
     * Returns true if the change applies to the given target. A change without target ids applies to all targets.
     */
    public boolean affects(int targetId) {
      return targetIds().isEmpty() || targetIds().contains(targetId);
    }
  }

  /**
   * A document was added or changed, or left some targets.
   */
  @AutoValue
  public abstract static class DocumentUpdated extends ListenEvent {

    public static DocumentUpdated create(Document document, List<Integer> targetIds,
        List<Integer> removedTargetIds) {
      return new AutoValue_ListenEvent_DocumentUpdated(document, ImmutableList.copyOf(targetIds),
          ImmutableList.copyOf(removedTargetIds));
    }

    @Override
    public Kind kind() {
      return Kind.DOCUMENT_UPDATED;
    }

    public abstract Document document();

    /**
     * Returns the targets that now match the document.
     */
    public abstract ImmutableList<Integer> targetIds();

    /**
     * Returns the targets that no longer match the document.
     */
    public abstract ImmutableList<Integer> removedTargetIds();
  }

  /**
   * A document was deleted.
   */
  @AutoValue
  public abstract static class DocumentDeleted extends ListenEvent {

    public static DocumentDeleted create(String documentName, List<Integer> removedTargetIds,
        @Nullable Timestamp readTime) {
      return new AutoValue_ListenEvent_DocumentDeleted(documentName, ImmutableList.copyOf(removedTargetIds), readTime);
    }

    @Override
    public Kind kind() {
      return Kind.DOCUMENT_DELETED;
    }

    public abstract String documentName();

    public abstract ImmutableList<Integer> removedTargetIds();

    @Nullable
    public abstract Timestamp readTime();
  }

  /**
   * A document is no longer relevant to some targets.
   */
  @AutoValue
  public abstract static class DocumentRemoved extends ListenEvent {

    public static DocumentRemoved create(String documentName, List<Integer> removedTargetIds,
        @Nullable Timestamp readTime) {
      return new AutoValue_ListenEvent_DocumentRemoved(documentName, ImmutableList.copyOf(removedTargetIds), readTime);
    }

    @Override
    public Kind kind() {
      return Kind.DOCUMENT_REMOVED;
    }

    public abstract String documentName();

    public abstract ImmutableList<Integer> removedTargetIds();

    @Nullable
    public abstract Timestamp readTime();
  }

  /**
   * The number of documents the server holds for a target.
   */
  @AutoValue
  public abstract static class ExistenceFilter extends ListenEvent {

    public static ExistenceFilter create(int targetId, int count) {
      return new AutoValue_ListenEvent_ExistenceFilter(targetId, count);
    }

    @Override
    public Kind kind() {
      return Kind.EXISTENCE_FILTER;
    }

    public abstract int targetId();

    public abstract int count();
  }
}
