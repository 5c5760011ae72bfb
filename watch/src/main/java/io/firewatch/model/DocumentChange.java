package io.firewatch.model;

import com.google.auto.value.AutoValue;

/**
 * {@code DocumentChange} describes how a document moved between two consecutive query snapshots. Applying the
 * changes of a snapshot in order, removing at {@link #oldIndex()} and then inserting at {@link #newIndex()},
 * turns the previous document list into the current one.
 */
@AutoValue
public abstract class DocumentChange {

  public enum Type {
    ADDED,
    MODIFIED,
    REMOVED
  }

  public static DocumentChange added(DocumentSnapshot document, int newIndex) {
    return new AutoValue_DocumentChange(Type.ADDED, document, -1, newIndex);
  }

  public static DocumentChange modified(DocumentSnapshot document, int oldIndex, int newIndex) {
    return new AutoValue_DocumentChange(Type.MODIFIED, document, oldIndex, newIndex);
  }

  public static DocumentChange removed(DocumentSnapshot document, int oldIndex) {
    return new AutoValue_DocumentChange(Type.REMOVED, document, oldIndex, -1);
  }

  public abstract Type type();

  /**
   * Returns the new version of the document, or the last known version for removals.
   */
  public abstract DocumentSnapshot document();

  /**
   * Returns the index of the document in the previous snapshot, or -1 for additions.
   */
  public abstract int oldIndex();

  /**
   * Returns the index of the document in this snapshot, or -1 for removals.
   */
  public abstract int newIndex();
}
