package io.firewatch.model;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.firestore.v1.Value;
import com.google.protobuf.Timestamp;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * {@code DocumentSnapshot} is an immutable view of a document at a read time. A snapshot of a document that does not
 * exist carries no fields and no create or update time.
 */
@AutoValue
public abstract class DocumentSnapshot {

  /**
   * Returns a snapshot of an existing document.
   *
   * @param path       the document path
   * @param fields     the document fields
   * @param createTime the time the document was created
   * @param updateTime the time the document was last changed
   * @param readTime   the time this snapshot was read
   */
  public static DocumentSnapshot create(ResourcePath path, Map<String, Value> fields, Timestamp createTime,
      Timestamp updateTime, Timestamp readTime) {
    checkNotNull(fields, "fields");
    checkNotNull(createTime, "createTime");
    checkNotNull(updateTime, "updateTime");
    return new AutoValue_DocumentSnapshot(path, ImmutableMap.copyOf(fields), createTime, updateTime, readTime);
  }

  /**
   * Returns a snapshot for a document that was not found at {@code readTime}.
   */
  public static DocumentSnapshot missing(ResourcePath path, Timestamp readTime) {
    return new AutoValue_DocumentSnapshot(path, null, null, null, readTime);
  }

  public abstract ResourcePath path();

  /**
   * Returns the document fields, or {@code null} if the document does not exist.
   */
  @Nullable
  public abstract ImmutableMap<String, Value> fields();

  @Nullable
  public abstract Timestamp createTime();

  @Nullable
  public abstract Timestamp updateTime();

  public abstract Timestamp readTime();

  public boolean exists() {
    return fields() != null;
  }

  /**
   * Returns the fully qualified document name.
   */
  public String name() {
    return path().name();
  }

  public String id() {
    return path().id();
  }

  /**
   * Returns the value at the given dot-separated field path, or {@code null} if it is not set.
   */
  @Nullable
  public Value get(String field) {
    return get(FieldPath.fromDotSeparatedString(field));
  }

  /**
   * Returns the value at the given field path, or {@code null} if it is not set or the document does not exist.
   */
  @Nullable
  public Value get(FieldPath field) {
    return exists() ? field.lookup(fields()) : null;
  }

  /**
   * Returns the document fields as plain Java objects, or {@code null} if the document does not exist.
   */
  @Nullable
  public Map<String, Object> getData() {
    return exists() ? Values.toJava(fields()) : null;
  }

  /**
   * Returns a copy of this snapshot that was read at {@code readTime}.
   */
  public DocumentSnapshot withReadTime(Timestamp readTime) {
    return new AutoValue_DocumentSnapshot(path(), fields(), createTime(), updateTime(), readTime);
  }
}
