package io.firewatch.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * {@code ResourcePath} is the fully qualified path of a document or collection, i.e.
 * {@code projects/{project}/databases/{database}/documents/{segment}/...}. A path without segments refers to the
 * documents root of the database.
 */
public final class ResourcePath implements Comparable<ResourcePath> {

  private static final Splitter SLASH_SPLITTER = Splitter.on('/');
  private static final Joiner SLASH_JOINER = Joiner.on('/');

  private final String projectId;
  private final String databaseId;
  private final ImmutableList<String> segments;

  private ResourcePath(String projectId, String databaseId, ImmutableList<String> segments) {
    this.projectId = projectId;
    this.databaseId = databaseId;
    this.segments = segments;
  }

  /**
   * Returns the documents root of the given database.
   *
   * @param projectId  the project that owns the database
   * @param databaseId the database id, usually {@code (default)}
   */
  public static ResourcePath forDatabase(String projectId, String databaseId) {
    checkArgument(!isNullOrEmpty(projectId), "projectId cannot be empty");
    checkArgument(!isNullOrEmpty(databaseId), "databaseId cannot be empty");
    return new ResourcePath(projectId, databaseId, ImmutableList.of());
  }

  /**
   * Parses a fully qualified resource name as sent by the backend.
   *
   * @param name the resource name, e.g. {@code projects/p/databases/d/documents/users/alice}
   * @throws IllegalArgumentException if the name is not a valid resource name
   */
  public static ResourcePath parse(String name) {
    checkNotNull(name, "name");
    List<String> parts = SLASH_SPLITTER.splitToList(name);
    checkArgument(parts.size() >= 5
            && "projects".equals(parts.get(0))
            && "databases".equals(parts.get(2))
            && "documents".equals(parts.get(4)),
        "'%s' is not a valid resource name", name);

    ResourcePath root = forDatabase(parts.get(1), parts.get(3));
    return root.append(parts.subList(5, parts.size()));
  }

  /**
   * Returns a new path with the given slash-separated relative path appended.
   *
   * @param relativePath a path such as {@code users/alice}
   */
  public ResourcePath append(String relativePath) {
    checkNotNull(relativePath, "relativePath");
    checkArgument(!relativePath.startsWith("/") && !relativePath.endsWith("/"),
        "'%s' must not start or end with '/'", relativePath);
    return append(SLASH_SPLITTER.splitToList(relativePath));
  }

  private ResourcePath append(List<String> newSegments) {
    for (String segment : newSegments) {
      checkArgument(!segment.isEmpty(), "paths must not contain empty segments");
    }
    return new ResourcePath(projectId, databaseId, ImmutableList.<String>builder()
        .addAll(segments)
        .addAll(newSegments)
        .build());
  }

  public String projectId() {
    return projectId;
  }

  public String databaseId() {
    return databaseId;
  }

  public ImmutableList<String> segments() {
    return segments;
  }

  /**
   * Returns the database resource name, {@code projects/{project}/databases/{database}}.
   */
  public String databaseName() {
    return "projects/" + projectId + "/databases/" + databaseId;
  }

  /**
   * Returns the documents root, {@code projects/{project}/databases/{database}/documents}.
   */
  public String documentsRoot() {
    return databaseName() + "/documents";
  }

  /**
   * Returns the fully qualified resource name.
   */
  public String name() {
    if (segments.isEmpty()) {
      return documentsRoot();
    }
    return documentsRoot() + "/" + relativeName();
  }

  /**
   * Returns the path relative to the documents root.
   */
  public String relativeName() {
    return SLASH_JOINER.join(segments);
  }

  public boolean isDocument() {
    return !segments.isEmpty() && segments.size() % 2 == 0;
  }

  public boolean isCollection() {
    return segments.size() % 2 == 1;
  }

  /**
   * Returns the last segment (the document or collection id).
   */
  public String id() {
    checkState(!segments.isEmpty(), "the documents root has no id");
    return segments.get(segments.size() - 1);
  }

  /**
   * Returns the parent path.
   */
  public ResourcePath parent() {
    checkState(!segments.isEmpty(), "the documents root has no parent");
    return new ResourcePath(projectId, databaseId, segments.subList(0, segments.size() - 1));
  }

  @Override
  public int compareTo(ResourcePath other) {
    int comparison = projectId.compareTo(other.projectId);
    if (comparison != 0) {
      return comparison;
    }
    comparison = databaseId.compareTo(other.databaseId);
    if (comparison != 0) {
      return comparison;
    }
    int length = Math.min(segments.size(), other.segments.size());
    for (int i = 0; i < length; i++) {
      comparison = segments.get(i).compareTo(other.segments.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(segments.size(), other.segments.size());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResourcePath)) {
      return false;
    }
    ResourcePath that = (ResourcePath) o;
    return projectId.equals(that.projectId)
        && databaseId.equals(that.databaseId)
        && segments.equals(that.segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(projectId, databaseId, segments);
  }

  @Override
  public String toString() {
    return name();
  }

  private static boolean isNullOrEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
