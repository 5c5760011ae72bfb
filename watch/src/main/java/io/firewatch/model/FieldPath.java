package io.firewatch.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.firestore.v1.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * {@code FieldPath} addresses a (possibly nested) field of a document. Segments that are not simple identifiers are
 * written between back-ticks in the canonical form, e.g. {@code address.`zip-code`}.
 */
public final class FieldPath {

  private static final String DOCUMENT_ID = "__name__";
  private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[_a-zA-Z][_a-zA-Z0-9]*");
  private static final FieldPath DOCUMENT_ID_PATH = new FieldPath(ImmutableList.of(DOCUMENT_ID));

  private final ImmutableList<String> segments;

  private FieldPath(ImmutableList<String> segments) {
    this.segments = segments;
  }

  /**
   * Returns the special field path that refers to the document name.
   */
  public static FieldPath documentId() {
    return DOCUMENT_ID_PATH;
  }

  /**
   * Creates a field path from unescaped segments.
   */
  public static FieldPath of(String... segments) {
    checkArgument(segments.length > 0, "a field path needs at least one segment");
    for (String segment : segments) {
      checkArgument(segment != null && !segment.isEmpty(), "field path segments cannot be empty");
    }
    return new FieldPath(ImmutableList.copyOf(segments));
  }

  /**
   * Parses a dot-separated field path. Back-ticks quote segments that contain dots or other special characters;
   * a back-slash escapes the next character inside a quoted segment.
   *
   * @param path the field path, e.g. {@code a.b} or {@code a.`b.c`}
   * @throws IllegalArgumentException if the path is malformed
   */
  public static FieldPath fromDotSeparatedString(String path) {
    checkNotNull(path, "path");
    checkArgument(!path.isEmpty(), "field path cannot be empty");

    List<String> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;

    for (int i = 0; i < path.length(); i++) {
      char c = path.charAt(i);
      if (c == '\\' && quoted) {
        checkArgument(i + 1 < path.length(), "trailing escape character in '%s'", path);
        current.append(path.charAt(++i));
      } else if (c == '`') {
        quoted = !quoted;
      } else if (c == '.' && !quoted) {
        checkArgument(current.length() > 0, "field path '%s' contains an empty segment", path);
        segments.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    checkArgument(!quoted, "unterminated back-tick in '%s'", path);
    checkArgument(current.length() > 0, "field path '%s' contains an empty segment", path);
    segments.add(current.toString());

    return new FieldPath(ImmutableList.copyOf(segments));
  }

  public ImmutableList<String> segments() {
    return segments;
  }

  public boolean isDocumentId() {
    return equals(DOCUMENT_ID_PATH);
  }

  /**
   * Returns the encoded form expected in a {@code FieldReference}.
   */
  public String canonicalString() {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) {
        builder.append('.');
      }
      String segment = segments.get(i);
      if (SIMPLE_IDENTIFIER.matcher(segment).matches()) {
        builder.append(segment);
      } else {
        builder.append('`')
            .append(segment.replace("\\", "\\\\").replace("`", "\\`"))
            .append('`');
      }
    }
    return builder.toString();
  }

  /**
   * Looks up the value this path points to.
   *
   * @param fields the top-level fields of a document
   * @return the value, or {@code null} if any segment is missing or traverses a non-map value
   */
  @Nullable
  public Value lookup(Map<String, Value> fields) {
    Map<String, Value> currentFields = fields;
    Value value = null;
    for (int i = 0; i < segments.size(); i++) {
      if (currentFields == null) {
        return null;
      }
      value = currentFields.get(segments.get(i));
      if (value == null) {
        return null;
      }
      currentFields = value.getValueTypeCase() == Value.ValueTypeCase.MAP_VALUE
          ? value.getMapValue().getFieldsMap()
          : null;
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldPath && segments.equals(((FieldPath) o).segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return canonicalString();
  }
}
