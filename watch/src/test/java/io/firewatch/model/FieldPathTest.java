package io.firewatch.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import com.google.firestore.v1.MapValue;
import com.google.firestore.v1.Value;
import java.util.Map;
import org.junit.Test;

public class FieldPathTest {

  @Test
  public void parsesSimpleAndQuotedSegments() {
    assertThat(FieldPath.fromDotSeparatedString("a.b").segments()).containsExactly("a", "b");
    assertThat(FieldPath.fromDotSeparatedString("a.`b.c`").segments()).containsExactly("a", "b.c");
    assertThat(FieldPath.fromDotSeparatedString("`a\\`b`").segments()).containsExactly("a`b");
  }

  @Test
  public void canonicalStringQuotesSpecialSegments() {
    assertThat(FieldPath.of("address", "zip-code").canonicalString()).isEqualTo("address.`zip-code`");
    assertThat(FieldPath.of("a.b").canonicalString()).isEqualTo("`a.b`");
    assertThat(FieldPath.of("simple_1").canonicalString()).isEqualTo("simple_1");
  }

  @Test
  public void canonicalStringParsesBack() {
    FieldPath path = FieldPath.of("a", "b`c", "d\\e", "1st");

    assertThat(FieldPath.fromDotSeparatedString(path.canonicalString())).isEqualTo(path);
  }

  @Test
  public void rejectsEmptySegments() {
    assertThatThrownBy(() -> FieldPath.fromDotSeparatedString("a..b")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FieldPath.fromDotSeparatedString("a.")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FieldPath.fromDotSeparatedString("`a")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FieldPath.of("a", "")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void documentIdIsSpecial() {
    assertThat(FieldPath.documentId().isDocumentId()).isTrue();
    assertThat(FieldPath.fromDotSeparatedString("__name__").isDocumentId()).isTrue();
    assertThat(FieldPath.of("name").isDocumentId()).isFalse();
  }

  @Test
  public void looksUpNestedValues() {
    Value zip = Value.newBuilder().setStringValue("12345").build();
    Map<String, Value> fields = ImmutableMap.of(
        "address", Value.newBuilder()
            .setMapValue(MapValue.newBuilder().putFields("zip", zip))
            .build(),
        "name", Value.newBuilder().setStringValue("alice").build());

    assertThat(FieldPath.of("address", "zip").lookup(fields)).isEqualTo(zip);
    assertThat(FieldPath.of("address", "street").lookup(fields)).isNull();
    assertThat(FieldPath.of("name", "first").lookup(fields)).isNull();
  }
}
