package io.firewatch.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.google.common.collect.ImmutableMap;
import com.google.firestore.v1.ArrayValue;
import com.google.firestore.v1.MapValue;
import com.google.firestore.v1.Value;
import com.google.protobuf.NullValue;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import java.util.Arrays;
import org.junit.Test;

public class DocumentSnapshotTest {

  private static final ResourcePath PATH = ResourcePath.forDatabase("p", "(default)").append("rooms/a");
  private static final Timestamp T1 = Timestamps.fromSeconds(1);
  private static final Timestamp T2 = Timestamps.fromSeconds(2);

  @Test
  public void existingDocumentExposesFields() {
    DocumentSnapshot snapshot = DocumentSnapshot.create(PATH, ImmutableMap.of(
        "title", Value.newBuilder().setStringValue("lobby").build(),
        "meta", Value.newBuilder()
            .setMapValue(MapValue.newBuilder()
                .putFields("size", Value.newBuilder().setIntegerValue(3).build()))
            .build()),
        T1, T1, T2);

    assertThat(snapshot.exists()).isTrue();
    assertThat(snapshot.id()).isEqualTo("a");
    assertThat(snapshot.name()).isEqualTo(PATH.name());
    assertThat(snapshot.get("meta.size").getIntegerValue()).isEqualTo(3);
    assertThat(snapshot.get("missing")).isNull();
    assertThat(snapshot.getData()).containsEntry("title", "lobby");
    assertThat(snapshot.getData().get("meta")).isEqualTo(ImmutableMap.of("size", 3L));
  }

  @Test
  public void missingDocumentHasNoData() {
    DocumentSnapshot snapshot = DocumentSnapshot.missing(PATH, T2);

    assertThat(snapshot.exists()).isFalse();
    assertThat(snapshot.fields()).isNull();
    assertThat(snapshot.updateTime()).isNull();
    assertThat(snapshot.get("title")).isNull();
    assertThat(snapshot.getData()).isNull();
    assertThat(snapshot.readTime()).isEqualTo(T2);
  }

  @Test
  public void withReadTimeKeepsContent() {
    DocumentSnapshot snapshot = DocumentSnapshot.create(PATH, ImmutableMap.of(), T1, T1, T1);

    DocumentSnapshot reread = snapshot.withReadTime(T2);

    assertThat(reread.readTime()).isEqualTo(T2);
    assertThat(reread.updateTime()).isEqualTo(T1);
    assertThat(reread.fields()).isEqualTo(snapshot.fields());
  }

  @Test
  public void valuesConvertToJavaObjects() {
    Value array = Value.newBuilder()
        .setArrayValue(ArrayValue.newBuilder()
            .addValues(Value.newBuilder().setBooleanValue(true))
            .addValues(Value.newBuilder().setDoubleValue(1.5))
            .addValues(Value.newBuilder().setNullValue(NullValue.NULL_VALUE)))
        .build();

    assertThat(Values.toJava(array)).isEqualTo(Arrays.asList(true, 1.5, null));
    assertThat(Values.toJava(ImmutableMap.of("n", Value.newBuilder().setIntegerValue(4).build())))
        .containsExactly(entry("n", 4L));
  }
}
