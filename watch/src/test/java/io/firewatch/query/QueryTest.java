package io.firewatch.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import com.google.firestore.v1.ArrayValue;
import com.google.firestore.v1.StructuredQuery;
import com.google.firestore.v1.Value;
import com.google.protobuf.NullValue;
import com.google.protobuf.util.Timestamps;
import io.firewatch.model.DocumentSnapshot;
import io.firewatch.model.ResourcePath;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Test;

public class QueryTest {

  private static final ResourcePath ROOT = ResourcePath.forDatabase("p", "(default)");
  private static final ResourcePath ROOMS = ROOT.append("rooms");

  @Test
  public void buildsStructuredQuery() {
    Query query = Query.collection(ROOMS)
        .where("size", Query.Operator.GREATER_THAN, Value.newBuilder().setIntegerValue(2).build())
        .where("open", Query.Operator.EQUAL, Value.newBuilder().setBooleanValue(true).build())
        .orderBy("size", Query.Direction.DESCENDING)
        .limit(10);

    StructuredQuery proto = query.toStructuredQuery();

    assertThat(query.parent()).isEqualTo(ROOT);
    assertThat(proto.getFrom(0).getCollectionId()).isEqualTo("rooms");
    assertThat(proto.getFrom(0).getAllDescendants()).isFalse();
    assertThat(proto.getWhere().getCompositeFilter().getOp()).isEqualTo(StructuredQuery.CompositeFilter.Operator.AND);
    assertThat(proto.getWhere().getCompositeFilter().getFiltersCount()).isEqualTo(2);
    assertThat(proto.getWhere().getCompositeFilter().getFilters(0).getFieldFilter().getOp())
        .isEqualTo(StructuredQuery.FieldFilter.Operator.GREATER_THAN);
    assertThat(proto.getOrderBy(0).getField().getFieldPath()).isEqualTo("size");
    assertThat(proto.getOrderBy(0).getDirection()).isEqualTo(StructuredQuery.Direction.DESCENDING);
    assertThat(proto.getLimit().getValue()).isEqualTo(10);
  }

  @Test
  public void singleFilterIsNotWrapped() {
    StructuredQuery proto = Query.collection(ROOMS)
        .where("a.`b-c`", Query.Operator.EQUAL, Value.newBuilder().setStringValue("x").build())
        .toStructuredQuery();

    assertThat(proto.getWhere().hasFieldFilter()).isTrue();
    assertThat(proto.getWhere().getFieldFilter().getField().getFieldPath()).isEqualTo("a.`b-c`");
    assertThat(proto.hasLimit()).isFalse();
  }

  @Test
  public void collectionGroupListensToAllDescendants() {
    Query query = Query.collectionGroup(ROOT, "messages");

    assertThat(query.toStructuredQuery().getFrom(0).getAllDescendants()).isTrue();
    assertThat(query.parent()).isEqualTo(ROOT);
  }

  @Test
  public void rejectsInvalidArguments() {
    assertThatThrownBy(() -> Query.collection(ROOMS.append("a"))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Query.collection(ROOMS).limit(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Query.collectionGroup(ROOMS, "messages")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void arrayOperatorsMapToFieldFilters() {
    Value sizes = Value.newBuilder()
        .setArrayValue(ArrayValue.newBuilder()
            .addValues(Value.newBuilder().setIntegerValue(1))
            .addValues(Value.newBuilder().setIntegerValue(2)))
        .build();

    assertThat(singleFilter(Query.Operator.IN, sizes).getFieldFilter().getOp())
        .isEqualTo(StructuredQuery.FieldFilter.Operator.IN);
    assertThat(singleFilter(Query.Operator.NOT_IN, sizes).getFieldFilter().getOp())
        .isEqualTo(StructuredQuery.FieldFilter.Operator.NOT_IN);
    StructuredQuery.Filter any = singleFilter(Query.Operator.ARRAY_CONTAINS_ANY, sizes);
    assertThat(any.getFieldFilter().getOp()).isEqualTo(StructuredQuery.FieldFilter.Operator.ARRAY_CONTAINS_ANY);
    assertThat(any.getFieldFilter().getValue()).isEqualTo(sizes);
  }

  @Test
  public void arrayOperatorsRequireNonEmptyArray() {
    Value empty = Value.newBuilder().setArrayValue(ArrayValue.getDefaultInstance()).build();
    Value scalar = Value.newBuilder().setIntegerValue(1).build();

    assertThatThrownBy(() -> Query.collection(ROOMS).where("size", Query.Operator.IN, empty))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Query.collection(ROOMS).where("size", Query.Operator.NOT_IN, scalar))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Query.collection(ROOMS).where("size", Query.Operator.ARRAY_CONTAINS_ANY, scalar))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void nullAndNaNComparisonsBecomeUnaryFilters() {
    Value nullValue = Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
    Value nan = Value.newBuilder().setDoubleValue(Double.NaN).build();

    StructuredQuery.Filter isNull = singleFilter(Query.Operator.EQUAL, nullValue);
    assertThat(isNull.hasUnaryFilter()).isTrue();
    assertThat(isNull.getUnaryFilter().getField().getFieldPath()).isEqualTo("size");
    assertThat(isNull.getUnaryFilter().getOp()).isEqualTo(StructuredQuery.UnaryFilter.Operator.IS_NULL);
    assertThat(singleFilter(Query.Operator.NOT_EQUAL, nullValue).getUnaryFilter().getOp())
        .isEqualTo(StructuredQuery.UnaryFilter.Operator.IS_NOT_NULL);
    assertThat(singleFilter(Query.Operator.EQUAL, nan).getUnaryFilter().getOp())
        .isEqualTo(StructuredQuery.UnaryFilter.Operator.IS_NAN);
    assertThat(singleFilter(Query.Operator.NOT_EQUAL, nan).getUnaryFilter().getOp())
        .isEqualTo(StructuredQuery.UnaryFilter.Operator.IS_NOT_NAN);
  }

  @Test
  public void nullAndNaNOnlySupportEquality() {
    Value nullValue = Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
    Value nan = Value.newBuilder().setDoubleValue(Double.NaN).build();

    assertThatThrownBy(() -> Query.collection(ROOMS).where("size", Query.Operator.LESS_THAN, nullValue))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Query.collection(ROOMS).where("size", Query.Operator.ARRAY_CONTAINS, nan))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void comparatorOrdersByFieldsThenName() {
    Comparator<DocumentSnapshot> comparator = Query.collection(ROOMS).orderBy("size").comparator();
    List<DocumentSnapshot> documents = new ArrayList<>(Arrays.asList(
        document("c", 1), document("a", 2), document("b", 1)));

    documents.sort(comparator);

    assertThat(ids(documents)).containsExactly("b", "c", "a");
  }

  @Test
  public void nameUsesDirectionOfLastOrder() {
    Comparator<DocumentSnapshot> comparator = Query.collection(ROOMS)
        .orderBy("size", Query.Direction.DESCENDING)
        .comparator();
    List<DocumentSnapshot> documents = new ArrayList<>(Arrays.asList(
        document("a", 1), document("b", 1), document("c", 2)));

    documents.sort(comparator);

    assertThat(ids(documents)).containsExactly("c", "b", "a");
  }

  @Test
  public void comparatorWithoutOrderUsesName() {
    Comparator<DocumentSnapshot> comparator = Query.collection(ROOMS).comparator();

    assertThat(comparator.compare(document("a", 5), document("b", 1))).isNegative();
  }

  @Test
  public void comparatorRejectsMissingField() {
    Comparator<DocumentSnapshot> comparator = Query.collection(ROOMS).orderBy("other").comparator();

    assertThatThrownBy(() -> comparator.compare(document("a", 1), document("b", 2)))
        .isInstanceOf(IllegalStateException.class);
  }

  private static StructuredQuery.Filter singleFilter(Query.Operator operator, Value value) {
    return Query.collection(ROOMS).where("size", operator, value).toStructuredQuery().getWhere();
  }

  private static DocumentSnapshot document(String id, long size) {
    return DocumentSnapshot.create(ROOMS.append(id),
        ImmutableMap.of("size", Value.newBuilder().setIntegerValue(size).build()),
        Timestamps.fromSeconds(1), Timestamps.fromSeconds(1), Timestamps.fromSeconds(1));
  }

  private static List<String> ids(List<DocumentSnapshot> documents) {
    return documents.stream().map(DocumentSnapshot::id).collect(Collectors.toList());
  }
}
