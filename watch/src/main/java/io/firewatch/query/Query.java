package io.firewatch.query;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.firestore.v1.StructuredQuery;
import com.google.firestore.v1.StructuredQuery.CollectionSelector;
import com.google.firestore.v1.StructuredQuery.CompositeFilter;
import com.google.firestore.v1.StructuredQuery.FieldReference;
import com.google.firestore.v1.StructuredQuery.Filter;
import com.google.firestore.v1.StructuredQuery.Order;
import com.google.firestore.v1.StructuredQuery.UnaryFilter;
import com.google.firestore.v1.Value;
import com.google.protobuf.Int32Value;
import io.firewatch.model.DocumentSnapshot;
import io.firewatch.model.FieldPath;
import io.firewatch.model.ResourcePath;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * {@code Query} describes the documents a query listen matches and the order they are returned in. Instances are
 * immutable; every refinement returns a new query.
 */
public final class Query {

  public enum Direction {
    ASCENDING(StructuredQuery.Direction.ASCENDING),
    DESCENDING(StructuredQuery.Direction.DESCENDING);

    private final StructuredQuery.Direction proto;

    Direction(StructuredQuery.Direction proto) {
      this.proto = proto;
    }
  }

  public enum Operator {
    LESS_THAN(StructuredQuery.FieldFilter.Operator.LESS_THAN),
    LESS_THAN_OR_EQUAL(StructuredQuery.FieldFilter.Operator.LESS_THAN_OR_EQUAL),
    GREATER_THAN(StructuredQuery.FieldFilter.Operator.GREATER_THAN),
    GREATER_THAN_OR_EQUAL(StructuredQuery.FieldFilter.Operator.GREATER_THAN_OR_EQUAL),
    EQUAL(StructuredQuery.FieldFilter.Operator.EQUAL),
    NOT_EQUAL(StructuredQuery.FieldFilter.Operator.NOT_EQUAL),
    ARRAY_CONTAINS(StructuredQuery.FieldFilter.Operator.ARRAY_CONTAINS),
    IN(StructuredQuery.FieldFilter.Operator.IN),
    NOT_IN(StructuredQuery.FieldFilter.Operator.NOT_IN),
    ARRAY_CONTAINS_ANY(StructuredQuery.FieldFilter.Operator.ARRAY_CONTAINS_ANY);

    private final StructuredQuery.FieldFilter.Operator proto;

    Operator(StructuredQuery.FieldFilter.Operator proto) {
      this.proto = proto;
    }

    boolean takesArray() {
      return this == IN || this == NOT_IN || this == ARRAY_CONTAINS_ANY;
    }

    boolean isEquality() {
      return this == EQUAL || this == NOT_EQUAL;
    }
  }

  private static final class FieldFilter {
    final FieldPath field;
    final Operator operator;
    final Value value;

    FieldFilter(FieldPath field, Operator operator, Value value) {
      this.field = field;
      this.operator = operator;
      this.value = value;
    }
  }

  private static final class FieldOrder {
    final FieldPath field;
    final Direction direction;

    FieldOrder(FieldPath field, Direction direction) {
      this.field = field;
      this.direction = direction;
    }
  }

  private final ResourcePath parent;
  private final String collectionId;
  private final boolean allDescendants;
  private final ImmutableList<FieldFilter> filters;
  private final ImmutableList<FieldOrder> orders;
  @Nullable
  private final Integer limit;

  private Query(ResourcePath parent, String collectionId, boolean allDescendants,
      ImmutableList<FieldFilter> filters, ImmutableList<FieldOrder> orders, @Nullable Integer limit) {
    this.parent = parent;
    this.collectionId = collectionId;
    this.allDescendants = allDescendants;
    this.filters = filters;
    this.orders = orders;
    this.limit = limit;
  }

  /**
   * Returns a query over all documents of a collection.
   *
   * @param collection the collection path, e.g. {@code .../documents/users}
   */
  public static Query collection(ResourcePath collection) {
    checkNotNull(collection, "collection");
    checkArgument(collection.isCollection(), "'%s' is not a collection", collection);
    return new Query(collection.parent(), collection.id(), false, ImmutableList.of(), ImmutableList.of(), null);
  }

  /**
   * Returns a query over every collection with the given id below {@code parent}.
   *
   * @param parent       the documents root or a document
   * @param collectionId the collection id to match
   */
  public static Query collectionGroup(ResourcePath parent, String collectionId) {
    checkNotNull(parent, "parent");
    checkArgument(!parent.isCollection(), "collection groups need a document or the documents root as parent");
    checkArgument(collectionId != null && !collectionId.isEmpty() && !collectionId.contains("/"),
        "invalid collection id '%s'", collectionId);
    return new Query(parent, collectionId, true, ImmutableList.of(), ImmutableList.of(), null);
  }

  public Query where(String field, Operator operator, Value value) {
    return where(FieldPath.fromDotSeparatedString(field), operator, value);
  }

  /**
   * Returns a new query that additionally requires {@code field operator value}.
   *
   * <p>{@link Operator#IN}, {@link Operator#NOT_IN} and {@link Operator#ARRAY_CONTAINS_ANY} take a non-empty array
   * value. Null and NaN values can only be compared with {@link Operator#EQUAL} and {@link Operator#NOT_EQUAL}.
   */
  public Query where(FieldPath field, Operator operator, Value value) {
    checkNotNull(field, "field");
    checkNotNull(operator, "operator");
    checkNotNull(value, "value");
    if (operator.takesArray()) {
      checkArgument(value.hasArrayValue() && value.getArrayValue().getValuesCount() > 0,
          "a non-empty array is required for %s filters", operator);
    }
    if (isNull(value) || isNaN(value)) {
      checkArgument(operator.isEquality(), "null and NaN can only be compared with EQUAL and NOT_EQUAL");
    }
    ImmutableList<FieldFilter> newFilters = ImmutableList.<FieldFilter>builder()
        .addAll(filters)
        .add(new FieldFilter(field, operator, value))
        .build();
    return new Query(parent, collectionId, allDescendants, newFilters, orders, limit);
  }

  public Query orderBy(String field) {
    return orderBy(FieldPath.fromDotSeparatedString(field), Direction.ASCENDING);
  }

  public Query orderBy(String field, Direction direction) {
    return orderBy(FieldPath.fromDotSeparatedString(field), direction);
  }

  /**
   * Returns a new query that additionally sorts by {@code field}.
   */
  public Query orderBy(FieldPath field, Direction direction) {
    checkNotNull(field, "field");
    checkNotNull(direction, "direction");
    ImmutableList<FieldOrder> newOrders = ImmutableList.<FieldOrder>builder()
        .addAll(orders)
        .add(new FieldOrder(field, direction))
        .build();
    return new Query(parent, collectionId, allDescendants, filters, newOrders, limit);
  }

  /**
   * Returns a new query that returns at most {@code limit} documents.
   */
  public Query limit(int limit) {
    checkArgument(limit > 0, "limit must be positive, got %s", limit);
    return new Query(parent, collectionId, allDescendants, filters, orders, limit);
  }

  /**
   * Returns the resource the query runs under, used as the parent of the listen target.
   */
  public ResourcePath parent() {
    return parent;
  }

  public StructuredQuery toStructuredQuery() {
    StructuredQuery.Builder builder = StructuredQuery.newBuilder()
        .addFrom(CollectionSelector.newBuilder()
            .setCollectionId(collectionId)
            .setAllDescendants(allDescendants));

    if (filters.size() == 1) {
      builder.setWhere(toProto(filters.get(0)));
    } else if (filters.size() > 1) {
      CompositeFilter.Builder composite = CompositeFilter.newBuilder().setOp(CompositeFilter.Operator.AND);
      for (FieldFilter filter : filters) {
        composite.addFilters(toProto(filter));
      }
      builder.setWhere(Filter.newBuilder().setCompositeFilter(composite));
    }

    for (FieldOrder order : orders) {
      builder.addOrderBy(Order.newBuilder()
          .setField(FieldReference.newBuilder().setFieldPath(order.field.canonicalString()))
          .setDirection(order.direction.proto));
    }

    if (limit != null) {
      builder.setLimit(Int32Value.of(limit));
    }
    return builder.build();
  }

  private static Filter toProto(FieldFilter filter) {
    boolean equal = filter.operator == Operator.EQUAL;
    if (isNull(filter.value)) {
      return unaryFilter(filter.field, equal ? UnaryFilter.Operator.IS_NULL : UnaryFilter.Operator.IS_NOT_NULL);
    }
    if (isNaN(filter.value)) {
      return unaryFilter(filter.field, equal ? UnaryFilter.Operator.IS_NAN : UnaryFilter.Operator.IS_NOT_NAN);
    }
    return Filter.newBuilder()
        .setFieldFilter(StructuredQuery.FieldFilter.newBuilder()
            .setField(FieldReference.newBuilder().setFieldPath(filter.field.canonicalString()))
            .setOp(filter.operator.proto)
            .setValue(filter.value))
        .build();
  }

  private static Filter unaryFilter(FieldPath field, UnaryFilter.Operator operator) {
    return Filter.newBuilder()
        .setUnaryFilter(UnaryFilter.newBuilder()
            .setField(FieldReference.newBuilder().setFieldPath(field.canonicalString()))
            .setOp(operator))
        .build();
  }

  private static boolean isNull(Value value) {
    return value.getValueTypeCase() == Value.ValueTypeCase.NULL_VALUE;
  }

  private static boolean isNaN(Value value) {
    return value.getValueTypeCase() == Value.ValueTypeCase.DOUBLE_VALUE && Double.isNaN(value.getDoubleValue());
  }

  /**
   * Returns the order of the query results: the order-by fields, then the document name using the direction of the
   * last order-by clause. The name makes the order total.
   */
  public Comparator<DocumentSnapshot> comparator() {
    Direction lastDirection = orders.isEmpty() ? Direction.ASCENDING : Iterables.getLast(orders).direction;
    List<FieldOrder> effectiveOrders = ImmutableList.<FieldOrder>builder()
        .addAll(orders)
        .add(new FieldOrder(FieldPath.documentId(), lastDirection))
        .build();

    return (left, right) -> {
      for (FieldOrder order : effectiveOrders) {
        int comparison;
        if (order.field.isDocumentId()) {
          comparison = left.path().compareTo(right.path());
        } else {
          Value leftValue = left.get(order.field);
          Value rightValue = right.get(order.field);
          if (leftValue == null || rightValue == null) {
            throw new IllegalStateException("Cannot order documents " + left.name() + " and " + right.name()
                + " by missing field " + order.field);
          }
          comparison = ValueOrder.INSTANCE.compare(leftValue, rightValue);
        }
        if (comparison != 0) {
          return order.direction == Direction.ASCENDING ? comparison : -comparison;
        }
      }
      return 0;
    };
  }
}
