package io.firewatch.watch;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.firewatch.model.DocumentSnapshot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The documents of the last delivered snapshot, kept both in query order and by name.
 */
class DocumentSet {

  private final Comparator<DocumentSnapshot> comparator;
  private final List<DocumentSnapshot> sorted = new ArrayList<>();
  private final Map<String, DocumentSnapshot> byName = new HashMap<>();

  DocumentSet(Comparator<DocumentSnapshot> comparator) {
    this.comparator = comparator;
  }

  int size() {
    return sorted.size();
  }

  boolean contains(String name) {
    return byName.containsKey(name);
  }

  @Nullable
  DocumentSnapshot get(String name) {
    return byName.get(name);
  }

  ImmutableSet<String> names() {
    return ImmutableSet.copyOf(byName.keySet());
  }

  ImmutableList<DocumentSnapshot> documents() {
    return ImmutableList.copyOf(sorted);
  }

  /**
   * Inserts a document that is not yet in the set and returns its position.
   */
  int add(DocumentSnapshot document) {
    checkState(!byName.containsKey(document.name()), "Document to add already exists: %s", document.name());
    int index = Collections.binarySearch(sorted, document, comparator);
    checkState(index < 0, "Comparator reports %s as equal to another document", document.name());
    int insertionPoint = -(index + 1);
    sorted.add(insertionPoint, document);
    byName.put(document.name(), document);
    return insertionPoint;
  }

  /**
   * Removes the document with the given name and returns the position it had.
   */
  int remove(String name) {
    DocumentSnapshot existing = byName.remove(name);
    checkState(existing != null, "Document to remove does not exist: %s", name);
    int index = Collections.binarySearch(sorted, existing, comparator);
    checkState(index >= 0, "Document %s is missing from the sorted view", name);
    sorted.remove(index);
    return index;
  }
}
