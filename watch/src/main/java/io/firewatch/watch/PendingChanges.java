package io.firewatch.watch;

import com.google.firestore.v1.Document;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Document changes received since the last snapshot. A document is either upserted or removed; the latest event
 * wins.
 */
class PendingChanges {

  private final Map<String, Document> upserts = new LinkedHashMap<>();
  private final Set<String> removals = new LinkedHashSet<>();

  void upsert(Document document) {
    removals.remove(document.getName());
    upserts.put(document.getName(), document);
  }

  void remove(String name) {
    upserts.remove(name);
    removals.add(name);
  }

  Map<String, Document> upserts() {
    return upserts;
  }

  Set<String> removals() {
    return removals;
  }

  boolean isEmpty() {
    return upserts.isEmpty() && removals.isEmpty();
  }

  void clear() {
    upserts.clear();
    removals.clear();
  }

  /**
   * Returns the number of documents {@code current} would hold once these changes are applied.
   */
  int sizeAfterApplying(DocumentSet current) {
    int size = current.size();
    for (String name : upserts.keySet()) {
      if (!current.contains(name)) {
        size++;
      }
    }
    for (String name : removals) {
      if (current.contains(name)) {
        size--;
      }
    }
    return size;
  }
}
