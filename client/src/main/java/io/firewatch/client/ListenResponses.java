package io.firewatch.client;

import com.google.firestore.v1.DocumentDelete;
import com.google.firestore.v1.DocumentRemove;
import com.google.firestore.v1.ListenResponse;
import com.google.firestore.v1.TargetChange;
import io.firewatch.watch.ListenEvent;
import io.firewatch.watch.TargetChangeType;
import io.grpc.Status;

/**
 * Converts {@link ListenResponse} messages into {@link ListenEvent}s.
 */
public final class ListenResponses {

  private ListenResponses() {
  }

  /**
   * Converts a single response.
   *
   * @param response the response received on the listen stream
   * @return the event the response carries
   * @throws IllegalArgumentException if the response has no known payload
   */
  public static ListenEvent toEvent(ListenResponse response) {
    switch (response.getResponseTypeCase()) {
      case TARGET_CHANGE:
        return toEvent(response.getTargetChange());
      case DOCUMENT_CHANGE:
        com.google.firestore.v1.DocumentChange change = response.getDocumentChange();
        return ListenEvent.DocumentUpdated.create(change.getDocument(), change.getTargetIdsList(),
            change.getRemovedTargetIdsList());
      case DOCUMENT_DELETE:
        DocumentDelete delete = response.getDocumentDelete();
        return ListenEvent.DocumentDeleted.create(delete.getDocument(), delete.getRemovedTargetIdsList(),
            delete.hasReadTime() ? delete.getReadTime() : null);
      case DOCUMENT_REMOVE:
        DocumentRemove remove = response.getDocumentRemove();
        return ListenEvent.DocumentRemoved.create(remove.getDocument(), remove.getRemovedTargetIdsList(),
            remove.hasReadTime() ? remove.getReadTime() : null);
      case FILTER:
        return ListenEvent.ExistenceFilter.create(response.getFilter().getTargetId(),
            response.getFilter().getCount());
      default:
        throw new IllegalArgumentException("Unknown listen response type: " + response.getResponseTypeCase());
    }
  }

  private static ListenEvent toEvent(TargetChange change) {
    return ListenEvent.TargetChanged.create(
        toType(change.getTargetChangeType()),
        change.getTargetIdsList(),
        change.getResumeToken(),
        change.hasCause() ? toStatus(change.getCause()) : null,
        change.hasReadTime() ? change.getReadTime() : null);
  }

  private static TargetChangeType toType(TargetChange.TargetChangeType type) {
    switch (type) {
      case NO_CHANGE:
        return TargetChangeType.NO_CHANGE;
      case ADD:
        return TargetChangeType.ADD;
      case REMOVE:
        return TargetChangeType.REMOVE;
      case CURRENT:
        return TargetChangeType.CURRENT;
      case RESET:
        return TargetChangeType.RESET;
      default:
        throw new IllegalArgumentException("Unknown target change type: " + type);
    }
  }

  static Status toStatus(com.google.rpc.Status cause) {
    Status status = Status.fromCodeValue(cause.getCode());
    return cause.getMessage().isEmpty() ? status : status.withDescription(cause.getMessage());
  }
}
