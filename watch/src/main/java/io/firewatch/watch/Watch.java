package io.firewatch.watch;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.firestore.v1.Document;
import com.google.firestore.v1.Target;
import com.google.firestore.v1.Target.DocumentsTarget;
import com.google.firestore.v1.Target.QueryTarget;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import io.firewatch.model.DocumentChange;
import io.firewatch.model.DocumentSnapshot;
import io.firewatch.model.QuerySnapshot;
import io.firewatch.model.ResourcePath;
import io.firewatch.query.Query;
import io.grpc.Status;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code Watch} maintains a single listen target against the backend and turns the stream of target and document
 * events into consistent, ordered {@link QuerySnapshot}s.
 *
 * <p>All events of a watch are processed one at a time, in arrival order, on a sequential executor built on top of
 * {@link WatchOptions#executor()}. Snapshots and the terminal error are delivered on that same executor, so listener
 * invocations never overlap. Retryable stream failures reopen the stream with the last resume token after a backoff
 * delay; the listener only observes them as a delay.
 */
public class Watch {

  /**
   * The target id used for the single target of every watch stream.
   */
  public static final int WATCH_TARGET_ID = 1;

  private static final Logger LOGGER = LoggerFactory.getLogger(Watch.class);

  private static final AtomicLong WATCH_IDS = new AtomicLong();

  private static final AtomicIntegerFieldUpdater<Watch> isClosedUpdater =
      AtomicIntegerFieldUpdater.newUpdater(Watch.class, "isClosed");
  private static final AtomicIntegerFieldUpdater<Watch> isSubscribedUpdater =
      AtomicIntegerFieldUpdater.newUpdater(Watch.class, "isSubscribed");

  public enum State {
    /** The stream was requested but the target was not acknowledged yet. */
    INITIALIZING,
    /** The target is acknowledged but not consistent yet. */
    OPEN,
    /** The target is consistent; snapshots are delivered as changes arrive. */
    CURRENT,
    /** The stream failed and is being reopened. */
    RECONNECTING,
    /** The watch was cancelled or failed permanently. */
    CLOSED
  }

  private final long watchId;
  private final Target target;
  private final Comparator<DocumentSnapshot> comparator;
  private final ListenTransport transport;
  private final DocumentDecoder decoder;
  private final Executor serialExecutor;
  private final ScheduledExecutorService scheduler;
  private final ExponentialBackoff backoff;
  private final WatchCallbacks callbacks;

  // held while a listener runs and while the watch is closed
  private final Object deliveryLock = new Object();

  private volatile int isClosed = 0;
  private volatile int isSubscribed = 0;
  private volatile State state = State.INITIALIZING;

  // confined to serialExecutor
  private final DocumentSet documents;
  private final PendingChanges pending = new PendingChanges();
  private boolean current;
  private boolean hasPushed;
  private boolean forcePush;
  private ByteString resumeToken = ByteString.EMPTY;
  private ListenStream stream;
  private int streamGeneration;
  private Consumer<QuerySnapshot> onSnapshot;
  private Consumer<WatchException> onError;

  Watch(Target target, Comparator<DocumentSnapshot> comparator, ListenTransport transport, DocumentDecoder decoder,
      WatchOptions options) {
    this.watchId = WATCH_IDS.incrementAndGet();
    this.target = checkNotNull(target, "target");
    this.comparator = checkNotNull(comparator, "comparator");
    this.transport = checkNotNull(transport, "transport");
    this.decoder = checkNotNull(decoder, "decoder");
    checkNotNull(options, "options");
    this.serialExecutor = MoreExecutors.newSequentialExecutor(options.executor());
    this.scheduler = options.scheduler();
    this.backoff = new ExponentialBackoff(options.backoffSettings());
    this.callbacks = options.callbacks();
    this.documents = new DocumentSet(comparator);
  }

  /**
   * Creates a watch on a single document.
   *
   * @param document  the document path
   * @param transport opens the listen streams
   * @param decoder   decodes the documents sent by the backend
   * @param options   executors, backoff and callbacks
   */
  public static Watch forDocument(ResourcePath document, ListenTransport transport, DocumentDecoder decoder,
      WatchOptions options) {
    checkNotNull(document, "document");
    checkArgument(document.isDocument(), "'%s' is not a document", document);
    Target target = Target.newBuilder()
        .setTargetId(WATCH_TARGET_ID)
        .setDocuments(DocumentsTarget.newBuilder().addDocuments(document.name()))
        .build();
    return new Watch(target, Comparator.comparing(DocumentSnapshot::path), transport, decoder, options);
  }

  /**
   * Creates a watch on the results of a query. Snapshots are ordered by {@link Query#comparator()}.
   *
   * @param query     the query to listen to
   * @param transport opens the listen streams
   * @param decoder   decodes the documents sent by the backend
   * @param options   executors, backoff and callbacks
   */
  public static Watch forQuery(Query query, ListenTransport transport, DocumentDecoder decoder,
      WatchOptions options) {
    checkNotNull(query, "query");
    Target target = Target.newBuilder()
        .setTargetId(WATCH_TARGET_ID)
        .setQuery(QueryTarget.newBuilder()
            .setParent(query.parent().name())
            .setStructuredQuery(query.toStructuredQuery()))
        .build();
    return new Watch(target, query.comparator(), transport, decoder, options);
  }

  /**
   * Returns the ID of this watch, used in logs and callbacks.
   */
  public long id() {
    return watchId;
  }

  public State state() {
    return state;
  }

  /**
   * Returns the target sent to the backend, without resume token.
   */
  public Target target() {
    return target;
  }

  /**
   * Starts listening. {@code onSnapshot} receives a snapshot each time the target reaches a consistent state with
   * changes, and {@code onError} receives the terminal error at most once. A watch can only be subscribed once.
   *
   * @param onSnapshot receives the snapshots
   * @param onError    receives the terminal error
   * @return a registration that stops the watch
   * @throws IllegalStateException if the watch was already subscribed
   */
  public ListenerRegistration subscribe(Consumer<QuerySnapshot> onSnapshot, Consumer<WatchException> onError) {
    checkNotNull(onSnapshot, "onSnapshot");
    checkNotNull(onError, "onError");
    checkState(isSubscribedUpdater.compareAndSet(this, 0, 1), "watch %s is already subscribed", watchId);

    LOGGER.info("[{}] subscribing to target {}", watchId, describeTarget());
    serialExecutor.execute(() -> {
      this.onSnapshot = onSnapshot;
      this.onError = onError;
      scheduleOpen();
    });
    return this::cancel;
  }

  /**
   * Stops the watch. Cancel may be called multiple times, with each subsequent call being a no-op.
   *
   * <p>Once cancel returns, the listeners receive no further calls. If a listener is running on another thread, cancel
   * waits for it to return. Calling cancel from inside a listener is allowed.
   */
  public void cancel() {
    boolean cancelled;
    synchronized (deliveryLock) {
      cancelled = isClosedUpdater.compareAndSet(this, 0, 1);
    }
    if (cancelled) {
      state = State.CLOSED;
      LOGGER.info("[{}] cancelled", watchId);
      serialExecutor.execute(() -> {
        closeCurrentStream();
        pending.clear();
        callbacks.onClose(watchId, null);
      });
    }
  }

  public boolean isClosed() {
    return isClosedUpdater.get(this) == 1;
  }

  private void scheduleOpen() {
    long delayMillis = backoff.nextDelayMillis();
    if (delayMillis <= 0) {
      serialExecutor.execute(this::openStream);
    } else {
      LOGGER.debug("[{}] reopening stream in {} ms", watchId, delayMillis);
      scheduler.schedule(() -> serialExecutor.execute(this::openStream), delayMillis, TimeUnit.MILLISECONDS);
    }
  }

  private void openStream() {
    if (isClosed()) {
      LOGGER.debug("[{}] not opening stream for closed watch", watchId);
      return;
    }

    int generation = ++streamGeneration;
    try {
      stream = transport.openStream(new StreamObserver(generation));
    } catch (RuntimeException e) {
      closeWithError(WatchException.fromThrowable(e));
      return;
    }

    Target request = resumeToken.isEmpty() ? target : target.toBuilder().setResumeToken(resumeToken).build();
    LOGGER.info("[{}] opened stream {}, resuming: {}", watchId, generation, !resumeToken.isEmpty());
    callbacks.onStreamOpen(watchId);
    stream.addTarget(request);
  }

  private void closeCurrentStream() {
    streamGeneration++;
    if (stream != null) {
      stream.close();
      stream = null;
    }
  }

  private void onEvent(ListenEvent event) {
    switch (event.kind()) {
      case TARGET_CHANGED:
        onTargetChanged((ListenEvent.TargetChanged) event);
        break;
      case DOCUMENT_UPDATED:
        onDocumentUpdated((ListenEvent.DocumentUpdated) event);
        break;
      case DOCUMENT_DELETED:
        LOGGER.debug("[{}] received document delete", watchId);
        pending.remove(((ListenEvent.DocumentDeleted) event).documentName());
        break;
      case DOCUMENT_REMOVED:
        LOGGER.debug("[{}] received document remove", watchId);
        pending.remove(((ListenEvent.DocumentRemoved) event).documentName());
        break;
      case EXISTENCE_FILTER:
        onExistenceFilter((ListenEvent.ExistenceFilter) event);
        break;
      default:
        closeWithError(new WatchException(
            Status.INTERNAL.withDescription("Unknown listen event: " + event.kind())));
    }
  }

  private void onTargetChanged(ListenEvent.TargetChanged change) {
    LOGGER.debug("[{}] processing target change {} for targets {}", watchId, change.type(), change.targetIds());

    switch (change.type()) {
      case NO_CHANGE:
        if (change.targetIds().isEmpty() && change.readTime() != null && current) {
          push(change.readTime(), change.resumeToken());
        }
        break;
      case ADD:
        if (change.targetIds().isEmpty() || change.targetIds().get(0) != WATCH_TARGET_ID) {
          closeWithError(new WatchException(
              Status.INTERNAL.withDescription("Unexpected target ID sent by server")));
          return;
        }
        state = current ? State.CURRENT : State.OPEN;
        break;
      case REMOVE:
        Status cause = change.cause() != null
            ? change.cause()
            : Status.INTERNAL.withDescription("internal error");
        closeWithError(new WatchException(cause));
        return;
      case RESET:
        resetDocs();
        break;
      case CURRENT:
        current = true;
        state = State.CURRENT;
        if (change.readTime() != null && change.affects(WATCH_TARGET_ID)) {
          push(change.readTime(), change.resumeToken());
        }
        break;
      default:
        closeWithError(new WatchException(
            Status.INTERNAL.withDescription("Unknown target change type: " + change.type())));
        return;
    }

    if (!change.resumeToken().isEmpty() && change.affects(WATCH_TARGET_ID)) {
      backoff.reset();
    }
  }

  private void onDocumentUpdated(ListenEvent.DocumentUpdated change) {
    Document document = change.document();
    if (change.targetIds().contains(WATCH_TARGET_ID)) {
      LOGGER.debug("[{}] received document change for {}", watchId, document.getName());
      pending.upsert(document);
    } else if (change.removedTargetIds().contains(WATCH_TARGET_ID)) {
      LOGGER.debug("[{}] received document remove for {}", watchId, document.getName());
      pending.remove(document.getName());
    }
  }

  private void onExistenceFilter(ListenEvent.ExistenceFilter filter) {
    if (filter.targetId() != WATCH_TARGET_ID) {
      return;
    }
    int expected = pending.sizeAfterApplying(documents);
    if (filter.count() != expected) {
      LOGGER.info("[{}] existence filter mismatch, server has {} documents, cache has {}, resetting",
          watchId, filter.count(), expected);
      resetDocs();
      resetStream();
    }
  }

  /**
   * Forgets everything received since the last snapshot and marks every document of that snapshot as removed. The
   * backend re-sends the documents that still match.
   */
  private void resetDocs() {
    LOGGER.debug("[{}] resetting documents", watchId);
    pending.clear();
    resumeToken = ByteString.EMPTY;
    for (String name : documents.names()) {
      pending.remove(name);
    }
    current = false;
    if (state == State.CURRENT) {
      state = State.OPEN;
    }
  }

  private void resetStream() {
    if (stream == null) {
      return;
    }
    LOGGER.info("[{}] restarting stream without resume token", watchId);
    stream.removeTarget(WATCH_TARGET_ID);
    closeCurrentStream();
    scheduleOpen();
  }

  private void maybeReopenStream(Throwable error) {
    if (isClosed()) {
      return;
    }
    if (isPermanentError(error)) {
      closeWithError(WatchException.fromThrowable(error));
      return;
    }

    Status status = Status.fromThrowable(error);
    LOGGER.warn("[{}] stream failed with retryable status {}, reopening", watchId, status);

    // the failed stream is already terminated
    stream = null;
    streamGeneration++;

    pending.clear();
    if (resumeToken.isEmpty()) {
      resetDocs();
    }
    if (status.getCode() == Status.Code.RESOURCE_EXHAUSTED) {
      backoff.resetToMax();
    }
    forcePush = true;
    state = State.RECONNECTING;
    callbacks.onStreamRetry(watchId, status);
    scheduleOpen();
  }

  /**
   * Returns true if the stream must not be reopened after {@code error}. Errors raised by this client and statuses
   * outside the retryable set are permanent; errors without a status are not.
   */
  static boolean isPermanentError(Throwable error) {
    if (error instanceof WatchException) {
      return true;
    }
    switch (Status.fromThrowable(error).getCode()) {
      case CANCELLED:
      case UNKNOWN:
      case DEADLINE_EXCEEDED:
      case RESOURCE_EXHAUSTED:
      case INTERNAL:
      case UNAVAILABLE:
      case UNAUTHENTICATED:
        return false;
      default:
        return true;
    }
  }

  /**
   * Applies the pending changes to the documents of the last snapshot and delivers a new snapshot if anything
   * changed, if nothing was delivered yet or if the stream was reopened since the last delivery.
   */
  private void push(Timestamp readTime, ByteString nextResumeToken) {
    List<String> deletes = new ArrayList<>();
    List<DocumentSnapshot> adds = new ArrayList<>();
    List<DocumentSnapshot> updates = new ArrayList<>();

    for (String name : pending.removals()) {
      if (documents.contains(name)) {
        deletes.add(name);
      }
    }
    for (Map.Entry<String, Document> upsert : pending.upserts().entrySet()) {
      DocumentSnapshot snapshot;
      try {
        snapshot = decoder.decode(upsert.getValue(), readTime);
      } catch (DocumentDecodeException e) {
        closeWithError(new WatchException(Status.INTERNAL
            .withDescription("Failed to decode document " + upsert.getKey())
            .withCause(e)));
        return;
      }
      if (documents.contains(upsert.getKey())) {
        updates.add(snapshot);
      } else {
        adds.add(snapshot);
      }
    }

    List<DocumentChange> changes = new ArrayList<>();

    deletes.sort((left, right) -> comparator.compare(documents.get(left), documents.get(right)));
    for (String name : deletes) {
      DocumentSnapshot oldDocument = documents.get(name);
      int oldIndex = documents.remove(name);
      changes.add(DocumentChange.removed(oldDocument, oldIndex));
    }

    adds.sort(comparator);
    for (DocumentSnapshot document : adds) {
      int newIndex = documents.add(document);
      changes.add(DocumentChange.added(document, newIndex));
    }

    updates.sort(comparator);
    for (DocumentSnapshot document : updates) {
      DocumentSnapshot oldDocument = documents.get(document.name());
      if (!oldDocument.updateTime().equals(document.updateTime())) {
        int oldIndex = documents.remove(document.name());
        int newIndex = documents.add(document);
        changes.add(DocumentChange.modified(document, oldIndex, newIndex));
      }
    }

    pending.clear();
    if (!nextResumeToken.isEmpty()) {
      resumeToken = nextResumeToken;
    }

    if (!hasPushed || !changes.isEmpty() || forcePush) {
      hasPushed = true;
      forcePush = false;
      QuerySnapshot snapshot = QuerySnapshot.create(readTime, documents.documents(), changes);
      LOGGER.debug("[{}] sending snapshot at {} with {} changes and {} documents",
          watchId, Timestamps.toString(readTime), changes.size(), snapshot.size());
      deliver(snapshot);
    }
  }

  private void deliver(QuerySnapshot snapshot) {
    if (isClosed()) {
      return;
    }
    callbacks.onSnapshot(watchId, snapshot.size(), snapshot.changes());
    synchronized (deliveryLock) {
      if (isClosed()) {
        LOGGER.debug("[{}] dropping snapshot, watch was cancelled", watchId);
        return;
      }
      try {
        onSnapshot.accept(snapshot);
      } catch (RuntimeException e) {
        LOGGER.error("[{}] snapshot listener threw an exception", watchId, e);
      }
    }
  }

  private void closeWithError(WatchException error) {
    synchronized (deliveryLock) {
      if (!isClosedUpdater.compareAndSet(this, 0, 1)) {
        return;
      }
      state = State.CLOSED;
      LOGGER.error("[{}] closing watch after error", watchId, error);
      closeCurrentStream();
      pending.clear();
      callbacks.onClose(watchId, error);
      try {
        onError.accept(error);
      } catch (RuntimeException e) {
        LOGGER.error("[{}] error listener threw an exception", watchId, e);
      }
    }
  }

  private String describeTarget() {
    if (target.hasDocuments()) {
      return target.getDocuments().getDocumentsList().toString();
    }
    return "query under " + target.getQuery().getParent();
  }

  /**
   * Moves the events of one stream onto the serial executor, dropping them once the stream was replaced or the watch
   * was closed.
   */
  private class StreamObserver implements ListenStreamObserver {

    private final int generation;

    StreamObserver(int generation) {
      this.generation = generation;
    }

    @Override
    public void onEvent(ListenEvent event) {
      serialExecutor.execute(() -> {
        if (isLive()) {
          Watch.this.onEvent(event);
        }
      });
    }

    @Override
    public void onError(Throwable error) {
      serialExecutor.execute(() -> {
        if (isLive()) {
          maybeReopenStream(error);
        }
      });
    }

    @Override
    public void onCompleted() {
      serialExecutor.execute(() -> {
        if (isLive()) {
          LOGGER.debug("[{}] processing stream end", watchId);
          maybeReopenStream(Status.UNKNOWN.withDescription("Stream ended unexpectedly").asRuntimeException());
        }
      });
    }

    private boolean isLive() {
      return generation == streamGeneration && !isClosed();
    }
  }
}
