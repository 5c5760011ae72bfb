package io.firewatch.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.firewatch.model.DocumentSnapshot;
import io.firewatch.model.QuerySnapshot;
import io.firewatch.model.ResourcePath;
import io.firewatch.query.Query;
import io.firewatch.watch.DocumentDecoder;
import io.firewatch.watch.ListenTransport;
import io.firewatch.watch.ListenerRegistration;
import io.firewatch.watch.ProtoDocumentDecoder;
import io.firewatch.watch.Watch;
import io.firewatch.watch.WatchException;
import io.firewatch.watch.WatchOptions;
import io.grpc.Channel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code WatchClient} is the entry point for real-time listens on one database. Each listen runs its own
 * {@link Watch}; they share the transport, the decoder and the reconnect scheduler but no state.
 */
public class WatchClient implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WatchClient.class);

  private final ResourcePath root;
  private final ListenTransport transport;
  private final DocumentDecoder decoder;
  private final ExecutorGroup executorGroup;
  private final WatchOptions options;
  private final Set<Watch> watches = ConcurrentHashMap.newKeySet();
  private volatile boolean isClosed;

  public WatchClient(ResourcePath database, ListenTransport transport) {
    this(database, transport, new ProtoDocumentDecoder(), new DefaultExecutorGroup(), WatchOptions.defaults());
  }

  /**
   * Creates a client.
   *
   * @param database      any path of the database to listen to
   * @param transport     opens the listen streams
   * @param decoder       decodes the documents sent by the backend
   * @param executorGroup chooses the executor of each watch
   * @param options       scheduler, backoff and callbacks shared by all watches; the executor is replaced by the one
   *                      {@code executorGroup} picks
   */
  public WatchClient(ResourcePath database, ListenTransport transport, DocumentDecoder decoder,
      ExecutorGroup executorGroup, WatchOptions options) {
    checkNotNull(database, "database");
    this.root = ResourcePath.forDatabase(database.projectId(), database.databaseId());
    this.transport = checkNotNull(transport, "transport");
    this.decoder = checkNotNull(decoder, "decoder");
    this.executorGroup = checkNotNull(executorGroup, "executorGroup");
    this.options = checkNotNull(options, "options");
  }

  /**
   * Creates a client that listens through the given channel with the default settings.
   *
   * @param channel    the channel to the backend; owned by the caller
   * @param projectId  the project that owns the database
   * @param databaseId the database id, usually {@code (default)}
   */
  public static WatchClient forChannel(Channel channel, String projectId, String databaseId) {
    ResourcePath database = ResourcePath.forDatabase(projectId, databaseId);
    return new WatchClient(database, new GrpcListenTransport(channel, database));
  }

  /**
   * Returns the documents root of the database.
   */
  public ResourcePath root() {
    return root;
  }

  /**
   * Listens to a single document. Every snapshot reports whether the document exists at its read time.
   *
   * @param relativePath the document path relative to the documents root, e.g. {@code rooms/lobby}
   * @param listener     receives the snapshots and the terminal error
   * @return a registration that stops the listen
   */
  public ListenerRegistration listenDocument(String relativePath, SnapshotListener<DocumentSnapshot> listener) {
    checkNotNull(listener, "listener");
    ResourcePath path = root.append(relativePath);
    checkArgument(path.isDocument(), "'%s' is not a document path", relativePath);

    Watch watch = Watch.forDocument(path, transport, decoder, nextOptions());
    return register(watch, snapshot -> listener.onSnapshot(toDocumentSnapshot(path, snapshot)), listener::onError);
  }

  /**
   * Listens to the results of a query.
   *
   * @param query    the query; it must belong to this client's database
   * @param listener receives the snapshots and the terminal error
   * @return a registration that stops the listen
   */
  public ListenerRegistration listenQuery(Query query, SnapshotListener<QuerySnapshot> listener) {
    checkNotNull(query, "query");
    checkNotNull(listener, "listener");
    checkArgument(query.parent().databaseName().equals(root.databaseName()),
        "query belongs to %s, not %s", query.parent().databaseName(), root.databaseName());

    Watch watch = Watch.forQuery(query, transport, decoder, nextOptions());
    return register(watch, listener::onSnapshot, listener::onError);
  }

  /**
   * Returns the number of listens that are still running.
   */
  public int activeListens() {
    return watches.size();
  }

  /**
   * Stops every running listen. Listeners receive no further callbacks.
   */
  @Override
  public void close() {
    isClosed = true;
    LOGGER.info("closing watch client for {} with {} active listens", root.databaseName(), watches.size());
    for (Watch watch : watches) {
      watch.cancel();
    }
    watches.clear();
  }

  private ListenerRegistration register(Watch watch, Consumer<QuerySnapshot> onSnapshot,
      Consumer<WatchException> onError) {
    checkState(!isClosed, "client is closed");
    watches.add(watch);
    LOGGER.info("[{}] starting listen on {}", watch.id(), root.databaseName());

    ListenerRegistration registration = watch.subscribe(onSnapshot, error -> {
      watches.remove(watch);
      onError.accept(error);
    });
    return () -> {
      watches.remove(watch);
      registration.remove();
    };
  }

  private WatchOptions nextOptions() {
    return options.toBuilder().executor(executorGroup.next()).build();
  }

  private static DocumentSnapshot toDocumentSnapshot(ResourcePath path, QuerySnapshot snapshot) {
    if (snapshot.isEmpty()) {
      return DocumentSnapshot.missing(path, snapshot.readTime());
    }
    return snapshot.documents().get(0).withReadTime(snapshot.readTime());
  }
}
