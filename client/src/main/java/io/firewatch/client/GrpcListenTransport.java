package io.firewatch.client;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.firestore.v1.FirestoreGrpc;
import com.google.firestore.v1.FirestoreGrpc.FirestoreStub;
import com.google.firestore.v1.ListenRequest;
import com.google.firestore.v1.ListenResponse;
import com.google.firestore.v1.Target;
import io.firewatch.model.ResourcePath;
import io.firewatch.watch.ListenEvent;
import io.firewatch.watch.ListenStream;
import io.firewatch.watch.ListenStreamObserver;
import io.firewatch.watch.ListenTransport;
import io.firewatch.watch.WatchException;
import io.grpc.Channel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.MetadataUtils;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GrpcListenTransport} opens listen streams with the {@code Firestore/Listen} RPC. Every request carries the
 * database name and the configured labels; the database is also sent as routing headers.
 */
public class GrpcListenTransport implements ListenTransport {

  static final Metadata.Key<String> REQUEST_PARAMS_HEADER =
      Metadata.Key.of("x-goog-request-params", Metadata.ASCII_STRING_MARSHALLER);
  static final Metadata.Key<String> RESOURCE_PREFIX_HEADER =
      Metadata.Key.of("google-cloud-resource-prefix", Metadata.ASCII_STRING_MARSHALLER);

  private static final Logger LOGGER = LoggerFactory.getLogger(GrpcListenTransport.class);

  private static final AtomicLong STREAM_IDS = new AtomicLong();

  private final FirestoreStub stub;
  private final String database;
  private final ImmutableMap<String, String> labels;

  public GrpcListenTransport(Channel channel, ResourcePath database) {
    this(channel, database, ImmutableMap.of());
  }

  /**
   * Creates a transport.
   *
   * @param channel  the channel to the backend; owned by the caller
   * @param database any path of the database to listen to
   * @param labels   labels attached to every listen request
   */
  public GrpcListenTransport(Channel channel, ResourcePath database, Map<String, String> labels) {
    checkNotNull(channel, "channel");
    checkNotNull(database, "database");
    this.database = database.databaseName();
    this.labels = ImmutableMap.copyOf(labels);

    Metadata headers = new Metadata();
    headers.put(REQUEST_PARAMS_HEADER, "database=" + this.database);
    headers.put(RESOURCE_PREFIX_HEADER, this.database);
    this.stub = FirestoreGrpc.newStub(channel)
        .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
  }

  @Override
  public ListenStream openStream(ListenStreamObserver observer) {
    checkNotNull(observer, "observer");
    GrpcListenStream stream = new GrpcListenStream(STREAM_IDS.incrementAndGet(), observer);
    stub.listen(stream);
    return stream;
  }

  /**
   * One {@code Listen} call. Responses are converted and passed on until the call ends or is closed locally.
   */
  private class GrpcListenStream implements ListenStream, ClientResponseObserver<ListenRequest, ListenResponse> {

    private final long streamId;
    private final ListenStreamObserver observer;
    private volatile ClientCallStreamObserver<ListenRequest> requestStream;
    private volatile boolean isClosed;

    GrpcListenStream(long streamId, ListenStreamObserver observer) {
      this.streamId = streamId;
      this.observer = observer;
    }

    @Override
    public void beforeStart(ClientCallStreamObserver<ListenRequest> requestStream) {
      this.requestStream = requestStream;
    }

    @Override
    public void addTarget(Target target) {
      LOGGER.debug("[{}] adding target {} to {}", streamId, target.getTargetId(), database);
      send(newRequest().setAddTarget(target).build());
    }

    @Override
    public void removeTarget(int targetId) {
      LOGGER.debug("[{}] removing target {}", streamId, targetId);
      send(newRequest().setRemoveTarget(targetId).build());
    }

    @Override
    public void close() {
      if (isClosed) {
        return;
      }
      isClosed = true;
      LOGGER.debug("[{}] closing listen stream", streamId);
      requestStream.cancel("listen stream closed", null);
    }

    @Override
    public void onNext(ListenResponse response) {
      if (isClosed) {
        return;
      }

      ListenEvent event;
      try {
        event = ListenResponses.toEvent(response);
      } catch (IllegalArgumentException e) {
        LOGGER.warn("[{}] closing listen stream after unreadable response", streamId, e);
        close();
        observer.onError(new WatchException(Status.INTERNAL.withDescription(e.getMessage()).withCause(e)));
        return;
      }
      observer.onEvent(event);
    }

    @Override
    public void onError(Throwable t) {
      if (isClosed) {
        return;
      }
      LOGGER.debug("[{}] listen stream failed with {}", streamId, Status.fromThrowable(t));
      isClosed = true;
      observer.onError(t);
    }

    @Override
    public void onCompleted() {
      if (isClosed) {
        return;
      }
      LOGGER.debug("[{}] listen stream completed by server", streamId);
      isClosed = true;
      observer.onCompleted();
    }

    private ListenRequest.Builder newRequest() {
      return ListenRequest.newBuilder()
          .setDatabase(database)
          .putAllLabels(labels);
    }

    private void send(ListenRequest request) {
      if (isClosed) {
        LOGGER.debug("[{}] dropping request on closed listen stream", streamId);
        return;
      }
      requestStream.onNext(request);
    }
  }
}
