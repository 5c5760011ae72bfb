package io.firewatch.client;

import com.google.firestore.v1.FirestoreGrpc.FirestoreImplBase;
import com.google.firestore.v1.ListenRequest;
import com.google.firestore.v1.ListenResponse;
import io.grpc.stub.StreamObserver;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Firestore service whose {@code Listen} behavior is scripted by the test.
 */
class FakeFirestoreService extends FirestoreImplBase {

  /**
   * Reacts to a request received on the n-th listen call, counting from 1.
   */
  interface ListenHandler {
    void onRequest(int call, ListenRequest request, StreamObserver<ListenResponse> responses);
  }

  final BlockingQueue<ListenRequest> requests = new LinkedBlockingQueue<>();
  final BlockingQueue<Throwable> cancellations = new LinkedBlockingQueue<>();
  final AtomicInteger calls = new AtomicInteger();
  volatile ListenHandler handler = (call, request, responses) -> { };

  @Override
  public StreamObserver<ListenRequest> listen(StreamObserver<ListenResponse> responseObserver) {
    int call = calls.incrementAndGet();
    return new StreamObserver<ListenRequest>() {
      @Override
      public void onNext(ListenRequest request) {
        requests.add(request);
        handler.onRequest(call, request, responseObserver);
      }

      @Override
      public void onError(Throwable t) {
        cancellations.add(t);
      }

      @Override
      public void onCompleted() {
        responseObserver.onCompleted();
      }
    };
  }
}
