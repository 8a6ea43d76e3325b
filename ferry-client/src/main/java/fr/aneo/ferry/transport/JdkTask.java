/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.ferry.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static fr.aneo.ferry.exception.FerryException.unwrap;

/**
 * Common machinery of the tasks created by {@link JdkNetworkSession}.
 * <p>
 * A task sends its current request, offers redirects and basic authentication challenges to the
 * delegate, then streams the body of the final response one chunk at a time. Subclasses decide
 * what to do with the chunks.
 */
abstract class JdkTask implements NetworkTask {
  private static final Logger logger = LoggerFactory.getLogger(JdkTask.class);
  private static final Pattern BASIC_REALM = Pattern.compile("realm=\"?([^\",]*)\"?", Pattern.CASE_INSENSITIVE);

  protected final JdkNetworkSession session;
  protected final Object lock = new Object();

  private final long identifier;
  private final HttpRequest originalRequest;
  private final AtomicBoolean completed = new AtomicBoolean();
  private final AtomicLong bytesReceived = new AtomicLong();
  private final AtomicLong bytesSent = new AtomicLong();

  private volatile HttpRequest currentRequest;
  private volatile HttpResponseHead response;
  private volatile long expectedToReceive = -1;
  private volatile long expectedToSend = -1;
  private volatile Instant taskStart;
  private volatile int redirectCount;
  private volatile int previousFailureCount;

  // guarded by lock
  private State state = State.SUSPENDED;
  private boolean started;
  private boolean demandPaused;
  private Flow.Subscription subscription;
  private CompletableFuture<?> exchange;

  JdkTask(JdkNetworkSession session, long identifier, HttpRequest originalRequest) {
    this.session = session;
    this.identifier = identifier;
    this.originalRequest = originalRequest;
    this.currentRequest = originalRequest;
    originalRequest.bodyPublisher().ifPresent(body -> expectedToSend = body.contentLength());
  }

  @Override
  public long taskIdentifier() {
    return identifier;
  }

  @Override
  public HttpRequest originalRequest() {
    return originalRequest;
  }

  @Override
  public HttpRequest currentRequest() {
    return currentRequest;
  }

  @Override
  public HttpResponseHead response() {
    return response;
  }

  @Override
  public State state() {
    synchronized (lock) {
      return state;
    }
  }

  @Override
  public long countOfBytesReceived() {
    return bytesReceived.get();
  }

  @Override
  public long countOfBytesExpectedToReceive() {
    return expectedToReceive;
  }

  @Override
  public long countOfBytesSent() {
    return bytesSent.get();
  }

  @Override
  public long countOfBytesExpectedToSend() {
    return expectedToSend;
  }

  @Override
  public void resume() {
    boolean start = false;
    Flow.Subscription toRequest = null;
    synchronized (lock) {
      if (state != State.SUSPENDED) return;
      state = State.RUNNING;
      if (!started) {
        started = true;
        start = true;
      } else if (demandPaused && subscription != null) {
        demandPaused = false;
        toRequest = subscription;
      }
    }

    if (start) {
      taskStart = Instant.now();
      send(currentRequest);
    }
    if (toRequest != null) toRequest.request(1);
  }

  @Override
  public void suspend() {
    synchronized (lock) {
      if (state == State.RUNNING) state = State.SUSPENDED;
    }
  }

  @Override
  public void cancel() {
    if (!beginCancel()) return;
    complete(new CancellationException("Task " + identifier + " cancelled"));
  }

  /**
   * Moves the task to {@link State#CANCELING} and aborts the exchange in flight.
   *
   * @return {@code false} if the task was already cancelling or completed
   */
  protected final boolean beginCancel() {
    Flow.Subscription toCancel;
    CompletableFuture<?> toAbort;
    synchronized (lock) {
      if (state == State.CANCELING || state == State.COMPLETED) return false;
      state = State.CANCELING;
      toCancel = subscription;
      toAbort = exchange;
    }
    if (toCancel != null) toCancel.cancel();
    if (toAbort != null) toAbort.cancel(true);
    return true;
  }

  protected final boolean isDone() {
    synchronized (lock) {
      return state == State.CANCELING || state == State.COMPLETED;
    }
  }

  /**
   * Reports the completion of the task exactly once, preceded by its metrics.
   */
  protected final void complete(Throwable error) {
    if (!completed.compareAndSet(false, true)) return;

    synchronized (lock) {
      state = State.COMPLETED;
    }
    var end = Instant.now();
    var metrics = new TaskMetrics(taskStart == null ? end : taskStart, end, redirectCount);
    willComplete(error);

    if (error != null) logger.debug("Task {} completed with {}", identifier, error.toString());
    var delegate = session.delegate();
    session.post(() -> {
      delegate.onMetrics(this, metrics);
      delegate.onComplete(this, error);
    });
    session.unregister(this);
  }

  /**
   * Called with the head of the response whose body is about to be streamed.
   */
  protected void didReceiveResponse(HttpResponseHead head) throws IOException {
  }

  protected abstract void didReceiveData(byte[] data) throws IOException;

  /**
   * Called once the whole body was received. Implementations must eventually call {@link #complete}.
   */
  protected void didFinishBody() {
    complete(null);
  }

  /**
   * Called exactly once, before the completion event is posted.
   */
  protected void willComplete(Throwable error) {
  }

  protected final void didSendBodyData(long length) {
    long total = bytesSent.addAndGet(length);
    long expected = expectedToSend;
    session.post(() -> session.delegate().onSendBodyData(this, length, total, expected));
  }

  private void send(HttpRequest request) {
    currentRequest = request;
    bytesSent.set(0);

    var future = session.client().sendAsync(request, BodyHandlers.ofPublisher());
    synchronized (lock) {
      if (state == State.CANCELING || state == State.COMPLETED) {
        future.cancel(true);
        return;
      }
      exchange = future;
    }

    future.whenComplete((httpResponse, failure) -> {
      if (failure != null) {
        complete(unwrap(failure));
      } else {
        onHeaders(httpResponse);
      }
    });
  }

  private void onHeaders(HttpResponse<Flow.Publisher<List<ByteBuffer>>> httpResponse) {
    if (isDone()) {
      discard(httpResponse.body());
      return;
    }

    var head = new HttpResponseHead(httpResponse.statusCode(), httpResponse.uri(), httpResponse.headers());
    var location = head.header("Location");
    if (head.isRedirection() && head.statusCode() != 304 && location.isPresent() && redirectCount < JdkNetworkSession.MAX_REDIRECTS) {
      var proposed = redirectRequest(currentRequest, head, location.get());
      session.post(() -> session.delegate().onRedirect(this, head, proposed, next -> onRedirectDecision(httpResponse, head, next)));
      return;
    }

    var realm = basicRealm(head);
    if (head.statusCode() == 401 && realm != null) {
      var uri = currentRequest.uri();
      var challenge = AuthenticationChallenge.httpBasic(uri.getHost(), uri.getPort(), realm, previousFailureCount, head);
      session.post(() -> session.delegate().onChallenge(this, challenge, evaluation -> onChallengeEvaluation(httpResponse, head, evaluation)));
      return;
    }

    deliver(httpResponse, head);
  }

  private void onRedirectDecision(HttpResponse<Flow.Publisher<List<ByteBuffer>>> httpResponse, HttpResponseHead head, HttpRequest next) {
    if (isDone()) {
      discard(httpResponse.body());
      return;
    }
    if (next == null) {
      deliver(httpResponse, head);
      return;
    }

    discard(httpResponse.body());
    redirectCount++;
    send(next);
  }

  private void onChallengeEvaluation(HttpResponse<Flow.Publisher<List<ByteBuffer>>> httpResponse, HttpResponseHead head, ChallengeEvaluation evaluation) {
    if (isDone()) {
      discard(httpResponse.body());
      return;
    }

    switch (evaluation.disposition()) {
      case USE_CREDENTIAL:
        if (evaluation.credential() == null) {
          deliver(httpResponse, head);
          return;
        }
        discard(httpResponse.body());
        previousFailureCount++;
        var authorized = HttpRequest.newBuilder(currentRequest, (name, value) -> !name.equalsIgnoreCase("Authorization"))
                                    .header("Authorization", evaluation.credential().basicAuthorization())
                                    .build();
        send(authorized);
        return;
      case CANCEL_AUTHENTICATION_CHALLENGE:
        discard(httpResponse.body());
        var error = evaluation.error() != null ? evaluation.error() : new IOException("Authentication challenge cancelled");
        if (beginCancel()) complete(error);
        return;
      default:
        deliver(httpResponse, head);
    }
  }

  private void deliver(HttpResponse<Flow.Publisher<List<ByteBuffer>>> httpResponse, HttpResponseHead head) {
    response = head;
    expectedToReceive = head.expectedContentLength();
    session.post(() -> session.delegate().onResponse(this, head));

    try {
      didReceiveResponse(head);
    } catch (IOException e) {
      discard(httpResponse.body());
      complete(e);
      return;
    }
    httpResponse.body().subscribe(new BodySubscriber());
  }

  private static void discard(Flow.Publisher<List<ByteBuffer>> body) {
    body.subscribe(new Flow.Subscriber<>() {
      @Override
      public void onSubscribe(Flow.Subscription subscription) {
        subscription.cancel();
      }

      @Override
      public void onNext(List<ByteBuffer> item) {
      }

      @Override
      public void onError(Throwable throwable) {
      }

      @Override
      public void onComplete() {
      }
    });
  }

  /**
   * Builds the request a redirect leads to. {@code 303} always becomes a {@code GET}, and so do
   * {@code 301} and {@code 302} answering a {@code POST}; other redirects keep method and body.
   */
  static HttpRequest redirectRequest(HttpRequest current, HttpResponseHead head, String location) {
    URI target = current.uri().resolve(location);
    int status = head.statusCode();
    String method = current.method();
    boolean switchToGet = status == 303 && !method.equals("HEAD")
      || (status == 301 || status == 302) && method.equals("POST");

    if (!switchToGet) {
      return HttpRequest.newBuilder(current, (name, value) -> true).uri(target).build();
    }
    return HttpRequest.newBuilder(current, (name, value) -> !name.equalsIgnoreCase("Content-Type"))
                      .uri(target)
                      .GET()
                      .build();
  }

  private static String basicRealm(HttpResponseHead head) {
    for (String challenge : head.headers().allValues("WWW-Authenticate")) {
      if (!challenge.toLowerCase(Locale.ROOT).startsWith("basic")) continue;
      Matcher matcher = BASIC_REALM.matcher(challenge);
      return matcher.find() ? matcher.group(1) : "";
    }
    return null;
  }

  private final class BodySubscriber implements Flow.Subscriber<List<ByteBuffer>> {
    private Flow.Subscription bodySubscription;

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      boolean running;
      synchronized (lock) {
        if (state == State.CANCELING || state == State.COMPLETED) {
          subscription.cancel();
          return;
        }
        JdkTask.this.subscription = subscription;
        bodySubscription = subscription;
        running = state == State.RUNNING;
        demandPaused = !running;
      }
      if (running) subscription.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
      if (isDone()) return;

      int length = items.stream().mapToInt(ByteBuffer::remaining).sum();
      if (length > 0) {
        var bytes = new byte[length];
        int position = 0;
        for (ByteBuffer item : items) {
          int remaining = item.remaining();
          item.get(bytes, position, remaining);
          position += remaining;
        }
        bytesReceived.addAndGet(length);
        try {
          didReceiveData(bytes);
        } catch (IOException e) {
          bodySubscription.cancel();
          complete(e);
          return;
        }
      }

      boolean more;
      synchronized (lock) {
        more = state == State.RUNNING;
        if (state == State.SUSPENDED) demandPaused = true;
      }
      if (more) bodySubscription.request(1);
    }

    @Override
    public void onError(Throwable throwable) {
      complete(unwrap(throwable));
    }

    @Override
    public void onComplete() {
      if (isDone()) return;
      didFinishBody();
    }
  }
}
