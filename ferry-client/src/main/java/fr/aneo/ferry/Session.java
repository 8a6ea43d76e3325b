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
package fr.aneo.ferry;

import fr.aneo.ferry.encoding.EncodedRequest;
import fr.aneo.ferry.encoding.HttpMethod;
import fr.aneo.ferry.encoding.ParameterEncoding;
import fr.aneo.ferry.encoding.RequestConvertible;
import fr.aneo.ferry.encoding.UrlEncoding;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.interceptor.CompositeInterceptor;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.interceptor.RetryResult;
import fr.aneo.ferry.internal.concurrent.FerryExecutors;
import fr.aneo.ferry.monitor.CompositeEventMonitor;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.DownloadTask;
import fr.aneo.ferry.transport.NetworkSession;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.Uploadable;
import fr.aneo.ferry.trust.ServerTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Creates and drives requests.
 * <p>
 * A session owns a {@link NetworkSession} and a serial root executor. Every request of the
 * session is set up, retried and finished on that executor, so requests never race with their
 * own task events. Requests start as soon as their first response handler is attached, unless
 * {@link SessionConfig#startRequestsImmediately()} is turned off.
 * <p>
 * Sessions are thread-safe. {@link #close()} cancels every outstanding request; requests created
 * afterwards fail with a {@code SESSION_DEINITIALIZED} error.
 *
 * <pre>{@code
 * try (var session = new Session()) {
 *   session.request("https://example.com/items")
 *          .validate()
 *          .responseJson(response -> System.out.println(response.result()));
 * }
 * }</pre>
 */
public class Session implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Session.class);
  private static final AtomicInteger SESSION_COUNTER = new AtomicInteger();

  private final SessionConfig config;
  private final ExecutorService rootExecutor;
  private final EventMonitor eventMonitor;
  private final RequestTaskMap requestTaskMap = new RequestTaskMap();
  private final Set<Request> activeRequests = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Coordinator coordinator = new Coordinator();
  private final NetworkSession networkSession;

  public Session() {
    this(SessionConfig.defaults());
  }

  public Session(SessionConfig config) {
    this.config = requireNonNull(config, "config must not be null");
    this.rootExecutor = FerryExecutors.newSerialExecutor("ferry-session-" + SESSION_COUNTER.incrementAndGet() + "-root");
    this.eventMonitor = new CompositeEventMonitor(config.eventMonitors());
    this.networkSession = requireNonNull(config.networkSessionFactory().create(new SessionDelegate(coordinator)),
      "networkSessionFactory must not create a null session");
    logger.debug("Session created with {}", config);
  }

  /**
   * Returns the process wide session with the default configuration, created on first use.
   *
   * @return the shared session
   */
  public static Session defaultSession() {
    return DefaultSessionHolder.INSTANCE;
  }

  public SessionConfig config() {
    return config;
  }

  // Data requests

  public DataRequest request(String url) {
    return request(EncodedRequest.of(url));
  }

  public DataRequest request(String url, HttpMethod method) {
    return request(EncodedRequest.of(url, method));
  }

  /**
   * Creates a request from its parts.
   *
   * @param url        the URL
   * @param method     the HTTP method
   * @param parameters the parameters, or {@code null}
   * @param encoding   how to encode the parameters, or {@code null} for the default URL encoding
   * @param headers    the headers, or {@code null}
   * @return the request
   */
  public DataRequest request(String url, HttpMethod method, Map<String, ?> parameters, ParameterEncoding encoding, Map<String, String> headers) {
    var convertible = EncodedRequest.of(url, method);
    if (parameters != null) {
      convertible = convertible.withParameters(parameters, encoding == null ? new UrlEncoding() : encoding);
    }
    if (headers != null) convertible = convertible.withHeaders(headers);
    return request(convertible);
  }

  public DataRequest request(RequestConvertible convertible) {
    return request(convertible, null);
  }

  /**
   * Creates a request.
   *
   * @param convertible produces the wire request on every attempt
   * @param interceptor the interceptor of this request, applied before the session one; may be {@code null}
   * @return the request, started once a response handler is attached
   */
  public DataRequest request(RequestConvertible convertible, Interceptor interceptor) {
    var request = new DataRequest(convertible, interceptor, coordinator);
    perform(request);
    return request;
  }

  // Uploads

  public UploadRequest upload(byte[] data, RequestConvertible convertible) {
    requireNonNull(data, "data must not be null");
    var copy = data.clone();
    return upload(() -> Uploadable.data(copy), convertible, null);
  }

  /**
   * Uploads a file. The file is not removed after the upload.
   */
  public UploadRequest upload(Path file, RequestConvertible convertible) {
    requireNonNull(file, "file must not be null");
    return upload(() -> Uploadable.file(file, false), convertible, null);
  }

  /**
   * Uploads a stream. The supplier is called again on retry and must return a fresh stream.
   */
  public UploadRequest upload(Supplier<InputStream> stream, RequestConvertible convertible) {
    requireNonNull(stream, "stream must not be null");
    return upload(() -> Uploadable.stream(stream), convertible, null);
  }

  public UploadRequest upload(UploadRequest.UploadableConvertible uploadable, RequestConvertible convertible, Interceptor interceptor) {
    var request = new UploadRequest(convertible, uploadable, interceptor, coordinator);
    perform(request);
    return request;
  }

  // Downloads

  public DownloadRequest download(RequestConvertible convertible) {
    return download(convertible, null, null);
  }

  public DownloadRequest download(RequestConvertible convertible, DownloadRequest.Destination destination) {
    return download(convertible, null, destination);
  }

  /**
   * Creates a download.
   *
   * @param convertible produces the wire request on every attempt
   * @param interceptor the interceptor of this request; may be {@code null}
   * @param destination where to move the downloaded file; {@code null} for a unique file in the temporary directory
   * @return the download
   */
  public DownloadRequest download(RequestConvertible convertible, Interceptor interceptor, DownloadRequest.Destination destination) {
    requireNonNull(convertible, "convertible must not be null");
    var request = new DownloadRequest(convertible, null, destination, interceptor, coordinator);
    perform(request);
    return request;
  }

  public DownloadRequest download(byte[] resumeData, DownloadRequest.Destination destination) {
    return download(resumeData, null, destination);
  }

  /**
   * Continues a cancelled download.
   *
   * @param resumeData  the data produced by {@link DownloadRequest#cancel(Consumer)}
   * @param interceptor the interceptor of this request; may be {@code null}
   * @param destination where to move the downloaded file; {@code null} for a unique file in the temporary directory
   * @return the download
   */
  public DownloadRequest download(byte[] resumeData, Interceptor interceptor, DownloadRequest.Destination destination) {
    requireNonNull(resumeData, "resumeData must not be null");
    var request = new DownloadRequest(null, resumeData, destination, interceptor, coordinator);
    perform(request);
    return request;
  }

  // Bulk operations

  /**
   * Passes the requests still running to {@code action}, on the root executor.
   *
   * @param action receives an immutable snapshot of the active requests
   */
  public void withAllRequests(Consumer<Set<Request>> action) {
    requireNonNull(action, "action must not be null");
    executeOnRoot(() -> action.accept(Set.copyOf(activeRequests)));
  }

  public void cancelAllRequests() {
    cancelAllRequests(config.callbackExecutor(), null);
  }

  /**
   * Cancels every active request.
   *
   * @param executor   where {@code completion} runs
   * @param completion called once every request was told to cancel, may be {@code null}
   */
  public void cancelAllRequests(Executor executor, Runnable completion) {
    requireNonNull(executor, "executor must not be null");
    withAllRequests(requests -> {
      requests.forEach(Request::cancel);
      if (completion != null) executor.execute(completion);
    });
  }

  /**
   * Cancels every outstanding request and invalidates the network session. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    logger.debug("Closing session with {} active requests", activeRequests.size());
    executeOnRoot(() -> activeRequests.forEach(request -> request.finish(FerryException.sessionDeinitialized())));
    rootExecutor.shutdown();
    networkSession.invalidateAndCancel();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String toString() {
    return "Session{activeRequests=" + activeRequests.size() + ", closed=" + closed.get() + ", config=" + config + '}';
  }

  // Request lifecycle, on the root executor

  private void perform(Request request) {
    activeRequests.add(request);
    if (closed.get()) {
      request.finish(FerryException.sessionDeinitialized());
      return;
    }
    try {
      rootExecutor.execute(() -> performOnRoot(request));
    } catch (RejectedExecutionException e) {
      request.finish(FerryException.sessionDeinitialized());
    }
  }

  private void performOnRoot(Request request) {
    if (request.isCancelled()) {
      request.finish();
      return;
    }

    if (request instanceof UploadRequest) {
      var upload = (UploadRequest) request;
      Uploadable uploadable;
      try {
        uploadable = upload.createUploadable();
      } catch (FerryException e) {
        upload.didFailToCreateUploadable(e);
        return;
      } catch (Exception e) {
        upload.didFailToCreateUploadable(FerryException.uploadableCreationFailed(e));
        return;
      }
      upload.didCreateUploadable(uploadable);
      performSetupOperations(request);
    } else if (request instanceof DownloadRequest && ((DownloadRequest) request).isResuming()) {
      var download = (DownloadRequest) request;
      DownloadTask task;
      try {
        task = networkSession.downloadTask(download.resumingFrom());
      } catch (RuntimeException e) {
        logger.warn("Could not resume download of request {}", request.id(), e);
        request.didFailToCreateTask(FerryException.createTaskFailed(e));
        return;
      }
      var httpRequest = task.originalRequest();
      request.didCreateInitialHttpRequest(httpRequest);
      request.didCreateHttpRequest(httpRequest);
      registerTask(request, task);
    } else {
      performSetupOperations(request);
    }
  }

  private void performSetupOperations(Request request) {
    HttpRequest initial;
    try {
      initial = convertible(request).asHttpRequest();
    } catch (FerryException e) {
      request.didFailToCreateHttpRequest(e);
      return;
    } catch (Exception e) {
      request.didFailToCreateHttpRequest(FerryException.createUrlRequestFailed(e));
      return;
    }

    request.didCreateInitialHttpRequest(initial);
    if (request.isCancelled()) {
      request.finish();
      return;
    }

    var adapter = interceptor(request);
    if (adapter == null) {
      didCreateHttpRequest(request, initial);
      return;
    }

    CompletionStage<HttpRequest> adaptation;
    try {
      adaptation = adapter.adapt(initial, this);
    } catch (RuntimeException e) {
      adaptation = CompletableFuture.failedFuture(e);
    }
    adaptation.whenComplete((adapted, failure) -> executeOnRoot(() -> {
      if (failure != null || adapted == null) {
        var cause = failure == null
          ? new IllegalStateException("Adapter produced no request")
          : FerryException.unwrap(failure);
        var error = cause instanceof FerryException
          ? (FerryException) cause
          : FerryException.requestAdaptationFailed(cause);
        request.didFailToAdaptHttpRequest(initial, error);
        return;
      }
      if (request.isCancelled()) {
        request.finish();
        return;
      }
      request.didAdaptInitialRequest(initial, adapted);
      didCreateHttpRequest(request, adapted);
    }));
  }

  private void didCreateHttpRequest(Request request, HttpRequest httpRequest) {
    request.didCreateHttpRequest(httpRequest);
    if (request.isCancelled()) {
      request.finish();
      return;
    }

    NetworkTask task;
    try {
      task = createTask(request, httpRequest);
    } catch (RuntimeException e) {
      logger.warn("Could not create the task of request {}", request.id(), e);
      request.didFailToCreateTask(FerryException.createTaskFailed(e));
      return;
    }
    registerTask(request, task);
  }

  private NetworkTask createTask(Request request, HttpRequest httpRequest) {
    if (request instanceof DownloadRequest) return networkSession.downloadTask(httpRequest);
    if (request instanceof UploadRequest) return networkSession.uploadTask(httpRequest, ((UploadRequest) request).uploadable());
    return networkSession.dataTask(httpRequest);
  }

  private void registerTask(Request request, NetworkTask task) {
    var taskDelegate = TaskDelegate.forRequest(request, task);
    requestTaskMap.put(request, taskDelegate);
    request.didCreateTask(taskDelegate);
    taskDelegate.completion().thenRun(() -> executeOnRoot(() -> request.didCompleteTask(taskDelegate)));
    updateStatesForTask(request, task);
  }

  private void updateStatesForTask(Request request, NetworkTask task) {
    switch (request.state()) {
      case RESUMED:
        task.resume();
        request.didResumeTask(task);
        break;
      case SUSPENDED:
        task.suspend();
        request.didSuspendTask(task);
        break;
      case CANCELLED:
        task.cancel();
        request.didCancelTask(task);
        break;
      default:
        break;
    }
  }

  private static RequestConvertible convertible(Request request) {
    if (request instanceof DownloadRequest) return ((DownloadRequest) request).convertible();
    return ((DataRequest) request).convertible();
  }

  private void executeOnRoot(Runnable work) {
    try {
      rootExecutor.execute(work);
    } catch (RejectedExecutionException e) {
      logger.debug("Session closed, dropping work on the root executor");
    }
  }

  private Interceptor interceptor(Request request) {
    return CompositeInterceptor.combine(request.interceptor(), config.interceptor());
  }

  /**
   * Serves both the requests of the session and its network delegate.
   */
  private final class Coordinator implements RequestDelegate, SessionStateProvider {

    @Override
    public Executor rootExecutor() {
      return rootExecutor;
    }

    @Override
    public Executor serializationExecutor() {
      return config.serializationExecutor();
    }

    @Override
    public Executor callbackExecutor() {
      return config.callbackExecutor();
    }

    @Override
    public EventMonitor eventMonitor() {
      return eventMonitor;
    }

    @Override
    public boolean startImmediately() {
      return config.startRequestsImmediately();
    }

    @Override
    public Path temporaryDirectory() {
      return config.temporaryDirectory();
    }

    @Override
    public CompletionStage<RetryResult> retryResult(Request request, FerryException error) {
      var retrier = interceptor(request);
      if (retrier == null) return CompletableFuture.completedFuture(RetryResult.doNotRetry());
      try {
        return retrier.retry(request, Session.this, error);
      } catch (RuntimeException e) {
        return CompletableFuture.failedFuture(e);
      }
    }

    @Override
    public void retryRequest(Request request, Duration delay) {
      Runnable retry = () -> executeOnRoot(() -> {
        if (request.isCancelled()) {
          request.finish();
          return;
        }
        request.prepareForRetry();
        performOnRoot(request);
      });

      if (delay == null || delay.isZero()) {
        retry.run();
        return;
      }
      logger.debug("Retrying request {} in {}", request.id(), delay);
      try {
        config.retryScheduler().schedule(retry, saturatedNanos(delay), TimeUnit.NANOSECONDS);
      } catch (RejectedExecutionException e) {
        executeOnRoot(() -> request.finish(FerryException.sessionDeinitialized()));
      }
    }

    private long saturatedNanos(Duration delay) {
      try {
        return delay.toNanos();
      } catch (ArithmeticException e) {
        return Long.MAX_VALUE;
      }
    }

    @Override
    public void resumeTask(Request request) {
      var task = requestTaskMap.task(request);
      if (task == null) return;
      task.resume();
      request.didResumeTask(task);
    }

    @Override
    public void suspendTask(Request request) {
      var task = requestTaskMap.task(request);
      if (task == null) return;
      task.suspend();
      request.didSuspendTask(task);
    }

    @Override
    public void cancelTask(Request request) {
      var task = requestTaskMap.task(request);
      if (task != null) {
        task.cancel();
        request.didCancelTask(task);
      } else if (!request.isAwaitingTaskCompletion()) {
        request.finish();
      }
    }

    @Override
    public void cancelDownloadTask(DownloadRequest request, Consumer<byte[]> resumeDataHandler) {
      var task = requestTaskMap.task(request);
      if (task instanceof DownloadTask) {
        ((DownloadTask) task).cancelByProducingResumeData(resumeDataHandler);
        request.didCancelTask(task);
        return;
      }
      resumeDataHandler.accept(null);
      cancelTask(request);
    }

    @Override
    public void cleanup(Request request) {
      activeRequests.remove(request);
    }

    @Override
    public Session session() {
      return Session.this;
    }

    @Override
    public Request request(NetworkTask task) {
      return requestTaskMap.request(task);
    }

    @Override
    public TaskDelegate taskDelegate(NetworkTask task) {
      return requestTaskMap.taskDelegate(task);
    }

    @Override
    public void didCompleteTask(NetworkTask task) {
      requestTaskMap.remove(task);
    }

    @Override
    public ServerTrustManager serverTrustManager() {
      return config.serverTrustManager();
    }

    @Override
    public RedirectHandler redirectHandler() {
      return config.redirectHandler();
    }

    @Override
    public Credential defaultCredential(String host) {
      return config.defaultCredential(host);
    }

    @Override
    public void cancelRequestsForSessionInvalidation(Throwable error) {
      logger.debug("Network session invalidated, finishing {} requests", activeRequests.size());
      executeOnRoot(() -> activeRequests.forEach(request -> request.finish(FerryException.sessionInvalidated(error))));
    }
  }

  private static final class DefaultSessionHolder {
    private static final Session INSTANCE = new Session();
  }
}
