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

import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.RequestRetryException;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.interceptor.RetryResult;
import fr.aneo.ferry.internal.concurrent.FerryExecutors;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A unit of work sent through a {@link Session}, retried as a whole when its retrier says so.
 * <p>
 * A request owns at most one network task at a time. Every attempt creates a new wire request
 * and a new task, while the identity of the request, its validators and its response handlers
 * survive across attempts.
 *
 * <h2>Lifecycle</h2>
 * A request starts {@linkplain RequestState#INITIALIZED initialized}. When the session starts
 * requests immediately, which is the default, attaching the first response handler resumes it;
 * otherwise {@link #resume()} must be called. Once its task completes, validators run, the
 * retrier is asked about any error and, when no retry happens, the response handlers run in the
 * order they were attached. Handlers attached after the request finished run right away against
 * the same data.
 *
 * <h2>Threading</h2>
 * {@link #resume()}, {@link #suspend()} and {@link #cancel()} may be called from any thread at
 * any time, and are no-ops once the request reached a terminal state. Response serializers run on
 * the serialization executor of the session, one request at a time in attachment order, and
 * completion handlers are then dispatched on the executor each one was attached with.
 *
 * @see DataRequest
 * @see UploadRequest
 * @see DownloadRequest
 */
public abstract class Request {
  private static final Logger logger = LoggerFactory.getLogger(Request.class);

  private final UUID id = UUID.randomUUID();
  private final Interceptor interceptor;
  final RequestDelegate delegate;
  final EventMonitor eventMonitor;
  final Executor serializationExecutor;

  final Object lock = new Object();

  // guarded by lock
  private RequestState state = RequestState.INITIALIZED;
  private final List<HttpRequest> httpRequests = new ArrayList<>();
  private final List<NetworkTask> tasks = new ArrayList<>();
  private final List<TaskMetrics> metrics = new ArrayList<>();
  private final List<Runnable> validators = new ArrayList<>();
  private final List<Runnable> responseSerializers = new ArrayList<>();
  private final List<Runnable> responseSerializerCompletions = new ArrayList<>();
  private final List<Handler<HttpRequest>> httpRequestHandlers = new ArrayList<>();
  private final List<Handler<NetworkTask>> taskHandlers = new ArrayList<>();
  private boolean responseSerializerProcessingFinished;
  private boolean isFinishing;
  private boolean attemptFinished;
  private boolean awaitingTaskCompletion;
  private int retryCount;
  private FerryException error;
  private Credential credential;
  private RedirectHandler redirectHandler;
  private TaskDelegate taskDelegate;
  private Progress uploadProgress = Progress.NONE;
  private Progress downloadProgress = Progress.NONE;
  private Handler<Progress> uploadProgressHandler;
  private Handler<Progress> downloadProgressHandler;

  Request(Interceptor interceptor, RequestDelegate delegate) {
    this.interceptor = interceptor;
    this.delegate = requireNonNull(delegate, "delegate must not be null");
    this.eventMonitor = delegate.eventMonitor();
    this.serializationExecutor = FerryExecutors.sequential(delegate.serializationExecutor());
  }

  /**
   * Returns the identifier of this request, unique and stable across retries.
   *
   * @return the request identifier
   */
  public UUID id() {
    return id;
  }

  /**
   * Returns the current lifecycle state of this request.
   *
   * @return the state, never {@code null}
   */
  public RequestState state() {
    synchronized (lock) {
      return state;
    }
  }

  /** @return {@code true} until the request is first resumed, suspended or cancelled */
  public boolean isInitialized() {
    return state() == RequestState.INITIALIZED;
  }

  /** @return {@code true} while the request is resumed */
  public boolean isResumed() {
    return state() == RequestState.RESUMED;
  }

  /** @return {@code true} while the request is suspended */
  public boolean isSuspended() {
    return state() == RequestState.SUSPENDED;
  }

  /** @return {@code true} once the request was cancelled, even after it finished */
  public boolean isCancelled() {
    return state() == RequestState.CANCELLED;
  }

  /** @return {@code true} once the request finished without being cancelled */
  public boolean isFinished() {
    return state() == RequestState.FINISHED;
  }

  /**
   * Returns the interceptor given to this request only, combined with the session one at runtime.
   *
   * @return the request interceptor, or {@code null}
   */
  public Interceptor interceptor() {
    return interceptor;
  }

  /**
   * Returns the wire request of the latest attempt, adapted when an adapter ran.
   *
   * @return the last wire request, or {@code null} before the first one is created
   */
  public HttpRequest request() {
    synchronized (lock) {
      return httpRequests.isEmpty() ? null : httpRequests.get(httpRequests.size() - 1);
    }
  }

  /**
   * Returns every wire request created so far: for each attempt, the initial one followed by
   * the adapted one when an adapter ran.
   */
  public List<HttpRequest> httpRequests() {
    synchronized (lock) {
      return List.copyOf(httpRequests);
    }
  }

  /**
   * Returns the network task of the latest attempt.
   *
   * @return the last task, or {@code null} before the first one is created
   */
  public NetworkTask task() {
    synchronized (lock) {
      return tasks.isEmpty() ? null : tasks.get(tasks.size() - 1);
    }
  }

  /**
   * Returns every network task created for this request, one per attempt, oldest first.
   *
   * @return an immutable snapshot of the tasks
   */
  public List<NetworkTask> tasks() {
    synchronized (lock) {
      return List.copyOf(tasks);
    }
  }

  /**
   * Returns the response head received by the latest task.
   *
   * @return the response head, or {@code null} if no response was received
   */
  public HttpResponseHead response() {
    var current = taskDelegate();
    return current == null ? null : current.response();
  }

  /**
   * Returns the metrics gathered for the latest task.
   *
   * @return the last metrics, or {@code null} if none were gathered yet
   */
  public TaskMetrics metrics() {
    synchronized (lock) {
      return metrics.isEmpty() ? null : metrics.get(metrics.size() - 1);
    }
  }

  /**
   * Returns the metrics of every task of this request, oldest first.
   *
   * @return an immutable snapshot of the metrics
   */
  public List<TaskMetrics> allMetrics() {
    synchronized (lock) {
      return List.copyOf(metrics);
    }
  }

  /**
   * Returns how many times this request was retried. The first attempt is not counted.
   *
   * @return the number of retries
   */
  public int retryCount() {
    synchronized (lock) {
      return retryCount;
    }
  }

  /**
   * Returns the first error of the current attempt.
   *
   * @return the error, or {@code null}
   */
  public FerryException error() {
    synchronized (lock) {
      return error;
    }
  }

  /**
   * Returns the upload progress of the current attempt.
   *
   * @return the progress, {@link Progress#NONE} before any byte is sent
   */
  public Progress uploadProgress() {
    synchronized (lock) {
      return uploadProgress;
    }
  }

  /**
   * Returns the download progress of the current attempt.
   *
   * @return the progress, {@link Progress#NONE} before any byte is received
   */
  public Progress downloadProgress() {
    synchronized (lock) {
      return downloadProgress;
    }
  }

  /**
   * Returns the credential answering basic challenges of this request.
   *
   * @return the credential, or {@code null} to fall back to the session default
   */
  public Credential credential() {
    synchronized (lock) {
      return credential;
    }
  }

  /**
   * Returns the redirect handler set with {@link #redirect(RedirectHandler)}.
   *
   * @return the request redirect handler, or {@code null} to use the session one
   */
  public RedirectHandler redirectHandler() {
    synchronized (lock) {
      return redirectHandler;
    }
  }

  /**
   * Answers HTTP basic challenges of this request with the given user and password.
   */
  public Request authenticate(String user, String password) {
    return authenticate(new Credential(user, password));
  }

  /**
   * Answers HTTP basic challenges of this request with {@code credential}, replacing any previous one.
   *
   * @param credential the credential to use
   * @return this request
   * @throws NullPointerException if {@code credential} is null
   */
  public Request authenticate(Credential credential) {
    requireNonNull(credential, "credential must not be null");
    synchronized (lock) {
      this.credential = credential;
    }
    return this;
  }

  /**
   * Sets the redirect handler of this request, used instead of the session one.
   *
   * @throws IllegalStateException if a redirect handler was already set
   */
  public Request redirect(RedirectHandler handler) {
    requireNonNull(handler, "handler must not be null");
    synchronized (lock) {
      if (redirectHandler != null) throw new IllegalStateException("Redirect handler already set on request " + id);
      redirectHandler = handler;
    }
    return this;
  }

  /**
   * Sets the upload progress handler, run on the session callback executor.
   *
   * @param handler receives each progress update
   * @return this request
   */
  public Request uploadProgress(Consumer<Progress> handler) {
    return uploadProgress(delegate.callbackExecutor(), handler);
  }

  /**
   * Sets the upload progress handler, replacing any previous one.
   *
   * @param executor where {@code handler} runs
   * @param handler  receives each progress update
   * @return this request
   */
  public Request uploadProgress(Executor executor, Consumer<Progress> handler) {
    var registered = new Handler<>(executor, handler);
    synchronized (lock) {
      uploadProgressHandler = registered;
    }
    return this;
  }

  /**
   * Sets the download progress handler, run on the session callback executor.
   *
   * @param handler receives each progress update
   * @return this request
   */
  public Request downloadProgress(Consumer<Progress> handler) {
    return downloadProgress(delegate.callbackExecutor(), handler);
  }

  /**
   * Sets the download progress handler, replacing any previous one.
   *
   * @param executor where {@code handler} runs
   * @param handler  receives each progress update
   * @return this request
   */
  public Request downloadProgress(Executor executor, Consumer<Progress> handler) {
    var registered = new Handler<>(executor, handler);
    synchronized (lock) {
      downloadProgressHandler = registered;
    }
    return this;
  }

  /**
   * Registers a handler told about each wire request sent, once per attempt.
   */
  public Request onHttpRequestCreation(Consumer<HttpRequest> handler) {
    return onHttpRequestCreation(delegate.callbackExecutor(), handler);
  }

  /**
   * Same as {@link #onHttpRequestCreation(Consumer)}, running {@code handler} on {@code executor}.
   */
  public Request onHttpRequestCreation(Executor executor, Consumer<HttpRequest> handler) {
    var registered = new Handler<>(executor, handler);
    synchronized (lock) {
      httpRequestHandlers.add(registered);
    }
    return this;
  }

  /**
   * Registers a handler told about each network task created, once per attempt.
   */
  public Request onTaskCreation(Consumer<NetworkTask> handler) {
    return onTaskCreation(delegate.callbackExecutor(), handler);
  }

  /**
   * Same as {@link #onTaskCreation(Consumer)}, running {@code handler} on {@code executor}.
   */
  public Request onTaskCreation(Executor executor, Consumer<NetworkTask> handler) {
    var registered = new Handler<>(executor, handler);
    synchronized (lock) {
      taskHandlers.add(registered);
    }
    return this;
  }

  /**
   * Cancels this request. Its response handlers receive an explicitly cancelled error.
   *
   * @return this request
   */
  public Request cancel() {
    if (!markCancelled()) return this;
    onRoot(() -> {
      didCancel();
      delegate.cancelTask(this);
    });
    return this;
  }

  /**
   * Suspends this request and its current task. A suspended task receives no more body data
   * until {@link #resume()} is called. Has no effect once the request is cancelled or finished.
   *
   * @return this request
   */
  public Request suspend() {
    synchronized (lock) {
      if (!state.canTransitionTo(RequestState.SUSPENDED)) return this;
      state = RequestState.SUSPENDED;
    }
    onRoot(() -> {
      eventMonitor.requestDidSuspend(this);
      delegate.suspendTask(this);
    });
    return this;
  }

  /**
   * Resumes this request, starting its task on the first call. Has no effect once the request
   * is cancelled or finished.
   *
   * @return this request
   */
  public Request resume() {
    synchronized (lock) {
      if (!state.canTransitionTo(RequestState.RESUMED)) return this;
      state = RequestState.RESUMED;
    }
    onRoot(() -> {
      eventMonitor.requestDidResume(this);
      delegate.resumeTask(this);
    });
    return this;
  }

  // Session side of the lifecycle, all called on the root executor unless stated otherwise.

  void didCreateInitialHttpRequest(HttpRequest httpRequest) {
    synchronized (lock) {
      httpRequests.add(httpRequest);
    }
    eventMonitor.requestDidCreateInitialHttpRequest(this, httpRequest);
  }

  void didFailToCreateHttpRequest(FerryException failure) {
    setError(failure);
    eventMonitor.requestDidFailToCreateHttpRequest(this, failure);
    retryOrFinish(failure);
  }

  void didAdaptInitialRequest(HttpRequest initial, HttpRequest adapted) {
    synchronized (lock) {
      httpRequests.add(adapted);
    }
    eventMonitor.requestDidAdaptHttpRequest(this, initial, adapted);
  }

  void didFailToAdaptHttpRequest(HttpRequest initial, FerryException failure) {
    setError(failure);
    eventMonitor.requestDidFailToAdaptHttpRequest(this, initial, failure);
    retryOrFinish(failure);
  }

  void didCreateHttpRequest(HttpRequest httpRequest) {
    List<Handler<HttpRequest>> handlers;
    synchronized (lock) {
      handlers = List.copyOf(httpRequestHandlers);
    }
    eventMonitor.requestDidCreateHttpRequest(this, httpRequest);
    handlers.forEach(handler -> handler.dispatch(httpRequest));
  }

  void didFailToCreateTask(FerryException failure) {
    setError(failure);
    retryOrFinish(failure);
  }

  void didCreateTask(TaskDelegate created) {
    List<Handler<NetworkTask>> handlers;
    synchronized (lock) {
      tasks.add(created.task());
      taskDelegate = created;
      awaitingTaskCompletion = true;
      handlers = List.copyOf(taskHandlers);
    }
    eventMonitor.requestDidCreateTask(this, created.task());
    handlers.forEach(handler -> handler.dispatch(created.task()));
  }

  void didResumeTask(NetworkTask task) {
    eventMonitor.requestDidResumeTask(this, task);
  }

  void didSuspendTask(NetworkTask task) {
    eventMonitor.requestDidSuspendTask(this, task);
  }

  void didCancelTask(NetworkTask task) {
    eventMonitor.requestDidCancelTask(this, task);
  }

  /**
   * Called from the network delegate thread.
   */
  void didGatherMetrics(TaskMetrics taskMetrics) {
    synchronized (lock) {
      metrics.add(taskMetrics);
    }
    eventMonitor.requestDidGatherMetrics(this, taskMetrics);
  }

  /**
   * Called from the network delegate thread.
   */
  void updateUploadProgress(Progress progress) {
    Handler<Progress> handler;
    synchronized (lock) {
      uploadProgress = progress;
      handler = uploadProgressHandler;
    }
    if (handler != null) handler.dispatch(progress);
  }

  /**
   * Called from the network delegate thread.
   */
  void updateDownloadProgress(Progress progress) {
    Handler<Progress> handler;
    synchronized (lock) {
      downloadProgress = progress;
      handler = downloadProgressHandler;
    }
    if (handler != null) handler.dispatch(progress);
  }

  /**
   * The task of the current attempt completed: validate, then retry or finish.
   */
  void didCompleteTask(TaskDelegate completed) {
    FerryException taskError = completed.error() == null ? null : FerryException.from(completed.error());
    FerryException current;
    synchronized (lock) {
      awaitingTaskCompletion = false;
      if (error == null) error = taskError;
      current = error;
    }

    if (taskError != null) eventMonitor.requestDidFailTask(this, completed.task(), taskError);
    eventMonitor.requestDidCompleteTask(this, completed.task(), current);

    if (current == null) runValidators();
    retryOrFinish(error());
  }

  boolean isAwaitingTaskCompletion() {
    synchronized (lock) {
      return awaitingTaskCompletion;
    }
  }

  void retryOrFinish(FerryException failure) {
    if (failure == null || isCancelled()) {
      finish();
      return;
    }

    delegate.retryResult(this, failure).whenComplete((result, retrierFailure) -> onRoot(() -> {
      if (isCancelled()) {
        finish();
        return;
      }

      if (retrierFailure != null) {
        finish(new RequestRetryException(FerryException.unwrap(retrierFailure), failure));
        return;
      }
      try {
        applyRetryResult(result, failure);
      } catch (RuntimeException e) {
        logger.warn("Could not apply retry result {} to request {}", result, id, e);
        finish(new RequestRetryException(e, failure));
      }
    }));
  }

  private void applyRetryResult(RetryResult result, FerryException failure) {
    requireNonNull(result, "retry result must not be null");
    switch (result.kind()) {
      case DO_NOT_RETRY:
        finish();
        break;
      case DO_NOT_RETRY_WITH_ERROR:
        finish(new RequestRetryException(result.error(), failure));
        break;
      case RETRY:
      case RETRY_WITH_DELAY:
        delegate.retryRequest(this, result.delay().orElse(null));
        break;
      default:
        throw new IllegalStateException("Unknown retry result: " + result.kind());
    }
  }

  /**
   * Starts a new attempt: the retry count grows and the state of the previous attempt is dropped.
   */
  void prepareForRetry() {
    synchronized (lock) {
      retryCount++;
      reset();
    }
    eventMonitor.requestIsRetrying(this);
  }

  // guarded by lock
  private void reset() {
    error = state == RequestState.CANCELLED ? FerryException.explicitlyCancelled() : null;
    uploadProgress = Progress.NONE;
    downloadProgress = Progress.NONE;
    isFinishing = false;
    attemptFinished = false;
    responseSerializerCompletions.clear();
  }

  void finish() {
    finish(null);
  }

  /**
   * Finishes the current attempt: runs the response serializers and then the completion handlers.
   * Only the first call of an attempt has an effect.
   *
   * @param failure replaces the error of the request when not {@code null}
   */
  void finish(FerryException failure) {
    synchronized (lock) {
      if (isFinishing || attemptFinished) return;
      isFinishing = true;
      attemptFinished = true;
      if (failure != null) error = failure;
    }
    logger.debug("Request {} finishing in state {}", id, state());

    processNextResponseSerializer();
    eventMonitor.requestDidFinish(this);
  }

  void processNextResponseSerializer() {
    Runnable next = null;
    List<Runnable> completions = null;
    synchronized (lock) {
      int index = responseSerializerCompletions.size();
      if (index < responseSerializers.size()) {
        next = responseSerializers.get(index);
      } else {
        completions = List.copyOf(responseSerializerCompletions);
        responseSerializers.clear();
        responseSerializerCompletions.clear();
        if (state.canTransitionTo(RequestState.FINISHED)) state = RequestState.FINISHED;
        responseSerializerProcessingFinished = true;
        isFinishing = false;
      }
    }

    if (next != null) {
      serializationExecutor.execute(next);
      return;
    }
    completions.forEach(Runnable::run);
    cleanup();
  }

  /**
   * Queues a response serializer, processed when the current attempt finishes, or right away if
   * it already has.
   */
  void appendResponseSerializer(Runnable serializer) {
    boolean processNow;
    boolean mayResume;
    synchronized (lock) {
      responseSerializers.add(serializer);
      if (state == RequestState.FINISHED) state = RequestState.RESUMED;
      processNow = responseSerializerProcessingFinished;
      if (processNow) {
        responseSerializerProcessingFinished = false;
        isFinishing = true;
      }
      mayResume = state.canTransitionTo(RequestState.RESUMED);
    }

    if (processNow) onRoot(this::processNextResponseSerializer);
    if (mayResume) {
      onRoot(() -> {
        if (delegate.startImmediately()) resume();
      });
    }
  }

  void responseSerializerDidComplete(Runnable completion) {
    synchronized (lock) {
      responseSerializerCompletions.add(completion);
    }
    processNextResponseSerializer();
  }

  /**
   * Hands the outcome of one serializer over. A serialization failure of an attempt that had no
   * error of its own is offered to the retrier; when it asks for a retry, the response is not
   * delivered and the whole request runs again.
   *
   * @param response           the response built by the serializer
   * @param serializationError the serializer failure, or {@code null}
   * @param withError          rebuilds the response around a replacement error
   * @param executor           where {@code handler} runs
   * @param handler            the completion handler
   */
  <R> void didSerialize(R response,
                        FerryException serializationError,
                        Function<FerryException, R> withError,
                        Executor executor,
                        Consumer<? super R> handler) {
    if (serializationError == null || isCancelled()) {
      responseSerializerDidComplete(() -> executor.execute(() -> handler.accept(response)));
      return;
    }

    delegate.retryResult(this, serializationError).whenComplete((result, retrierFailure) -> {
      R delivered = response;
      if (retrierFailure != null || result == null) {
        var cause = retrierFailure != null ? FerryException.unwrap(retrierFailure) : new NullPointerException("retry result must not be null");
        delivered = withError.apply(new RequestRetryException(cause, serializationError));
      } else if (result.isRetryRequired() && !isCancelled()) {
        synchronized (lock) {
          isFinishing = false;
          attemptFinished = false;
          responseSerializerCompletions.clear();
        }
        delegate.retryRequest(this, result.delay().orElse(null));
        return;
      } else if (result.kind() == RetryResult.Kind.DO_NOT_RETRY_WITH_ERROR) {
        delivered = withError.apply(new RequestRetryException(result.error(), serializationError));
      }

      R toDeliver = delivered;
      responseSerializerDidComplete(() -> executor.execute(() -> handler.accept(toDeliver)));
    });
  }

  /**
   * Appends a validator, run on the root executor once per attempt whose task completed without
   * error.
   */
  void appendValidator(Runnable validator) {
    synchronized (lock) {
      validators.add(validator);
    }
  }

  /**
   * Records the outcome of one validator. The first failure becomes the error of the attempt;
   * later validators still run but cannot replace it.
   */
  void didValidate(HttpRequest httpRequest, HttpResponseHead response, FerryException failure) {
    synchronized (lock) {
      if (error == null && failure != null) error = failure;
    }
    eventMonitor.requestDidValidate(this, httpRequest, response, failure);
  }

  TaskDelegate taskDelegate() {
    synchronized (lock) {
      return taskDelegate;
    }
  }

  /**
   * Called when the request has no work left. Overridden to release per request resources.
   */
  void cleanup() {
    delegate.cleanup(this);
  }

  /**
   * Moves to {@link RequestState#CANCELLED} and records the cancellation error in one step.
   *
   * @return {@code false} if the request could not be cancelled any more
   */
  boolean markCancelled() {
    synchronized (lock) {
      if (!state.canTransitionTo(RequestState.CANCELLED)) return false;
      state = RequestState.CANCELLED;
      if (error == null) error = FerryException.explicitlyCancelled();
      return true;
    }
  }

  void didCancel() {
    eventMonitor.requestDidCancel(this);
  }

  /**
   * Runs {@code work} on the root executor, or inline once the session is closed so that late
   * handlers still receive the closing error.
   */
  void onRoot(Runnable work) {
    try {
      delegate.rootExecutor().execute(work);
    } catch (RejectedExecutionException e) {
      logger.debug("Session of request {} is closed, running inline", id);
      work.run();
    }
  }

  void setError(FerryException failure) {
    synchronized (lock) {
      error = failure;
    }
  }

  private void runValidators() {
    List<Runnable> toRun;
    synchronized (lock) {
      toRun = List.copyOf(validators);
    }
    toRun.forEach(Runnable::run);
  }

  @Override
  public String toString() {
    var last = request();
    return getClass().getSimpleName() + "[id=" + id + ", state=" + state()
      + (last == null ? "" : ", " + last.method() + " " + last.uri()) + "]";
  }

  private record Handler<T>(Executor executor, Consumer<T> consumer) {

    private Handler {
      requireNonNull(executor, "executor must not be null");
      requireNonNull(consumer, "handler must not be null");
    }

    void dispatch(T value) {
      executor.execute(() -> consumer.accept(value));
    }
  }
}
