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

import fr.aneo.ferry.exception.DownloadedFileMoveException;
import fr.aneo.ferry.exception.ServerTrustEvaluationException;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.response.Result;
import fr.aneo.ferry.transport.AuthenticationChallenge;
import fr.aneo.ferry.transport.ChallengeEvaluation;
import fr.aneo.ferry.transport.DownloadTask;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkSessionDelegate;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.TaskMetrics;
import fr.aneo.ferry.trust.ServerTrustEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * The single {@link NetworkSessionDelegate} of a session: routes every network event to the
 * request and task delegate owning the task.
 * <p>
 * Events for a task that is no longer registered, because its request was cancelled or retried
 * meanwhile, get the default behaviour and are otherwise dropped.
 */
final class SessionDelegate implements NetworkSessionDelegate {
  private static final Logger logger = LoggerFactory.getLogger(SessionDelegate.class);

  private final SessionStateProvider stateProvider;
  private final EventMonitor eventMonitor;

  SessionDelegate(SessionStateProvider stateProvider) {
    this.stateProvider = requireNonNull(stateProvider, "stateProvider must not be null");
    this.eventMonitor = stateProvider.eventMonitor();
  }

  @Override
  public void onRedirect(NetworkTask task, HttpResponseHead response, HttpRequest proposed, Consumer<HttpRequest> completion) {
    eventMonitor.taskWillPerformRedirection(task, response, proposed);

    var request = stateProvider.request(task);
    var handler = request == null ? null : request.redirectHandler();
    if (handler == null) handler = stateProvider.redirectHandler();

    if (handler == null) {
      completion.accept(proposed);
      return;
    }
    Optional<HttpRequest> decision = handler.redirect(task, proposed, response);
    completion.accept(decision.orElse(null));
  }

  @Override
  public void onChallenge(NetworkTask task, AuthenticationChallenge challenge, Consumer<ChallengeEvaluation> completion) {
    eventMonitor.taskDidReceiveChallenge(task, challenge);

    switch (challenge.type()) {
      case SERVER_TRUST:
        completion.accept(evaluateServerTrust(challenge));
        break;
      case HTTP_BASIC:
        completion.accept(evaluateHttpBasic(task, challenge));
        break;
      default:
        completion.accept(ChallengeEvaluation.performDefaultHandling());
    }
  }

  @Override
  public void onResponse(NetworkTask task, HttpResponseHead response) {
    eventMonitor.dataTaskDidReceiveResponse(task, response);

    var taskDelegate = taskDelegate(task, "response");
    if (taskDelegate != null) taskDelegate.didReceiveResponse(response);
  }

  @Override
  public void onData(NetworkTask task, byte[] data) {
    eventMonitor.dataTaskDidReceiveData(task, data);

    var taskDelegate = taskDelegate(task, "data");
    if (taskDelegate == null) return;
    var progress = taskDelegate.didReceiveData(data);
    withRequest(task, request -> request.updateDownloadProgress(progress));
  }

  @Override
  public void onSendBodyData(NetworkTask task, long bytesSent, long totalBytesSent, long totalBytesExpectedToSend) {
    eventMonitor.taskDidSendBodyData(task, bytesSent, totalBytesSent, totalBytesExpectedToSend);

    var taskDelegate = taskDelegate(task, "upload progress");
    if (taskDelegate == null) return;
    var progress = taskDelegate.didSendBodyData(totalBytesSent, totalBytesExpectedToSend);
    withRequest(task, request -> request.updateUploadProgress(progress));
  }

  @Override
  public void onWriteData(DownloadTask task, long bytesWritten, long totalBytesWritten, long totalBytesExpectedToWrite) {
    eventMonitor.downloadTaskDidWriteData(task, bytesWritten, totalBytesWritten, totalBytesExpectedToWrite);

    var taskDelegate = taskDelegate(task, "download progress");
    if (taskDelegate == null) return;
    var progress = taskDelegate.didWriteData(totalBytesWritten, totalBytesExpectedToWrite);
    withRequest(task, request -> request.updateDownloadProgress(progress));
  }

  @Override
  public void onResumeAtOffset(DownloadTask task, long fileOffset, long expectedTotalBytes) {
    eventMonitor.downloadTaskDidResumeAtOffset(task, fileOffset, expectedTotalBytes);

    var taskDelegate = taskDelegate(task, "resume offset");
    if (taskDelegate == null) return;
    var progress = taskDelegate.didResumeAtOffset(fileOffset, expectedTotalBytes);
    withRequest(task, request -> request.updateDownloadProgress(progress));
  }

  @Override
  public void onFinishDownloading(DownloadTask task, Path location) {
    eventMonitor.downloadTaskDidFinishDownloading(task, location);

    var taskDelegate = taskDelegate(task, "finished download");
    var request = stateProvider.request(task);
    if (taskDelegate == null || !(request instanceof DownloadRequest)) return;
    var download = (DownloadRequest) request;

    DownloadRequest.Target target = null;
    try {
      var destination = download.destination();
      target = destination == null
        ? download.defaultDestination(location)
        : requireNonNull(destination.destination(location, task.response()), "destination must not be null");

      if (target.options().contains(DownloadRequest.Option.CREATE_INTERMEDIATE_DIRECTORIES) && target.file().getParent() != null) {
        Files.createDirectories(target.file().getParent());
      }
      if (target.options().contains(DownloadRequest.Option.REMOVE_PREVIOUS_FILE)) {
        Files.deleteIfExists(target.file());
      }
      Files.move(location, target.file());

      taskDelegate.didFinishDownloading(target.file());
      eventMonitor.requestDidFinishDownloading(download, task, Result.success(target.file()));
    } catch (IOException | RuntimeException e) {
      var failure = new DownloadedFileMoveException(location, target == null ? null : target.file(), e);
      logger.warn("Could not move download of request {} from {}", download.id(), location, e);
      taskDelegate.didFail(failure);
      eventMonitor.requestDidFinishDownloading(download, task, Result.failure(failure));
    }
  }

  @Override
  public void onMetrics(NetworkTask task, TaskMetrics metrics) {
    eventMonitor.taskDidFinishCollectingMetrics(task, metrics);
    withRequest(task, request -> request.didGatherMetrics(metrics));
  }

  @Override
  public void onComplete(NetworkTask task, Throwable error) {
    eventMonitor.taskDidComplete(task, error);

    var taskDelegate = stateProvider.taskDelegate(task);
    stateProvider.didCompleteTask(task);
    if (taskDelegate == null) {
      logger.debug("Completion of unregistered task {} ignored", task.taskIdentifier());
      return;
    }
    taskDelegate.complete(error);
  }

  @Override
  public void onInvalidated(Throwable error) {
    eventMonitor.sessionDidBecomeInvalid(error);
    stateProvider.cancelRequestsForSessionInvalidation(error);
  }

  private ChallengeEvaluation evaluateServerTrust(AuthenticationChallenge challenge) {
    var trustManager = stateProvider.serverTrustManager();
    if (trustManager == null) return ChallengeEvaluation.performDefaultHandling();

    var host = challenge.host();
    try {
      Optional<ServerTrustEvaluator> evaluator = trustManager.serverTrustEvaluator(host);
      if (evaluator.isEmpty()) return ChallengeEvaluation.performDefaultHandling();

      if (evaluator.get().evaluate(challenge.serverTrust(), host)) {
        return ChallengeEvaluation.useCredential(null);
      }
      logger.warn("Server trust evaluation failed for host {}", host);
      return ChallengeEvaluation.cancel(ServerTrustEvaluationException.evaluationFailed(host));
    } catch (ServerTrustEvaluationException e) {
      logger.warn("Server trust evaluation failed for host {}: {}", host, e.getMessage());
      return ChallengeEvaluation.cancel(e);
    } catch (RuntimeException e) {
      logger.warn("Server trust evaluator for host {} failed", host, e);
      return ChallengeEvaluation.cancel(new ServerTrustEvaluationException(host, "Server trust evaluator failed for host " + host, e));
    }
  }

  private ChallengeEvaluation evaluateHttpBasic(NetworkTask task, AuthenticationChallenge challenge) {
    if (challenge.previousFailureCount() > 0) return ChallengeEvaluation.rejectProtectionSpace();

    var request = task == null ? null : stateProvider.request(task);
    var credential = request == null ? null : request.credential();
    if (credential == null) credential = stateProvider.defaultCredential(challenge.host());

    return credential == null ? ChallengeEvaluation.performDefaultHandling() : ChallengeEvaluation.useCredential(credential);
  }

  private TaskDelegate taskDelegate(NetworkTask task, String event) {
    var taskDelegate = stateProvider.taskDelegate(task);
    if (taskDelegate == null) {
      logger.debug("Dropping {} of unregistered task {}", event, task.taskIdentifier());
    }
    return taskDelegate;
  }

  private void withRequest(NetworkTask task, Consumer<Request> action) {
    var request = stateProvider.request(task);
    if (request != null) action.accept(request);
  }
}
