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
package fr.aneo.ferry.monitor;

import com.google.common.util.concurrent.MoreExecutors;
import fr.aneo.ferry.DataRequest;
import fr.aneo.ferry.DownloadRequest;
import fr.aneo.ferry.Request;
import fr.aneo.ferry.UploadRequest;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.response.DownloadResponse;
import fr.aneo.ferry.response.Result;
import fr.aneo.ferry.transport.AuthenticationChallenge;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.TaskMetrics;
import fr.aneo.ferry.transport.Uploadable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Fans every event out to a list of monitors, each one on its own {@link EventMonitor#executor()}.
 * <p>
 * The composite itself runs on the calling thread: it only hands the event over.
 */
public final class CompositeEventMonitor implements EventMonitor {
  private static final Logger logger = LoggerFactory.getLogger(CompositeEventMonitor.class);

  private final List<EventMonitor> monitors;

  public CompositeEventMonitor(List<? extends EventMonitor> monitors) {
    requireNonNull(monitors, "monitors must not be null");
    this.monitors = List.copyOf(monitors);
  }

  public List<EventMonitor> monitors() {
    return monitors;
  }

  @Override
  public Executor executor() {
    return MoreExecutors.directExecutor();
  }

  private void performEvent(Consumer<EventMonitor> event) {
    for (EventMonitor monitor : monitors) {
      try {
        monitor.executor().execute(() -> {
          try {
            event.accept(monitor);
          } catch (RuntimeException e) {
            logger.warn("Event monitor {} failed", monitor.getClass().getName(), e);
          }
        });
      } catch (RejectedExecutionException e) {
        logger.debug("Event dropped, executor of monitor {} rejected it", monitor.getClass().getName());
      }
    }
  }

  @Override
  public void sessionDidBecomeInvalid(Throwable error) {
    performEvent(m -> m.sessionDidBecomeInvalid(error));
  }

  @Override
  public void taskDidReceiveChallenge(NetworkTask task, AuthenticationChallenge challenge) {
    performEvent(m -> m.taskDidReceiveChallenge(task, challenge));
  }

  @Override
  public void taskDidSendBodyData(NetworkTask task, long bytesSent, long totalBytesSent, long totalBytesExpectedToSend) {
    performEvent(m -> m.taskDidSendBodyData(task, bytesSent, totalBytesSent, totalBytesExpectedToSend));
  }

  @Override
  public void taskWillPerformRedirection(NetworkTask task, HttpResponseHead response, HttpRequest proposed) {
    performEvent(m -> m.taskWillPerformRedirection(task, response, proposed));
  }

  @Override
  public void taskDidFinishCollectingMetrics(NetworkTask task, TaskMetrics metrics) {
    performEvent(m -> m.taskDidFinishCollectingMetrics(task, metrics));
  }

  @Override
  public void taskDidComplete(NetworkTask task, Throwable error) {
    performEvent(m -> m.taskDidComplete(task, error));
  }

  @Override
  public void dataTaskDidReceiveResponse(NetworkTask task, HttpResponseHead response) {
    performEvent(m -> m.dataTaskDidReceiveResponse(task, response));
  }

  @Override
  public void dataTaskDidReceiveData(NetworkTask task, byte[] data) {
    performEvent(m -> m.dataTaskDidReceiveData(task, data));
  }

  @Override
  public void downloadTaskDidResumeAtOffset(NetworkTask task, long fileOffset, long expectedTotalBytes) {
    performEvent(m -> m.downloadTaskDidResumeAtOffset(task, fileOffset, expectedTotalBytes));
  }

  @Override
  public void downloadTaskDidWriteData(NetworkTask task, long bytesWritten, long totalBytesWritten, long totalBytesExpectedToWrite) {
    performEvent(m -> m.downloadTaskDidWriteData(task, bytesWritten, totalBytesWritten, totalBytesExpectedToWrite));
  }

  @Override
  public void downloadTaskDidFinishDownloading(NetworkTask task, Path location) {
    performEvent(m -> m.downloadTaskDidFinishDownloading(task, location));
  }

  @Override
  public void requestDidCreateInitialHttpRequest(Request request, HttpRequest httpRequest) {
    performEvent(m -> m.requestDidCreateInitialHttpRequest(request, httpRequest));
  }

  @Override
  public void requestDidFailToCreateHttpRequest(Request request, FerryException error) {
    performEvent(m -> m.requestDidFailToCreateHttpRequest(request, error));
  }

  @Override
  public void requestDidAdaptHttpRequest(Request request, HttpRequest initial, HttpRequest adapted) {
    performEvent(m -> m.requestDidAdaptHttpRequest(request, initial, adapted));
  }

  @Override
  public void requestDidFailToAdaptHttpRequest(Request request, HttpRequest initial, FerryException error) {
    performEvent(m -> m.requestDidFailToAdaptHttpRequest(request, initial, error));
  }

  @Override
  public void requestDidCreateHttpRequest(Request request, HttpRequest httpRequest) {
    performEvent(m -> m.requestDidCreateHttpRequest(request, httpRequest));
  }

  @Override
  public void requestDidCreateTask(Request request, NetworkTask task) {
    performEvent(m -> m.requestDidCreateTask(request, task));
  }

  @Override
  public void requestDidGatherMetrics(Request request, TaskMetrics metrics) {
    performEvent(m -> m.requestDidGatherMetrics(request, metrics));
  }

  @Override
  public void requestDidFailTask(Request request, NetworkTask task, FerryException error) {
    performEvent(m -> m.requestDidFailTask(request, task, error));
  }

  @Override
  public void requestDidCompleteTask(Request request, NetworkTask task, FerryException error) {
    performEvent(m -> m.requestDidCompleteTask(request, task, error));
  }

  @Override
  public void requestIsRetrying(Request request) {
    performEvent(m -> m.requestIsRetrying(request));
  }

  @Override
  public void requestDidFinish(Request request) {
    performEvent(m -> m.requestDidFinish(request));
  }

  @Override
  public void requestDidResume(Request request) {
    performEvent(m -> m.requestDidResume(request));
  }

  @Override
  public void requestDidResumeTask(Request request, NetworkTask task) {
    performEvent(m -> m.requestDidResumeTask(request, task));
  }

  @Override
  public void requestDidSuspend(Request request) {
    performEvent(m -> m.requestDidSuspend(request));
  }

  @Override
  public void requestDidSuspendTask(Request request, NetworkTask task) {
    performEvent(m -> m.requestDidSuspendTask(request, task));
  }

  @Override
  public void requestDidCancel(Request request) {
    performEvent(m -> m.requestDidCancel(request));
  }

  @Override
  public void requestDidCancelTask(Request request, NetworkTask task) {
    performEvent(m -> m.requestDidCancelTask(request, task));
  }

  @Override
  public void requestDidValidate(Request request, HttpRequest httpRequest, HttpResponseHead response, FerryException error) {
    performEvent(m -> m.requestDidValidate(request, httpRequest, response, error));
  }

  @Override
  public void requestDidParseResponse(DataRequest request, DataResponse<?> response) {
    performEvent(m -> m.requestDidParseResponse(request, response));
  }

  @Override
  public void requestDidCreateUploadable(UploadRequest request, Uploadable uploadable) {
    performEvent(m -> m.requestDidCreateUploadable(request, uploadable));
  }

  @Override
  public void requestDidFailToCreateUploadable(UploadRequest request, FerryException error) {
    performEvent(m -> m.requestDidFailToCreateUploadable(request, error));
  }

  @Override
  public void requestDidFinishDownloading(DownloadRequest request, NetworkTask task, Result<Path> result) {
    performEvent(m -> m.requestDidFinishDownloading(request, task, result));
  }

  @Override
  public void requestDidParseDownloadResponse(DownloadRequest request, DownloadResponse<?> response) {
    performEvent(m -> m.requestDidParseDownloadResponse(request, response));
  }
}
