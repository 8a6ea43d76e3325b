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

import fr.aneo.ferry.DataRequest;
import fr.aneo.ferry.DownloadRequest;
import fr.aneo.ferry.Request;
import fr.aneo.ferry.UploadRequest;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.internal.concurrent.FerryExecutors;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.response.DownloadResponse;
import fr.aneo.ferry.response.Result;
import fr.aneo.ferry.transport.AuthenticationChallenge;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.TaskMetrics;
import fr.aneo.ferry.transport.Uploadable;

import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Observer of everything happening inside a {@link fr.aneo.ferry.Session}.
 * <p>
 * Two families of events are reported: the raw network events, as they are received from the
 * network session, and the lifecycle events of each {@link Request}. Every method does nothing by
 * default so implementations only override what they care about.
 * <p>
 * Events are fire-and-forget. They are dispatched on {@link #executor()} and never block the
 * request pipeline; an exception thrown by a monitor is logged and otherwise ignored.
 *
 * @see CompositeEventMonitor
 * @see LoggingEventMonitor
 */
public interface EventMonitor {

  /**
   * Returns the executor on which this monitor receives its events.
   *
   * @return the event executor, the shared callback executor by default
   */
  default Executor executor() {
    return FerryExecutors.callbacks();
  }

  // Network events

  default void sessionDidBecomeInvalid(Throwable error) {
  }

  default void taskDidReceiveChallenge(NetworkTask task, AuthenticationChallenge challenge) {
  }

  default void taskDidSendBodyData(NetworkTask task, long bytesSent, long totalBytesSent, long totalBytesExpectedToSend) {
  }

  default void taskWillPerformRedirection(NetworkTask task, HttpResponseHead response, HttpRequest proposed) {
  }

  default void taskDidFinishCollectingMetrics(NetworkTask task, TaskMetrics metrics) {
  }

  default void taskDidComplete(NetworkTask task, Throwable error) {
  }

  default void dataTaskDidReceiveResponse(NetworkTask task, HttpResponseHead response) {
  }

  default void dataTaskDidReceiveData(NetworkTask task, byte[] data) {
  }

  default void downloadTaskDidResumeAtOffset(NetworkTask task, long fileOffset, long expectedTotalBytes) {
  }

  default void downloadTaskDidWriteData(NetworkTask task, long bytesWritten, long totalBytesWritten, long totalBytesExpectedToWrite) {
  }

  default void downloadTaskDidFinishDownloading(NetworkTask task, Path location) {
  }

  // Request lifecycle events

  default void requestDidCreateInitialHttpRequest(Request request, HttpRequest httpRequest) {
  }

  default void requestDidFailToCreateHttpRequest(Request request, FerryException error) {
  }

  default void requestDidAdaptHttpRequest(Request request, HttpRequest initial, HttpRequest adapted) {
  }

  default void requestDidFailToAdaptHttpRequest(Request request, HttpRequest initial, FerryException error) {
  }

  default void requestDidCreateHttpRequest(Request request, HttpRequest httpRequest) {
  }

  default void requestDidCreateTask(Request request, NetworkTask task) {
  }

  default void requestDidGatherMetrics(Request request, TaskMetrics metrics) {
  }

  default void requestDidFailTask(Request request, NetworkTask task, FerryException error) {
  }

  default void requestDidCompleteTask(Request request, NetworkTask task, FerryException error) {
  }

  default void requestIsRetrying(Request request) {
  }

  default void requestDidFinish(Request request) {
  }

  default void requestDidResume(Request request) {
  }

  default void requestDidResumeTask(Request request, NetworkTask task) {
  }

  default void requestDidSuspend(Request request) {
  }

  default void requestDidSuspendTask(Request request, NetworkTask task) {
  }

  default void requestDidCancel(Request request) {
  }

  default void requestDidCancelTask(Request request, NetworkTask task) {
  }

  default void requestDidValidate(Request request, HttpRequest httpRequest, HttpResponseHead response, FerryException error) {
  }

  default void requestDidParseResponse(DataRequest request, DataResponse<?> response) {
  }

  default void requestDidCreateUploadable(UploadRequest request, Uploadable uploadable) {
  }

  default void requestDidFailToCreateUploadable(UploadRequest request, FerryException error) {
  }

  default void requestDidFinishDownloading(DownloadRequest request, NetworkTask task, Result<Path> result) {
  }

  default void requestDidParseDownloadResponse(DownloadRequest request, DownloadResponse<?> response) {
  }
}
