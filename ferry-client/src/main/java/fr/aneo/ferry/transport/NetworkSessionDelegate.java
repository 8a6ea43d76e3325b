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

import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Receives all events of the tasks created by a {@link NetworkSession}.
 * <p>
 * Events are delivered on a single serial executor owned by the network session, so an
 * implementation never sees two events at the same time. Events that expect an answer hand
 * the delegate a completion callback, which may be called from any thread.
 */
public interface NetworkSessionDelegate {

  /**
   * A {@code 3xx} response was received.
   *
   * @param task       the task being redirected
   * @param response   the redirect response head
   * @param proposed   the request the transport would send next
   * @param completion receives the request to send, or {@code null} to stop and deliver the redirect response
   */
  void onRedirect(NetworkTask task, HttpResponseHead response, HttpRequest proposed, Consumer<HttpRequest> completion);

  /**
   * An authentication challenge was raised.
   *
   * @param task       the task being challenged, or {@code null} for server trust challenges raised
   *                   during a TLS handshake
   * @param challenge  the challenge
   * @param completion receives the answer
   */
  void onChallenge(NetworkTask task, AuthenticationChallenge challenge, Consumer<ChallengeEvaluation> completion);

  void onResponse(NetworkTask task, HttpResponseHead response);

  void onData(NetworkTask task, byte[] data);

  void onSendBodyData(NetworkTask task, long bytesSent, long totalBytesSent, long totalBytesExpectedToSend);

  void onWriteData(DownloadTask task, long bytesWritten, long totalBytesWritten, long totalBytesExpectedToWrite);

  void onResumeAtOffset(DownloadTask task, long fileOffset, long expectedTotalBytes);

  /**
   * The body of a download task is complete.
   * <p>
   * The file at {@code location} is deleted when this method returns; it must be moved before.
   *
   * @param task     the download task
   * @param location the temporary file holding the body
   */
  void onFinishDownloading(DownloadTask task, Path location);

  void onMetrics(NetworkTask task, TaskMetrics metrics);

  /**
   * The task completed; no further event is reported for it.
   *
   * @param task  the task
   * @param error the transport failure, or {@code null} when a response was fully received
   */
  void onComplete(NetworkTask task, Throwable error);

  void onInvalidated(Throwable error);
}
