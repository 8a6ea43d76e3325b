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

/**
 * The asynchronous networking primitive the client is built on.
 * <p>
 * A network session creates tasks and reports every event of every task to a single
 * {@link NetworkSessionDelegate}, one event at a time, in the order the events happened for
 * a given task.
 *
 * @see JdkNetworkSession
 */
public interface NetworkSession {

  NetworkTask dataTask(HttpRequest request);

  NetworkTask uploadTask(HttpRequest request, Uploadable uploadable);

  DownloadTask downloadTask(HttpRequest request);

  /**
   * Creates a download task continuing a cancelled download.
   *
   * @param resumeData the data produced by {@link DownloadTask#cancelByProducingResumeData}
   * @return a new, suspended download task
   * @throws IllegalArgumentException if the resume data cannot be used
   */
  DownloadTask downloadTask(byte[] resumeData);

  /**
   * Cancels every outstanding task and makes the session unusable.
   * <p>
   * The delegate is told through {@link NetworkSessionDelegate#onInvalidated(Throwable)} once the
   * cancellations have been reported.
   */
  void invalidateAndCancel();

  /**
   * Creates a network session reporting to a given delegate.
   */
  @FunctionalInterface
  interface Factory {
    NetworkSession create(NetworkSessionDelegate delegate);
  }
}
