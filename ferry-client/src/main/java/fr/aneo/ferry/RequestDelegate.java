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
import fr.aneo.ferry.interceptor.RetryResult;
import fr.aneo.ferry.monitor.EventMonitor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * The session services a {@link Request} relies on.
 */
interface RequestDelegate {

  /**
   * The serial executor on which the session sets requests up, retries them and routes control calls.
   */
  Executor rootExecutor();

  Executor serializationExecutor();

  Executor callbackExecutor();

  EventMonitor eventMonitor();

  boolean startImmediately();

  /**
   * The directory receiving downloads that have no destination.
   */
  Path temporaryDirectory();

  CompletionStage<RetryResult> retryResult(Request request, FerryException error);

  void retryRequest(Request request, Duration delay);

  void resumeTask(Request request);

  void suspendTask(Request request);

  void cancelTask(Request request);

  /**
   * Cancels the task of a download, asking it for resume data first.
   *
   * @param resumeDataHandler receives the resume data, or {@code null}; called before the request finishes
   */
  void cancelDownloadTask(DownloadRequest request, Consumer<byte[]> resumeDataHandler);

  void cleanup(Request request);

  Session session();
}
