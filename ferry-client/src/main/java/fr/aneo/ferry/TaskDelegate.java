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

import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;

import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * State accumulated for one network task, from its creation to its completion.
 * <p>
 * One delegate exists per task, not per request: a retried request gets a fresh delegate with
 * its new task, so nothing received by an earlier attempt leaks into the next one. The fields
 * that matter depend on the {@link Kind}; every event handler switches on it.
 * <p>
 * {@link #completion()} is the gate response serialization waits on. It completes once, when
 * the network session reports the task complete.
 */
final class TaskDelegate {

  enum Kind {
    DATA,
    UPLOAD,
    DOWNLOAD
  }

  private final Kind kind;
  private final NetworkTask task;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();

  // guarded by this
  private HttpResponseHead response;
  private Throwable error;
  private ByteArrayOutputStream data;
  private long expectedContentLength = -1;
  private long totalBytesReceived;
  private Progress downloadProgress = Progress.NONE;
  private Progress uploadProgress = Progress.NONE;
  private Path fileUrl;

  TaskDelegate(Kind kind, NetworkTask task) {
    this.kind = requireNonNull(kind, "kind must not be null");
    this.task = requireNonNull(task, "task must not be null");
  }

  static TaskDelegate forRequest(Request request, NetworkTask task) {
    if (request instanceof DownloadRequest) return new TaskDelegate(Kind.DOWNLOAD, task);
    if (request instanceof UploadRequest) return new TaskDelegate(Kind.UPLOAD, task);
    return new TaskDelegate(Kind.DATA, task);
  }

  Kind kind() {
    return kind;
  }

  NetworkTask task() {
    return task;
  }

  CompletionStage<Void> completion() {
    return completion;
  }

  boolean isCompleted() {
    return completion.isDone();
  }

  synchronized HttpResponseHead response() {
    return response;
  }

  synchronized Throwable error() {
    return error;
  }

  synchronized Progress downloadProgress() {
    return downloadProgress;
  }

  synchronized Progress uploadProgress() {
    return uploadProgress;
  }

  synchronized void didReceiveResponse(HttpResponseHead head) {
    response = head;
    if (kind != Kind.DOWNLOAD) {
      expectedContentLength = head.expectedContentLength();
      downloadProgress = new Progress(totalBytesReceived, expectedContentLength);
    }
  }

  /**
   * Appends a body chunk of a data or upload task.
   *
   * @return the download progress after the chunk
   */
  synchronized Progress didReceiveData(byte[] chunk) {
    switch (kind) {
      case DATA:
      case UPLOAD:
        if (data == null) {
          data = new ByteArrayOutputStream(expectedContentLength > 0 && expectedContentLength < Integer.MAX_VALUE ? (int) expectedContentLength : 32);
        }
        data.write(chunk, 0, chunk.length);
        totalBytesReceived += chunk.length;
        downloadProgress = new Progress(totalBytesReceived, expectedContentLength);
        return downloadProgress;
      default:
        throw new IllegalStateException("Download task " + task.taskIdentifier() + " does not receive data chunks");
    }
  }

  /**
   * Records bytes sent by an upload task.
   *
   * @return the upload progress
   */
  synchronized Progress didSendBodyData(long totalBytesSent, long totalBytesExpectedToSend) {
    uploadProgress = new Progress(totalBytesSent, totalBytesExpectedToSend);
    return uploadProgress;
  }

  synchronized Progress didWriteData(long totalBytesWritten, long totalBytesExpectedToWrite) {
    requireDownload("write data");
    downloadProgress = new Progress(totalBytesWritten, totalBytesExpectedToWrite);
    return downloadProgress;
  }

  synchronized Progress didResumeAtOffset(long fileOffset, long expectedTotalBytes) {
    requireDownload("resume");
    downloadProgress = new Progress(fileOffset, expectedTotalBytes);
    return downloadProgress;
  }

  synchronized void didFinishDownloading(Path destination) {
    requireDownload("finish downloading");
    fileUrl = destination;
  }

  /**
   * Records a failure; the first one wins.
   */
  synchronized void didFail(Throwable failure) {
    if (error == null) error = failure;
  }

  /**
   * Records the transport outcome and releases the completion gate.
   *
   * @param failure the transport failure, or {@code null}
   */
  void complete(Throwable failure) {
    synchronized (this) {
      if (failure != null && error == null) error = failure;
    }
    completion.complete(null);
  }

  synchronized byte[] data() {
    return data == null ? null : data.toByteArray();
  }

  synchronized Path fileUrl() {
    return fileUrl;
  }

  private void requireDownload(String event) {
    if (kind != Kind.DOWNLOAD) {
      throw new IllegalStateException(kind + " task " + task.taskIdentifier() + " cannot " + event);
    }
  }
}
