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
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Download task streaming its body to a temporary file.
 * <p>
 * A task created from resume data asks for the missing range only. When the server answers
 * {@code 206 Partial Content} the body is appended to the partial file and the delegate is told
 * the offset the download resumed at; any other answer restarts the file from scratch.
 */
final class JdkDownloadTask extends JdkTask implements DownloadTask {
  private static final Logger logger = LoggerFactory.getLogger(JdkDownloadTask.class);

  private final ResumeData resumedFrom;
  private final Object fileLock = new Object();

  // guarded by fileLock
  private Path temporaryFile;
  private FileChannel channel;
  private long totalWritten;
  private long expectedToWrite = -1;
  private String entityTag;
  private String lastModified;
  private boolean keepTemporaryFile;

  JdkDownloadTask(JdkNetworkSession session, long identifier, HttpRequest request, ResumeData resumedFrom) {
    super(session, identifier, request);
    this.resumedFrom = resumedFrom;
  }

  @Override
  public void cancelByProducingResumeData(Consumer<byte[]> handler) {
    if (!beginCancel()) {
      session.post(() -> handler.accept(null));
      return;
    }

    byte[] resumeData;
    synchronized (fileLock) {
      resumeData = resumeData();
      if (resumeData != null) keepTemporaryFile = true;
      closeChannel();
    }

    logger.debug("Download task {} cancelled, resume data {}", taskIdentifier(), resumeData == null ? "unavailable" : "produced");
    session.post(() -> handler.accept(resumeData));
    complete(new CancellationException("Download task " + taskIdentifier() + " cancelled"));
  }

  @Override
  protected void didReceiveResponse(HttpResponseHead head) throws IOException {
    long offset = 0;
    synchronized (fileLock) {
      entityTag = head.header("ETag").orElse(null);
      lastModified = head.header("Last-Modified").orElse(null);
      long length = head.expectedContentLength();

      if (resumedFrom != null && head.statusCode() == 206) {
        offset = resumedFrom.offset();
        if (entityTag == null) entityTag = resumedFrom.entityTag();
        if (lastModified == null) lastModified = resumedFrom.lastModified();
        temporaryFile = resumedFrom.temporaryFilePath();
        channel = FileChannel.open(temporaryFile, StandardOpenOption.WRITE);
        channel.truncate(offset);
        channel.position(offset);
        totalWritten = offset;
        expectedToWrite = length >= 0 ? offset + length : -1;
      } else {
        temporaryFile = resumedFrom != null ? resumedFrom.temporaryFilePath() : session.createTemporaryFile();
        channel = FileChannel.open(temporaryFile, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        totalWritten = 0;
        expectedToWrite = length;
      }
    }

    if (resumedFrom != null && head.statusCode() == 206) {
      long fileOffset = offset;
      long expected = expectedToWrite;
      session.post(() -> session.delegate().onResumeAtOffset(this, fileOffset, expected));
    }
  }

  @Override
  protected void didReceiveData(byte[] data) throws IOException {
    long total;
    long expected;
    synchronized (fileLock) {
      if (channel == null) return;
      var buffer = ByteBuffer.wrap(data);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      totalWritten += data.length;
      total = totalWritten;
      expected = expectedToWrite;
    }
    session.post(() -> session.delegate().onWriteData(this, data.length, total, expected));
  }

  @Override
  protected void didFinishBody() {
    Path location;
    synchronized (fileLock) {
      try {
        if (channel != null) channel.force(false);
      } catch (IOException e) {
        closeChannel();
        complete(e);
        return;
      }
      closeChannel();
      location = temporaryFile;
    }

    session.post(() -> {
      try {
        session.delegate().onFinishDownloading(this, location);
      } finally {
        deleteQuietly(location);
      }
    });
    complete(null);
  }

  @Override
  protected void willComplete(Throwable error) {
    synchronized (fileLock) {
      closeChannel();
      if (error != null && !keepTemporaryFile && temporaryFile != null) deleteQuietly(temporaryFile);
    }
  }

  private byte[] resumeData() {
    if (temporaryFile == null || totalWritten <= 0 || (entityTag == null && lastModified == null)) return null;

    Map<String, List<String>> headers = new HashMap<>(originalRequest().headers().map());
    headers.keySet().removeIf(name -> name.equalsIgnoreCase("Range") || name.equalsIgnoreCase("If-Range"));
    var data = new ResumeData(originalRequest().uri().toString(), headers, temporaryFile.toString(), totalWritten, entityTag, lastModified);
    return data.encode(session.gson());
  }

  private void closeChannel() {
    if (channel == null) return;
    try {
      channel.close();
    } catch (IOException e) {
      logger.warn("Could not close download file {}", temporaryFile, e);
    }
    channel = null;
  }

  private static void deleteQuietly(Path file) {
    if (file == null) return;
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.warn("Could not delete temporary download file {}", file, e);
    }
  }
}
