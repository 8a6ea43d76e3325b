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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * The body of an upload task.
 * <p>
 * Three sources are supported:
 * <ul>
 *   <li>{@link #data(byte[])}: bytes held in memory</li>
 *   <li>{@link #file(Path, boolean)}: a file read from disk, optionally deleted once the upload is over</li>
 *   <li>{@link #stream(Supplier)}: an input stream opened each time the body is sent</li>
 * </ul>
 */
public final class Uploadable {
  private static final Logger logger = LoggerFactory.getLogger(Uploadable.class);

  public enum Kind {
    DATA,
    FILE,
    STREAM
  }

  private final Kind kind;
  private final byte[] data;
  private final Path file;
  private final boolean shouldRemove;
  private final Supplier<InputStream> stream;

  private Uploadable(Kind kind, byte[] data, Path file, boolean shouldRemove, Supplier<InputStream> stream) {
    this.kind = kind;
    this.data = data;
    this.file = file;
    this.shouldRemove = shouldRemove;
    this.stream = stream;
  }

  public static Uploadable data(byte[] data) {
    requireNonNull(data, "data must not be null");
    return new Uploadable(Kind.DATA, data.clone(), null, false, null);
  }

  public static Uploadable file(Path file, boolean shouldRemove) {
    requireNonNull(file, "file must not be null");
    return new Uploadable(Kind.FILE, null, file, shouldRemove, null);
  }

  public static Uploadable stream(Supplier<InputStream> stream) {
    requireNonNull(stream, "stream must not be null");
    return new Uploadable(Kind.STREAM, null, null, false, stream);
  }

  public Kind kind() {
    return kind;
  }

  public Path file() {
    return file;
  }

  public boolean shouldRemove() {
    return shouldRemove;
  }

  /**
   * Creates the publisher sending this body.
   *
   * @return a new body publisher
   * @throws FileNotFoundException if a file body does not exist
   */
  public BodyPublisher bodyPublisher() throws FileNotFoundException {
    switch (kind) {
      case DATA:
        return BodyPublishers.ofByteArray(data);
      case FILE:
        return BodyPublishers.ofFile(file);
      case STREAM:
        return BodyPublishers.ofInputStream(stream);
      default:
        throw new IllegalStateException("Unknown uploadable kind: " + kind);
    }
  }

  /**
   * Deletes the uploaded file when it was created for the upload only.
   */
  public void cleanup() {
    if (kind != Kind.FILE || !shouldRemove) return;

    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.warn("Could not remove uploaded file {}", file, e);
    }
  }
}
