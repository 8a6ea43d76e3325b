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
package fr.aneo.ferry.exception;

import java.nio.file.Path;

/**
 * Raised when a finished download cannot be moved from its temporary location to the
 * destination computed for it.
 */
public final class DownloadedFileMoveException extends FerryException {

  private final Path source;
  private final Path destination;

  public DownloadedFileMoveException(Path source, Path destination, Throwable cause) {
    super(ErrorKind.DOWNLOADED_FILE_MOVE_FAILED,
      "Moving downloaded file from " + source + " to " + destination + " failed: " + cause.getMessage(),
      cause);
    this.source = source;
    this.destination = destination;
  }

  public Path source() {
    return source;
  }

  public Path destination() {
    return destination;
  }
}
