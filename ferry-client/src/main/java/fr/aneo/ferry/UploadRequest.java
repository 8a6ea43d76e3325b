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

import fr.aneo.ferry.encoding.RequestConvertible;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.transport.Uploadable;

import java.io.FileNotFoundException;
import java.nio.file.Files;

import static java.util.Objects.requireNonNull;

/**
 * A data request sending a body.
 * <p>
 * The body is produced again for every attempt. A file created only for the upload can be
 * removed once the request has no work left, see {@link Uploadable#file(java.nio.file.Path, boolean)}.
 */
public final class UploadRequest extends DataRequest {

  /**
   * Produces the body of an upload. A failure fails the attempt before any task is created.
   */
  @FunctionalInterface
  public interface UploadableConvertible {
    Uploadable createUploadable() throws Exception;
  }

  private final UploadableConvertible upload;
  private volatile Uploadable uploadable;

  UploadRequest(RequestConvertible convertible, UploadableConvertible upload, Interceptor interceptor, RequestDelegate delegate) {
    super(convertible, interceptor, delegate);
    this.upload = requireNonNull(upload, "upload must not be null");
  }

  /**
   * Returns the body of the latest attempt.
   *
   * @return the uploadable, or {@code null} before it is created
   */
  public Uploadable uploadable() {
    return uploadable;
  }

  Uploadable createUploadable() throws Exception {
    var created = upload.createUploadable();
    if (created == null) throw new IllegalStateException("Uploadable convertible produced no uploadable");
    if (created.kind() == Uploadable.Kind.FILE && !Files.isRegularFile(created.file())) {
      throw new FileNotFoundException("Upload file not found: " + created.file());
    }
    return created;
  }

  void didCreateUploadable(Uploadable created) {
    uploadable = created;
    eventMonitor.requestDidCreateUploadable(this, created);
  }

  void didFailToCreateUploadable(FerryException failure) {
    setError(failure);
    eventMonitor.requestDidFailToCreateUploadable(this, failure);
    retryOrFinish(failure);
  }

  @Override
  void cleanup() {
    super.cleanup();
    var created = uploadable;
    if (created != null) created.cleanup();
  }
}
