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

/**
 * Raised when a retrier declines to retry a failed request and supplies its own error.
 * <p>
 * The retrier's error is the {@linkplain #getCause() cause}; the error that triggered the retry
 * decision is kept as {@link #originalError()}.
 */
public final class RequestRetryException extends FerryException {

  private final Throwable retryError;
  private final FerryException originalError;

  public RequestRetryException(Throwable retryError, FerryException originalError) {
    super(ErrorKind.REQUEST_RETRY_FAILED,
      "Request retry failed with retry error: " + retryError.getMessage() + ", original error: " + originalError.getMessage(),
      retryError);
    this.retryError = retryError;
    this.originalError = originalError;
  }

  public Throwable retryError() {
    return retryError;
  }

  public FerryException originalError() {
    return originalError;
  }
}
