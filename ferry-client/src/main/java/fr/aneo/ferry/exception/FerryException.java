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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * Base exception for all Ferry client operations.
 * <p>
 * This unchecked exception is delivered in the {@code Result} of every response handler attached
 * to a failed request. Its {@link #kind()} tells which stage of the pipeline failed; subclasses
 * carry the details of validation, serialization, file move, trust and retry failures.
 * <p>
 * A request latches the first {@code FerryException} it encounters for an attempt, and that error
 * is handed unchanged to every attached handler.
 *
 * @see ErrorKind
 */
public class FerryException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Creates a new exception of the given kind.
   *
   * @param kind    the pipeline stage that failed; must not be {@code null}
   * @param message the detail message explaining the error
   */
  public FerryException(ErrorKind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind, "kind must not be null");
  }

  /**
   * Creates a new exception of the given kind wrapping a lower-level cause.
   *
   * @param kind    the pipeline stage that failed; must not be {@code null}
   * @param message the detail message explaining the error
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public FerryException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind, "kind must not be null");
  }

  /**
   * Returns the pipeline stage that failed.
   *
   * @return the error kind, never {@code null}
   */
  public ErrorKind kind() {
    return kind;
  }

  public boolean isExplicitlyCancelled() {
    return kind == ErrorKind.EXPLICITLY_CANCELLED;
  }

  public boolean isResponseValidationError() {
    return kind == ErrorKind.RESPONSE_VALIDATION_FAILED;
  }

  public boolean isResponseSerializationError() {
    return kind == ErrorKind.RESPONSE_SERIALIZATION_FAILED;
  }

  public boolean isSessionTaskError() {
    return kind == ErrorKind.SESSION_TASK_FAILED;
  }

  /**
   * Returns the first {@code FerryException} found in the cause chain of {@code throwable}, or
   * wraps it as a {@link ErrorKind#SESSION_TASK_FAILED} error.
   * <p>
   * {@link CompletionException} and {@link ExecutionException} layers are skipped so that errors
   * raised inside asynchronous adapters and retriers keep their original kind.
   *
   * @param throwable the failure to convert; must not be {@code null}
   * @return a {@code FerryException} describing {@code throwable}
   */
  public static FerryException from(Throwable throwable) {
    requireNonNull(throwable, "throwable must not be null");

    Throwable current = throwable;
    while (current != null) {
      if (current instanceof FerryException ferryException) return ferryException;
      current = current.getCause();
    }
    return sessionTaskFailed(unwrap(throwable));
  }

  /**
   * Removes {@link CompletionException} and {@link ExecutionException} wrappers.
   *
   * @param throwable the throwable to unwrap
   * @return the innermost meaningful cause
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public static FerryException explicitlyCancelled() {
    return new FerryException(ErrorKind.EXPLICITLY_CANCELLED, "Request explicitly cancelled.");
  }

  public static FerryException sessionDeinitialized() {
    return new FerryException(ErrorKind.SESSION_DEINITIALIZED, "Session was closed while the request was outstanding.");
  }

  public static FerryException sessionInvalidated(Throwable cause) {
    return new FerryException(ErrorKind.SESSION_INVALIDATED, "Network session was invalidated.", cause);
  }

  public static FerryException sessionTaskFailed(Throwable cause) {
    return new FerryException(ErrorKind.SESSION_TASK_FAILED, "Network task failed: " + cause.getMessage(), cause);
  }

  public static FerryException requestAdaptationFailed(Throwable cause) {
    return new FerryException(ErrorKind.REQUEST_ADAPTATION_FAILED, "Request adaptation failed: " + cause.getMessage(), cause);
  }

  public static FerryException createUrlRequestFailed(Throwable cause) {
    return new FerryException(ErrorKind.CREATE_URL_REQUEST_FAILED, "Wire request creation failed: " + cause.getMessage(), cause);
  }

  public static FerryException invalidUrl(String url, Throwable cause) {
    return new FerryException(ErrorKind.INVALID_URL, "URL is not valid: " + url, cause);
  }

  public static FerryException parameterEncodingFailed(Throwable cause) {
    return new FerryException(ErrorKind.PARAMETER_ENCODING_FAILED, "Parameter encoding failed: " + cause.getMessage(), cause);
  }

  public static FerryException uploadableCreationFailed(Throwable cause) {
    return new FerryException(ErrorKind.UPLOADABLE_CREATION_FAILED, "Upload body creation failed: " + cause.getMessage(), cause);
  }

  public static FerryException createTaskFailed(Throwable cause) {
    return new FerryException(ErrorKind.CREATE_TASK_FAILED, "Network task creation failed: " + cause.getMessage(), cause);
  }
}
