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
 * Classifies every failure a {@link FerryException} can report.
 * <p>
 * Each kind corresponds to one stage of the request pipeline: building the wire request,
 * adapting it, creating the network task, running it, validating and serializing the response,
 * moving a downloaded file and deciding whether to retry.
 */
public enum ErrorKind {
  /** The URL could not be turned into a valid {@link java.net.URI}. */
  INVALID_URL,
  /** Parameters could not be encoded into the wire request. */
  PARAMETER_ENCODING_FAILED,
  /** The {@code RequestConvertible} threw while producing the wire request. */
  CREATE_URL_REQUEST_FAILED,
  /** A {@code RequestAdapter} failed to adapt the wire request. */
  REQUEST_ADAPTATION_FAILED,
  /** The body of an upload could not be produced. */
  UPLOADABLE_CREATION_FAILED,
  /** The network session refused to create a task. */
  CREATE_TASK_FAILED,
  /** The network task failed with a transport error. */
  SESSION_TASK_FAILED,
  /** The request was cancelled by the caller. */
  EXPLICITLY_CANCELLED,
  /** A validator rejected the response. */
  RESPONSE_VALIDATION_FAILED,
  /** A response serializer could not produce a value. */
  RESPONSE_SERIALIZATION_FAILED,
  /** The downloaded file could not be moved to its destination. */
  DOWNLOADED_FILE_MOVE_FAILED,
  /** A server trust evaluator rejected the certificate chain presented by the host. */
  SERVER_TRUST_EVALUATION_FAILED,
  /** The retrier declined to retry and supplied its own error. */
  REQUEST_RETRY_FAILED,
  /** The underlying network session was invalidated while the request was outstanding. */
  SESSION_INVALIDATED,
  /** The owning session was closed while the request was outstanding. */
  SESSION_DEINITIALIZED
}
