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
package fr.aneo.ferry.response;

import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Turns the outcome of a request into a typed value.
 * <p>
 * A serializer is called once per handler it is attached with, on a serialization thread, after
 * the request finished. It receives the error of the request, if any, and should rethrow it.
 * Download bodies are read from disk and handed to {@link #serialize} by default.
 *
 * @param <T> the type produced
 */
@FunctionalInterface
public interface ResponseSerializer<T> {

  Set<Integer> DEFAULT_EMPTY_RESPONSE_CODES = Set.of(204, 205);
  Set<String> DEFAULT_EMPTY_REQUEST_METHODS = Set.of("HEAD");

  /**
   * Serializes the outcome of a data or upload request.
   *
   * @param request  the last wire request, or {@code null}
   * @param response the response head, or {@code null}
   * @param data     the received body, or {@code null}
   * @param error    the error of the request, or {@code null}
   * @return the serialized value
   * @throws Exception if serialization fails; non {@link FerryException} failures are reported as
   *                   serialization errors
   */
  T serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) throws Exception;

  /**
   * Serializes the outcome of a download request.
   *
   * @param request  the last wire request, or {@code null}
   * @param response the response head, or {@code null}
   * @param fileUrl  where the body was moved, or {@code null}
   * @param error    the error of the request, or {@code null}
   * @return the serialized value
   * @throws Exception if serialization fails
   */
  default T serializeDownload(HttpRequest request, HttpResponseHead response, Path fileUrl, FerryException error) throws Exception {
    if (error != null) throw error;
    if (fileUrl == null) throw ResponseSerializationException.inputFileNil();

    byte[] data;
    try {
      data = Files.readAllBytes(fileUrl);
    } catch (IOException e) {
      throw ResponseSerializationException.inputFileReadFailed(e);
    }
    return serialize(request, response, data, null);
  }

  /**
   * Tells whether an empty body is a valid response, as it is for {@code 204}, {@code 205} and
   * {@code HEAD} requests.
   */
  static boolean emptyResponseAllowed(HttpRequest request, HttpResponseHead response, Set<Integer> emptyResponseCodes, Set<String> emptyRequestMethods) {
    boolean methodAllowed = request != null && emptyRequestMethods.contains(request.method());
    boolean codeAllowed = response != null && emptyResponseCodes.contains(response.statusCode());
    return methodAllowed || codeAllowed;
  }
}
