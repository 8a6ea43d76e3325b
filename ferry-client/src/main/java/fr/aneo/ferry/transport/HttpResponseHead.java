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

import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.Optional;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Status line and headers of an HTTP response, as received before its body.
 *
 * @param statusCode the HTTP status code
 * @param uri        the URI the response was received from
 * @param headers    the response headers
 */
public record HttpResponseHead(int statusCode, URI uri, HttpHeaders headers) {

  public HttpResponseHead {
    requireNonNull(uri, "uri must not be null");
    requireNonNull(headers, "headers must not be null");
  }

  public Optional<String> header(String name) {
    return headers.firstValue(name);
  }

  /**
   * Returns the raw {@code Content-Type} header value, if any.
   *
   * @return the content type
   */
  public Optional<String> contentType() {
    return headers.firstValue("Content-Type");
  }

  /**
   * Returns the declared body length.
   *
   * @return the {@code Content-Length} value, or {@code -1} when absent or invalid
   */
  public long expectedContentLength() {
    OptionalLong length = headers.firstValueAsLong("Content-Length");
    return length.isPresent() ? length.getAsLong() : -1;
  }

  public boolean isRedirection() {
    return statusCode >= 300 && statusCode < 400;
  }
}
