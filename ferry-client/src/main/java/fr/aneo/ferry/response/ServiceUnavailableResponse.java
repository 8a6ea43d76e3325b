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

import fr.aneo.ferry.transport.HttpResponseHead;

import java.net.http.HttpHeaders;
import java.util.Optional;

/**
 * Recognizes the maintenance mode signal: a {@code 503 Service Unavailable} response carrying a
 * valid {@code Retry-After} header.
 * <p>
 * Requests are not retried automatically on this signal; callers decide what to do with it.
 */
public final class ServiceUnavailableResponse {

  public static final int SERVICE_UNAVAILABLE = 503;

  private ServiceUnavailableResponse() {
  }

  public static boolean isServiceUnavailable(HttpResponseHead response) {
    return response != null && response.statusCode() == SERVICE_UNAVAILABLE && retryAfter(response.headers()).isPresent();
  }

  public static Optional<RetryAfter> retryAfter(HttpHeaders headers) {
    return headers.firstValue("Retry-After").flatMap(RetryAfter::parse);
  }

  /**
   * Returns when to try again if {@code response} is a maintenance mode signal.
   *
   * @param response the response head, may be {@code null}
   * @return the parsed {@code Retry-After}, or empty if the response is not a maintenance signal
   */
  public static Optional<RetryAfter> maintenance(HttpResponseHead response) {
    if (response == null || response.statusCode() != SERVICE_UNAVAILABLE) return Optional.empty();
    return retryAfter(response.headers());
  }
}
