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
package fr.aneo.ferry.interceptor;

import fr.aneo.ferry.Session;

import java.net.http.HttpRequest;
import java.util.concurrent.CompletionStage;

/**
 * Rewrites a wire request before a task is created for it, for instance to add an
 * authorization header.
 * <p>
 * Adapters run on every attempt, retries included. A failed stage fails the request with a
 * {@code REQUEST_ADAPTATION_FAILED} error, and the retrier is then asked whether to try again.
 */
@FunctionalInterface
public interface RequestAdapter {

  /**
   * Adapts a wire request.
   *
   * @param request the request about to be sent
   * @param session the session sending it
   * @return a stage completing with the request to send
   */
  CompletionStage<HttpRequest> adapt(HttpRequest request, Session session);
}
