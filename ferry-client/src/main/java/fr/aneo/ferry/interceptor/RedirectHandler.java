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

import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;

import java.net.http.HttpRequest;
import java.util.Optional;

/**
 * Decides what happens when a task receives a redirect.
 * <p>
 * Without a handler, every redirect is followed.
 */
@FunctionalInterface
public interface RedirectHandler {

  /**
   * Decides how to handle a redirect.
   *
   * @param task     the redirected task
   * @param proposed the request the redirect leads to
   * @param response the redirect response
   * @return the request to send, or empty to stop and surface the redirect response and its body
   */
  Optional<HttpRequest> redirect(NetworkTask task, HttpRequest proposed, HttpResponseHead response);
}
