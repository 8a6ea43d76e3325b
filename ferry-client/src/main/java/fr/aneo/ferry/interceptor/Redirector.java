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

import static java.util.Objects.requireNonNull;

/**
 * {@link RedirectHandler} applying one fixed behaviour to every redirect.
 */
public final class Redirector implements RedirectHandler {

  /**
   * Computes the request to send instead of the proposed one, or {@code null} to stop.
   */
  @FunctionalInterface
  public interface Modifier {
    HttpRequest modify(NetworkTask task, HttpRequest proposed, HttpResponseHead response);
  }

  private static final Redirector FOLLOW = new Redirector((task, proposed, response) -> proposed);
  private static final Redirector DO_NOT_FOLLOW = new Redirector((task, proposed, response) -> null);

  private final Modifier modifier;

  private Redirector(Modifier modifier) {
    this.modifier = modifier;
  }

  public static Redirector follow() {
    return FOLLOW;
  }

  public static Redirector doNotFollow() {
    return DO_NOT_FOLLOW;
  }

  public static Redirector modify(Modifier modifier) {
    return new Redirector(requireNonNull(modifier, "modifier must not be null"));
  }

  @Override
  public Optional<HttpRequest> redirect(NetworkTask task, HttpRequest proposed, HttpResponseHead response) {
    return Optional.ofNullable(modifier.modify(task, proposed, response));
  }
}
