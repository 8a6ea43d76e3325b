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

import fr.aneo.ferry.Request;
import fr.aneo.ferry.Session;
import fr.aneo.ferry.exception.FerryException;

import java.util.concurrent.CompletionStage;

/**
 * Decides whether a failed request should be attempted again.
 * <p>
 * The decision may be taken asynchronously. If the request is cancelled before the stage
 * completes, the decision is ignored and the request finishes as cancelled.
 */
@FunctionalInterface
public interface RequestRetrier {

  /**
   * Decides what to do with a failed attempt.
   *
   * @param request the failed request; {@link Request#retryCount()} tells how many retries already happened
   * @param session the session the request belongs to
   * @param error   the error of the attempt
   * @return a stage completing with the decision
   */
  CompletionStage<RetryResult> retry(Request request, Session session, FerryException error);
}
