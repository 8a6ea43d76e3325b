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

import java.net.http.HttpRequest;

/**
 * Handle on one in-flight network operation.
 * <p>
 * A task is created {@linkplain State#SUSPENDED suspended}; the first call to {@link #resume()}
 * sends its request. All progress and completion events of the task are reported to the
 * {@link NetworkSessionDelegate} of the session that created it.
 * <p>
 * Implementations are thread safe: {@link #resume()}, {@link #suspend()} and {@link #cancel()}
 * may be called from any thread, and are no-ops once the task has completed.
 */
public interface NetworkTask {

  enum State {
    RUNNING,
    SUSPENDED,
    CANCELING,
    COMPLETED
  }

  /**
   * Returns the identifier of this task, unique within its session.
   *
   * @return the task identifier
   */
  long taskIdentifier();

  HttpRequest originalRequest();

  /**
   * Returns the request currently being sent, which differs from {@link #originalRequest()}
   * after a redirect or an authentication retry.
   *
   * @return the current request
   */
  HttpRequest currentRequest();

  /**
   * Returns the response head once it has been received.
   *
   * @return the response head, or {@code null} before the response arrives
   */
  HttpResponseHead response();

  State state();

  void resume();

  void suspend();

  void cancel();

  long countOfBytesReceived();

  /**
   * Returns the expected number of response body bytes.
   *
   * @return the declared content length, or {@code -1} when unknown
   */
  long countOfBytesExpectedToReceive();

  long countOfBytesSent();

  long countOfBytesExpectedToSend();
}
