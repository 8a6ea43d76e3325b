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
package fr.aneo.ferry;

import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.trust.ServerTrustManager;

/**
 * What the {@link SessionDelegate} needs to know about its session to route network events.
 */
interface SessionStateProvider {

  Request request(NetworkTask task);

  TaskDelegate taskDelegate(NetworkTask task);

  /**
   * Called when a task completes, before its request is told, so the task is no longer live.
   */
  void didCompleteTask(NetworkTask task);

  ServerTrustManager serverTrustManager();

  RedirectHandler redirectHandler();

  Credential defaultCredential(String host);

  EventMonitor eventMonitor();

  /**
   * Finishes every outstanding request because the network session can no longer be used.
   */
  void cancelRequestsForSessionInvalidation(Throwable error);
}
