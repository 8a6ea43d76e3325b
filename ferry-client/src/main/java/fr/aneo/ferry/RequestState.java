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

/**
 * Lifecycle state of a {@link Request}.
 * <pre>
 * INITIALIZED ──► RESUMED ◄──► SUSPENDED
 *                    │              │
 *                    ▼              ▼
 *       FINISHED ◄───┴── any ──►  CANCELLED
 * </pre>
 * {@link #CANCELLED} and {@link #FINISHED} are terminal. A request retried after a failure keeps
 * its state, so a retried request that was resumed stays resumed.
 */
public enum RequestState {
  INITIALIZED,
  RESUMED,
  SUSPENDED,
  CANCELLED,
  FINISHED;

  /**
   * Tells whether a request in this state may move to {@code next}.
   *
   * @param next the target state
   * @return {@code true} if the transition is allowed
   */
  public boolean canTransitionTo(RequestState next) {
    if (this == next) return false;
    if (next == INITIALIZED) return false;
    return !isTerminal();
  }

  /** @return {@code true} for the states a request never leaves */
  public boolean isTerminal() {
    return this == CANCELLED || this == FINISHED;
  }
}
