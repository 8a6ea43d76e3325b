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

/**
 * How a network task should proceed after an authentication challenge.
 */
public enum ChallengeDisposition {
  /** Answer the challenge with the supplied credential, or accept the server trust. */
  USE_CREDENTIAL,
  /** Let the transport apply its own behaviour, as if no delegate were installed. */
  PERFORM_DEFAULT_HANDLING,
  /** Abort the task. */
  CANCEL_AUTHENTICATION_CHALLENGE,
  /** Decline this challenge and let the response through unanswered. */
  REJECT_PROTECTION_SPACE
}
