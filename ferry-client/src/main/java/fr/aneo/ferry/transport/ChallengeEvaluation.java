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

import static java.util.Objects.requireNonNull;

/**
 * Answer to an {@link AuthenticationChallenge}.
 *
 * @param disposition how the task should proceed
 * @param credential  the credential to use; only meaningful with {@link ChallengeDisposition#USE_CREDENTIAL}
 *                    for HTTP challenges
 * @param error       the reason of a cancellation, or {@code null}
 */
public record ChallengeEvaluation(ChallengeDisposition disposition, Credential credential, Throwable error) {

  public ChallengeEvaluation {
    requireNonNull(disposition, "disposition must not be null");
  }

  public static ChallengeEvaluation useCredential(Credential credential) {
    return new ChallengeEvaluation(ChallengeDisposition.USE_CREDENTIAL, credential, null);
  }

  public static ChallengeEvaluation performDefaultHandling() {
    return new ChallengeEvaluation(ChallengeDisposition.PERFORM_DEFAULT_HANDLING, null, null);
  }

  public static ChallengeEvaluation rejectProtectionSpace() {
    return new ChallengeEvaluation(ChallengeDisposition.REJECT_PROTECTION_SPACE, null, null);
  }

  public static ChallengeEvaluation cancel(Throwable error) {
    return new ChallengeEvaluation(ChallengeDisposition.CANCEL_AUTHENTICATION_CHALLENGE, null, error);
  }
}
