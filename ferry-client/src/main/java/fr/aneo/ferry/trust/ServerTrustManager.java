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
package fr.aneo.ferry.trust;

import fr.aneo.ferry.exception.ServerTrustEvaluationException;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Maps hosts to the evaluator deciding whether they are trusted.
 * <p>
 * Hosts without an evaluator use the platform default behaviour, unless the manager requires
 * every host to be evaluated, in which case connecting to them fails.
 */
public class ServerTrustManager {

  private final boolean allHostsMustBeEvaluated;
  private final Map<String, ServerTrustEvaluator> evaluators;

  public ServerTrustManager(Map<String, ServerTrustEvaluator> evaluators) {
    this(true, evaluators);
  }

  public ServerTrustManager(boolean allHostsMustBeEvaluated, Map<String, ServerTrustEvaluator> evaluators) {
    this.allHostsMustBeEvaluated = allHostsMustBeEvaluated;
    this.evaluators = Map.copyOf(requireNonNull(evaluators, "evaluators must not be null"));
  }

  /**
   * Returns the evaluator registered for {@code host}.
   *
   * @param host the host being contacted
   * @return the evaluator, or empty when the platform default behaviour applies
   * @throws ServerTrustEvaluationException if no evaluator is registered and every host must be evaluated
   */
  public Optional<ServerTrustEvaluator> serverTrustEvaluator(String host) {
    var evaluator = evaluators.get(host);
    if (evaluator == null && allHostsMustBeEvaluated) throw ServerTrustEvaluationException.noEvaluatorFound(host);

    return Optional.ofNullable(evaluator);
  }

  public boolean allHostsMustBeEvaluated() {
    return allHostsMustBeEvaluated;
  }
}
