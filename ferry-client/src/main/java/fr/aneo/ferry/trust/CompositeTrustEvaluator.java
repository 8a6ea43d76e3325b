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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Trusts a host only when every wrapped evaluator trusts it. Evaluation stops at the first
 * rejection.
 */
public final class CompositeTrustEvaluator implements ServerTrustEvaluator {

  private final List<ServerTrustEvaluator> evaluators;

  public CompositeTrustEvaluator(List<ServerTrustEvaluator> evaluators) {
    requireNonNull(evaluators, "evaluators must not be null");
    this.evaluators = List.copyOf(evaluators);
  }

  @Override
  public boolean evaluate(ServerTrust trust, String host) {
    for (ServerTrustEvaluator evaluator : evaluators) {
      if (!evaluator.evaluate(trust, host)) return false;
    }
    return true;
  }
}
