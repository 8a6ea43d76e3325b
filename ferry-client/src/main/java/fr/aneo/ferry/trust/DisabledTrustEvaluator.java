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

/**
 * Trusts every host.
 * <p>
 * <strong>This evaluator disables TLS authentication.</strong> Use it only against development
 * servers whose traffic carries nothing worth protecting.
 */
public final class DisabledTrustEvaluator implements ServerTrustEvaluator {

  @Override
  public boolean evaluate(ServerTrust trust, String host) {
    return true;
  }
}
