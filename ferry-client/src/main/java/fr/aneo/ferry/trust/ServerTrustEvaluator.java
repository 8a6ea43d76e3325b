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
 * Decides whether the certificate chain presented by a host should be trusted.
 * <p>
 * Evaluators are called during the TLS handshake, on the delegate executor of the network
 * session; they must not block on network operations.
 */
@FunctionalInterface
public interface ServerTrustEvaluator {

  /**
   * Evaluates a presented certificate chain.
   *
   * @param trust the chain presented by the peer
   * @param host  the host the client connected to
   * @return {@code true} to continue the handshake, {@code false} to abort it
   */
  boolean evaluate(ServerTrust trust, String host);
}
