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

import javax.net.ssl.X509TrustManager;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Trusts a host only when a certificate of its chain carries one of a set of pinned public keys.
 */
public final class PublicKeysTrustEvaluator implements ServerTrustEvaluator {

  private final List<PublicKey> keys;
  private final boolean performDefaultValidation;
  private final boolean validateHost;
  private final X509TrustManager trustManager;

  public PublicKeysTrustEvaluator(List<PublicKey> keys) {
    this(keys, true, true, DefaultTrustEvaluator.systemTrustManager());
  }

  public PublicKeysTrustEvaluator(List<PublicKey> keys,
                                  boolean performDefaultValidation,
                                  boolean validateHost,
                                  X509TrustManager trustManager) {
    requireNonNull(keys, "keys must not be null");
    if (keys.isEmpty()) throw new IllegalArgumentException("at least one pinned public key is required");
    this.keys = List.copyOf(keys);
    this.performDefaultValidation = performDefaultValidation;
    this.validateHost = validateHost;
    this.trustManager = requireNonNull(trustManager, "trustManager must not be null");
  }

  @Override
  public boolean evaluate(ServerTrust trust, String host) {
    if (performDefaultValidation && !new DefaultTrustEvaluator(trustManager, false).evaluate(trust, host)) return false;
    if (validateHost && !HostNames.matches(trust.leaf(), host)) return false;

    return trust.certificates().stream()
                .map(certificate -> certificate.getPublicKey().getEncoded())
                .anyMatch(encoded -> keys.stream().anyMatch(key -> Arrays.equals(encoded, key.getEncoded())));
  }
}
