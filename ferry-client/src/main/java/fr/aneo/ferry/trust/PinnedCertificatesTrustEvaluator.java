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
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Trusts a host only when its chain contains one of a set of pinned certificates.
 * <p>
 * Default validation and host validation can be layered on top of the pin check. When
 * self-signed certificates are accepted, a chain whose leaf is itself pinned skips default
 * validation.
 */
public final class PinnedCertificatesTrustEvaluator implements ServerTrustEvaluator {

  private final List<X509Certificate> certificates;
  private final boolean acceptSelfSignedCertificates;
  private final boolean performDefaultValidation;
  private final boolean validateHost;
  private final X509TrustManager trustManager;

  public PinnedCertificatesTrustEvaluator(List<X509Certificate> certificates) {
    this(certificates, false, true, true, DefaultTrustEvaluator.systemTrustManager());
  }

  public PinnedCertificatesTrustEvaluator(List<X509Certificate> certificates,
                                          boolean acceptSelfSignedCertificates,
                                          boolean performDefaultValidation,
                                          boolean validateHost,
                                          X509TrustManager trustManager) {
    requireNonNull(certificates, "certificates must not be null");
    if (certificates.isEmpty()) throw new IllegalArgumentException("at least one pinned certificate is required");
    this.certificates = List.copyOf(certificates);
    this.acceptSelfSignedCertificates = acceptSelfSignedCertificates;
    this.performDefaultValidation = performDefaultValidation;
    this.validateHost = validateHost;
    this.trustManager = requireNonNull(trustManager, "trustManager must not be null");
  }

  @Override
  public boolean evaluate(ServerTrust trust, String host) {
    boolean selfSignedPin = acceptSelfSignedCertificates && isPinned(trust.leaf());

    if (performDefaultValidation && !selfSignedPin) {
      if (!new DefaultTrustEvaluator(trustManager, false).evaluate(trust, host)) return false;
    }
    if (validateHost && !HostNames.matches(trust.leaf(), host)) return false;

    return trust.certificates().stream().anyMatch(this::isPinned);
  }

  private boolean isPinned(X509Certificate candidate) {
    byte[] encoded = encoded(candidate);
    return encoded != null && certificates.stream().anyMatch(pinned -> Arrays.equals(encoded, encoded(pinned)));
  }

  private static byte[] encoded(X509Certificate certificate) {
    try {
      return certificate.getEncoded();
    } catch (CertificateEncodingException e) {
      return null;
    }
  }
}
