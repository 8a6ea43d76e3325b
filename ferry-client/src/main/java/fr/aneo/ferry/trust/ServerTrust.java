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

import java.security.cert.X509Certificate;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The certificate chain a TLS peer presented during a handshake.
 *
 * @param host         the host name the client connected to
 * @param certificates the chain, leaf first
 * @param authType     the key exchange algorithm, as given to {@link javax.net.ssl.X509TrustManager}
 */
public record ServerTrust(String host, List<X509Certificate> certificates, String authType) {

  public ServerTrust {
    requireNonNull(host, "host must not be null");
    requireNonNull(certificates, "certificates must not be null");
    requireNonNull(authType, "authType must not be null");
    if (certificates.isEmpty()) throw new IllegalArgumentException("certificates must not be empty");
    certificates = List.copyOf(certificates);
  }

  public X509Certificate leaf() {
    return certificates.get(0);
  }

  public X509Certificate[] chain() {
    return certificates.toArray(new X509Certificate[0]);
  }
}
