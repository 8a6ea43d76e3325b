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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;

import static java.util.Objects.requireNonNull;

/**
 * Trusts a host when its chain validates against the platform trust store and its leaf
 * certificate identifies the host.
 */
public final class DefaultTrustEvaluator implements ServerTrustEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(DefaultTrustEvaluator.class);

  private final X509TrustManager trustManager;
  private final boolean validateHost;

  public DefaultTrustEvaluator() {
    this(systemTrustManager(), true);
  }

  public DefaultTrustEvaluator(boolean validateHost) {
    this(systemTrustManager(), validateHost);
  }

  /**
   * Creates an evaluator validating chains with a given trust manager.
   *
   * @param trustManager the trust manager validating chains
   * @param validateHost whether the leaf certificate must identify the evaluated host
   */
  public DefaultTrustEvaluator(X509TrustManager trustManager, boolean validateHost) {
    this.trustManager = requireNonNull(trustManager, "trustManager must not be null");
    this.validateHost = validateHost;
  }

  @Override
  public boolean evaluate(ServerTrust trust, String host) {
    try {
      trustManager.checkServerTrusted(trust.chain(), trust.authType());
    } catch (CertificateException e) {
      logger.debug("Default validation of {} failed", host, e);
      return false;
    }
    return !validateHost || HostNames.matches(trust.leaf(), host);
  }

  /**
   * Returns the trust manager of the platform default trust store.
   *
   * @return the default X.509 trust manager
   * @throws IllegalStateException if the platform provides none
   */
  public static X509TrustManager systemTrustManager() {
    try {
      var factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init((KeyStore) null);
      for (TrustManager manager : factory.getTrustManagers()) {
        if (manager instanceof X509TrustManager x509) return x509;
      }
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to load the default trust store", e);
    }
    throw new IllegalStateException("No X509TrustManager available");
  }
}
