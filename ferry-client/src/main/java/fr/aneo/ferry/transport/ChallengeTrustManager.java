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

import fr.aneo.ferry.trust.ServerTrust;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Trust manager turning every server certificate check into a server trust challenge.
 * <p>
 * {@link ChallengeDisposition#USE_CREDENTIAL} accepts the peer,
 * {@link ChallengeDisposition#CANCEL_AUTHENTICATION_CHALLENGE} aborts the handshake and any other
 * answer falls back to the platform trust manager, host name verification included.
 */
final class ChallengeTrustManager extends X509ExtendedTrustManager {

  private final JdkNetworkSession session;
  private final X509TrustManager system;

  ChallengeTrustManager(JdkNetworkSession session, X509TrustManager system) {
    this.session = session;
    this.system = system;
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
    var host = engine == null ? null : engine.getPeerHost();
    if (host == null || chain == null || chain.length == 0) {
      systemCheck(chain, authType, engine);
      return;
    }

    var evaluation = session.evaluateServerTrust(new ServerTrust(host, List.of(chain), authType), engine.getPeerPort());
    switch (evaluation.disposition()) {
      case USE_CREDENTIAL:
        return;
      case CANCEL_AUTHENTICATION_CHALLENGE:
        throw new CertificateException("Server trust evaluation cancelled the connection to " + host, evaluation.error());
      default:
        systemCheck(chain, authType, engine);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
    if (system instanceof X509ExtendedTrustManager extended) {
      extended.checkServerTrusted(chain, authType, socket);
    } else {
      system.checkServerTrusted(chain, authType);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
    system.checkServerTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
    system.checkClientTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
    system.checkClientTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
    system.checkClientTrusted(chain, authType);
  }

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return system.getAcceptedIssuers();
  }

  private void systemCheck(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
    if (system instanceof X509ExtendedTrustManager extended) {
      extended.checkServerTrusted(chain, authType, engine);
    } else {
      system.checkServerTrusted(chain, authType);
    }
  }
}
