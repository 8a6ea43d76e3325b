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

import static java.util.Objects.requireNonNull;

/**
 * A challenge raised by the transport, either to decide whether a TLS peer is trusted or to
 * answer an HTTP {@code 401} with credentials.
 *
 * @param type                 the kind of challenge
 * @param host                 the host being contacted
 * @param port                 the port being contacted, {@code -1} when unknown
 * @param realm                the realm announced by {@code WWW-Authenticate}, or {@code null}
 * @param previousFailureCount how many credentials were already rejected for this task
 * @param serverTrust          the presented certificate chain, for {@link Type#SERVER_TRUST} challenges
 * @param failureResponse      the {@code 401} response head, for {@link Type#HTTP_BASIC} challenges
 */
public record AuthenticationChallenge(Type type,
                                      String host,
                                      int port,
                                      String realm,
                                      int previousFailureCount,
                                      ServerTrust serverTrust,
                                      HttpResponseHead failureResponse) {

  public enum Type {
    SERVER_TRUST,
    HTTP_BASIC
  }

  public AuthenticationChallenge {
    requireNonNull(type, "type must not be null");
    requireNonNull(host, "host must not be null");
  }

  public static AuthenticationChallenge serverTrust(ServerTrust trust, int port) {
    requireNonNull(trust, "trust must not be null");
    return new AuthenticationChallenge(Type.SERVER_TRUST, trust.host(), port, null, 0, trust, null);
  }

  public static AuthenticationChallenge httpBasic(String host, int port, String realm, int previousFailureCount, HttpResponseHead failureResponse) {
    return new AuthenticationChallenge(Type.HTTP_BASIC, host, port, realm, previousFailureCount, null, failureResponse);
  }
}
