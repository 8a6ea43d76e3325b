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

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Host name verification against the identities of a server certificate.
 */
final class HostNames {
  private static final Logger logger = LoggerFactory.getLogger(HostNames.class);

  private static final int SAN_DNS_NAME = 2;
  private static final int SAN_IP_ADDRESS = 7;

  private HostNames() {
  }

  /**
   * Tells whether {@code certificate} identifies {@code host}.
   * <p>
   * Subject alternative names are used when present; the subject common name is used otherwise.
   * A leftmost {@code *} label matches exactly one label.
   */
  static boolean matches(X509Certificate certificate, String host) {
    var normalizedHost = host.toLowerCase(Locale.ROOT);
    List<String> dnsNames = new ArrayList<>();

    try {
      Collection<List<?>> alternativeNames = certificate.getSubjectAlternativeNames();
      if (alternativeNames != null) {
        for (List<?> entry : alternativeNames) {
          int type = (Integer) entry.get(0);
          var value = String.valueOf(entry.get(1)).toLowerCase(Locale.ROOT);
          if (type == SAN_IP_ADDRESS && value.equals(normalizedHost)) return true;
          if (type == SAN_DNS_NAME) dnsNames.add(value);
        }
      }
    } catch (CertificateParsingException e) {
      logger.debug("Could not read subject alternative names of {}", certificate.getSubjectX500Principal(), e);
      return false;
    }

    if (dnsNames.isEmpty()) {
      var commonName = commonName(certificate);
      if (commonName != null) dnsNames.add(commonName.toLowerCase(Locale.ROOT));
    }

    return dnsNames.stream().anyMatch(pattern -> matches(pattern, normalizedHost));
  }

  static boolean matches(String pattern, String host) {
    if (!pattern.startsWith("*.")) return pattern.equals(host);

    int firstDot = host.indexOf('.');
    return firstDot > 0 && host.substring(firstDot).equals(pattern.substring(1));
  }

  private static String commonName(X509Certificate certificate) {
    try {
      var name = new LdapName(certificate.getSubjectX500Principal().getName());
      for (Rdn rdn : name.getRdns()) {
        if ("CN".equalsIgnoreCase(rdn.getType())) return String.valueOf(rdn.getValue());
      }
    } catch (InvalidNameException e) {
      logger.debug("Could not parse subject of {}", certificate.getSubjectX500Principal(), e);
    }
    return null;
  }
}
