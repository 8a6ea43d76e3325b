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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import javax.security.auth.x500.X500Principal;
import java.security.cert.X509Certificate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HostNamesTest {

  @ParameterizedTest
  @CsvSource({
    "api.example.com, api.example.com, true",
    "*.example.com, api.example.com, true",
    "*.example.com, example.com, false",
    "*.example.com, deep.api.example.com, false",
    "api.example.com, www.example.com, false"
  })
  @DisplayName("should match host against name pattern")
  void should_match_pattern(String pattern, String host, boolean expected) {
    assertThat(HostNames.matches(pattern, host)).isEqualTo(expected);
  }

  @Test
  @DisplayName("should prefer subject alternative names over common name")
  void should_prefer_alternative_names() throws Exception {
    // Given
    var certificate = mock(X509Certificate.class);
    when(certificate.getSubjectX500Principal()).thenReturn(new X500Principal("CN=legacy.example.com"));
    doReturn(List.of(List.of(2, "*.Example.com"), List.of(7, "10.0.0.1"))).when(certificate).getSubjectAlternativeNames();

    // Then
    assertThat(HostNames.matches(certificate, "API.example.com")).isTrue();
    assertThat(HostNames.matches(certificate, "10.0.0.1")).isTrue();
    assertThat(HostNames.matches(certificate, "legacy.example.com")).isTrue();
    assertThat(HostNames.matches(certificate, "example.org")).isFalse();
  }

  @Test
  @DisplayName("should fall back to common name without alternative names")
  void should_fall_back_to_common_name() throws Exception {
    // Given
    var certificate = mock(X509Certificate.class);
    when(certificate.getSubjectX500Principal()).thenReturn(new X500Principal("CN=legacy.example.com, O=Example"));
    doReturn(null).when(certificate).getSubjectAlternativeNames();

    // Then
    assertThat(HostNames.matches(certificate, "legacy.example.com")).isTrue();
    assertThat(HostNames.matches(certificate, "api.example.com")).isFalse();
  }
}
