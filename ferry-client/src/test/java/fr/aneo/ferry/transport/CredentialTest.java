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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialTest {

  @Test
  @DisplayName("should build basic authorization header value")
  void should_build_basic_authorization() {
    assertThat(new Credential("user", "pass").basicAuthorization()).isEqualTo("Basic dXNlcjpwYXNz");
  }

  @Test
  @DisplayName("should hide password in string form")
  void should_hide_password() {
    assertThat(new Credential("user", "s3cr3t").toString()).doesNotContain("s3cr3t").contains("user");
  }
}
