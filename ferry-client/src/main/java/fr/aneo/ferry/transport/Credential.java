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

import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * A user name and password answering an HTTP authentication challenge.
 *
 * @param user     the user name
 * @param password the password
 */
public record Credential(String user, String password) {

  public Credential {
    requireNonNull(user, "user must not be null");
    requireNonNull(password, "password must not be null");
  }

  /**
   * Returns the value of an {@code Authorization} header for the HTTP basic scheme.
   *
   * @return {@code "Basic "} followed by the base64 encoded {@code user:password}
   */
  public String basicAuthorization() {
    var token = (user + ":" + password).getBytes(StandardCharsets.UTF_8);
    return "Basic " + BaseEncoding.base64().encode(token);
  }

  @Override
  public String toString() {
    return "Credential[user=" + user + ", password=****]";
  }
}
