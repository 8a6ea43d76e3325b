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
package fr.aneo.ferry.encoding;

/**
 * HTTP request methods.
 */
public enum HttpMethod {
  CONNECT,
  DELETE,
  GET,
  HEAD,
  OPTIONS,
  PATCH,
  POST,
  PUT,
  QUERY,
  TRACE;

  /**
   * Returns the method matching a wire method name.
   *
   * @param method the method name, case sensitive as on the wire
   * @return the matching method
   * @throws IllegalArgumentException if the name is not a known method
   */
  public static HttpMethod of(String method) {
    return valueOf(method);
  }
}
