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

import java.net.http.HttpRequest;
import java.util.Map;

/**
 * Places parameters into a wire request, either in its URL or in its body.
 *
 * @see UrlEncoding
 * @see JsonEncoding
 */
@FunctionalInterface
public interface ParameterEncoding {

  /**
   * Returns {@code request} carrying {@code parameters}.
   *
   * @param request    the request to encode parameters into
   * @param parameters the parameters, possibly {@code null} or empty
   * @return the encoded request
   * @throws fr.aneo.ferry.exception.FerryException with kind {@code PARAMETER_ENCODING_FAILED} if encoding fails
   */
  HttpRequest encode(HttpRequest request, Map<String, ?> parameters);
}
