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
package fr.aneo.ferry;

import com.google.common.base.Splitter;
import com.google.common.net.MediaType;
import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Status code and content type checks shared by data and download validators.
 */
final class Validations {

  static final String ANY_CONTENT_TYPE = "*/*";
  static final IntPredicate SUCCESSFUL_STATUS = code -> code >= 200 && code < 300;

  private static final Splitter ACCEPT_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private Validations() {
  }

  static void validateStatusCode(HttpResponseHead response, IntPredicate acceptable) {
    if (!acceptable.test(response.statusCode())) {
      throw ResponseValidationException.unacceptableStatusCode(response.statusCode());
    }
  }

  /**
   * Returns the content types the request accepts, from its {@code Accept} header.
   *
   * @return the accepted types, {@code * / *} when the header is missing
   */
  static List<String> acceptableContentTypes(HttpRequest request) {
    var accept = request == null ? Optional.<String>empty() : request.headers().firstValue("Accept");
    if (accept.isEmpty()) return List.of(ANY_CONTENT_TYPE);

    var types = new ArrayList<String>();
    for (String type : ACCEPT_SPLITTER.split(accept.get())) {
      int parameters = type.indexOf(';');
      types.add((parameters < 0 ? type : type.substring(0, parameters)).trim());
    }
    return types.isEmpty() ? List.of(ANY_CONTENT_TYPE) : List.copyOf(types);
  }

  /**
   * Checks the response content type against acceptable types, wildcards included.
   * Callers skip this check for empty bodies.
   */
  static void validateContentType(List<String> acceptable, HttpResponseHead response) {
    var header = response.contentType();
    if (header.isEmpty()) {
      if (acceptable.contains(ANY_CONTENT_TYPE)) return;
      throw ResponseValidationException.missingContentType(acceptable);
    }

    MediaType responseType;
    try {
      responseType = MediaType.parse(header.get()).withoutParameters();
    } catch (IllegalArgumentException e) {
      throw ResponseValidationException.unacceptableContentType(acceptable, header.get());
    }

    for (String candidate : acceptable) {
      if (matches(candidate, responseType)) return;
    }
    throw ResponseValidationException.unacceptableContentType(acceptable, responseType.toString());
  }

  private static boolean matches(String acceptable, MediaType responseType) {
    try {
      return responseType.is(MediaType.parse(acceptable).withoutParameters());
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
