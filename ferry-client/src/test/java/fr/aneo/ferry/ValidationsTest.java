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

import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.transport.HttpResponseHead;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

class ValidationsTest {

  @ParameterizedTest
  @ValueSource(ints = {200, 201, 204, 299})
  @DisplayName("should accept successful status codes")
  void should_accept_successful_status(int statusCode) {
    assertThatCode(() -> Validations.validateStatusCode(head(statusCode, null), Validations.SUCCESSFUL_STATUS))
      .doesNotThrowAnyException();
  }

  @ParameterizedTest
  @ValueSource(ints = {199, 302, 404, 500})
  @DisplayName("should reject unsuccessful status codes")
  void should_reject_unsuccessful_status(int statusCode) {
    assertThatThrownBy(() -> Validations.validateStatusCode(head(statusCode, null), Validations.SUCCESSFUL_STATUS))
      .asInstanceOf(type(ResponseValidationException.class))
      .satisfies(e -> {
        assertThat(e.reason()).isEqualTo(ResponseValidationException.Reason.UNACCEPTABLE_STATUS_CODE);
        assertThat(e.statusCode()).isEqualTo(statusCode);
      });
  }

  @Test
  @DisplayName("should read acceptable content types from Accept header")
  void should_read_accept_header() {
    // Given
    var request = HttpRequest.newBuilder(URI.create("http://localhost/"))
                             .header("Accept", "application/json; q=0.9, text/*")
                             .build();

    // Then
    assertThat(Validations.acceptableContentTypes(request)).containsExactly("application/json", "text/*");
    assertThat(Validations.acceptableContentTypes(null)).containsExactly("*/*");
  }

  @Test
  @DisplayName("should match content types with wildcards and parameters")
  void should_match_content_types() {
    assertThatCode(() -> Validations.validateContentType(List.of("application/json"), head(200, "application/json; charset=utf-8")))
      .doesNotThrowAnyException();
    assertThatCode(() -> Validations.validateContentType(List.of("text/*"), head(200, "text/html")))
      .doesNotThrowAnyException();
    assertThatCode(() -> Validations.validateContentType(List.of("*/*"), head(200, null)))
      .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should reject unacceptable and missing content types")
  void should_reject_content_types() {
    assertThatThrownBy(() -> Validations.validateContentType(List.of("application/json"), head(200, "application/xml")))
      .asInstanceOf(type(ResponseValidationException.class))
      .satisfies(e -> {
        assertThat(e.reason()).isEqualTo(ResponseValidationException.Reason.UNACCEPTABLE_CONTENT_TYPE);
        assertThat(e.responseContentType()).isEqualTo("application/xml");
        assertThat(e.acceptableContentTypes()).containsExactly("application/json");
      });
    assertThatThrownBy(() -> Validations.validateContentType(List.of("application/json"), head(200, null)))
      .asInstanceOf(type(ResponseValidationException.class))
      .extracting(ResponseValidationException::reason)
      .isEqualTo(ResponseValidationException.Reason.MISSING_CONTENT_TYPE);
  }

  private static HttpResponseHead head(int status, String contentType) {
    Map<String, List<String>> headers = contentType == null ? Map.of() : Map.of("Content-Type", List.of(contentType));
    return new HttpResponseHead(status, URI.create("http://localhost/"), HttpHeaders.of(headers, (name, value) -> true));
  }
}
