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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static fr.aneo.ferry.testutils.BodyPublisherReader.body;
import static org.assertj.core.api.Assertions.assertThat;

class UrlEncodingTest {

  @Test
  @DisplayName("should sort keys and expand arrays, booleans and nested objects")
  void should_build_sorted_query() {
    // Given
    Map<String, Object> parameters = new HashMap<>();
    parameters.put("tags", List.of("x", "y"));
    parameters.put("active", true);
    parameters.put("filter", Map.of("size", 3, "name", "a b"));
    parameters.put("empty", null);

    // When
    var query = new UrlEncoding().query(parameters);

    // Then
    assertThat(query).isEqualTo("active=1&empty=&filter%5Bname%5D=a%20b&filter%5Bsize%5D=3&tags%5B%5D=x&tags%5B%5D=y");
  }

  @Test
  @DisplayName("should honour array and boolean encoding options")
  void should_honour_encoding_options() {
    // Given
    var encoding = new UrlEncoding(UrlEncoding.Destination.QUERY_STRING, UrlEncoding.ArrayEncoding.NO_BRACKETS, UrlEncoding.BoolEncoding.LITERAL);

    // When
    var query = encoding.query(Map.of("id", List.of(1, 2), "debug", false));

    // Then
    assertThat(query).isEqualTo("debug=false&id=1&id=2");
  }

  @Test
  @DisplayName("should escape reserved characters but keep slash and question mark")
  void should_escape_reserved_characters() {
    assertThat(UrlEncoding.escape("a&b=c/d?e")).isEqualTo("a%26b%3Dc/d?e");
  }

  @Test
  @DisplayName("should append parameters to the query of a GET request")
  void should_append_query_for_get() {
    // Given
    var request = HttpRequest.newBuilder(URI.create("http://localhost/search?lang=fr#top")).GET().build();

    // When
    var encoded = new UrlEncoding().encode(request, Map.of("q", "ferry"));

    // Then
    assertThat(encoded.uri()).hasToString("http://localhost/search?lang=fr&q=ferry#top");
    assertThat(encoded.method()).isEqualTo("GET");
  }

  @Test
  @DisplayName("should send parameters as form body of a POST request")
  void should_send_form_body_for_post() throws Exception {
    // Given
    var request = HttpRequest.newBuilder(URI.create("http://localhost/login"))
                             .POST(HttpRequest.BodyPublishers.noBody())
                             .build();

    // When
    var encoded = new UrlEncoding().encode(request, Map.of("user", "ada", "remember", true));

    // Then
    assertThat(encoded.uri()).hasToString("http://localhost/login");
    assertThat(encoded.headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded; charset=utf-8");
    assertThat(body(encoded)).isEqualTo("remember=1&user=ada");
  }

  @Test
  @DisplayName("should keep request untouched without parameters")
  void should_keep_request_without_parameters() {
    // Given
    var request = HttpRequest.newBuilder(URI.create("http://localhost/")).build();

    // Then
    assertThat(new UrlEncoding().encode(request, Map.of())).isSameAs(request);
    assertThat(UrlEncoding.httpBody().encode(request, null)).isSameAs(request);
  }
}
