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
package fr.aneo.ferry.response;

import fr.aneo.ferry.transport.HttpResponseHead;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetryAfterTest {

  @Test
  @DisplayName("should parse delay in seconds")
  void should_parse_seconds() {
    // When
    var retryAfter = RetryAfter.parse(" 120 ");

    // Then
    assertThat(retryAfter).contains(RetryAfter.ofSeconds(120));
    assertThat(retryAfter.get().delayFrom(Instant.now())).isEqualTo(Duration.ofMinutes(2));
  }

  @Test
  @DisplayName("should parse HTTP date")
  void should_parse_http_date() {
    // Given
    var now = Instant.parse("2015-10-21T07:27:00Z");

    // When
    var retryAfter = RetryAfter.parse("Wed, 21 Oct 2015 07:28:00 GMT");

    // Then
    assertThat(retryAfter).isPresent();
    assertThat(retryAfter.get().date()).contains(Instant.parse("2015-10-21T07:28:00Z"));
    assertThat(retryAfter.get().seconds()).isEmpty();
    assertThat(retryAfter.get().delayFrom(now)).isEqualTo(Duration.ofMinutes(1));
  }

  @ParameterizedTest
  @ValueSource(strings = {"Sun, 06 Nov 1994 08:49:37 GMT", "Sunday, 06-Nov-94 08:49:37 GMT", "Sun Nov  6 08:49:37 1994"})
  @DisplayName("should parse every HTTP date form")
  void should_parse_every_http_date_form(String value) {
    // When
    var retryAfter = RetryAfter.parse(value);

    // Then
    assertThat(retryAfter).contains(RetryAfter.ofDate(Instant.parse("1994-11-06T08:49:37Z")));
  }

  @Test
  @DisplayName("should never return a negative delay for a past date")
  void should_clamp_past_date() {
    // Given
    var retryAfter = RetryAfter.ofDate(Instant.parse("2015-10-21T07:28:00Z"));

    // When
    var delay = retryAfter.delayFrom(Instant.parse("2020-01-01T00:00:00Z"));

    // Then
    assertThat(delay).isEqualTo(Duration.ZERO);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "-5", "soon", "2015-10-21T07:28:00Z", "1.5", "Monday, 06-Nov-94 08:49:37 GMT", "Sun Nov 6 08:49:37"})
  @DisplayName("should ignore invalid values")
  void should_ignore_invalid_values(String value) {
    assertThat(RetryAfter.parse(value)).isEmpty();
  }

  @Test
  @DisplayName("should detect maintenance mode responses")
  void should_detect_maintenance() {
    // Given
    var maintenance = head(503, "30");
    var unavailableWithoutHint = head(503, null);
    var failure = head(500, "30");

    // Then
    assertThat(ServiceUnavailableResponse.isServiceUnavailable(maintenance)).isTrue();
    assertThat(ServiceUnavailableResponse.maintenance(maintenance)).contains(RetryAfter.ofSeconds(30));
    assertThat(ServiceUnavailableResponse.isServiceUnavailable(unavailableWithoutHint)).isFalse();
    assertThat(ServiceUnavailableResponse.maintenance(failure)).isEmpty();
    assertThat(ServiceUnavailableResponse.maintenance(null)).isEmpty();
  }

  private static HttpResponseHead head(int status, String retryAfter) {
    Map<String, List<String>> headers = retryAfter == null ? Map.of() : Map.of("Retry-After", List.of(retryAfter));
    return new HttpResponseHead(status, URI.create("http://localhost/"), HttpHeaders.of(headers, (name, value) -> true));
  }
}
