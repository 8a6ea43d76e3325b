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
package fr.aneo.ferry.interceptor;

import fr.aneo.ferry.Request;
import fr.aneo.ferry.encoding.HttpMethod;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.transport.HttpResponseHead;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetryPolicyTest {

  private final RetryPolicy policy = new RetryPolicy();

  @Test
  @DisplayName("should retry a GET that failed to connect")
  void should_retry_connect_failure() {
    // Given
    var request = request("GET", null, 0);
    var error = FerryException.sessionTaskFailed(new ConnectException("Connection refused"));

    // When
    var result = policy.retry(request, null, error).toCompletableFuture().join();

    // Then
    assertThat(result.kind()).isEqualTo(RetryResult.Kind.RETRY_WITH_DELAY);
    assertThat(result.delay()).contains(Duration.ofMillis(500));
  }

  @Test
  @DisplayName("should retry a validated retryable status code")
  void should_retry_retryable_status() {
    // Given
    var request = request("GET", 503, 0);

    // When
    var shouldRetry = policy.shouldRetry(request, ResponseValidationException.unacceptableStatusCode(503));

    // Then
    assertThat(shouldRetry).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 404, 501})
  @DisplayName("should not retry a non retryable status code")
  void should_not_retry_other_status(int statusCode) {
    // Given
    var request = request("GET", statusCode, 0);

    // When
    var shouldRetry = policy.shouldRetry(request, ResponseValidationException.unacceptableStatusCode(statusCode));

    // Then
    assertThat(shouldRetry).isFalse();
  }

  @Test
  @DisplayName("should not retry a POST")
  void should_not_retry_post() {
    // Given
    var request = request("POST", 503, 0);

    // When
    var result = policy.retry(request, null, ResponseValidationException.unacceptableStatusCode(503)).toCompletableFuture().join();

    // Then
    assertThat(result.kind()).isEqualTo(RetryResult.Kind.DO_NOT_RETRY);
  }

  @Test
  @DisplayName("should stop retrying once the retry limit is reached")
  void should_stop_at_retry_limit() {
    // Given
    var request = request("GET", 503, 2);

    // When
    var result = policy.retry(request, null, ResponseValidationException.unacceptableStatusCode(503)).toCompletableFuture().join();

    // Then
    assertThat(result.isRetryRequired()).isFalse();
  }

  @Test
  @DisplayName("should not retry when the request has no wire request")
  void should_not_retry_without_request() {
    // Given
    var request = mock(Request.class);

    // When
    var shouldRetry = policy.shouldRetry(request, FerryException.sessionTaskFailed(new ConnectException()));

    // Then
    assertThat(shouldRetry).isFalse();
  }

  @Test
  @DisplayName("should grow delay exponentially")
  void should_grow_delay_exponentially() {
    // Given
    var custom = new RetryPolicy(5, 3, Duration.ofMillis(10), Set.of(HttpMethod.GET), Set.of(), Set.of(IOException.class));

    // Then
    assertThat(custom.delay(0)).isEqualTo(Duration.ofMillis(10));
    assertThat(custom.delay(1)).isEqualTo(Duration.ofMillis(30));
    assertThat(custom.delay(2)).isEqualTo(Duration.ofMillis(90));
    assertThat(custom.retryLimit()).isEqualTo(5);
  }

  @Test
  @DisplayName("should match retryable failures anywhere in the cause chain")
  void should_match_nested_cause() {
    // Given
    var request = request("PUT", null, 0);
    var nested = new IllegalStateException("wrapped", new ConnectException("refused"));

    // When
    var shouldRetry = policy.shouldRetry(request, FerryException.sessionTaskFailed(nested));

    // Then
    assertThat(shouldRetry).isTrue();
  }

  @Test
  @DisplayName("should only retry lost connections with connection lost policy")
  void should_only_retry_lost_connections() {
    // Given
    var lostConnection = new ConnectionLostRetryPolicy();

    // Then
    assertThat(lostConnection.shouldRetry(request("GET", 503, 0), ResponseValidationException.unacceptableStatusCode(503))).isFalse();
    assertThat(lostConnection.shouldRetry(request("GET", null, 0), FerryException.sessionTaskFailed(new EOFException()))).isTrue();
  }

  @Test
  @DisplayName("should reject invalid configuration")
  void should_reject_invalid_configuration() {
    assertThatThrownBy(() -> new RetryPolicy(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(1, 1, Duration.ofMillis(1), Set.of(), Set.of(), Set.of()))
      .isInstanceOf(IllegalArgumentException.class);
  }

  private static Request request(String method, Integer statusCode, int retryCount) {
    var request = mock(Request.class);
    when(request.request()).thenReturn(HttpRequest.newBuilder(URI.create("http://localhost/resource"))
      .method(method, HttpRequest.BodyPublishers.noBody())
      .build());
    if (statusCode != null) {
      when(request.response()).thenReturn(new HttpResponseHead(statusCode, URI.create("http://localhost/resource"), HttpHeaders.of(Map.of(), (name, value) -> true)));
    }
    when(request.retryCount()).thenReturn(retryCount);
    return request;
  }
}
