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
import fr.aneo.ferry.exception.FerryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CompositeInterceptorTest {

  private final HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost/")).build();

  @Test
  @DisplayName("should apply adapters in order")
  void should_apply_adapters_in_order() {
    // Given
    var first = Interceptor.adapter((r, s) -> completedFuture(HttpRequest.newBuilder(r, (n, v) -> true).header("X-Step", "first").build()));
    var second = Interceptor.adapter((r, s) -> completedFuture(HttpRequest.newBuilder(r, (n, v) -> true).header("X-Step", "second").build()));

    // When
    var adapted = CompositeInterceptor.combine(first, second).adapt(request, null).toCompletableFuture().join();

    // Then
    assertThat(adapted.headers().allValues("X-Step")).containsExactly("first", "second");
  }

  @Test
  @DisplayName("should return the first retry decision other than do not retry")
  void should_return_first_decisive_retrier() {
    // Given
    List<String> consulted = new ArrayList<>();
    var composite = CompositeInterceptor.of(List.of(
      Interceptor.retrier((r, s, e) -> {
        consulted.add("first");
        return completedFuture(RetryResult.doNotRetry());
      }),
      Interceptor.retrier((r, s, e) -> {
        consulted.add("second");
        return completedFuture(RetryResult.retryWithDelay(Duration.ofSeconds(1)));
      }),
      Interceptor.retrier((r, s, e) -> {
        consulted.add("third");
        return completedFuture(RetryResult.retry());
      })));

    // When
    var result = composite.retry(mock(Request.class), null, FerryException.explicitlyCancelled()).toCompletableFuture().join();

    // Then
    assertThat(result.kind()).isEqualTo(RetryResult.Kind.RETRY_WITH_DELAY);
    assertThat(consulted).containsExactly("first", "second");
  }

  @Test
  @DisplayName("should not retry when every retrier declines")
  void should_not_retry_when_all_decline() {
    // Given
    var composite = CompositeInterceptor.of(List.of(new Interceptor() {
    }, new Interceptor() {
    }));

    // When
    var result = composite.retry(mock(Request.class), null, FerryException.explicitlyCancelled()).toCompletableFuture().join();

    // Then
    assertThat(result).isSameAs(RetryResult.doNotRetry());
  }

  @Test
  @DisplayName("should combine with null as identity")
  void should_combine_with_null() {
    // Given
    var interceptor = new Interceptor() {
    };

    // Then
    assertThat(CompositeInterceptor.combine(interceptor, null)).isSameAs(interceptor);
    assertThat(CompositeInterceptor.combine(null, interceptor)).isSameAs(interceptor);
    assertThat(CompositeInterceptor.combine(null, null)).isNull();
  }
}
