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
import fr.aneo.ferry.Session;
import fr.aneo.ferry.exception.FerryException;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Chains adapters and retriers.
 * <p>
 * Adapters run in order, each receiving the output of the previous one; the first failure stops
 * the chain. Retriers are asked in order until one answers something other than
 * {@link RetryResult#doNotRetry()}.
 */
public final class CompositeInterceptor implements Interceptor {

  private final List<RequestAdapter> adapters;
  private final List<RequestRetrier> retriers;

  public CompositeInterceptor(List<? extends RequestAdapter> adapters, List<? extends RequestRetrier> retriers) {
    this.adapters = List.copyOf(requireNonNull(adapters, "adapters must not be null"));
    this.retriers = List.copyOf(requireNonNull(retriers, "retriers must not be null"));
  }

  /**
   * Combines interceptors, request level first.
   *
   * @param first  the interceptor consulted first, may be {@code null}
   * @param second the interceptor consulted next, may be {@code null}
   * @return the combination, or the only non-null argument, or {@code null} if both are
   */
  public static Interceptor combine(Interceptor first, Interceptor second) {
    if (first == null) return second;
    if (second == null) return first;

    List<Interceptor> both = List.of(first, second);
    return new CompositeInterceptor(both, both);
  }

  public static CompositeInterceptor of(List<? extends Interceptor> interceptors) {
    return new CompositeInterceptor(interceptors, interceptors);
  }

  @Override
  public CompletionStage<HttpRequest> adapt(HttpRequest request, Session session) {
    CompletionStage<HttpRequest> stage = CompletableFuture.completedFuture(request);
    for (RequestAdapter adapter : adapters) {
      stage = stage.thenCompose(adapted -> adapter.adapt(adapted, session));
    }
    return stage;
  }

  @Override
  public CompletionStage<RetryResult> retry(Request request, Session session, FerryException error) {
    return retry(new ArrayList<>(retriers), request, session, error);
  }

  private static CompletionStage<RetryResult> retry(List<RequestRetrier> pending, Request request, Session session, FerryException error) {
    if (pending.isEmpty()) return CompletableFuture.completedFuture(RetryResult.doNotRetry());

    var retrier = pending.remove(0);
    return retrier.retry(request, session, error).thenCompose(result -> {
      if (result.kind() != RetryResult.Kind.DO_NOT_RETRY) return CompletableFuture.completedFuture(result);
      return retry(pending, request, session, error);
    });
  }
}
