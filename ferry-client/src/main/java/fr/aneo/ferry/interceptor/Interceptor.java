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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Both a {@link RequestAdapter} and a {@link RequestRetrier}. The default methods leave requests
 * unchanged and never retry, so implementations override only the half they need.
 */
public interface Interceptor extends RequestAdapter, RequestRetrier {

  @Override
  default CompletionStage<HttpRequest> adapt(HttpRequest request, Session session) {
    return CompletableFuture.completedFuture(request);
  }

  @Override
  default CompletionStage<RetryResult> retry(Request request, Session session, FerryException error) {
    return CompletableFuture.completedFuture(RetryResult.doNotRetry());
  }

  static Interceptor of(RequestAdapter adapter, RequestRetrier retrier) {
    return new CompositeInterceptor(adapter == null ? List.of() : List.of(adapter), retrier == null ? List.of() : List.of(retrier));
  }

  static Interceptor adapter(RequestAdapter adapter) {
    return of(adapter, null);
  }

  static Interceptor retrier(RequestRetrier retrier) {
    return of(null, retrier);
  }
}
