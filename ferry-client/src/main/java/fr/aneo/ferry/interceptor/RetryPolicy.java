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
import fr.aneo.ferry.encoding.HttpMethod;
import fr.aneo.ferry.exception.FerryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Retries idempotent requests that failed with a transient error, with exponential backoff.
 * <p>
 * A request is retried while its retry count is below the retry limit, its method is retryable
 * and either its response status code or one of the causes of its error is retryable. The delay
 * before retry {@code n} (0-based) is {@code base^n * scale}.
 * <p>
 * Status codes only cause a retry when a validator turned them into an error.
 */
public class RetryPolicy implements Interceptor {
  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

  public static final int DEFAULT_RETRY_LIMIT = 2;
  public static final int DEFAULT_EXPONENTIAL_BACKOFF_BASE = 2;
  public static final Duration DEFAULT_EXPONENTIAL_BACKOFF_SCALE = Duration.ofMillis(500);
  public static final Set<HttpMethod> DEFAULT_RETRYABLE_METHODS = Set.of(
    HttpMethod.DELETE, HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.PUT, HttpMethod.TRACE);
  public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 500, 502, 503, 504);
  public static final Set<Class<? extends Throwable>> DEFAULT_RETRYABLE_FAILURES = Set.of(
    ConnectException.class,
    UnknownHostException.class,
    HttpTimeoutException.class,
    SocketTimeoutException.class,
    SocketException.class,
    EOFException.class,
    ClosedChannelException.class);

  private final int retryLimit;
  private final int exponentialBackoffBase;
  private final Duration exponentialBackoffScale;
  private final Set<HttpMethod> retryableMethods;
  private final Set<Integer> retryableStatusCodes;
  private final Set<Class<? extends Throwable>> retryableFailures;

  public RetryPolicy() {
    this(DEFAULT_RETRY_LIMIT);
  }

  public RetryPolicy(int retryLimit) {
    this(retryLimit,
      DEFAULT_EXPONENTIAL_BACKOFF_BASE,
      DEFAULT_EXPONENTIAL_BACKOFF_SCALE,
      DEFAULT_RETRYABLE_METHODS,
      DEFAULT_RETRYABLE_STATUS_CODES,
      DEFAULT_RETRYABLE_FAILURES);
  }

  /**
   * Creates a retry policy.
   *
   * @param retryLimit              how many retries are allowed per request
   * @param exponentialBackoffBase  the base of the backoff, at least 2
   * @param exponentialBackoffScale the delay unit multiplied by the backoff
   * @param retryableMethods        the methods eligible for retry
   * @param retryableStatusCodes    the status codes causing a retry
   * @param retryableFailures       the transport failures causing a retry, matched anywhere in the cause chain
   * @throws IllegalArgumentException if {@code retryLimit} is negative or {@code exponentialBackoffBase} below 2
   */
  public RetryPolicy(int retryLimit,
                     int exponentialBackoffBase,
                     Duration exponentialBackoffScale,
                     Set<HttpMethod> retryableMethods,
                     Set<Integer> retryableStatusCodes,
                     Set<Class<? extends Throwable>> retryableFailures) {
    if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must be positive or zero");
    if (exponentialBackoffBase < 2) throw new IllegalArgumentException("exponentialBackoffBase must be at least 2");
    this.retryLimit = retryLimit;
    this.exponentialBackoffBase = exponentialBackoffBase;
    this.exponentialBackoffScale = requireNonNull(exponentialBackoffScale, "exponentialBackoffScale must not be null");
    this.retryableMethods = Set.copyOf(requireNonNull(retryableMethods, "retryableMethods must not be null"));
    this.retryableStatusCodes = Set.copyOf(requireNonNull(retryableStatusCodes, "retryableStatusCodes must not be null"));
    this.retryableFailures = Set.copyOf(requireNonNull(retryableFailures, "retryableFailures must not be null"));
  }

  @Override
  public CompletionStage<RetryResult> retry(Request request, Session session, FerryException error) {
    int retryCount = request.retryCount();
    if (retryCount < retryLimit && shouldRetry(request, error)) {
      var delay = delay(retryCount);
      logger.debug("Retrying request {} in {} after attempt {} failed with {}", request.id(), delay, retryCount + 1, error.kind());
      return CompletableFuture.completedFuture(RetryResult.retryWithDelay(delay));
    }
    return CompletableFuture.completedFuture(RetryResult.doNotRetry());
  }

  /**
   * Tells whether {@code error} makes {@code request} eligible for a retry, the retry limit aside.
   */
  public boolean shouldRetry(Request request, FerryException error) {
    var httpRequest = request.request();
    if (httpRequest == null || !isRetryableMethod(httpRequest.method())) return false;

    var response = request.response();
    if (response != null && retryableStatusCodes.contains(response.statusCode())) return true;

    for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
      for (Class<? extends Throwable> failure : retryableFailures) {
        if (failure.isInstance(cause)) return true;
      }
    }
    return false;
  }

  /**
   * Returns the delay before retry number {@code retryCount + 1}.
   */
  public Duration delay(int retryCount) {
    double factor = Math.pow(exponentialBackoffBase, retryCount);
    return Duration.ofNanos((long) (exponentialBackoffScale.toNanos() * factor));
  }

  public int retryLimit() {
    return retryLimit;
  }

  private boolean isRetryableMethod(String method) {
    try {
      return retryableMethods.contains(HttpMethod.of(method));
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
