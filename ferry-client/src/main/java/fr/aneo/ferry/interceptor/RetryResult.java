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

import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a {@link RequestRetrier} decision.
 */
public final class RetryResult {

  public enum Kind {
    RETRY,
    RETRY_WITH_DELAY,
    DO_NOT_RETRY,
    DO_NOT_RETRY_WITH_ERROR
  }

  private static final RetryResult RETRY = new RetryResult(Kind.RETRY, null, null);
  private static final RetryResult DO_NOT_RETRY = new RetryResult(Kind.DO_NOT_RETRY, null, null);

  private final Kind kind;
  private final Duration delay;
  private final Throwable error;

  private RetryResult(Kind kind, Duration delay, Throwable error) {
    this.kind = kind;
    this.delay = delay;
    this.error = error;
  }

  /** @return a decision to retry at once */
  public static RetryResult retry() {
    return RETRY;
  }

  /**
   * Retries after {@code delay}. Delays too long to express in nanoseconds wait as long as the
   * scheduler allows.
   *
   * @param delay how long to wait before the next attempt
   * @return the decision
   * @throws IllegalArgumentException if {@code delay} is negative
   */
  public static RetryResult retryWithDelay(Duration delay) {
    requireNonNull(delay, "delay must not be null");
    if (delay.isNegative()) throw new IllegalArgumentException("delay must not be negative");
    return new RetryResult(Kind.RETRY_WITH_DELAY, delay, null);
  }

  /** @return a decision to finish the request with its current error */
  public static RetryResult doNotRetry() {
    return DO_NOT_RETRY;
  }

  /**
   * Finishes the request with {@code error}, reported as the retry error of a
   * {@link fr.aneo.ferry.exception.RequestRetryException}.
   *
   * @param error the retrier's error
   * @return the decision
   */
  public static RetryResult doNotRetryWithError(Throwable error) {
    return new RetryResult(Kind.DO_NOT_RETRY_WITH_ERROR, null, requireNonNull(error, "error must not be null"));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isRetryRequired() {
    return kind == Kind.RETRY || kind == Kind.RETRY_WITH_DELAY;
  }

  public Optional<Duration> delay() {
    return Optional.ofNullable(delay);
  }

  /**
   * Returns the error supplied with {@link Kind#DO_NOT_RETRY_WITH_ERROR}.
   *
   * @return the retrier's error, or {@code null}
   */
  public Throwable error() {
    return error;
  }

  @Override
  public String toString() {
    return "RetryResult[" + kind + (delay != null ? ", delay=" + delay : "") + (error != null ? ", error=" + error : "") + "]";
  }
}
