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

import java.io.EOFException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Set;

/**
 * {@link RetryPolicy} retrying only requests whose connection was lost while in flight.
 * Status codes never cause a retry.
 */
public class ConnectionLostRetryPolicy extends RetryPolicy {

  public static final Set<Class<? extends Throwable>> CONNECTION_LOST_FAILURES = Set.of(
    SocketException.class,
    EOFException.class,
    ClosedChannelException.class);

  public ConnectionLostRetryPolicy() {
    this(DEFAULT_RETRY_LIMIT, DEFAULT_EXPONENTIAL_BACKOFF_BASE, DEFAULT_EXPONENTIAL_BACKOFF_SCALE);
  }

  public ConnectionLostRetryPolicy(int retryLimit, int exponentialBackoffBase, Duration exponentialBackoffScale) {
    super(retryLimit, exponentialBackoffBase, exponentialBackoffScale, DEFAULT_RETRYABLE_METHODS, Set.of(), CONNECTION_LOST_FAILURES);
  }
}
