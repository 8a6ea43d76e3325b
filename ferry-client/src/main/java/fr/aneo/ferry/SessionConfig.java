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

import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.internal.concurrent.FerryExecutors;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.JdkNetworkSession;
import fr.aneo.ferry.transport.NetworkSession;
import fr.aneo.ferry.trust.ServerTrustManager;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of a {@link Session}.
 * <p>
 * Create instances with {@link #builder()}; {@link #defaults()} returns the configuration of a
 * session built without one.
 *
 * @see Session
 */
public final class SessionConfig {

  private final boolean startRequestsImmediately;
  private final Interceptor interceptor;
  private final RedirectHandler redirectHandler;
  private final ServerTrustManager serverTrustManager;
  private final List<EventMonitor> eventMonitors;
  private final Executor callbackExecutor;
  private final Executor serializationExecutor;
  private final ScheduledExecutorService retryScheduler;
  private final Duration connectTimeout;
  private final Path temporaryDirectory;
  private final Map<String, Credential> defaultCredentials;
  private final NetworkSession.Factory networkSessionFactory;

  private SessionConfig(Builder builder) {
    this.startRequestsImmediately = builder.startRequestsImmediately;
    this.interceptor = builder.interceptor;
    this.redirectHandler = builder.redirectHandler;
    this.serverTrustManager = builder.serverTrustManager;
    this.eventMonitors = List.copyOf(builder.eventMonitors);
    this.callbackExecutor = builder.callbackExecutor;
    this.serializationExecutor = builder.serializationExecutor;
    this.retryScheduler = builder.retryScheduler;
    this.connectTimeout = builder.connectTimeout;
    this.temporaryDirectory = builder.temporaryDirectory;
    this.defaultCredentials = Map.copyOf(builder.defaultCredentials);
    this.networkSessionFactory = builder.networkSessionFactory != null
      ? builder.networkSessionFactory
      : JdkNetworkSession.factory(connectTimeout, temporaryDirectory);
  }

  public static SessionConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether a request is resumed as soon as its first response handler is attached.
   *
   * @return {@code true} by default
   */
  public boolean startRequestsImmediately() {
    return startRequestsImmediately;
  }

  /**
   * Returns the interceptor applied to every request, after the request's own one.
   *
   * @return the session interceptor, or {@code null}
   */
  public Interceptor interceptor() {
    return interceptor;
  }

  /**
   * Returns the redirect handler used for requests without their own.
   *
   * @return the session redirect handler, or {@code null} to follow every redirect
   */
  public RedirectHandler redirectHandler() {
    return redirectHandler;
  }

  /**
   * Returns the per host server trust evaluators.
   *
   * @return the trust manager, or {@code null} to rely on the platform trust store only
   */
  public ServerTrustManager serverTrustManager() {
    return serverTrustManager;
  }

  public List<EventMonitor> eventMonitors() {
    return eventMonitors;
  }

  /**
   * Returns the default executor of completion and progress handlers.
   *
   * @return the callback executor
   */
  public Executor callbackExecutor() {
    return callbackExecutor;
  }

  public Executor serializationExecutor() {
    return serializationExecutor;
  }

  /**
   * Returns the scheduler delaying retries.
   *
   * @return the retry scheduler
   */
  public ScheduledExecutorService retryScheduler() {
    return retryScheduler;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Path temporaryDirectory() {
    return temporaryDirectory;
  }

  /**
   * Returns the credential answering HTTP basic challenges of a host when the request has none.
   *
   * @param host the challenged host
   * @return the credential, or {@code null}
   */
  public Credential defaultCredential(String host) {
    return host == null ? null : defaultCredentials.get(host.toLowerCase(Locale.ROOT));
  }

  public NetworkSession.Factory networkSessionFactory() {
    return networkSessionFactory;
  }

  @Override
  public String toString() {
    return "SessionConfig{" +
      "startRequestsImmediately=" + startRequestsImmediately +
      ", interceptor=" + interceptor +
      ", redirectHandler=" + redirectHandler +
      ", serverTrustManager=" + serverTrustManager +
      ", eventMonitors=" + eventMonitors.size() +
      ", connectTimeout=" + connectTimeout +
      ", temporaryDirectory=" + temporaryDirectory +
      ", defaultCredentials=" + defaultCredentials.keySet() +
      '}';
  }

  /**
   * Builder for {@link SessionConfig}.
   * <p>
   * Every setting has a default, so {@code SessionConfig.builder().build()} is a valid
   * configuration.
   */
  public static final class Builder {
    private boolean startRequestsImmediately = true;
    private Interceptor interceptor;
    private RedirectHandler redirectHandler;
    private ServerTrustManager serverTrustManager;
    private final List<EventMonitor> eventMonitors = new ArrayList<>();
    private Executor callbackExecutor = FerryExecutors.callbacks();
    private Executor serializationExecutor = FerryExecutors.serialization();
    private ScheduledExecutorService retryScheduler = FerryExecutors.scheduler();
    private Duration connectTimeout = Duration.ofSeconds(60);
    private Path temporaryDirectory = Path.of(System.getProperty("java.io.tmpdir"));
    private final Map<String, Credential> defaultCredentials = new HashMap<>();
    private NetworkSession.Factory networkSessionFactory;

    private Builder() {
    }

    public Builder startRequestsImmediately(boolean startRequestsImmediately) {
      this.startRequestsImmediately = startRequestsImmediately;
      return this;
    }

    public Builder interceptor(Interceptor interceptor) {
      this.interceptor = interceptor;
      return this;
    }

    public Builder redirectHandler(RedirectHandler redirectHandler) {
      this.redirectHandler = redirectHandler;
      return this;
    }

    public Builder serverTrustManager(ServerTrustManager serverTrustManager) {
      this.serverTrustManager = serverTrustManager;
      return this;
    }

    /**
     * Adds an event monitor. Monitors receive events in the order they were added, each on its
     * own executor.
     *
     * @param eventMonitor the monitor to add
     * @return this builder
     * @throws NullPointerException if eventMonitor is null
     */
    public Builder eventMonitor(EventMonitor eventMonitor) {
      this.eventMonitors.add(requireNonNull(eventMonitor, "eventMonitor must not be null"));
      return this;
    }

    public Builder callbackExecutor(Executor callbackExecutor) {
      this.callbackExecutor = callbackExecutor;
      return this;
    }

    public Builder serializationExecutor(Executor serializationExecutor) {
      this.serializationExecutor = serializationExecutor;
      return this;
    }

    public Builder retryScheduler(ScheduledExecutorService retryScheduler) {
      this.retryScheduler = retryScheduler;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder temporaryDirectory(Path temporaryDirectory) {
      this.temporaryDirectory = temporaryDirectory;
      return this;
    }

    /**
     * Registers the credential answering HTTP basic challenges of {@code host} for requests that
     * were not {@linkplain Request#authenticate(Credential) given one}.
     *
     * @param host       the host name, case insensitive
     * @param credential the credential
     * @return this builder
     */
    public Builder defaultCredential(String host, Credential credential) {
      requireNonNull(host, "host must not be null");
      requireNonNull(credential, "credential must not be null");
      this.defaultCredentials.put(host.toLowerCase(Locale.ROOT), credential);
      return this;
    }

    /**
     * Replaces the network session implementation, {@link JdkNetworkSession} by default.
     * The connect timeout and temporary directory only apply to the default implementation.
     *
     * @param networkSessionFactory creates the network session of the session
     * @return this builder
     */
    public Builder networkSessionFactory(NetworkSession.Factory networkSessionFactory) {
      this.networkSessionFactory = networkSessionFactory;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new immutable configuration
     * @throws NullPointerException     if an executor, the connect timeout or the temporary directory is null
     * @throws IllegalArgumentException if the connect timeout is not positive
     */
    public SessionConfig build() {
      requireNonNull(callbackExecutor, "callbackExecutor must not be null");
      requireNonNull(serializationExecutor, "serializationExecutor must not be null");
      requireNonNull(retryScheduler, "retryScheduler must not be null");
      requireNonNull(connectTimeout, "connectTimeout must not be null");
      requireNonNull(temporaryDirectory, "temporaryDirectory must not be null");
      if (connectTimeout.isZero() || connectTimeout.isNegative()) {
        throw new IllegalArgumentException("connectTimeout must be positive");
      }
      return new SessionConfig(this);
    }
  }
}
