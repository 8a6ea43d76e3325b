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
package fr.aneo.ferry.transport;

import com.google.gson.Gson;
import fr.aneo.ferry.internal.concurrent.FerryExecutors;
import fr.aneo.ferry.trust.DefaultTrustEvaluator;
import fr.aneo.ferry.trust.ServerTrust;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * {@link NetworkSession} built on {@link HttpClient}.
 * <p>
 * The client never follows redirects itself, so every hop is offered to the delegate. Response
 * bodies are consumed one chunk at a time, which makes {@link NetworkTask#suspend()} stop the
 * transfer instead of buffering it. TLS peers are checked through a trust manager that raises a
 * server trust challenge for every handshake.
 * <p>
 * All delegate events are delivered on a single daemon thread named {@code ferry-delegate}.
 */
public final class JdkNetworkSession implements NetworkSession {
  private static final Logger logger = LoggerFactory.getLogger(JdkNetworkSession.class);

  static final int MAX_REDIRECTS = 16;
  static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration CHALLENGE_TIMEOUT = Duration.ofSeconds(30);

  private final NetworkSessionDelegate delegate;
  private final ExecutorService delegateExecutor;
  private final HttpClient client;
  private final Path temporaryDirectory;
  private final Gson gson = new Gson();
  private final AtomicLong identifiers = new AtomicLong();
  private final Set<JdkTask> tasks = ConcurrentHashMap.newKeySet();
  private volatile boolean invalidated;

  public JdkNetworkSession(NetworkSessionDelegate delegate) {
    this(delegate, DEFAULT_CONNECT_TIMEOUT, Path.of(System.getProperty("java.io.tmpdir")));
  }

  /**
   * Creates a network session.
   *
   * @param delegate           receives the events of every task
   * @param connectTimeout     the connection timeout of the underlying client
   * @param temporaryDirectory where download bodies are written while in flight
   */
  public JdkNetworkSession(NetworkSessionDelegate delegate, Duration connectTimeout, Path temporaryDirectory) {
    this.delegate = requireNonNull(delegate, "delegate must not be null");
    requireNonNull(connectTimeout, "connectTimeout must not be null");
    this.temporaryDirectory = requireNonNull(temporaryDirectory, "temporaryDirectory must not be null");
    this.delegateExecutor = FerryExecutors.newSerialExecutor("ferry-delegate");
    this.client = HttpClient.newBuilder()
                            .version(HttpClient.Version.HTTP_1_1)
                            .followRedirects(HttpClient.Redirect.NEVER)
                            .connectTimeout(connectTimeout)
                            .sslContext(challengingSslContext())
                            .build();
  }

  /**
   * Returns a factory creating JDK network sessions with the given settings.
   *
   * @param connectTimeout     the connection timeout
   * @param temporaryDirectory the directory holding in-flight downloads
   * @return the factory
   */
  public static NetworkSession.Factory factory(Duration connectTimeout, Path temporaryDirectory) {
    return delegate -> new JdkNetworkSession(delegate, connectTimeout, temporaryDirectory);
  }

  @Override
  public NetworkTask dataTask(HttpRequest request) {
    requireNonNull(request, "request must not be null");
    return register(JdkDataTask.create(this, nextIdentifier(), request, null));
  }

  @Override
  public NetworkTask uploadTask(HttpRequest request, Uploadable uploadable) {
    requireNonNull(request, "request must not be null");
    requireNonNull(uploadable, "uploadable must not be null");
    try {
      return register(JdkDataTask.create(this, nextIdentifier(), request, uploadable.bodyPublisher()));
    } catch (FileNotFoundException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public DownloadTask downloadTask(HttpRequest request) {
    requireNonNull(request, "request must not be null");
    return register(new JdkDownloadTask(this, nextIdentifier(), request, null));
  }

  @Override
  public DownloadTask downloadTask(byte[] resumeData) {
    requireNonNull(resumeData, "resumeData must not be null");
    var data = ResumeData.decode(gson, resumeData);
    if (!Files.isRegularFile(data.temporaryFilePath())) {
      throw new IllegalArgumentException("Resume data refers to a missing file: " + data.temporaryFile());
    }

    var builder = HttpRequest.newBuilder(URI.create(data.url())).GET();
    data.headers().forEach((name, values) -> values.forEach(value -> builder.header(name, value)));
    builder.header("Range", "bytes=" + data.offset() + "-");
    data.ifRangeValue().ifPresent(value -> builder.header("If-Range", value));

    return register(new JdkDownloadTask(this, nextIdentifier(), builder.build(), data));
  }

  @Override
  public void invalidateAndCancel() {
    if (invalidated) return;
    invalidated = true;

    logger.debug("Invalidating network session with {} outstanding task(s)", tasks.size());
    List.copyOf(tasks).forEach(JdkTask::cancel);
    post(() -> delegate.onInvalidated(null));
    delegateExecutor.shutdown();
  }

  HttpClient client() {
    return client;
  }

  NetworkSessionDelegate delegate() {
    return delegate;
  }

  Gson gson() {
    return gson;
  }

  Path createTemporaryFile() throws IOException {
    Files.createDirectories(temporaryDirectory);
    return Files.createTempFile(temporaryDirectory, "ferry-download-", ".tmp");
  }

  void unregister(JdkTask task) {
    tasks.remove(task);
  }

  /**
   * Runs {@code event} on the delegate executor.
   *
   * @return {@code false} when the session no longer delivers events
   */
  boolean post(Runnable event) {
    try {
      delegateExecutor.execute(() -> {
        try {
          event.run();
        } catch (RuntimeException e) {
          logger.warn("Network session delegate failed while handling an event", e);
        }
      });
      return true;
    } catch (RejectedExecutionException e) {
      logger.debug("Dropping event, network session was invalidated");
      return false;
    }
  }

  /**
   * Asks the delegate whether a TLS peer is trusted, blocking the handshake until it answers.
   */
  ChallengeEvaluation evaluateServerTrust(ServerTrust trust, int port) {
    var answer = new CompletableFuture<ChallengeEvaluation>();
    var challenge = AuthenticationChallenge.serverTrust(trust, port);
    if (!post(() -> delegate.onChallenge(null, challenge, answer::complete))) {
      return ChallengeEvaluation.cancel(new IllegalStateException("Network session was invalidated"));
    }

    try {
      return answer.get(CHALLENGE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ChallengeEvaluation.cancel(e);
    } catch (ExecutionException | TimeoutException e) {
      return ChallengeEvaluation.cancel(e);
    }
  }

  private <T extends JdkTask> T register(T task) {
    if (invalidated) throw new IllegalStateException("Network session was invalidated");
    tasks.add(task);
    return task;
  }

  private long nextIdentifier() {
    return identifiers.incrementAndGet();
  }

  private SSLContext challengingSslContext() {
    try {
      var context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[]{new ChallengeTrustManager(this, DefaultTrustEvaluator.systemTrustManager())}, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to initialize TLS", e);
    }
  }
}
