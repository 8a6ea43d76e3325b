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

import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;
import fr.aneo.ferry.exception.ErrorKind;
import fr.aneo.ferry.exception.ServerTrustEvaluationException;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.trust.DefaultTrustEvaluator;
import fr.aneo.ferry.trust.PinnedCertificatesTrustEvaluator;
import fr.aneo.ferry.trust.ServerTrustEvaluator;
import fr.aneo.ferry.trust.ServerTrustManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class ServerTrustSessionTest {

  private static final String HOST = "127.0.0.1";
  private static final char[] PASSWORD = "ferry-test".toCharArray();

  private HttpsServer server;
  private ExecutorService serverExecutor;
  private Session session;

  @BeforeEach
  void startServer() throws IOException, GeneralSecurityException {
    server = HttpsServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.setHttpsConfigurator(new HttpsConfigurator(serverSslContext()));
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);
    server.createContext("/hello", exchange -> {
      var body = "Hello".getBytes(UTF_8);
      exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
      exchange.sendResponseHeaders(200, body.length);
      try (var os = exchange.getResponseBody()) {
        os.write(body);
      }
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    if (session != null) session.close();
    server.stop(0);
    serverExecutor.shutdownNow();
  }

  @Test
  @DisplayName("should fail the task with the trust error when the pinned certificate does not match")
  void should_fail_task_when_pinned_certificate_does_not_match() throws Exception {
    // Given
    session = sessionTrusting(new PinnedCertificatesTrustEvaluator(List.of(certificate("tls/other.pem"))));
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    var request = session.request(url("/hello")).responseString(future::complete);
    var response = await(future);

    // Then
    var error = response.result().error().orElseThrow();
    assertThat(error.kind()).isEqualTo(ErrorKind.SERVER_TRUST_EVALUATION_FAILED);
    assertThat(((ServerTrustEvaluationException) error).host()).isEqualTo(HOST);
    assertThat(response.response()).isNull();
    assertThat(request.tasks()).hasSize(1);
  }

  @Test
  @DisplayName("should complete the request when the server presents the pinned self-signed certificate")
  void should_complete_request_with_pinned_self_signed_certificate() throws Exception {
    // Given
    var evaluator = new PinnedCertificatesTrustEvaluator(List.of(certificate("tls/server.pem")), true, true, true,
      DefaultTrustEvaluator.systemTrustManager());
    session = sessionTrusting(evaluator);
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    session.request(url("/hello")).validate().responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().isSuccess()).isTrue();
    assertThat(response.value()).isEqualTo("Hello");
  }

  @Test
  @DisplayName("should reject a self-signed certificate when no evaluator is registered")
  void should_reject_self_signed_certificate_without_evaluator() {
    // Given
    session = new Session(SessionConfig.builder().build());
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    session.request(url("/hello")).responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().error().orElseThrow().kind()).isEqualTo(ErrorKind.SESSION_TASK_FAILED);
    assertThat(response.response()).isNull();
  }

  private Session sessionTrusting(ServerTrustEvaluator evaluator) {
    var trustManager = new ServerTrustManager(Map.of(HOST, evaluator));
    return new Session(SessionConfig.builder().serverTrustManager(trustManager).build());
  }

  private String url(String path) {
    return "https://" + HOST + ":" + server.getAddress().getPort() + path;
  }

  private static SSLContext serverSslContext() throws IOException, GeneralSecurityException {
    var keyStore = KeyStore.getInstance("PKCS12");
    try (InputStream in = resource("tls/server.p12")) {
      keyStore.load(in, PASSWORD);
    }
    var keyManagers = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    keyManagers.init(keyStore, PASSWORD);
    var context = SSLContext.getInstance("TLS");
    context.init(keyManagers.getKeyManagers(), null, null);
    return context;
  }

  private static X509Certificate certificate(String name) throws IOException, GeneralSecurityException {
    try (InputStream in = resource(name)) {
      return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
    }
  }

  private static InputStream resource(String name) {
    var in = ServerTrustSessionTest.class.getClassLoader().getResourceAsStream(name);
    if (in == null) throw new IllegalStateException("Missing test resource " + name);
    return in;
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.get(10, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new AssertionError("No result within 10 seconds", e);
    }
  }
}
