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
package fr.aneo.ferry.testutils;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.aneo.ferry.Session;
import fr.aneo.ferry.SessionConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Base class spinning up a local HTTP server and a session talking to it.
 */
public abstract class LocalHttpServerTestBase {
  protected Session session;
  protected final List<HttpExchangeRecord> exchanges = new CopyOnWriteArrayList<>();
  private HttpServer server;
  private ExecutorService serverExecutor;

  /** Subclasses register the handlers they need. */
  protected abstract void routes(HttpServer server);

  /** Subclasses may tune the session configuration. */
  protected SessionConfig.Builder sessionConfig() {
    return SessionConfig.builder();
  }

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);
    routes(server);
    server.start();
    session = new Session(sessionConfig().build());
  }

  @AfterEach
  void stopServer() {
    if (session != null) {
      session.close();
    }
    if (server != null) {
      server.stop(0);
    }
    if (serverExecutor != null) {
      serverExecutor.shutdownNow();
    }
  }

  protected String url(String path) {
    return "http://127.0.0.1:" + server.getAddress().getPort() + path;
  }

  /** Wraps a handler so every exchange it serves is recorded. */
  protected HttpHandler recording(HttpHandler handler) {
    return exchange -> {
      exchanges.add(new HttpExchangeRecord(exchange.getRequestMethod(), exchange.getRequestURI().toString(), exchange.getRequestHeaders()));
      handler.handle(exchange);
    };
  }

  protected static HttpHandler respond(int status, String contentType, String body) {
    return exchange -> send(exchange, status, contentType, body);
  }

  protected static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
    exchange.getRequestBody().readAllBytes();
    var bytes = body.getBytes(UTF_8);
    if (contentType != null) exchange.getResponseHeaders().set("Content-Type", contentType);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    if (bytes.length > 0) {
      try (var os = exchange.getResponseBody()) {
        os.write(bytes);
      }
    }
    exchange.close();
  }

  protected static <T> T await(CompletableFuture<T> future) {
    try {
      return future.get(10, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new AssertionError("No result within 10 seconds", e);
    }
  }

  /**
   * What the server saw of one exchange.
   */
  public record HttpExchangeRecord(String method, String uri, Headers headers) {
  }
}
