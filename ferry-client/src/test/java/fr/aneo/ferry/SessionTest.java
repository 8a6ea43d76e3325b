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

import com.sun.net.httpserver.HttpServer;
import fr.aneo.ferry.encoding.EncodedRequest;
import fr.aneo.ferry.encoding.HttpMethod;
import fr.aneo.ferry.exception.ErrorKind;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RetryPolicy;
import fr.aneo.ferry.interceptor.RetryResult;
import fr.aneo.ferry.monitor.EventMonitor;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.testutils.LocalHttpServerTestBase;
import fr.aneo.ferry.transport.NetworkTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;

class SessionTest extends LocalHttpServerTestBase {

  private final CountDownLatch hangingRequestReceived = new CountDownLatch(1);
  private final CountDownLatch releaseHangingRequest = new CountDownLatch(1);
  private final CountDownLatch releaseSecondPart = new CountDownLatch(1);

  @Override
  protected void routes(HttpServer server) {
    server.createContext("/hello", recording(respond(200, "text/plain; charset=utf-8", "Hello")));
    server.createContext("/missing", recording(respond(404, "text/plain", "not here")));
    server.createContext("/xml", recording(respond(200, "text/xml", "<hello/>")));
    server.createContext("/json", recording(respond(200, "application/json; charset=utf-8", "{\"name\":\"ferry\",\"size\":3}")));
    server.createContext("/failing", recording(respond(500, "text/plain", "error")));
    server.createContext("/empty", recording(respond(200, null, "")));
    server.createContext("/echo", recording(exchange -> {
      var body = new String(exchange.getRequestBody().readAllBytes(), UTF_8);
      send(exchange, 200, "text/plain; charset=utf-8", exchange.getRequestMethod() + " " + body);
    }));
    server.createContext("/two-parts", recording(exchange -> {
      var part = new byte[100_000];
      exchange.sendResponseHeaders(200, 2L * part.length);
      try (var os = exchange.getResponseBody()) {
        os.write(part);
        os.flush();
        releaseSecondPart.await(10, TimeUnit.SECONDS);
        os.write(part);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }));
    server.createContext("/hang", recording(exchange -> {
      hangingRequestReceived.countDown();
      try {
        releaseHangingRequest.await(10, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      exchange.close();
    }));
  }

  @Test
  @DisplayName("should deliver the body and status of a successful request")
  void should_deliver_body_and_status_of_successful_request() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    var request = session.request(url("/hello")).responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().isSuccess()).isTrue();
    assertThat(response.result().value()).isEqualTo("Hello");
    assertThat(response.response().statusCode()).isEqualTo(200);
    assertThat(response.metrics()).isNotNull();
    assertThat(request.isFinished()).isTrue();
    assertThat(request.tasks()).hasSize(1);
    assertThat(request.retryCount()).isZero();
  }

  @Test
  @DisplayName("should encode query parameters and headers into the wire request")
  void should_encode_query_parameters_and_headers() {
    // Given
    var future = new CompletableFuture<DataResponse<byte[]>>();

    // When
    session.request(url("/hello"), HttpMethod.GET, Map.of("q", "a b"), null, Map.of("X-Trace", "42"))
           .responseData(future::complete);
    await(future);

    // Then
    assertThat(exchanges).hasSize(1);
    assertThat(exchanges.get(0).uri()).isEqualTo("/hello?q=a%20b");
    assertThat(exchanges.get(0).headers().getFirst("X-Trace")).isEqualTo("42");
  }

  @Test
  @DisplayName("should fail validation of a 404 response")
  void should_fail_validation_of_404_response() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    session.request(url("/missing")).validate().responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().isFailure()).isTrue();
    var error = response.result().error().orElseThrow();
    assertThat(error).isInstanceOf(ResponseValidationException.class);
    assertThat(((ResponseValidationException) error).reason()).isEqualTo(ResponseValidationException.Reason.UNACCEPTABLE_STATUS_CODE);
    assertThat(((ResponseValidationException) error).statusCode()).isEqualTo(404);
    assertThat(response.data()).isEqualTo("not here".getBytes(UTF_8));
  }

  @Test
  @DisplayName("should deliver a 404 response as a success when nothing validates it")
  void should_deliver_404_response_without_validation() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    session.request(url("/missing")).responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().value()).isEqualTo("not here");
    assertThat(response.response().statusCode()).isEqualTo(404);
  }

  @Test
  @DisplayName("should reject a content type the Accept header does not allow")
  void should_reject_content_type_not_accepted() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var convertible = EncodedRequest.of(url("/xml")).withHeader("Accept", "application/json");

    // When
    session.request(convertible).validate().responseString(future::complete);
    var response = await(future);

    // Then
    var error = (ResponseValidationException) response.result().error().orElseThrow();
    assertThat(error.reason()).isEqualTo(ResponseValidationException.Reason.UNACCEPTABLE_CONTENT_TYPE);
    assertThat(error.acceptableContentTypes()).containsExactly("application/json");
    assertThat(error.responseContentType()).isEqualTo("text/xml");
  }

  @Test
  @DisplayName("should accept a content type matching the Accept header")
  void should_accept_content_type_matching_accept_header() {
    // Given
    var future = new CompletableFuture<DataResponse<Item>>();
    var convertible = EncodedRequest.of(url("/json")).withHeader("Accept", "application/json");

    // When
    session.request(convertible).validate().responseDecodable(Item.class, future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().value()).isEqualTo(new Item("ferry", 3));
  }

  @Test
  @DisplayName("should run response handlers in the order they were attached")
  void should_run_response_handlers_in_attachment_order() {
    // Given
    var order = new CopyOnWriteArrayList<String>();
    var done = new CompletableFuture<Void>();

    // When
    session.request(url("/json"))
           .responseString(response -> order.add("string:" + response.result().value()))
           .responseJson(response -> order.add("json:" + response.result().value().getAsJsonObject().get("size")))
           .responseData(response -> {
             order.add("data:" + response.result().value().length);
             done.complete(null);
           });
    await(done);

    // Then
    assertThat(order).containsExactly("string:{\"name\":\"ferry\",\"size\":3}", "json:3", "data:25");
  }

  @Test
  @DisplayName("should deliver a handler attached after the request finished")
  void should_deliver_handler_attached_after_finish() {
    // Given
    var first = new CompletableFuture<DataResponse<String>>();
    var request = session.request(url("/hello")).responseString(first::complete);
    await(first);
    var late = new CompletableFuture<DataResponse<byte[]>>();

    // When
    request.responseData(late::complete);
    var response = await(late);

    // Then
    assertThat(response.result().value()).isEqualTo("Hello".getBytes(UTF_8));
    assertThat(exchanges).hasSize(1);
  }

  @Test
  @DisplayName("should finish a cancelled request exactly once with an explicit cancellation error")
  void should_finish_cancelled_request_once() throws InterruptedException {
    // Given
    var calls = new AtomicInteger();
    var future = new CompletableFuture<DataResponse<String>>();
    var request = session.request(url("/hello"));

    // When
    request.cancel();
    request.cancel();
    request.responseString(response -> {
      calls.incrementAndGet();
      future.complete(response);
    });
    var response = await(future);
    Thread.sleep(100);

    // Then
    assertThat(calls).hasValue(1);
    assertThat(response.result().error().orElseThrow().isExplicitlyCancelled()).isTrue();
    assertThat(request.isCancelled()).isTrue();
    assertThat(request.tasks()).isEmpty();
  }

  @Test
  @DisplayName("should cancel a request whose task is running")
  void should_cancel_running_request() throws InterruptedException {
    // Given
    var future = new CompletableFuture<DataResponse<byte[]>>();
    var request = session.request(url("/hang")).response(future::complete);
    assertThat(hangingRequestReceived.await(10, TimeUnit.SECONDS)).isTrue();

    try {
      // When
      request.cancel();
      var response = await(future);

      // Then
      assertThat(response.result().error().orElseThrow().kind()).isEqualTo(ErrorKind.EXPLICITLY_CANCELLED);
      assertThat(request.tasks()).hasSize(1);
    } finally {
      releaseHangingRequest.countDown();
    }
  }

  @Test
  @DisplayName("should hold a suspended body stream until the request is resumed")
  void should_hold_suspended_body_until_resumed() throws InterruptedException {
    // Given
    var future = new CompletableFuture<DataResponse<byte[]>>();
    var firstBytes = new CountDownLatch(1);
    var request = session.request(url("/two-parts"))
                         .downloadProgress(progress -> firstBytes.countDown())
                         .responseData(future::complete);
    assertThat(firstBytes.await(10, TimeUnit.SECONDS)).isTrue();

    try {
      // When
      request.suspend();
      awaitTaskState(request, NetworkTask.State.SUSPENDED);
      releaseSecondPart.countDown();
      Thread.sleep(300);
      var finishedWhileSuspended = future.isDone();
      var stateWhileSuspended = request.state();
      request.resume();
      var response = await(future);

      // Then
      assertThat(finishedWhileSuspended).isFalse();
      assertThat(stateWhileSuspended).isEqualTo(RequestState.SUSPENDED);
      assertThat(response.data()).hasSize(200_000);
      assertThat(request.state()).isEqualTo(RequestState.FINISHED);
      assertThat(exchanges).hasSize(1);
    } finally {
      releaseSecondPart.countDown();
    }
  }

  @Test
  @DisplayName("should cancel every active request")
  void should_cancel_all_requests() throws InterruptedException {
    // Given
    var future = new CompletableFuture<DataResponse<byte[]>>();
    var cancelled = new CompletableFuture<Void>();
    session.request(url("/hang")).response(future::complete);
    assertThat(hangingRequestReceived.await(10, TimeUnit.SECONDS)).isTrue();

    try {
      // When
      session.cancelAllRequests(Runnable::run, () -> cancelled.complete(null));
      await(cancelled);
      var response = await(future);

      // Then
      assertThat(response.result().error().orElseThrow().isExplicitlyCancelled()).isTrue();
    } finally {
      releaseHangingRequest.countDown();
    }
  }

  @Test
  @DisplayName("should fail outstanding and new requests once the session is closed")
  void should_fail_requests_when_session_closed() throws InterruptedException {
    // Given
    var outstanding = new CompletableFuture<DataResponse<byte[]>>();
    session.request(url("/hang")).response(outstanding::complete);
    assertThat(hangingRequestReceived.await(10, TimeUnit.SECONDS)).isTrue();

    try {
      // When
      session.close();
      var afterClose = new CompletableFuture<DataResponse<byte[]>>();
      session.request(url("/hello")).response(afterClose::complete);

      // Then
      assertThat(await(outstanding).result().error().orElseThrow().kind()).isEqualTo(ErrorKind.SESSION_DEINITIALIZED);
      assertThat(await(afterClose).result().error().orElseThrow().kind()).isEqualTo(ErrorKind.SESSION_DEINITIALIZED);
      assertThat(session.isClosed()).isTrue();
    } finally {
      releaseHangingRequest.countDown();
    }
  }

  @Test
  @DisplayName("should retry up to the retry limit and report the last validation error")
  void should_retry_up_to_retry_limit() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var policy = new RetryPolicy(2,
      RetryPolicy.DEFAULT_EXPONENTIAL_BACKOFF_BASE,
      Duration.ofMillis(1),
      RetryPolicy.DEFAULT_RETRYABLE_METHODS,
      RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES,
      RetryPolicy.DEFAULT_RETRYABLE_FAILURES);

    // When
    var request = session.request(EncodedRequest.of(url("/failing")), policy).validate().responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(exchanges).hasSize(3);
    assertThat(request.retryCount()).isEqualTo(2);
    assertThat(request.tasks()).hasSize(3);
    assertThat(request.allMetrics()).hasSize(3);
    var error = (ResponseValidationException) response.result().error().orElseThrow();
    assertThat(error.statusCode()).isEqualTo(500);
  }

  @Test
  @DisplayName("should run every validator and keep the first failure")
  void should_run_every_validator_and_keep_first_failure() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var lastValidatorRan = new AtomicBoolean();

    // When
    session.request(url("/hello"))
           .validate((request, response, data) -> {
           })
           .validate((request, response, data) -> {
             throw new IllegalStateException("rejected");
           })
           .validate((request, response, data) -> {
             lastValidatorRan.set(true);
             throw ResponseValidationException.unacceptableStatusCode(response.statusCode());
           })
           .responseString(future::complete);
    var response = await(future);

    // Then
    var error = (ResponseValidationException) response.result().error().orElseThrow();
    assertThat(error.reason()).isEqualTo(ResponseValidationException.Reason.CUSTOM_VALIDATION_FAILED);
    assertThat(error.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("rejected");
    assertThat(lastValidatorRan).isTrue();
  }

  @Test
  @DisplayName("should offer a serialization failure to the retrier")
  void should_offer_serialization_failure_to_retrier() throws InterruptedException {
    // Given
    var calls = new AtomicInteger();
    var future = new CompletableFuture<DataResponse<byte[]>>();
    var retrier = Interceptor.retrier((request, session, error) ->
      completedFuture(request.retryCount() < 1 ? RetryResult.retry() : RetryResult.doNotRetry()));

    // When
    var request = session.request(EncodedRequest.of(url("/empty")), retrier).responseData(response -> {
      calls.incrementAndGet();
      future.complete(response);
    });
    var response = await(future);
    Thread.sleep(100);

    // Then
    assertThat(calls).hasValue(1);
    assertThat(exchanges).hasSize(2);
    assertThat(request.retryCount()).isEqualTo(1);
    var error = (ResponseSerializationException) response.result().error().orElseThrow();
    assertThat(error.reason()).isEqualTo(ResponseSerializationException.Reason.INPUT_DATA_NIL_OR_ZERO_LENGTH);
  }

  @Test
  @DisplayName("should report the retrier error when it declines with one")
  void should_report_retrier_error() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var retrier = Interceptor.retrier((request, session, error) ->
      completedFuture(RetryResult.doNotRetryWithError(new IllegalStateException("give up"))));

    // When
    session.request(EncodedRequest.of(url("/failing")), retrier).validate().responseString(future::complete);
    var response = await(future);

    // Then
    var error = response.result().error().orElseThrow();
    assertThat(error.kind()).isEqualTo(ErrorKind.REQUEST_RETRY_FAILED);
    assertThat(exchanges).hasSize(1);
  }

  @Test
  @DisplayName("should adapt the wire request before sending it")
  void should_adapt_wire_request() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var adapter = Interceptor.adapter((request, session) ->
      completedFuture(HttpRequest.newBuilder(request, (name, value) -> true).header("X-Token", "abc").build()));

    // When
    var request = session.request(EncodedRequest.of(url("/hello")), adapter).responseString(future::complete);
    await(future);

    // Then
    assertThat(exchanges.get(0).headers().getFirst("X-Token")).isEqualTo("abc");
    assertThat(request.httpRequests()).hasSize(2);
  }

  @Test
  @DisplayName("should fail without creating a task when adaptation fails")
  void should_fail_without_task_when_adaptation_fails() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();
    var adapter = Interceptor.adapter((request, session) -> CompletableFuture.failedFuture(new IllegalStateException("no token")));

    // When
    var request = session.request(EncodedRequest.of(url("/hello")), adapter).responseString(future::complete);
    var response = await(future);

    // Then
    var error = response.result().error().orElseThrow();
    assertThat(error.kind()).isEqualTo(ErrorKind.REQUEST_ADAPTATION_FAILED);
    assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
    assertThat(request.tasks()).isEmpty();
    assertThat(exchanges).isEmpty();
  }

  @Test
  @DisplayName("should fail with an invalid URL error without creating a task")
  void should_fail_with_invalid_url() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    var request = session.request("http://exa mple.com/").responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().error().orElseThrow().kind()).isEqualTo(ErrorKind.INVALID_URL);
    assertThat(request.tasks()).isEmpty();
  }

  @Test
  @DisplayName("should upload bytes and report upload progress")
  void should_upload_bytes() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    var request = session.upload("payload".getBytes(UTF_8), EncodedRequest.of(url("/echo"), HttpMethod.POST))
                         .responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().value()).isEqualTo("POST payload");
    assertThat(request.uploadProgress().completedUnitCount()).isEqualTo(7);
  }

  @Test
  @DisplayName("should fail an upload of a missing file without creating a task")
  void should_fail_upload_of_missing_file() {
    // Given
    var future = new CompletableFuture<DataResponse<String>>();

    // When
    var request = session.upload(Path.of("does-not-exist", "payload.bin"), EncodedRequest.of(url("/echo"), HttpMethod.PUT))
                         .responseString(future::complete);
    var response = await(future);

    // Then
    assertThat(response.result().error().orElseThrow().kind()).isEqualTo(ErrorKind.UPLOADABLE_CREATION_FAILED);
    assertThat(request.tasks()).isEmpty();
    assertThat(exchanges).isEmpty();
  }

  @Test
  @DisplayName("should deliver progress on the given executor")
  void should_deliver_download_progress() {
    // Given
    var progress = new CopyOnWriteArrayList<Progress>();
    var future = new CompletableFuture<DataResponse<byte[]>>();
    Executor direct = Runnable::run;

    // When
    session.request(url("/json")).downloadProgress(direct, progress::add).responseData(future::complete);
    await(future);

    // Then
    assertThat(progress).isNotEmpty();
    assertThat(progress.get(progress.size() - 1).completedUnitCount()).isEqualTo(25);
    assertThat(progress.get(progress.size() - 1).isFinished()).isTrue();
  }

  @Test
  @DisplayName("should not start a request before resume when requests do not start immediately")
  void should_not_start_before_resume_when_not_immediate() throws InterruptedException {
    // Given
    session.close();
    session = new Session(SessionConfig.builder().startRequestsImmediately(false).build());
    var future = new CompletableFuture<DataResponse<String>>();
    var request = session.request(url("/hello")).responseString(future::complete);

    // When
    Thread.sleep(200);
    var sentBeforeResume = exchanges.size();
    request.resume();
    await(future);

    // Then
    assertThat(sentBeforeResume).isZero();
    assertThat(exchanges).hasSize(1);
  }

  @Test
  @DisplayName("should report the request lifecycle to event monitors")
  void should_report_lifecycle_to_event_monitors() {
    // Given
    var events = new CopyOnWriteArrayList<String>();
    var finished = new CompletableFuture<Void>();
    var monitor = new EventMonitor() {
      @Override
      public Executor executor() {
        return Runnable::run;
      }

      @Override
      public void requestDidCreateInitialHttpRequest(Request request, HttpRequest httpRequest) {
        events.add("initial");
      }

      @Override
      public void requestDidCreateTask(Request request, NetworkTask task) {
        events.add("task");
      }

      @Override
      public void requestDidCompleteTask(Request request, NetworkTask task, FerryException error) {
        events.add("completed");
      }

      @Override
      public void requestDidParseResponse(DataRequest request, DataResponse<?> response) {
        events.add("parsed");
      }

      @Override
      public void requestDidFinish(Request request) {
        events.add("finished");
        finished.complete(null);
      }
    };
    session.close();
    session = new Session(SessionConfig.builder().eventMonitor(monitor).build());

    // When
    session.request(url("/hello")).responseString(response -> {
    });
    await(finished);

    // Then
    assertThat(events).startsWith("initial", "task", "completed");
    assertThat(events).contains("finished");
  }

  record Item(String name, int size) {
  }

  private static void awaitTaskState(Request request, NetworkTask.State expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (request.task() == null || request.task().state() != expected) {
      if (System.nanoTime() > deadline) throw new AssertionError("Task never reached state " + expected);
      Thread.sleep(10);
    }
  }
}
