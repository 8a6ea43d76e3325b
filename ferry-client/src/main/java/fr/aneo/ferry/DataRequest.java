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

import com.google.gson.JsonElement;
import fr.aneo.ferry.encoding.RequestConvertible;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.response.DataResponseSerializer;
import fr.aneo.ferry.response.DecodableResponseSerializer;
import fr.aneo.ferry.response.JsonResponseSerializer;
import fr.aneo.ferry.response.ResponseSerializer;
import fr.aneo.ferry.response.Result;
import fr.aneo.ferry.response.StringResponseSerializer;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;

import java.net.http.HttpRequest;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A request whose response body is accumulated in memory.
 * <p>
 * Typical use:
 * <pre>{@code
 * session.request("https://example.com/items")
 *        .validate()
 *        .responseDecodable(Item[].class, response -> { ... });
 * }</pre>
 */
public class DataRequest extends Request {

  /**
   * Checks a received response. Any exception fails the request; a {@link FerryException} is kept
   * as is while others are wrapped in a {@code CUSTOM_VALIDATION_FAILED} validation error.
   */
  @FunctionalInterface
  public interface Validation {
    void validate(HttpRequest request, HttpResponseHead response, byte[] data) throws Exception;
  }

  private final RequestConvertible convertible;

  DataRequest(RequestConvertible convertible, Interceptor interceptor, RequestDelegate delegate) {
    super(interceptor, delegate);
    this.convertible = requireNonNull(convertible, "convertible must not be null");
  }

  /**
   * Returns the convertible this request builds its wire request from on every attempt.
   *
   * @return the convertible, never {@code null}
   */
  public RequestConvertible convertible() {
    return convertible;
  }

  /**
   * Returns the body received by the latest task.
   *
   * @return a copy of the body, or {@code null} if no byte was received
   */
  public byte[] data() {
    var current = taskDelegate();
    return current == null ? null : current.data();
  }

  /**
   * Appends a validator run once per attempt whose task completed without error. Every validator
   * runs; the first failure becomes the error of the attempt and is offered to the retrier.
   *
   * @param validation the check to run
   * @return this request
   */
  public DataRequest validate(Validation validation) {
    requireNonNull(validation, "validation must not be null");
    appendValidator(() -> {
      var response = response();
      if (response == null) return;

      var httpRequest = request();
      FerryException failure = null;
      try {
        validation.validate(httpRequest, response, data());
      } catch (FerryException e) {
        failure = e;
      } catch (Exception e) {
        failure = ResponseValidationException.customValidationFailed(e);
      }
      didValidate(httpRequest, response, failure);
    });
    return this;
  }

  /**
   * Accepts {@code 2xx} responses whose content type matches the {@code Accept} header of the
   * request. Empty bodies are not checked for content type.
   */
  public DataRequest validate() {
    return validate((request, response, data) -> {
      Validations.validateStatusCode(response, Validations.SUCCESSFUL_STATUS);
      if (data != null && data.length > 0) {
        Validations.validateContentType(Validations.acceptableContentTypes(request), response);
      }
    });
  }

  /**
   * Accepts only responses whose status code is one of {@code acceptableStatusCodes}.
   *
   * @param acceptableStatusCodes the accepted status codes
   * @return this request
   */
  public DataRequest validate(int... acceptableStatusCodes) {
    Set<Integer> acceptable = Arrays.stream(acceptableStatusCodes).boxed().collect(Collectors.toUnmodifiableSet());
    return validate((request, response, data) -> Validations.validateStatusCode(response, acceptable::contains));
  }

  /**
   * Accepts only responses whose status code lies in {@code [fromInclusive, toInclusive]}.
   *
   * @param fromInclusive the lowest accepted status code
   * @param toInclusive   the highest accepted status code
   * @return this request
   * @throws IllegalArgumentException if {@code fromInclusive > toInclusive}
   */
  public DataRequest validateStatusRange(int fromInclusive, int toInclusive) {
    if (fromInclusive > toInclusive) throw new IllegalArgumentException("fromInclusive must not exceed toInclusive");
    return validate((request, response, data) ->
      Validations.validateStatusCode(response, code -> code >= fromInclusive && code <= toInclusive));
  }

  /**
   * Accepts only non-empty responses whose {@code Content-Type} matches one of the given media
   * types; {@code *} wildcards are allowed.
   *
   * @param acceptableContentTypes the accepted media types
   * @return this request
   */
  public DataRequest validateContentType(String... acceptableContentTypes) {
    List<String> acceptable = List.of(acceptableContentTypes);
    return validate((request, response, data) -> {
      if (data != null && data.length > 0) Validations.validateContentType(acceptable, response);
    });
  }

  /**
   * Delivers the raw response without any check: the body may be {@code null} and the result is a
   * failure only when the request failed.
   */
  public DataRequest response(Consumer<DataResponse<byte[]>> handler) {
    return response(delegate.callbackExecutor(), (request, response, data, error) -> {
      if (error != null) throw error;
      return data;
    }, handler);
  }

  /** Delivers the body as bytes; an empty body fails unless the response may have none. */
  public DataRequest responseData(Consumer<DataResponse<byte[]>> handler) {
    return response(new DataResponseSerializer(), handler);
  }

  /** Delivers the body decoded with the response charset, ISO-8859-1 when it declares none. */
  public DataRequest responseString(Consumer<DataResponse<String>> handler) {
    return response(new StringResponseSerializer(), handler);
  }

  /** Delivers the body decoded with {@code charset}, whatever the response declares. */
  public DataRequest responseString(Charset charset, Consumer<DataResponse<String>> handler) {
    return response(new StringResponseSerializer(charset), handler);
  }

  /** Delivers the body parsed as a JSON tree. */
  public DataRequest responseJson(Consumer<DataResponse<JsonElement>> handler) {
    return response(new JsonResponseSerializer(), handler);
  }

  /**
   * Delivers the body decoded from JSON into {@code type}.
   *
   * @param type    the target type
   * @param handler receives the response
   * @param <T>     the decoded type
   * @return this request
   */
  public <T> DataRequest responseDecodable(Class<T> type, Consumer<DataResponse<T>> handler) {
    return response(new DecodableResponseSerializer<>(type), handler);
  }

  /** Same as {@link #response(Executor, ResponseSerializer, Consumer)} on the session callback executor. */
  public <T> DataRequest response(ResponseSerializer<T> serializer, Consumer<DataResponse<T>> handler) {
    return response(delegate.callbackExecutor(), serializer, handler);
  }

  /**
   * Attaches a response handler.
   * <p>
   * Once the request finishes, {@code serializer} turns the received body into a value on the
   * serialization executor, then {@code handler} receives the response on {@code executor}.
   * Handlers run once per finished request, in the order they were attached.
   *
   * @param executor   where the handler runs
   * @param serializer turns the body into a value
   * @param handler    receives the response
   * @param <T>        the serialized type
   * @return this request
   */
  public <T> DataRequest response(Executor executor, ResponseSerializer<T> serializer, Consumer<DataResponse<T>> handler) {
    requireNonNull(executor, "executor must not be null");
    requireNonNull(serializer, "serializer must not be null");
    requireNonNull(handler, "handler must not be null");

    appendResponseSerializer(() -> {
      long start = System.nanoTime();
      var httpRequest = request();
      var head = response();
      var body = data();
      var requestError = error();

      Result<T> result;
      try {
        result = Result.success(serializer.serialize(httpRequest, head, body, requestError));
      } catch (FerryException e) {
        result = Result.failure(e);
      } catch (Exception e) {
        result = Result.failure(ResponseSerializationException.customSerializationFailed(e));
      }

      var elapsed = Duration.ofNanos(System.nanoTime() - start);
      var metrics = metrics();
      var response = new DataResponse<>(httpRequest, head, body, metrics, elapsed, result);
      eventMonitor.requestDidParseResponse(this, response);

      FerryException serializationError = requestError == null ? result.error().orElse(null) : null;
      didSerialize(response,
        serializationError,
        replacement -> new DataResponse<T>(httpRequest, head, body, metrics, elapsed, Result.failure(replacement)),
        executor,
        handler);
    });
    return this;
  }

  @Override
  public DataRequest cancel() {
    super.cancel();
    return this;
  }

  @Override
  public DataRequest suspend() {
    super.suspend();
    return this;
  }

  @Override
  public DataRequest resume() {
    super.resume();
    return this;
  }

  @Override
  public DataRequest authenticate(String user, String password) {
    super.authenticate(user, password);
    return this;
  }

  @Override
  public DataRequest authenticate(Credential credential) {
    super.authenticate(credential);
    return this;
  }

  @Override
  public DataRequest redirect(RedirectHandler handler) {
    super.redirect(handler);
    return this;
  }

  @Override
  public DataRequest uploadProgress(Consumer<Progress> handler) {
    super.uploadProgress(handler);
    return this;
  }

  @Override
  public DataRequest uploadProgress(Executor executor, Consumer<Progress> handler) {
    super.uploadProgress(executor, handler);
    return this;
  }

  @Override
  public DataRequest downloadProgress(Consumer<Progress> handler) {
    super.downloadProgress(handler);
    return this;
  }

  @Override
  public DataRequest downloadProgress(Executor executor, Consumer<Progress> handler) {
    super.downloadProgress(executor, handler);
    return this;
  }

  @Override
  public DataRequest onHttpRequestCreation(Consumer<HttpRequest> handler) {
    super.onHttpRequestCreation(handler);
    return this;
  }

  @Override
  public DataRequest onHttpRequestCreation(Executor executor, Consumer<HttpRequest> handler) {
    super.onHttpRequestCreation(executor, handler);
    return this;
  }

  @Override
  public DataRequest onTaskCreation(Consumer<NetworkTask> handler) {
    super.onTaskCreation(handler);
    return this;
  }

  @Override
  public DataRequest onTaskCreation(Executor executor, Consumer<NetworkTask> handler) {
    super.onTaskCreation(executor, handler);
    return this;
  }
}
