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

import com.google.common.net.HttpHeaders;
import com.google.gson.JsonElement;
import fr.aneo.ferry.encoding.RequestConvertible;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.exception.ResponseValidationException;
import fr.aneo.ferry.interceptor.Interceptor;
import fr.aneo.ferry.interceptor.RedirectHandler;
import fr.aneo.ferry.response.DataResponseSerializer;
import fr.aneo.ferry.response.DecodableResponseSerializer;
import fr.aneo.ferry.response.DownloadResponse;
import fr.aneo.ferry.response.JsonResponseSerializer;
import fr.aneo.ferry.response.ResponseSerializer;
import fr.aneo.ferry.response.Result;
import fr.aneo.ferry.response.StringResponseSerializer;
import fr.aneo.ferry.transport.Credential;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A request whose response body is written to a file.
 * <p>
 * The body is first streamed to a temporary file, then moved to the location computed by the
 * {@link Destination} of the request. Without a destination the file is moved to the temporary
 * directory under a unique name. A failed move fails the request with a
 * {@code DOWNLOADED_FILE_MOVE_FAILED} error.
 * <p>
 * A download can be cancelled {@linkplain #cancel(Consumer) producing resume data}, which
 * {@link Session#download(byte[], Destination)} accepts to continue it later.
 */
public final class DownloadRequest extends Request {

  /**
   * How the downloaded file is moved to its destination.
   */
  public enum Option {
    CREATE_INTERMEDIATE_DIRECTORIES,
    REMOVE_PREVIOUS_FILE
  }

  /**
   * Where a downloaded file goes, and how to move it there.
   *
   * @param file    the final location
   * @param options the move options
   */
  public record Target(Path file, Set<Option> options) {

    public Target {
      requireNonNull(file, "file must not be null");
      options = options == null || options.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(options));
    }

    /**
     * Creates a target moving the download to {@code file} with the given options.
     *
     * @param file    the final location
     * @param options the move options
     * @return the target
     */
    public static Target of(Path file, Option... options) {
      return new Target(file, Set.of(options));
    }
  }

  /**
   * Computes the final location of a download once its body is complete.
   */
  @FunctionalInterface
  public interface Destination {
    Target destination(Path temporaryFile, HttpResponseHead response);
  }

  /**
   * Checks a received download. Any exception fails the request; a {@link FerryException} is kept
   * as is while others are wrapped in a {@code CUSTOM_VALIDATION_FAILED} validation error.
   */
  @FunctionalInterface
  public interface Validation {
    void validate(HttpRequest request, HttpResponseHead response, Path file) throws Exception;
  }

  private static final Pattern CONTENT_DISPOSITION_FILE_NAME = Pattern.compile("filename\\s*=\\s*\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);

  private final RequestConvertible convertible;
  private final byte[] resumingFrom;
  private final Destination destination;
  private volatile byte[] resumeData;

  DownloadRequest(RequestConvertible convertible, byte[] resumingFrom, Destination destination, Interceptor interceptor, RequestDelegate delegate) {
    super(interceptor, delegate);
    if ((convertible == null) == (resumingFrom == null)) {
      throw new IllegalArgumentException("A download needs either a request or resume data");
    }
    this.convertible = convertible;
    this.resumingFrom = resumingFrom == null ? null : resumingFrom.clone();
    this.destination = destination;
  }

  /**
   * Returns a destination placing downloads in {@code directory} under the file name suggested by
   * the response: the {@code Content-Disposition} file name, else the last segment of the URL.
   *
   * @param directory the target directory
   * @param options   the move options
   * @return the destination
   */
  public static Destination suggestedDownloadDestination(Path directory, Option... options) {
    requireNonNull(directory, "directory must not be null");
    var optionSet = Set.of(options);
    return (temporaryFile, response) -> new Target(directory.resolve(suggestedFileName(temporaryFile, response)), optionSet);
  }

  /**
   * The location used when a download has no destination: the temporary directory of the session,
   * under a unique name ending with the name of the temporary file.
   */
  Target defaultDestination(Path temporaryFile) {
    var directory = delegate.temporaryDirectory();
    return new Target(directory.resolve("Ferry_" + UUID.randomUUID() + "_" + temporaryFile.getFileName()), Set.of());
  }

  /**
   * Returns the request this download was created from.
   *
   * @return the convertible, or {@code null} for a download resumed from resume data
   */
  public RequestConvertible convertible() {
    return convertible;
  }

  boolean isResuming() {
    return resumingFrom != null;
  }

  byte[] resumingFrom() {
    return resumingFrom == null ? null : resumingFrom.clone();
  }

  Destination destination() {
    return destination;
  }

  /**
   * Returns the resume data produced when this download was cancelled.
   *
   * @return the resume data, or {@code null} if none was produced
   */
  public byte[] resumeData() {
    var data = resumeData;
    return data == null ? null : data.clone();
  }

  /**
   * Returns where the body of the latest task was moved.
   *
   * @return the downloaded file, or {@code null} if the download did not complete
   */
  public Path fileUrl() {
    var current = taskDelegate();
    return current == null ? null : current.fileUrl();
  }

  /**
   * Cancels the download, asking the task for resume data first. The handler receives the resume
   * data, or {@code null} when the download cannot be resumed, before the response handlers run.
   *
   * @param resumeDataHandler receives the resume data on the callback executor
   * @return this request
   */
  public DownloadRequest cancel(Consumer<byte[]> resumeDataHandler) {
    requireNonNull(resumeDataHandler, "resumeDataHandler must not be null");
    if (!markCancelled()) return this;

    onRoot(() -> {
      didCancel();
      delegate.cancelDownloadTask(this, data -> {
        resumeData = data;
        delegate.callbackExecutor().execute(() -> resumeDataHandler.accept(data == null ? null : data.clone()));
      });
    });
    return this;
  }

  /**
   * Cancels the download, keeping resume data available from {@link #resumeData()} when
   * {@code producingResumeData} is set.
   */
  public DownloadRequest cancel(boolean producingResumeData) {
    if (!producingResumeData) return cancel();
    if (!markCancelled()) return this;

    onRoot(() -> {
      didCancel();
      delegate.cancelDownloadTask(this, data -> resumeData = data);
    });
    return this;
  }

  /**
   * Appends a validator run against the downloaded file once per attempt whose task completed
   * without error. Every validator runs and the first failure wins.
   *
   * @param validation the check to run
   * @return this request
   */
  public DownloadRequest validate(Validation validation) {
    requireNonNull(validation, "validation must not be null");
    appendValidator(() -> {
      var response = response();
      if (response == null) return;

      var httpRequest = request();
      FerryException failure = null;
      try {
        validation.validate(httpRequest, response, fileUrl());
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
   * request. Empty files are not checked for content type.
   */
  public DownloadRequest validate() {
    return validate((request, response, file) -> {
      Validations.validateStatusCode(response, Validations.SUCCESSFUL_STATUS);
      if (!isEmpty(file)) Validations.validateContentType(Validations.acceptableContentTypes(request), response);
    });
  }

  /**
   * Accepts only responses whose status code is one of {@code acceptableStatusCodes}.
   *
   * @param acceptableStatusCodes the accepted status codes
   * @return this request
   */
  public DownloadRequest validate(int... acceptableStatusCodes) {
    Set<Integer> acceptable = Arrays.stream(acceptableStatusCodes).boxed().collect(Collectors.toUnmodifiableSet());
    return validate((request, response, file) -> Validations.validateStatusCode(response, acceptable::contains));
  }

  /**
   * Accepts only responses whose status code lies in {@code [fromInclusive, toInclusive]}.
   *
   * @throws IllegalArgumentException if {@code fromInclusive > toInclusive}
   */
  public DownloadRequest validateStatusRange(int fromInclusive, int toInclusive) {
    if (fromInclusive > toInclusive) throw new IllegalArgumentException("fromInclusive must not exceed toInclusive");
    return validate((request, response, file) ->
      Validations.validateStatusCode(response, code -> code >= fromInclusive && code <= toInclusive));
  }

  /** Accepts only non-empty files whose {@code Content-Type} matches one of the given media types. */
  public DownloadRequest validateContentType(String... acceptableContentTypes) {
    List<String> acceptable = List.of(acceptableContentTypes);
    return validate((request, response, file) -> {
      if (!isEmpty(file)) Validations.validateContentType(acceptable, response);
    });
  }

  /**
   * Delivers the location of the downloaded file without any check.
   */
  public DownloadRequest response(Consumer<DownloadResponse<Path>> handler) {
    return response(delegate.callbackExecutor(), new ResponseSerializer<>() {
      @Override
      public Path serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) {
        throw new UnsupportedOperationException("Only downloads are served");
      }

      @Override
      public Path serializeDownload(HttpRequest request, HttpResponseHead response, Path fileUrl, FerryException error) {
        if (error != null) throw error;
        return fileUrl;
      }
    }, handler);
  }

  /** Delivers the content of the downloaded file as bytes. */
  public DownloadRequest responseData(Consumer<DownloadResponse<byte[]>> handler) {
    return response(new DataResponseSerializer(), handler);
  }

  /** Delivers the content of the downloaded file decoded with the response charset. */
  public DownloadRequest responseString(Consumer<DownloadResponse<String>> handler) {
    return response(new StringResponseSerializer(), handler);
  }

  /** Delivers the content of the downloaded file parsed as a JSON tree. */
  public DownloadRequest responseJson(Consumer<DownloadResponse<JsonElement>> handler) {
    return response(new JsonResponseSerializer(), handler);
  }

  /** Delivers the content of the downloaded file decoded from JSON into {@code type}. */
  public <T> DownloadRequest responseDecodable(Class<T> type, Consumer<DownloadResponse<T>> handler) {
    return response(new DecodableResponseSerializer<>(type), handler);
  }

  /** Same as {@link #response(Executor, ResponseSerializer, Consumer)} on the session callback executor. */
  public <T> DownloadRequest response(ResponseSerializer<T> serializer, Consumer<DownloadResponse<T>> handler) {
    return response(delegate.callbackExecutor(), serializer, handler);
  }

  /**
   * Attaches a response handler, serializing the downloaded file with
   * {@link ResponseSerializer#serializeDownload}.
   *
   * @param executor   where the handler runs
   * @param serializer turns the file into a value
   * @param handler    receives the response
   * @param <T>        the serialized type
   * @return this request
   */
  public <T> DownloadRequest response(Executor executor, ResponseSerializer<T> serializer, Consumer<DownloadResponse<T>> handler) {
    requireNonNull(executor, "executor must not be null");
    requireNonNull(serializer, "serializer must not be null");
    requireNonNull(handler, "handler must not be null");

    appendResponseSerializer(() -> {
      long start = System.nanoTime();
      var httpRequest = request();
      var head = response();
      var file = fileUrl();
      var requestError = error();

      Result<T> result;
      try {
        result = Result.success(serializer.serializeDownload(httpRequest, head, file, requestError));
      } catch (FerryException e) {
        result = Result.failure(e);
      } catch (Exception e) {
        result = Result.failure(ResponseSerializationException.customSerializationFailed(e));
      }

      var elapsed = Duration.ofNanos(System.nanoTime() - start);
      var metrics = metrics();
      var resume = resumeData();
      var response = new DownloadResponse<>(httpRequest, head, file, resume, metrics, elapsed, result);
      eventMonitor.requestDidParseDownloadResponse(this, response);

      FerryException serializationError = requestError == null ? result.error().orElse(null) : null;
      didSerialize(response,
        serializationError,
        replacement -> new DownloadResponse<T>(httpRequest, head, file, resume, metrics, elapsed, Result.failure(replacement)),
        executor,
        handler);
    });
    return this;
  }

  @Override
  public DownloadRequest cancel() {
    super.cancel();
    return this;
  }

  @Override
  public DownloadRequest suspend() {
    super.suspend();
    return this;
  }

  @Override
  public DownloadRequest resume() {
    super.resume();
    return this;
  }

  @Override
  public DownloadRequest authenticate(String user, String password) {
    super.authenticate(user, password);
    return this;
  }

  @Override
  public DownloadRequest authenticate(Credential credential) {
    super.authenticate(credential);
    return this;
  }

  @Override
  public DownloadRequest redirect(RedirectHandler handler) {
    super.redirect(handler);
    return this;
  }

  @Override
  public DownloadRequest uploadProgress(Consumer<Progress> handler) {
    super.uploadProgress(handler);
    return this;
  }

  @Override
  public DownloadRequest uploadProgress(Executor executor, Consumer<Progress> handler) {
    super.uploadProgress(executor, handler);
    return this;
  }

  @Override
  public DownloadRequest downloadProgress(Consumer<Progress> handler) {
    super.downloadProgress(handler);
    return this;
  }

  @Override
  public DownloadRequest downloadProgress(Executor executor, Consumer<Progress> handler) {
    super.downloadProgress(executor, handler);
    return this;
  }

  @Override
  public DownloadRequest onHttpRequestCreation(Consumer<HttpRequest> handler) {
    super.onHttpRequestCreation(handler);
    return this;
  }

  @Override
  public DownloadRequest onHttpRequestCreation(Executor executor, Consumer<HttpRequest> handler) {
    super.onHttpRequestCreation(executor, handler);
    return this;
  }

  @Override
  public DownloadRequest onTaskCreation(Consumer<NetworkTask> handler) {
    super.onTaskCreation(handler);
    return this;
  }

  @Override
  public DownloadRequest onTaskCreation(Executor executor, Consumer<NetworkTask> handler) {
    super.onTaskCreation(executor, handler);
    return this;
  }

  private static boolean isEmpty(Path file) throws IOException {
    if (file == null) throw ResponseValidationException.dataFileNil();
    return Files.size(file) == 0;
  }

  static String suggestedFileName(Path temporaryFile, HttpResponseHead response) {
    if (response != null) {
      var disposition = response.header(HttpHeaders.CONTENT_DISPOSITION);
      if (disposition.isPresent()) {
        Matcher matcher = CONTENT_DISPOSITION_FILE_NAME.matcher(disposition.get());
        if (matcher.find()) {
          var name = safeFileName(matcher.group(1).trim());
          if (name != null) return name;
        }
      }

      var path = response.uri() == null ? null : response.uri().getPath();
      if (path != null) {
        var name = safeFileName(path.substring(path.lastIndexOf('/') + 1));
        if (name != null) return name;
      }
    }
    return temporaryFile.getFileName().toString();
  }

  private static String safeFileName(String candidate) {
    if (candidate.isEmpty() || candidate.equals(".") || candidate.equals("..")) return null;
    try {
      var fileName = Path.of(candidate).getFileName();
      return fileName == null ? null : fileName.toString();
    } catch (InvalidPathException e) {
      return null;
    }
  }
}
