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
package fr.aneo.ferry.encoding;

import fr.aneo.ferry.exception.FerryException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A {@link RequestConvertible} built from a URL, a method, parameters and headers.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 *
 * <pre>{@code
 * var convertible = EncodedRequest.of("https://httpbin.org/get")
 *                                 .withParameters(Map.of("page", 2), new UrlEncoding())
 *                                 .withHeader("Accept", "application/json");
 * }</pre>
 */
public final class EncodedRequest implements RequestConvertible {

  private final String url;
  private final HttpMethod method;
  private final Map<String, ?> parameters;
  private final ParameterEncoding encoding;
  private final Map<String, String> headers;
  private final Consumer<HttpRequest.Builder> modifier;

  private EncodedRequest(String url,
                         HttpMethod method,
                         Map<String, ?> parameters,
                         ParameterEncoding encoding,
                         Map<String, String> headers,
                         Consumer<HttpRequest.Builder> modifier) {
    this.url = requireNonNull(url, "url must not be null");
    this.method = requireNonNull(method, "method must not be null");
    this.parameters = parameters;
    this.encoding = requireNonNull(encoding, "encoding must not be null");
    this.headers = Map.copyOf(headers);
    this.modifier = modifier;
  }

  public static EncodedRequest of(String url) {
    return of(url, HttpMethod.GET);
  }

  public static EncodedRequest of(String url, HttpMethod method) {
    return new EncodedRequest(url, method, null, new UrlEncoding(), Map.of(), null);
  }

  public EncodedRequest withParameters(Map<String, ?> parameters, ParameterEncoding encoding) {
    return new EncodedRequest(url, method, parameters, encoding, headers, modifier);
  }

  public EncodedRequest withHeader(String name, String value) {
    var copy = new LinkedHashMap<>(headers);
    copy.put(requireNonNull(name, "name must not be null"), requireNonNull(value, "value must not be null"));
    return new EncodedRequest(url, method, parameters, encoding, copy, modifier);
  }

  public EncodedRequest withHeaders(Map<String, String> headers) {
    var copy = new LinkedHashMap<>(this.headers);
    copy.putAll(requireNonNull(headers, "headers must not be null"));
    return new EncodedRequest(url, method, parameters, encoding, copy, modifier);
  }

  /**
   * Returns a copy applying {@code modifier} to the request builder before parameters are encoded.
   *
   * @param modifier changes the builder, for instance to set a timeout
   * @return the modified copy
   */
  public EncodedRequest withModifier(Consumer<HttpRequest.Builder> modifier) {
    return new EncodedRequest(url, method, parameters, encoding, headers, modifier);
  }

  public HttpMethod method() {
    return method;
  }

  @Override
  public HttpRequest asHttpRequest() {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw FerryException.invalidUrl(url, e);
    }
    if (uri.getScheme() == null || uri.getHost() == null) throw FerryException.invalidUrl(url, null);

    HttpRequest request;
    try {
      var builder = HttpRequest.newBuilder(uri).method(method.name(), BodyPublishers.noBody());
      headers.forEach(builder::header);
      if (modifier != null) modifier.accept(builder);
      request = builder.build();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw FerryException.createUrlRequestFailed(e);
    }
    try {
      return encoding.encode(request, parameters);
    } catch (FerryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw FerryException.parameterEncodingFailed(e);
    }
  }

  @Override
  public String toString() {
    return method + " " + url;
  }
}
