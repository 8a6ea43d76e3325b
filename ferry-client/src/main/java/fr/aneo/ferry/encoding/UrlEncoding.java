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

import com.google.common.net.PercentEscaper;
import fr.aneo.ferry.exception.FerryException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Encodes parameters as a percent-escaped query string.
 * <p>
 * The query is appended to the URL of {@code GET}, {@code HEAD} and {@code DELETE} requests and
 * sent as an {@code application/x-www-form-urlencoded} body otherwise, unless a
 * {@link Destination} forces one or the other. Nested maps become {@code key[nested]=value},
 * collections become {@code key[]=value} and keys are sorted.
 */
public final class UrlEncoding implements ParameterEncoding {

  private static final Set<String> QUERY_METHODS = Set.of("GET", "HEAD", "DELETE");
  private static final PercentEscaper ESCAPER = new PercentEscaper("-._~?/", false);

  public enum Destination {
    METHOD_DEPENDENT,
    QUERY_STRING,
    HTTP_BODY
  }

  public enum ArrayEncoding {
    BRACKETS,
    NO_BRACKETS
  }

  public enum BoolEncoding {
    NUMERIC,
    LITERAL
  }

  private final Destination destination;
  private final ArrayEncoding arrayEncoding;
  private final BoolEncoding boolEncoding;

  public UrlEncoding() {
    this(Destination.METHOD_DEPENDENT, ArrayEncoding.BRACKETS, BoolEncoding.NUMERIC);
  }

  public UrlEncoding(Destination destination, ArrayEncoding arrayEncoding, BoolEncoding boolEncoding) {
    this.destination = requireNonNull(destination, "destination must not be null");
    this.arrayEncoding = requireNonNull(arrayEncoding, "arrayEncoding must not be null");
    this.boolEncoding = requireNonNull(boolEncoding, "boolEncoding must not be null");
  }

  public static UrlEncoding queryString() {
    return new UrlEncoding(Destination.QUERY_STRING, ArrayEncoding.BRACKETS, BoolEncoding.NUMERIC);
  }

  public static UrlEncoding httpBody() {
    return new UrlEncoding(Destination.HTTP_BODY, ArrayEncoding.BRACKETS, BoolEncoding.NUMERIC);
  }

  @Override
  public HttpRequest encode(HttpRequest request, Map<String, ?> parameters) {
    requireNonNull(request, "request must not be null");
    if (parameters == null || parameters.isEmpty()) return request;

    var query = query(parameters);
    if (encodesInUrl(request.method())) {
      return HttpRequest.newBuilder(request, (name, value) -> true)
                        .uri(withQuery(request.uri(), query))
                        .build();
    }

    var builder = HttpRequest.newBuilder(request, (name, value) -> true)
                             .method(request.method(), BodyPublishers.ofString(query, StandardCharsets.UTF_8));
    if (request.headers().firstValue("Content-Type").isEmpty()) {
      builder.header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8");
    }
    return builder.build();
  }

  /**
   * Builds the query string for {@code parameters}, keys sorted.
   *
   * @param parameters the parameters
   * @return the percent-escaped query, without leading {@code ?}
   */
  public String query(Map<String, ?> parameters) {
    List<String> components = new ArrayList<>();
    new TreeMap<>(parameters).forEach((key, value) -> components.addAll(queryComponents(key, value)));
    return String.join("&", components);
  }

  private List<String> queryComponents(String key, Object value) {
    List<String> components = new ArrayList<>();
    if (value instanceof Map<?, ?> map) {
      var sorted = new TreeMap<String, Object>();
      map.forEach((nestedKey, nestedValue) -> sorted.put(String.valueOf(nestedKey), nestedValue));
      sorted.forEach((nestedKey, nestedValue) -> components.addAll(queryComponents(key + "[" + nestedKey + "]", nestedValue)));
    } else if (value instanceof Collection<?> collection) {
      var arrayKey = arrayEncoding == ArrayEncoding.BRACKETS ? key + "[]" : key;
      for (Object element : collection) {
        components.addAll(queryComponents(arrayKey, element));
      }
    } else if (value instanceof Boolean bool) {
      var encoded = boolEncoding == BoolEncoding.NUMERIC ? (bool ? "1" : "0") : bool.toString();
      components.add(escape(key) + "=" + encoded);
    } else {
      components.add(escape(key) + "=" + escape(value == null ? "" : String.valueOf(value)));
    }
    return components;
  }

  /**
   * Percent-escapes a query key or value. {@code ?} and {@code /} are left as is.
   */
  public static String escape(String string) {
    return ESCAPER.escape(string);
  }

  private boolean encodesInUrl(String method) {
    switch (destination) {
      case QUERY_STRING:
        return true;
      case HTTP_BODY:
        return false;
      default:
        return QUERY_METHODS.contains(method);
    }
  }

  private static URI withQuery(URI uri, String query) {
    var existing = uri.getRawQuery();
    var merged = existing == null || existing.isEmpty() ? query : existing + "&" + query;
    var fragment = uri.getRawFragment();
    var base = uri.toString();
    int cut = base.indexOf('?');
    if (cut < 0) cut = fragment == null ? base.length() : base.indexOf('#');
    try {
      return new URI(base.substring(0, cut) + "?" + merged + (fragment == null ? "" : "#" + fragment));
    } catch (URISyntaxException e) {
      throw FerryException.parameterEncodingFailed(e);
    }
  }
}
