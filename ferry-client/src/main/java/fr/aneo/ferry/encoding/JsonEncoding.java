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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;

import fr.aneo.ferry.exception.FerryException;

import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Encodes parameters as a JSON object sent as the request body, with
 * {@code Content-Type: application/json} unless the request already declares a content type.
 */
public final class JsonEncoding implements ParameterEncoding {

  private final Gson gson;

  public JsonEncoding() {
    this(new Gson());
  }

  public JsonEncoding(Gson gson) {
    this.gson = requireNonNull(gson, "gson must not be null");
  }

  public static JsonEncoding prettyPrinted() {
    return new JsonEncoding(new GsonBuilder().setPrettyPrinting().create());
  }

  @Override
  public HttpRequest encode(HttpRequest request, Map<String, ?> parameters) {
    requireNonNull(request, "request must not be null");
    if (parameters == null) return request;

    String json;
    try {
      json = gson.toJson(parameters);
    } catch (JsonIOException | UnsupportedOperationException | IllegalArgumentException e) {
      throw FerryException.parameterEncodingFailed(e);
    }

    var builder = HttpRequest.newBuilder(request, (name, value) -> true)
                             .method(request.method(), BodyPublishers.ofString(json, StandardCharsets.UTF_8));
    if (request.headers().firstValue("Content-Type").isEmpty()) {
      builder.header("Content-Type", "application/json");
    }
    return builder.build();
  }
}
