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
package fr.aneo.ferry.response;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.lang.reflect.Type;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Decodes a JSON body into an instance of a given type with Gson.
 * <p>
 * An allowed empty body produces the configured empty value; without one it is an error.
 *
 * @param <T> the decoded type
 */
public final class DecodableResponseSerializer<T> implements ResponseSerializer<T> {

  private final Type type;
  private final Gson gson;
  private final Supplier<T> emptyValue;
  private final Set<Integer> emptyResponseCodes;
  private final Set<String> emptyRequestMethods;

  public DecodableResponseSerializer(Class<T> type) {
    this(type, new Gson(), null);
  }

  public DecodableResponseSerializer(Type type, Gson gson, Supplier<T> emptyValue) {
    this(type, gson, emptyValue, DEFAULT_EMPTY_RESPONSE_CODES, DEFAULT_EMPTY_REQUEST_METHODS);
  }

  public DecodableResponseSerializer(Type type,
                                     Gson gson,
                                     Supplier<T> emptyValue,
                                     Set<Integer> emptyResponseCodes,
                                     Set<String> emptyRequestMethods) {
    this.type = requireNonNull(type, "type must not be null");
    this.gson = requireNonNull(gson, "gson must not be null");
    this.emptyValue = emptyValue;
    this.emptyResponseCodes = Set.copyOf(emptyResponseCodes);
    this.emptyRequestMethods = Set.copyOf(emptyRequestMethods);
  }

  @Override
  public T serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) {
    if (error != null) throw error;

    if (data == null || data.length == 0) {
      if (emptyValue != null && ResponseSerializer.emptyResponseAllowed(request, response, emptyResponseCodes, emptyRequestMethods)) {
        return emptyValue.get();
      }
      throw ResponseSerializationException.inputDataNilOrZeroLength();
    }

    try {
      T decoded = gson.fromJson(new String(data, StandardCharsets.UTF_8), type);
      if (decoded == null) throw new JsonParseException("JSON body decoded to null");
      return decoded;
    } catch (JsonParseException e) {
      throw ResponseSerializationException.decodingFailed(e);
    }
  }
}
