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

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Parses the body as a JSON tree. Allowed empty bodies produce {@link JsonNull#INSTANCE}.
 */
public final class JsonResponseSerializer implements ResponseSerializer<JsonElement> {

  private final Set<Integer> emptyResponseCodes;
  private final Set<String> emptyRequestMethods;

  public JsonResponseSerializer() {
    this(DEFAULT_EMPTY_RESPONSE_CODES, DEFAULT_EMPTY_REQUEST_METHODS);
  }

  public JsonResponseSerializer(Set<Integer> emptyResponseCodes, Set<String> emptyRequestMethods) {
    this.emptyResponseCodes = Set.copyOf(emptyResponseCodes);
    this.emptyRequestMethods = Set.copyOf(emptyRequestMethods);
  }

  @Override
  public JsonElement serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) {
    if (error != null) throw error;

    if (data == null || data.length == 0) {
      if (ResponseSerializer.emptyResponseAllowed(request, response, emptyResponseCodes, emptyRequestMethods)) return JsonNull.INSTANCE;
      throw ResponseSerializationException.inputDataNilOrZeroLength();
    }

    try {
      return JsonParser.parseString(new String(data, StandardCharsets.UTF_8));
    } catch (JsonParseException e) {
      throw ResponseSerializationException.jsonSerializationFailed(e);
    }
  }
}
