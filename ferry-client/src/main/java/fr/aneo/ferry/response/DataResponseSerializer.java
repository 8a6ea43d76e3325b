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

import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.net.http.HttpRequest;
import java.util.Set;

/**
 * Passes the raw body through. Empty bodies are an error unless the response allows them.
 */
public final class DataResponseSerializer implements ResponseSerializer<byte[]> {

  private final Set<Integer> emptyResponseCodes;
  private final Set<String> emptyRequestMethods;

  public DataResponseSerializer() {
    this(DEFAULT_EMPTY_RESPONSE_CODES, DEFAULT_EMPTY_REQUEST_METHODS);
  }

  public DataResponseSerializer(Set<Integer> emptyResponseCodes, Set<String> emptyRequestMethods) {
    this.emptyResponseCodes = Set.copyOf(emptyResponseCodes);
    this.emptyRequestMethods = Set.copyOf(emptyRequestMethods);
  }

  @Override
  public byte[] serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) {
    if (error != null) throw error;

    if (data == null || data.length == 0) {
      if (ResponseSerializer.emptyResponseAllowed(request, response, emptyResponseCodes, emptyRequestMethods)) return new byte[0];
      throw ResponseSerializationException.inputDataNilOrZeroLength();
    }
    return data;
  }
}
