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

import com.google.common.net.MediaType;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.exception.ResponseSerializationException;
import fr.aneo.ferry.transport.HttpResponseHead;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.net.http.HttpRequest;
import java.util.Set;

/**
 * Decodes the body as text.
 * <p>
 * The charset is, in order: the one given at construction, the {@code charset} parameter of the
 * response {@code Content-Type}, then ISO-8859-1. Malformed input is an error.
 */
public final class StringResponseSerializer implements ResponseSerializer<String> {

  private final Charset charset;
  private final Set<Integer> emptyResponseCodes;
  private final Set<String> emptyRequestMethods;

  public StringResponseSerializer() {
    this(null);
  }

  public StringResponseSerializer(Charset charset) {
    this(charset, DEFAULT_EMPTY_RESPONSE_CODES, DEFAULT_EMPTY_REQUEST_METHODS);
  }

  public StringResponseSerializer(Charset charset, Set<Integer> emptyResponseCodes, Set<String> emptyRequestMethods) {
    this.charset = charset;
    this.emptyResponseCodes = Set.copyOf(emptyResponseCodes);
    this.emptyRequestMethods = Set.copyOf(emptyRequestMethods);
  }

  @Override
  public String serialize(HttpRequest request, HttpResponseHead response, byte[] data, FerryException error) {
    if (error != null) throw error;

    if (data == null || data.length == 0) {
      if (ResponseSerializer.emptyResponseAllowed(request, response, emptyResponseCodes, emptyRequestMethods)) return "";
      throw ResponseSerializationException.inputDataNilOrZeroLength();
    }

    var effective = charset != null ? charset : responseCharset(response);
    try {
      return effective.newDecoder()
                      .onMalformedInput(CodingErrorAction.REPORT)
                      .onUnmappableCharacter(CodingErrorAction.REPORT)
                      .decode(ByteBuffer.wrap(data))
                      .toString();
    } catch (CharacterCodingException e) {
      throw ResponseSerializationException.stringSerializationFailed(effective, e);
    }
  }

  private static Charset responseCharset(HttpResponseHead response) {
    if (response == null) return StandardCharsets.ISO_8859_1;
    try {
      return response.contentType()
                     .map(MediaType::parse)
                     .flatMap(mediaType -> mediaType.charset().toJavaUtil())
                     .orElse(StandardCharsets.ISO_8859_1);
    } catch (IllegalArgumentException | IllegalStateException e) {
      return StandardCharsets.ISO_8859_1;
    }
  }
}
