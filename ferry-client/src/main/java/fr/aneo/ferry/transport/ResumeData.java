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
package fr.aneo.ferry.transport;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of a cancelled download, serialized as JSON inside the opaque resume data blob.
 *
 * @param url           the URL being downloaded
 * @param headers       the headers of the original request, without range headers
 * @param temporaryFile the file holding the bytes already received
 * @param offset        how many bytes the file holds
 * @param entityTag     the {@code ETag} of the partial response, or {@code null}
 * @param lastModified  the {@code Last-Modified} of the partial response, or {@code null}
 */
record ResumeData(String url,
                  Map<String, List<String>> headers,
                  String temporaryFile,
                  long offset,
                  String entityTag,
                  String lastModified) {

  static ResumeData decode(Gson gson, byte[] data) {
    ResumeData decoded;
    try {
      decoded = gson.fromJson(new String(data, StandardCharsets.UTF_8), ResumeData.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Resume data is not valid", e);
    }
    if (decoded == null || decoded.url() == null || decoded.temporaryFile() == null || decoded.offset() < 0) {
      throw new IllegalArgumentException("Resume data is incomplete");
    }
    return decoded.headers() == null ? new ResumeData(decoded.url(), Map.of(), decoded.temporaryFile(), decoded.offset(), decoded.entityTag(), decoded.lastModified()) : decoded;
  }

  byte[] encode(Gson gson) {
    return gson.toJson(this).getBytes(StandardCharsets.UTF_8);
  }

  Path temporaryFilePath() {
    return Path.of(temporaryFile);
  }

  /**
   * Returns the validator sent in {@code If-Range}. Weak entity tags cannot be used there.
   */
  Optional<String> ifRangeValue() {
    if (entityTag != null && !entityTag.startsWith("W/")) return Optional.of(entityTag);
    return Optional.ofNullable(lastModified);
  }
}
