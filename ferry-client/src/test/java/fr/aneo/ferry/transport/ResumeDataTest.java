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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeDataTest {

  private final Gson gson = new Gson();

  @Test
  @DisplayName("should restore resume data produced by a cancelled download")
  void should_restore_encoded_resume_data() {
    // Given
    var original = new ResumeData("http://localhost/large", Map.of("Accept", List.of("*/*")), "/tmp/ferry-1.tmp", 16384, "\"v1\"", null);

    // When
    var restored = ResumeData.decode(gson, original.encode(gson));

    // Then
    assertThat(restored).isEqualTo(original);
    assertThat(restored.temporaryFilePath()).isEqualTo(Path.of("/tmp/ferry-1.tmp"));
  }

  @Test
  @DisplayName("should default missing headers to none")
  void should_default_missing_headers() {
    // Given
    var json = "{\"url\":\"http://localhost/large\",\"temporaryFile\":\"/tmp/f\",\"offset\":10}";

    // When
    var restored = ResumeData.decode(gson, json.getBytes(UTF_8));

    // Then
    assertThat(restored.headers()).isEmpty();
    assertThat(restored.ifRangeValue()).isEmpty();
  }

  @Test
  @DisplayName("should validate with strong entity tag before last modified date")
  void should_choose_if_range_validator() {
    // Given
    var strong = new ResumeData("u", Map.of(), "f", 1, "\"v1\"", "Wed, 21 Oct 2015 07:28:00 GMT");
    var weak = new ResumeData("u", Map.of(), "f", 1, "W/\"v1\"", "Wed, 21 Oct 2015 07:28:00 GMT");

    // Then
    assertThat(strong.ifRangeValue()).contains("\"v1\"");
    assertThat(weak.ifRangeValue()).contains("Wed, 21 Oct 2015 07:28:00 GMT");
  }

  @ParameterizedTest
  @ValueSource(strings = {"not json {", "{}", "{\"url\":\"u\",\"temporaryFile\":\"f\",\"offset\":-1}", "null"})
  @DisplayName("should reject invalid resume data")
  void should_reject_invalid_resume_data(String json) {
    assertThatThrownBy(() -> ResumeData.decode(gson, json.getBytes(UTF_8)))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
