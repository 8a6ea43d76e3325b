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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTest {

  @Test
  @DisplayName("should compute fraction completed against a known total")
  void should_compute_fraction_completed() {
    assertThat(new Progress(5, 10).fractionCompleted()).isEqualTo(0.5);
    assertThat(new Progress(20, 10).fractionCompleted()).isEqualTo(1.0);
    assertThat(new Progress(0, 0).fractionCompleted()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should stay indeterminate while total is unknown")
  void should_stay_indeterminate() {
    var progress = new Progress(5, -1);

    assertThat(progress.isIndeterminate()).isTrue();
    assertThat(progress.fractionCompleted()).isZero();
    assertThat(progress.isFinished()).isFalse();
  }
}
