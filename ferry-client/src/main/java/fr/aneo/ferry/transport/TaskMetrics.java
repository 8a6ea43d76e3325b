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

import java.time.Duration;
import java.time.Instant;

/**
 * Timing gathered for one network task.
 *
 * @param taskStart     when the first request of the task was sent
 * @param taskEnd       when the task completed
 * @param redirectCount how many redirects were followed
 */
public record TaskMetrics(Instant taskStart, Instant taskEnd, int redirectCount) {

  public Duration taskInterval() {
    return Duration.between(taskStart, taskEnd);
  }
}
