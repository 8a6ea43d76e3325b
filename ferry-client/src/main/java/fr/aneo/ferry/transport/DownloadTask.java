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

import java.util.function.Consumer;

/**
 * A network task writing its response body to a temporary file.
 */
public interface DownloadTask extends NetworkTask {

  /**
   * Cancels the task and produces the data needed to continue it later.
   * <p>
   * The handler is called on the delegate executor before the task reports its completion. It
   * receives {@code null} when the server did not provide the validators needed to resume.
   *
   * @param handler receives the opaque resume data, or {@code null}
   */
  void cancelByProducingResumeData(Consumer<byte[]> handler);
}
