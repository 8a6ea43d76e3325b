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

/**
 * Snapshot of a transfer progress, in bytes.
 *
 * @param completedUnitCount the number of bytes transferred so far
 * @param totalUnitCount     the number of bytes expected, or {@code -1} while unknown
 */
public record Progress(long completedUnitCount, long totalUnitCount) {

  static final Progress NONE = new Progress(0, -1);

  public boolean isIndeterminate() {
    return totalUnitCount < 0;
  }

  /**
   * Returns the completed fraction, between 0 and 1.
   *
   * @return the fraction completed, or 0 while the total is unknown
   */
  public double fractionCompleted() {
    if (totalUnitCount < 0) return 0;
    if (totalUnitCount == 0) return 1;
    return Math.min(1.0, (double) completedUnitCount / totalUnitCount);
  }

  public boolean isFinished() {
    return totalUnitCount >= 0 && completedUnitCount >= totalUnitCount;
  }
}
