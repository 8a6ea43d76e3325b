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
package fr.aneo.ferry.testutils;

import org.jmock.lib.concurrent.DeterministicScheduler;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * A {@link DeterministicScheduler} that counts delayed schedules and lets a test wait for them.
 * Scheduling and ticking are serialized so the session threads may schedule while the test ticks.
 */
public class CountingDeterministicScheduler extends DeterministicScheduler {
  private final Semaphore scheduled = new Semaphore(0);
  private int scheduleCount;

  @Override
  public synchronized ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
    scheduleCount++;
    var future = super.schedule(command, delay, unit);
    scheduled.release();
    return future;
  }

  @Override
  public synchronized void tick(long duration, TimeUnit timeUnit) {
    super.tick(duration, timeUnit);
  }

  public synchronized int scheduleCount() {
    return scheduleCount;
  }

  /**
   * Waits until {@code count} more commands were scheduled.
   */
  public void awaitScheduled(int count) throws InterruptedException {
    if (!scheduled.tryAcquire(count, 10, TimeUnit.SECONDS)) {
      throw new AssertionError("Expected " + count + " scheduled command(s)");
    }
  }
}
