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
package fr.aneo.ferry.internal.concurrent;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

import static java.lang.Runtime.getRuntime;

/**
 * Shared executors used by the Ferry client.
 * <p>
 * Three process-wide executors are created lazily on first access:
 * <ul>
 *   <li><strong>scheduler:</strong> a single daemon thread used for retry delays</li>
 *   <li><strong>serialization pool:</strong> a daemon {@link ForkJoinPool} on which response
 *   serializers run</li>
 *   <li><strong>callback executor:</strong> a single daemon thread on which completion handlers
 *   are delivered when the caller does not provide its own executor</li>
 * </ul>
 * Each session additionally owns serial executors created through {@link #newSerialExecutor(String)}.
 * <p>
 * A JVM shutdown hook shuts the scheduler down when the application terminates.
 */
public final class FerryExecutors {

  private static final ScheduledThreadPoolExecutor SCHEDULER;
  private static final Executor SERIALIZATION = createSerializationPool();
  private static final ExecutorService CALLBACKS = newSerialExecutor("ferry-callbacks");

  static {
    SCHEDULER = new ScheduledThreadPoolExecutor(1, daemonThreadFactory("ferry-scheduler"));
    SCHEDULER.setRemoveOnCancelPolicy(true);
    SCHEDULER.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

    Runtime.getRuntime().addShutdownHook(new Thread(SCHEDULER::shutdown, "ferry-scheduler-shutdown"));
  }

  private FerryExecutors() {
  }

  /**
   * Returns the shared scheduler used to delay retries.
   * <p>
   * Do not call {@code shutdown()} on the returned executor.
   *
   * @return the shared scheduled executor service
   */
  public static ScheduledExecutorService scheduler() {
    return SCHEDULER;
  }

  /**
   * Returns the shared pool on which response serializers run.
   *
   * @return the shared serialization executor
   */
  public static Executor serialization() {
    return SERIALIZATION;
  }

  /**
   * Returns the executor on which completion handlers run by default.
   * <p>
   * It is a single thread, so handlers attached without an explicit executor observe each other's
   * effects in delivery order.
   *
   * @return the default callback executor
   */
  public static Executor callbacks() {
    return CALLBACKS;
  }

  /**
   * Creates a new single-threaded daemon executor whose thread carries the given name.
   *
   * @param name the thread name
   * @return a new serial executor service, owned by the caller
   */
  public static ExecutorService newSerialExecutor(String name) {
    return Executors.newSingleThreadExecutor(daemonThreadFactory(name));
  }

  /**
   * Creates an executor running submitted tasks one at a time, in submission order, on top of
   * {@code delegate}.
   *
   * @param delegate the executor providing the threads
   * @return a sequential view of {@code delegate}
   */
  public static Executor sequential(Executor delegate) {
    return MoreExecutors.newSequentialExecutor(delegate);
  }

  private static ThreadFactory daemonThreadFactory(String name) {
    return new ThreadFactoryBuilder()
      .setNameFormat(name)
      .setDaemon(true)
      .build();
  }

  private static Executor createSerializationPool() {
    int cores = Math.max(2, getRuntime().availableProcessors());
    var factory = (ForkJoinPool.ForkJoinWorkerThreadFactory) pool -> {
      var workerThread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
      workerThread.setName("ferry-serialization-" + workerThread.getPoolIndex());
      workerThread.setDaemon(true);
      return workerThread;
    };
    return new ForkJoinPool(cores, factory, null, true);
  }
}
