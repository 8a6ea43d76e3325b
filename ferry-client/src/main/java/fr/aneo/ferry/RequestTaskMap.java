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

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import fr.aneo.ferry.transport.NetworkTask;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Two-way association between requests and their live network task.
 * <p>
 * Network callbacks look requests up by task while control calls look tasks up by request, so
 * both directions are kept in one {@link BiMap}. Each live task also maps to the
 * {@link TaskDelegate} collecting its state. A request has at most one live task and a task
 * belongs to at most one request.
 * <p>
 * All operations are guarded by one lock and run in constant time.
 */
final class RequestTaskMap {

  private final Object lock = new Object();
  private final BiMap<Request, NetworkTask> tasksByRequest = HashBiMap.create();
  private final Map<NetworkTask, TaskDelegate> delegatesByTask = new HashMap<>();

  /**
   * Registers the live task of a request.
   *
   * @throws IllegalStateException if the request already has a live task or the task is already registered
   */
  void put(Request request, TaskDelegate taskDelegate) {
    requireNonNull(request, "request must not be null");
    requireNonNull(taskDelegate, "taskDelegate must not be null");

    var task = taskDelegate.task();
    synchronized (lock) {
      var live = tasksByRequest.get(request);
      if (live != null) {
        throw new IllegalStateException("Request " + request.id() + " already has live task " + live.taskIdentifier());
      }
      if (tasksByRequest.containsValue(task)) {
        throw new IllegalStateException("Task " + task.taskIdentifier() + " is already registered");
      }
      tasksByRequest.put(request, task);
      delegatesByTask.put(task, taskDelegate);
    }
  }

  NetworkTask task(Request request) {
    synchronized (lock) {
      return tasksByRequest.get(request);
    }
  }

  Request request(NetworkTask task) {
    synchronized (lock) {
      return tasksByRequest.inverse().get(task);
    }
  }

  TaskDelegate taskDelegate(NetworkTask task) {
    synchronized (lock) {
      return delegatesByTask.get(task);
    }
  }

  /**
   * Forgets a completed task.
   *
   * @return the request the task belonged to, or {@code null} if it was not registered
   */
  Request remove(NetworkTask task) {
    synchronized (lock) {
      delegatesByTask.remove(task);
      return tasksByRequest.inverse().remove(task);
    }
  }

  List<Request> requests() {
    synchronized (lock) {
      return List.copyOf(tasksByRequest.keySet());
    }
  }

  int size() {
    synchronized (lock) {
      return tasksByRequest.size();
    }
  }

  boolean isEmpty() {
    return size() == 0;
  }
}
