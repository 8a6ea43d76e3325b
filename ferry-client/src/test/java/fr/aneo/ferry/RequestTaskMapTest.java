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

import fr.aneo.ferry.transport.NetworkTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RequestTaskMapTest {

  private RequestTaskMap map;
  private Request request;
  private NetworkTask task;

  @BeforeEach
  void setUp() {
    map = new RequestTaskMap();
    request = mock(Request.class);
    task = mock(NetworkTask.class);
  }

  @Test
  @DisplayName("should look up request and task in both directions")
  void should_look_up_both_directions() {
    // Given
    var taskDelegate = new TaskDelegate(TaskDelegate.Kind.DATA, task);

    // When
    map.put(request, taskDelegate);

    // Then
    assertThat(map.task(request)).isSameAs(task);
    assertThat(map.request(task)).isSameAs(request);
    assertThat(map.taskDelegate(task)).isSameAs(taskDelegate);
    assertThat(map.requests()).containsExactly(request);
    assertThat(map.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("should forget request and delegate when task is removed")
  void should_forget_removed_task() {
    // Given
    map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, task));

    // When
    var removed = map.remove(task);

    // Then
    assertThat(removed).isSameAs(request);
    assertThat(map.task(request)).isNull();
    assertThat(map.request(task)).isNull();
    assertThat(map.taskDelegate(task)).isNull();
    assertThat(map.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("should return null when removing an unknown task")
  void should_ignore_unknown_task() {
    // When
    var removed = map.remove(task);

    // Then
    assertThat(removed).isNull();
    assertThat(map.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("should reject a second live task for the same request")
  void should_reject_second_task_for_request() {
    // Given
    map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, task));
    var otherTask = mock(NetworkTask.class);

    // When / Then
    assertThatThrownBy(() -> map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, otherTask)))
      .isInstanceOf(IllegalStateException.class);
    assertThat(map.task(request)).isSameAs(task);
  }

  @Test
  @DisplayName("should reject a task already owned by another request")
  void should_reject_task_of_other_request() {
    // Given
    map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, task));
    var otherRequest = mock(Request.class);

    // When / Then
    assertThatThrownBy(() -> map.put(otherRequest, new TaskDelegate(TaskDelegate.Kind.DATA, task)))
      .isInstanceOf(IllegalStateException.class);
    assertThat(map.request(task)).isSameAs(request);
    assertThat(map.task(otherRequest)).isNull();
  }

  @Test
  @DisplayName("should accept a new task once the previous one completed")
  void should_accept_new_task_after_removal() {
    // Given
    map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, task));
    map.remove(task);
    var retryTask = mock(NetworkTask.class);

    // When
    map.put(request, new TaskDelegate(TaskDelegate.Kind.DATA, retryTask));

    // Then
    assertThat(map.task(request)).isSameAs(retryTask);
    assertThat(map.request(task)).isNull();
  }
}
