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
package fr.aneo.ferry.monitor;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CompositeEventMonitorTest {

  @Test
  @DisplayName("should notify monitors in order on their executors")
  void should_notify_monitors_in_order() {
    // Given
    List<String> events = new ArrayList<>();
    var composite = new CompositeEventMonitor(List.of(recording("first", events), recording("second", events)));

    // When
    composite.sessionDidBecomeInvalid(new IOException("gone"));

    // Then
    assertThat(events).containsExactly("first:gone", "second:gone");
  }

  @Test
  @DisplayName("should keep notifying monitors after one fails")
  void should_isolate_failing_monitor() {
    // Given
    List<String> events = new ArrayList<>();
    var failing = new EventMonitor() {
      @Override
      public Executor executor() {
        return MoreExecutors.directExecutor();
      }

      @Override
      public void sessionDidBecomeInvalid(Throwable error) {
        throw new IllegalStateException("monitor bug");
      }
    };
    var composite = new CompositeEventMonitor(List.of(failing, recording("healthy", events)));

    // When / Then
    assertThatCode(() -> composite.sessionDidBecomeInvalid(new IOException("gone"))).doesNotThrowAnyException();
    assertThat(events).containsExactly("healthy:gone");
  }

  @Test
  @DisplayName("should drop event when monitor executor rejects it")
  void should_drop_rejected_event() {
    // Given
    List<String> events = new ArrayList<>();
    var rejecting = new EventMonitor() {
      @Override
      public Executor executor() {
        return command -> {
          throw new RejectedExecutionException("shut down");
        };
      }
    };
    var composite = new CompositeEventMonitor(List.of(rejecting, recording("healthy", events)));

    // When / Then
    assertThatCode(() -> composite.sessionDidBecomeInvalid(new IOException("gone"))).doesNotThrowAnyException();
    assertThat(events).containsExactly("healthy:gone");
  }

  @Test
  @DisplayName("should accept logging monitor events without failing")
  void should_log_events() {
    // Given
    var composite = new CompositeEventMonitor(List.of(new LoggingEventMonitor() {
      @Override
      public Executor executor() {
        return MoreExecutors.directExecutor();
      }
    }));

    // When / Then
    assertThatCode(() -> {
      composite.sessionDidBecomeInvalid(null);
      composite.sessionDidBecomeInvalid(new IOException("gone"));
    }).doesNotThrowAnyException();
  }

  private static EventMonitor recording(String name, List<String> events) {
    return new EventMonitor() {
      @Override
      public Executor executor() {
        return MoreExecutors.directExecutor();
      }

      @Override
      public void sessionDidBecomeInvalid(Throwable error) {
        events.add(name + ":" + error.getMessage());
      }
    };
  }
}
