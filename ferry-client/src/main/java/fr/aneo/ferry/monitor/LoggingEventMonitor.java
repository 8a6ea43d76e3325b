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

import fr.aneo.ferry.DataRequest;
import fr.aneo.ferry.Request;
import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.response.DataResponse;
import fr.aneo.ferry.transport.AuthenticationChallenge;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.NetworkTask;
import fr.aneo.ferry.transport.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;

/**
 * Writes the request lifecycle to SLF4J: milestones at {@code DEBUG}, network details at
 * {@code TRACE} and task failures at {@code WARN}.
 */
public class LoggingEventMonitor implements EventMonitor {
  private static final Logger logger = LoggerFactory.getLogger(LoggingEventMonitor.class);

  @Override
  public void sessionDidBecomeInvalid(Throwable error) {
    if (error == null) {
      logger.debug("Network session invalidated");
    } else {
      logger.warn("Network session invalidated", error);
    }
  }

  @Override
  public void taskDidReceiveChallenge(NetworkTask task, AuthenticationChallenge challenge) {
    logger.trace("Task {} received a {} challenge for {}:{}",
      task == null ? "-" : task.taskIdentifier(), challenge.type(), challenge.host(), challenge.port());
  }

  @Override
  public void taskWillPerformRedirection(NetworkTask task, HttpResponseHead response, HttpRequest proposed) {
    logger.trace("Task {} received {} redirecting to {}", task.taskIdentifier(), response.statusCode(), proposed.uri());
  }

  @Override
  public void taskDidFinishCollectingMetrics(NetworkTask task, TaskMetrics metrics) {
    logger.trace("Task {} took {} ms with {} redirect(s)", task.taskIdentifier(), metrics.taskInterval().toMillis(), metrics.redirectCount());
  }

  @Override
  public void dataTaskDidReceiveResponse(NetworkTask task, HttpResponseHead response) {
    logger.trace("Task {} received status {} from {}", task.taskIdentifier(), response.statusCode(), response.uri());
  }

  @Override
  public void requestDidCreateHttpRequest(Request request, HttpRequest httpRequest) {
    logger.debug("Request {} created {} {}", request.id(), httpRequest.method(), httpRequest.uri());
  }

  @Override
  public void requestDidFailToCreateHttpRequest(Request request, FerryException error) {
    logger.warn("Request {} could not create its HTTP request: {}", request.id(), error.getMessage());
  }

  @Override
  public void requestDidFailToAdaptHttpRequest(Request request, HttpRequest initial, FerryException error) {
    logger.warn("Request {} could not adapt {} {}: {}", request.id(), initial.method(), initial.uri(), error.getMessage());
  }

  @Override
  public void requestDidCreateTask(Request request, NetworkTask task) {
    logger.debug("Request {} created task {}", request.id(), task.taskIdentifier());
  }

  @Override
  public void requestDidCompleteTask(Request request, NetworkTask task, FerryException error) {
    if (error == null) {
      logger.debug("Request {} completed task {}", request.id(), task.taskIdentifier());
    } else if (error.isExplicitlyCancelled()) {
      logger.debug("Request {} cancelled task {}", request.id(), task.taskIdentifier());
    } else {
      logger.warn("Request {} task {} failed: {}", request.id(), task.taskIdentifier(), error.getMessage());
    }
  }

  @Override
  public void requestIsRetrying(Request request) {
    logger.debug("Request {} retrying, attempt {}", request.id(), request.retryCount() + 1);
  }

  @Override
  public void requestDidFinish(Request request) {
    logger.debug("Request {} finished in state {}", request.id(), request.state());
  }

  @Override
  public void requestDidCancel(Request request) {
    logger.debug("Request {} cancelled", request.id());
  }

  @Override
  public void requestDidParseResponse(DataRequest request, DataResponse<?> response) {
    logger.debug("Request {} parsed response: {}", request.id(), response);
  }
}
