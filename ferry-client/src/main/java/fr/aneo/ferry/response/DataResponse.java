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
package fr.aneo.ferry.response;

import fr.aneo.ferry.exception.FerryException;
import fr.aneo.ferry.transport.HttpResponseHead;
import fr.aneo.ferry.transport.TaskMetrics;

import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Everything known about a finished data or upload request, as seen by one response handler.
 *
 * @param request               the last wire request sent, or {@code null} if none was created
 * @param response              the response head, or {@code null} if none was received
 * @param data                  the raw response body, or {@code null}
 * @param metrics               the metrics of the last task, or {@code null}
 * @param serializationDuration how long the serializer ran
 * @param result                the serialized value or the error
 * @param <T>                   the serialized type
 */
public record DataResponse<T>(HttpRequest request,
                              HttpResponseHead response,
                              byte[] data,
                              TaskMetrics metrics,
                              Duration serializationDuration,
                              Result<T> result) {

  public T value() {
    return result.value();
  }

  public FerryException error() {
    return result.error().orElse(null);
  }

  @Override
  public String toString() {
    return "DataResponse[" + (request == null ? "no request" : request.method() + " " + request.uri())
      + ", status=" + (response == null ? "none" : response.statusCode())
      + ", bytes=" + (data == null ? 0 : data.length)
      + ", result=" + result + "]";
  }
}
