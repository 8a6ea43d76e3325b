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

import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.util.function.LongConsumer;

/**
 * Data and upload task: every received chunk is handed to the delegate as is.
 */
final class JdkDataTask extends JdkTask {

  private JdkDataTask(JdkNetworkSession session, long identifier, HttpRequest request) {
    super(session, identifier, request);
  }

  /**
   * Creates a data task, or an upload task reporting sent bytes when {@code uploadBody} is given.
   */
  static JdkDataTask create(JdkNetworkSession session, long identifier, HttpRequest request, BodyPublisher uploadBody) {
    if (uploadBody == null) return new JdkDataTask(session, identifier, request);

    var sentBytes = new SentBytes();
    var counted = HttpRequest.newBuilder(request, (name, value) -> true)
                             .method(request.method(), new CountingBodyPublisher(uploadBody, sentBytes))
                             .build();
    var task = new JdkDataTask(session, identifier, counted);
    sentBytes.task = task;
    return task;
  }

  @Override
  protected void didReceiveData(byte[] data) {
    session.post(() -> session.delegate().onData(this, data));
  }

  private static final class SentBytes implements LongConsumer {
    private volatile JdkDataTask task;

    @Override
    public void accept(long length) {
      var owner = task;
      if (owner != null) owner.didSendBodyData(length);
    }
  }
}
