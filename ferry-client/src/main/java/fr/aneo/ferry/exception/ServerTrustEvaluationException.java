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
package fr.aneo.ferry.exception;

/**
 * Raised when the certificate chain presented by a host is rejected, either because its
 * evaluator returned {@code false} or because no evaluator is registered for a host that
 * must be evaluated.
 */
public final class ServerTrustEvaluationException extends FerryException {

  private final String host;

  public ServerTrustEvaluationException(String host, String message) {
    super(ErrorKind.SERVER_TRUST_EVALUATION_FAILED, message);
    this.host = host;
  }

  public ServerTrustEvaluationException(String host, String message, Throwable cause) {
    super(ErrorKind.SERVER_TRUST_EVALUATION_FAILED, message, cause);
    this.host = host;
  }

  public static ServerTrustEvaluationException noEvaluatorFound(String host) {
    return new ServerTrustEvaluationException(host, "No trust evaluator registered for host " + host + ".");
  }

  public static ServerTrustEvaluationException evaluationFailed(String host) {
    return new ServerTrustEvaluationException(host, "Server trust evaluation failed for host " + host + ".");
  }

  public String host() {
    return host;
  }
}
