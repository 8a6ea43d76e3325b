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
package fr.aneo.ferry.encoding;

import java.net.http.HttpRequest;

/**
 * Anything able to produce the wire request a {@code Request} sends.
 * <p>
 * The conversion runs each time the request is attempted, retries included. A failure surfaces
 * as the error of the request, without any task being created.
 */
@FunctionalInterface
public interface RequestConvertible {

  HttpRequest asHttpRequest() throws Exception;
}
