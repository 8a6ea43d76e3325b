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

import java.nio.charset.Charset;

/**
 * Raised when a response serializer cannot turn the received bytes into a value.
 */
public final class ResponseSerializationException extends FerryException {

  /**
   * Why serialization failed.
   */
  public enum Reason {
    INPUT_DATA_NIL_OR_ZERO_LENGTH,
    INPUT_FILE_NIL,
    INPUT_FILE_READ_FAILED,
    STRING_SERIALIZATION_FAILED,
    JSON_SERIALIZATION_FAILED,
    DECODING_FAILED,
    CUSTOM_SERIALIZATION_FAILED
  }

  private final Reason reason;
  private final Charset charset;

  private ResponseSerializationException(Reason reason, String message, Charset charset, Throwable cause) {
    super(ErrorKind.RESPONSE_SERIALIZATION_FAILED, message, cause);
    this.reason = reason;
    this.charset = charset;
  }

  public static ResponseSerializationException inputDataNilOrZeroLength() {
    return new ResponseSerializationException(
      Reason.INPUT_DATA_NIL_OR_ZERO_LENGTH,
      "Response could not be serialized, input data was empty and the response does not allow empty bodies.",
      null, null);
  }

  public static ResponseSerializationException inputFileNil() {
    return new ResponseSerializationException(Reason.INPUT_FILE_NIL, "Response could not be serialized, input file was missing.", null, null);
  }

  public static ResponseSerializationException inputFileReadFailed(Throwable cause) {
    return new ResponseSerializationException(Reason.INPUT_FILE_READ_FAILED, "Response could not be serialized, input file could not be read.", null, cause);
  }

  public static ResponseSerializationException stringSerializationFailed(Charset charset, Throwable cause) {
    return new ResponseSerializationException(
      Reason.STRING_SERIALIZATION_FAILED,
      "String could not be serialized with encoding: " + charset + ".",
      charset, cause);
  }

  public static ResponseSerializationException jsonSerializationFailed(Throwable cause) {
    return new ResponseSerializationException(Reason.JSON_SERIALIZATION_FAILED, "JSON could not be serialized: " + cause.getMessage(), null, cause);
  }

  public static ResponseSerializationException decodingFailed(Throwable cause) {
    return new ResponseSerializationException(Reason.DECODING_FAILED, "Response could not be decoded: " + cause.getMessage(), null, cause);
  }

  public static ResponseSerializationException customSerializationFailed(Throwable cause) {
    return new ResponseSerializationException(Reason.CUSTOM_SERIALIZATION_FAILED, "Custom response serializer failed: " + cause.getMessage(), null, cause);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the charset used when string decoding failed.
   *
   * @return the charset, or {@code null} for other reasons
   */
  public Charset charset() {
    return charset;
  }
}
