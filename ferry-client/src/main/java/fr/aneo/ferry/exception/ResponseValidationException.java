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

import java.util.List;

/**
 * Raised when a validator attached to a request rejects the response.
 */
public final class ResponseValidationException extends FerryException {

  /**
   * Why validation failed.
   */
  public enum Reason {
    UNACCEPTABLE_STATUS_CODE,
    UNACCEPTABLE_CONTENT_TYPE,
    MISSING_CONTENT_TYPE,
    DATA_FILE_NIL,
    CUSTOM_VALIDATION_FAILED
  }

  private final Reason reason;
  private final int statusCode;
  private final List<String> acceptableContentTypes;
  private final String responseContentType;

  private ResponseValidationException(Reason reason,
                                      String message,
                                      int statusCode,
                                      List<String> acceptableContentTypes,
                                      String responseContentType,
                                      Throwable cause) {
    super(ErrorKind.RESPONSE_VALIDATION_FAILED, message, cause);
    this.reason = reason;
    this.statusCode = statusCode;
    this.acceptableContentTypes = acceptableContentTypes == null ? List.of() : List.copyOf(acceptableContentTypes);
    this.responseContentType = responseContentType;
  }

  public static ResponseValidationException unacceptableStatusCode(int statusCode) {
    return new ResponseValidationException(
      Reason.UNACCEPTABLE_STATUS_CODE,
      "Response status code was unacceptable: " + statusCode + ".",
      statusCode, null, null, null);
  }

  public static ResponseValidationException unacceptableContentType(List<String> acceptableContentTypes, String responseContentType) {
    return new ResponseValidationException(
      Reason.UNACCEPTABLE_CONTENT_TYPE,
      "Response Content-Type \"" + responseContentType + "\" does not match any acceptable types: " + String.join(", ", acceptableContentTypes) + ".",
      -1, acceptableContentTypes, responseContentType, null);
  }

  public static ResponseValidationException missingContentType(List<String> acceptableContentTypes) {
    return new ResponseValidationException(
      Reason.MISSING_CONTENT_TYPE,
      "Response Content-Type was missing and acceptable content types (" + String.join(", ", acceptableContentTypes) + ") do not match \"*/*\".",
      -1, acceptableContentTypes, null, null);
  }

  public static ResponseValidationException dataFileNil() {
    return new ResponseValidationException(Reason.DATA_FILE_NIL, "Response could not be validated, downloaded file is missing.", -1, null, null, null);
  }

  public static ResponseValidationException customValidationFailed(Throwable cause) {
    return new ResponseValidationException(Reason.CUSTOM_VALIDATION_FAILED, "Custom response validation failed: " + cause.getMessage(), -1, null, null, cause);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the rejected status code.
   *
   * @return the status code, or {@code -1} when the failure is not about the status code
   */
  public int statusCode() {
    return statusCode;
  }

  public List<String> acceptableContentTypes() {
    return acceptableContentTypes;
  }

  public String responseContentType() {
    return responseContentType;
  }
}
