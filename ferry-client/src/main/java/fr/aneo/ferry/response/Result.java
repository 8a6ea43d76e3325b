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

import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Either the value a serializer produced or the error that prevented it.
 *
 * @param <T> the type of the value
 */
public final class Result<T> {

  private final T value;
  private final FerryException error;

  private Result(T value, FerryException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Result<T> success(T value) {
    return new Result<>(value, null);
  }

  public static <T> Result<T> failure(FerryException error) {
    return new Result<>(null, requireNonNull(error, "error must not be null"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isFailure() {
    return error != null;
  }

  /**
   * Returns the value of a successful result.
   *
   * @return the value, possibly {@code null}, or {@code null} on failure
   */
  public T value() {
    return value;
  }

  public Optional<FerryException> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the value, or throws the error.
   *
   * @return the value
   * @throws FerryException if the result is a failure
   */
  public T orElseThrow() {
    if (error != null) throw error;
    return value;
  }

  public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
    return error == null ? success(mapper.apply(value)) : failure(error);
  }

  @Override
  public String toString() {
    return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
  }
}
