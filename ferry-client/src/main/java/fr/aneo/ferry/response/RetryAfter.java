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

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Value of a {@code Retry-After} header: either a number of seconds or an HTTP date.
 * Exactly one of {@link #seconds()} and {@link #date()} is present.
 */
public final class RetryAfter {

  // Obsolete HTTP-date forms; a two-digit year is read within the century ending 50 years from now.
  private static final DateTimeFormatter RFC_850 = new DateTimeFormatterBuilder()
    .appendPattern("EEEE, dd-MMM-")
    .appendValueReduced(ChronoField.YEAR, 2, 2, LocalDate.now(ZoneOffset.UTC).minusYears(50))
    .appendPattern(" HH:mm:ss 'GMT'")
    .toFormatter(Locale.US);
  private static final DateTimeFormatter ASCTIME = DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.US);
  private static final DateTimeFormatter OBSOLETE_HTTP_DATE = new DateTimeFormatterBuilder()
    .appendOptional(RFC_850)
    .appendOptional(ASCTIME)
    .toFormatter(Locale.US);

  private final Long seconds;
  private final Instant date;

  private RetryAfter(Long seconds, Instant date) {
    this.seconds = seconds;
    this.date = date;
  }

  public static RetryAfter ofSeconds(long seconds) {
    if (seconds < 0) throw new IllegalArgumentException("seconds must be positive or zero");
    return new RetryAfter(seconds, null);
  }

  public static RetryAfter ofDate(Instant date) {
    if (date == null) throw new IllegalArgumentException("date must not be null");
    return new RetryAfter(null, date);
  }

  /**
   * Parses a {@code Retry-After} header value.
   *
   * @param value the header value
   * @return the parsed value, or empty if it is neither a non-negative integer nor an HTTP date
   *     (RFC 1123, with the obsolete RFC 850 and asctime forms accepted)
   */
  public static Optional<RetryAfter> parse(String value) {
    if (value == null) return Optional.empty();
    var trimmed = value.trim();
    if (trimmed.isEmpty()) return Optional.empty();

    try {
      long parsed = Long.parseLong(trimmed);
      return parsed < 0 ? Optional.empty() : Optional.of(ofSeconds(parsed));
    } catch (NumberFormatException e) {
      return parseDate(trimmed).map(RetryAfter::ofDate);
    }
  }

  private static Optional<Instant> parseDate(String value) {
    try {
      return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
    } catch (DateTimeParseException notRfc1123) {
      try {
        return Optional.of(LocalDateTime.parse(value, OBSOLETE_HTTP_DATE).toInstant(ZoneOffset.UTC));
      } catch (DateTimeParseException notAnHttpDate) {
        return Optional.empty();
      }
    }
  }

  public Optional<Long> seconds() {
    return Optional.ofNullable(seconds);
  }

  public Optional<Instant> date() {
    return Optional.ofNullable(date);
  }

  /**
   * Returns how long to wait from {@code now}, never negative.
   */
  public Duration delayFrom(Instant now) {
    if (seconds != null) return Duration.ofSeconds(seconds);
    var delay = Duration.between(now, date);
    return delay.isNegative() ? Duration.ZERO : delay;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryAfter that)) return false;
    return Objects.equals(seconds, that.seconds) && Objects.equals(date, that.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(seconds, date);
  }

  @Override
  public String toString() {
    return seconds != null ? "RetryAfter[seconds=" + seconds + "]" : "RetryAfter[date=" + date + "]";
  }
}
