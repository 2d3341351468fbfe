package ca.gc.cra.proxylog.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code start=} and {@code delta=} arguments.
 *
 * <ul>
 *   <li>start: {@code dd/MMM/yyyy[:HH[:mm[:ss]]]}, the accept-date layout with trailing parts
 *       optional and defaulting to zero, e.g. {@code 11/Dec/2013:10}.</li>
 *   <li>delta: a non-negative integer followed by {@code s}, {@code m}, {@code h} or {@code d}.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class TimeArguments {
  private static final Pattern DELTA = Pattern.compile("^(\\d+)([smhd])$");

  private static final DateTimeFormatter START = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .appendPattern("dd/MMM/uuuu")
      .optionalStart()
      .appendLiteral(':')
      .appendValue(ChronoField.HOUR_OF_DAY, 2)
      .optionalStart()
      .appendLiteral(':')
      .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
      .optionalStart()
      .appendLiteral(':')
      .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
      .optionalEnd()
      .optionalEnd()
      .optionalEnd()
      .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
      .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
      .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
      .toFormatter(Locale.ENGLISH)
      .withResolverStyle(ResolverStyle.STRICT);

  private TimeArguments() {}

  /**
   * Parses a window start.
   *
   * @param raw start text
   * @return parsed timestamp
   * @throws IllegalArgumentException if the text does not follow {@code dd/MMM/yyyy[:HH[:mm[:ss]]]}
   */
  public static LocalDateTime parseStart(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("start must not be blank");
    }
    try {
      return LocalDateTime.parse(raw.trim(), START);
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException(
          "start must look like 11/Dec/2013[:HH[:mm[:ss]]] (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a window length.
   *
   * @param raw delta text such as {@code 45s} or {@code 2h}
   * @return parsed duration
   * @throws IllegalArgumentException if the text is not {@code <digits><s|m|h|d>}
   */
  public static Duration parseDelta(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("delta must not be blank");
    }
    Matcher m = DELTA.matcher(raw.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("delta must be <number><s|m|h|d>, e.g. 45s or 2h (was '" + raw + "')");
    }
    long amount;
    try {
      amount = Long.parseLong(m.group(1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("delta is out of range (was '" + raw + "')", ex);
    }
    try {
      return switch (m.group(2)) {
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        default -> Duration.ofDays(amount);
      };
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("delta is out of range (was '" + raw + "')", ex);
    }
  }
}
