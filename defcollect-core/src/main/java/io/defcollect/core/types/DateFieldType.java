package io.defcollect.core.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.defcollect.core.ConstraintException;
import io.defcollect.core.FieldConstraints;
import io.defcollect.core.FieldType;
import io.defcollect.core.FieldTypeDescriptor;
import io.defcollect.core.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Calendar date, stored as a {@link LocalDate}.
 *
 * <p>Constraint {@code format} selects how non-temporal input is read:
 * <ul>
 *   <li>a strftime-style pattern for text input, {@value #DEFAULT_FORMAT} when absent;</li>
 *   <li>{@value #TIMESTAMP} for numeric input, taken as seconds since the Unix
 *       epoch and converted to the UTC date, which must fall in years 1 to 9999.</li>
 * </ul>
 * Dates pass through unchanged and date-times are truncated to their date,
 * whatever the format.
 */
public class DateFieldType extends FieldType<LocalDate> {

  public static final String TAG = "date";
  public static final String DEFAULT_FORMAT = "%Y-%m-%d";
  public static final String TIMESTAMP = "timestamp";
  public static final FieldTypeDescriptor<DateFieldType> DESCRIPTOR =
      new FieldTypeDescriptor<>(TAG, DateFieldType.class, DateFieldType::new);

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Constraints extends FieldConstraints {
    public String format;
  }

  // years a timestamp may resolve to
  private static final int MIN_YEAR = 1;
  private static final int MAX_YEAR = 9999;

  // null in timestamp mode
  private final String format;
  private final StrftimePattern pattern;

  public DateFieldType(String name) {
    this(name, null, null);
  }

  public DateFieldType(String name, Map<String, ?> constraints) {
    this(name, constraints, null);
  }

  public DateFieldType(String name, Map<String, ?> constraints, String uid) {
    super(name, constraints, uid);
    Constraints c = ingestConstraints(Constraints.class);
    if (TIMESTAMP.equals(c.format)) {
      this.format = null;
      this.pattern = null;
    } else {
      this.format = c.format == null ? DEFAULT_FORMAT : c.format;
      try {
        this.pattern = StrftimePattern.compile(format);
      } catch (IllegalArgumentException e) {
        throw new ConstraintException(name + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public String tag() {
    return TAG;
  }

  /** The date pattern, or {@code null} when reading epoch timestamps. */
  public String format() {
    return format;
  }

  public boolean isTimestamp() {
    return format == null;
  }

  @Override
  protected LocalDate coerce(Object value) {
    if (value instanceof LocalDate date) return date;
    if (value instanceof LocalDateTime dateTime) return dateTime.toLocalDate();
    if (value instanceof OffsetDateTime dateTime) return dateTime.toLocalDate();
    if (value instanceof ZonedDateTime dateTime) return dateTime.toLocalDate();
    return isTimestamp() ? fromTimestamp(value) : fromText(value);
  }

  private LocalDate fromText(Object value) {
    if (!(value instanceof CharSequence)) {
      throw new ValidationException(name() + ": expected string, got " + value.getClass().getSimpleName());
    }
    String text = value.toString();
    try {
      return pattern.parse(text);
    } catch (DateTimeException e) {
      throw new ValidationException(name() + ": '" + text + "' does not match format '" + format + "'", e);
    }
  }

  private LocalDate fromTimestamp(Object value) {
    if (!(value instanceof Number number)) {
      throw new ValidationException(name() + ": non valid timestamp " + value);
    }
    LocalDate date;
    try {
      date = LocalDate.ofInstant(Instant.ofEpochSecond(epochSeconds(number)), ZoneOffset.UTC);
    } catch (DateTimeException | ArithmeticException e) {
      throw new ValidationException(name() + ": timestamp out of range " + value, e);
    }
    if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
      throw new ValidationException(name() + ": timestamp out of range " + value);
    }
    return date;
  }

  private long epochSeconds(Number number) {
    if (number instanceof Double || number instanceof Float) {
      double seconds = number.doubleValue();
      if (!Double.isFinite(seconds)) throw new ValidationException(name() + ": non valid timestamp " + number);
      return (long) Math.floor(seconds);
    }
    if (number instanceof BigDecimal || number instanceof BigInteger) {
      return new BigDecimal(number.toString()).setScale(0, RoundingMode.FLOOR).longValueExact();
    }
    return number.longValue();
  }
}
