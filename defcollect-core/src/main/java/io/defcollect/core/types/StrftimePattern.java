package io.defcollect.core.types;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A strftime-style date pattern ({@code %Y-%m-%d}) compiled into a
 * {@link DateTimeFormatter} that parses the way strptime does: numeric fields
 * take a variable number of digits, month and weekday names are matched
 * case-insensitively in English, a run of whitespace in the pattern matches
 * one or more whitespace characters, and the date fields a pattern leaves out
 * default to 1900-01-01.
 */
final class StrftimePattern {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String pattern;
  private final DateTimeFormatter formatter;

  private StrftimePattern(String pattern, DateTimeFormatter formatter) {
    this.pattern = pattern;
    this.formatter = formatter;
  }

  String pattern() {
    return pattern;
  }

  /**
   * @throws DateTimeException if the text does not match or names an invalid date
   */
  LocalDate parse(String text) {
    return LocalDate.from(formatter.parse(WHITESPACE.matcher(text).replaceAll(" ")));
  }

  /**
   * @throws IllegalArgumentException if the pattern is blank, ends in a lone
   *     {@code %} or uses an unsupported directive
   */
  static StrftimePattern compile(String pattern) {
    if (pattern == null || pattern.isBlank()) throw new IllegalArgumentException("empty date format");
    String collapsed = WHITESPACE.matcher(pattern).replaceAll(" ");

    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .parseStrict();
    Set<ChronoField> seen = EnumSet.noneOf(ChronoField.class);
    StringBuilder literal = new StringBuilder();

    for (int i = 0; i < collapsed.length(); i++) {
      char c = collapsed.charAt(i);
      if (c != '%') {
        literal.append(c);
        continue;
      }
      if (++i == collapsed.length()) throw new IllegalArgumentException("stray % at end of format '" + pattern + "'");
      char directive = collapsed.charAt(i);
      if (directive == '%') {
        literal.append('%');
        continue;
      }
      if (literal.length() > 0) {
        builder.appendLiteral(literal.toString());
        literal.setLength(0);
      }
      appendDirective(builder, directive, pattern, seen);
    }
    if (literal.length() > 0) builder.appendLiteral(literal.toString());

    if (!seen.contains(ChronoField.YEAR)) builder.parseDefaulting(ChronoField.YEAR, 1900);
    if (!seen.contains(ChronoField.DAY_OF_YEAR)) {
      if (!seen.contains(ChronoField.MONTH_OF_YEAR)) builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
      if (!seen.contains(ChronoField.DAY_OF_MONTH)) builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
    }
    return new StrftimePattern(pattern, builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT));
  }

  private static void appendDirective(DateTimeFormatterBuilder builder, char directive, String pattern,
                                      Set<ChronoField> seen) {
    switch (directive) {
      case 'Y':
        builder.appendValue(ChronoField.YEAR, 4);
        seen.add(ChronoField.YEAR);
        break;
      case 'y':
        builder.appendValueReduced(ChronoField.YEAR, 2, 2, 1969);
        seen.add(ChronoField.YEAR);
        break;
      case 'm':
        builder.appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE);
        seen.add(ChronoField.MONTH_OF_YEAR);
        break;
      case 'b':
      case 'h':
        builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
        seen.add(ChronoField.MONTH_OF_YEAR);
        break;
      case 'B':
        builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
        seen.add(ChronoField.MONTH_OF_YEAR);
        break;
      case 'd':
        builder.appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE);
        seen.add(ChronoField.DAY_OF_MONTH);
        break;
      case 'j':
        builder.appendValue(ChronoField.DAY_OF_YEAR, 1, 3, SignStyle.NOT_NEGATIVE);
        seen.add(ChronoField.DAY_OF_YEAR);
        break;
      case 'a':
        builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
        break;
      case 'A':
        builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
        break;
      case 'H':
        builder.appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE);
        break;
      case 'I':
        builder.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 1, 2, SignStyle.NOT_NEGATIVE);
        break;
      case 'p':
        builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
        break;
      case 'M':
        builder.appendValue(ChronoField.MINUTE_OF_HOUR, 1, 2, SignStyle.NOT_NEGATIVE);
        break;
      case 'S':
        builder.appendValue(ChronoField.SECOND_OF_MINUTE, 1, 2, SignStyle.NOT_NEGATIVE);
        break;
      case 'f':
        builder.appendValue(ChronoField.MICRO_OF_SECOND, 1, 6, SignStyle.NOT_NEGATIVE);
        break;
      default:
        throw new IllegalArgumentException("unsupported directive %" + directive + " in format '" + pattern + "'");
    }
  }
}
