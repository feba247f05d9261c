package io.defcollect.core.types;

import io.defcollect.core.FieldType;
import io.defcollect.core.FieldTypeDescriptor;
import io.defcollect.core.ValidationException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Numeric value, stored as a {@code Double}.
 *
 * <p>Text is parsed as a decimal floating-point literal; surrounding whitespace
 * is ignored, single underscores may group digits ({@code 1_000.5}) and
 * {@code inf}, {@code infinity} and {@code nan} are accepted in any case.
 * Java-only forms such as {@code 1d} or hex literals are rejected.
 */
public class NumberFieldType extends FieldType<Double> {

  public static final String TAG = "number";
  public static final FieldTypeDescriptor<NumberFieldType> DESCRIPTOR =
      new FieldTypeDescriptor<>(TAG, NumberFieldType.class, NumberFieldType::new);

  // digits, optionally grouped by single underscores: 1_000
  private static final String DIGITS = "\\d(?:_?\\d)*";
  private static final Pattern DECIMAL = Pattern.compile(
      "[+-]?(" + DIGITS + "\\.?(?:" + DIGITS + ")?|\\." + DIGITS + ")([eE][+-]?" + DIGITS + ")?");

  public NumberFieldType(String name) {
    this(name, null, null);
  }

  public NumberFieldType(String name, Map<String, ?> constraints) {
    this(name, constraints, null);
  }

  public NumberFieldType(String name, Map<String, ?> constraints, String uid) {
    super(name, constraints, uid);
  }

  @Override
  public String tag() {
    return TAG;
  }

  @Override
  protected Double coerce(Object value) {
    if (value instanceof CharSequence text) return parse(text.toString());
    if (value instanceof Number number) return number.doubleValue();
    throw new ValidationException(name() + ": expected a number, got " + value.getClass().getSimpleName());
  }

  private Double parse(String text) {
    String s = text.strip();
    if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s.replace("_", ""));

    boolean negative = s.startsWith("-");
    String unsigned = (s.startsWith("-") || s.startsWith("+")) ? s.substring(1) : s;
    switch (unsigned.toLowerCase(Locale.ROOT)) {
      case "inf":
      case "infinity":
        return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      case "nan":
        return Double.NaN;
      default:
        throw new ValidationException(name() + ": could not convert '" + text + "' to a number");
    }
  }
}
