package io.defcollect.core;

import java.util.Objects;

/**
 * Outcome of {@link FieldType#check(Object)}: either the coerced value or the
 * kind and message of the failure.
 *
 * @param <T> canonical type of the checked field
 */
public record ValidationResult<T>(T value, ErrorKind errorKind, String message) {

  public static <T> ValidationResult<T> valid(T value) {
    return new ValidationResult<>(value, null, null);
  }

  public static <T> ValidationResult<T> invalid(FieldTypeException error) {
    Objects.requireNonNull(error, "error");
    return new ValidationResult<>(null, error.kind(), error.getMessage());
  }

  public boolean isValid() {
    return errorKind == null;
  }

  /** Returns the value, or rethrows the failure as a {@link ValidationException}. */
  public T orElseThrow() {
    if (!isValid()) throw new ValidationException(message);
    return value;
  }
}
