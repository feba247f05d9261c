package io.defcollect.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, constrained unit describing how to validate one kind of value.
 *
 * <p>Constraints are read once, in the constructor: the base class binds
 * {@code nullable} and each variant binds its own keys through
 * {@link #ingestConstraints(Class)}. Instances are immutable afterwards and may
 * be shared between threads.
 *
 * <p>{@link #validate(Object)} applies the nullability contract shared by all
 * variants before handing non-null values to {@link #coerce(Object)}.
 *
 * @param <T> canonical Java type of validated values
 */
public abstract class FieldType<T> {

  private final String name;
  private final String uid;
  private final boolean nullable;
  private final Map<String, Object> constraints;

  protected FieldType(String name, Map<String, ?> constraints, String uid) {
    if (name == null || name.isBlank()) throw new ConstraintException("field name required");
    this.name = name;
    this.uid = uid;
    this.constraints = constraints == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    this.nullable = Boolean.TRUE.equals(ingestConstraints(FieldConstraints.class).nullable);
  }

  /** The registry tag of this variant, e.g. {@code "date"}. */
  public abstract String tag();

  /** Converts a non-null value to {@code T} or throws {@link ValidationException}. */
  protected abstract T coerce(Object value);

  public final T validate(Object value) {
    if (value == null) {
      if (!nullable) throw new ValidationException(name + ": non nullable");
      return null;
    }
    return coerce(value);
  }

  /** Like {@link #validate(Object)}, but reports failure as a result value. */
  public final ValidationResult<T> check(Object value) {
    try {
      return ValidationResult.valid(validate(value));
    } catch (ValidationException e) {
      return ValidationResult.invalid(e);
    }
  }

  /**
   * Binds this field's constraints onto {@code type}. Variants call it from
   * their constructor to read the keys they own.
   */
  protected final <C extends FieldConstraints> C ingestConstraints(Class<C> type) {
    return ConstraintBinder.bind(constraints, type);
  }

  public String name() {
    return name;
  }

  public String uid() {
    return uid;
  }

  public boolean nullable() {
    return nullable;
  }

  public Map<String, Object> constraints() {
    return constraints;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name + ", nullable=" + nullable
        + (uid == null ? "" : ", uid=" + uid) + "}";
  }
}
