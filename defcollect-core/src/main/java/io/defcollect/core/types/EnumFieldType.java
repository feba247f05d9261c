package io.defcollect.core.types;

import io.defcollect.core.ConstraintException;
import io.defcollect.core.FieldType;
import io.defcollect.core.FieldTypeDescriptor;
import io.defcollect.core.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One of a fixed list of string options.
 *
 * <p>Constraint {@code options} is required and must be a non-empty collection
 * or array; each element is kept in its string form, in the given order.
 * Elements are read as given, so any object with a {@code toString} works.
 */
public class EnumFieldType extends FieldType<String> {

  public static final String TAG = "enum";
  public static final FieldTypeDescriptor<EnumFieldType> DESCRIPTOR =
      new FieldTypeDescriptor<>(TAG, EnumFieldType.class, EnumFieldType::new);

  private final List<String> options;

  public EnumFieldType(String name, Map<String, ?> constraints) {
    this(name, constraints, null);
  }

  public EnumFieldType(String name, Map<String, ?> constraints, String uid) {
    super(name, constraints, uid);
    Collection<?> given = optionsOf(name, constraints().get("options"));
    if (given.isEmpty()) throw new ConstraintException(name + ": no options for enum defined");

    List<String> values = new ArrayList<>(given.size());
    for (Object option : given) {
      if (option == null) throw new ConstraintException(name + ": enum options cannot be null");
      values.add(String.valueOf(option));
    }
    this.options = Collections.unmodifiableList(values);
  }

  private static Collection<?> optionsOf(String name, Object options) {
    if (options == null) return List.of();
    if (options instanceof Collection<?> collection) return collection;
    if (options instanceof Object[] array) return Arrays.asList(array);
    throw new ConstraintException(name + ": enum options must be a list, got " + options.getClass().getSimpleName());
  }

  @Override
  public String tag() {
    return TAG;
  }

  public List<String> options() {
    return options;
  }

  @Override
  protected String coerce(Object value) {
    if (value instanceof CharSequence text) {
      String s = text.toString();
      for (String option : options) {
        if (option.equals(s)) return option;
      }
    }
    throw new ValidationException(name() + ": non valid option: " + value);
  }
}
