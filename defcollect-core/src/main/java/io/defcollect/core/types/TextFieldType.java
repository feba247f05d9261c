package io.defcollect.core.types;

import io.defcollect.core.FieldType;
import io.defcollect.core.FieldTypeDescriptor;

import java.util.Map;

/**
 * Free text. Non-string values are stored in their string form.
 */
public class TextFieldType extends FieldType<String> {

  public static final String TAG = "text";
  public static final FieldTypeDescriptor<TextFieldType> DESCRIPTOR =
      new FieldTypeDescriptor<>(TAG, TextFieldType.class, TextFieldType::new);

  public TextFieldType(String name) {
    this(name, null, null);
  }

  public TextFieldType(String name, Map<String, ?> constraints) {
    this(name, constraints, null);
  }

  public TextFieldType(String name, Map<String, ?> constraints, String uid) {
    super(name, constraints, uid);
  }

  @Override
  public String tag() {
    return TAG;
  }

  @Override
  protected String coerce(Object value) {
    if (value instanceof String s) return s;
    return String.valueOf(value);
  }
}
