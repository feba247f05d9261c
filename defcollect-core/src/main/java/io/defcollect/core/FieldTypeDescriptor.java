package io.defcollect.core;

import java.util.Map;
import java.util.Objects;

/**
 * Registry entry for one field type variant: its tag, its class and the
 * constructor used to build instances.
 *
 * @param <F> the variant
 */
public final class FieldTypeDescriptor<F extends FieldType<?>> {

  /** Constructor reference of a variant, {@code (name, constraints, uid)}. */
  @FunctionalInterface
  public interface Factory<F extends FieldType<?>> {
    F create(String name, Map<String, ?> constraints, String uid);
  }

  private final String tag;
  private final Class<F> type;
  private final Factory<F> factory;

  public FieldTypeDescriptor(String tag, Class<F> type, Factory<F> factory) {
    if (tag == null || tag.isEmpty()) throw new ConfigurationException("field type tag required");
    this.tag = tag;
    this.type = Objects.requireNonNull(type, "type");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public String tag() {
    return tag;
  }

  public Class<F> type() {
    return type;
  }

  public F create(String name) {
    return create(name, null, null);
  }

  public F create(String name, Map<String, ?> constraints) {
    return create(name, constraints, null);
  }

  public F create(String name, Map<String, ?> constraints, String uid) {
    return factory.create(name, constraints, uid);
  }

  @Override
  public String toString() {
    return tag + " -> " + type.getSimpleName();
  }
}
