package io.defcollect.core;

import io.defcollect.core.types.DateFieldType;
import io.defcollect.core.types.EnumFieldType;
import io.defcollect.core.types.NumberFieldType;
import io.defcollect.core.types.TextFieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps type tags to field type variants.
 *
 * <p>The table is explicit and fixed once built. {@link #standard()} holds the
 * four built-in variants; additional variants go through {@link #builder()}
 * without touching existing ones:
 *
 * <pre>{@code
 * FieldTypeRegistry registry = FieldTypeRegistry.builder()
 *     .registerStandardTypes()
 *     .register(MoneyFieldType.DESCRIPTOR)
 *     .build();
 * }</pre>
 */
public final class FieldTypeRegistry {

  private static final Logger log = LoggerFactory.getLogger(FieldTypeRegistry.class);

  private static final FieldTypeRegistry STANDARD = builder().registerStandardTypes().build();

  private final Map<String, FieldTypeDescriptor<?>> byTag;

  private FieldTypeRegistry(Map<String, FieldTypeDescriptor<?>> byTag) {
    this.byTag = Collections.unmodifiableMap(new LinkedHashMap<>(byTag));
  }

  /** The registry of text, number, date and enum. */
  public static FieldTypeRegistry standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All registered variants, in registration order. */
  public List<FieldTypeDescriptor<?>> listTypes() {
    return List.copyOf(byTag.values());
  }

  public Optional<FieldTypeDescriptor<?>> typeClass(String tag) {
    if (tag == null) return Optional.empty();
    return Optional.ofNullable(byTag.get(tag));
  }

  public boolean isRegistered(String tag) {
    return typeClass(tag).isPresent();
  }

  /** Looks up {@code tag} and builds a field of that variant. */
  public FieldType<?> create(String tag, String name, Map<String, ?> constraints) {
    return create(tag, name, constraints, null);
  }

  public FieldType<?> create(String tag, String name, Map<String, ?> constraints, String uid) {
    FieldTypeDescriptor<?> descriptor = typeClass(tag)
        .orElseThrow(() -> new ConfigurationException("unsupported field type " + tag + " for " + name));
    return descriptor.create(name, constraints, uid);
  }

  public static final class Builder {

    private final Map<String, FieldTypeDescriptor<?>> byTag = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(FieldTypeDescriptor<?> descriptor) {
      if (byTag.containsKey(descriptor.tag())) {
        throw new ConfigurationException("field type " + descriptor.tag() + " already registered");
      }
      byTag.put(descriptor.tag(), descriptor);
      log.debug("Registered field type {}", descriptor);
      return this;
    }

    public Builder registerStandardTypes() {
      return register(TextFieldType.DESCRIPTOR)
          .register(NumberFieldType.DESCRIPTOR)
          .register(DateFieldType.DESCRIPTOR)
          .register(EnumFieldType.DESCRIPTOR);
    }

    public FieldTypeRegistry build() {
      return new FieldTypeRegistry(byTag);
    }
  }
}
