package io.defcollect.core.model;

import io.defcollect.core.ConfigurationException;
import io.defcollect.core.FieldType;
import io.defcollect.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The shape of one record: a name and an ordered list of field types.
 *
 * <p>Field order is kept as given and defines the order of validated records.
 * Field names are not required to be unique; {@link #field(String)} and
 * {@link #validate(Map)} use the first field of a given name.
 */
public final class ModelDefinition {

  private static final Logger log = LoggerFactory.getLogger(ModelDefinition.class);

  private final String name;
  private final String uid;
  private final List<FieldType<?>> fields;

  public ModelDefinition(String name, List<?> fields) {
    this(name, fields, null);
  }

  /**
   * @throws ConfigurationException on the first element of {@code fields} that
   *     is not a {@link FieldType}
   */
  public ModelDefinition(String name, List<?> fields, String uid) {
    if (name == null || name.isBlank()) throw new ConfigurationException("model name required");
    if (fields == null) throw new ConfigurationException(name + ": fields required");

    List<FieldType<?>> checked = new ArrayList<>(fields.size());
    for (Object field : fields) {
      if (!(field instanceof FieldType<?> fieldType)) {
        String type = field == null ? "null" : field.getClass().getName();
        throw new ConfigurationException(name + ": non valid type : " + type);
      }
      checked.add(fieldType);
    }
    this.name = name;
    this.uid = uid;
    this.fields = Collections.unmodifiableList(checked);
    log.debug("Defined model {} with fields {}", name, fieldNames());
  }

  public String name() {
    return name;
  }

  public String uid() {
    return uid;
  }

  public List<FieldType<?>> fields() {
    return fields;
  }

  public List<String> fieldNames() {
    return fields.stream().map(FieldType::name).collect(Collectors.toList());
  }

  public Optional<FieldType<?>> field(String fieldName) {
    return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
  }

  /**
   * Validates a record against every field, in model order. A missing key is
   * validated as {@code null}; keys the model does not declare are rejected.
   * When several fields share a name, only the first one validates that key,
   * as in {@link #field(String)}.
   *
   * @return the coerced record, iterating in model order
   * @throws ValidationException naming the first field that failed
   */
  public Map<String, Object> validate(Map<String, ?> record) {
    if (record == null) throw new ValidationException(name + ": record required");

    for (String key : record.keySet()) {
      if (field(key).isEmpty()) throw new ValidationException(name + ": unknown field " + key);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    for (FieldType<?> field : fields) {
      if (result.containsKey(field.name())) continue;
      try {
        result.put(field.name(), field.validate(record.get(field.name())));
      } catch (ValidationException e) {
        throw new ValidationException(name + "." + e.getMessage(), e);
      }
    }
    return Collections.unmodifiableMap(result);
  }

  @Override
  public String toString() {
    return "ModelDefinition{name=" + name + ", fields=" + fieldNames()
        + (uid == null ? "" : ", uid=" + uid) + "}";
  }
}
