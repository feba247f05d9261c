package io.defcollect.core;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds an untyped constraint map onto a {@link FieldConstraints} class.
 *
 * Only the keys the target class declares are converted, so unrelated
 * entries of any Java type can ride along in the same map.
 */
final class ConstraintBinder {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConstraintBinder() {}

  static <C extends FieldConstraints> C bind(Map<String, ?> constraints, Class<C> type) {
    JavaType javaType = MAPPER.constructType(type);
    BeanDescription description = MAPPER.getDeserializationConfig().introspect(javaType);

    Map<String, Object> known = new LinkedHashMap<>();
    for (BeanPropertyDefinition property : description.findProperties()) {
      String key = property.getName();
      if (constraints.containsKey(key)) known.put(key, constraints.get(key));
    }

    try {
      return MAPPER.convertValue(known, javaType);
    } catch (IllegalArgumentException e) {
      throw new ConstraintException("Malformed constraints " + known.keySet() + ": " + rootMessage(e), e);
    }
  }

  private static String rootMessage(Throwable e) {
    Throwable t = e;
    while (t.getCause() != null && t.getCause() != t) t = t.getCause();
    String message = t.getMessage();
    if (message == null) return t.getClass().getSimpleName();
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }
}
