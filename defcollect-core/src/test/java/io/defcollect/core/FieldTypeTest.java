package io.defcollect.core;

import io.defcollect.core.types.DateFieldType;
import io.defcollect.core.types.EnumFieldType;
import io.defcollect.core.types.NumberFieldType;
import io.defcollect.core.types.TextFieldType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour shared by every variant: nullability, constraint handling and
 * result-style checking.
 */
public class FieldTypeTest {

  static Stream<Arguments> variants() {
    return Stream.of(
        Arguments.of("text", Map.of()),
        Arguments.of("number", Map.of()),
        Arguments.of("date", Map.of()),
        Arguments.of("date", Map.of("format", "timestamp")),
        Arguments.of("enum", Map.of("options", List.of("red", "green", "blue"))));
  }

  private static FieldType<?> create(String tag, Map<String, Object> constraints, Boolean nullable) {
    Map<String, Object> withNullable = new HashMap<>(constraints);
    if (nullable != null) withNullable.put("nullable", nullable);
    return FieldTypeRegistry.standard().create(tag, "field", withNullable);
  }

  @ParameterizedTest
  @MethodSource("variants")
  void shouldReturnNullWhenNullable(String tag, Map<String, Object> constraints) {
    FieldType<?> field = create(tag, constraints, true);

    assertThat(field.nullable()).isTrue();
    assertThat(field.validate(null)).isNull();
  }

  @ParameterizedTest
  @MethodSource("variants")
  void rejectsNullWhenNotNullable(String tag, Map<String, Object> constraints) {
    FieldType<?> field = create(tag, constraints, false);

    assertThatThrownBy(() -> field.validate(null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("non nullable");
  }

  @ParameterizedTest
  @MethodSource("variants")
  void shouldDefaultToNotNullable(String tag, Map<String, Object> constraints) {
    FieldType<?> field = create(tag, constraints, null);

    assertThat(field.nullable()).isFalse();
    assertThatThrownBy(() -> field.validate(null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldTreatMissingConstraintsAsEmpty() {
    TextFieldType field = new TextFieldType("name", null);

    assertThat(field.constraints()).isEmpty();
    assertThat(field.nullable()).isFalse();
  }

  @Test
  void shouldIgnoreUnknownConstraintKeys() {
    Map<String, Object> constraints = new LinkedHashMap<>();
    constraints.put("nullable", true);
    constraints.put("maxLength", 10);
    constraints.put("createdBy", new Object());

    TextFieldType field = new TextFieldType("name", constraints);

    assertThat(field.nullable()).isTrue();
    assertThat(field.constraints()).containsKeys("maxLength", "createdBy");
  }

  @Test
  void rejectsMalformedNullable() {
    assertThatThrownBy(() -> new NumberFieldType("price", Map.of("nullable", "perhaps")))
        .isInstanceOf(ConstraintException.class)
        .hasMessageContaining("nullable");
  }

  @Test
  void rejectsBlankName() {
    assertThatThrownBy(() -> new TextFieldType(" "))
        .isInstanceOf(ConstraintException.class)
        .hasMessageContaining("field name required");
    assertThatThrownBy(() -> new DateFieldType(null))
        .isInstanceOf(ConstraintException.class);
  }

  @Test
  void shouldKeepConstraintsImmutable() {
    Map<String, Object> constraints = new HashMap<>();
    constraints.put("nullable", false);
    TextFieldType field = new TextFieldType("name", constraints);

    constraints.put("nullable", true);

    assertThat(field.nullable()).isFalse();
    assertThat(field.constraints()).containsEntry("nullable", false);
    assertThatThrownBy(() -> field.constraints().put("nullable", true))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void shouldReportCheckResults() {
    NumberFieldType price = new NumberFieldType("price");

    ValidationResult<Double> ok = price.check("3");
    assertThat(ok.isValid()).isTrue();
    assertThat(ok.value()).isEqualTo(3.0);
    assertThat(ok.orElseThrow()).isEqualTo(3.0);

    ValidationResult<Double> failed = price.check("foo");
    assertThat(failed.isValid()).isFalse();
    assertThat(failed.errorKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(failed.message()).contains("foo");
    assertThatThrownBy(failed::orElseThrow).isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldCarryErrorKinds() {
    assertThat(new ConstraintException("x").kind()).isEqualTo(ErrorKind.CONSTRAINT);
    assertThat(new ValidationException("x").kind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(new ConfigurationException("x").kind()).isEqualTo(ErrorKind.CONFIGURATION);
    assertThat(new ValidationException("x")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldDescribeItself() {
    EnumFieldType field = new EnumFieldType("color", Map.of("options", List.of("red")), "f-9");

    assertThat(field.toString()).isEqualTo("EnumFieldType{name=color, nullable=false, uid=f-9}");
  }
}
