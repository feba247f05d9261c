package io.defcollect.core.types;

import io.defcollect.core.FieldTypeRegistry;
import io.defcollect.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class TextFieldTypeTest {

  @Test
  void shouldCreateFromRegistry() {
    assertThat(FieldTypeRegistry.standard().typeClass("text"))
        .hasValueSatisfying(d -> assertThat(d.create("name")).isInstanceOf(TextFieldType.class));
  }

  @Test
  void shouldReturnStringsUnchanged() {
    TextFieldType field = new TextFieldType("name");

    assertThat(field.validate("foo")).isEqualTo("foo");
    assertThat(field.validate("")).isEmpty();
  }

  @Test
  void shouldCoerceOtherValuesToString() {
    TextFieldType field = new TextFieldType("name");

    assertThat(field.validate(3)).isEqualTo("3");
    assertThat(field.validate(2.5)).isEqualTo("2.5");
    assertThat(field.validate(true)).isEqualTo("true");
    assertThat(field.validate(LocalDate.of(2018, 2, 23))).isEqualTo("2018-02-23");
    assertThat(field.validate(new StringBuilder("built"))).isEqualTo("built");
  }

  @Test
  void rejectsNullWhenNotNullable() {
    TextFieldType field = new TextFieldType("name");

    assertThatThrownBy(() -> field.validate(null))
        .isInstanceOf(ValidationException.class)
        .hasMessage("name: non nullable");
  }

  @Test
  void shouldAllowNullWhenNullable() {
    TextFieldType field = new TextFieldType("street", Map.of("nullable", true));

    assertThat(field.validate(null)).isNull();
  }
}
