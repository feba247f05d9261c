package io.defcollect.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Typed view of the constraint keys every field type understands.
 * Variants extend this with their own keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldConstraints {
  public Boolean nullable;
}
