package io.defcollect.core;

/**
 * The three ways a field type or model definition can reject its input.
 */
public enum ErrorKind {
  /** A constraint given at construction is missing or malformed. */
  CONSTRAINT,
  /** A value passed to {@code validate} cannot be read as the field's type. */
  VALIDATION,
  /** A model definition or registry was assembled from unusable parts. */
  CONFIGURATION
}
