package io.defcollect.core;

/**
 * Base of the errors raised by field types, the registry and model definitions.
 */
public abstract class FieldTypeException extends IllegalArgumentException {

  private final ErrorKind kind;

  protected FieldTypeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
