package io.defcollect.core;

public class ConstraintException extends FieldTypeException {

  public ConstraintException(String message) {
    this(message, null);
  }

  public ConstraintException(String message, Throwable cause) {
    super(ErrorKind.CONSTRAINT, message, cause);
  }
}
