package io.defcollect.core;

public class ValidationException extends FieldTypeException {

  public ValidationException(String message) {
    this(message, null);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }
}
