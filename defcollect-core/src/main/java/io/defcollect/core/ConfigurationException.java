package io.defcollect.core;

public class ConfigurationException extends FieldTypeException {

  public ConfigurationException(String message) {
    this(message, null);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
