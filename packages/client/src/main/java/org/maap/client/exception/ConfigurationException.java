package org.maap.client.exception;

/** Errors while loading or interpreting the client configuration. */
public class ConfigurationException extends MaapException {
  public ConfigurationException(String message) {
    super(MaapErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(MaapErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
