package com.consullo.remoteterm.core;

/**
 * Engine configuration could not be read or parsed.
 *
 * @since 1.0
 */
public class ConfigurationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
