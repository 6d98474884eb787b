package com.consullo.remoteterm.input;

import java.util.Optional;
import org.apache.commons.lang3.CharUtils;

/**
 * Stateless shape checks applied before a device request reaches the process executor.
 *
 * @since 1.0
 */
public final class InputValidator {

  public static final int SESSION_ID_LENGTH = 12;
  public static final int MAX_INPUT_BYTES = 64 * 1024;

  private InputValidator() {
  }

  /**
   * Session ids are exactly 12 ASCII letters or digits.
   *
   * @param sessionId candidate id
   * @return error when rejected, empty when valid
   */
  public static Optional<ValidationError> validateSessionId(String sessionId) {
    if (sessionId == null || sessionId.isEmpty()) {
      return Optional.of(new ValidationError(ValidationError.INVALID_SESSION_ID, "Session ID is required"));
    }
    if (sessionId.contains("..") || sessionId.indexOf('/') >= 0 || sessionId.indexOf('\0') >= 0) {
      return Optional.of(new ValidationError(ValidationError.INVALID_SESSION_ID, "Invalid session ID format"));
    }
    if (sessionId.length() != SESSION_ID_LENGTH) {
      return Optional.of(new ValidationError(ValidationError.INVALID_SESSION_ID, "Invalid session ID format"));
    }
    for (int i = 0; i < sessionId.length(); i++) {
      if (!CharUtils.isAsciiAlphanumeric(sessionId.charAt(i))) {
        return Optional.of(new ValidationError(ValidationError.INVALID_SESSION_ID, "Invalid session ID format"));
      }
    }
    return Optional.empty();
  }

  /**
   * Input payloads are limited to {@value #MAX_INPUT_BYTES} bytes. Empty and binary payloads are allowed.
   *
   * @param data raw input
   * @return error when rejected, empty when valid
   */
  public static Optional<ValidationError> validateInput(byte[] data) {
    if (data != null && data.length > MAX_INPUT_BYTES) {
      return Optional.of(new ValidationError(ValidationError.INPUT_TOO_LARGE,
          "Input exceeds " + MAX_INPUT_BYTES + " bytes (got " + data.length + ")"));
    }
    return Optional.empty();
  }
}
