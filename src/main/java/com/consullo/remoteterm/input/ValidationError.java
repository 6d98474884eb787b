package com.consullo.remoteterm.input;

/**
 * A rejected request, reported once to the originating device.
 *
 * @param code machine-readable error code
 * @param message human-readable description
 * @since 1.0
 */
public record ValidationError(String code, String message) {

  public static final String INVALID_SESSION_ID = "INVALID_SESSION_ID";
  public static final String INPUT_TOO_LARGE = "INPUT_TOO_LARGE";
  public static final String RATE_LIMITED = "RATE_LIMITED";

  public ValidationError {
    if (code == null || message == null) {
      throw new IllegalArgumentException("code/message must not be null.");
    }
  }
}
