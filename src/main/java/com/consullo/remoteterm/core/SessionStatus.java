package com.consullo.remoteterm.core;

/**
 * Lifecycle status reported by the session directory.
 *
 * @since 1.0
 */
public enum SessionStatus {
  CREATING,
  ACTIVE,
  KILLING
}
