package com.consullo.remoteterm.notify;

/**
 * Kinds of terminal output worth notifying the user about.
 *
 * @since 1.0
 */
public enum NotificationCategory {
  APPROVAL("approval", "Approval needed"),
  ERROR("error", "Error detected"),
  SHELL_IDLE("shell_idle", "Shell idle");

  private final String wireName;
  private final String title;

  NotificationCategory(String wireName, String title) {
    this.wireName = wireName;
    this.title = title;
  }

  /**
   * Name used in serialized notification events.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Short human-readable title suffix, e.g. {@code "Approval needed"}.
   *
   * @return title
   */
  public String title() {
    return title;
  }
}
