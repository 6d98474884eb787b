package com.consullo.remoteterm.core.events;

/**
 * Something in the session's output needs the user's attention. Broadcast to every device.
 *
 * @param sessionId session id
 * @param category {@code approval}, {@code error} or {@code shell_idle}
 * @param pattern pattern that matched
 * @param title display title, e.g. {@code "build: Error detected"}
 * @param snippet context around the match
 * @param timestamp emission time in epoch milliseconds
 * @since 1.0
 */
public record TerminalNotification(
    String sessionId,
    String category,
    String pattern,
    String title,
    String snippet,
    long timestamp) implements TerminalEvent {
}
