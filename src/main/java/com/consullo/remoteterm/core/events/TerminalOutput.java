package com.consullo.remoteterm.core.events;

/**
 * A chunk of live or replayed terminal output.
 *
 * <p>The data array is shared between every device the chunk is fanned out to and must not be mutated.</p>
 *
 * @param sessionId session id
 * @param sequence sequence assigned by the session's replay buffer
 * @param data raw output bytes (Base64 on the wire)
 * @since 1.0
 */
public record TerminalOutput(String sessionId, long sequence, byte[] data) implements TerminalEvent {
}
