package com.consullo.remoteterm.core.events;

/**
 * Acknowledges an attach request.
 *
 * @param sessionId session id
 * @param bufferStartSequence oldest sequence still available for replay
 * @param currentSequence sequence the next live chunk will carry
 * @since 1.0
 */
public record TerminalAttached(String sessionId, long bufferStartSequence, long currentSequence)
    implements TerminalEvent {
}
