package com.consullo.remoteterm.core.events;

/**
 * Output in the inclusive range {@code [fromSequence, toSequence]} will never be delivered; the device should
 * resynchronize its local view.
 *
 * @param sessionId session id
 * @param fromSequence first lost sequence
 * @param toSequence last lost sequence
 * @since 1.0
 */
public record OutputSkipped(String sessionId, long fromSequence, long toSequence) implements TerminalEvent {
}
