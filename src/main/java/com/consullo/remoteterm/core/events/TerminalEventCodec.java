package com.consullo.remoteterm.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.apache.commons.lang3.Validate;

/**
 * JSON encoding of {@link TerminalEvent}s. Each document carries a {@code type} discriminator; output bytes are
 * Base64 encoded.
 *
 * <p>Thread-safe; one instance is shared by the whole engine.</p>
 *
 * @since 1.0
 */
public final class TerminalEventCodec {

  private final ObjectMapper objectMapper;

  public TerminalEventCodec() {
    this.objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Serializes an event to UTF-8 JSON.
   *
   * @param event event
   * @return JSON bytes
   */
  public byte[] encode(TerminalEvent event) {
    Validate.notNull(event, "event must not be null");
    try {
      return objectMapper.writerFor(TerminalEvent.class).writeValueAsBytes(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode " + event.getClass().getSimpleName(), e);
    }
  }

  /**
   * Parses an event produced by {@link #encode(TerminalEvent)}.
   *
   * @param payload JSON bytes
   * @return event
   * @throws IOException if the payload is not a known event
   */
  public TerminalEvent decode(byte[] payload) throws IOException {
    Validate.notNull(payload, "payload must not be null");
    return objectMapper.readValue(payload, TerminalEvent.class);
  }
}
