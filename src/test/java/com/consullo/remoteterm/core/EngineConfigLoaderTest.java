package com.consullo.remoteterm.core;

import com.consullo.remoteterm.notify.NotificationConfig;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JSON configuration loading.
 *
 * @since 1.0
 */
public class EngineConfigLoaderTest {

  private final EngineConfigLoader loader = new EngineConfigLoader();

  private static InputStream json(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Should fall back to defaults when the file is missing")
  void load_MissingFile_Defaults(@TempDir Path dir) {
    assertThat(loader.load(dir.resolve("absent.json"))).isEqualTo(EngineConfig.defaults());
  }

  @Test
  @DisplayName("Should override only the fields present")
  void load_PartialDocument_MergesWithDefaults() {
    final EngineConfig config = loader.load(json(
        "{\"replay_buffer_bytes\": 2048, \"tmux_socket_path\": \"/tmp/t.sock\","
            + " \"notifications\": {\"cooldown_seconds\": 1.5, \"error_patterns\": [\"^oops\"]}}"));

    assertThat(config.replayBufferBytes()).isEqualTo(2048L);
    assertThat(config.outboxCapacity()).isEqualTo(EngineConfig.DEFAULT_OUTBOX_CAPACITY);
    assertThat(config.tmuxSocketPath()).isEqualTo("/tmp/t.sock");
    assertThat(config.notifications().cooldownMillis()).isEqualTo(1_500L);
    assertThat(config.notifications().errorPatterns()).containsExactly("^oops");
    assertThat(config.notifications().approvalPatterns()).isEqualTo(NotificationConfig.DEFAULT_APPROVAL_PATTERNS);
  }

  @Test
  @DisplayName("Should read a configuration file from disk")
  void load_File_Parsed(@TempDir Path dir) throws Exception {
    final Path file = dir.resolve("engine.json");
    Files.writeString(file, "{\"outbox_capacity\": 16, \"input_rate_limit_per_second\": 20}");

    final EngineConfig config = loader.load(file);

    assertThat(config.outboxCapacity()).isEqualTo(16);
    assertThat(config.inputRateLimitPerSecond()).isEqualTo(20);
  }

  @Test
  @DisplayName("Should reject malformed JSON")
  void load_MalformedJson_Throws() {
    assertThatThrownBy(() -> loader.load(json("{not json"))).isInstanceOf(ConfigurationException.class);
  }

  @Test
  @DisplayName("Should reject out-of-range values")
  void load_InvalidValue_Throws() {
    assertThatThrownBy(() -> loader.load(json("{\"outbox_capacity\": 1}")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("outboxCapacity");
  }
}
