package com.consullo.remoteterm.core;

import com.consullo.remoteterm.notify.NotificationConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link EngineConfig} from a JSON document. Every field is optional and falls back to the built-in default.
 *
 * <pre>
 * {
 *   "replay_buffer_bytes": 102400,
 *   "outbox_capacity": 256,
 *   "handler_budget_ms": 5000,
 *   "input_rate_limit_per_second": 100,
 *   "tmux_path": "tmux",
 *   "tmux_socket_path": null,
 *   "notifications": {
 *     "approval_patterns": ["..."],
 *     "error_patterns": ["..."],
 *     "shell_prompt_patterns": ["..."],
 *     "cooldown_seconds": 5.0,
 *     "scan_budget_ms": 100,
 *     "sliding_window_bytes": 500,
 *     "snippet_context_chars": 25,
 *     "max_snippet_length": 60
 *   }
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class EngineConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfigLoader.class);

  private final ObjectMapper objectMapper = new ObjectMapper();

  /**
   * Loads configuration from a file; a missing file yields the defaults.
   *
   * @param path config file
   * @return configuration
   * @throws ConfigurationException if the file exists but cannot be read or parsed
   */
  public EngineConfig load(Path path) {
    Validate.notNull(path, "path must not be null");
    if (!Files.exists(path)) {
      LOGGER.info("No configuration at {}, using defaults", path);
      return EngineConfig.defaults();
    }
    try (InputStream in = Files.newInputStream(path)) {
      EngineConfig config = load(in);
      LOGGER.info("Loaded configuration from {}", path);
      return config;
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration " + path, e);
    }
  }

  /**
   * Loads configuration from a stream.
   *
   * @param in JSON document
   * @return configuration
   * @throws ConfigurationException if the document cannot be parsed or holds invalid values
   */
  public EngineConfig load(InputStream in) {
    Validate.notNull(in, "in must not be null");
    JsonNode root;
    try {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new ConfigurationException("Malformed configuration document", e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      return EngineConfig.defaults();
    }

    EngineConfig d = EngineConfig.defaults();
    try {
      return new EngineConfig(
          root.path("replay_buffer_bytes").asLong(d.replayBufferBytes()),
          root.path("outbox_capacity").asInt(d.outboxCapacity()),
          root.path("handler_budget_ms").asLong(d.handlerBudgetMillis()),
          root.path("input_rate_limit_per_second").asInt(d.inputRateLimitPerSecond()),
          text(root.path("tmux_path"), d.tmuxPath()),
          text(root.path("tmux_socket_path"), d.tmuxSocketPath()),
          notifications(root.path("notifications"), d.notifications()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static NotificationConfig notifications(JsonNode node, NotificationConfig d) {
    if (node.isMissingNode() || node.isNull()) {
      return d;
    }
    return new NotificationConfig(
        patterns(node.path("approval_patterns"), d.approvalPatterns()),
        patterns(node.path("error_patterns"), d.errorPatterns()),
        patterns(node.path("shell_prompt_patterns"), d.shellPromptPatterns()),
        node.path("cooldown_seconds").asDouble(d.cooldownSeconds()),
        node.path("scan_budget_ms").asLong(d.scanBudgetMillis()),
        node.path("sliding_window_bytes").asInt(d.slidingWindowBytes()),
        node.path("snippet_context_chars").asInt(d.snippetContextChars()),
        node.path("max_snippet_length").asInt(d.maxSnippetLength()));
  }

  private static List<String> patterns(JsonNode node, List<String> fallback) {
    if (!node.isArray()) {
      return fallback;
    }
    List<String> out = new ArrayList<>(node.size());
    for (JsonNode item : node) {
      out.add(item.asText());
    }
    return out;
  }

  private static String text(JsonNode node, String fallback) {
    if (node.isMissingNode() || node.isNull()) {
      return fallback;
    }
    return node.asText();
  }
}
