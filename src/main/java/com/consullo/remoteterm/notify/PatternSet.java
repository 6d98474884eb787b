package com.consullo.remoteterm.notify;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled form of a {@link NotificationConfig}, built once and shared by every session's matcher.
 *
 * <p>
 * A pattern that fails to compile is logged and left out; the rest of its family keeps working.
 * </p>
 *
 * @since 1.0
 */
public final class PatternSet {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatternSet.class);

  /**
   * A compiled pattern together with the source text reported in match results.
   *
   * @param source pattern text as configured
   * @param regex compiled pattern
   */
  public record Entry(String source, Pattern regex) {
  }

  private final NotificationConfig config;
  private final List<Entry> approval;
  private final List<Entry> error;
  private final List<Entry> shellPrompt;
  private final List<String> rejected = new ArrayList<>();

  private PatternSet(NotificationConfig config) {
    this.config = config;
    this.approval = compileAll(config.approvalPatterns(), Pattern.CASE_INSENSITIVE, NotificationCategory.APPROVAL);
    this.error = compileAll(config.errorPatterns(), Pattern.MULTILINE, NotificationCategory.ERROR);
    this.shellPrompt = compileAll(config.shellPromptPatterns(), Pattern.MULTILINE, NotificationCategory.SHELL_IDLE);
    LOGGER.debug("Compiled patterns: {} approval, {} error, {} shell prompt, {} rejected",
        approval.size(), error.size(), shellPrompt.size(), rejected.size());
  }

  /**
   * Compiles every pattern in the configuration.
   *
   * @param config notification configuration
   * @return compiled set
   */
  public static PatternSet compile(NotificationConfig config) {
    Validate.notNull(config, "config must not be null");
    return new PatternSet(config);
  }

  private List<Entry> compileAll(List<String> sources, int flags, NotificationCategory category) {
    List<Entry> out = new ArrayList<>(sources.size());
    for (String source : sources) {
      if (source == null || source.isEmpty()) {
        LOGGER.warn("Skipping empty {} pattern", category.wireName());
        rejected.add(String.valueOf(source));
        continue;
      }
      try {
        out.add(new Entry(source, Pattern.compile(source, flags)));
      } catch (PatternSyntaxException e) {
        LOGGER.warn("Disabling malformed {} pattern '{}': {}", category.wireName(), source, e.getDescription());
        rejected.add(source);
      }
    }
    return List.copyOf(out);
  }

  public NotificationConfig config() {
    return config;
  }

  public List<Entry> approval() {
    return approval;
  }

  public List<Entry> error() {
    return error;
  }

  public List<Entry> shellPrompt() {
    return shellPrompt;
  }

  /**
   * Pattern texts that were disabled at compile time.
   *
   * @return rejected sources
   */
  public List<String> rejected() {
    return List.copyOf(rejected);
  }
}
