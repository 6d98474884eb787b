package com.consullo.remoteterm.notify;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Immutable notification detection settings, shared read-only by every session.
 *
 * @param approvalPatterns regular expressions for approval prompts, matched case-insensitively
 * @param errorPatterns regular expressions for errors, matched in multi-line mode
 * @param shellPromptPatterns regular expressions for an idle shell prompt, matched in multi-line mode
 * @param cooldownSeconds minimum interval between two notifications of one category for one session
 * @param scanBudgetMillis wall-clock budget for evaluating all patterns against one chunk
 * @param slidingWindowBytes trailing bytes carried across chunk boundaries
 * @param snippetContextChars characters of context kept on each side of a match
 * @param maxSnippetLength hard cap on snippet length
 * @since 1.0
 */
public record NotificationConfig(
    List<String> approvalPatterns,
    List<String> errorPatterns,
    List<String> shellPromptPatterns,
    double cooldownSeconds,
    long scanBudgetMillis,
    int slidingWindowBytes,
    int snippetContextChars,
    int maxSnippetLength) {

  public static final double DEFAULT_COOLDOWN_SECONDS = 5.0;
  public static final long DEFAULT_SCAN_BUDGET_MILLIS = 100L;
  public static final int DEFAULT_SLIDING_WINDOW_BYTES = 500;
  public static final int DEFAULT_SNIPPET_CONTEXT_CHARS = 25;
  public static final int DEFAULT_MAX_SNIPPET_LENGTH = 60;

  public static final List<String> DEFAULT_APPROVAL_PATTERNS = List.of(
      "\\?\\s*\\(y/n\\)",
      "\\?\\s*\\[y/N\\]",
      "\\?\\s*\\[Y/n\\]",
      "\\?\\s*\\[yes/no\\]",
      "\\(yes/no\\)",
      "(?i)proceed\\?",
      "(?i)continue\\?",
      "(?i)approve\\?",
      "(?i)confirm\\?",
      "(?i)accept\\?",
      "(?i)press enter",
      "(?i)press any key",
      "(?i)hit enter",
      "(?i)do you want to proceed",
      "(?i)should I continue",
      "(?i)would you like to");

  public static final List<String> DEFAULT_ERROR_PATTERNS = List.of(
      "^error:",
      "^Error:",
      "^ERROR:",
      "^error\\[",
      "(?i)^failed:",
      "(?i)^failure:",
      "(?i)exception:",
      "(?i)exception in",
      "Traceback \\(most recent call last\\):",
      "(?i)stack trace:",
      "^panic:",
      "^fatal:",
      "^FATAL:",
      "(?i)segmentation fault",
      "(?i)unhandled.*exception",
      "(?i)build failed",
      "(?i)compilation failed",
      "npm ERR!",
      "(?i)cargo error");

  public static final List<String> DEFAULT_SHELL_PROMPT_PATTERNS = List.of(
      "^\\$ ",
      "^% ",
      "^> ",
      "^\u276F ",
      "^\u279C ",
      "^\u03BB ",
      "^\\[\\w+@\\w+.*\\]\\$ ");

  public NotificationConfig {
    Validate.notNull(approvalPatterns, "approvalPatterns must not be null");
    Validate.notNull(errorPatterns, "errorPatterns must not be null");
    Validate.notNull(shellPromptPatterns, "shellPromptPatterns must not be null");
    Validate.isTrue(cooldownSeconds >= 0, "cooldownSeconds must not be negative");
    Validate.isTrue(scanBudgetMillis > 0, "scanBudgetMillis must be positive");
    Validate.isTrue(slidingWindowBytes >= 0, "slidingWindowBytes must not be negative");
    Validate.isTrue(snippetContextChars >= 0, "snippetContextChars must not be negative");
    Validate.isTrue(maxSnippetLength > 3, "maxSnippetLength must be greater than 3");
    approvalPatterns = List.copyOf(approvalPatterns);
    errorPatterns = List.copyOf(errorPatterns);
    shellPromptPatterns = List.copyOf(shellPromptPatterns);
  }

  /**
   * Built-in patterns and timings.
   *
   * @return default configuration
   */
  public static NotificationConfig defaults() {
    return new NotificationConfig(
        DEFAULT_APPROVAL_PATTERNS,
        DEFAULT_ERROR_PATTERNS,
        DEFAULT_SHELL_PROMPT_PATTERNS,
        DEFAULT_COOLDOWN_SECONDS,
        DEFAULT_SCAN_BUDGET_MILLIS,
        DEFAULT_SLIDING_WINDOW_BYTES,
        DEFAULT_SNIPPET_CONTEXT_CHARS,
        DEFAULT_MAX_SNIPPET_LENGTH);
  }

  public long cooldownMillis() {
    return Math.round(cooldownSeconds * 1000.0);
  }
}
