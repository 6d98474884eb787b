package com.consullo.remoteterm.notify;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental scanner that detects approval prompts, errors and an idle shell in one session's output stream.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Prepend the trailing window of previously seen bytes so patterns split across deliveries still match.</li>
 * <li>Strip terminal control sequences before matching (see {@link AnsiStripper}).</li>
 * <li>Evaluate approval, then error, then shell-prompt patterns; one result per matching pattern, every family is
 * evaluated.</li>
 * <li>Match only the trailing {@value #MAX_SCAN_BYTES} bytes of window plus chunk, so the cost of a scan does not
 * grow with the size of one delivery.</li>
 * <li>Bound the whole scan, decoding and stripping included, by the configured budget; a pattern still running at
 * the deadline counts as no match.</li>
 * <li>Report nothing while a full-screen program holds the alternate screen.</li>
 * <li>Report an idle shell only when the previous chunk was not itself a bare prompt.</li>
 * </ul>
 * </p>
 *
 * <p>One instance per session. Calls are serialized on an internal lock.</p>
 *
 * @since 1.0
 */
public final class PatternMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatternMatcher.class);

  private static final String[] ALT_SCREEN_ENTER = {"\u001b[?1049h", "\u001b[?47h"};
  private static final String[] ALT_SCREEN_EXIT = {"\u001b[?1049l", "\u001b[?47l"};
  private static final int ALT_CARRY_CHARS = 7;
  private static final int BARE_PROMPT_MAX_CHARS = 20;
  // Output older than this within one delivery is not matched.
  static final int MAX_SCAN_BYTES = 64 * 1024;
  private static final int BARE_PROMPT_MAX_BYTES = 4 * 1024;
  private static final byte[] NO_BYTES = new byte[0];

  private final PatternSet patterns;
  private final NotificationConfig config;
  private final long budgetNanos;

  private final Object lock = new Object();

  private byte[] window = NO_BYTES;
  private String altCarry = "";
  private boolean inAlternateScreen;
  private boolean lastWasPrompt;

  public PatternMatcher(PatternSet patterns) {
    Validate.notNull(patterns, "patterns must not be null");
    this.patterns = patterns;
    this.config = patterns.config();
    this.budgetNanos = TimeUnit.MILLISECONDS.toNanos(config.scanBudgetMillis());
  }

  /**
   * Scans a newly delivered output chunk.
   *
   * @param data raw terminal output
   * @return matches, possibly several across categories; empty if none
   */
  public List<MatchResult> processChunk(byte[] data) {
    if (data == null || data.length == 0) {
      return List.of();
    }

    synchronized (lock) {
      long deadline = System.nanoTime() + budgetNanos;
      updateAlternateScreen(data);
      if (inAlternateScreen) {
        LOGGER.debug("Skipping scan: alternate screen active");
        return List.of();
      }

      byte[] combined = ArrayUtils.addAll(window, data);
      window = tail(combined, config.slidingWindowBytes());

      String text;
      try {
        text = AnsiStripper.strip(new String(tail(combined, MAX_SCAN_BYTES), StandardCharsets.UTF_8), deadline);
      } catch (DeadlineCharSequence.DeadlineExceededException e) {
        LOGGER.debug("Scan budget exhausted while stripping {} byte chunk", data.length);
        lastWasPrompt = false;
        return List.of();
      }

      List<MatchResult> results = new ArrayList<>();
      scanFamily(patterns.approval(), NotificationCategory.APPROVAL, text, deadline, results);
      scanFamily(patterns.error(), NotificationCategory.ERROR, text, deadline, results);

      boolean promptFound = false;
      for (PatternSet.Entry entry : patterns.shellPrompt()) {
        Matcher m = find(entry, text, deadline);
        if (m != null) {
          promptFound = true;
          if (!lastWasPrompt) {
            results.add(toResult(NotificationCategory.SHELL_IDLE, entry, text, m));
          }
          break;
        }
      }
      lastWasPrompt = promptFound && isBarePrompt(data);

      if (!results.isEmpty()) {
        LOGGER.debug("Found {} matches in {} byte chunk", results.size(), data.length);
      }
      return results;
    }
  }

  /**
   * Forgets the sliding window and screen state.
   */
  public void reset() {
    synchronized (lock) {
      window = NO_BYTES;
      altCarry = "";
      inAlternateScreen = false;
      lastWasPrompt = false;
    }
  }

  public boolean inAlternateScreen() {
    synchronized (lock) {
      return inAlternateScreen;
    }
  }

  int windowSize() {
    synchronized (lock) {
      return window.length;
    }
  }

  private void scanFamily(List<PatternSet.Entry> family, NotificationCategory category, String text, long deadline,
      List<MatchResult> out) {
    for (PatternSet.Entry entry : family) {
      Matcher m = find(entry, text, deadline);
      if (m != null) {
        out.add(toResult(category, entry, text, m));
      }
    }
  }

  private Matcher find(PatternSet.Entry entry, String text, long deadline) {
    if (System.nanoTime() - deadline > 0) {
      LOGGER.debug("Scan budget exhausted before pattern '{}'", entry.source());
      return null;
    }
    Matcher m = entry.regex().matcher(new DeadlineCharSequence(text, deadline));
    try {
      return m.find() ? m : null;
    } catch (DeadlineCharSequence.DeadlineExceededException e) {
      LOGGER.debug("Pattern '{}' timed out on {} chars", entry.source(), text.length());
      return null;
    }
  }

  private MatchResult toResult(NotificationCategory category, PatternSet.Entry entry, String text, Matcher m) {
    return new MatchResult(category, entry.source(), extractSnippet(text, m.start(), m.end()), m.start());
  }

  String extractSnippet(String text, int matchStart, int matchEnd) {
    int context = config.snippetContextChars();
    int maxLen = config.maxSnippetLength();

    int start = Math.max(0, matchStart - context);
    int end = Math.min(text.length(), matchEnd + context);

    String snippet = StringUtils.normalizeSpace(text.substring(start, end));
    if (start > 0) {
      snippet = "..." + snippet;
    }
    if (end < text.length()) {
      snippet = snippet + "...";
    }
    if (snippet.length() > maxLen) {
      snippet = snippet.substring(0, maxLen - 3) + "...";
    }
    return snippet;
  }

  private void updateAlternateScreen(byte[] data) {
    // ISO-8859-1 maps bytes 1:1 so escape sequences are found regardless of UTF-8 boundaries.
    String text = altCarry + new String(data, StandardCharsets.ISO_8859_1);
    int enter = lastIndexOfAny(text, ALT_SCREEN_ENTER);
    int exit = lastIndexOfAny(text, ALT_SCREEN_EXIT);

    if (enter > exit) {
      if (!inAlternateScreen) {
        LOGGER.debug("Entering alternate screen");
        window = NO_BYTES;
      }
      inAlternateScreen = true;
    } else if (exit > enter) {
      if (inAlternateScreen) {
        LOGGER.debug("Exiting alternate screen");
      }
      inAlternateScreen = false;
    }

    int keep = Math.min(ALT_CARRY_CHARS, text.length());
    altCarry = text.substring(text.length() - keep);
  }

  private static boolean isBarePrompt(byte[] data) {
    if (data.length > BARE_PROMPT_MAX_BYTES) {
      return false;
    }
    String chunk = AnsiStripper.strip(new String(data, StandardCharsets.UTF_8));
    return chunk.strip().length() < BARE_PROMPT_MAX_CHARS;
  }

  private static int lastIndexOfAny(String text, String[] needles) {
    int best = -1;
    for (String needle : needles) {
      best = Math.max(best, text.lastIndexOf(needle));
    }
    return best;
  }

  private static byte[] tail(byte[] data, int max) {
    return data.length <= max ? data : ArrayUtils.subarray(data, data.length - max, data.length);
  }
}
