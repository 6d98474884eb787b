package com.consullo.remoteterm.notify;

/**
 * A pattern hit in the scanned output window.
 *
 * @param category which pattern family matched
 * @param pattern source text of the pattern that matched
 * @param snippet single-line context around the match, bounded by the configured maximum length
 * @param position character offset of the match in the cleaned scan window
 * @since 1.0
 */
public record MatchResult(NotificationCategory category, String pattern, String snippet, int position) {

  public MatchResult {
    if (category == null || pattern == null || snippet == null) {
      throw new IllegalArgumentException("category/pattern/snippet must not be null.");
    }
  }
}
