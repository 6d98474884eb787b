package com.consullo.remoteterm.notify;

/**
 * Removes terminal control sequences from decoded output so textual patterns can match.
 *
 * <p>
 * Handled forms:
 * <ul>
 * <li>CSI ({@code ESC [ params intermediates final}), including private-mode sequences such as {@code ESC[?1049h}.
 * Cursor movement that starts a new line (A, B, d, E, F, H, f) becomes {@code '\n'}; horizontal movement (C, G)
 * becomes a space; every other CSI is dropped.</li>
 * <li>OSC ({@code ESC ] ... BEL} or {@code ESC ] ... ESC \}).</li>
 * <li>Character set selection ({@code ESC ( X}, {@code ESC ) X}).</li>
 * <li>Any other two-byte escape.</li>
 * <li>C0 control characters other than tab, line feed and carriage return.</li>
 * </ul>
 * A sequence cut off at the end of the input is dropped. Replacing cursor movement with whitespace keeps words that
 * were positioned apart from being glued together.
 * </p>
 *
 * <p>
 * Scanning is a single pass with no regex, so cost is linear in the input. The deadline overload samples the clock
 * every {@value DeadlineCharSequence#CHECK_INTERVAL} characters.
 * </p>
 *
 * @since 1.0
 */
public final class AnsiStripper {

  private static final char ESC = '\u001b';
  private static final char BEL = '\u0007';

  private AnsiStripper() {
  }

  public static String strip(String s) {
    return strip(s, false, 0L);
  }

  /**
   * Strips control sequences, giving up once the deadline passes.
   *
   * @param s decoded terminal output
   * @param deadlineNanos {@link System#nanoTime()} value after which stripping aborts
   * @return cleaned text
   * @throws DeadlineCharSequence.DeadlineExceededException when the deadline passes before the end of the input
   */
  static String strip(String s, long deadlineNanos) {
    return strip(s, true, deadlineNanos);
  }

  private static String strip(String s, boolean bounded, long deadlineNanos) {
    if (s == null || s.isEmpty()) {
      return "";
    }
    if (s.indexOf(ESC) < 0 && !hasStrayControl(s)) {
      return s;
    }

    StringBuilder out = new StringBuilder(s.length());
    int n = s.length();
    int i = 0;
    int nextCheck = DeadlineCharSequence.CHECK_INTERVAL;
    while (i < n) {
      if (bounded && i >= nextCheck) {
        nextCheck = i + DeadlineCharSequence.CHECK_INTERVAL;
        if (System.nanoTime() - deadlineNanos > 0) {
          throw new DeadlineCharSequence.DeadlineExceededException();
        }
      }
      char c = s.charAt(i);
      if (c != ESC) {
        if (!isStrayControl(c)) {
          out.append(c);
        }
        i++;
        continue;
      }

      if (i + 1 >= n) {
        break;
      }
      char kind = s.charAt(i + 1);
      if (kind == '[') {
        i = skipCsi(s, i + 2, out);
      } else if (kind == ']') {
        i = skipOsc(s, i + 2);
      } else if (kind == '(' || kind == ')') {
        i = Math.min(n, i + 3);
      } else {
        i += 2;
      }
    }
    return out.toString();
  }

  private static int skipCsi(String s, int start, StringBuilder out) {
    int n = s.length();
    int i = start;
    while (i < n) {
      char c = s.charAt(i);
      if (c >= 0x40 && c <= 0x7E) {
        appendReplacement(c, out);
        return i + 1;
      }
      if (c < 0x20 || c > 0x3F) {
        // Malformed; resume at the offending character.
        return i;
      }
      i++;
    }
    return n;
  }

  private static int skipOsc(String s, int start) {
    int n = s.length();
    int i = start;
    while (i < n) {
      char c = s.charAt(i);
      if (c == BEL) {
        return i + 1;
      }
      if (c == ESC && i + 1 < n && s.charAt(i + 1) == '\\') {
        return i + 2;
      }
      i++;
    }
    return n;
  }

  private static void appendReplacement(char finalByte, StringBuilder out) {
    switch (finalByte) {
      case 'A', 'B', 'd', 'E', 'F', 'H', 'f' -> appendSeparator('\n', out);
      case 'C', 'G' -> appendSeparator(' ', out);
      default -> {
      }
    }
  }

  private static void appendSeparator(char sep, StringBuilder out) {
    int len = out.length();
    if (len == 0) {
      return;
    }
    char last = out.charAt(len - 1);
    if (last == '\n' || last == '\r') {
      return;
    }
    if (last == ' ' && sep == ' ') {
      return;
    }
    out.append(sep);
  }

  private static boolean hasStrayControl(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (isStrayControl(s.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static boolean isStrayControl(char c) {
    return (c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F;
  }
}
