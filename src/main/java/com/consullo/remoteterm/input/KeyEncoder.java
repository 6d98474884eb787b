package com.consullo.remoteterm.input;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps logical keys plus a modifier bitmask to the exact bytes an xterm-compatible terminal emits for the keypress.
 *
 * <p>
 * Modifier weights are {@link #SHIFT} = 1, {@link #ALT} = 2, {@link #CTRL} = 4. Inside an escape sequence the
 * modifier parameter is {@code 1 + bitmask}. Rewriting rules:
 * <ul>
 * <li>Shift+Tab produces backtab, {@code ESC [ Z}.</li>
 * <li>Control characters (Ctrl+C, Ctrl+D, Ctrl+Z) are returned unchanged.</li>
 * <li>SS3 sequences {@code ESC O <final>} become {@code ESC [ 1 ; <param> <final>}.</li>
 * <li>CSI sequences get {@code ;<param>} inserted before the final byte when they already carry a numeric
 * parameter, {@code 1;<param>} otherwise.</li>
 * <li>Any other base (Enter, Tab, Backspace, Escape) is returned unchanged.</li>
 * </ul>
 * </p>
 *
 * <p>This table must stay byte-for-byte identical to the device-side encoder.</p>
 *
 * @since 1.0
 */
public final class KeyEncoder {

  public static final int SHIFT = 1;
  public static final int ALT = 2;
  public static final int CTRL = 4;

  private static final int MODIFIER_MASK = SHIFT | ALT | CTRL;

  private static final byte ESC = 0x1B;
  private static final byte[] EMPTY = new byte[0];
  private static final byte[] BACKTAB = {ESC, '[', 'Z'};

  private static final Map<KeyType, byte[]> SEQUENCES = new EnumMap<>(KeyType.class);

  static {
    put(KeyType.ENTER, "\r");
    put(KeyType.TAB, "\t");
    put(KeyType.BACKSPACE, "\u007f");
    put(KeyType.ESCAPE, "\u001b");
    put(KeyType.DELETE, "\u001b[3~");
    put(KeyType.INSERT, "\u001b[2~");

    put(KeyType.UP, "\u001b[A");
    put(KeyType.DOWN, "\u001b[B");
    put(KeyType.RIGHT, "\u001b[C");
    put(KeyType.LEFT, "\u001b[D");

    put(KeyType.HOME, "\u001b[H");
    put(KeyType.END, "\u001b[F");
    put(KeyType.PAGE_UP, "\u001b[5~");
    put(KeyType.PAGE_DOWN, "\u001b[6~");

    put(KeyType.F1, "\u001bOP");
    put(KeyType.F2, "\u001bOQ");
    put(KeyType.F3, "\u001bOR");
    put(KeyType.F4, "\u001bOS");
    put(KeyType.F5, "\u001b[15~");
    put(KeyType.F6, "\u001b[17~");
    put(KeyType.F7, "\u001b[18~");
    put(KeyType.F8, "\u001b[19~");
    put(KeyType.F9, "\u001b[20~");
    put(KeyType.F10, "\u001b[21~");
    put(KeyType.F11, "\u001b[23~");
    put(KeyType.F12, "\u001b[24~");

    put(KeyType.CTRL_C, "\u0003");
    put(KeyType.CTRL_D, "\u0004");
    put(KeyType.CTRL_Z, "\u001a");
  }

  private KeyEncoder() {
  }

  private static void put(KeyType key, String sequence) {
    SEQUENCES.put(key, ascii(sequence));
  }

  /**
   * Encodes a keypress.
   *
   * @param key logical key
   * @param modifiers bitmask of {@link #SHIFT}, {@link #ALT}, {@link #CTRL}; other bits are ignored
   * @return bytes to send, empty for an unknown key
   */
  public static byte[] encode(KeyType key, int modifiers) {
    if (key == null) {
      return EMPTY;
    }
    byte[] base = SEQUENCES.get(key);
    if (base == null) {
      return EMPTY;
    }

    int mods = modifiers & MODIFIER_MASK;
    if (mods == 0 || isControlKey(key)) {
      return base.clone();
    }
    if (key == KeyType.TAB && (mods & SHIFT) != 0) {
      return BACKTAB.clone();
    }

    int param = 1 + mods;
    if (isSs3(base)) {
      return ascii("\u001b[1;" + param + (char) base[2]);
    }
    if (isCsi(base)) {
      char finalByte = (char) base[base.length - 1];
      String params = new String(base, 2, base.length - 3, StandardCharsets.US_ASCII);
      return ascii("\u001b[" + StringUtils.defaultIfEmpty(params, "1") + ";" + param + finalByte);
    }
    return base.clone();
  }

  /**
   * Encodes a keypress identified by its wire code.
   *
   * @param keyCode wire code, see {@link KeyType#code()}
   * @param modifiers modifier bitmask
   * @return bytes to send, empty for an unknown code
   */
  public static byte[] encode(int keyCode, int modifiers) {
    return encode(KeyType.fromCode(keyCode), modifiers);
  }

  /**
   * Unmodified base sequence for a key.
   *
   * @param key logical key
   * @return base bytes, empty for an unknown key
   */
  public static byte[] baseSequence(KeyType key) {
    byte[] base = key != null ? SEQUENCES.get(key) : null;
    return base != null ? base.clone() : EMPTY;
  }

  private static boolean isControlKey(KeyType key) {
    return key == KeyType.CTRL_C || key == KeyType.CTRL_D || key == KeyType.CTRL_Z;
  }

  private static boolean isSs3(byte[] seq) {
    return seq.length == 3 && seq[0] == ESC && seq[1] == 'O';
  }

  private static boolean isCsi(byte[] seq) {
    return seq.length >= 3 && seq[0] == ESC && seq[1] == '[';
  }

  private static byte[] ascii(String sequence) {
    return sequence.getBytes(StandardCharsets.US_ASCII);
  }
}
