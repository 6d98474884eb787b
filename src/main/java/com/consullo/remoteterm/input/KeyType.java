package com.consullo.remoteterm.input;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Logical keys a remote device can send. Wire codes are part of the versioned key table shared with device clients.
 *
 * @since 1.0
 */
public enum KeyType {
  UNKNOWN(0),

  ENTER(1),
  TAB(2),
  BACKSPACE(3),
  ESCAPE(4),
  DELETE(5),
  INSERT(6),

  UP(10),
  DOWN(11),
  RIGHT(12),
  LEFT(13),

  HOME(20),
  END(21),
  PAGE_UP(22),
  PAGE_DOWN(23),

  F1(30),
  F2(31),
  F3(32),
  F4(33),
  F5(34),
  F6(35),
  F7(36),
  F8(37),
  F9(38),
  F10(39),
  F11(40),
  F12(41),

  CTRL_C(50),
  CTRL_D(51),
  CTRL_Z(52);

  private static final Map<Integer, KeyType> BY_CODE = new HashMap<>();

  static {
    for (KeyType k : values()) {
      BY_CODE.put(k.code, k);
    }
  }

  private final int code;

  KeyType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Resolves a wire code.
   *
   * @param code wire code
   * @return key, or {@link #UNKNOWN} when the code is not in the table
   */
  public static KeyType fromCode(int code) {
    return BY_CODE.getOrDefault(code, UNKNOWN);
  }

  /**
   * Resolves a key name such as {@code "page_up"} or {@code "F5"}.
   *
   * @param name key name, case-insensitive
   * @return key, or {@link #UNKNOWN} when the name is not recognized
   */
  public static KeyType fromName(String name) {
    if (name == null || name.isBlank()) {
      return UNKNOWN;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }
}
