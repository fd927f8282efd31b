// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.parser;

/** Parser for Genstep numeric literals. */
public class NumberParser {
  private NumberParser() {}

  /** Classification of numeric literal kinds. */
  public enum Format {
    INT,
    FLOAT,
    UNKNOWN
  }

  /**
   * Classifies a numeric literal as it appears in source.
   *
   * <p>Underscores between digits are ignored. Literals with a {@code 0x}, {@code 0b} or {@code
   * 0o} prefix are integers, as are plain digit strings. A decimal point or an exponent makes the
   * literal a float.
   */
  public static Format getFormat(String value) {
    if (value == null) return Format.UNKNOWN;
    String t = value.trim().replace("_", "");
    if (t.isEmpty()) return Format.UNKNOWN;

    if (t.length() > 2 && t.charAt(0) == '0' && "xXbBoO".indexOf(t.charAt(1)) >= 0) {
      return t.indexOf('.') >= 0 ? Format.UNKNOWN : Format.INT;
    }

    if (t.indexOf('.') >= 0 || t.indexOf('e') >= 0 || t.indexOf('E') >= 0) {
      String mantissa = t.replaceFirst("[eE].*$", "").replace(".", "");
      return mantissa.chars().anyMatch(Character::isDigit) ? Format.FLOAT : Format.UNKNOWN;
    }

    return t.chars().allMatch(Character::isDigit) ? Format.INT : Format.UNKNOWN;
  }

  /**
   * Parses an integer literal, detecting the base from its prefix.
   *
   * @throws NumberFormatException if the literal has no digits or digits invalid for its base
   */
  public static long parseAsLong(String value) {
    String s = value.trim().replace("_", "");
    int base = 10;
    if (s.length() > 2 && s.charAt(0) == '0') {
      switch (s.charAt(1)) {
        case 'x', 'X' -> base = 16;
        case 'b', 'B' -> base = 2;
        case 'o', 'O' -> base = 8;
        default -> {}
      }
    }
    String digits = base == 10 ? s : s.substring(2);
    if (digits.isEmpty()) {
      throw new NumberFormatException("Invalid integer literal: '%s'".formatted(value));
    }
    try {
      return Long.parseLong(digits, base);
    } catch (NumberFormatException e) {
      throw new NumberFormatException(
          "Invalid integer literal with base %d: '%s'".formatted(base, value));
    }
  }
}
