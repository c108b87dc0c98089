package com.badu.ai.constraint.grammar;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/**
 * Parses character class specs such as {@code "a-zA-Z0-9_"} into byte sets. Negation is
 * handled by {@link GrammarExpr#chars(String)}.
 *
 * <p>Ranges work on single bytes, so they are meant for ASCII. Non-ASCII characters outside a
 * range add all of their UTF-8 bytes.
 */
final class CharClassParser {

  private CharClassParser() {
    throw new UnsupportedOperationException("Utility class");
  }

  static BitSet parse(String spec) {
    if (spec == null) {
      throw new IllegalArgumentException("Character class spec cannot be null");
    }
    BitSet bytes = new BitSet(256);
    int i = 0;
    while (i < spec.length()) {
      char c = spec.charAt(i);
      int start;
      if (c == '\\' && i + 1 < spec.length()) {
        start = unescape(spec.charAt(i + 1));
        i += 2;
      } else {
        start = c;
        i++;
      }
      if (i + 1 < spec.length() && spec.charAt(i) == '-') {
        char endChar = spec.charAt(i + 1);
        int end;
        if (endChar == '\\' && i + 2 < spec.length()) {
          end = unescape(spec.charAt(i + 2));
          i += 3;
        } else {
          end = endChar;
          i += 2;
        }
        if (end < start || end > 0xFF) {
          throw new IllegalArgumentException("Invalid range in character class '" + spec + "'");
        }
        bytes.set(start, end + 1);
      } else if (start < 0x80) {
        bytes.set(start);
      } else {
        for (byte b : String.valueOf((char) start).getBytes(StandardCharsets.UTF_8)) {
          bytes.set(b & 0xFF);
        }
      }
    }
    return bytes;
  }

  private static int unescape(char c) {
    return switch (c) {
      case 'n' -> '\n';
      case 't' -> '\t';
      case 'r' -> '\r';
      default -> c;
    };
  }
}
