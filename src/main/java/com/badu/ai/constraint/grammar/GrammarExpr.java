package com.badu.ai.constraint.grammar;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Expression of the structural grammar notation compiled by {@link GrammarCompiler}.
 *
 * <p>Expressions are immutable values; equal expressions compile identically. Build them with
 * the static factories:
 * <pre>{@code
 * GrammarExpr digits = oneOrMore(chars("0-9"));
 * GrammarExpr line = seq(literal("bpm: "), digits, literal("\n"));
 * GrammarExpr list = nest("[", seq(digits, zeroOrMore(seq(literal(","), digits))), "]");
 * }</pre>
 *
 * <p>{@link Nest} is the only construct through which rules may recurse: its open and close
 * literals become stack push and pop operations in the compiled automaton.
 */
public abstract class GrammarExpr {

  /** Upper bound marker for unbounded repetition. */
  public static final int UNBOUNDED = -1;

  GrammarExpr() {
  }

  // ---------------------------------------------------------------- factories

  /** Literal UTF-8 text. */
  public static Literal literal(String text) {
    return new Literal(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Character class from a range spec such as {@code "a-zA-Z_"}. Escapes:
   * {@code \n \t \r \\ \- \^}. A leading {@code ^} negates the class the way
   * {@link #charsExcept(String)} does, so the negated class may only list ASCII.
   */
  public static GrammarExpr chars(String spec) {
    if (spec != null && spec.length() > 1 && spec.startsWith("^")) {
      return utf8Except(CharClassParser.parse(spec.substring(1)));
    }
    return new CharClass(CharClassParser.parse(spec));
  }

  /** Character class of exactly the given characters (no range syntax). */
  public static CharClass anyOf(String characters) {
    BitSet bytes = new BitSet(256);
    for (byte b : characters.getBytes(StandardCharsets.UTF_8)) {
      bytes.set(b & 0xFF);
    }
    return new CharClass(bytes);
  }

  /**
   * One well-formed UTF-8 encoded character: printable ASCII other than the given characters,
   * or a complete multi-byte sequence. Overlong forms, surrogates and code points above
   * {@code U+10FFFF} are excluded. The excluded characters must be ASCII.
   */
  public static Choice charsExcept(String characters) {
    BitSet excluded = new BitSet(256);
    for (byte b : characters.getBytes(StandardCharsets.UTF_8)) {
      excluded.set(b & 0xFF);
    }
    return utf8Except(excluded);
  }

  private static Choice utf8Except(BitSet excluded) {
    if (excluded.nextSetBit(0x80) >= 0) {
      throw new IllegalArgumentException("Only ASCII characters can be excluded from text");
    }
    BitSet ascii = new BitSet(256);
    ascii.set(0x20, 0x7F);
    ascii.andNot(excluded);
    CharClass tail = byteRange(0x80, 0xBF);
    return new Choice(List.of(
        new CharClass(ascii),
        seq(byteRange(0xC2, 0xDF), tail),
        seq(byteRange(0xE0, 0xE0), byteRange(0xA0, 0xBF), tail),
        seq(choice(byteRange(0xE1, 0xEC), byteRange(0xEE, 0xEF)), tail, tail),
        seq(byteRange(0xED, 0xED), byteRange(0x80, 0x9F), tail),
        seq(byteRange(0xF0, 0xF0), byteRange(0x90, 0xBF), tail, tail),
        seq(byteRange(0xF1, 0xF3), tail, tail, tail),
        seq(byteRange(0xF4, 0xF4), byteRange(0x80, 0x8F), tail, tail)));
  }

  private static CharClass byteRange(int from, int to) {
    BitSet bytes = new BitSet(256);
    bytes.set(from, to + 1);
    return new CharClass(bytes);
  }

  public static Sequence seq(GrammarExpr... parts) {
    return new Sequence(List.of(parts));
  }

  public static Choice choice(GrammarExpr... alternatives) {
    return new Choice(List.of(alternatives));
  }

  /** Choice between literal strings. */
  public static Choice oneOf(String... literals) {
    return new Choice(Arrays.stream(literals).map(GrammarExpr::literal).map(GrammarExpr.class::cast).toList());
  }

  public static Repeat repeat(GrammarExpr body, int min, int max) {
    return new Repeat(body, min, max);
  }

  public static Repeat optional(GrammarExpr body) {
    return new Repeat(body, 0, 1);
  }

  public static Repeat zeroOrMore(GrammarExpr body) {
    return new Repeat(body, 0, UNBOUNDED);
  }

  public static Repeat oneOrMore(GrammarExpr body) {
    return new Repeat(body, 1, UNBOUNDED);
  }

  public static Ref ref(String rule) {
    return new Ref(rule);
  }

  /** Nested construct delimited by literal open and close strings. */
  public static Nest nest(String open, GrammarExpr body, String close) {
    return new Nest(literal(open), body, literal(close));
  }

  // ---------------------------------------------------------------- kinds

  /** Non-empty byte string. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Literal extends GrammarExpr {
    byte[] bytes;

    public byte[] getBytes() {
      return bytes.clone();
    }

    public int length() {
      return bytes.length;
    }

    public int byteAt(int index) {
      return bytes[index] & 0xFF;
    }

    @Override
    public String toString() {
      return "\"" + new String(bytes, StandardCharsets.UTF_8).replace("\n", "\\n") + "\"";
    }
  }

  /** Set of single bytes. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class CharClass extends GrammarExpr {
    BitSet bytes;

    public BitSet getBytes() {
      return (BitSet) bytes.clone();
    }

    public boolean isEmpty() {
      return bytes.isEmpty();
    }

    @Override
    public String toString() {
      return "[" + bytes.cardinality() + " bytes]";
    }
  }

  /** Concatenation. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Sequence extends GrammarExpr {
    List<GrammarExpr> parts;

    @Override
    public String toString() {
      return "seq" + parts;
    }
  }

  /** Alternation. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Choice extends GrammarExpr {
    List<GrammarExpr> alternatives;

    @Override
    public String toString() {
      return "choice" + alternatives;
    }
  }

  /** Bounded or unbounded repetition; {@code max == UNBOUNDED} for no upper bound. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Repeat extends GrammarExpr {
    GrammarExpr body;
    int min;
    int max;

    public boolean isUnbounded() {
      return max == UNBOUNDED;
    }

    @Override
    public String toString() {
      return body + "{" + min + "," + (isUnbounded() ? "" : max) + "}";
    }
  }

  /** Reference to a named rule. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Ref extends GrammarExpr {
    String rule;

    @Override
    public String toString() {
      return "<" + rule + ">";
    }
  }

  /** Nested construct: open literal, body, close literal. */
  @Value
  @EqualsAndHashCode(callSuper = false)
  public static class Nest extends GrammarExpr {
    Literal open;
    GrammarExpr body;
    Literal close;

    @Override
    public String toString() {
      return "nest(" + open + " " + body + " " + close + ")";
    }
  }
}
