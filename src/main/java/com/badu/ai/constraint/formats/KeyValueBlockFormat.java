package com.badu.ai.constraint.formats;

import com.badu.ai.constraint.grammar.GrammarExpr;
import com.badu.ai.constraint.grammar.GrammarSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.badu.ai.constraint.grammar.GrammarExpr.anyOf;
import static com.badu.ai.constraint.grammar.GrammarExpr.chars;
import static com.badu.ai.constraint.grammar.GrammarExpr.charsExcept;
import static com.badu.ai.constraint.grammar.GrammarExpr.choice;
import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOf;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static com.badu.ai.constraint.grammar.GrammarExpr.optional;
import static com.badu.ai.constraint.grammar.GrammarExpr.ref;
import static com.badu.ai.constraint.grammar.GrammarExpr.repeat;
import static com.badu.ai.constraint.grammar.GrammarExpr.seq;

/**
 * Block of {@code key: value} lines over a fixed key set, closed by a terminator marker.
 * <pre>
 * bpm: 120
 * keyscale: C major
 * timesignature: 4
 * &lt;/think&gt;
 * </pre>
 * Every line ends with a newline; at least one line comes before the terminator. Keys may
 * appear in any order; duplicates and required keys are left to
 * {@link com.badu.ai.constraint.validation.MetadataValidator}.
 */
public final class KeyValueBlockFormat implements ConstraintFormat {

  public static final String DEFAULT_TERMINATOR = "</think>";

  private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** Any non-empty text up to the end of the line. */
  public static final GrammarExpr FREE_TEXT = oneOrMore(charsExcept("\n"));

  private final String name;
  private final Map<String, GrammarExpr> keys;
  private final String terminator;

  private KeyValueBlockFormat(String name, Map<String, GrammarExpr> keys, String terminator) {
    this.name = name;
    this.keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    this.terminator = terminator;
  }

  /**
   * Music metadata block: bpm, keyscale, timesignature, duration, caption, language and genres.
   */
  public static KeyValueBlockFormat musicMetadata() {
    GrammarExpr digits = chars("0-9");
    return builder("metadata")
        .key("bpm", repeat(digits, 1, 3))
        .key("keyscale", seq(chars("A-G"), optional(anyOf("#b")), literal(" "), oneOf("major", "minor")))
        .key("timesignature", seq(repeat(digits, 1, 2), optional(seq(literal("/"), repeat(digits, 1, 2)))))
        .key("duration", seq(repeat(digits, 1, 3), optional(seq(literal("."), repeat(digits, 1, 3)))))
        .key("caption")
        .key("language")
        .key("genres")
        .build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String getName() {
    return name;
  }

  public Map<String, GrammarExpr> getKeys() {
    return keys;
  }

  public String getTerminator() {
    return terminator;
  }

  @Override
  public GrammarSpec toGrammar() {
    List<GrammarExpr> lines = new ArrayList<>();
    for (String key : keys.keySet()) {
      lines.add(ref("line_" + key));
    }
    GrammarSpec.Builder spec = GrammarSpec.builder(name)
        .rule("block", seq(oneOrMore(choice(lines.toArray(new GrammarExpr[0]))), literal(terminator)));
    keys.forEach((key, value) -> spec.rule("line_" + key, seq(literal(key + ": "), value, literal("\n"))));
    return spec.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KeyValueBlockFormat)) {
      return false;
    }
    KeyValueBlockFormat other = (KeyValueBlockFormat) o;
    return name.equals(other.name) && keys.equals(other.keys) && terminator.equals(other.terminator);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 * 31 + keys.hashCode() * 31 + terminator.hashCode();
  }

  @Override
  public String toString() {
    return "KeyValueBlockFormat{name='" + name + "', keys=" + keys.keySet() + ", terminator='" + terminator + "'}";
  }

  public static final class Builder {
    private final String name;
    private final Map<String, GrammarExpr> keys = new LinkedHashMap<>();
    private String terminator = DEFAULT_TERMINATOR;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Adds a key whose value is free text.
     */
    public Builder key(String key) {
      return key(key, FREE_TEXT);
    }

    public Builder key(String key, GrammarExpr valuePattern) {
      if (key == null || !KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("Invalid key: '" + key + "'");
      }
      if (keys.putIfAbsent(key, valuePattern) != null) {
        throw new IllegalArgumentException("Key '" + key + "' is already defined");
      }
      return this;
    }

    public Builder terminator(String terminator) {
      this.terminator = terminator;
      return this;
    }

    public KeyValueBlockFormat build() {
      if (name == null || name.isBlank()) {
        throw new IllegalStateException("Format name cannot be null or blank");
      }
      if (keys.isEmpty()) {
        throw new IllegalStateException("Format '" + name + "' needs at least one key");
      }
      if (terminator == null || terminator.isEmpty()) {
        throw new IllegalStateException("Terminator cannot be null or empty");
      }
      if (terminator.contains("\n")) {
        throw new IllegalStateException("Terminator cannot contain a newline");
      }
      return new KeyValueBlockFormat(name, keys, terminator);
    }
  }
}
