package com.badu.ai.constraint.formats;

import com.badu.ai.constraint.grammar.GrammarExpr;
import com.badu.ai.constraint.grammar.GrammarSpec;

import static com.badu.ai.constraint.grammar.GrammarExpr.anyOf;
import static com.badu.ai.constraint.grammar.GrammarExpr.chars;
import static com.badu.ai.constraint.grammar.GrammarExpr.charsExcept;
import static com.badu.ai.constraint.grammar.GrammarExpr.choice;
import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.nest;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOf;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static com.badu.ai.constraint.grammar.GrammarExpr.optional;
import static com.badu.ai.constraint.grammar.GrammarExpr.ref;
import static com.badu.ai.constraint.grammar.GrammarExpr.repeat;
import static com.badu.ai.constraint.grammar.GrammarExpr.seq;
import static com.badu.ai.constraint.grammar.GrammarExpr.zeroOrMore;

/**
 * JSON values: objects, arrays, strings with escapes, integers and decimals, {@code true},
 * {@code false} and {@code null}. Whitespace is limited to spaces and newlines.
 */
public final class JsonFormat implements ConstraintFormat {

  private final String name;
  private final boolean objectRoot;

  private JsonFormat(String name, boolean objectRoot) {
    this.name = name;
    this.objectRoot = objectRoot;
  }

  /** Any JSON value. */
  public static JsonFormat value() {
    return new JsonFormat("json", false);
  }

  /** A JSON object at the top level. */
  public static JsonFormat object() {
    return new JsonFormat("json-object", true);
  }

  @Override
  public String getName() {
    return name;
  }

  public boolean isObjectRoot() {
    return objectRoot;
  }

  @Override
  public GrammarSpec toGrammar() {
    GrammarExpr ws = zeroOrMore(anyOf(" \n"));
    GrammarExpr digits = oneOrMore(chars("0-9"));
    GrammarExpr escape = seq(literal("\\"),
        choice(anyOf("\"\\/bfnrt"), seq(literal("u"), repeat(chars("0-9a-fA-F"), 4, 4))));

    return GrammarSpec.builder(name)
        .rule("document", seq(ws, ref(objectRoot ? "object" : "value"), ws))
        .rule("value", choice(ref("object"), ref("array"), ref("string"), ref("number"),
            oneOf("true", "false", "null")))
        .rule("object", nest("{",
            seq(ws, optional(seq(ref("member"), zeroOrMore(seq(ws, literal(","), ws, ref("member"))))), ws),
            "}"))
        .rule("member", seq(ref("string"), ws, literal(":"), ws, ref("value")))
        .rule("array", nest("[",
            seq(ws, optional(seq(ref("value"), zeroOrMore(seq(ws, literal(","), ws, ref("value"))))), ws),
            "]"))
        .rule("string", seq(literal("\""), zeroOrMore(choice(charsExcept("\"\\"), escape)), literal("\"")))
        .rule("number", seq(optional(literal("-")),
            choice(literal("0"), seq(chars("1-9"), zeroOrMore(chars("0-9")))),
            optional(seq(literal("."), digits))))
        .root("document")
        .build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof JsonFormat)) {
      return false;
    }
    JsonFormat other = (JsonFormat) o;
    return objectRoot == other.objectRoot && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + Boolean.hashCode(objectRoot);
  }

  @Override
  public String toString() {
    return "JsonFormat{name='" + name + "', objectRoot=" + objectRoot + "}";
  }
}
