package com.badu.ai.constraint.formats;

import com.badu.ai.constraint.grammar.GrammarExpr;
import com.badu.ai.constraint.grammar.GrammarSpec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static com.badu.ai.constraint.grammar.GrammarExpr.anyOf;
import static com.badu.ai.constraint.grammar.GrammarExpr.charsExcept;
import static com.badu.ai.constraint.grammar.GrammarExpr.choice;
import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.nest;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static com.badu.ai.constraint.grammar.GrammarExpr.optional;
import static com.badu.ai.constraint.grammar.GrammarExpr.ref;
import static com.badu.ai.constraint.grammar.GrammarExpr.seq;
import static com.badu.ai.constraint.grammar.GrammarExpr.zeroOrMore;

/**
 * XML-like elements {@code <tag>text</tag>} over a fixed tag set. Elements nest; text may
 * contain anything except {@code <}. The output is one or more top-level elements, each
 * optionally followed by a newline.
 */
public final class TaggedFormat implements ConstraintFormat {

  private static final Pattern TAG = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");

  private final String name;
  private final Set<String> tags;

  public TaggedFormat(String name, List<String> tags) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Format name cannot be null or blank");
    }
    if (tags == null || tags.isEmpty()) {
      throw new IllegalArgumentException("At least one tag is required");
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String tag : tags) {
      if (tag == null || !TAG.matcher(tag).matches()) {
        throw new IllegalArgumentException("Invalid tag name: '" + tag + "'");
      }
      if (!unique.add(tag)) {
        throw new IllegalArgumentException("Duplicate tag: '" + tag + "'");
      }
    }
    this.name = name;
    this.tags = unique;
  }

  /**
   * Song lyrics sections.
   */
  public static TaggedFormat lyrics() {
    return new TaggedFormat("lyrics", List.of("verse", "chorus", "bridge", "intro", "outro"));
  }

  @Override
  public String getName() {
    return name;
  }

  public Set<String> getTags() {
    return tags;
  }

  @Override
  public GrammarSpec toGrammar() {
    List<GrammarExpr> elements = new ArrayList<>();
    for (String tag : tags) {
      elements.add(ref("element_" + tag));
    }
    GrammarExpr anyElement = choice(elements.toArray(new GrammarExpr[0]));
    GrammarExpr text = oneOrMore(choice(charsExcept("<"), anyOf("\n\t")));

    GrammarSpec.Builder spec = GrammarSpec.builder(name)
        .rule("document", oneOrMore(seq(anyElement, optional(literal("\n")))))
        .rule("content", zeroOrMore(choice(text, anyElement)));
    for (String tag : tags) {
      spec.rule("element_" + tag, nest("<" + tag + ">", ref("content"), "</" + tag + ">"));
    }
    return spec.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaggedFormat)) {
      return false;
    }
    TaggedFormat other = (TaggedFormat) o;
    return name.equals(other.name) && List.copyOf(tags).equals(List.copyOf(other.tags));
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + List.copyOf(tags).hashCode();
  }

  @Override
  public String toString() {
    return "TaggedFormat{name='" + name + "', tags=" + tags + "}";
  }
}
