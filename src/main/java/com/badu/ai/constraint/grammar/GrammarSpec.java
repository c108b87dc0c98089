package com.badu.ai.constraint.grammar;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable structural specification of a target format: named rules and a root rule.
 *
 * <p>Two specs are equal when their names, roots and rules are equal, which is what
 * {@link GrammarCompiler} memoises on.
 *
 * <p>Builder usage:
 * <pre>{@code
 * GrammarSpec spec = GrammarSpec.builder("numbers")
 *     .rule("root", oneOrMore(ref("number")))
 *     .rule("number", seq(oneOrMore(chars("0-9")), literal("\n")))
 *     .root("root")
 *     .build();
 * }</pre>
 */
@Value
public class GrammarSpec {

  String name;
  String root;
  Map<String, GrammarExpr> rules;

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Returns the rule body, or null when undefined.
   */
  public GrammarExpr rule(String ruleName) {
    return rules.get(ruleName);
  }

  /**
   * Builder preserving rule declaration order.
   */
  public static final class Builder {
    private final String name;
    private String root;
    private final Map<String, GrammarExpr> rules = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Adds a rule. The first rule added is the root unless {@link #root(String)} is called.
     *
     * @throws IllegalArgumentException if the rule is already defined
     */
    public Builder rule(String ruleName, GrammarExpr body) {
      if (ruleName == null || ruleName.isBlank()) {
        throw new IllegalArgumentException("Rule name cannot be null or blank");
      }
      if (rules.containsKey(ruleName)) {
        throw new IllegalArgumentException("Rule '" + ruleName + "' is already defined");
      }
      rules.put(ruleName, body);
      if (root == null) {
        root = ruleName;
      }
      return this;
    }

    public Builder root(String ruleName) {
      this.root = ruleName;
      return this;
    }

    public GrammarSpec build() {
      if (name == null || name.isBlank()) {
        throw new IllegalStateException("Grammar name cannot be null or blank");
      }
      if (root == null) {
        throw new IllegalStateException("Grammar '" + name + "' has no rules");
      }
      return new GrammarSpec(name, root, Collections.unmodifiableMap(new LinkedHashMap<>(rules)));
    }
  }
}
