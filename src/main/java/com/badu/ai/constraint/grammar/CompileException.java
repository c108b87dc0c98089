package com.badu.ai.constraint.grammar;

/**
 * Exception thrown when a grammar specification is malformed or ambiguous.
 *
 * <p>Raised only at compile time, to whoever registers the format; it never occurs during
 * generation. The message names the offending rule.
 *
 * @see GrammarCompiler
 * @see GrammarDefinitionParser
 */
public class CompileException extends Exception {

  private final String grammarName;
  private final String ruleName;

  /**
   * Constructs a CompileException for a rule.
   *
   * @param grammarName grammar being compiled
   * @param ruleName offending rule (may be null when the problem is not rule specific)
   * @param message description of the problem
   */
  public CompileException(String grammarName, String ruleName, String message) {
    super(buildMessage(grammarName, ruleName, message));
    this.grammarName = grammarName;
    this.ruleName = ruleName;
  }

  /**
   * Constructs a CompileException wrapping a parse failure.
   */
  public CompileException(String grammarName, String message, Throwable cause) {
    super(buildMessage(grammarName, null, message), cause);
    this.grammarName = grammarName;
    this.ruleName = null;
  }

  public String getGrammarName() {
    return grammarName;
  }

  /**
   * Gets the offending rule.
   *
   * @return rule name (may be null)
   */
  public String getRuleName() {
    return ruleName;
  }

  private static String buildMessage(String grammarName, String ruleName, String message) {
    StringBuilder sb = new StringBuilder("Grammar '").append(grammarName).append("'");
    if (ruleName != null) {
      sb.append(", rule '").append(ruleName).append("'");
    }
    return sb.append(": ").append(message).toString();
  }
}
