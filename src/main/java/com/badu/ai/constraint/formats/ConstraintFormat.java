package com.badu.ai.constraint.formats;

import com.badu.ai.constraint.grammar.GrammarSpec;

/**
 * A named output format that can be expressed as a grammar.
 */
public interface ConstraintFormat {

  String getName();

  /**
   * Builds the grammar for this format. Equal formats return equal specs.
   */
  GrammarSpec toGrammar();
}
