package com.badu.ai.constraint.formats;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.cache.TokenTransitionCache;
import com.badu.ai.constraint.config.ConstraintConfig;
import com.badu.ai.constraint.engine.ConstraintEngine;
import com.badu.ai.constraint.grammar.CompileException;
import com.badu.ai.constraint.grammar.GrammarCompiler;
import com.badu.ai.constraint.grammar.GrammarDefinitionParser;
import com.badu.ai.constraint.grammar.GrammarSpec;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named formats with their compiled automata and token transition caches.
 *
 * <p>Each format is compiled once, on first use. Caches are created once per
 * {@code (format, vocabulary)} pair, vocabularies compared by identity, and shared by every
 * engine built from the registry.
 *
 * <pre>{@code
 * FormatRegistry registry = FormatRegistry.withBuiltInFormats();
 * try (ConstraintEngine engine = registry.newEngine("metadata", vocabulary, ConstraintConfig.DEFAULT)) {
 *   ...
 * }
 * }</pre>
 */
public class FormatRegistry {

  private static final Logger logger = LoggerFactory.getLogger(FormatRegistry.class);

  private final GrammarCompiler compiler;
  private final ConcurrentMap<String, GrammarSpec> grammars = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ConstraintAutomaton> automata = new ConcurrentHashMap<>();
  private final Map<String, Map<VocabularyIndex, TokenTransitionCache>> caches = new ConcurrentHashMap<>();

  public FormatRegistry() {
    this(new GrammarCompiler());
  }

  public FormatRegistry(GrammarCompiler compiler) {
    this.compiler = compiler;
  }

  /**
   * Registry holding {@code metadata}, {@code json}, {@code json-object} and {@code lyrics}.
   */
  public static FormatRegistry withBuiltInFormats() {
    FormatRegistry registry = new FormatRegistry();
    registry.register(KeyValueBlockFormat.musicMetadata());
    registry.register(JsonFormat.value());
    registry.register(JsonFormat.object());
    registry.register(TaggedFormat.lyrics());
    return registry;
  }

  public FormatRegistry register(ConstraintFormat format) {
    return register(format.getName(), format.toGrammar());
  }

  /**
   * Registers a grammar under a name.
   *
   * @throws IllegalArgumentException if the name is taken by a different grammar
   */
  public FormatRegistry register(String name, GrammarSpec grammar) {
    GrammarSpec existing = grammars.putIfAbsent(name, grammar);
    if (existing != null && !existing.equals(grammar)) {
      throw new IllegalArgumentException("Format '" + name + "' is already registered with a different grammar");
    }
    logger.debug("Registered format '{}' ({} rules)", name, grammar.getRules().size());
    return this;
  }

  /**
   * Parses a JSON grammar definition and registers it under its name.
   *
   * @return the registered name
   */
  public String load(Path definition) throws IOException, CompileException {
    GrammarSpec grammar = new GrammarDefinitionParser().parse(definition);
    register(grammar.getName(), grammar);
    return grammar.getName();
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<>(grammars.keySet()));
  }

  public boolean contains(String name) {
    return grammars.containsKey(name);
  }

  /**
   * Returns the compiled automaton of a format, compiling it on first use.
   *
   * @throws IllegalArgumentException if no format has this name
   * @throws CompileException if the grammar does not compile
   */
  public ConstraintAutomaton automaton(String name) throws CompileException {
    ConstraintAutomaton automaton = automata.get(name);
    if (automaton != null) {
      return automaton;
    }
    GrammarSpec grammar = grammars.get(name);
    if (grammar == null) {
      throw new IllegalArgumentException("Unknown format '" + name + "', known: " + names());
    }
    automaton = compiler.compile(grammar);
    ConstraintAutomaton existing = automata.putIfAbsent(name, automaton);
    return existing != null ? existing : automaton;
  }

  /**
   * Returns the shared token transition cache of a format for a vocabulary.
   */
  public TokenTransitionCache cache(String name, VocabularyIndex vocabulary) throws CompileException {
    ConstraintAutomaton automaton = automaton(name);
    Map<VocabularyIndex, TokenTransitionCache> perVocabulary =
        caches.computeIfAbsent(name, ignored -> Collections.synchronizedMap(new IdentityHashMap<>()));
    return perVocabulary.computeIfAbsent(vocabulary, v -> {
      logger.debug("Creating token transition cache for '{}' over {} tokens", name, v.size());
      return new TokenTransitionCache(automaton, v);
    });
  }

  /**
   * Creates an engine for a format. The caller closes it.
   */
  public ConstraintEngine newEngine(String name, VocabularyIndex vocabulary, ConstraintConfig config)
      throws CompileException {
    return new ConstraintEngine(cache(name, vocabulary), config);
  }
}
