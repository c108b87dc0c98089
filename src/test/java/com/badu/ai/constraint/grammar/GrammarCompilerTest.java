package com.badu.ai.constraint.grammar;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.RuntimeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.badu.ai.constraint.grammar.GrammarExpr.chars;
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
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GrammarCompiler: validation, ambiguity policy and the compiled language.
 */
class GrammarCompilerTest {

  private GrammarCompiler compiler;

  @BeforeEach
  void setUp() {
    compiler = new GrammarCompiler();
  }

  private static boolean accepts(ConstraintAutomaton automaton, String text) {
    return automaton.accepts(text.getBytes(StandardCharsets.UTF_8));
  }

  private static GrammarSpec single(GrammarExpr root) {
    return GrammarSpec.builder("test").rule("root", root).build();
  }

  @Test
  @DisplayName("Literal grammar accepts exactly its text")
  void compile_literal_acceptsExactText() throws CompileException {
    ConstraintAutomaton automaton = compiler.compile(single(literal("ab")));

    assertTrue(accepts(automaton, "ab"));
    assertFalse(accepts(automaton, "a"));
    assertFalse(accepts(automaton, "abc"));
    assertFalse(accepts(automaton, ""));
  }

  @Test
  @DisplayName("Choice between alternatives with a shared prefix is resolved by subset construction")
  void compile_sharedPrefix_keepsBothAlternatives() throws CompileException {
    ConstraintAutomaton automaton = compiler.compile(single(oneOf("major", "minor", "mi")));

    assertTrue(accepts(automaton, "major"));
    assertTrue(accepts(automaton, "minor"));
    assertTrue(accepts(automaton, "mi"));
    assertFalse(accepts(automaton, "min"));
  }

  @Test
  @DisplayName("Bounded repetition respects min and max")
  void compile_boundedRepeat_respectsBounds() throws CompileException {
    ConstraintAutomaton automaton = compiler.compile(single(repeat(chars("0-9"), 1, 3)));

    assertFalse(accepts(automaton, ""));
    assertTrue(accepts(automaton, "1"));
    assertTrue(accepts(automaton, "120"));
    assertFalse(accepts(automaton, "1200"));
  }

  @Test
  @DisplayName("Rules reference other rules")
  void compile_refs_inlineRules() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("lines")
        .rule("root", oneOrMore(ref("line")))
        .rule("line", seq(literal("bpm: "), oneOrMore(chars("0-9")), literal("\n")))
        .build();

    ConstraintAutomaton automaton = compiler.compile(spec);

    assertTrue(accepts(automaton, "bpm: 120\n"));
    assertTrue(accepts(automaton, "bpm: 1\nbpm: 2\n"));
    assertFalse(accepts(automaton, "bpm: \n"));
  }

  @Test
  @DisplayName("Nested constructs push and pop in order")
  void compile_nest_matchesBalancedBrackets() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("brackets")
        .rule("root", ref("value"))
        .rule("value", choice(literal("x"), ref("list")))
        .rule("list", nest("[", optional(seq(ref("value"), zeroOrMore(seq(literal(","), ref("value"))))), "]"))
        .build();

    ConstraintAutomaton automaton = compiler.compile(spec);

    assertTrue(accepts(automaton, "x"));
    assertTrue(accepts(automaton, "[]"));
    assertTrue(accepts(automaton, "[x,[x,[]],x]"));
    assertFalse(accepts(automaton, "[x,[x]"));
    assertFalse(accepts(automaton, "[x]]"));
    assertTrue(automaton.stackAlphabetSize() > 0);
  }

  @Test
  @DisplayName("Mismatched closer is rejected by the top-of-stack guard")
  void compile_mismatchedCloser_hasNoTransition() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("mixed")
        .rule("root", ref("value"))
        .rule("value", choice(literal("1"), ref("object"), ref("array")))
        .rule("object", nest("{", optional(ref("value")), "}"))
        .rule("array", nest("[", optional(ref("value")), "]"))
        .build();

    ConstraintAutomaton automaton = compiler.compile(spec);
    RuntimeState open = automaton.walk(automaton.start(), "{[1".getBytes(StandardCharsets.UTF_8));

    assertNotNull(open);
    assertEquals(2, open.getStack().depth());
    assertNull(automaton.step(open, '}'));
    assertNotNull(automaton.step(open, ']'));
    assertTrue(accepts(automaton, "{[1]}"));
  }

  @Test
  @DisplayName("Multi-byte delimiters: close prefix is matched inside the nested region")
  void compile_multiByteDelimiters_popOnLastByte() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("tags")
        .rule("root", ref("element"))
        .rule("element", nest("<a>", zeroOrMore(choice(chars("x-z"), ref("element"))), "</a>"))
        .build();

    ConstraintAutomaton automaton = compiler.compile(spec);

    assertTrue(accepts(automaton, "<a></a>"));
    assertTrue(accepts(automaton, "<a>x<a>yz</a></a>"));
    assertFalse(accepts(automaton, "<a>x</a"));
    assertFalse(accepts(automaton, "<a><a></a>"));
  }

  @Test
  @DisplayName("Undefined reference is rejected naming the rule")
  void compile_undefinedRef_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("broken")
        .rule("root", seq(literal("a"), ref("missing")))
        .build();

    CompileException exception = assertThrows(CompileException.class, () -> compiler.compile(spec));

    assertEquals("root", exception.getRuleName());
    assertTrue(exception.getMessage().contains("missing"));
  }

  @Test
  @DisplayName("Undefined root is rejected")
  void compile_undefinedRoot_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("broken").rule("a", literal("a")).root("b").build();

    assertThrows(CompileException.class, () -> compiler.compile(spec));
  }

  @Test
  @DisplayName("Empty literal, empty class and empty choice are rejected")
  void compile_emptyExpressions_throwException() {
    assertThrows(CompileException.class, () -> compiler.compile(single(literal(""))));
    assertThrows(CompileException.class, () -> compiler.compile(single(GrammarExpr.anyOf(""))));
    assertThrows(CompileException.class, () -> compiler.compile(single(choice())));
  }

  @Test
  @DisplayName("Repeat with min greater than max is rejected")
  void compile_invalidRepeatBounds_throwsException() {
    CompileException exception = assertThrows(CompileException.class,
        () -> compiler.compile(single(repeat(literal("a"), 3, 2))));

    assertEquals("root", exception.getRuleName());
  }

  @Test
  @DisplayName("Unbounded repetition of a nullable expression is rejected")
  void compile_unboundedNullableRepeat_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("loop")
        .rule("root", zeroOrMore(ref("maybe")))
        .rule("maybe", optional(literal("a")))
        .build();

    CompileException exception = assertThrows(CompileException.class, () -> compiler.compile(spec));

    assertTrue(exception.getMessage().contains("empty string"));
  }

  @Test
  @DisplayName("Recursion outside a nested construct is rejected")
  void compile_unguardedRecursion_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("recursive")
        .rule("root", ref("a"))
        .rule("a", seq(literal("x"), optional(ref("a"))))
        .build();

    CompileException exception = assertThrows(CompileException.class, () -> compiler.compile(spec));

    assertEquals("a", exception.getRuleName());
    assertTrue(exception.getMessage().contains("recursion"));
  }

  @Test
  @DisplayName("Opening a nested construct on text that also continues plainly is ambiguous")
  void compile_pushConflict_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("ambiguous")
        .rule("root", choice(ref("block"), literal("{b")))
        .rule("block", nest("{", literal("a"), "}"))
        .build();

    CompileException exception = assertThrows(CompileException.class, () -> compiler.compile(spec));

    assertTrue(exception.getMessage().contains("ambiguous"));
  }

  @Test
  @DisplayName("Closing a nested construct on text that is also content is ambiguous")
  void compile_popConflict_throwsException() {
    GrammarSpec spec = GrammarSpec.builder("ambiguous")
        .rule("root", ref("group"))
        .rule("group", nest("(", seq(literal("x"), optional(literal(")x"))), ")"))
        .build();

    CompileException exception = assertThrows(CompileException.class, () -> compiler.compile(spec));

    assertTrue(exception.getMessage().contains("ambiguous"));
  }

  @Test
  @DisplayName("Equal specs compile to the same automaton")
  void compile_equalSpecs_memoised() throws CompileException {
    ConstraintAutomaton first = compiler.compile(single(literal("ab")));
    ConstraintAutomaton second = compiler.compile(single(literal("ab")));

    assertSame(first, second);
    assertEquals(1, compiler.cachedCount());
  }

  @Test
  @DisplayName("Compiling an equal spec with separate compilers yields the same language")
  void compile_separateCompilers_sameLanguage() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("idempotent")
        .rule("root", seq(ref("group"), literal("\n")))
        .rule("group", nest("(", zeroOrMore(choice(chars("a-c"), ref("group"))), ")"))
        .build();
    GrammarSpec equalSpec = GrammarSpec.builder("idempotent")
        .rule("root", seq(ref("group"), literal("\n")))
        .rule("group", nest("(", zeroOrMore(choice(chars("a-c"), ref("group"))), ")"))
        .build();
    ConstraintAutomaton first = new GrammarCompiler().compile(spec);
    ConstraintAutomaton second = new GrammarCompiler().compile(equalSpec);

    assertNotSame(first, second);
    for (String sample : new String[] {"()\n", "(a(b)c)\n", "((()))\n", "(\n", "(a))\n", "(d)\n", "()", ""}) {
      assertEquals(accepts(first, sample), accepts(second, sample), sample);
    }
    assertTrue(accepts(first, "(a(b)c)\n"));
    assertFalse(accepts(first, "(a))\n"));
  }

  @Test
  @DisplayName("State limit aborts compilation")
  void compile_exceedsStateLimit_throwsException() {
    GrammarCompiler small = new GrammarCompiler(3);

    CompileException exception = assertThrows(CompileException.class,
        () -> small.compile(single(literal("abcdef"))));

    assertTrue(exception.getMessage().contains("exceeds"));
  }

  @Test
  @DisplayName("Invalid state limit is rejected")
  void constructor_invalidLimit_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> new GrammarCompiler(0));
  }

  @Test
  @DisplayName("Every state of a compiled automaton has a label")
  void compile_statesCarryRuleLabels() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("labels")
        .rule("root", seq(ref("key"), literal("\n")))
        .rule("key", literal("bpm"))
        .build();

    ConstraintAutomaton automaton = compiler.compile(spec);

    for (int s = 0; s < automaton.stateCount(); s++) {
      assertNotNull(automaton.stateLabel(s));
    }
  }
}
