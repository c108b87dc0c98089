package com.badu.ai.constraint.cache;

import com.badu.ai.constraint.automaton.ConstraintAutomaton;
import com.badu.ai.constraint.automaton.RuntimeState;
import com.badu.ai.constraint.formats.JsonFormat;
import com.badu.ai.constraint.grammar.CompileException;
import com.badu.ai.constraint.grammar.GrammarCompiler;
import com.badu.ai.constraint.grammar.GrammarSpec;
import com.badu.ai.constraint.vocabulary.VocabularyIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.badu.ai.constraint.grammar.GrammarExpr.literal;
import static com.badu.ai.constraint.grammar.GrammarExpr.oneOrMore;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenTransitionCache: consistency with the automaton, stack expectations and
 * at-most-once computation.
 */
class TokenTransitionCacheTest {

  private ConstraintAutomaton json;
  private VocabularyIndex vocabulary;
  private TokenTransitionCache cache;

  @BeforeEach
  void setUp() throws CompileException {
    json = new GrammarCompiler().compile(JsonFormat.value().toGrammar());
    vocabulary = VocabularyIndex.of("{", "\"", "a", ":", "[", "]", "}", "]}", "]}]", "1", ",", " ", "\"a\":");
    cache = new TokenTransitionCache(json, vocabulary);
  }

  private RuntimeState walk(String text) {
    RuntimeState state = json.walk(json.start(), text.getBytes(StandardCharsets.UTF_8));
    assertNotNull(state, "prefix should be valid: " + text);
    return state;
  }

  private int id(String piece) {
    return vocabulary.tokenId(piece);
  }

  @Test
  @DisplayName("Allowed set agrees with walking each token through the automaton")
  void allowed_matchesAutomatonWalk() {
    for (String prefix : List.of("", "{", "{\"a\":", "{\"a\":[1,", "[[", "{\"a\":[1]")) {
      RuntimeState state = walk(prefix);
      ResolvedTokens allowed = cache.allowed(state);

      for (int tokenId = 0; tokenId < vocabulary.size(); tokenId++) {
        RuntimeState expected = json.walk(state, vocabulary.piece(tokenId));
        assertEquals(expected != null, allowed.contains(tokenId),
            "token '" + vocabulary.pieceText(tokenId) + "' after '" + prefix + "'");
        if (expected != null) {
          assertEquals(expected, allowed.successor(tokenId));
        }
      }
    }
  }

  @Test
  @DisplayName("Tokens popping below the top are checked against the real stack")
  void allowed_deeperPops_resolvedPerStack() {
    RuntimeState inRootObject = walk("{\"a\":[");
    RuntimeState inNestedObject = walk("[{\"a\":[");

    assertEquals(inRootObject.getState(), inNestedObject.getState());
    assertEquals(inRootObject.topSymbol(), inNestedObject.topSymbol());
    assertSame(cache.query(inRootObject.getState(), inRootObject.topSymbol()),
        cache.query(inNestedObject.getState(), inNestedObject.topSymbol()));

    ResolvedTokens root = cache.allowed(inRootObject);
    ResolvedTokens nested = cache.allowed(inNestedObject);

    assertTrue(root.contains(id("]}")));
    assertTrue(json.isAccepting(root.successor(id("]}"))));
    assertFalse(root.contains(id("]}]")));

    assertTrue(nested.contains(id("]}")));
    assertFalse(json.isAccepting(nested.successor(id("]}"))));
    assertTrue(nested.contains(id("]}]")));
    assertTrue(json.isAccepting(nested.successor(id("]}]"))));
  }

  @Test
  @DisplayName("Mismatched closing token is not allowed")
  void allowed_wrongCloser_excluded() {
    ResolvedTokens allowed = cache.allowed(walk("{\"a\":[1"));

    assertTrue(allowed.contains(id("]")));
    assertFalse(allowed.contains(id("}")));
  }

  @Test
  @DisplayName("Repeated queries hit the cache")
  void query_twice_hitsCache() {
    RuntimeState start = json.start();

    AllowedTokens first = cache.query(start.getState(), start.topSymbol());
    AllowedTokens second = cache.query(start.getState(), start.topSymbol());

    assertSame(first, second);
    CacheStatistics statistics = cache.getStatistics();
    assertEquals(1, statistics.getMisses());
    assertEquals(1, statistics.getHits());
    assertEquals(1, statistics.getComputations());
    assertEquals(1, statistics.getEntries());
    assertEquals(0.5, statistics.getHitRatio(), 0.001);
  }

  @Test
  @DisplayName("Concurrent misses on one key compute it once")
  void query_concurrent_computesOnce() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(1);
    RuntimeState state = walk("{\"a\":");
    List<Future<AllowedTokens>> futures = new ArrayList<>();

    try {
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          ready.await();
          return cache.query(state.getState(), state.topSymbol());
        }));
      }
      ready.countDown();

      AllowedTokens first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<AllowedTokens> future : futures) {
        assertSame(first, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, cache.getStatistics().getComputations());
    assertEquals(threads, cache.getStatistics().getHits() + cache.getStatistics().getMisses());
  }

  @Test
  @DisplayName("Special tokens are never admitted by the grammar walk")
  void allowed_skipsSpecialTokens() throws CompileException {
    GrammarSpec spec = GrammarSpec.builder("as").rule("root", oneOrMore(literal("a"))).build();
    ConstraintAutomaton automaton = new GrammarCompiler().compile(spec);
    VocabularyIndex withEos = VocabularyIndex.builder().add("a").addEos("</s>").build();
    TokenTransitionCache eosCache = new TokenTransitionCache(automaton, withEos);

    RuntimeState afterA = automaton.walk(automaton.start(), new byte[] {'a'});
    ResolvedTokens allowed = eosCache.allowed(afterA);

    assertTrue(allowed.contains(0));
    assertFalse(allowed.contains(1));
    assertEquals(1, allowed.size());
  }

  @Test
  @DisplayName("Resolving against a state with another key is rejected")
  void resolve_wrongState_throwsException() {
    AllowedTokens entry = cache.query(json.start().getState(), json.start().topSymbol());

    assertThrows(IllegalArgumentException.class, () -> entry.resolve(walk("{")));
  }

  @Test
  @DisplayName("Constructor requires automaton and vocabulary")
  void constructor_nullArguments_throwException() {
    assertThrows(IllegalArgumentException.class, () -> new TokenTransitionCache(null, vocabulary));
    assertThrows(IllegalArgumentException.class, () -> new TokenTransitionCache(json, null));
  }
}
