package langex.graph;

import static langex.graph.Fixtures.AB;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SequentialConstructionTest {

  private static final List<String> WORDS = Fixtures.wordsUpTo(AB, 7);

  /**
   * Whether some split of the word has a prefix in the first language and
   * a suffix in the second.
   */
  private static boolean splits(Dfa first, Dfa second, String word) {
    for (int i = 0; i <= word.length(); i++) {
      if (first.evaluate(word.substring(0, i)) && second.evaluate(word.substring(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the word is a sequence of zero or more words from the language.
   */
  private static boolean repeats(Dfa dfa, String word) {
    if (word.isEmpty()) {
      return true;
    }
    for (int i = 1; i <= word.length(); i++) {
      if (dfa.evaluate(word.substring(0, i)) && repeats(dfa, word.substring(i))) {
        return true;
      }
    }
    return false;
  }

  @Nested
  @DisplayName("Concatenation")
  class ConcatenationTests {

    @Test
    void literalFollowedByAlternatives() {
      final Dfa a = Dfa.literal(AB, "a");
      final Dfa b = Dfa.literal(AB, "b").union(Dfa.literal(AB, "bb"));
      final Dfa ab = a.concatenate(b);
      assertTrue(ab.evaluate("ab"));
      assertTrue(ab.evaluate("abb"));
      assertFalse(ab.evaluate("a"));
      assertFalse(ab.evaluate(""));
      assertFalse(ab.evaluate("abbb"));
      assertFalse(ab.evaluate("b"));
    }

    @Test
    void matchesEverySplit() {
      final Dfa[][] pairs = {
        { Fixtures.endsInA(), Fixtures.containsB() },
        { Fixtures.evenLength(), Dfa.literal(AB, "ab") },
        { Dfa.literal(AB, "a").kleeneStar(), Fixtures.endsInA() },
        { Fixtures.containsB(), Fixtures.containsB() },
      };
      for (Dfa[] pair : pairs) {
        final Dfa concatenation = pair[0].concatenate(pair[1]);
        for (String word : WORDS) {
          assertEquals(splits(pair[0], pair[1], word), concatenation.evaluate(word), word);
        }
      }
    }

    @Test
    void emptyStringIsAnIdentity() {
      final Dfa literal = Dfa.literal(AB, "ba");
      final Dfa left = Dfa.emptyString(AB).concatenate(literal);
      final Dfa right = literal.concatenate(Dfa.emptyString(AB));
      for (String word : WORDS) {
        assertEquals(literal.evaluate(word), left.evaluate(word), word);
        assertEquals(literal.evaluate(word), right.evaluate(word), word);
      }
      assertTrue(Dfa.emptyString(AB).concatenate(Dfa.emptyString(AB)).evaluate(""));
    }

    @Test
    void emptyLanguageAbsorbs() {
      assertEquals(0, Dfa.emptyLanguage(AB).concatenate(Fixtures.endsInA()).stateCount());
      assertEquals(0, Fixtures.endsInA().concatenate(Dfa.emptyLanguage(AB)).stateCount());
    }

    @Test
    void alphabetsMustMatch() {
      assertThrows(
        AlphabetMismatchException.class,
        () -> Fixtures.endsInA().concatenate(Dfa.emptyString(Alphabet.of("a")))
      );
    }
  }

  @Nested
  @DisplayName("Kleene star")
  class KleeneStarTests {

    @Test
    void repeatedLiteral() {
      final Dfa star = Dfa.literal(AB, "ab").kleeneStar();
      assertTrue(star.evaluate(""));
      assertTrue(star.evaluate("ab"));
      assertTrue(star.evaluate("abab"));
      assertFalse(star.evaluate("aba"));
      assertFalse(star.evaluate("a"));
      assertFalse(star.evaluate("ba"));
    }

    @Test
    void returningToTheInitialStateIsNotARepetition() {
      // a(ba)*: every non-empty word ends in 'a', but the run on "ab" is back at the initial state
      final Dfa dfa = Dfa.of(
        AB,
        new int[][] {
          { 1, Dfa.NO_STATE },
          { Dfa.NO_STATE, 0 },
        },
        0,
        new boolean[] { false, true }
      );
      final Dfa star = dfa.kleeneStar();
      assertTrue(star.evaluate(""));
      assertTrue(star.evaluate("a"));
      assertTrue(star.evaluate("aa"));
      assertTrue(star.evaluate("aba"));
      assertFalse(star.evaluate("ab"));
      assertFalse(star.evaluate("abab"));
    }

    @Test
    void matchesEveryDecomposition() {
      final Dfa[] operands = {
        Dfa.literal(AB, "ab"),
        Dfa.literal(AB, "b").union(Dfa.literal(AB, "aa")),
        Fixtures.endsInA(),
        Fixtures.evenLength(),
        Dfa.literal(AB, "aba").union(Dfa.literal(AB, "ab")),
      };
      for (Dfa operand : operands) {
        final Dfa star = operand.kleeneStar();
        for (String word : WORDS) {
          assertEquals(repeats(operand, word), star.evaluate(word), word);
        }
      }
    }

    @Test
    void starOfEmptyLanguageIsTheEmptyString() {
      final Dfa star = Dfa.emptyLanguage(AB).kleeneStar();
      assertTrue(star.evaluate(""));
      assertFalse(star.evaluate("a"));
    }

    @Test
    void starIsIdempotentUpToLanguage() {
      final Dfa star = Dfa.literal(AB, "ab").kleeneStar();
      assertTrue(star.kleeneStar().equivalentTo(star));
    }
  }

  @Test
  void stateLimitIsReported() {
    final var error = assertThrows(
      StateLimitExceededException.class,
      () -> Dfa.literal(AB, "ab").kleeneStar(new ConstructionLimits(1))
    );
    assertEquals(2, error.requestedStates);

    assertThrows(
      StateLimitExceededException.class,
      () -> Fixtures.endsInA().concatenate(Fixtures.containsB(), new ConstructionLimits(2))
    );
  }

  @Test
  void blowUpIsBoundedByTheLimit() {
    // Words whose fourth symbol from the end is 'a': the classic exponential case
    final Dfa anySymbol = Dfa.anyOf(AB, "ab");
    Dfa dfa = anySymbol.kleeneStar().concatenate(Dfa.literal(AB, "a"));
    for (int i = 0; i < 3; i++) {
      dfa = dfa.concatenate(anySymbol);
    }
    assertEquals(16, dfa.minimize().stateCount());

    final Dfa finalDfa = dfa;
    assertThrows(
      StateLimitExceededException.class,
      () -> finalDfa.concatenate(anySymbol, new ConstructionLimits(8))
    );
  }
}
