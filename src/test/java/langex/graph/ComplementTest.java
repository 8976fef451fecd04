package langex.graph;

import static langex.graph.Fixtures.AB;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ComplementTest {

  @Test
  void completeAutomatonKeepsItsStates() {
    final Dfa dfa = Fixtures.endsInA();
    final Dfa complement = dfa.complement();
    assertEquals(dfa.stateCount(), complement.stateCount());
    for (String word : Fixtures.wordsUpTo(AB, 6)) {
      assertEquals(!dfa.evaluate(word), complement.evaluate(word), word);
    }
  }

  @Test
  void stringsFallingOffTheTransitionsAreInTheComplement() {
    final Dfa literal = Dfa.literal(AB, "ab");
    final Dfa complement = literal.complement();

    // "ba" has no run at all in the literal automaton
    assertFalse(literal.evaluate("ba"));
    assertTrue(complement.evaluate("ba"));

    assertTrue(complement.isComplete());
    assertEquals(literal.stateCount() + 1, complement.stateCount());
    assertTrue(complement.isAccepting(literal.stateCount()));
    for (String word : Fixtures.wordsUpTo(AB, 6)) {
      assertEquals(!literal.evaluate(word), complement.evaluate(word), word);
    }
  }

  @Test
  void complementOfEmptyLanguageAcceptsEverything() {
    final Dfa complement = Dfa.emptyLanguage(AB).complement();
    for (String word : Fixtures.wordsUpTo(AB, 4)) {
      assertTrue(complement.evaluate(word), word);
    }
  }

  @Test
  void doubleComplementIsEquivalent() {
    final Dfa literal = Dfa.literal(AB, "aab");
    assertTrue(literal.complement().complement().equivalentTo(literal));
  }

  @Test
  void symbolsOutsideTheAlphabetAreRejectedByBoth() {
    final Dfa literal = Dfa.literal(AB, "ab");
    assertFalse(literal.evaluate("abc"));
    assertFalse(literal.complement().evaluate("abc"));
  }

  @Test
  void inputIsUnchanged() {
    final Dfa literal = Dfa.literal(AB, "ab");
    literal.complement();
    assertEquals(Dfa.literal(AB, "ab"), literal);
  }
}
