package langex.codegen;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import langex.graph.Alphabet;
import langex.graph.Dfa;
import org.junit.jupiter.api.Test;

class CompiledDfaTest {

  private static final Alphabet AB = Alphabet.of("ab");

  /**
   * Every string over an alphabet up to a maximum length.
   */
  private static List<String> words(Alphabet alphabet, int maxLength) {
    final var words = new ArrayList<String>();
    words.add("");
    int from = 0;
    for (int length = 1; length <= maxLength; length++) {
      final int to = words.size();
      for (int i = from; i < to; i++) {
        for (int symbol = 0; symbol < alphabet.size(); symbol++) {
          words.add(words.get(i) + alphabet.symbolAt(symbol));
        }
      }
      from = to;
    }
    return words;
  }

  private static void assertAgrees(Dfa dfa, List<String> inputs) throws Exception {
    final CompiledMatcher matcher = CompiledDfa.compile(dfa);
    for (String input : inputs) {
      assertEquals(dfa.evaluate(input), matcher.matches(input), input);
    }
  }

  @Test
  void agreesWithTheInterpreter() throws Exception {
    final Dfa endsInA = Dfa.of(
      AB,
      new int[][] {
        { 1, 0 },
        { 1, 0 },
      },
      0,
      new boolean[] { false, true }
    );
    final Dfa[] automata = {
      endsInA,
      Dfa.literal(AB, "abba"),
      Dfa.literal(AB, "ab").kleeneStar(),
      endsInA.complement().union(Dfa.literal(AB, "ba")),
      Dfa.anyOf(AB, "b").concatenate(endsInA).minimize(),
    };
    final List<String> inputs = new ArrayList<>(words(AB, 6));
    inputs.add("abc");
    inputs.add("c");
    for (Dfa dfa : automata) {
      assertAgrees(dfa, inputs);
    }
  }

  @Test
  void degenerateAutomata() throws Exception {
    final List<String> inputs = List.of("", "a", "ab");
    assertAgrees(Dfa.emptyLanguage(AB), inputs);
    assertAgrees(Dfa.emptyString(AB), inputs);

    final CompiledMatcher nothing = CompiledDfa.compile(Dfa.emptyLanguage(AB));
    assertFalse(nothing.matches(""));
  }

  @Test
  void sparseAndNullSymbols() throws Exception {
    // Single branch on '\0', dense range and sparse lookup
    final Alphabet alphabet = Alphabet.of("\0abcz");
    final Dfa dfa = Dfa.literal(alphabet, "\0")
      .concatenate(Dfa.anyOf(alphabet, "abc").kleeneStar())
      .concatenate(Dfa.anyOf(alphabet, "\0z"));
    assertAgrees(dfa, words(alphabet, 4));
  }

  @Test
  void tracingMatcherGivesTheSameAnswers() throws Exception {
    final Dfa dfa = Dfa.literal(AB, "ab").kleeneStar();
    final CompiledMatcher matcher = CompiledDfa.compile(dfa, true);

    final PrintStream originalErr = System.err;
    final var captured = new ByteArrayOutputStream();
    System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try {
      assertTrue(matcher.matches("abab"));
      assertFalse(matcher.matches("aba"));
    } finally {
      System.setErr(originalErr);
    }

    final String trace = captured.toString(StandardCharsets.UTF_8);
    assertTrue(trace.contains("[DFA] starting run on: abab"), trace);
    assertTrue(trace.contains("[DFA] exiting run (successful)"), trace);
    assertTrue(trace.contains("[DFA] exiting run (unsuccessful)"), trace);
  }

  @Test
  void worksOnAnyCharSequence() throws Exception {
    final CompiledMatcher matcher = CompiledDfa.compile(Dfa.literal(AB, "abba"));
    assertTrue(matcher.matches(new StringBuilder("ab").append("ba")));
    assertFalse(matcher.matches(new StringBuilder("abb")));
  }
}
