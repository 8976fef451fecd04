package langex.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Automata and inputs shared by the tests.
 */
public final class Fixtures {

  public static final Alphabet AB = Alphabet.of("ab");

  private Fixtures() { }

  /**
   * Strings over {a, b} whose last symbol is {@code a}.
   */
  public static Dfa endsInA() {
    return Dfa.of(
      AB,
      new int[][] {
        { 1, 0 },
        { 1, 0 },
      },
      0,
      new boolean[] { false, true }
    );
  }

  /**
   * Strings over {a, b} of even length.
   */
  public static Dfa evenLength() {
    return Dfa.of(
      AB,
      new int[][] {
        { 1, 1 },
        { 0, 0 },
      },
      0,
      new boolean[] { true, false }
    );
  }

  /**
   * Strings over {a, b} containing at least one {@code b}.
   */
  public static Dfa containsB() {
    return Dfa.of(
      AB,
      new int[][] {
        { 0, 1 },
        { 1, 1 },
      },
      0,
      new boolean[] { false, true }
    );
  }

  /**
   * Every string over an alphabet, shortest first, up to a maximum length.
   *
   * @param alphabet symbols to draw from
   * @param maxLength longest string produced
   * @return all strings of length {@code 0} to {@code maxLength}
   */
  public static List<String> wordsUpTo(Alphabet alphabet, int maxLength) {
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
}
