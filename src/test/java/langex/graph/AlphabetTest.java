package langex.graph;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AlphabetTest {

  @Test
  void symbolsAreSortedAndDistinct() {
    final Alphabet alphabet = Alphabet.of("cabbac");
    assertEquals(3, alphabet.size());
    assertEquals('a', alphabet.symbolAt(0));
    assertEquals('b', alphabet.symbolAt(1));
    assertEquals('c', alphabet.symbolAt(2));
    assertEquals(Alphabet.of("abc"), alphabet);
    assertEquals(Alphabet.of("abc").hashCode(), alphabet.hashCode());
    assertEquals("Alphabet(abc)", alphabet.toString());
  }

  @Test
  void indexLookup() {
    final Alphabet alphabet = Alphabet.of("xz");
    assertEquals(0, alphabet.indexOf('x'));
    assertEquals(1, alphabet.indexOf('z'));
    assertEquals(-1, alphabet.indexOf('y'));
    assertTrue(alphabet.contains('z'));
    assertFalse(alphabet.contains('a'));
  }

  @Test
  void ranges() {
    final Alphabet digits = Alphabet.range('0', '9');
    assertEquals(10, digits.size());
    assertEquals(Alphabet.of("0123456789"), digits);
    assertThrows(IllegalArgumentException.class, () -> Alphabet.range('9', '0'));
  }

  @Test
  void emptyAlphabet() {
    final Alphabet empty = Alphabet.of("");
    assertEquals(0, empty.size());
    final Dfa dfa = Dfa.emptyString(empty);
    assertTrue(dfa.evaluate(""));
    assertFalse(dfa.evaluate("a"));
    assertTrue(dfa.isComplete());
  }

  @Test
  void mismatchNamesBothAlphabets() {
    final var error = assertThrows(
      AlphabetMismatchException.class,
      () -> Alphabet.of("ab").requireSameAs(Alphabet.of("abc"))
    );
    assertEquals(Alphabet.of("ab"), error.left);
    assertEquals(Alphabet.of("abc"), error.right);
    assertTrue(error.getMessage().contains("Alphabet(abc)"));
  }
}
