package langex.graph;

import java.util.Arrays;

/**
 * Finite, ordered set of input symbols.
 *
 * <p>Symbols are kept sorted and distinct. The position of a symbol in that
 * order is its index, which is how transition tables address their columns.
 */
public final class Alphabet {

  // Sorted and distinct symbols
  private final char[] symbols;

  private Alphabet(char[] sortedDistinct) {
    this.symbols = sortedDistinct;
  }

  /**
   * Alphabet made of the characters in a string (duplicates are ignored).
   *
   * @param symbols characters in the alphabet
   * @return alphabet over those characters
   */
  public static Alphabet of(CharSequence symbols) {
    final char[] chars = symbols.toString().toCharArray();
    Arrays.sort(chars);

    int distinct = 0;
    for (int i = 0; i < chars.length; i++) {
      if (i == 0 || chars[i] != chars[i - 1]) {
        chars[distinct++] = chars[i];
      }
    }
    return new Alphabet(Arrays.copyOf(chars, distinct));
  }

  /**
   * Alphabet made of an inclusive range of characters.
   *
   * @param from first character
   * @param to last character
   * @return alphabet over the range
   */
  public static Alphabet range(char from, char to) {
    if (from > to) {
      throw new IllegalArgumentException("Empty character range " + from + "-" + to);
    }
    final char[] chars = new char[to - from + 1];
    for (int i = 0; i < chars.length; i++) {
      chars[i] = (char) (from + i);
    }
    return new Alphabet(chars);
  }

  public int size() {
    return symbols.length;
  }

  public char symbolAt(int index) {
    return symbols[index];
  }

  /**
   * Index of a symbol.
   *
   * @param symbol character to look up
   * @return index of the symbol, or a negative number if it is not in the alphabet
   */
  public int indexOf(char symbol) {
    final int index = Arrays.binarySearch(symbols, symbol);
    return index < 0 ? -1 : index;
  }

  public boolean contains(char symbol) {
    return Arrays.binarySearch(symbols, symbol) >= 0;
  }

  /**
   * Check that another alphabet is the same as this one.
   *
   * @param other alphabet of the other operand
   * @throws AlphabetMismatchException if the alphabets differ
   */
  void requireSameAs(Alphabet other) {
    if (!equals(other)) {
      throw new AlphabetMismatchException(this, other);
    }
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(symbols);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Alphabet)) {
      return false;
    } else {
      return Arrays.equals(symbols, ((Alphabet) obj).symbols);
    }
  }

  @Override
  public String toString() {
    return "Alphabet(" + new String(symbols) + ")";
  }
}
