package langex;

/**
 * Finite automaton recognizing a regular language, closed under the usual
 * language operations.
 *
 * <p>Every operation returns a new automaton and leaves its operands
 * untouched. Binary operations require both operands to read the same
 * alphabet.
 *
 * @param <A> concrete automaton type, so that operations stay within it
 */
public interface FiniteAutomaton<A extends FiniteAutomaton<A>> {

  /**
   * Run the automaton over a whole input.
   *
   * @param input symbols to feed to the automaton
   * @return whether all of the input was consumed and ended in an accepting state
   */
  boolean evaluate(CharSequence input);

  /**
   * Automaton for strings accepted by both this and the other automaton.
   *
   * @param other automaton over the same alphabet
   * @return intersection automaton
   */
  A intersection(A other);

  /**
   * Automaton for strings accepted by this or the other automaton.
   *
   * @param other automaton over the same alphabet
   * @return union automaton
   */
  A union(A other);

  /**
   * Automaton for strings that split into a string accepted by this
   * automaton followed by a string accepted by the other.
   *
   * @param other automaton over the same alphabet
   * @return concatenation automaton
   */
  A concatenate(A other);

  /**
   * Automaton for zero or more repetitions of strings accepted by this one.
   *
   * @return Kleene star automaton
   */
  A kleeneStar();

  /**
   * Automaton for strings over the alphabet that this one rejects.
   *
   * @return complement automaton
   */
  A complement();

  /**
   * Equivalent automaton with the fewest possible states.
   *
   * @return minimal automaton for the same language
   */
  A minimize();
}
