package langex.codegen;

/**
 * Whole-input matcher generated from an automaton.
 */
public interface CompiledMatcher {

  /**
   * Check whether the automaton the matcher was generated from accepts an input.
   *
   * @param input string to match in its entirety
   * @return whether the input is accepted
   */
  boolean matches(CharSequence input);
}
