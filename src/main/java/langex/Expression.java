package langex;

import java.util.List;

/**
 * Operator tree of a regular expression whose leaves are already automata.
 *
 * <p>Producing this tree from pattern syntax is the parser's job. Folding it
 * into a single automaton is {@link Regex#compile(Expression)}'s.
 *
 * @param <A> automaton type at the leaves
 */
public interface Expression<A extends FiniteAutomaton<A>> {

  /**
   * Expression matching exactly what an automaton accepts.
   *
   * @param automaton automaton for the leaf
   */
  record Leaf<A extends FiniteAutomaton<A>>(A automaton) implements Expression<A> { }

  /**
   * Expression matching its operands one after another.
   *
   * @param operands sub-expressions, in order (at least one)
   */
  record Concatenation<A extends FiniteAutomaton<A>>(List<Expression<A>> operands) implements Expression<A> {
    public Concatenation {
      operands = List.copyOf(operands);
      if (operands.isEmpty()) {
        throw new IllegalArgumentException("Concatenation needs at least one operand");
      }
    }
  }

  /**
   * Expression matching any one of its operands.
   *
   * @param operands alternatives (at least one)
   */
  record Alternation<A extends FiniteAutomaton<A>>(List<Expression<A>> operands) implements Expression<A> {
    public Alternation {
      operands = List.copyOf(operands);
      if (operands.isEmpty()) {
        throw new IllegalArgumentException("Alternation needs at least one operand");
      }
    }
  }

  /**
   * Expression matching what all of its operands match.
   *
   * @param operands conjuncts (at least one)
   */
  record Intersection<A extends FiniteAutomaton<A>>(List<Expression<A>> operands) implements Expression<A> {
    public Intersection {
      operands = List.copyOf(operands);
      if (operands.isEmpty()) {
        throw new IllegalArgumentException("Intersection needs at least one operand");
      }
    }
  }

  /**
   * Expression matching zero or more repetitions of its operand.
   */
  record Star<A extends FiniteAutomaton<A>>(Expression<A> operand) implements Expression<A> { }

  /**
   * Expression matching one or more repetitions of its operand.
   */
  record Plus<A extends FiniteAutomaton<A>>(Expression<A> operand) implements Expression<A> { }

  /**
   * Expression matching its operand or the empty string.
   *
   * @param operand optional sub-expression
   * @param emptyString automaton accepting only the empty string
   */
  record ZeroOrOne<A extends FiniteAutomaton<A>>(Expression<A> operand, A emptyString) implements Expression<A> { }

  /**
   * Expression matching every string over the alphabet its operand doesn't.
   */
  record Complement<A extends FiniteAutomaton<A>>(Expression<A> operand) implements Expression<A> { }

  @SafeVarargs
  static <A extends FiniteAutomaton<A>> Expression<A> concatenation(Expression<A>... operands) {
    return new Concatenation<>(List.of(operands));
  }

  @SafeVarargs
  static <A extends FiniteAutomaton<A>> Expression<A> alternation(Expression<A>... operands) {
    return new Alternation<>(List.of(operands));
  }

  @SafeVarargs
  static <A extends FiniteAutomaton<A>> Expression<A> intersection(Expression<A>... operands) {
    return new Intersection<>(List.of(operands));
  }

  static <A extends FiniteAutomaton<A>> Expression<A> leaf(A automaton) {
    return new Leaf<>(automaton);
  }
}
