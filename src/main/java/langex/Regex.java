package langex;

import java.util.List;

/**
 * Regular expression backed by a finite automaton.
 *
 * <p>The regex only ever talks to its automaton through
 * {@link FiniteAutomaton}, so any implementation of it can be plugged in.
 * Like the automata underneath, regexes are immutable: every combinator
 * returns a fresh regex.
 *
 * @param <A> automaton implementation
 */
public final class Regex<A extends FiniteAutomaton<A>> {

  private final A automaton;

  public Regex(A automaton) {
    this.automaton = automaton;
  }

  /**
   * Fold an operator tree into a single automaton.
   *
   * @param expression operator tree with automata at its leaves
   * @return regex for the whole tree
   */
  public static <A extends FiniteAutomaton<A>> Regex<A> compile(Expression<A> expression) {
    return new Regex<>(construct(expression));
  }

  private static <A extends FiniteAutomaton<A>> A construct(Expression<A> expression) {
    if (expression instanceof Expression.Leaf<A> leaf) {
      return leaf.automaton();
    } else if (expression instanceof Expression.Concatenation<A> concatenation) {
      return fold(concatenation.operands(), Operator.CONCATENATE);
    } else if (expression instanceof Expression.Alternation<A> alternation) {
      return fold(alternation.operands(), Operator.UNION);
    } else if (expression instanceof Expression.Intersection<A> intersection) {
      return fold(intersection.operands(), Operator.INTERSECTION);
    } else if (expression instanceof Expression.Star<A> star) {
      return construct(star.operand()).kleeneStar();
    } else if (expression instanceof Expression.Plus<A> plus) {
      final A operand = construct(plus.operand());
      return operand.concatenate(operand.kleeneStar());
    } else if (expression instanceof Expression.ZeroOrOne<A> zeroOrOne) {
      return construct(zeroOrOne.operand()).union(zeroOrOne.emptyString());
    } else if (expression instanceof Expression.Complement<A> complement) {
      return construct(complement.operand()).complement();
    } else {
      throw new IllegalArgumentException("Unknown expression " + expression);
    }
  }

  private enum Operator { CONCATENATE, UNION, INTERSECTION }

  private static <A extends FiniteAutomaton<A>> A fold(List<Expression<A>> operands, Operator operator) {
    A result = construct(operands.get(0));
    for (Expression<A> operand : operands.subList(1, operands.size())) {
      result = combine(result, construct(operand), operator);
    }
    return result;
  }

  private static <A extends FiniteAutomaton<A>> A combine(A left, A right, Operator operator) {
    switch (operator) {
      case CONCATENATE:
        return left.concatenate(right);
      case UNION:
        return left.union(right);
      case INTERSECTION:
        return left.intersection(right);
      default:
        throw new IllegalArgumentException("Unknown operator " + operator);
    }
  }

  /**
   * Check whether the whole text matches.
   *
   * @param text input to match
   * @return whether the underlying automaton accepts the text
   */
  public boolean match(CharSequence text) {
    return automaton.evaluate(text);
  }

  /**
   * Regex matching this one followed by each of the others in turn.
   *
   * @param others regexes to append
   * @return concatenated regex
   */
  @SafeVarargs
  public final Regex<A> concatenate(Regex<A>... others) {
    A result = automaton;
    for (Regex<A> other : others) {
      result = result.concatenate(other.automaton);
    }
    return new Regex<>(result);
  }

  /**
   * Regex matching this one or any of the others.
   *
   * @param others alternatives
   * @return union regex
   */
  @SafeVarargs
  public final Regex<A> unionOr(Regex<A>... others) {
    A result = automaton;
    for (Regex<A> other : others) {
      result = result.union(other.automaton);
    }
    return new Regex<>(result);
  }

  /**
   * Regex matching what this one and all of the others match.
   *
   * @param others conjuncts
   * @return intersection regex
   */
  @SafeVarargs
  public final Regex<A> intersection(Regex<A>... others) {
    A result = automaton;
    for (Regex<A> other : others) {
      result = result.intersection(other.automaton);
    }
    return new Regex<>(result);
  }

  public Regex<A> kleeneStar() {
    return new Regex<>(automaton.kleeneStar());
  }

  public Regex<A> complement() {
    return new Regex<>(automaton.complement());
  }

  /**
   * Same regex over a minimal automaton.
   *
   * @return regex whose automaton has the fewest possible states
   */
  public Regex<A> minimized() {
    return new Regex<>(automaton.minimize());
  }

  public A automaton() {
    return automaton;
  }

  @Override
  public String toString() {
    return "Regex(" + automaton + ")";
  }
}
