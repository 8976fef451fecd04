package langex.graph;

import java.util.BitSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cartesian product of two automata, used for intersection and union.
 *
 * <p>Given {@code M1 = (Q1, d1, q1, F1)} and {@code M2 = (Q2, d2, q2, F2)},
 * the product has states {@code Q1 x Q2}, with the pair {@code (a, b)}
 * flattened to {@code a * |Q2| + b}. The transition on {@code c} out of
 * {@code (a, b)} is {@code (d1(a, c), d2(b, c))} when both components are
 * defined and is missing otherwise. The initial state is {@code (q1, q2)}.
 * Intersection and union share that transition table and differ only in
 * which pairs accept.
 *
 * <p>Unreachable pairs are kept: pruning them is
 * {@link Dfa#withoutUnreachableStates()}'s job.
 */
public final class ProductConstruction {

  private static final Logger logger = LoggerFactory.getLogger(ProductConstruction.class);

  private ProductConstruction() { }

  /**
   * Product automaton accepting {@code (a, b)} iff {@code a} and {@code b}
   * both accept.
   *
   * @param m1 first operand
   * @param m2 second operand, over the same alphabet
   * @param limits ceiling on the number of product states
   * @return automaton for {@code L(m1) ∩ L(m2)}
   */
  public static Dfa intersection(Dfa m1, Dfa m2, ConstructionLimits limits) {
    m1.alphabet().requireSameAs(m2.alphabet());
    final int s1 = m1.stateCount();
    final int s2 = m2.stateCount();
    limits.check("intersection", (long) s1 * s2);

    final BitSet accepting = new BitSet(s1 * s2);
    for (int a = nextAccepting(m1, 0); a >= 0; a = nextAccepting(m1, a + 1)) {
      for (int b = nextAccepting(m2, 0); b >= 0; b = nextAccepting(m2, b + 1)) {
        accepting.set(flatten(a, b, s2));
      }
    }

    final Dfa product = product(m1, m2, accepting);
    logger.debug("intersection: {} x {} states -> {} states", s1, s2, product.stateCount());
    return product;
  }

  /**
   * Product automaton accepting {@code (a, b)} iff {@code a} or {@code b}
   * accepts.
   *
   * <p>The shared transition rule drops any pair where one side is stuck, so
   * both operands are first {@linkplain Dfa#completed() completed}: a side
   * that can no longer accept then sits in its reject state while the other
   * side keeps running. No special transitions are added for the union.
   *
   * @param m1 first operand
   * @param m2 second operand, over the same alphabet
   * @param limits ceiling on the number of product states
   * @return automaton for {@code L(m1) ∪ L(m2)}
   */
  public static Dfa union(Dfa m1, Dfa m2, ConstructionLimits limits) {
    m1.alphabet().requireSameAs(m2.alphabet());

    // Pre-check with the pessimistic count so completion itself can't blow up
    final long completedCount = (long) completedStateCount(m1) * completedStateCount(m2);
    limits.check("union", completedCount);

    final Dfa c1 = m1.completed(limits);
    final Dfa c2 = m2.completed(limits);
    final int s1 = c1.stateCount();
    final int s2 = c2.stateCount();

    // (a, j) for every accepting a, then (i, b) for every accepting b
    final BitSet accepting = new BitSet(s1 * s2);
    for (int a = nextAccepting(c1, 0); a >= 0; a = nextAccepting(c1, a + 1)) {
      for (int j = 0; j < s2; j++) {
        accepting.set(flatten(a, j, s2));
      }
    }
    for (int b = nextAccepting(c2, 0); b >= 0; b = nextAccepting(c2, b + 1)) {
      for (int i = 0; i < s1; i++) {
        accepting.set(flatten(i, b, s2));
      }
    }

    final Dfa product = product(c1, c2, accepting);
    logger.debug(
      "union: {} x {} states (completed to {} x {}) -> {} states",
      m1.stateCount(),
      m2.stateCount(),
      s1,
      s2,
      product.stateCount()
    );
    return product;
  }

  /**
   * Shared transition table and initial state of the product.
   */
  private static Dfa product(Dfa m1, Dfa m2, BitSet accepting) {
    final int s1 = m1.stateCount();
    final int s2 = m2.stateCount();
    final int symbols = m1.alphabet().size();

    final int[][] table = new int[s1 * s2][symbols];
    for (int a = 0; a < s1; a++) {
      for (int b = 0; b < s2; b++) {
        final int[] row = table[flatten(a, b, s2)];
        for (int symbol = 0; symbol < symbols; symbol++) {
          final int aNext = m1.target(a, symbol);
          final int bNext = m2.target(b, symbol);
          row[symbol] = (aNext == Dfa.NO_STATE || bNext == Dfa.NO_STATE)
            ? Dfa.NO_STATE
            : flatten(aNext, bNext, s2);
        }
      }
    }

    final int initial = (s1 == 0 || s2 == 0)
      ? Dfa.NO_STATE
      : flatten(m1.initial(), m2.initial(), s2);
    return new Dfa(m1.alphabet(), table, initial, accepting);
  }

  private static int flatten(int a, int b, int s2) {
    return a * s2 + b;
  }

  private static int nextAccepting(Dfa dfa, int from) {
    for (int state = from; state < dfa.stateCount(); state++) {
      if (dfa.accepts(state)) {
        return state;
      }
    }
    return -1;
  }

  private static int completedStateCount(Dfa dfa) {
    return dfa.isComplete() ? dfa.stateCount() : dfa.stateCount() + 1;
  }
}
