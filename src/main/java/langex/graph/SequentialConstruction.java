package langex.graph;

import langex.util.IntSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Stack;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concatenation and Kleene star.
 *
 * <p>Neither operation is expressible as a product of deterministic
 * automata: after a prefix that the first automaton accepts, the input may
 * either keep going in the first automaton or hand off to the second (or, for
 * the star, restart). Both constructions therefore track the set of states
 * that might currently be active and determinize on the fly, in the manner
 * of a powerset construction. Only composite states reachable from the
 * initial one are ever created, but the number of those can still be
 * exponential in the size of the operands.
 */
public final class SequentialConstruction {

  private static final Logger logger = LoggerFactory.getLogger(SequentialConstruction.class);

  private SequentialConstruction() { }

  /**
   * Automaton for {@code L(m1) L(m2)}.
   *
   * <p>Composite states are a state of {@code m1} (or {@link Dfa#NO_STATE}
   * once {@code m1} is stuck) paired with the set of active {@code m2} states.
   * Every time {@code m1} enters an accepting state, {@code m2}'s initial
   * state joins the active set. A composite accepts when one of its active
   * {@code m2} states does.
   *
   * @param m1 automaton for the prefix
   * @param m2 automaton for the suffix, over the same alphabet
   * @param limits ceiling on the number of composite states
   * @return concatenation automaton
   */
  public static Dfa concatenate(Dfa m1, Dfa m2, ConstructionLimits limits) {
    final Alphabet alphabet = m1.alphabet();
    alphabet.requireSameAs(m2.alphabet());
    if (m1.stateCount() == 0 || m2.stateCount() == 0) {
      return Dfa.emptyLanguage(alphabet);
    }

    record Composite(int first, IntSet second) { }

    final int initial2 = m2.initial();
    final var interner = new Interner<Composite>(
      new Dfa.Builder(alphabet, limits, "concatenation"),
      composite -> composite.second().stream().anyMatch(m2::accepts)
    );

    {
      final int initial1 = m1.initial();
      final var initial = new Composite(initial1, m1.accepts(initial1) ? IntSet.of(initial2) : IntSet.EMPTY);
      interner.builder.setInitial(interner.idOf(initial));
    }

    while (!interner.toVisit.isEmpty()) {
      final Composite composite = interner.toVisit.pop();
      final int from = interner.ids.get(composite);

      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final int first = composite.first() == Dfa.NO_STATE
          ? Dfa.NO_STATE
          : m1.target(composite.first(), symbol);
        IntSet second = step(m2, composite.second(), symbol);
        if (first != Dfa.NO_STATE && m1.accepts(first)) {
          second = second.with(initial2);
        }

        // Both sides stuck: leave the transition undefined
        if (first == Dfa.NO_STATE && second.isEmpty()) {
          continue;
        }

        interner.builder.setTransition(from, symbol, interner.idOf(new Composite(first, second)));
      }
    }

    final Dfa result = interner.builder.build();
    logger.debug(
      "concatenation: {} . {} states -> {} states",
      m1.stateCount(),
      m2.stateCount(),
      result.stateCount()
    );
    return result;
  }

  /**
   * Automaton for {@code L(m)*}.
   *
   * <p>Composite states are sets of active {@code m} states. Whenever a step
   * reaches an accepting state, {@code m}'s initial state joins the set so
   * that another repetition may begin. The initial composite accepts (zero
   * repetitions) and is kept apart from the composite {@code {initial}}: the
   * latter is only reached by running {@code m} back to its initial state,
   * which does not by itself complete a repetition.
   *
   * @param m automaton for one repetition
   * @param limits ceiling on the number of composite states
   * @return Kleene star automaton
   */
  public static Dfa kleeneStar(Dfa m, ConstructionLimits limits) {
    final Alphabet alphabet = m.alphabet();
    if (m.stateCount() == 0) {
      return Dfa.emptyString(alphabet);
    }

    final int restart = m.initial();
    final var interner = new Interner<IntSet>(
      new Dfa.Builder(alphabet, limits, "Kleene star"),
      active -> active.stream().anyMatch(m::accepts)
    );

    final int initialId = interner.builder.freshState();
    interner.builder.setInitial(initialId).setAccepting(initialId, true);
    starTransitions(m, restart, interner, IntSet.of(restart), initialId);

    while (!interner.toVisit.isEmpty()) {
      final IntSet active = interner.toVisit.pop();
      starTransitions(m, restart, interner, active, interner.ids.get(active));
    }

    final Dfa result = interner.builder.build();
    logger.debug("Kleene star: {} states -> {} states", m.stateCount(), result.stateCount());
    return result;
  }

  private static void starTransitions(
    Dfa m,
    int restart,
    Interner<IntSet> interner,
    IntSet active,
    int from
  ) {
    for (int symbol = 0; symbol < m.alphabet().size(); symbol++) {
      IntSet next = step(m, active, symbol);
      if (next.isEmpty()) {
        continue;
      }
      if (next.stream().anyMatch(m::accepts)) {
        next = next.with(restart);
      }
      interner.builder.setTransition(from, symbol, interner.idOf(next));
    }
  }

  /**
   * Step every active state on a symbol, dropping those that get stuck.
   */
  private static IntSet step(Dfa dfa, IntSet active, int symbol) {
    return IntSet.of(
      active
        .stream()
        .map(state -> dfa.target(state, symbol))
        .filter(state -> state != Dfa.NO_STATE)
        .toArray()
    );
  }

  /**
   * Assigns dense state identifiers to composite keys in discovery order.
   *
   * @param <K> composite state key
   */
  private static final class Interner<K> {
    final Dfa.Builder builder;
    final Predicate<K> accepting;
    final Map<K, Integer> ids = new HashMap<>();
    final Stack<K> toVisit = new Stack<>();

    Interner(Dfa.Builder builder, Predicate<K> accepting) {
      this.builder = builder;
      this.accepting = accepting;
    }

    /**
     * Look up the state for a key, allocating (and scheduling a visit to) a
     * fresh one the first time the key is seen.
     */
    int idOf(K key) {
      final Integer existing = ids.get(key);
      if (existing != null) {
        return existing;
      }
      final int id = builder.freshState();
      builder.setAccepting(id, accepting.test(key));
      ids.put(key, id);
      toVisit.push(key);
      return id;
    }
  }
}
