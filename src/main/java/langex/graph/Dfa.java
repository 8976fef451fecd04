package langex.graph;

import langex.FiniteAutomaton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalInt;

/**
 * Deterministic finite automaton over an {@link Alphabet}.
 *
 * <p>States are the dense integers {@code 0} to {@code stateCount() - 1}.
 * Transitions form a partial function: a missing transition is how the
 * automaton rejects, and is never materialized as a state unless the
 * automaton is explicitly {@linkplain #completed() completed}. An automaton
 * with no states has no initial state and accepts nothing, not even the
 * empty string.
 *
 * <p>Instances are not modified by any closure operation, so they can be
 * evaluated concurrently from many threads. The one exception is
 * {@link #clear()}, which must only be called on an automaton nobody else is
 * looking at.
 */
public final class Dfa implements FiniteAutomaton<Dfa> {

  /**
   * Marker used in transition tables for "no transition" and for the initial
   * state of an automaton with no states.
   */
  public static final int NO_STATE = -1;

  private final Alphabet alphabet;

  /**
   * State transitions, indexed first by state and then by symbol index in the
   * alphabet. Entries are either a target state or {@link #NO_STATE}.
   */
  private int[][] transitions;

  private int initialState;

  private BitSet accepting;

  // Trusted constructor: arguments are neither validated nor copied
  Dfa(Alphabet alphabet, int[][] transitions, int initialState, BitSet accepting) {
    this.alphabet = alphabet;
    this.transitions = transitions;
    this.initialState = initialState;
    this.accepting = accepting;
  }

  /**
   * Construct an automaton from explicit parts.
   *
   * @param alphabet symbols read by the automaton
   * @param transitions one row per state, one column per alphabet symbol, {@code NO_STATE} when undefined
   * @param initialState initial state ({@code NO_STATE} if and only if there are no states)
   * @param accepting one entry per state
   * @return validated automaton (the arrays are copied)
   * @throws MalformedAutomatonException if the parts are inconsistent
   */
  public static Dfa of(Alphabet alphabet, int[][] transitions, int initialState, boolean[] accepting) {
    final int stateCount = transitions.length;

    if (accepting.length != stateCount) {
      throw new MalformedAutomatonException(
        "Accepting vector has " + accepting.length + " entries but there are " + stateCount + " states"
      );
    }
    if (stateCount == 0 ? initialState != NO_STATE : (initialState < 0 || initialState >= stateCount)) {
      throw new MalformedAutomatonException(
        "Initial state " + initialState + " is out of range for " + stateCount + " states"
      );
    }

    final int[][] table = new int[stateCount][];
    final BitSet acceptingSet = new BitSet(stateCount);
    for (int state = 0; state < stateCount; state++) {
      final int[] row = transitions[state];
      if (row == null) {
        throw new MalformedAutomatonException("State " + state + " has no transition row");
      }
      if (row.length != alphabet.size()) {
        throw new MalformedAutomatonException(
          "State " + state + " has " + row.length + " transition slots but the alphabet has " + alphabet.size() + " symbols"
        );
      }
      for (int symbol = 0; symbol < row.length; symbol++) {
        final int target = row[symbol];
        if (target != NO_STATE && (target < 0 || target >= stateCount)) {
          throw new MalformedAutomatonException(
            "Transition from " + state + " on '" + alphabet.symbolAt(symbol) + "' targets missing state " + target
          );
        }
      }
      table[state] = row.clone();
      acceptingSet.set(state, accepting[state]);
    }

    return new Dfa(alphabet, table, initialState, acceptingSet);
  }

  /**
   * Automaton accepting only the empty string.
   *
   * @param alphabet symbols read by the automaton
   * @return one accepting state with no transitions
   */
  public static Dfa emptyString(Alphabet alphabet) {
    final var builder = new Builder(alphabet);
    final int state = builder.freshState();
    return builder.setInitial(state).setAccepting(state, true).build();
  }

  /**
   * Automaton accepting nothing at all.
   *
   * @param alphabet symbols read by the automaton
   * @return automaton with no states
   */
  public static Dfa emptyLanguage(Alphabet alphabet) {
    return new Dfa(alphabet, new int[0][], NO_STATE, new BitSet());
  }

  /**
   * Automaton accepting exactly one string.
   *
   * @param alphabet symbols read by the automaton
   * @param literal the accepted string
   * @return chain of {@code literal.length() + 1} states
   * @throws IllegalArgumentException if the literal uses symbols outside the alphabet
   */
  public static Dfa literal(Alphabet alphabet, CharSequence literal) {
    final var builder = new Builder(alphabet);
    int state = builder.freshState();
    builder.setInitial(state);
    for (int i = 0; i < literal.length(); i++) {
      final int next = builder.freshState();
      builder.addTransition(state, literal.charAt(i), next);
      state = next;
    }
    return builder.setAccepting(state, true).build();
  }

  /**
   * Automaton accepting any one of the given symbols.
   *
   * @param alphabet symbols read by the automaton
   * @param symbols symbols each accepted as a one-character string
   * @return two state automaton
   * @throws IllegalArgumentException if a symbol is outside the alphabet
   */
  public static Dfa anyOf(Alphabet alphabet, CharSequence symbols) {
    final var builder = new Builder(alphabet);
    final int from = builder.freshState();
    final int to = builder.freshState();
    for (int i = 0; i < symbols.length(); i++) {
      builder.addTransition(from, symbols.charAt(i), to);
    }
    return builder.setInitial(from).setAccepting(to, true).build();
  }

  public Alphabet alphabet() {
    return alphabet;
  }

  public int stateCount() {
    return transitions.length;
  }

  /**
   * Initial state.
   *
   * @return initial state, or nothing if the automaton has no states
   */
  public OptionalInt initialState() {
    return transitions.length == 0 ? OptionalInt.empty() : OptionalInt.of(initialState);
  }

  public boolean isAccepting(int state) {
    checkState(state);
    return accepting.get(state);
  }

  /**
   * Take a single step.
   *
   * @param state state to step from
   * @param symbol symbol to consume
   * @return target state, or nothing if there is no such transition
   */
  public OptionalInt step(int state, char symbol) {
    checkState(state);
    final int symbolIndex = alphabet.indexOf(symbol);
    if (symbolIndex < 0) {
      return OptionalInt.empty();
    }
    final int target = transitions[state][symbolIndex];
    return target == NO_STATE ? OptionalInt.empty() : OptionalInt.of(target);
  }

  /**
   * Run the automaton over a whole input.
   *
   * <p>Reading stops at the first symbol with no transition: the input is
   * then rejected without looking at the rest of it.
   *
   * @param input symbols to consume
   * @return whether all input was consumed and the last state is accepting
   */
  @Override
  public boolean evaluate(CharSequence input) {
    if (transitions.length == 0) {
      return false;
    }

    int state = initialState;
    for (int i = 0; i < input.length(); i++) {
      final int symbolIndex = alphabet.indexOf(input.charAt(i));
      if (symbolIndex < 0) {
        return false;
      }
      state = transitions[state][symbolIndex];
      if (state == NO_STATE) {
        return false;
      }
    }
    return accepting.get(state);
  }

  /**
   * Reset this automaton, in place, to the automaton with no states.
   */
  public void clear() {
    transitions = new int[0][];
    initialState = NO_STATE;
    accepting = new BitSet();
  }

  /**
   * Check whether every state has a transition on every symbol.
   *
   * @return true if the transition function is total (false if there are no states)
   */
  public boolean isComplete() {
    if (transitions.length == 0) {
      return false;
    }
    for (int[] row : transitions) {
      for (int target : row) {
        if (target == NO_STATE) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Check whether the automaton accepts no strings at all.
   *
   * @return true if no accepting state is reachable from the initial state
   */
  public boolean isEmpty() {
    return reachableStates().stream().noneMatch(accepting::get);
  }

  /**
   * Equivalent automaton whose transition function is total.
   *
   * <p>If some transitions are missing, one extra non-accepting state is added
   * and every missing transition (including those out of the new state) is
   * routed to it. An automaton with no states completes to that single state.
   *
   * @return complete automaton for the same language
   */
  public Dfa completed() {
    return completed(ConstructionLimits.DEFAULT);
  }

  public Dfa completed(ConstructionLimits limits) {
    final int stateCount = transitions.length;
    final boolean complete = isComplete();
    final int totalStates = complete ? stateCount : stateCount + 1;
    limits.check("completion", totalStates);

    final int rejectState = stateCount;
    final int[][] table = new int[totalStates][];
    for (int state = 0; state < stateCount; state++) {
      final int[] row = transitions[state].clone();
      for (int symbol = 0; symbol < row.length; symbol++) {
        if (row[symbol] == NO_STATE) {
          row[symbol] = rejectState;
        }
      }
      table[state] = row;
    }
    if (!complete) {
      final int[] row = new int[alphabet.size()];
      Arrays.fill(row, rejectState);
      table[rejectState] = row;
    }

    return new Dfa(
      alphabet,
      table,
      stateCount == 0 ? rejectState : initialState,
      (BitSet) accepting.clone()
    );
  }

  /**
   * Equivalent automaton without states unreachable from the initial state.
   *
   * <p>Surviving states are renumbered in breadth-first order from the
   * initial state, visiting symbols in alphabet order.
   *
   * @return trimmed automaton for the same language
   */
  public Dfa withoutUnreachableStates() {
    final List<Integer> order = reachableStates();
    final int[] renumbered = new int[transitions.length];
    Arrays.fill(renumbered, NO_STATE);
    for (int i = 0; i < order.size(); i++) {
      renumbered[order.get(i)] = i;
    }

    final int[][] table = new int[order.size()][];
    final BitSet acceptingSet = new BitSet(order.size());
    for (int i = 0; i < order.size(); i++) {
      final int[] oldRow = transitions[order.get(i)];
      final int[] row = new int[oldRow.length];
      for (int symbol = 0; symbol < row.length; symbol++) {
        row[symbol] = oldRow[symbol] == NO_STATE ? NO_STATE : renumbered[oldRow[symbol]];
      }
      table[i] = row;
      acceptingSet.set(i, accepting.get(order.get(i)));
    }

    return new Dfa(alphabet, table, order.isEmpty() ? NO_STATE : 0, acceptingSet);
  }

  /**
   * States reachable from the initial state in breadth-first order.
   */
  List<Integer> reachableStates() {
    final var order = new ArrayList<Integer>();
    if (transitions.length == 0) {
      return order;
    }

    final var seen = new BitSet(transitions.length);
    final var toVisit = new ArrayDeque<Integer>();
    seen.set(initialState);
    toVisit.add(initialState);

    while (!toVisit.isEmpty()) {
      final int state = toVisit.poll();
      order.add(state);
      for (int target : transitions[state]) {
        if (target != NO_STATE && !seen.get(target)) {
          seen.set(target);
          toVisit.add(target);
        }
      }
    }
    return order;
  }

  /**
   * Decide whether another automaton recognizes the same language.
   *
   * @param other automaton over the same alphabet
   * @return whether the symmetric difference of the two languages is empty
   */
  public boolean equivalentTo(Dfa other) {
    alphabet.requireSameAs(other.alphabet);
    return intersection(other.complement()).isEmpty() && other.intersection(complement()).isEmpty();
  }

  @Override
  public Dfa intersection(Dfa other) {
    return ProductConstruction.intersection(this, other, ConstructionLimits.DEFAULT);
  }

  public Dfa intersection(Dfa other, ConstructionLimits limits) {
    return ProductConstruction.intersection(this, other, limits);
  }

  @Override
  public Dfa union(Dfa other) {
    return ProductConstruction.union(this, other, ConstructionLimits.DEFAULT);
  }

  public Dfa union(Dfa other, ConstructionLimits limits) {
    return ProductConstruction.union(this, other, limits);
  }

  @Override
  public Dfa concatenate(Dfa other) {
    return SequentialConstruction.concatenate(this, other, ConstructionLimits.DEFAULT);
  }

  public Dfa concatenate(Dfa other, ConstructionLimits limits) {
    return SequentialConstruction.concatenate(this, other, limits);
  }

  @Override
  public Dfa kleeneStar() {
    return SequentialConstruction.kleeneStar(this, ConstructionLimits.DEFAULT);
  }

  public Dfa kleeneStar(ConstructionLimits limits) {
    return SequentialConstruction.kleeneStar(this, limits);
  }

  /**
   * Automaton for the strings over the alphabet that this one rejects.
   *
   * <p>The automaton is {@linkplain #completed() completed} before acceptance
   * is flipped, so strings that would fall off a missing transition end up in
   * the (accepting) added state. Strings using symbols outside the alphabet
   * are rejected by both this automaton and its complement.
   *
   * @return complement automaton
   */
  @Override
  public Dfa complement() {
    return complement(ConstructionLimits.DEFAULT);
  }

  public Dfa complement(ConstructionLimits limits) {
    final Dfa complete = completed(limits);
    complete.accepting.flip(0, complete.stateCount());
    return complete;
  }

  @Override
  public Dfa minimize() {
    return Minimizer.minimize(this);
  }

  /**
   * Transition target by symbol index.
   *
   * @return target state or {@link #NO_STATE}
   */
  int target(int state, int symbolIndex) {
    return transitions[state][symbolIndex];
  }

  int initial() {
    return initialState;
  }

  boolean accepts(int state) {
    return accepting.get(state);
  }

  private void checkState(int state) {
    if (state < 0 || state >= transitions.length) {
      throw new IndexOutOfBoundsException("State " + state + " is out of range for " + transitions.length + " states");
    }
  }

  @Override
  public int hashCode() {
    return 31 * (31 * (31 * alphabet.hashCode() + Arrays.deepHashCode(transitions)) + initialState)
      + accepting.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Dfa)) {
      return false;
    } else {
      final Dfa other = (Dfa) obj;
      return alphabet.equals(other.alphabet)
        && initialState == other.initialState
        && accepting.equals(other.accepting)
        && Arrays.deepEquals(transitions, other.transitions);
    }
  }

  @Override
  public String toString() {
    return "Dfa(states = " + transitions.length
      + ", initial = " + initialState
      + ", accepting = " + accepting
      + ", " + alphabet + ")";
  }

  /**
   * Incremental construction of an automaton, one fresh state at a time.
   */
  public static final class Builder {

    private final Alphabet alphabet;
    private final ConstructionLimits limits;
    private final String construction;

    private boolean used = false;
    private final ArrayList<int[]> rows = new ArrayList<>();
    private final BitSet accepting = new BitSet();
    private int initialState = NO_STATE;

    public Builder(Alphabet alphabet) {
      this(alphabet, ConstructionLimits.DEFAULT, "construction");
    }

    /**
     * @param alphabet symbols read by the automaton
     * @param limits ceiling checked on every fresh state
     * @param construction name of what is being built (for error messages)
     */
    public Builder(Alphabet alphabet, ConstructionLimits limits, String construction) {
      this.alphabet = alphabet;
      this.limits = limits;
      this.construction = construction;
    }

    /**
     * Allocate a new state with no transitions, not accepting.
     *
     * @return identifier of the new state
     * @throws StateLimitExceededException if this would exceed the limits
     */
    public int freshState() {
      checkUnused();
      limits.check(construction, rows.size() + 1L);
      final int[] row = new int[alphabet.size()];
      Arrays.fill(row, NO_STATE);
      rows.add(row);
      return rows.size() - 1;
    }

    public int stateCount() {
      return rows.size();
    }

    public Builder addTransition(int from, char symbol, int to) {
      final int symbolIndex = alphabet.indexOf(symbol);
      if (symbolIndex < 0) {
        throw new IllegalArgumentException("Symbol '" + symbol + "' is not in " + alphabet);
      }
      return setTransition(from, symbolIndex, to);
    }

    Builder setTransition(int from, int symbolIndex, int to) {
      checkUnused();
      checkAllocated(from);
      checkAllocated(to);
      rows.get(from)[symbolIndex] = to;
      return this;
    }

    public Builder setInitial(int state) {
      checkUnused();
      checkAllocated(state);
      initialState = state;
      return this;
    }

    public Builder setAccepting(int state, boolean isAccepting) {
      checkUnused();
      checkAllocated(state);
      accepting.set(state, isAccepting);
      return this;
    }

    /**
     * Finalize the automaton.
     *
     * @return automaton with all of the states allocated so far
     * @throws MalformedAutomatonException if states exist but no initial state was set
     */
    public Dfa build() {
      checkUnused();
      used = true;

      if (!rows.isEmpty() && initialState == NO_STATE) {
        throw new MalformedAutomatonException("Automaton with " + rows.size() + " states has no initial state");
      }

      // The automaton gets its own copies so it is unaffected by the builder
      final int[][] table = new int[rows.size()][];
      for (int state = 0; state < table.length; state++) {
        table[state] = rows.get(state).clone();
      }
      return new Dfa(alphabet, table, initialState, (BitSet) accepting.clone());
    }

    private void checkUnused() {
      if (used) {
        throw new IllegalStateException("DFA builder has already built its automaton");
      }
    }

    private void checkAllocated(int state) {
      if (state < 0 || state >= rows.size()) {
        throw new MalformedAutomatonException("State " + state + " has not been allocated");
      }
    }
  }
}
