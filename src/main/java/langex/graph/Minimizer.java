package langex.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Myhill-Nerode minimization.
 *
 * <p>Two states are merged when no suffix distinguishes them. Before the
 * partition is refined, unreachable states are dropped and so are dead states
 * (from which no accepting state can be reached): transitions into a dead
 * state become missing transitions, which reject in exactly the same way.
 * With both gone, the missing transition is the one and only representative
 * of the dead class and the result is the minimal partial automaton.
 *
 * <p>The output is numbered breadth-first from its initial state, visiting
 * symbols in alphabet order. Minimizing is therefore a canonical form: two
 * automata over one alphabet recognize the same language exactly when their
 * minimized forms are equal.
 */
public final class Minimizer {

  private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

  private Minimizer() { }

  /**
   * Minimize an automaton.
   *
   * @param dfa automaton to minimize
   * @return minimal automaton for the same language (no states if the language is empty)
   */
  public static Dfa minimize(Dfa dfa) {
    final Dfa trimmed = withoutDeadStates(dfa.withoutUnreachableStates());
    if (trimmed.stateCount() == 0) {
      logger.debug("minimization: {} states -> empty language", dfa.stateCount());
      return Dfa.emptyLanguage(dfa.alphabet());
    }

    // Mapping from states that should be collapsed to the block they belong to
    final List<SortedSet<Integer>> blocks = new ArrayList<>(partition(trimmed));
    final int[] blockOf = new int[trimmed.stateCount()];
    for (int block = 0; block < blocks.size(); block++) {
      for (int state : blocks.get(block)) {
        blockOf[state] = block;
      }
    }

    // Number the blocks breadth-first from the initial block
    final int symbols = trimmed.alphabet().size();
    final int[] blockNumber = new int[blocks.size()];
    Arrays.fill(blockNumber, Dfa.NO_STATE);
    final var order = new ArrayList<Integer>();
    final var toVisit = new ArrayDeque<Integer>();
    blockNumber[blockOf[trimmed.initial()]] = 0;
    toVisit.add(blockOf[trimmed.initial()]);
    while (!toVisit.isEmpty()) {
      final int block = toVisit.poll();
      order.add(block);
      final int representative = blocks.get(block).first();
      for (int symbol = 0; symbol < symbols; symbol++) {
        final int target = trimmed.target(representative, symbol);
        if (target != Dfa.NO_STATE && blockNumber[blockOf[target]] == Dfa.NO_STATE) {
          blockNumber[blockOf[target]] = order.size() + toVisit.size();
          toVisit.add(blockOf[target]);
        }
      }
    }

    final int[][] table = new int[order.size()][symbols];
    final BitSet accepting = new BitSet(order.size());
    for (int i = 0; i < order.size(); i++) {
      final int representative = blocks.get(order.get(i)).first();
      for (int symbol = 0; symbol < symbols; symbol++) {
        final int target = trimmed.target(representative, symbol);
        table[i][symbol] = target == Dfa.NO_STATE ? Dfa.NO_STATE : blockNumber[blockOf[target]];
      }
      accepting.set(i, trimmed.accepts(representative));
    }

    logger.debug("minimization: {} states -> {} states", dfa.stateCount(), order.size());
    return new Dfa(trimmed.alphabet(), table, 0, accepting);
  }

  /**
   * Drop states from which no accepting state is reachable.
   *
   * @param dfa automaton whose states are all reachable
   * @return automaton with only live states (none if the initial state is dead)
   */
  static Dfa withoutDeadStates(Dfa dfa) {
    final int stateCount = dfa.stateCount();
    final int symbols = dfa.alphabet().size();

    // Reversed edges, ignoring symbols
    final List<List<Integer>> predecessors = new ArrayList<>(stateCount);
    for (int state = 0; state < stateCount; state++) {
      predecessors.add(new ArrayList<>());
    }
    for (int state = 0; state < stateCount; state++) {
      for (int symbol = 0; symbol < symbols; symbol++) {
        final int target = dfa.target(state, symbol);
        if (target != Dfa.NO_STATE) {
          predecessors.get(target).add(state);
        }
      }
    }

    final var live = new BitSet(stateCount);
    final var toVisit = new ArrayDeque<Integer>();
    for (int state = 0; state < stateCount; state++) {
      if (dfa.accepts(state)) {
        live.set(state);
        toVisit.add(state);
      }
    }
    while (!toVisit.isEmpty()) {
      for (int predecessor : predecessors.get(toVisit.poll())) {
        if (!live.get(predecessor)) {
          live.set(predecessor);
          toVisit.add(predecessor);
        }
      }
    }

    if (stateCount == 0 || !live.get(dfa.initial())) {
      return Dfa.emptyLanguage(dfa.alphabet());
    }

    final int[] renumbered = new int[stateCount];
    int next = 0;
    for (int state = 0; state < stateCount; state++) {
      renumbered[state] = live.get(state) ? next++ : Dfa.NO_STATE;
    }

    final int[][] table = new int[next][symbols];
    final BitSet accepting = new BitSet(next);
    for (int state = 0; state < stateCount; state++) {
      if (renumbered[state] == Dfa.NO_STATE) {
        continue;
      }
      for (int symbol = 0; symbol < symbols; symbol++) {
        final int target = dfa.target(state, symbol);
        table[renumbered[state]][symbol] = target == Dfa.NO_STATE ? Dfa.NO_STATE : renumbered[target];
      }
      accepting.set(renumbered[state], dfa.accepts(state));
    }
    return new Dfa(dfa.alphabet(), table, renumbered[dfa.initial()], accepting);
  }

  /**
   * Compute the coarsest partition of indistinguishable states.
   *
   * <p>This uses a variant of Hopcroft's algorithm. The partition starts as
   * accepting versus non-accepting states. Each block taken off the worklist
   * acts as a splitter: for every symbol, the states that step into the
   * splitter are separated from those that don't. A missing transition
   * steps into no block, so it distinguishes a state from every state with a
   * defined transition on the same symbol.
   *
   * @param dfa automaton with no unreachable or dead states
   * @return partition of the states
   */
  static Set<SortedSet<Integer>> partition(Dfa dfa) {
    final int stateCount = dfa.stateCount();
    final int symbols = dfa.alphabet().size();

    // Keys are target states and values are mappings from symbols to source states
    final Map<Integer, Map<Integer, Set<Integer>>> reversedTransitions = new HashMap<>();
    for (int state = 0; state < stateCount; state++) {
      for (int symbol = 0; symbol < symbols; symbol++) {
        final int target = dfa.target(state, symbol);
        if (target != Dfa.NO_STATE) {
          reversedTransitions
            .computeIfAbsent(target, k -> new HashMap<>())
            .computeIfAbsent(symbol, k -> new HashSet<>())
            .add(state);
        }
      }
    }

    // Set up initial partition
    final var partition = new HashSet<SortedSet<Integer>>();
    final var acceptingStates = new TreeSet<Integer>();
    final var rejectingStates = new TreeSet<Integer>();
    for (int state = 0; state < stateCount; state++) {
      (dfa.accepts(state) ? acceptingStates : rejectingStates).add(state);
    }
    partition.add(acceptingStates);
    partition.add(rejectingStates);
    partition.removeIf(Set::isEmpty);

    // Mapping from states to blocks in the partition
    final var stateToBlock = new HashMap<Integer, SortedSet<Integer>>();
    for (final var block : partition) {
      for (final var state : block) {
        stateToBlock.put(state, block);
      }
    }

    // Worklist
    final var toVisit = new HashSet<Set<Integer>>(partition);

    while (!toVisit.isEmpty()) {
      final var splitter = toVisit.iterator().next();
      toVisit.remove(splitter);

      // Pre-images of the splitter, keyed by symbol
      final var preImages = new HashMap<Integer, Set<Integer>>();
      for (final int state : splitter) {
        final var incoming = reversedTransitions.get(state);
        if (incoming != null) {
          for (final var entry : incoming.entrySet()) {
            preImages
              .computeIfAbsent(entry.getKey(), k -> new HashSet<>())
              .addAll(entry.getValue());
          }
        }
      }

      for (final Set<Integer> preImage : preImages.values()) {
        for (final int containedState : preImage) {
          final var oldBlock = stateToBlock.get(containedState);

          final var inPreImage = new TreeSet<Integer>();
          final var notInPreImage = new TreeSet<Integer>();
          for (final int state : oldBlock) {
            if (preImage.contains(state)) {
              inPreImage.add(state);
            } else {
              notInPreImage.add(state);
            }
          }

          // Block is not split by this pre-image
          if (notInPreImage.isEmpty()) {
            continue;
          }

          partition.remove(oldBlock);
          partition.add(inPreImage);
          partition.add(notInPreImage);

          for (final int state : inPreImage) {
            stateToBlock.put(state, inPreImage);
          }
          for (final int state : notInPreImage) {
            stateToBlock.put(state, notInPreImage);
          }

          if (toVisit.remove(oldBlock)) {
            toVisit.add(inPreImage);
            toVisit.add(notInPreImage);
          } else if (inPreImage.size() < notInPreImage.size()) {
            toVisit.add(inPreImage);
          } else {
            toVisit.add(notInPreImage);
          }
        }
      }
    }

    return partition;
  }
}
