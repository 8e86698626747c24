package DFAKit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import DFAKit.Exceptions.AlphabetMismatchException;
import DFAKit.Model.AcceptanceCombiner;
import DFAKit.Model.ProductOperation;
import DFAKit.Model.State;
import DFAKit.Model.StatePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Product construction of two automata over the same alphabet.
 * <p>
 * Only pairs reachable from the pair of start states are materialized. A pair has a transition on a symbol only if
 * both components have one; a missing edge on either side cuts the combined path, whatever the operator.
 */
public class DFAProduct {
  private static final Logger LOG = LoggerFactory.getLogger(DFAProduct.class);

  private DFAProduct() {}

  public static Dfa intersection(Dfa a, Dfa b) {
    return product(a, b, ProductOperation.INTERSECTION);
  }

  public static Dfa union(Dfa a, Dfa b) {
    return product(a, b, ProductOperation.UNION);
  }

  public static Dfa difference(Dfa a, Dfa b) {
    return product(a, b, ProductOperation.DIFFERENCE);
  }

  /**
   * Synchronized product of {@code a} and {@code b}.
   * @param a - left operand
   * @param b - right operand
   * @param combiner - acceptance of a pair state, evaluated once when the pair is discovered
   * @return new automaton whose states are named {@code (qa,qb)}, suffixed when two pairs render alike
   * @throws AlphabetMismatchException if the alphabets differ
   */
  public static Dfa product(Dfa a, Dfa b, AcceptanceCombiner combiner) {
    if (!a.hasSameAlphabet(b)) {
      throw new AlphabetMismatchException(a.getAlphabet(), b.getAlphabet());
    }

    final Map<StatePair, State> registry = new HashMap<>();
    final Map<String, State> states = new LinkedHashMap<>();
    final Map<State, Map<String, State>> transitions = new LinkedHashMap<>();
    final Deque<StatePair> queue = new ArrayDeque<>();

    final StatePair init = new StatePair(a.getStartState(), b.getStartState());
    final State initOut = register(init, combiner, registry, states);
    queue.add(init);

    while (!queue.isEmpty()) {
      final StatePair curr = queue.poll();
      final Map<String, State> row = new LinkedHashMap<>();

      for (String symbol : a.getAlphabet()) {
        final State succA = a.getSuccessor(curr.left(), symbol);
        final State succB = b.getSuccessor(curr.right(), symbol);
        if (succA == null || succB == null) {
          continue;
        }
        final StatePair succ = new StatePair(succA, succB);
        State succOut = registry.get(succ);
        if (succOut == null) {
          succOut = register(succ, combiner, registry, states);
          queue.add(succ);
        }
        row.put(symbol, succOut);
      }
      transitions.put(registry.get(curr), row);
    }

    LOG.debug("Product ({}) of {} x {} states: {} reachable pairs", combiner, a.size(), b.size(), states.size());
    return new Dfa(initOut, states, a.getAlphabet(), transitions);
  }

  /**
   * Distinct pairs may render to the same name when component names contain commas or parentheses; later pairs
   * then get a {@code #k} suffix. Pairs are registered in discovery order, so the suffixes are deterministic.
   */
  private static State register(StatePair pair, AcceptanceCombiner combiner,
                                Map<StatePair, State> registry, Map<String, State> states) {
    String name = pair.name();
    for (int k = 1; states.containsKey(name); k++) {
      name = pair.name() + "#" + k;
    }
    final State out = new State(name, combiner.combine(pair));
    states.put(name, out);
    registry.put(pair, out);
    return out;
  }
}
