package DFAKit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import DFAKit.Model.State;

public class DFATrim {

    /**
     * States reachable from the start state, in breadth-first discovery order. Successors are visited in alphabet
     * order, so the iteration order of the result is the canonical numbering of the automaton.
     * @param dfa - automaton to explore
     * @return reachable states, start state first
     */
    public static Set<State> accessibleStates(Dfa dfa) {
        final Set<State> visited = new LinkedHashSet<>();
        final Deque<State> queue = new ArrayDeque<>();

        visited.add(dfa.getStartState());
        queue.add(dfa.getStartState());

        while (!queue.isEmpty()) {
            final State s = queue.poll();
            for (String symbol : dfa.getAlphabet()) {
                final State t = dfa.getSuccessor(s, symbol);
                if (t != null && visited.add(t)) {
                    queue.add(t);
                }
            }
        }
        return visited;
    }

    /**
     * Copy of the automaton restricted to its reachable states. Names, acceptance and edges are preserved.
     * @param dfa - original automaton
     * @return trimmed automaton
     */
    public static Dfa trim(Dfa dfa) {
        final Set<State> reachable = accessibleStates(dfa);

        final Map<String, State> states = new LinkedHashMap<>();
        final Map<State, Map<String, State>> transitions = new LinkedHashMap<>();
        for (State s : reachable) {
            states.put(s.name(), s);
            transitions.put(s, dfa.getTransitions(s));
        }
        return new Dfa(dfa.getStartState(), states, dfa.getAlphabet(), transitions);
    }
}
