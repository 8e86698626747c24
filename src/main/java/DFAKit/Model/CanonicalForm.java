package DFAKit.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import DFAKit.DFATrim;
import DFAKit.Dfa;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * Renaming-independent view of the reachable part of an automaton.
 * <p>
 * Reachable states are numbered 0, 1, ... in breadth-first order from the start state, following successors in
 * alphabet order. The transition table and the accepting set are then expressed over those indices.
 * <p>
 * Two automata with equal canonical forms are isomorphic on their reachable states and hence accept the same
 * language. The converse only holds for minimal automata: minimize both sides first when language equality is
 * what matters.
 */
public final class CanonicalForm {
    public static final int MISSING_STATE = -1;

    private final Object2IntMap<State> stateIndex;
    private final List<Map<String, Integer>> transitions;
    private final IntSet accepting;

    private CanonicalForm(Object2IntMap<State> stateIndex, List<Map<String, Integer>> transitions, IntSet accepting) {
        this.stateIndex = stateIndex;
        this.transitions = transitions;
        this.accepting = accepting;
    }

    public static CanonicalForm of(Dfa dfa) {
        final Set<State> reachable = DFATrim.accessibleStates(dfa);

        final Object2IntMap<State> stateIndex = new Object2IntLinkedOpenHashMap<>(reachable.size());
        stateIndex.defaultReturnValue(MISSING_STATE);
        for (State s : reachable) {
            stateIndex.put(s, stateIndex.size());
        }

        final List<Map<String, Integer>> transitions = new ArrayList<>(reachable.size());
        final IntSet accepting = new IntOpenHashSet();
        for (State s : reachable) {
            final Map<String, Integer> row = new LinkedHashMap<>();
            for (String symbol : dfa.getAlphabet()) {
                final State t = dfa.getSuccessor(s, symbol);
                if (t != null) {
                    row.put(symbol, stateIndex.getInt(t));
                }
            }
            transitions.add(Collections.unmodifiableMap(row));
            if (s.isAccepting()) {
                accepting.add(stateIndex.getInt(s));
            }
        }

        return new CanonicalForm(stateIndex, Collections.unmodifiableList(transitions), IntSets.unmodifiable(accepting));
    }

    /**
     * Decide whether two automata are equivalent: equal alphabets, the same number of reachable states, equal
     * canonical transition tables (including which symbols are missing) and equal canonical accepting sets.
     */
    public static boolean equivalent(Dfa a, Dfa b) {
        if (!a.hasSameAlphabet(b)) {
            return false;
        }
        return of(a).equals(of(b));
    }

    /**
     * @return number of reachable states
     */
    public int size() {
        return transitions.size();
    }

    /**
     * @return canonical index of the state, or {@link #MISSING_STATE} if it is not reachable
     */
    public int indexOf(State state) {
        return stateIndex.getInt(state);
    }

    /**
     * @return outgoing transitions of canonical state {@code index}, symbol to target index
     */
    public Map<String, Integer> transitionsOf(int index) {
        return transitions.get(index);
    }

    public IntSet getAcceptingIndices() {
        return accepting;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanonicalForm)) {
            return false;
        }
        final CanonicalForm that = (CanonicalForm) o;
        return size() == that.size() && transitions.equals(that.transitions) && accepting.equals(that.accepting);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transitions, accepting);
    }

    @Override
    public String toString() {
        return "CanonicalForm" + transitions + ", accepting=" + accepting;
    }
}
