package DFAKit.Serialization;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import DFAKit.Dfa;
import DFAKit.Model.State;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Conversion to AutomataLib's {@link CompactDFA}, for rendering and for cross-checking against AutomataLib's own
 * algorithms. State {@code i} of the result is the {@code i}-th element of {@link #stateOrder(Dfa)}.
 */
public class CompactConverter {

    private CompactConverter() {}

    public static CompactDFA<String> toCompactDFA(Dfa dfa) {
        final Alphabet<String> alphabet = dfa.getAlphabet();
        final Object2IntMap<State> ids = indexStates(dfa);
        final CompactDFA<String> out = new CompactDFA<>(alphabet, ids.size());

        for (State s : ids.keySet()) {
            out.addState(s.isAccepting());
        }
        out.setInitialState(ids.getInt(dfa.getStartState()));

        for (Object2IntMap.Entry<State> e : ids.object2IntEntrySet()) {
            for (String symbol : alphabet) {
                final State t = dfa.getSuccessor(e.getKey(), symbol);
                if (t != null) {
                    out.setTransition(e.getIntValue(), symbol, Integer.valueOf(ids.getInt(t)));
                }
            }
        }
        return out;
    }

    /**
     * States of the converted automaton, in id order: the state table first, then any state value that edges or
     * the start still refer to after its name was re-added with a different acceptance flag.
     */
    public static List<State> stateOrder(Dfa dfa) {
        return new ArrayList<>(indexStates(dfa).keySet());
    }

    private static Object2IntMap<State> indexStates(Dfa dfa) {
        final Object2IntMap<State> ids = new Object2IntLinkedOpenHashMap<>(dfa.size());
        for (State s : dfa.getStates()) {
            ids.put(s, ids.size());
        }
        ids.putIfAbsent(dfa.getStartState(), ids.size());
        for (Map.Entry<State, Map<String, State>> row : dfa.getTransitionTable().entrySet()) {
            ids.putIfAbsent(row.getKey(), ids.size());
            for (State t : row.getValue().values()) {
                ids.putIfAbsent(t, ids.size());
            }
        }
        return ids;
    }
}
