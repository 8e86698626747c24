package DFAKit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import DFAKit.Model.State;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by iterative partition refinement.
 * <p>
 * Unreachable states are pruned before refinement starts, so the result has exactly one state per equivalence
 * class of reachable states. Every round recomputes the signature of every state; this is simpler than Hopcroft's
 * work-list variant and quadratic in the worst case.
 */
public class DFAMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(DFAMinimizer.class);

    /** Signature entry for a symbol without an outgoing transition. */
    private static final int NO_TRANSITION = -1;

    private DFAMinimizer() {}

    /**
     * Minimize an automaton.
     * @param dfa - automaton to minimize; not modified
     * @return new automaton with states {@code s0, s1, ...}, one per block of the stable partition
     */
    public static Dfa minimize(Dfa dfa) {
        final Set<State> reachable = DFATrim.accessibleStates(dfa);
        if (reachable.size() < dfa.size()) {
            LOG.debug("Pruned {} unreachable states", dfa.size() - reachable.size());
        }

        List<List<State>> partition = initialPartition(reachable);
        Object2IntMap<State> blockOf = blockIndex(partition);

        int round = 0;
        boolean refined = true;
        while (refined) {
            final List<List<State>> newPartition = refine(dfa, partition, blockOf);
            refined = newPartition.size() > partition.size();
            partition = newPartition;
            blockOf = blockIndex(partition);
            round++;
            LOG.debug("Refinement round {}: {} blocks", round, partition.size());
        }

        return buildQuotient(dfa, partition, blockOf);
    }

    /**
     * Accepting states first, then non-accepting ones. Empty blocks are left out.
     */
    private static List<List<State>> initialPartition(Set<State> states) {
        final List<State> accepting = new ArrayList<>();
        final List<State> rejecting = new ArrayList<>();
        for (State s : states) {
            (s.isAccepting() ? accepting : rejecting).add(s);
        }

        final List<List<State>> partition = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            partition.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            partition.add(rejecting);
        }
        return partition;
    }

    /**
     * One refinement round: split every block by the signatures of its members. Sub-blocks keep the order in which
     * their first member was seen, which keeps the output naming deterministic.
     */
    private static List<List<State>> refine(Dfa dfa, List<List<State>> partition, Object2IntMap<State> blockOf) {
        final List<List<State>> newPartition = new ArrayList<>(partition.size());
        for (List<State> block : partition) {
            final Map<IntList, List<State>> splits = new LinkedHashMap<>();
            for (State s : block) {
                splits.computeIfAbsent(signature(dfa, s, blockOf), k -> new ArrayList<>()).add(s);
            }
            newPartition.addAll(splits.values());
        }
        return newPartition;
    }

    private static IntList signature(Dfa dfa, State state, Object2IntMap<State> blockOf) {
        final Alphabet<String> alphabet = dfa.getAlphabet();
        final IntList signature = new IntArrayList(alphabet.size());
        for (String symbol : alphabet) {
            final State t = dfa.getSuccessor(state, symbol);
            signature.add(t == null ? NO_TRANSITION : blockOf.getInt(t));
        }
        return signature;
    }

    private static Object2IntMap<State> blockIndex(List<List<State>> partition) {
        final Object2IntMap<State> blockOf = new Object2IntOpenHashMap<>();
        blockOf.defaultReturnValue(NO_TRANSITION);
        for (int i = 0; i < partition.size(); i++) {
            for (State s : partition.get(i)) {
                blockOf.put(s, i);
            }
        }
        return blockOf;
    }

    /**
     * One state per block. All members of a stable block agree on acceptance and on the target block of every
     * symbol, so the first member stands in for the whole block.
     */
    private static Dfa buildQuotient(Dfa dfa, List<List<State>> partition, Object2IntMap<State> blockOf) {
        final List<State> blockStates = new ArrayList<>(partition.size());
        final Map<String, State> states = new LinkedHashMap<>();
        for (int i = 0; i < partition.size(); i++) {
            final State blockState = new State("s" + i, partition.get(i).get(0).isAccepting());
            blockStates.add(blockState);
            states.put(blockState.name(), blockState);
        }

        final Map<State, Map<String, State>> transitions = new LinkedHashMap<>();
        for (int i = 0; i < partition.size(); i++) {
            final State representative = partition.get(i).get(0);
            final Map<String, State> row = new LinkedHashMap<>();
            for (String symbol : dfa.getAlphabet()) {
                final State t = dfa.getSuccessor(representative, symbol);
                if (t != null) {
                    row.put(symbol, blockStates.get(blockOf.getInt(t)));
                }
            }
            transitions.put(blockStates.get(i), row);
        }

        final State start = blockStates.get(blockOf.getInt(dfa.getStartState()));
        return new Dfa(start, states, dfa.getAlphabet(), transitions);
    }
}
