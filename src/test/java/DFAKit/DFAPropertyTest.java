package DFAKit;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import DFAKit.Serialization.CompactConverter;
import DFAKit.Serialization.JSONFormat;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.DFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Random automata checked against AutomataLib's own algorithms and against brute-force word enumeration.
 */
public class DFAPropertyTest {
    private static final List<Dfa> TOTAL;
    private static final List<Dfa> PARTIAL;
    private static final List<List<String>> WORDS = DFAFixtures.words(RandomDFA.ALPHABET, 8);

    static {
        final int size = 12;
        final int amount = 100;
        TOTAL = new ArrayList<>(amount);
        PARTIAL = new ArrayList<>(amount);
        for (int randomSeed = 0; randomSeed < amount; randomSeed++) {
            TOTAL.add(RandomDFA.getRandomTotalDFA(randomSeed, size));
            PARTIAL.add(RandomDFA.getRandomPartialDFA(randomSeed, size));
        }
    }

    @Test
    void testMinimizeAgainstHopcroft() {
        for (Dfa dfa : TOTAL) {
            final Alphabet<String> alphabet = dfa.getAlphabet();
            final CompactDFA<String> expected = HopcroftMinimizer.minimizeDFA(CompactConverter.toCompactDFA(dfa), alphabet);
            final Dfa result = DFAMinimizer.minimize(dfa);

            Assertions.assertEquals(expected.size(), result.size());
            Assertions.assertTrue(Automata.testEquivalence(expected, CompactConverter.toCompactDFA(result), alphabet));
        }
    }

    @Test
    void testMinimizePreservesLanguage() {
        for (Dfa dfa : PARTIAL) {
            final Dfa result = dfa.minimize();
            Assertions.assertTrue(result.size() <= DFATrim.accessibleStates(dfa).size());
            for (List<String> word : WORDS) {
                Assertions.assertEquals(dfa.run(word), result.run(word));
            }
        }
    }

    @Test
    void testMinimizeIdempotent() {
        for (Dfa dfa : PARTIAL) {
            final Dfa once = dfa.minimize();
            final Dfa twice = once.minimize();
            Assertions.assertEquals(once.size(), twice.size());
            Assertions.assertTrue(once.isEquivalentTo(twice));
        }
    }

    @Test
    void testRenamedMinimalFormsEquivalent() {
        for (int i = 0; i < TOTAL.size(); i++) {
            final Dfa dfa = TOTAL.get(i);
            final Dfa renamed = RandomDFA.renamed(dfa, "r_", i);
            Assertions.assertTrue(dfa.isEquivalentTo(renamed));
            Assertions.assertTrue(dfa.minimize().isEquivalentTo(renamed.minimize()));
        }
    }

    @Test
    void testProductsAgainstAutomataLib() {
        for (int i = 0; i + 1 < TOTAL.size(); i++) {
            final Dfa a = TOTAL.get(i);
            final Dfa b = TOTAL.get(i + 1);
            final Alphabet<String> alphabet = a.getAlphabet();
            final CompactDFA<String> ca = CompactConverter.toCompactDFA(a);
            final CompactDFA<String> cb = CompactConverter.toCompactDFA(b);

            Assertions.assertTrue(Automata.testEquivalence(
                DFAs.and(ca, cb, alphabet), CompactConverter.toCompactDFA(a.intersection(b)), alphabet));
            Assertions.assertTrue(Automata.testEquivalence(
                DFAs.or(ca, cb, alphabet), CompactConverter.toCompactDFA(a.union(b)), alphabet));
        }
    }

    @Test
    void testProductLawsOnTotalAutomata() {
        for (int i = 0; i + 1 < TOTAL.size(); i++) {
            final Dfa a = TOTAL.get(i);
            final Dfa b = TOTAL.get(i + 1);
            final Dfa intersection = a.intersection(b);
            final Dfa union = a.union(b);
            final Dfa difference = a.setDifference(b);
            for (List<String> word : WORDS) {
                final boolean x = a.run(word);
                final boolean y = b.run(word);
                Assertions.assertEquals(x && y, intersection.run(word));
                Assertions.assertEquals(x || y, union.run(word));
                Assertions.assertEquals(x && !y, difference.run(word));
            }
        }
    }

    @Test
    void testIntersectionLawOnPartialAutomata() {
        for (int i = 0; i + 1 < PARTIAL.size(); i++) {
            final Dfa a = PARTIAL.get(i);
            final Dfa b = PARTIAL.get(i + 1);
            final Dfa intersection = a.intersection(b);
            for (List<String> word : WORDS) {
                Assertions.assertEquals(a.run(word) && b.run(word), intersection.run(word));
            }
        }
    }

    @Test
    void testJSONRoundTrip() throws IOException {
        for (Dfa dfa : PARTIAL) {
            final Dfa copy = JSONFormat.fromJSON(JSONFormat.toJSON(dfa));
            Assertions.assertEquals(dfa.getStartState(), copy.getStartState());
            Assertions.assertEquals(dfa.getTransitionTable(), copy.getTransitionTable());
            Assertions.assertTrue(dfa.isEquivalentTo(copy));
        }
    }
}
