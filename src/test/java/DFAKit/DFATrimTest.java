package DFAKit;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import DFAKit.Model.State;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static DFAKit.DFAFixtures.BINARY;

public class DFATrimTest {

  @Test
  void testSingleState() {
    Dfa dfa = DFAFixtures.withStates("s0", BINARY, "s0");
    Assertions.assertEquals(Set.of(dfa.getStartState()), DFATrim.accessibleStates(dfa));

    Dfa trimmed = DFATrim.trim(dfa);
    Assertions.assertEquals(1, trimmed.size());
    Assertions.assertEquals(dfa.getStartState(), trimmed.getStartState());
  }

  @Test
  void testSmallTrim() {
    Dfa dfa = DFAFixtures.withStates("s0", BINARY, "s0+", "s1+", "s2+");
    dfa.addTransition("s0", "0", "s1");
    dfa.addTransition("s2", "1", "s0");
    Assertions.assertEquals(3, dfa.size());

    Dfa trimmed = DFATrim.trim(dfa);
    Assertions.assertEquals(2, trimmed.size()); // s2 isn't reachable
    Assertions.assertTrue(trimmed.getState("s2").isEmpty());
    Assertions.assertEquals("s1", trimmed.getSuccessor(trimmed.getStartState(), "0").name());
    Assertions.assertTrue(trimmed.run("0"));
    Assertions.assertFalse(trimmed.run("1"));

    // operand untouched
    Assertions.assertEquals(3, dfa.size());
  }

  @Test
  void testBreadthFirstOrder() {
    // discovery order follows the alphabet order, not the insertion order of transitions
    Dfa dfa = DFAFixtures.withStates("r", BINARY, "d", "c", "b", "a", "r");
    dfa.addTransition("r", "1", "a");
    dfa.addTransition("r", "0", "b");
    dfa.addTransition("a", "0", "d");
    dfa.addTransition("b", "1", "c");
    dfa.addTransition("c", "0", "r");

    List<String> order = DFATrim.accessibleStates(dfa).stream().map(State::name).collect(Collectors.toList());
    Assertions.assertEquals(List.of("r", "b", "a", "c", "d"), order);
  }

  @Test
  void testAlreadyTrim() {
    Dfa dfa = DFAFixtures.sixStates();
    Dfa trimmed = DFATrim.trim(dfa);
    Assertions.assertEquals(dfa.size(), trimmed.size());
    Assertions.assertTrue(trimmed.isEquivalentTo(dfa));
    for (List<String> word : DFAFixtures.words(BINARY, 6)) {
      Assertions.assertEquals(dfa.run(word), trimmed.run(word));
    }
  }
}
