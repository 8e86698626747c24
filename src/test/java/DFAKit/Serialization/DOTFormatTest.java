package DFAKit.Serialization;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import DFAKit.DFAFixtures;
import DFAKit.Dfa;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DOTFormatTest {

  @Test
  void testToDOT() {
    String dot = DOTFormat.toDOT(DFAFixtures.multiplesOfThree());
    Assertions.assertTrue(dot.contains("digraph"), dot);
    Assertions.assertTrue(dot.contains("doublecircle"), dot); // s0 accepts
  }

  @Test
  void testStateNamesAsLabels() {
    String dot = DOTFormat.toDOT(DFAFixtures.sixStates());
    for (String name : List.of("a", "b", "c", "d", "e", "f")) {
      Assertions.assertTrue(dot.contains("label=\"" + name + "\""), dot);
    }
    Assertions.assertFalse(dot.contains("label=\"5\""), dot);
  }

  @Test
  void testReAddedStateKeepsItsNode() {
    Dfa dfa = DFAFixtures.withStates("p", DFAFixtures.BINARY, "p", "q");
    dfa.addTransition("p", "0", "q");
    dfa.addState("q", true);

    String dot = DOTFormat.toDOT(dfa);
    // the replaced q is still the target of p's edge
    Assertions.assertEquals(2, dot.split("label=\"q\"", -1).length - 1, dot);
  }

  @Test
  void testWriteFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("six.dot");
    DOTFormat.write(DFAFixtures.sixStates(), file);
    String dot = Files.readString(file, StandardCharsets.UTF_8);
    Assertions.assertEquals(DOTFormat.toDOT(DFAFixtures.sixStates()), dot);
  }
}
