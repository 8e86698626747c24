package DFAKit.Serialization;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import DFAKit.Dfa;
import DFAKit.Model.State;
import net.automatalib.serialization.dot.GraphDOT;
import net.automatalib.visualization.DefaultVisualizationHelper;
import net.automatalib.visualization.VisualizationHelper;

/**
 * GraphViz export. Layout and styling (start marker, double-circled accepting states) are AutomataLib's; every
 * node is labelled with the name of its state.
 */
public class DOTFormat {

    private DOTFormat() {}

    public static void write(Dfa dfa, Appendable out) throws IOException {
        GraphDOT.write(CompactConverter.toCompactDFA(dfa), dfa.getAlphabet(), out,
                       stateNames(CompactConverter.stateOrder(dfa)));
    }

    public static void write(Dfa dfa, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(dfa, writer);
        }
    }

    public static String toDOT(Dfa dfa) {
        final StringBuilder sb = new StringBuilder();
        try {
            write(dfa, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    private static <E> VisualizationHelper<Integer, E> stateNames(List<State> states) {
        return new DefaultVisualizationHelper<Integer, E>() {

            @Override
            public boolean getNodeProperties(Integer node, Map<String, String> properties) {
                if (!super.getNodeProperties(node, properties)) {
                    return false;
                }
                properties.put(NodeAttrs.LABEL, states.get(node).name());
                return true;
            }
        };
    }
}
