package DFAKit.Serialization;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import DFAKit.Dfa;
import DFAKit.Exceptions.UnknownStateException;
import DFAKit.Model.State;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON persistence of automata.
 * <pre>
 * {
 *   "starting_state" : "s0",
 *   "states" : { "s0" : { "name" : "s0", "is_accepting" : true }, ... },
 *   "alphabet" : [ "0", "1" ],
 *   "transition_table" : { "s0" : { "0" : "s1", "1" : "s0" }, ... }
 * }
 * </pre>
 * Loading goes through the {@link Dfa} constructor, so references to unknown states or symbols fail the same way
 * {@link Dfa#addTransition} does.
 */
public class JSONFormat {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
        .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
        .build();

    public record StateJSON(@JsonProperty("name") String name,
                            @JsonProperty("is_accepting") boolean accepting) {}

    public record DfaJSON(@JsonProperty("starting_state") String startingState,
                          @JsonProperty("states") Map<String, StateJSON> states,
                          @JsonProperty("alphabet") List<String> alphabet,
                          @JsonProperty("transition_table") Map<String, Map<String, String>> transitionTable) {}

    private JSONFormat() {}

    public static void write(Dfa dfa, OutputStream os) throws IOException {
        MAPPER.writeValue(os, toRecord(dfa));
    }

    public static void write(Dfa dfa, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(dfa, os);
        }
    }

    public static String toJSON(Dfa dfa) throws IOException {
        return MAPPER.writeValueAsString(toRecord(dfa));
    }

    public static Dfa read(InputStream is) throws IOException {
        return fromRecord(MAPPER.readValue(is, DfaJSON.class));
    }

    public static Dfa read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public static Dfa fromJSON(String json) throws IOException {
        return fromRecord(MAPPER.readValue(json, DfaJSON.class));
    }

    static DfaJSON toRecord(Dfa dfa) {
        final Map<String, StateJSON> states = new LinkedHashMap<>();
        for (State s : dfa.getStates()) {
            states.put(s.name(), new StateJSON(s.name(), s.isAccepting()));
        }

        final Map<String, Map<String, String>> table = new LinkedHashMap<>();
        dfa.getTransitionTable().forEach((from, row) -> {
            final Map<String, String> names = new LinkedHashMap<>();
            for (String symbol : dfa.getAlphabet()) {
                final State to = row.get(symbol);
                if (to != null) {
                    names.put(symbol, to.name());
                }
            }
            table.put(from.name(), names);
        });

        return new DfaJSON(dfa.getStartState().name(), states, new ArrayList<>(dfa.getAlphabet()), table);
    }

    static Dfa fromRecord(DfaJSON json) throws IOException {
        requireField(json.startingState(), "starting_state");
        requireField(json.states(), "states");
        requireField(json.alphabet(), "alphabet");

        final Map<String, State> states = new LinkedHashMap<>();
        // the inner name may be omitted; the key is authoritative then
        json.states().forEach((name, s) -> states.put(name, new State(s.name() == null ? name : s.name(), s.accepting())));

        final Map<State, Map<String, State>> transitions = new LinkedHashMap<>();
        if (json.transitionTable() != null) {
            json.transitionTable().forEach((fromName, row) -> {
                final Map<String, State> targets = new LinkedHashMap<>();
                row.forEach((symbol, toName) -> targets.put(symbol, lookup(states, toName)));
                transitions.put(lookup(states, fromName), targets);
            });
        }

        return new Dfa(lookup(states, json.startingState()), states, json.alphabet(), transitions);
    }

    private static State lookup(Map<String, State> states, String name) {
        final State s = states.get(name);
        if (s == null) {
            throw new UnknownStateException(name);
        }
        return s;
    }

    private static void requireField(Object value, String field) throws IOException {
        if (value == null) {
            throw new IOException("Missing field '" + field + "'.");
        }
    }
}
