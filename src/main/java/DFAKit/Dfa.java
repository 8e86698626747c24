package DFAKit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

import DFAKit.Exceptions.DuplicateTransitionException;
import DFAKit.Exceptions.InvalidSymbolException;
import DFAKit.Exceptions.UnknownStateException;
import DFAKit.Model.CanonicalForm;
import DFAKit.Model.ProductOperation;
import DFAKit.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A deterministic finite automaton over string symbols, with a possibly partial transition function.
 * <p>
 * The alphabet is fixed at construction and iterated in the natural order of its symbols. States and transitions
 * may be added afterwards; minimization, the product operators and trimming always return a new automaton and
 * never modify their operands.
 * <p>
 * Transitions are keyed by the {@link State} values captured when they were added. Re-adding a state under an
 * existing name with a different acceptance flag replaces the table entry but does not repoint edges that refer
 * to the old value. Instances are not synchronized: writes must not race with reads of the same automaton.
 */
public class Dfa {
  private final State start;
  private final Map<String, State> states;
  private final Alphabet<String> alphabet;
  private final Map<State, Map<String, State>> transitions;

  public Dfa(State start, Map<String, State> states, Collection<String> alphabet) {
    this(start, states, alphabet, Collections.emptyMap());
  }

  /**
   * Creates a fully formed automaton. All arguments are copied.
   * @param start - start state, must be one of {@code states}
   * @param states - state table, keyed by state name
   * @param alphabet - input symbols
   * @param transitions - transition table; every symbol must be in {@code alphabet} and every state in {@code states}
   */
  public Dfa(State start,
             Map<String, State> states,
             Collection<String> alphabet,
             Map<State, ? extends Map<String, State>> transitions) {
    Objects.requireNonNull(start, "start");
    this.alphabet = Alphabets.fromCollection(new TreeSet<>(alphabet));
    this.states = new LinkedHashMap<>(states);
    this.states.forEach((name, state) -> {
      if (!name.equals(state.name())) {
        throw new IllegalArgumentException("State '" + state.name() + "' registered under name '" + name + "'.");
      }
    });
    if (!start.equals(this.states.get(start.name()))) {
      throw new UnknownStateException(start.name());
    }
    this.start = start;
    this.transitions = new LinkedHashMap<>();
    transitions.forEach((from, row) -> row.forEach((symbol, to) -> putTransition(from, symbol, to)));
  }

  public State getStartState() {
    return start;
  }

  /**
   * Look up a state by name.
   */
  public Optional<State> getState(String name) {
    return Optional.ofNullable(states.get(name));
  }

  public Collection<State> getStates() {
    return Collections.unmodifiableCollection(states.values());
  }

  public Alphabet<String> getAlphabet() {
    return alphabet;
  }

  public int size() {
    return states.size();
  }

  public @Nullable State getSuccessor(State state, String symbol) {
    final Map<String, State> row = transitions.get(state);
    return row == null ? null : row.get(symbol);
  }

  /**
   * Outgoing transitions of a state, in insertion order. Empty if the state has none.
   */
  public Map<String, State> getTransitions(State state) {
    final Map<String, State> row = transitions.get(state);
    return row == null ? Collections.emptyMap() : Collections.unmodifiableMap(row);
  }

  /**
   * Snapshot of the whole transition table. Source states without outgoing edges may be present with an empty
   * row.
   */
  public Map<State, Map<String, State>> getTransitionTable() {
    final Map<State, Map<String, State>> table = new LinkedHashMap<>();
    transitions.forEach((from, row) -> table.put(from, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
    return Collections.unmodifiableMap(table);
  }

  public boolean hasSameAlphabet(Dfa other) {
    return alphabet.size() == other.alphabet.size() && alphabet.containsAll(other.alphabet);
  }

  public void addState(String name) {
    addState(name, false);
  }

  /**
   * Add a state, replacing any state of the same name. Existing transitions are not rewired.
   */
  public void addState(String name, boolean accepting) {
    states.put(name, new State(name, accepting));
  }

  /**
   * Add a transition between two states of this automaton.
   * @throws InvalidSymbolException if {@code symbol} is not in the alphabet
   * @throws UnknownStateException if either state is not in the state table
   * @throws DuplicateTransitionException if {@code fromName} already has a transition for {@code symbol}
   */
  public void addTransition(String fromName, String symbol, String toName) {
    checkSymbol(symbol);
    final State from = states.get(fromName);
    if (from == null) {
      throw new UnknownStateException(fromName);
    }
    final State to = states.get(toName);
    if (to == null) {
      throw new UnknownStateException(toName);
    }
    putTransition(from, symbol, to);
  }

  private void putTransition(State from, String symbol, State to) {
    checkSymbol(symbol);
    checkMember(from);
    checkMember(to);
    final Map<String, State> row = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>());
    if (row.containsKey(symbol)) {
      throw new DuplicateTransitionException(from.name(), symbol);
    }
    row.put(symbol, to);
  }

  private void checkSymbol(String symbol) {
    if (!alphabet.contains(symbol)) {
      throw new InvalidSymbolException(symbol, alphabet);
    }
  }

  private void checkMember(State state) {
    if (!state.equals(states.get(state.name()))) {
      throw new UnknownStateException(state.name());
    }
  }

  /**
   * Run the automaton on a string, one code point per symbol.
   * @return whether the walk ends in an accepting state; false if it gets stuck on a missing transition
   * @throws InvalidSymbolException if any character is not in the alphabet
   */
  public boolean run(String input) {
    return run(input.codePoints().mapToObj(cp -> new String(Character.toChars(cp))).collect(Collectors.toList()));
  }

  /**
   * Run the automaton on a sequence of symbols.
   * @see #run(String)
   */
  public boolean run(Iterable<String> input) {
    final List<String> symbols = new ArrayList<>();
    for (String symbol : input) {
      checkSymbol(symbol);
      symbols.add(symbol);
    }
    State current = start;
    for (String symbol : symbols) {
      current = getSuccessor(current, symbol);
      if (current == null) {
        return false; // stuck
      }
    }
    return current.isAccepting();
  }

  public Dfa minimize() {
    return DFAMinimizer.minimize(this);
  }

  public Dfa intersection(Dfa other) {
    return DFAProduct.product(this, other, ProductOperation.INTERSECTION);
  }

  public Dfa union(Dfa other) {
    return DFAProduct.product(this, other, ProductOperation.UNION);
  }

  public Dfa setDifference(Dfa other) {
    return DFAProduct.product(this, other, ProductOperation.DIFFERENCE);
  }

  /**
   * Structural equivalence of the reachable parts of both automata; see {@link CanonicalForm#equivalent}.
   */
  public boolean isEquivalentTo(Dfa other) {
    return CanonicalForm.equivalent(this, other);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    sb.append("DFA(Starting state: ").append(start).append(", Σ: ").append(new ArrayList<>(alphabet)).append("):");
    transitions.forEach((from, row) -> {
      sb.append("\n\t").append(from).append(": {");
      sb.append(row.entrySet()
                   .stream()
                   .map(e -> "'" + e.getKey() + "' -> " + e.getValue())
                   .collect(Collectors.joining(", ")));
      sb.append('}');
    });
    return sb.toString();
  }
}
