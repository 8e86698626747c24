package DFAKit.Model;

import java.util.Objects;

/**
 * A named automaton state. States compare by value, so two states with the same name and acceptance flag are
 * interchangeable as map keys.
 */
public record State(String name, boolean isAccepting) {

  public State {
    Objects.requireNonNull(name, "name");
  }

  public State(String name) {
    this(name, false);
  }

  @Override
  public String toString() {
    return name + " (" + (isAccepting ? "✓" : "✗") + ")";
  }
}
