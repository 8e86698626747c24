package DFAKit.Exceptions;

/**
 * Thrown when an operation references a state that is not in the automaton's state table.
 */
public class UnknownStateException extends DFAException {

  private final String stateName;

  public UnknownStateException(String stateName) {
    super("State '" + stateName + "' not in states.");
    this.stateName = stateName;
  }

  public String getStateName() {
    return stateName;
  }
}
