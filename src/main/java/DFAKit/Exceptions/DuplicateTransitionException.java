package DFAKit.Exceptions;

/**
 * Thrown when a second transition is added for a (state, symbol) pair that already has one.
 */
public class DuplicateTransitionException extends DFAException {

  private final String stateName;
  private final String symbol;

  public DuplicateTransitionException(String stateName, String symbol) {
    super("Transition from '" + stateName + "' for the same symbol '" + symbol + "' already exists.");
    this.stateName = stateName;
    this.symbol = symbol;
  }

  public String getStateName() {
    return stateName;
  }

  public String getSymbol() {
    return symbol;
  }
}
