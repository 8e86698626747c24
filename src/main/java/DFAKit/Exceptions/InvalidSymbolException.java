package DFAKit.Exceptions;

import java.util.ArrayList;
import java.util.Collection;

/**
 * Thrown when a transition or an input references a symbol outside the automaton's alphabet.
 */
public class InvalidSymbolException extends DFAException {

  private final String symbol;

  public InvalidSymbolException(String symbol, Collection<String> alphabet) {
    super("Symbol '" + symbol + "' not in " + new ArrayList<>(alphabet) + ".");
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
