package DFAKit.Exceptions;

/**
 * Base class of the errors raised by automaton construction and the automaton operations. None of them is
 * recovered from internally.
 */
public abstract class DFAException extends RuntimeException {

  protected DFAException(String message) {
    super(message);
  }
}
