package DFAKit.Exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a product operation is attempted between automata over different alphabets.
 */
public class AlphabetMismatchException extends DFAException {

  private final List<String> leftAlphabet;
  private final List<String> rightAlphabet;

  public AlphabetMismatchException(Collection<String> leftAlphabet, Collection<String> rightAlphabet) {
    this(List.copyOf(leftAlphabet), List.copyOf(rightAlphabet));
  }

  private AlphabetMismatchException(List<String> leftAlphabet, List<String> rightAlphabet) {
    super("Alphabets of the two DFAs are not the same: " + leftAlphabet + " vs " + rightAlphabet + ".");
    this.leftAlphabet = leftAlphabet;
    this.rightAlphabet = rightAlphabet;
  }

  public List<String> getLeftAlphabet() {
    return leftAlphabet;
  }

  public List<String> getRightAlphabet() {
    return rightAlphabet;
  }
}
