package DFAKit.Model;

/**
 * Work item of the product construction: one state of each operand, stepped in lockstep.
 */
public record StatePair(State left, State right) {

  /**
   * Name of the synthetic product state, e.g. {@code (p,q)}.
   */
  public String name() {
    return "(" + left.name() + "," + right.name() + ")";
  }

  @Override
  public String toString() {
    return name();
  }
}
