package DFAKit.Model;

/**
 * The binary language operators built on the product construction.
 */
public enum ProductOperation implements AcceptanceCombiner {
  INTERSECTION {
    @Override
    public boolean combine(boolean leftAccepting, boolean rightAccepting) {
      return leftAccepting && rightAccepting;
    }
  },
  UNION {
    @Override
    public boolean combine(boolean leftAccepting, boolean rightAccepting) {
      return leftAccepting || rightAccepting;
    }
  },
  // left minus right
  DIFFERENCE {
    @Override
    public boolean combine(boolean leftAccepting, boolean rightAccepting) {
      return leftAccepting && !rightAccepting;
    }
  };

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
