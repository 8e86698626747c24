package DFAKit.Model;

/**
 * Decides whether a product state accepts, given the acceptance of its two component states.
 */
@FunctionalInterface
public interface AcceptanceCombiner {

  boolean combine(boolean leftAccepting, boolean rightAccepting);

  default boolean combine(StatePair pair) {
    return combine(pair.left().isAccepting(), pair.right().isAccepting());
  }
}
