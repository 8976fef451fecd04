package langex.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity ceilings applied while building automata.
 *
 * @param maxStates largest number of states a construction may produce
 */
public record ConstructionLimits(int maxStates) {

  private static final Logger logger = LoggerFactory.getLogger(ConstructionLimits.class);

  /**
   * Name of the system property overriding the default state ceiling.
   */
  public static final String MAX_STATES_PROPERTY = "langex.maxStates";

  public static final int DEFAULT_MAX_STATES = 1_000_000;

  /**
   * Limits used by the closure operations that don't take explicit limits.
   */
  public static final ConstructionLimits DEFAULT = new ConstructionLimits(
    Integer.getInteger(MAX_STATES_PROPERTY, DEFAULT_MAX_STATES)
  );

  public ConstructionLimits {
    if (maxStates < 0) {
      throw new IllegalArgumentException("maxStates must be non-negative: " + maxStates);
    }
  }

  public static ConstructionLimits unlimited() {
    return new ConstructionLimits(Integer.MAX_VALUE);
  }

  /**
   * Check a prospective state count against the ceiling.
   *
   * @param construction name of the construction (used in the error message)
   * @param requestedStates number of states that would be produced
   * @throws StateLimitExceededException if the count exceeds {@link #maxStates}
   */
  void check(String construction, long requestedStates) {
    if (requestedStates > maxStates) {
      logger.warn("{} abandoned: {} states requested, limit is {}", construction, requestedStates, maxStates);
      throw new StateLimitExceededException(construction, requestedStates, maxStates);
    }
  }
}
