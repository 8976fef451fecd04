package langex.graph;

/**
 * Closure construction whose output would have more states than allowed.
 *
 * <p>The construction is abandoned rather than truncated. Minimizing an input
 * and retrying, or retrying with a larger {@link ConstructionLimits}, are both
 * left to the caller.
 */
public class StateLimitExceededException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = -7739284011530482316L;

  /**
   * Number of states the construction needed (or would have reached).
   */
  public final long requestedStates;

  /**
   * Configured ceiling that was exceeded.
   */
  public final int limit;

  public StateLimitExceededException(String construction, long requestedStates, int limit) {
    super(construction + " needs " + requestedStates + " states but the limit is " + limit);
    this.requestedStates = requestedStates;
    this.limit = limit;
  }
}
