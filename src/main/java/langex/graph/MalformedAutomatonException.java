package langex.graph;

/**
 * Automaton whose parts are inconsistent with its state count.
 *
 * <p>Examples include an initial state or transition target outside of the
 * state range, or an accepting vector of the wrong length.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3148907623315094217L;

  public MalformedAutomatonException(String message) {
    super(message);
  }
}
