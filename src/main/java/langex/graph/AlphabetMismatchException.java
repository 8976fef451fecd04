package langex.graph;

/**
 * Binary closure operation attempted on automata over different alphabets.
 */
public class AlphabetMismatchException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -2406197384573829045L;

  public final Alphabet left;
  public final Alphabet right;

  public AlphabetMismatchException(Alphabet left, Alphabet right) {
    super("Automata are over different alphabets: " + left + " and " + right);
    this.left = left;
    this.right = right;
  }
}
