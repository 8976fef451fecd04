package langex.codegen;

import langex.graph.Alphabet;
import langex.graph.Dfa;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functionality for generating the body of a DFA matching method.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks with transitions encoded
 * as jumps to other blocks. A missing transition jumps to the block returning
 * {@code false}.
 */
class DfaMethodCodegen extends BytecodeHelpers {

  private static final Logger logger = LoggerFactory.getLogger(DfaMethodCodegen.class);

  /**
   * DFA for which code is generated.
   */
  private final Dfa dfa;

  /**
   * If set, the generated method will include code that prints to "standard"
   * error output for: states entered, offsets read, final output.
   */
  private final boolean printDebugInfo;

  /**
   * Offset for argument of type {@code CharSequence}, corresponding to the
   * input string.
   */
  private final int inputLocal;

  /**
   * Offset for a local of type {@code int}, corresponding to the (ascending)
   * offset in the input string.
   */
  private final int offsetLocal;

  /**
   * Offset for a local of type {@code int}, holding the length of the input.
   */
  private final int lengthLocal;

  /**
   * Labels associated with DFA states.
   *
   * <p>Each DFA state has a label and going to a new state is as simple as
   * jumping to that label.
   */
  private final List<Label> stateLabels;

  /**
   * Label for the block which ends in a positive match being returned.
   */
  private final Label returnSuccess;

  /**
   * Label for the block which ends in a negative match being returned.
   */
  private final Label returnFailure;

  public DfaMethodCodegen(
    MethodVisitor mv,
    Dfa dfa,
    boolean printDebugInfo
  ) {
    super(mv);
    this.dfa = dfa;
    this.printDebugInfo = printDebugInfo;

    // Slot 0 is the receiver and all other locals are single-width
    int nextLocal = 1;
    this.inputLocal = nextLocal++;
    this.offsetLocal = nextLocal++;
    this.lengthLocal = nextLocal++;

    this.stateLabels = IntStream
      .range(0, dfa.stateCount())
      .mapToObj(s -> new Label())
      .collect(Collectors.toUnmodifiableList());
    this.returnSuccess = new Label();
    this.returnFailure = new Label();
  }

  public void visitDfa() {
    initializeLocals();

    if (printDebugInfo) {
      visitPrintErrConstantString("[DFA] starting run on: ", false);
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      Method.TOSTRING_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      visitPrintErrString();
    }

    // Jump to the first state (an automaton without states rejects everything)
    final OptionalInt initial = dfa.initialState();
    mv.visitJumpInsn(Opcodes.GOTO, initial.isPresent() ? stateLabels.get(initial.getAsInt()) : returnFailure);

    // Lay out the blocks for each state
    for (int state = 0; state < stateLabels.size(); state++) {
      mv.visitLabel(stateLabels.get(state));

      if (printDebugInfo) {
        visitPrintErrConstantString("[DFA] entering " + state + " at offset ", false);
        mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
        visitPrintErrInt();
      }

      // Out of input: the answer is whether this state accepts
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, dfa.isAccepting(state) ? returnSuccess : returnFailure);

      // Get the next character and advance
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
      mv.visitIincInsn(offsetLocal, 1);

      visitTransition(state);
    }

    visitReturn(returnSuccess, true);
    visitReturn(returnFailure, false);

    if (logger.isDebugEnabled()) {
      final var stateOffsets = new TreeMap<Integer, Integer>();
      for (int state = 0; state < stateLabels.size(); state++) {
        stateOffsets.put(state, stateLabels.get(state).getOffset());
      }
      logger.debug("DFA compilation state offsets: {}", stateOffsets);
    }
  }

  /**
   * Initialize local variables that aren't arguments.
   */
  private void initializeLocals() {
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);

    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);
  }

  private void visitReturn(Label label, boolean success) {
    mv.visitLabel(label);

    if (printDebugInfo) {
      visitPrintErrConstantString(
        success ? "[DFA] exiting run (successful)" : "[DFA] exiting run (unsuccessful)",
        true
      );
    }

    mv.visitInsn(success ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Generate the branching logic associated with a state's transitions.
   *
   * <p>The character is on top of the stack. Symbols are visited in alphabet
   * order, which is also ascending character order, so the values can go
   * straight into a switch.
   *
   * @param state state whose transitions are emitted
   */
  private void visitTransition(int state) {
    final Alphabet alphabet = dfa.alphabet();
    final Map<Integer, Label> branches = new TreeMap<>();
    for (int symbol = 0; symbol < alphabet.size(); symbol++) {
      final char c = alphabet.symbolAt(symbol);
      final OptionalInt target = dfa.step(state, c);
      if (target.isPresent()) {
        branches.put((int) c, stateLabels.get(target.getAsInt()));
      }
    }

    final int[] values = branches.keySet().stream().mapToInt(Integer::intValue).toArray();
    final Label[] labels = new ArrayList<>(branches.values()).toArray(new Label[0]);
    visitLookupBranch(returnFailure, values, labels);
  }
}
