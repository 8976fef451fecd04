package langex.codegen;

import langex.graph.Dfa;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles automata into JVM bytecode.
 *
 * <p>The generated matcher accepts exactly the inputs {@link Dfa#evaluate}
 * accepts, but walks the automaton with jumps between basic blocks instead of
 * table lookups. Automata with many states may not fit in a single method, in
 * which case ASM reports a {@code MethodTooLargeException} and the interpreted
 * {@link Dfa#evaluate} should be used instead.
 */
public final class CompiledDfa {

  private static final Logger logger = LoggerFactory.getLogger(CompiledDfa.class);

  private static final String CLASS_NAME = "langex/codegen/CompiledDfa$Matcher";

  private CompiledDfa() { }

  /**
   * Compile an automaton into a matcher.
   *
   * @param dfa automaton to compile
   * @param printDebugInfo generate code which traces the run to STDERR
   * @return freshly loaded matcher
   */
  public static CompiledMatcher compile(Dfa dfa, boolean printDebugInfo)
  throws IllegalAccessException, NoSuchMethodException {
    final int classFlags = Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
    final byte[] classBytes = generateMatcherClass(dfa, CLASS_NAME, classFlags, printDebugInfo).toByteArray();
    logger.debug("Compiled {} into {} bytes of class file", dfa, classBytes.length);

    // Load the class and get a handle on the constructor
    final MethodHandles.Lookup lookup = MethodHandles
      .lookup()
      .defineHiddenClass(classBytes, true);
    final MethodHandle constructMatcher = lookup.findConstructor(
      lookup.lookupClass(),
      MethodType.methodType(void.class)
    );

    try {
      return (CompiledMatcher) constructMatcher.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct matcher", error);
    }
  }

  public static CompiledMatcher compile(Dfa dfa) throws IllegalAccessException, NoSuchMethodException {
    return compile(dfa, false);
  }

  /**
   * Code generator for a compiled DFA matcher.
   *
   * @param dfa automaton to encode
   * @param className name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @param printDebugInfo generate code which prints debug info to STDERR
   * @return class writer for a class implementing {@link CompiledMatcher}
   */
  static ClassWriter generateMatcherClass(
    Dfa dfa,
    String className,
    int classFlags,
    boolean printDebugInfo
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.COMPILEDMATCHER_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `matches` method
    {
      final var mv = Method.MATCHES_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      mv.visitCode();
      new DfaMethodCodegen(mv, dfa, printDebugInfo).visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }
}
