package ctrlsynth.backend;

/**
 * Output stage consuming a {@link CompiledProgram}. Implementations decide the textual form; the program itself is the contract.
 */
public interface ProgramEmitter {
  /** File name suffix of the emitted text, including the extension. */
  String suffix();

  String emit(CompiledProgram program);
}
