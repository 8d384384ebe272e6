package ctrlsynth.frontend;

/** Malformed YAML program description. */
public class ProgramFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProgramFormatException(String message) { super(message); }

  public ProgramFormatException(String message, Throwable cause) { super(message, cause); }
}
