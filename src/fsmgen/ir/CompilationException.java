package fsmgen.ir;

import java.util.Optional;

/**
 * A failure that aborts the compilation of a component. Carries the source position of the offending node when the
 * input provided one.
 */
public class CompilationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<String> pos;

  public CompilationException(String message) {
    super(message);
    this.pos = Optional.empty();
  }

  public CompilationException(String message, Optional<String> pos) {
    super(pos.map(p -> message + " (at " + p + ")").orElse(message));
    this.pos = pos;
  }

  public CompilationException(String message, Throwable cause) {
    super(message, cause);
    this.pos = Optional.empty();
  }

  public Optional<String> getPos() { return pos; }
}
