package fsmgen.ir;

import java.util.Optional;

/**
 * The control program or input document violates a structural precondition of a lowering stage, e.g. an invoke or par
 * node that should have been compiled away.
 */
public class MalformedControlException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public MalformedControlException(String message) { super(message); }

  public MalformedControlException(String message, Optional<String> pos) { super(message, pos); }

  /** Uses the position recorded in the attributes of the offending node. */
  public MalformedControlException(String message, Attributes attrs) { super(message, attrs.getPos()); }

  public MalformedControlException(String message, Throwable cause) { super(message, cause); }
}
