package cat2verilog.dag;

import cat2verilog.Cat2VerilogException;

/** A morphism refers to a name that no declaration provides. */
public class ReferenceException extends Cat2VerilogException {
  private static final long serialVersionUID = 1L;

  private final String missingName;

  public ReferenceException(String missingName, String message) {
    super(message);
    this.missingName = missingName;
  }

  /** The identifier that could not be resolved. */
  public String getMissingName() { return missingName; }
}
