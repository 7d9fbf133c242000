package cat2verilog.drc;

import cat2verilog.Cat2VerilogException;

/**
 * A commutativity assertion does not hold.
 * Not raised at the moment, see {@link CommutativityChecker}.
 */
public class CommutativityException extends Cat2VerilogException {
  private static final long serialVersionUID = 1L;

  public CommutativityException(String message) { super(message); }
}
