package cat2verilog;

/**
 * Base class of all errors reported by the cat2verilog pipeline stages.
 * These are compile-time errors of the input description; none of them has a transient cause.
 */
public class Cat2VerilogException extends Exception {
  private static final long serialVersionUID = 1L;

  public Cat2VerilogException(String message) { super(message); }
  public Cat2VerilogException(String message, Throwable cause) { super(message, cause); }
}
