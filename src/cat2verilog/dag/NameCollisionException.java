package cat2verilog.dag;

import cat2verilog.Cat2VerilogException;

/** Two declarations use the same name. Only raised with strict name checking enabled. */
public class NameCollisionException extends Cat2VerilogException {
  private static final long serialVersionUID = 1L;

  private final String name;

  public NameCollisionException(String name) {
    super("Name " + name + " is declared more than once");
    this.name = name;
  }

  public String getName() { return name; }
}
