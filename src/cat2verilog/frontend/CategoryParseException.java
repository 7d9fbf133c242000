package cat2verilog.frontend;

import cat2verilog.Cat2VerilogException;

/** Raised when a line of a category description does not match any statement shape. */
public class CategoryParseException extends Cat2VerilogException {
  private static final long serialVersionUID = 1L;

  private final int line;
  private final String text;

  /**
   * @param line 1-based line number, or 0 if the error does not belong to a single line
   * @param text the offending source text
   */
  public CategoryParseException(int line, String text, String message) {
    super(line > 0 ? "line " + line + ": " + message + ": '" + text + "'" : message);
    this.line = line;
    this.text = text;
  }

  public int getLine() { return line; }
  public String getText() { return text; }
}
