package cat2verilog.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Line-based parser for category descriptions.
 * <pre>
 * object A
 * morphism f: A -> B
 * assert commute: g ∘ f == h
 * </pre>
 * One statement per line; blank lines and surrounding whitespace are ignored.
 */
public class CategoryParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String COMPOSITION_OP = "∘";

  private static final String IDENT = "[A-Za-z_][A-Za-z0-9_]*";
  private static final String PATH = IDENT + "(?:[ \\t]*" + COMPOSITION_OP + "[ \\t]*" + IDENT + ")*";

  private static final Pattern OBJECT = Pattern.compile("object[ \\t]+(" + IDENT + ")");
  private static final Pattern MORPHISM =
      Pattern.compile("morphism[ \\t]+(" + IDENT + ")[ \\t]*:[ \\t]*(" + IDENT + ")[ \\t]*->[ \\t]*(" + IDENT + ")");
  private static final Pattern ASSERT_COMMUTE = Pattern.compile("assert commute:[ \\t]*(" + PATH + ")[ \\t]*==[ \\t]*(" + PATH + ")");
  private static final Pattern COMPOSITION_SPLIT = Pattern.compile("[ \\t]*" + COMPOSITION_OP + "[ \\t]*");

  /**
   * Parses a single statement.
   * @param line the statement text without line break
   * @param lineNumber 1-based line number for error messages
   * @throws CategoryParseException if the text matches none of the statement shapes
   */
  public Statement parseStatement(String line, int lineNumber) throws CategoryParseException {
    String text = line.strip();
    Matcher m = OBJECT.matcher(text);
    if (m.matches())
      return new Statement.ObjectDecl(m.group(1));
    m = MORPHISM.matcher(text);
    if (m.matches())
      return new Statement.MorphismDecl(m.group(1), m.group(2), m.group(3));
    m = ASSERT_COMMUTE.matcher(text);
    if (m.matches())
      return new Statement.AssertCommute(parsePath(m.group(1)), parsePath(m.group(2)));
    throw new CategoryParseException(lineNumber, text, "unrecognized statement");
  }

  private static List<String> parsePath(String path) { return Arrays.asList(COMPOSITION_SPLIT.split(path.strip())); }

  /**
   * Parses a complete category description.
   * @throws CategoryParseException on the first malformed line, or if the input contains no statement
   */
  public CategoryDescription parse(String source) throws CategoryParseException {
    List<Statement> statements = new ArrayList<>();
    String[] lines = source.split("\\r?\\n", -1);
    for (int i = 0; i < lines.length; ++i) {
      if (lines[i].isBlank())
        continue;
      Statement stmt = parseStatement(lines[i], i + 1);
      logger.trace("Parsed line {}: {}", i + 1, stmt);
      statements.add(stmt);
    }
    if (statements.isEmpty())
      throw new CategoryParseException(0, source, "description contains no statement");
    return new CategoryDescription(statements);
  }
}
