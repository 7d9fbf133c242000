package cat2verilog.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import cat2verilog.frontend.Statement.AssertCommute;
import cat2verilog.frontend.Statement.MorphismDecl;
import cat2verilog.frontend.Statement.ObjectDecl;

class CategoryParserTest {
  CategoryParser parser;

  @BeforeEach
  void setUp() {
    parser = new CategoryParser();
  }

  @Test
  void testParseObject() throws Exception {
    Assertions.assertEquals(new ObjectDecl("A"), parser.parseStatement("object A", 1));
  }

  @Test
  void testParseMorphism() throws Exception {
    Assertions.assertEquals(new MorphismDecl("f", "A", "B"), parser.parseStatement("morphism f: A -> B", 1));
  }

  @Test
  void testParseAssertCommute() throws Exception {
    Statement stmt = parser.parseStatement("assert commute: g ∘ f == h", 1);
    Assertions.assertEquals(Statement.StatementKind.AssertCommute, stmt.getKind());
    AssertCommute assertion = (AssertCommute)stmt;
    Assertions.assertEquals(List.of("g", "f"), assertion.lhs);
    Assertions.assertEquals(List.of("h"), assertion.rhs);
  }

  @ParameterizedTest
  @ValueSource(strings = {"morphism f:A->B", "morphism  f :  A  ->  B", "\tmorphism f: A -> B  ", "morphism f :A-> B"})
  void testMorphismSpacing(String line) throws Exception {
    Assertions.assertEquals(new MorphismDecl("f", "A", "B"), parser.parseStatement(line, 1));
  }

  @Test
  void testLongPathsWithoutSpaces() throws Exception {
    AssertCommute assertion = (AssertCommute)parser.parseStatement("assert commute: k∘h∘g_1 == f2∘id", 1);
    Assertions.assertEquals(List.of("k", "h", "g_1"), assertion.lhs);
    Assertions.assertEquals(List.of("f2", "id"), assertion.rhs);
  }

  @ParameterizedTest
  @ValueSource(strings = {"objectA", "object", "object 1A", "morphism f A -> B", "morphism f: A => B", "assert commute: g ∘ == h",
                          "assert commute: g ∘ f", "assert  commute: f == g", "object A B", "foo bar"})
  void testMalformed(String line) {
    CategoryParseException ex = Assertions.assertThrows(CategoryParseException.class, () -> parser.parseStatement(line, 7));
    Assertions.assertEquals(7, ex.getLine());
    Assertions.assertTrue(ex.getMessage().startsWith("line 7: "), ex.getMessage());
  }

  @Test
  void testParseFile() throws Exception {
    String source = "object A\n"
                    + "\n"
                    + "object B\r\n"
                    + "   \n"
                    + "morphism f: A -> B\n"
                    + "morphism g: B -> A\n"
                    + "assert commute: g ∘ f == f\n";
    CategoryDescription description = parser.parse(source);
    Assertions.assertEquals(5, description.getStatements().size());
    Assertions.assertEquals(List.of("A", "B"), description.getObjects());
    Assertions.assertEquals(List.of(new MorphismDecl("f", "A", "B"), new MorphismDecl("g", "B", "A")), description.getMorphisms());
    Assertions.assertEquals(1, description.getCommuteAssertions().size());
  }

  @Test
  void testErrorLineNumber() {
    String source = "object A\n\nobject B\nmorphism f A -> B\n";
    CategoryParseException ex = Assertions.assertThrows(CategoryParseException.class, () -> parser.parse(source));
    Assertions.assertEquals(4, ex.getLine());
    Assertions.assertEquals("morphism f A -> B", ex.getText());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "\n\n", "  \n\t\n"})
  void testEmpty(String source) {
    Assertions.assertThrows(CategoryParseException.class, () -> parser.parse(source));
  }

  @Test
  void testRoundTripThroughToString() throws Exception {
    String source = "object A\nobject B\nmorphism f: A -> B\nassert commute: f ∘ f == f";
    Assertions.assertEquals(source, parser.parse(source).toString());
  }
}
