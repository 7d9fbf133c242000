package cat2verilog.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import cat2verilog.frontend.Statement.AssertCommute;
import cat2verilog.frontend.Statement.MorphismDecl;
import cat2verilog.frontend.Statement.ObjectDecl;

/**
 * Ordered, immutable sequence of statements as produced by the front end.
 */
public class CategoryDescription {
  private final List<Statement> statements;

  public CategoryDescription(List<Statement> statements) { this.statements = Collections.unmodifiableList(new ArrayList<>(statements)); }

  /** Returns all statements in source order. */
  public List<Statement> getStatements() { return statements; }

  /** Returns the names of all declared objects in declaration order. Duplicates are kept. */
  public List<String> getObjects() {
    return statements.stream()
        .filter(stmt -> stmt instanceof ObjectDecl)
        .map(stmt -> ((ObjectDecl)stmt).name)
        .collect(Collectors.toList());
  }

  /** Returns all morphism declarations in declaration order. */
  public List<MorphismDecl> getMorphisms() {
    return statements.stream()
        .filter(stmt -> stmt instanceof MorphismDecl)
        .map(stmt -> (MorphismDecl)stmt)
        .collect(Collectors.toList());
  }

  /** Returns all commutativity assertions in declaration order. */
  public List<AssertCommute> getCommuteAssertions() {
    return statements.stream()
        .filter(stmt -> stmt instanceof AssertCommute)
        .map(stmt -> (AssertCommute)stmt)
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return statements.stream().map(Statement::toString).collect(Collectors.joining("\n"));
  }
}
