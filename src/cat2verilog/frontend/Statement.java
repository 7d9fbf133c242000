package cat2verilog.frontend;

import java.util.List;
import java.util.Objects;

/**
 * One statement of a categorical description: an object declaration, a morphism declaration or a commutativity assertion.
 */
public abstract class Statement {
  public enum StatementKind { Object, Morphism, AssertCommute }

  private Statement() {}

  public abstract StatementKind getKind();

  /** {@code object A} */
  public static final class ObjectDecl extends Statement {
    public final String name;

    public ObjectDecl(String name) { this.name = Objects.requireNonNull(name); }

    @Override
    public StatementKind getKind() {
      return StatementKind.Object;
    }
    @Override
    public int hashCode() {
      return Objects.hash(name);
    }
    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      return name.equals(((ObjectDecl)obj).name);
    }
    @Override
    public String toString() {
      return "object " + name;
    }
  }

  /** {@code morphism f: A -> B} */
  public static final class MorphismDecl extends Statement {
    public final String name;
    /** Name of the domain object */
    public final String from;
    /** Name of the codomain object */
    public final String to;

    public MorphismDecl(String name, String from, String to) {
      this.name = Objects.requireNonNull(name);
      this.from = Objects.requireNonNull(from);
      this.to = Objects.requireNonNull(to);
    }

    @Override
    public StatementKind getKind() {
      return StatementKind.Morphism;
    }
    @Override
    public int hashCode() {
      return Objects.hash(name, from, to);
    }
    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      MorphismDecl other = (MorphismDecl)obj;
      return name.equals(other.name) && from.equals(other.from) && to.equals(other.to);
    }
    @Override
    public String toString() {
      return "morphism " + name + ": " + from + " -> " + to;
    }
  }

  /**
   * {@code assert commute: g ∘ f == h}
   * <p>
   * Both sides are composition paths. The first element of a path is the outermost (last applied) morphism,
   * i.e. {@code g ∘ f} is stored as {@code [g, f]}.
   */
  public static final class AssertCommute extends Statement {
    public final List<String> lhs;
    public final List<String> rhs;

    public AssertCommute(List<String> lhs, List<String> rhs) {
      if (lhs.isEmpty() || rhs.isEmpty())
        throw new IllegalArgumentException("composition paths must not be empty");
      this.lhs = List.copyOf(lhs);
      this.rhs = List.copyOf(rhs);
    }

    @Override
    public StatementKind getKind() {
      return StatementKind.AssertCommute;
    }
    @Override
    public int hashCode() {
      return Objects.hash(lhs, rhs);
    }
    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      AssertCommute other = (AssertCommute)obj;
      return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }
    @Override
    public String toString() {
      return "assert commute: " + String.join(" ∘ ", lhs) + " == " + String.join(" ∘ ", rhs);
    }
  }
}
