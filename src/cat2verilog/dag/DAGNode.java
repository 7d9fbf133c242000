package cat2verilog.dag;

import java.util.Objects;

/**
 * Node of a {@link CategoryDAG}. Object nodes anchor edges and resolve references, morphism nodes become logic.
 */
public abstract class DAGNode {
  public enum NodeKind { Object, Morphism }

  /** Position in the node arena of the owning DAG. */
  public final int id;
  public final String name;

  private DAGNode(int id, String name) {
    this.id = id;
    this.name = Objects.requireNonNull(name);
  }

  public abstract NodeKind getKind();

  public boolean isMorphism() { return getKind() == NodeKind.Morphism; }

  public static final class ObjectNode extends DAGNode {
    public ObjectNode(int id, String name) { super(id, name); }

    @Override
    public NodeKind getKind() {
      return NodeKind.Object;
    }
    @Override
    public String toString() {
      return "Object " + name;
    }
  }

  public static final class MorphismNode extends DAGNode {
    public final String from;
    public final String to;

    public MorphismNode(int id, String name, String from, String to) {
      super(id, name);
      this.from = Objects.requireNonNull(from);
      this.to = Objects.requireNonNull(to);
    }

    @Override
    public NodeKind getKind() {
      return NodeKind.Morphism;
    }
    @Override
    public String toString() {
      return "Morphism " + name + ": " + from + " -> " + to;
    }
  }
}
