package cat2verilog.dag;

/**
 * Data-flow edge between two nodes of a {@link CategoryDAG}.
 */
public class DAGEdge {
  /** Source node id */
  public final int from;
  /** Target node id */
  public final int to;
  /** Signal width in bits */
  public final int width;

  public DAGEdge(int from, int to, int width) {
    if (width < 1)
      throw new IllegalArgumentException("edge width must be positive, got " + width);
    this.from = from;
    this.to = to;
    this.width = width;
  }

  @Override
  public String toString() {
    return from + " -> " + to + " [" + width + "]";
  }
}
