package cat2verilog.dag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cat2verilog.frontend.CategoryDescription;
import cat2verilog.frontend.Statement;
import cat2verilog.frontend.Statement.MorphismDecl;
import cat2verilog.frontend.Statement.ObjectDecl;
import cat2verilog.ui.Cat2VerilogConfig;

/**
 * Builds a {@link CategoryDAG} from a category description.
 * <p>
 * Pass 1 creates one node per object and morphism declaration and registers it in the name index.
 * Pass 2 connects every morphism to its domain and codomain objects.
 * Two passes are needed since morphisms may refer to objects declared further down.
 */
public class DAGBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final int signalWidth;
  private final boolean strictNames;

  public DAGBuilder() { this(new Cat2VerilogConfig()); }
  public DAGBuilder(Cat2VerilogConfig cfg) {
    if (cfg.signal_width < 1)
      throw new IllegalArgumentException("signal_width must be positive, got " + cfg.signal_width);
    this.signalWidth = cfg.signal_width;
    this.strictNames = cfg.strict_names;
  }

  /**
   * Builds the DAG. Either returns a complete graph or throws; no partially connected graph is ever handed out.
   * @throws ReferenceException if a morphism refers to a name without an object declaration
   * @throws NameCollisionException if strict name checking is enabled and a name is declared twice
   */
  public CategoryDAG build(CategoryDescription description) throws ReferenceException, NameCollisionException {
    List<DAGNode> nodes = new ArrayList<>();
    Map<String, Integer> nodeIndices = new LinkedHashMap<>();

    // First pass: nodes.
    for (Statement stmt : description.getStatements()) {
      DAGNode node;
      if (stmt instanceof ObjectDecl) {
        node = new DAGNode.ObjectNode(nodes.size(), ((ObjectDecl)stmt).name);
      } else if (stmt instanceof MorphismDecl) {
        MorphismDecl morphism = (MorphismDecl)stmt;
        node = new DAGNode.MorphismNode(nodes.size(), morphism.name, morphism.from, morphism.to);
      } else
        continue;
      nodes.add(node);
      Integer prev = nodeIndices.put(node.name, node.id);
      if (prev != null) {
        if (strictNames)
          throw new NameCollisionException(node.name);
        // Last declaration wins, the earlier node stays in the arena without a name binding.
        logger.warn("{} overwrites earlier declaration {} of the same name", nodes.get(node.id), nodes.get(prev));
      }
    }

    // Second pass: edges. Collected locally so that nothing is added if any reference fails.
    List<DAGEdge> edges = new ArrayList<>();
    for (MorphismDecl morphism : description.getMorphisms()) {
      Integer morphismIdx = nodeIndices.get(morphism.name);
      if (morphismIdx == null)
        throw new ReferenceException(morphism.name, "Morphism " + morphism.name + " not found");
      int fromIdx = resolveObject(nodes, nodeIndices, morphism.from, morphism);
      int toIdx = resolveObject(nodes, nodeIndices, morphism.to, morphism);
      if (!nodes.get(morphismIdx).isMorphism()) {
        // Name taken over by a later object declaration: the morphism node stays unconnected.
        logger.debug("Morphism {} is shadowed by {}, not connecting it", morphism.name, nodes.get(morphismIdx));
        continue;
      }

      edges.add(new DAGEdge(fromIdx, morphismIdx, signalWidth));
      edges.add(new DAGEdge(morphismIdx, toIdx, signalWidth));
    }

    CategoryDAG dag = new CategoryDAG(nodes, edges, nodeIndices);
    logger.debug("Built DAG with {} nodes and {} edges", dag.nodeCount(), dag.edgeCount());
    logger.trace("DAG:\n{}", dag);
    return dag;
  }

  private static int resolveObject(List<DAGNode> nodes, Map<String, Integer> nodeIndices, String name, MorphismDecl user)
      throws ReferenceException {
    Integer idx = nodeIndices.get(name);
    if (idx == null)
      throw new ReferenceException(name, "Object " + name + " not found (referenced by morphism " + user.name + ")");
    if (nodes.get(idx).isMorphism())
      throw new ReferenceException(name, "Object " + name + " not found, the name refers to a morphism (referenced by morphism " +
                                             user.name + ")");
    return idx;
  }
}
