package cat2verilog.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed graph over object and morphism nodes.
 * Nodes live in an arena addressed by their id (declaration order); edges are kept in insertion order with per-node adjacency lists.
 * Instances are created by {@link DAGBuilder} and never change afterwards.
 */
public class CategoryDAG {
  private final List<DAGNode> nodes;
  private final List<DAGEdge> edges;
  private final Map<String, Integer> nodeIndices;
  private final List<List<DAGEdge>> outgoing;
  private final List<List<DAGEdge>> incoming;

  CategoryDAG(List<DAGNode> nodes, List<DAGEdge> edges, Map<String, Integer> nodeIndices) {
    for (int i = 0; i < nodes.size(); ++i) {
      if (nodes.get(i).id != i)
        throw new IllegalArgumentException("node " + nodes.get(i).name + " has id " + nodes.get(i).id + " at arena position " + i);
    }
    this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    this.nodeIndices = Collections.unmodifiableMap(new LinkedHashMap<>(nodeIndices));

    List<List<DAGEdge>> outgoing_ = new ArrayList<>(nodes.size());
    List<List<DAGEdge>> incoming_ = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); ++i) {
      outgoing_.add(new ArrayList<>());
      incoming_.add(new ArrayList<>());
    }
    for (DAGEdge edge : edges) {
      checkId(edge.from);
      checkId(edge.to);
      outgoing_.get(edge.from).add(edge);
      incoming_.get(edge.to).add(edge);
    }
    outgoing_.replaceAll(Collections::unmodifiableList);
    incoming_.replaceAll(Collections::unmodifiableList);
    this.outgoing = Collections.unmodifiableList(outgoing_);
    this.incoming = Collections.unmodifiableList(incoming_);
  }

  private void checkId(int id) {
    if (id < 0 || id >= nodes.size())
      throw new IllegalArgumentException("no node with id " + id);
  }

  public int nodeCount() { return nodes.size(); }
  public int edgeCount() { return edges.size(); }

  /** Returns all nodes, ordered by id. Includes nodes whose name was later taken over by another declaration. */
  public List<DAGNode> getNodes() { return nodes; }
  public List<DAGEdge> getEdges() { return edges; }

  public DAGNode getNode(int id) {
    checkId(id);
    return nodes.get(id);
  }

  /** The name index: maps each name to the node it currently resolves to. */
  public Map<String, Integer> getNodeIndices() { return nodeIndices; }

  /** Resolves a name through the name index. */
  public Optional<DAGNode> lookup(String name) { return Optional.ofNullable(nodeIndices.get(name)).map(nodes::get); }

  public List<DAGEdge> getOutgoing(int id) {
    checkId(id);
    return outgoing.get(id);
  }
  public List<DAGEdge> getIncoming(int id) {
    checkId(id);
    return incoming.get(id);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (DAGNode node : nodes)
      sb.append(node.id).append(": ").append(node).append('\n');
    for (DAGEdge edge : edges)
      sb.append(nodes.get(edge.from).name).append(" -> ").append(nodes.get(edge.to).name).append(" [").append(edge.width).append("]\n");
    return sb.toString();
  }
}
