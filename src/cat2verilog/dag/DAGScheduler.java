package cat2verilog.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes the elaboration order of a {@link CategoryDAG}.
 * <p>
 * Uses Kahn's algorithm. Whenever several nodes are ready, the one declared first (lowest id) is taken,
 * so the result only depends on the DAG contents.
 */
public class DAGScheduler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Returns all node ids in topological order: for every edge u-&gt;v, u is listed before v.
   * The DAG is not modified.
   * @throws CycleException if the graph has a directed cycle; no partial order is returned in that case
   */
  public List<Integer> order(CategoryDAG dag) throws CycleException {
    int n = dag.nodeCount();
    int[] remainingInputs = new int[n];
    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < n; ++i) {
      remainingInputs[i] = dag.getIncoming(i).size();
      if (remainingInputs[i] == 0)
        ready.add(i);
    }

    List<Integer> order = new ArrayList<>(n);
    while (!ready.isEmpty()) {
      int u = ready.poll();
      order.add(u);
      for (DAGEdge edge : dag.getOutgoing(u)) {
        if (--remainingInputs[edge.to] == 0)
          ready.add(edge.to);
      }
    }

    if (order.size() != n)
      throw new CycleException(findCycle(dag, remainingInputs));

    logger.debug("Execution order: {}", order.stream().map(id -> dag.getNode(id).name).collect(Collectors.joining(", ")));
    return Collections.unmodifiableList(order);
  }

  /**
   * Extracts one cycle from the nodes Kahn's algorithm could not emit.
   * Each of those nodes has at least one predecessor that was not emitted either,
   * so walking backwards along such predecessors must eventually revisit a node.
   */
  private static List<String> findCycle(CategoryDAG dag, int[] remainingInputs) {
    int start = 0;
    while (remainingInputs[start] == 0)
      ++start;

    HashMap<Integer, Integer> positionInWalk = new HashMap<>();
    List<Integer> walk = new ArrayList<>();
    int cur = start;
    while (!positionInWalk.containsKey(cur)) {
      positionInWalk.put(cur, walk.size());
      walk.add(cur);
      cur = dag.getIncoming(cur)
                .stream()
                .filter(edge -> remainingInputs[edge.from] > 0)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("unscheduled node without unscheduled predecessor"))
                .from;
    }
    // walk[positionInWalk(cur)..] is the cycle against edge direction, starting at cur.
    List<Integer> cycle = new ArrayList<>(walk.subList(positionInWalk.get(cur) + 1, walk.size()));
    Collections.reverse(cycle);
    cycle.add(0, cur);
    cycle.add(cur);
    return cycle.stream().map(id -> dag.getNode(id).name).collect(Collectors.toList());
  }
}
