package cat2verilog.dag;

import java.util.List;
import cat2verilog.Cat2VerilogException;

/** The DAG contains a directed cycle, so no elaboration order exists. */
public class CycleException extends Cat2VerilogException {
  private static final long serialVersionUID = 1L;

  private final List<String> cycle;

  /**
   * @param cycle node names along the cycle; the first name is repeated at the end
   */
  public CycleException(List<String> cycle) {
    super("Cycle detected in DAG: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> getCycle() { return cycle; }
}
