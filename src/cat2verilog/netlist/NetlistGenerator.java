package cat2verilog.netlist;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cat2verilog.dag.CategoryDAG;
import cat2verilog.dag.DAGEdge;
import cat2verilog.dag.DAGNode;
import cat2verilog.dag.DAGNode.MorphismNode;
import cat2verilog.frontend.CategoryDescription;
import cat2verilog.netlist.VerilogModule.Signal;
import cat2verilog.ui.Cat2VerilogConfig;
import cat2verilog.util.Verilog;

/**
 * Turns a scheduled DAG into a {@link Netlist}.
 * <p>
 * Every morphism becomes one module with a single input (its domain) and a single output (its codomain).
 * The module body is a placeholder increment, as morphism behavior is not part of the description.
 * Objects get no module of their own; they only appear as ports of the top module.
 * The top module is a port shell and does not instantiate the morphism modules.
 */
public class NetlistGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String INPUT_PREFIX = "in_";
  public static final String OUTPUT_PREFIX = "out_";

  private final Cat2VerilogConfig cfg;
  private final Verilog language;

  public NetlistGenerator() { this(new Cat2VerilogConfig()); }
  public NetlistGenerator(Cat2VerilogConfig cfg) {
    this.cfg = cfg;
    this.language = new Verilog(cfg);
  }

  /**
   * Generates the netlist. Expects {@code order} to be a valid schedule of {@code dag}, e.g. from
   * {@link cat2verilog.dag.DAGScheduler#order(CategoryDAG)}.
   */
  public Netlist generate(CategoryDAG dag, List<Integer> order, CategoryDescription description) {
    if (order.size() != dag.nodeCount())
      throw new IllegalArgumentException("order lists " + order.size() + " nodes, DAG has " + dag.nodeCount());

    List<VerilogModule> modules = new ArrayList<>();
    for (int nodeIdx : order) {
      DAGNode node = dag.getNode(nodeIdx);
      if (!node.isMorphism())
        continue;
      modules.add(createMorphismModule(dag, (MorphismNode)node));
    }

    List<Signal> topInputs = new ArrayList<>();
    List<Signal> topOutputs = new ArrayList<>();
    for (String object : description.getObjects()) {
      topInputs.add(new Signal(INPUT_PREFIX + object, cfg.signal_width));
      topOutputs.add(new Signal(OUTPUT_PREFIX + object, cfg.signal_width));
    }
    VerilogModule top = new VerilogModule(cfg.top_module_name, topInputs, topOutputs, List.of(), List.of());

    Netlist netlist = new Netlist(modules, top);
    logger.debug("Generated {} modules", netlist.moduleCount());
    return netlist;
  }

  private VerilogModule createMorphismModule(CategoryDAG dag, MorphismNode node) {
    // DAGBuilder gives every morphism node one edge in each direction; a name overwritten
    // by a later declaration leaves a node without edges, which falls back to the default width.
    int inWidth = dag.getIncoming(node.id).stream().mapToInt((DAGEdge edge) -> edge.width).findFirst().orElse(cfg.signal_width);
    int outWidth = dag.getOutgoing(node.id).stream().mapToInt((DAGEdge edge) -> edge.width).findFirst().orElse(cfg.signal_width);
    String in = INPUT_PREFIX + node.from;
    String out = OUTPUT_PREFIX + node.to;
    String placeholder = language.CreateAssign(out, in + " + 1", "Placeholder logic");
    logger.trace("Module {}{}: {}", cfg.module_prefix, node.name, placeholder);
    return new VerilogModule(cfg.module_prefix + node.name, List.of(new Signal(in, inWidth)), List.of(new Signal(out, outWidth)),
                             List.of(), List.of(placeholder));
  }
}
