package cat2verilog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cat2verilog.dag.CategoryDAG;
import cat2verilog.dag.DAGBuilder;
import cat2verilog.dag.DAGScheduler;
import cat2verilog.drc.CommutativityChecker;
import cat2verilog.frontend.CategoryDescription;
import cat2verilog.frontend.CategoryParser;
import cat2verilog.netlist.Netlist;
import cat2verilog.netlist.NetlistGenerator;
import cat2verilog.ui.Cat2VerilogConfig;
import cat2verilog.util.FileWriter;
import cat2verilog.util.Verilog;

/**
 * Compile pipeline: parse, build DAG, schedule, check commutativity assertions, generate the netlist and its Verilog text.
 * <p>
 * Each stage only reads its inputs and returns a new value, so one instance may compile several descriptions concurrently.
 */
public class Cat2Verilog {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** All artifacts of one compilation. */
  public static class CompileResult {
    public final CategoryDescription description;
    public final CategoryDAG dag;
    /** Node ids of {@link #dag} in elaboration order */
    public final List<Integer> order;
    public final Netlist netlist;
    public final String verilog;

    CompileResult(CategoryDescription description, CategoryDAG dag, List<Integer> order, Netlist netlist, String verilog) {
      this.description = description;
      this.dag = dag;
      this.order = order;
      this.netlist = netlist;
      this.verilog = verilog;
    }
  }

  private final Cat2VerilogConfig cfg;

  public Cat2Verilog() { this(new Cat2VerilogConfig()); }
  public Cat2Verilog(Cat2VerilogConfig cfg) { this.cfg = cfg; }

  /**
   * Compiles an already parsed description.
   * @throws Cat2VerilogException from the first failing stage (unresolved reference, name collision in strict mode, cycle)
   */
  public CompileResult compile(CategoryDescription description) throws Cat2VerilogException {
    CategoryDAG dag = new DAGBuilder(cfg).build(description);
    List<Integer> order = new DAGScheduler().order(dag);
    new CommutativityChecker().check(description);
    Netlist netlist = new NetlistGenerator(cfg).generate(dag, order, description);
    String verilog = new Verilog(cfg).CreateNetlistText(netlist);
    return new CompileResult(description, dag, order, netlist, verilog);
  }

  /**
   * Parses and compiles a description given as source text.
   * @throws Cat2VerilogException if parsing or any later stage fails
   */
  public CompileResult compile(String source) throws Cat2VerilogException { return compile(new CategoryParser().parse(source)); }

  /**
   * Reads a description file, compiles it and writes the Verilog output. Errors are logged.
   * @return true on success
   */
  public boolean Generate(String inFile, String outFile) {
    String source;
    try {
      source = Files.readString(Paths.get(inFile), StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.fatal("Cannot read input file " + inFile, e);
      return false;
    }

    CompileResult result;
    try {
      result = compile(source);
    } catch (Cat2VerilogException e) {
      logger.error("Compilation of {} failed: {}", inFile, e.getMessage());
      return false;
    }
    logger.info("Generated {} modules from {}", result.netlist.moduleCount(), inFile);

    FileWriter toFile = new FileWriter("");
    toFile.UpdateContent(outFile, result.verilog);
    try {
      toFile.WriteFiles();
    } catch (IOException e) {
      logger.fatal("Cannot write output file " + outFile, e);
      return false;
    }
    return true;
  }
}
