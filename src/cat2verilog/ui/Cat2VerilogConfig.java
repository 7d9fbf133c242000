package cat2verilog.ui;

/**
 * Data-Class to hold tool options.
 */
public class Cat2VerilogConfig {

  /** Bit width of every generated signal. */
  public int signal_width = 8;
  /** Prefix for the names of generated morphism modules. */
  public String module_prefix = "morphism_";
  public String top_module_name = "top";
  /** Reject duplicate declarations instead of letting the later declaration take over the name. */
  public boolean strict_names = false;
  /** Indentation used in generated text. */
  public String tab = "    ";
}
