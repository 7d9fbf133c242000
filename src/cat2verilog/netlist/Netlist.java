package cat2verilog.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generated netlist: the morphism modules in elaboration order plus exactly one top module.
 */
public class Netlist {
  private final List<VerilogModule> modules;
  private final VerilogModule topModule;

  public Netlist(List<VerilogModule> modules, VerilogModule topModule) {
    this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
    this.topModule = Objects.requireNonNull(topModule);
  }

  /** The morphism modules, without the top module. */
  public List<VerilogModule> getModules() { return modules; }
  public VerilogModule getTopModule() { return topModule; }

  /** Returns all modules in emission order, top module last. */
  public List<VerilogModule> getAllModules() {
    List<VerilogModule> all = new ArrayList<>(modules);
    all.add(topModule);
    return all;
  }

  public int moduleCount() { return modules.size() + 1; }
}
