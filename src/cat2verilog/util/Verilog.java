package cat2verilog.util;

import java.util.ArrayList;
import java.util.List;
import cat2verilog.netlist.Netlist;
import cat2verilog.netlist.VerilogModule;
import cat2verilog.netlist.VerilogModule.Signal;
import cat2verilog.ui.Cat2VerilogConfig;

public class Verilog extends GenerateText {

  /**
   * Class constructor
   * @param cfg supplies the indentation
   */
  public Verilog(Cat2VerilogConfig cfg) {
    DictionaryDefinition();
    this.tab = cfg.tab;
  }

  public Verilog() { DictionaryDefinition(); }

  private void DictionaryDefinition() {
    dictionary.put(DictWords.module, "module");
    dictionary.put(DictWords.endmodule, "endmodule");
    dictionary.put(DictWords.wire, "wire");
    dictionary.put(DictWords.assign, "assign");
    dictionary.put(DictWords.assign_eq, "=");
    dictionary.put(DictWords.bitsselectRight, "]");
    dictionary.put(DictWords.bitsselectLeft, "[");
    dictionary.put(DictWords.bitsRange, ":");
    dictionary.put(DictWords.in, "input");
    dictionary.put(DictWords.out, "output");
    dictionary.put(DictWords.comment, "//");
  }

  /** Generates text like {@code [7:0]} for the given width. */
  public String CreateRange(int width) {
    return dictionary.get(DictWords.bitsselectLeft) + (width - 1) + dictionary.get(DictWords.bitsRange) + "0" +
        dictionary.get(DictWords.bitsselectRight);
  }

  /** Generates text like {@code input [7:0] in_A} (no separator). */
  public String CreateTextInterface(Signal port, boolean isInput) {
    return dictionary.get(isInput ? DictWords.in : DictWords.out) + " " + CreateRange(port.width) + " " + port.name;
  }

  /** Generates text like {@code wire [7:0] name;} */
  public String CreateDeclSig(Signal wire) {
    return dictionary.get(DictWords.wire) + " " + CreateRange(wire.width) + " " + wire.name + ";";
  }

  /** Generates text like {@code assign a = b;} */
  public String CreateAssign(String assigSig, String toAssign) {
    return dictionary.get(DictWords.assign) + " " + assigSig + " " + dictionary.get(DictWords.assign_eq) + " " + toAssign + ";";
  }

  /** Generates text like {@code assign a = b; // comment} */
  public String CreateAssign(String assigSig, String toAssign, String comment) {
    return CreateAssign(assigSig, toAssign) + " " + dictionary.get(DictWords.comment) + " " + comment;
  }

  /**
   * Renders one module: header with all ports (inputs first, one per line, comma-separated),
   * optional wire declarations followed by a blank line, the assignments and the closing keyword.
   */
  public String CreateModuleText(VerilogModule module) {
    StringBuilder text = new StringBuilder();
    text.append(GetDictModule()).append(" ").append(module.name).append(" (\n");

    List<String> ports = new ArrayList<>(module.inputs.size() + module.outputs.size());
    module.inputs.forEach(port -> ports.add(CreateTextInterface(port, true)));
    module.outputs.forEach(port -> ports.add(CreateTextInterface(port, false)));
    for (int i = 0; i < ports.size(); ++i) {
      text.append(tab).append(ports.get(i));
      if (i < ports.size() - 1)
        text.append(",");
      text.append("\n");
    }
    text.append(");\n\n");

    for (Signal wire : module.wires)
      text.append(tab).append(CreateDeclSig(wire)).append("\n");
    if (!module.wires.isEmpty())
      text.append("\n");

    for (String assignment : module.assignments)
      text.append(AlignText(tab, assignment)).append("\n");

    text.append(GetDictEndModule()).append("\n");
    return text.toString();
  }

  /** Renders all modules of a netlist in order, top module last, separated by a blank line. */
  public String CreateNetlistText(Netlist netlist) {
    StringBuilder text = new StringBuilder();
    for (VerilogModule module : netlist.getModules())
      text.append(CreateModuleText(module)).append("\n");
    text.append(CreateModuleText(netlist.getTopModule()));
    return text.toString();
  }
}
