package cat2verilog.netlist;

import java.util.List;
import java.util.Objects;

/**
 * One generated HDL module: ports, internal wires and assignment statements, all in emission order.
 */
public class VerilogModule {
  /** A named signal of a given bit width, used for ports and wires. */
  public static class Signal {
    public final String name;
    public final int width;

    public Signal(String name, int width) {
      if (width < 1)
        throw new IllegalArgumentException("signal " + name + " must have a positive width, got " + width);
      this.name = Objects.requireNonNull(name);
      this.width = width;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, width);
    }
    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      Signal other = (Signal)obj;
      return name.equals(other.name) && width == other.width;
    }
    @Override
    public String toString() {
      return name + "[" + width + "]";
    }
  }

  public final String name;
  public final List<Signal> inputs;
  public final List<Signal> outputs;
  public final List<Signal> wires;
  /** Complete statements, e.g. {@code assign a = b;} */
  public final List<String> assignments;

  public VerilogModule(String name, List<Signal> inputs, List<Signal> outputs, List<Signal> wires, List<String> assignments) {
    this.name = Objects.requireNonNull(name);
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
    this.wires = List.copyOf(wires);
    this.assignments = List.copyOf(assignments);
  }

  @Override
  public String toString() {
    return "module " + name + " in=" + inputs + " out=" + outputs;
  }
}
