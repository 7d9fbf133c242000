package cat2verilog.netlist;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import cat2verilog.dag.CategoryDAG;
import cat2verilog.dag.CategoryTestBuilder;
import cat2verilog.dag.DAGBuilder;
import cat2verilog.dag.DAGScheduler;
import cat2verilog.frontend.CategoryDescription;
import cat2verilog.frontend.CategoryParser;
import cat2verilog.netlist.VerilogModule.Signal;
import cat2verilog.ui.Cat2VerilogConfig;

class NetlistGeneratorTest {

  private static Netlist generate(Cat2VerilogConfig cfg, CategoryDescription description) throws Exception {
    CategoryDAG dag = new DAGBuilder(cfg).build(description);
    List<Integer> order = new DAGScheduler().order(dag);
    return new NetlistGenerator(cfg).generate(dag, order, description);
  }

  @Test
  void testMinimalChain() throws Exception {
    Netlist netlist = generate(new Cat2VerilogConfig(), new CategoryParser().parse("object A\nobject B\nmorphism f: A -> B"));

    Assertions.assertEquals(2, netlist.moduleCount());
    Assertions.assertEquals(1, netlist.getModules().size());
    VerilogModule f = netlist.getModules().get(0);
    Assertions.assertEquals("morphism_f", f.name);
    Assertions.assertEquals(List.of(new Signal("in_A", 8)), f.inputs);
    Assertions.assertEquals(List.of(new Signal("out_B", 8)), f.outputs);
    Assertions.assertTrue(f.wires.isEmpty());
    Assertions.assertEquals(List.of("assign out_B = in_A + 1; // Placeholder logic"), f.assignments);

    VerilogModule top = netlist.getTopModule();
    Assertions.assertEquals("top", top.name);
    Assertions.assertEquals(List.of(new Signal("in_A", 8), new Signal("in_B", 8)), top.inputs);
    Assertions.assertEquals(List.of(new Signal("out_A", 8), new Signal("out_B", 8)), top.outputs);
    Assertions.assertTrue(top.wires.isEmpty());
    Assertions.assertTrue(top.assignments.isEmpty());
    Assertions.assertSame(top, netlist.getAllModules().get(1));
  }

  @Test
  void testModulesFollowSchedule() throws Exception {
    Netlist netlist = generate(new Cat2VerilogConfig(), new CategoryParser().parse("object A\nobject B\nobject C\n"
                                                                                   + "morphism h: A -> C\n"
                                                                                   + "morphism g: B -> C\n"
                                                                                   + "morphism f: A -> B\n"));
    // A is ready first and unlocks h and f; h was declared before f, f then unlocks B and g.
    Assertions.assertEquals(List.of("morphism_h", "morphism_f", "morphism_g"),
                            netlist.getModules().stream().map(module -> module.name).collect(Collectors.toList()));
  }

  @Test
  void testTopPortsInDeclarationOrder() throws Exception {
    Netlist netlist = generate(new Cat2VerilogConfig(), new CategoryParser().parse("object Z\nobject A\nobject M"));
    Assertions.assertEquals(1, netlist.moduleCount());
    Assertions.assertEquals(List.of("in_Z", "in_A", "in_M"),
                            netlist.getTopModule().inputs.stream().map(port -> port.name).collect(Collectors.toList()));
    Assertions.assertEquals(List.of("out_Z", "out_A", "out_M"),
                            netlist.getTopModule().outputs.stream().map(port -> port.name).collect(Collectors.toList()));
  }

  @Test
  void testConfiguredNames() throws Exception {
    Cat2VerilogConfig cfg = new Cat2VerilogConfig();
    cfg.signal_width = 16;
    cfg.module_prefix = "m_";
    cfg.top_module_name = "category_top";
    Netlist netlist = generate(cfg, new CategoryParser().parse("object A\nobject B\nmorphism f: A -> B"));
    Assertions.assertEquals("m_f", netlist.getModules().get(0).name);
    Assertions.assertEquals(16, netlist.getModules().get(0).inputs.get(0).width);
    Assertions.assertEquals("category_top", netlist.getTopModule().name);
    Assertions.assertTrue(netlist.getTopModule().inputs.stream().allMatch(port -> port.width == 16));
  }

  @Test
  void testShadowedObjectKeepsTopPort() throws Exception {
    // object X loses its name to morphism X but is still a declared object
    Netlist netlist = generate(new Cat2VerilogConfig(), new CategoryParser().parse("object X\nobject A\nobject B\nmorphism X: A -> B"));
    Assertions.assertEquals(2, netlist.moduleCount());
    Assertions.assertEquals("morphism_X", netlist.getModules().get(0).name);
    Assertions.assertEquals(List.of("in_X", "in_A", "in_B"),
                            netlist.getTopModule().inputs.stream().map(port -> port.name).collect(Collectors.toList()));
  }

  @Test
  void testShadowedMorphismKeepsModule() throws Exception {
    Cat2VerilogConfig cfg = new Cat2VerilogConfig();
    cfg.signal_width = 4;
    Netlist netlist = generate(cfg, new CategoryParser().parse("object A\nobject B\nmorphism X: A -> B\nobject X"));
    Assertions.assertEquals(2, netlist.moduleCount());
    VerilogModule x = netlist.getModules().get(0);
    Assertions.assertEquals("morphism_X", x.name);
    Assertions.assertEquals(List.of(new Signal("in_A", 4)), x.inputs);
    Assertions.assertEquals(List.of(new Signal("out_B", 4)), x.outputs);
    Assertions.assertEquals(List.of("in_A", "in_B", "in_X"),
                            netlist.getTopModule().inputs.stream().map(port -> port.name).collect(Collectors.toList()));
  }

  @Test
  void testOrderMismatch() throws Exception {
    CategoryDescription description = new CategoryParser().parse("object A\nobject B\nmorphism f: A -> B");
    CategoryDAG dag = new DAGBuilder().build(description);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new NetlistGenerator().generate(dag, List.of(0, 2), description));
  }

  @RepeatedTest(32)
  void testModuleCount_random() throws Exception {
    long seed = new Random().nextLong();
    try {
      testModuleCount(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testModuleCount with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3, 1234, 68392, -6733423670758169604L})
  void testModuleCount(long seed) throws Exception {
    var generated = new CategoryTestBuilder(new Random(seed)).buildAcyclic(8, 16);
    Netlist netlist = generate(new Cat2VerilogConfig(), generated.description);
    Assertions.assertEquals(generated.morphisms.size() + 1, netlist.moduleCount());
    Assertions.assertEquals(generated.objects.size(), netlist.getTopModule().inputs.size());
    Assertions.assertEquals(generated.objects.size(), netlist.getTopModule().outputs.size());
    for (VerilogModule module : netlist.getModules()) {
      Assertions.assertEquals(1, module.inputs.size());
      Assertions.assertEquals(1, module.outputs.size());
      Assertions.assertEquals(1, module.assignments.size());
    }
  }
}
