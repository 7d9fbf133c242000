package cat2verilog.ui;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConfigReaderTest {

  private static InputStream yaml(String text) { return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)); }

  @Test
  void testValues() {
    Cat2VerilogConfig cfg = ConfigReader.Read(yaml("signal_width: 16\n"
                                                   + "module_prefix: m_\n"
                                                   + "top_module_name: category_top\n"
                                                   + "strict_names: true\n"));
    Assertions.assertEquals(16, cfg.signal_width);
    Assertions.assertEquals("m_", cfg.module_prefix);
    Assertions.assertEquals("category_top", cfg.top_module_name);
    Assertions.assertTrue(cfg.strict_names);
    Assertions.assertEquals("    ", cfg.tab);
  }

  @Test
  void testEmptyDocument() {
    Cat2VerilogConfig cfg = ConfigReader.Read(yaml(""));
    Assertions.assertEquals(8, cfg.signal_width);
    Assertions.assertEquals("morphism_", cfg.module_prefix);
    Assertions.assertEquals("top", cfg.top_module_name);
    Assertions.assertFalse(cfg.strict_names);
  }

  @Test
  void testUnknownKey() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> ConfigReader.Read(yaml("signal_bits: 4\n")));
  }

  @Test
  void testInvalidWidth() {
    IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> ConfigReader.Read(yaml("signal_width: 0\n")));
    Assertions.assertTrue(e.getMessage().contains("signal_width"));
  }

  @Test
  void testEmptyTopName() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> ConfigReader.Read(yaml("top_module_name: ''\n")));
  }

  @Test
  void testMissingFile() {
    Assertions.assertThrows(java.io.IOException.class, () -> ConfigReader.Read(new File("does/not/exist.yaml")));
  }
}
