package cat2verilog.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link Cat2VerilogConfig} from YAML. Keys are the field names of Cat2VerilogConfig; missing keys keep their defaults.
 * <pre>
 * signal_width: 16
 * top_module_name: category_top
 * strict_names: true
 * </pre>
 */
public class ConfigReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed, has unknown keys or out-of-range values
   */
  public static Cat2VerilogConfig Read(File configFile) throws IOException {
    try (InputStream in = new FileInputStream(configFile)) {
      return Read(in);
    }
  }

  public static Cat2VerilogConfig Read(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(Cat2VerilogConfig.class, new LoaderOptions()));
    Cat2VerilogConfig cfg;
    try {
      cfg = yaml.load(in);
    } catch (YAMLException e) {
      throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
    }
    if (cfg == null) {
      logger.debug("Empty configuration, using defaults");
      cfg = new Cat2VerilogConfig();
    }
    Validate(cfg);
    return cfg;
  }

  public static void Validate(Cat2VerilogConfig cfg) {
    if (cfg.signal_width < 1)
      throw new IllegalArgumentException("signal_width must be at least 1, got " + cfg.signal_width);
    if (cfg.top_module_name == null || cfg.top_module_name.isEmpty())
      throw new IllegalArgumentException("top_module_name must not be empty");
    if (cfg.module_prefix == null)
      cfg.module_prefix = "";
    if (cfg.tab == null)
      cfg.tab = "";
  }
}
