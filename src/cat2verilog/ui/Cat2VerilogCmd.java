package cat2verilog.ui;

import java.io.File;
import java.io.IOException;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import cat2verilog.Cat2Verilog;

public class Cat2VerilogCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();
  static {
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("description.cat")
                          .hasArg()
                          .required(false)
                          .desc("Category description with object, morphism and assert commute statements")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("netlist.v")
                          .hasArg()
                          .required(false)
                          .desc("Verilog file to generate; defaults to the input file name with .v extension")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options (signal_width, module_prefix, top_module_name, strict_names, tab)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static int printHelp(Options options) {
    helper.printHelp("cat2verilog - generate a Verilog netlist from a category description", options);
    return -1;
  }

  private static void initLogging() {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  /** Default output path: input path with its extension replaced by .v */
  static String DefaultOutputFile(String inputFile) {
    File in = new File(inputFile);
    String name = in.getName();
    int dot = name.lastIndexOf('.');
    String outName = (dot > 0 ? name.substring(0, dot) : name) + ".v";
    return in.getParent() == null ? outName : new File(in.getParent(), outName).getPath();
  }

  // entrypoint
  public static void main(String[] args) { System.exit(run(args)); }

  /**
   * Runs the command line tool.
   * @return process exit status: 0 on success, 1 if compilation failed, -1 for usage errors
   */
  public static int run(String[] args) {
    initLogging();

    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String inputFile;
    String outputFile;
    Cat2VerilogConfig cfg = new Cat2VerilogConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h"))
        return printHelp(options);
      if (!line.hasOption("i")) {
        System.err.println("Missing required option: i");
        return printHelp(options);
      }

      inputFile = line.getOptionValue("i");
      outputFile = line.hasOption("o") ? line.getOptionValue("o") : DefaultOutputFile(inputFile);

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c"))
        cfg = ConfigReader.Read(new File(line.getOptionValue("c")));
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      return printHelp(options);
    } catch (IOException | IllegalArgumentException e) {
      logger.error("Cannot load configuration: " + e.getMessage());
      return -1;
    }

    //////////   invoke cat2verilog pipeline   //////////
    logger.debug("Compiling {} to {}", inputFile, outputFile);
    boolean success = new Cat2Verilog(cfg).Generate(inputFile, outputFile);
    return success ? 0 : 1;
  }
}
