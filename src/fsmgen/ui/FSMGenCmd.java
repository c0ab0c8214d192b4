package fsmgen.ui;

import fsmgen.FSMGen;
import fsmgen.ir.CompilationException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class FSMGenCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("fsmgen - lower the control program of a component into FSM groups", options);
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("component.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the component to lower")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to write <component>_fsm.yaml into (default: results)")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options")
                          .build());
    options.addOption(Option.builder().longOpt("dump-fsm").required(false).desc("Print every generated FSM").build());
    options.addOption(Option.builder().longOpt("force").required(false).desc("Require the whole program to be statically timed").build());
    options.addOption(Option.builder()
                          .longOpt("early-transitions")
                          .required(false)
                          .desc("Start groups in the cycle their predecessor finishes")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  /**
   * Parses the command line and runs the generator.
   * @return the process exit code: 0 on success, 1 on invalid arguments or a compilation error
   */
  public static int run(String[] args) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    // print help if requested, before the required options are checked
    if (Arrays.asList(args).contains("-h") || Arrays.asList(args).contains("--help")) {
      printHelp(options);
      return 0;
    }

    File input;
    Path outputDir;
    FSMGenConfig cfg;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      input = new File(line.getOptionValue("i"));
      outputDir = Path.of(line.hasOption("o") ? line.getOptionValue("o") : "results");
      cfg = line.hasOption("c") ? FSMGenConfig.load(new File(line.getOptionValue("c"))) : new FSMGenConfig();
      // command line flags override the config file
      if (line.hasOption("dump-fsm"))
        cfg.dump_fsm = true;
      if (line.hasOption("force"))
        cfg.force = true;
      if (line.hasOption("early-transitions"))
        cfg.early_transitions = true;
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 1;
    }

    //////////   invoke fsm generation   //////////
    try {
      Path netlist = new FSMGen(cfg).generate(input, outputDir);
      logger.debug("Generated {}", netlist);
      return 0;
    } catch (CompilationException e) {
      logger.error("Compilation failed: {}", e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.error("Cannot write output to {}: {}", outputDir, e.getMessage());
      return 1;
    }
  }
}
