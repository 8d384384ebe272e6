package ctrlsynth.ui;

import ctrlsynth.CtrlSynth;
import ctrlsynth.frontend.ProgramFormatException;
import ctrlsynth.frontend.ProgramReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

public class CtrlSynthCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("ctrlsynth - compile a control program into guarded assignments and state machines", options);
    System.exit(-1);
  };

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
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("program.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML file with the cells, groups and control tree to compile")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file overriding compiler options")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory for the listing and the netlist; the listing is printed if not set")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("simulate")
                          .argName("cycles")
                          .hasArg()
                          .required(false)
                          .desc("Simulate one run of the compiled program for at most the given number of cycles")
                          .build());
    options.addOption(Option.builder().longOpt("naive").required(false).desc("Give comb conditions a settle state on every evaluation").build());
    options.addOption(Option.builder().longOpt("no-promote").required(false).desc("Promote only annotated subtrees to static islands").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String inputFileName = "";
    String outputDir = null;
    int simulateCycles = 0;
    CtrlSynthConfig cfg = new CtrlSynthConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      inputFileName = line.getOptionValue("i");
      outputDir = line.getOptionValue("o");
      if (line.hasOption("s"))
        simulateCycles = Integer.parseInt(line.getOptionValue("s"));

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
        cfg = readConfig(new File(line.getOptionValue("c")));
      if (line.hasOption("naive"))
        cfg.early_reset = false;
      if (line.hasOption("no-promote"))
        cfg.static_promotion = false;
    } catch (ParseException | NumberFormatException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    ///////// check options are not empty /////////
    assert inputFileName != null && !inputFileName.isEmpty() : "No input file selected!";

    //////////   read, compile, emit   //////////
    ProgramReader.ProgramDescription description;
    try {
      description = ProgramReader.read(new File(inputFileName));
    } catch (ProgramFormatException e) {
      logger.error("Cannot read {}: {}", inputFileName, e.getMessage());
      System.exit(1);
      return;
    } catch (IOException e) {
      logger.error("Program file {} could not be opened", inputFileName);
      printHelpAndExit(options);
      return;
    }
    CtrlSynth synth = new CtrlSynth(description.name(), description.catalog(), description.control());
    synth.SetConfig(cfg);
    boolean success = synth.Generate(outputDir);
    if (success && simulateCycles > 0)
      success = synth.Simulate(simulateCycles);

    System.exit(success ? 0 : 1);
  }

  // options not given in the file keep their defaults
  private static CtrlSynthConfig readConfig(File configFile) {
    Yaml yaml = new Yaml(new Constructor(CtrlSynthConfig.class, new LoaderOptions()));
    try (InputStream readFile = new FileInputStream(configFile)) {
      CtrlSynthConfig ret = yaml.load(readFile);
      return (ret == null) ? new CtrlSynthConfig() : ret;
    } catch (IOException e) {
      logger.error("Config file {} could not be opened", configFile);
    } catch (YAMLException e) {
      logger.error("Invalid config file {}: {}", configFile, e.getMessage());
    }
    printHelpAndExit(options);
    return null;
  }
}
