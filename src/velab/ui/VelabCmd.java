package velab.ui;

import java.io.File;
import java.util.Map;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import velab.ast.Identifier;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleItem;
import velab.program.Program;
import velab.util.Diagnostic;

public class VelabCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("velab - declare, elaborate and check a hierarchical hardware design", options);
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

    options.addOption(Option.builder("d")
                          .longOpt("design")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file with the module declarations; the first module is the root")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with elaboration options")
                          .build());
    options.addOption(Option.builder("i").longOpt("inline").required(false).desc("Inline all instances after elaboration").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String designFileName = "";
    String configFileName = null;
    boolean inline = false;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      designFileName = line.getOptionValue("d");
      configFileName = line.getOptionValue("c");
      inline = line.hasOption("i");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    //////////   read inputs   //////////
    ElabConfig config;
    DesignReader.Design design;
    try {
      config = (configFileName == null) ? new ElabConfig() : ElabConfig.load(new File(configFileName));
      design = DesignReader.read(new File(designFileName));
    } catch (DesignFormatException e) {
      logger.error(e.getMessage());
      System.exit(1);
      return;
    }
    if (inline)
      config.inline = true;

    boolean success = run(design, config);
    System.exit(success ? 0 : 1);
  }

  /**
   * Declares and elaborates a design, optionally inlines it and prints the elaborated hierarchy.
   * @return true iff no step reported an error
   */
  public static boolean run(DesignReader.Design design, ElabConfig config) {
    Program program = new Program().configure(config);
    boolean success = true;

    ModuleDeclaration root = design.modules().get(0);
    program.declareAndInstantiate(root);
    success &= report(program, "root module " + root.getId().readable());
    for (ModuleDeclaration md : design.modules().subList(1, design.modules().size())) {
      program.declare(md);
      success &= report(program, "module " + md.getId().readable());
    }
    if (program.src().isEmpty()) {
      logger.error("Root module was not instantiated, nothing to evaluate");
      return false;
    }
    for (ModuleItem item : design.eval()) {
      program.eval(item);
      success &= report(program, "evaluated item");
    }

    if (config.inline)
      program.inlineAll();

    logger.info("Elaborated hierarchy:");
    for (Map.Entry<Identifier, ModuleDeclaration> elab : program.getElabs().entrySet())
      logger.info("  {} : {}", elab.getKey().readable(), elab.getValue().getId().readable());
    return success;
  }

  private static boolean report(Program program, String what) {
    for (Diagnostic warning : program.getWarnings())
      logger.warn("{}: {}", what, warning.message());
    for (Diagnostic error : program.getErrors())
      logger.error("{}: {}", what, error.message());
    return !program.error();
  }
}
