package rvfchecks.ui;

import java.io.IOException;
import java.util.stream.Stream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import rvfchecks.RVFChecks;
import rvfchecks.config.ConfigException;
import rvfchecks.sby.TemplateException;

public class RVFChecksCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("rvfchecks - generate all sby checks of a core for riscv-formal", options);
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("c")
                          .longOpt("corename")
                          .argName("core")
                          .hasArg()
                          .required(true)
                          .desc("Core name used by rvfi when generating checks. Should match the subdirectory holding its configuration")
                          .build());
    options.addOption(Option.builder("n")
                          .longOpt("cfgname")
                          .argName("name")
                          .hasArg()
                          .required(false)
                          .desc("Name of the configuration and of the destination directory inside the core directory [Default = "
                                + PathConfig.DefaultCfgName + "]")
                          .build());
    options.addOption(Option.builder("b")
                          .longOpt("basedir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Path to all checks in the rvfi library [Default = " + PathConfig.defaultBasedir() + "]")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print usage and exit").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all log output").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Log configuration and filter decisions").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Also log every rendered and written check").build());
    return options;
  }

  public static void main(String[] args) {
    // console logging, level adjusted by -q/-v/-vv in run
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  /**
   * Parses the command line and runs the generator.
   * @return process exit status
   */
  static int run(String[] args) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();
    // print help if requested, before the required options are checked
    if (Stream.of(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
      printHelp(options);
      return 0;
    }

    PathConfig pathCfg;
    try {
      CommandLine line = parser.parse(options, args);

      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      pathCfg = new PathConfig(line.getOptionValue("c"));
      if (line.hasOption("n"))
        pathCfg.cfgname = line.getOptionValue("n");
      if (line.hasOption("b"))
        pathCfg.basedir = line.getOptionValue("b");
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelp(options);
      return 1;
    }

    logger.info("Entering {} directory", pathCfg.corename);
    try {
      new RVFChecks().Generate(pathCfg);
    } catch (ConfigException e) {
      logger.fatal("Configuration error: {}", e.getMessage());
      logger.debug("Configuration error details", e);
      return 1;
    } catch (TemplateException e) {
      logger.fatal("Template error: {}", e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.fatal("I/O error: {}", e.toString());
      logger.debug("I/O error details", e);
      return 1;
    }
    return 0;
  }
}
