package pardir.exec;

import pardir.analysis.AnalysisPass;
import pardir.analysis.DirectiveClausePass;
import pardir.analysis.DirectiveValidationPass;
import pardir.hir.Container;
import pardir.hir.PrintTools;
import pardir.hir.Tools;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Implements the command line option registry and controls pass ordering.
 * The front end builds a {@link Container Container} with resolved symbol
 * tables and hands it to {@link #run(Container)}, which runs the passes
 * selected by the options. Users may extend this class by overriding
 * runPasses.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static
  {
    registerOptions();
  }

  /**
   * The container the passes run on; set by {@link #run(Container)}.
   */
  protected Container container;

  /**
   * Constructor used by derived classes.
   */
  protected Driver()
  {
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Calling this method again restores the default values.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "dump-options",
                "Print the registered options with their default values");
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-3) that you wish to see (default is 0)\n"
                + "      =0 pass banners and warnings\n"
                + "      =1 per-directive summaries\n"
                + "      =2 per-variable decisions\n"
                + "      =3 tree dumps");
    options.add(options.UTILITY, "skip-routines", "proc1,proc2,...",
                "Causes all passes that observe this flag to skip the listed routines");
    options.add(options.ANALYSIS, "validate-directives",
                "Check the nesting rules of every directive");
    options.add(options.ANALYSIS, "omp-clauses",
                "Compute data-sharing and dependence clauses of parallel and task directives");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /**
   * Returns the set of routine names that should be excluded from the
   * passes, given as a comma-separated list by the skip-routines option.
   * Names are returned in lower case.
   */
  public static Set<String> getSkipRoutineSet()
  {
    Set<String> skip_set = new HashSet<String>();
    String s = getOptionValue("skip-routines");
    if (s != null)
    {
      for (String name : Arrays.asList(s.split(",")))
      {
        if (name.trim().length() > 0)
          skip_set.add(name.trim().toLowerCase());
      }
    }
    return skip_set;
  }

  /**
   * Parses one option given as <b>name[=value]</b>, without the leading
   * dash. An option without a value is set to "1".
   *
   * @param opt the option text.
   * @return true if the option is registered.
   */
  protected boolean parseOption(String opt)
  {
    opt = opt.trim();
    if (opt.length() == 0)
      return false;
    int eq = opt.indexOf('=');
    String option_name = (eq == -1) ? opt : opt.substring(0, eq);
    if (!options.contains(option_name))
    {
      System.err.println("ignoring unrecognized option " + option_name);
      return false;
    }
    setOptionValue(option_name, (eq == -1) ? "1" : opt.substring(eq + 1));
    return true;
  }

  /**
   * Parses command line options.
   *
   * @param args The String array passed to main by the system.
   * @return false if a utility option (help, version, dump-options) was
   *   served and nothing else should run.
   */
  protected boolean parseCommandLine(String[] args)
  {
    for (String opt : args)
    {
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
      {
        System.err.println("ignoring argument " + opt);
        continue;
      }
      parseOption(opt.substring(1));
    }

    if (getOptionValue("help") != null)
    {
      printUsage();
      return false;
    }

    if (getOptionValue("version") != null)
    {
      printVersion();
      return false;
    }

    if (getOptionValue("dump-options") != null)
    {
      setOptionValue("dump-options", null);
      System.out.println(options.dumpOptions().trim());
      return false;
    }

    return true;
  }

  /**
   * Prints the list of options that the driver accepts.
   */
  public void printUsage()
  {
    String usage = "\npardir.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Prints the version.
   */
  public void printVersion()
  {
    System.err.println("pardir 1.0 - Directive legality and data-sharing analysis");
  }

  /**
   * Runs the passes selected by the options on the given container.
   *
   * @param container the program produced by the front end.
   */
  public void run(Container container)
  {
    if (container == null)
      throw new IllegalArgumentException("no container to run on");
    this.container = container;

    runPasses();

    PrintTools.printlnStatus(3, container);
  }

  /**
   * Runs this driver with args as the command line. Without a front end
   * there is no program to read, so only the utility options do work here.
   *
   * @param args The command line from main.
   */
  public void run(String[] args)
  {
    if (!parseCommandLine(args))
      Tools.exit(0);
    System.err.println("No input program: a front end must build the IR and call run(Container)");
    Tools.exit(1);
  }

  /**
   * Runs the analysis passes on the container.
   */
  public void runPasses()
  {
    /* in each set of option strings, the first option requires the
       rest of the options to be set for it to run effectively */
    String[][] pass_prerequisites = {
      { "omp-clauses", "validate-directives" }
    };

    for (String[] pass_prerequisite : pass_prerequisites) {
      if (getOptionValue(pass_prerequisite[0]) != null) {
        for (int j = 1; j < pass_prerequisite.length; ++j) {
          if (getOptionValue(pass_prerequisite[j]) == null) {
            PrintTools.printlnStatus(0, "WARNING:", pass_prerequisite[0],
                "flag is set but", pass_prerequisite[j], "is not set");
            PrintTools.printlnStatus(0, "WARNING: turning on",
                pass_prerequisite[j]);
            setOptionValue(pass_prerequisite[j], "1");
          }
        }
      }
    }

    if (getOptionValue("validate-directives") != null)
    {
      AnalysisPass.run(new DirectiveValidationPass(container));
    }

    if (getOptionValue("omp-clauses") != null)
    {
      AnalysisPass.run(new DirectiveClausePass(container));
    }
  }

  /**
   * Entry point; creates a new Driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    (new Driver()).run(args);
  }
}
