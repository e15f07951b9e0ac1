package svlower.exec;

import svlower.hir.PrintTools;
import svlower.hir.Program;
import svlower.hir.Tools;
import svlower.transforms.LinkJump;
import svlower.transforms.TransformPass;

/**
 * Implements the command line parser and controls pass ordering.
 * The front end hands over an elaborated {@link Program Program}; the driver
 * reads the options, runs the lowering passes on the program and reports
 * the diagnostics they produce.
 * Users may extend this class by overriding runPasses.
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
   * The program being compiled.
   */
  protected Program program;

  /** Collects the diagnostics of all passes. */
  protected DiagnosticLog diagnostics;

  /**
   * Creates a driver for the given program.
   *
   * @param program the elaborated design.
   */
  public Driver(Program program)
  {
    registerOptions();
    this.program = program;
    this.diagnostics = new DiagnosticLog();
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Only registered options can have values set.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "dump-tree",
                "Print the tree to stderr after every pass");
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.TRANSFORM, "skip-link-jump",
                "Do not lower return/break/continue/disable into jumps (debugging only)");
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
   * Parses command line options.
   *
   * @param args The String array passed to run.
   */
  protected void parseCommandLine(String[] args)
  {
    for (int i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
      {
        System.err.println("ignoring unrecognized argument " + opt);
        continue;
      }

      int eq = opt.indexOf('=');

      // if value is not set
      if (eq == -1)
      {
        String option_name = opt.substring(1);

        // registered option
        if (options.contains(option_name))
          // no value on the command line, so just set it to "1"
          setOptionValue(option_name, "1");
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
      // if value is set
      else
      {
        String option_name = opt.substring(1, eq);

        if (options.contains(option_name))
          // use the value from the command line
          setOptionValue(option_name, opt.substring(eq + 1));
        else
          System.err.println("ignoring unrecognized option " + option_name);
      }
    }

    checkVerbosity();

    if (getOptionValue("help") != null)
    {
      printUsage();
      Tools.exit(0);
    }

    if (getOptionValue("version") != null)
    {
      printVersion();
      Tools.exit(0);
    }
  }

  private void checkVerbosity()
  {
    String value = getOptionValue("verbosity");
    boolean valid = (value != null);
    if (valid)
    {
      try {
        int level = Integer.parseInt(value);
        valid = (level >= 0 && level <= 4);
      } catch (NumberFormatException e) {
        valid = false;
      }
    }
    if (!valid)
    {
      System.err.println("invalid verbosity " + value + ", expecting 0-4");
      setOptionValue("verbosity", "0");
      Tools.exit(1);
    }
  }

  /**
   * Prints the list of options that the driver accepts.
   */
  public void printUsage()
  {
    String usage = "\nsvlower.exec.Driver [option]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Prints the compiler version.
   */
  public void printVersion()
  {
    System.err.println("svlower 1.0 - jump lowering and loop normalization");
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line options.
   * @return the number of errors reported, to be used as exit status.
   */
  public int run(String[] args)
  {
    parseCommandLine(args);

    runPasses();

    PrintTools.printlnStatus(1, "[Driver]", diagnostics.getErrorCount(),
        "error(s),", diagnostics.getUnsupportedCount(), "unsupported construct(s)");

    return diagnostics.getErrorCount();
  }

  /**
   * Runs the lowering passes on the program.
   */
  public void runPasses()
  {
    if (getOptionValue("skip-link-jump") == null)
      TransformPass.run(new LinkJump(program, diagnostics));
    else
      PrintTools.printlnStatus(1, "[Driver] skipping [LinkJump]");
  }

  /** Returns the diagnostics reported so far. */
  public DiagnosticLog getDiagnostics()
  {
    return diagnostics;
  }
}
