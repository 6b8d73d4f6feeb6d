package polyc.exec;

import polyc.codegen.AstPrinter;
import polyc.codegen.CodeGenException;
import polyc.codegen.CodeGenPass;
import polyc.codegen.CpuCodeGen;
import polyc.codegen.CpuPrinter;
import polyc.hir.CommentAnnotation;
import polyc.hir.PrintTools;
import polyc.hir.Statement;
import polyc.hir.Tools;
import polyc.hir.UnsupportedInput;
import polyc.scop.Scop;
import polyc.scop.ScopArray;
import polyc.scop.ScopFormatException;
import polyc.scop.ScopReader;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Implements the command line parser and runs code generation on one input
 * file. The scop of the input is read from a description file, by default
 * the input name with the extension <b>.scop</b>. The generated file copies
 * the input outside the scop region and replaces the region by the
 * generated loops.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static {
    registerOptions();
  }

  /** The C file supplied on the command line. */
  protected String filename;

  protected Driver()
  {
  }

  /**
   * Registers the legal set of options and their default values.
   */
  public static void registerOptions()
  {
    options.add(options.CODEGEN, "openmp",
                "Mark loops that carry no dependence with #pragma omp parallel for");
    options.add(options.UTILITY, "output", "file",
                "Set the output file name (default is the input name with .polyc before the extension)");
    options.add(options.UTILITY, "scop", "file",
                "Set the scop description file (default is the input name with extension .scop)");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "dump-options",
                "Create file options.polyc with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file options.polyc");
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
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  protected void parseOption(String opt)
  {
    opt = opt.trim();
    // empty line
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');
    String option_name = (eq == -1) ? opt : opt.substring(0, eq);
    if (!options.contains(option_name))
      System.err.println("ignoring unrecognized option " + option_name);
    else if (eq == -1)
      setOptionValue(option_name, "1");
    else
      setOptionValue(option_name, opt.substring(eq + 1));
  }

  /**
   * Parses the command line: options start with "-" and the last argument
   * is the input file.
   *
   * @param args The String array passed to main by the system.
   */
  protected void parseCommandLine(String[] args)
  {
    /* print a useful message if there are no arguments */
    if (args.length == 0)
    {
      printUsage();
      Tools.exit(1);
    }

    int i; /* used after loop; don't put inside for loop */
    for (i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
        break;

      parseOption(opt.substring(1));

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

      if (getOptionValue("dump-options") != null)
      {
        setOptionValue("dump-options", null);
        dumpOptionsFile();
        Tools.exit(0);
      }

      // load options file and then proceed with rest
      // of command line options
      if (getOptionValue("load-options") != null)
      {
        setOptionValue("load-options", null);
        loadOptionsFile();
        // prevent reentering this handler
        setOptionValue("load-options", null);
      }
    }

    if (i >= args.length)
    {
      System.err.println("No input file!");
      Tools.exit(1);
    }
    if (i < args.length - 1)
    {
      System.err.println("Only one input file is accepted");
      Tools.exit(1);
    }
    filename = args[i];
  }

  /**
   * Prints the list of options that polyc accepts.
   */
  public void printUsage()
  {
    String usage = "\npolyc.exec.Driver [option]... file.c\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Dumps the default options to file options.polyc in the working
   * directory; an existing file is not overwritten.
   */
  public void dumpOptionsFile()
  {
    File optionsFile = new File("options.polyc");
    try {
      if (optionsFile.createNewFile()) {
        PrintStream ps = new PrintStream(
            new FileOutputStream(optionsFile), false, "UTF-8");
        ps.println(options.dumpOptions().trim());
        ps.close();
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump options.polyc: " + e);
    }
  }

  /**
   * Loads options.polyc, searching the working directory and then the home
   * directory.
   */
  public void loadOptionsFile()
  {
    File optionsFile = new File("options.polyc");
    if (!optionsFile.exists()) {
      String homePath = System.getProperty("user.home");
      optionsFile = new File(homePath, "options.polyc");
    }
    if (!optionsFile.exists()) {
      System.err.println("Error: Failed to load options.polyc");
      System.err.println("Use option -dump-options"
                       + " to create options.polyc with default values");
      Tools.exit(1);
    }
    try {
      BufferedReader br = new BufferedReader(new InputStreamReader(
          new FileInputStream(optionsFile), StandardCharsets.UTF_8));
      try {
        String line;
        while ((line = br.readLine()) != null) {
          // Remove comments
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e);
      Tools.exit(1);
    }
  }

  /**
   * Prints the compiler version.
   */
  public void printVersion()
  {
    System.err.println("polyc 1.0 - A Polyhedral Code Generator for C");
  }

  /**
   * Returns the name of the generated file for an input file: the final
   * path component with <b>.polyc</b> inserted before its last extension,
   * or appended when it has none. A leading dot starts an extension too,
   * so <b>.foo</b> becomes <b>.polyc.foo</b>.
   */
  public static String getOutputName(String input)
  {
    String base = new File(input).getName();
    int dot = base.lastIndexOf('.');
    if (dot < 0)
      return base + ".polyc";
    return base.substring(0, dot) + ".polyc" + base.substring(dot);
  }

  /**
   * Returns the name of the default scop description of an input file: the
   * input path with its last extension replaced by <b>.scop</b>.
   */
  public static String getScopName(String input)
  {
    File file = new File(input);
    String base = file.getName();
    int dot = base.lastIndexOf('.');
    if (dot > 0)
      base = base.substring(0, dot);
    return new File(file.getParentFile(), base + ".scop").getPath();
  }

  /**
   * Generates the output file of a scop. The output is the input text with
   * the scop region replaced by the declarations of the arrays it declares
   * and the generated code; arrays that are not exposed are declared in a
   * block around the code. The text goes to a temporary file next to the
   * output, which then replaces the output, so a failed generation or write
   * leaves an existing output untouched and no partial file behind.
   *
   * @param scop the scop of the input.
   * @param input the input file name.
   * @param output the output file name.
   * @throws IOException if the input cannot be read or the output written.
   * @throws CodeGenException if the tree cannot be annotated.
   */
  public static void generate(Scop scop, String input, String output)
      throws IOException
  {
    if (scop == null)
      throw new IllegalArgumentException("no scop to generate code for");
    String source = readFile(input);
    CpuCodeGen codegen =
        new CpuCodeGen(scop, getOptionValue("openmp") != null);
    CodeGenPass.run(codegen);
    String text = print(scop, codegen.getTree(), source);
    writeFile(output, text);
    PrintTools.printlnStatus(1, "[Driver] wrote", output);
  }

  /**
   * Writes a whole text file through a temporary file in the same directory.
   * The temporary file is removed if anything fails.
   */
  public static void writeFile(String name, String text) throws IOException
  {
    File target = new File(name).getAbsoluteFile();
    File tmp = File.createTempFile(target.getName() + ".", ".tmp",
        target.getParentFile());
    boolean done = false;
    try {
      Writer w = new OutputStreamWriter(
          new FileOutputStream(tmp), StandardCharsets.UTF_8);
      try {
        w.write(text);
      } finally {
        w.close();
      }
      Files.move(tmp.toPath(), target.toPath(),
          StandardCopyOption.REPLACE_EXISTING);
      done = true;
    } finally {
      if (!done && !tmp.delete())
        PrintTools.printlnStatus(0, "[Driver] could not remove", tmp);
    }
  }

  /**
   * Returns the text of the output file for a generated tree.
   */
  public static String print(Scop scop, Statement tree, String source)
  {
    StringWriter sw = new StringWriter(source.length() + 1000);
    PrintWriter o = new PrintWriter(sw);
    o.print(source.substring(0, scop.getStart()));
    CommentAnnotation marker = new CommentAnnotation("polyc generated CPU code");
    marker.setOneLiner(true);
    o.println(marker);
    o.println();
    for (ScopArray array : scop.getArrays()) {
      if (array.isDeclared() && array.isExposed()) {
        array.getDeclaration().print(o);
        o.println();
      }
    }
    AstPrinter printer = new CpuPrinter();
    if (scop.hasHiddenArrays()) {
      o.println("{");
      for (ScopArray array : scop.getArrays()) {
        if (array.isDeclared() && !array.isExposed()) {
          o.print("  ");
          array.getDeclaration().print(o);
          o.println();
        }
      }
      AstPrinter.printMacros(tree, o);
      printer.print(tree, 1, o);
      o.println("}");
    } else {
      AstPrinter.printMacros(tree, o);
      printer.print(tree, 0, o);
    }
    o.print(source.substring(scop.getEnd()));
    o.flush();
    return sw.toString();
  }

  /** Reads a whole text file. */
  public static String readFile(String name) throws IOException
  {
    Reader r = new InputStreamReader(
        new FileInputStream(name), StandardCharsets.UTF_8);
    try {
      StringBuilder sb = new StringBuilder(4096);
      char[] buf = new char[4096];
      int n;
      while ((n = r.read(buf)) != -1)
        sb.append(buf, 0, n);
      return sb.toString();
    } finally {
      r.close();
    }
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line from main.
   */
  public void run(String[] args)
  {
    parseCommandLine(args);

    String scop_name = getOptionValue("scop");
    if (scop_name == null)
      scop_name = getScopName(filename);
    String output = getOptionValue("output");
    if (output == null)
      output = getOutputName(filename);

    try {
      Scop scop = ScopReader.read(readFile(scop_name), readFile(filename));
      PrintTools.printlnStatus(4, "[Driver] scop", scop);
      generate(scop, filename, output);
    } catch (ScopFormatException e) {
      System.err.println(scop_name + ": " + e.getMessage());
      Tools.exit(1);
    } catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      Tools.exit(1);
    } catch (UnsupportedInput e) {
      System.err.println("unsupported input: " + e.getMessage());
      Tools.exit(1);
    } catch (CodeGenException e) {
      System.err.println("code generation failed: " + e.getMessage());
      Tools.exit(1);
    }
  }

  /**
   * Entry point for polyc; creates a new Driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    (new Driver()).run(args);
  }
}
