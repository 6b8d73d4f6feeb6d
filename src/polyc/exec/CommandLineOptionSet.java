package polyc.exec;

import java.util.Map;
import java.util.TreeMap;
import polyc.hir.PrintTools;

/**
* The registered command line options of the driver with their usage text
* and current values.
*/
public class CommandLineOptionSet
{
  public static final int UTILITY = 1;
  public static final int ANALYSIS = 2;
  public static final int CODEGEN = 3;

  private static class OptionRecord
  {
    public int option_type;
    public String value;
    // Shape of the argument in usage text, e.g. "N".
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(String name, String usage)
  {
    add(UTILITY, name, null, null, usage);
  }

  public void add(String name, String arg, String usage)
  {
    add(UTILITY, name, null, arg, usage);
  }

  public void add(int type, String name, String usage)
  {
    add(type, name, null, null, usage);
  }

  public void add(int type, String name, String arg, String usage)
  {
    add(type, name, null, arg, usage);
  }

  public void add(int type, String name, String value, String arg,
      String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
  * Returns the text of an options file listing every option with its usage
  * as comments and its current value.
  */
  public String dumpOptions()
  {
    StringBuilder sb = new StringBuilder(2000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      String name = entry.getKey();
      OptionRecord record = entry.getValue();
      sb.append("#Option: ").append(name).append("\n#").append(name);
      if (record.arg != null)
        sb.append("=").append(record.arg);
      sb.append("\n#").append(record.usage.replaceAll("\n", "\n#"));
      sb.append("\n");
      if (record.value == null)
        sb.append("#");
      sb.append(name);
      if (record.value != null)
        sb.append("=").append(record.value);
      sb.append("\n");
    }
    return sb.toString();
  }

  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(2000);
    appendSection(sb, "UTILITY", UTILITY);
    appendSection(sb, "ANALYSIS", ANALYSIS);
    appendSection(sb, "CODEGEN", CODEGEN);
    return sb.toString();
  }

  private void appendSection(StringBuilder sb, String title, int type)
  {
    String sep = PrintTools.line_sep;
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(title).append(sep);
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(getUsage(type));
  }

  public String getUsage(int type)
  {
    StringBuilder sb = new StringBuilder(1000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type != type)
        continue;
      sb.append("-").append(entry.getKey());
      if (record.arg != null)
        sb.append("=").append(record.arg);
      sb.append("\n    ").append(record.usage).append("\n\n");
    }
    return sb.toString();
  }

  /** Returns the value of an option, or null if it is unset or unknown. */
  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    else
      return record.value;
  }

  /** Sets the value of a registered option; unknown names are ignored. */
  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }
}
