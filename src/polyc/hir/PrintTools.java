package polyc.hir;

import polyc.exec.Driver;

import java.io.PrintWriter;
import java.util.List;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of IR
* or debug messages.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * This method minimizes overheads from string composition since it is done
    * only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= PrintTools.getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating string. If the list contains an object not printable, this
    * method throws a cast exception.
    * @param list the list of printable object.
    * @param w the target print writer.
    * @param sep the separating string.
    */
    public static void printListWithSeparator(
            List<? extends Printable> list, PrintWriter w, String sep) {
        if (list == null) {
            return;
        }
        int list_size = list.size();
        if (list_size > 0) {
            list.get(0).print(w);
            for (int i = 1; i < list_size; i++) {
                w.print(sep);
                list.get(i).print(w);
            }
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating comma.
    */
    public static void printListWithComma(
            List<? extends Printable> list, PrintWriter w) {
        printListWithSeparator(list, w, ", ");
    }

    /**
    * Returns the global verbosity level. The level is read from the
    * command-line option on every call so that tests and embedders may change
    * it after class loading.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            return 0;
        }
    }

}
