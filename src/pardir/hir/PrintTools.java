package pardir.hir;

import pardir.exec.Driver;

import java.io.PrintWriter;
import java.util.List;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of IR
* or debug messages. Status messages go to {@link System#err} and are
* filtered by the {@code verbosity} command-line option.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /** Returns the verbosity level taken from the command-line option */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            throw new IllegalArgumentException(
                    "verbosity must be an integer but found '" + value + "'",
                    e);
        }
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
        if (min_verbosity <= getVerbosity()) {
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
    * Prints a string to System.out if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating stirng. If the list contains an object not printable, this
    * method throws a cast exception.
    * @param list the list of printable object.
    * @param w the target print writer.
    * @param sep the separating string.
    */
    public static void
            printListWithSeparator(List<?> list, PrintWriter w, String sep) {
        if (list == null) {
            return;
        }
        int list_size = list.size();
        if (list_size > 0) {
            ((Printable)list.get(0)).print(w);
            for (int i = 1; i < list_size; i++) {
                w.print(sep);
                ((Printable)list.get(i)).print(w);
            }
        }
    }

    /**
    * Prints a list of printable object to the specified print writer with a
    * separating comma.
    *
    * @param list the list of printable object.
    * @param w the target print writer.
    */
    public static void printListWithComma(List<?> list, PrintWriter w) {
        printListWithSeparator(list, w, ", ");
    }

    /**
    * Converts a list of objects to a string with the given separator.
    *
    * @param list the list to be converted.
    * @param separator the separating string.
    * @return the converted string.
    */
    public static String listToString(List<?> list, String separator) {
        if (list == null || list.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(80);
        sb.append(list.get(0));
        int list_size = list.size();
        for (int i = 1; i < list_size; i++) {
            sb.append(separator).append(list.get(i));
        }
        return sb.toString();
    }

}
