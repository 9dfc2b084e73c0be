package gpusync.hir;

/**
* Printing and logging helpers. Messages carry a minimum verbosity level and
* are written to stderr only when the process-wide verbosity, set once by the
* driver, is at least that level.
*/
public final class PrintTools {

    /** Platform line separator used by every printer in the IR. */
    public static final String line_sep = System.getProperty("line.separator");

    private static int verbosity = 0;

    private PrintTools() {
    }

    /** Returns the current verbosity level. */
    public static int getVerbosity() {
        return verbosity;
    }

    /**
    * Sets the verbosity level; negative values are clamped to zero.
    */
    public static void setVerbosity(int level) {
        verbosity = (level < 0) ? 0 : level;
    }

    /**
    * Prints the message with a newline if the verbosity is at least
    * <b>min_verbosity</b>.
    */
    public static void println(String msg, int min_verbosity) {
        if (verbosity >= min_verbosity) {
            System.err.println(msg);
        }
    }

    /**
    * Prints a pass status line, which is prefixed by the pass name.
    */
    public static void printlnStatus(String pass_name, String msg,
                                     int min_verbosity) {
        println(pass_name + " " + msg, min_verbosity);
    }
}
