package gpusync.hir;

import java.util.List;

/**
* Miscellaneous helpers that do not belong to a specific IR class.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the position of the given object in the list, comparing by
    * identity rather than by {@code equals}; -1 if absent.
    */
    public static int identityIndexOf(List<?> list, Object o) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /** Returns the current time in seconds. */
    public static double getTime() {
        return System.currentTimeMillis() / 1000.0;
    }

    /** Returns the time elapsed since the given time, in seconds. */
    public static double getTime(double since) {
        return getTime() - since;
    }

    /**
    * Prints the message to stderr and terminates the process with status 1.
    */
    public static void exit(String msg) {
        System.err.println(msg);
        System.exit(1);
    }

    /** Terminates the process with the given status. */
    public static void exit(int status) {
        System.exit(status);
    }
}
