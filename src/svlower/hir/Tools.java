package svlower.hir;

import java.util.List;

/**
* <b>Tools</b> provides general utilities for IR manipulation and for
* controlling the compiler process.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the index of the first element in the list that is the same
    * object as <var>o</var>, comparing with == instead of equals.
    *
    * @param l the list to search.
    * @param o the object to find.
    * @return the index of <var>o</var>, or -1 if it is not in the list.
    */
    public static int identityIndexOf(List l, Object o) {
        int size = l.size();
        for (int i = 0; i < size; i++) {
            if (l.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Returns the current system time in seconds.
    *
    * @return the current time in seconds
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }

    /** Flag for selecting how exit() is handled. */
    private static boolean exit_throws_exception = false;

    /**
    * Selects how Tools.exit() behaves.
    * Setting <b>flag = true</b> causes <b>Tools.exit()</b> throw a runtime
    * exception instead of invoking <b>System.exit()</b>.
    * @param flag the boolean flag
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Invokes exit operation.
    * Depending on the flag set by {@link #exitThrowsException(boolean)}, this
    * method either calls {@link System#exit(int)} or throws a
    * {@link RuntimeException}.
    * @param status the exit status
    * @exception RuntimeException if the last call to
    *       {@link #exitThrowsException(boolean)} is with <b>true</b>.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new RuntimeException("Exiting with status " + status);
        } else {
            System.exit(status);
        }
    }

}
