package polyc.hir;

import java.util.List;

/**
* <b>Tools</b> provides a set of static utility methods shared by the
* generator packages.
*/
public final class Tools {

    /**
    * When set, {@link #exit(int)} throws instead of terminating the virtual
    * machine; embedders and tests switch this on.
    */
    private static boolean exitThrowsException = false;

    private Tools() {
    }

    /**
    * Thrown by {@link #exit(int)} when exiting is disabled.
    */
    public static class ExitException extends RuntimeException {
        private static final long serialVersionUID = 1;
        private final int status;

        public ExitException(int status) {
            super("exit status " + status);
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }

    /**
    * Exits the program with the given status, or throws
    * {@link ExitException} if exiting has been disabled.
    */
    public static void exit(int status) {
        if (exitThrowsException) {
            throw new ExitException(status);
        }
        System.exit(status);
    }

    /**
    * Controls whether {@link #exit(int)} throws an exception instead of
    * terminating the virtual machine.
    */
    public static void setExitThrowsException(boolean b) {
        exitThrowsException = b;
    }

    /**
    * Returns the index of an object in a list using identity rather than
    * equality.
    *
    * @param list the list to be searched.
    * @param obj the object to be found.
    * @return the index of <var>obj</var> or -1 if not found.
    */
    public static int identityIndexOf(List<?> list, Object obj) {
        int index = 0;
        for (Object o : list) {
            if (o == obj) {
                return index;
            }
            index++;
        }
        return -1;
    }

    /** Returns the non-negative greatest common divisor of two integers. */
    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

}
