package pardir.hir;

import java.util.List;

/**
* <b>Tools</b> provides a set of static utility methods that do not belong to
* a specific IR tool class.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the index of an object in a list using identity rather than
    * equality. IR expressions compare structurally, so {@link List#indexOf}
    * cannot tell two equal subtrees apart.
    *
    * @param list the list to be searched.
    * @param obj the object to be searched for.
    * @return the index of the object, or -1 if it is not in the list.
    */
    public static int identityIndexOf(List<?> list, Object obj) {
        int size = list.size();
        for (int i = 0; i < size; i++) {
            if (list.get(i) == obj) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Returns the current system time in seconds.
    */
    public static double getTime() {
        return System.currentTimeMillis() / 1000.0;
    }

    /**
    * Returns the elapsed time in seconds since the given start time.
    *
    * @param since the start time in seconds.
    */
    public static double getTime(double since) {
        return getTime() - since;
    }

    /**
    * Exits the program with the given status code.
    *
    * @param code the exit status.
    */
    public static void exit(int code) {
        System.out.flush();
        System.err.flush();
        System.exit(code);
    }

}
