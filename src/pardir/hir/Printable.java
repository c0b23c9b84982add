package pardir.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print itself.
*/
public interface Printable {

    /**
    * Prints the object on the specified print writer.
    *
    * @param o the target print writer.
    */
    void print(PrintWriter o);

}
