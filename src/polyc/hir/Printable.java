package polyc.hir;

import java.io.PrintWriter;

/**
* Objects that print themselves as C source text. For IR nodes,
* {@code toString} returns what {@code print} writes.
*/
public interface Printable {

    /**
    * Prints the C text of this object.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
