package polyc.hir;

import java.io.PrintWriter;

/**
* Represents the empty statement {@code ;}; a loop under construction holds
* one as its body until the builder sets the real body.
*/
public class NullStatement extends Statement {

    public void print(PrintWriter o) {
        o.print(";");
    }

}
