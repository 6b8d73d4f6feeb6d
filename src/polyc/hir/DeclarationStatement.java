package polyc.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Declares one variable, optionally with array dimensions and an
* initializer, e.g. {@code float A[N][N];} or {@code int c0 = 0;}. The
* first child is the declared identifier, followed by the dimensions and the
* optional initializer.
*/
public class DeclarationStatement extends Statement {

    private String type;

    private int num_dims;

    /** Declares a scalar with an initializer. */
    public DeclarationStatement(String type, Identifier name, Expression init) {
        this(type, name, new ArrayList<Expression>(0), init);
    }

    /**
    * @param type the element type, e.g. {@code float}.
    * @param name the declared name.
    * @param dims the extents, outermost first; empty for a scalar.
    * @param init the initializer or null.
    */
    public DeclarationStatement(String type, Identifier name,
            List<Expression> dims, Expression init) {
        super();
        this.type = type;
        this.num_dims = dims.size();
        adopt(name);
        for (Expression dim : dims) {
            adopt(dim);
        }
        if (init != null) {
            adopt(init);
        }
    }

    public void print(PrintWriter o) {
        o.print(type);
        o.print(" ");
        getName().print(o);
        for (int i = 1; i <= num_dims; i++) {
            o.print("[");
            children.get(i).print(o);
            o.print("]");
        }
        Expression init = getInitializer();
        if (init != null) {
            o.print(" = ");
            init.print(o);
        }
        o.print(";");
    }

    public Identifier getName() {
        return (Identifier)children.get(0);
    }

    /** Returns the initializer or null if there is none. */
    public Expression getInitializer() {
        if (children.size() > num_dims + 1) {
            return (Expression)children.get(num_dims + 1);
        }
        return null;
    }

}
