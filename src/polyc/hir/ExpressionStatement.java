package polyc.hir;

import java.io.PrintWriter;
import java.util.Collections;

/**
* A statement made of a single expression. Leaves of the generated tree are
* expression statements wrapping the call-like expression that names the
* statement instance.
*/
public class ExpressionStatement extends Statement {

    /**
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ExpressionStatement(Expression expr) {
        super(Collections.singletonList(expr));
    }

    public void print(PrintWriter o) {
        getExpression().print(o);
        o.print(";");
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

}
