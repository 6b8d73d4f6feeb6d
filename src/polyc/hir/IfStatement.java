package polyc.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Represents an if statement without an else part. The generated tree uses
* it to guard leaves whose instances do not cover the full range of the
* enclosing loops.
*/
public class IfStatement extends Statement {

    /**
    * @throws NotAnOrphanException if an argument has a parent object.
    */
    public IfStatement(Expression condition, Statement then_stmt) {
        super(Arrays.asList(condition, then_stmt));
    }

    public void print(PrintWriter o) {
        o.print("if (");
        getControlExpression().print(o);
        o.println(")");
        getThenStatement().print(o);
    }

    /** Returns the guard expression. */
    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    /** Returns the guarded statement. */
    public Statement getThenStatement() {
        return (Statement)children.get(1);
    }

}
