package polyc.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Represents a C for loop. The generated tree only builds loops of the form
* <pre>
*   for (int c = lb; c &lt;= ub; c += 1) body
* </pre>
* whose initial statement declares the iterator, although any condition and
* step expressions can be held.
*/
public class ForLoop extends Statement {

    /**
    * @param init the initial statement, usually a declaration.
    * @param condition the loop condition.
    * @param step the step expression.
    * @param body the loop body.
    * @throws NotAnOrphanException if an argument has a parent object.
    */
    public ForLoop(Statement init, Expression condition,
            Expression step, Statement body) {
        super(Arrays.asList(init, condition, step, body));
    }

    public void print(PrintWriter o) {
        o.print("for (");
        getInitialStatement().print(o);
        o.print(" ");
        getCondition().print(o);
        o.print("; ");
        getStep().print(o);
        o.println(")");
        getBody().print(o);
    }

    public Statement getInitialStatement() {
        return (Statement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public Expression getStep() {
        return (Expression)children.get(2);
    }

    public Statement getBody() {
        return (Statement)children.get(3);
    }

    /**
    * Sets the loop body; the tree builder creates the loop before its
    * descendants and fills the body in afterwards.
    */
    public void setBody(Statement body) {
        setChild(3, body);
    }

}
