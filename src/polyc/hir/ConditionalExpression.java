package polyc.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* Represents <code>condition ? true_expr : false_expr</code>. The generator
* uses it for piecewise index expressions with more than one piece. It always
* prints in parentheses.
*/
public class ConditionalExpression extends Expression {

    /**
    * @throws NotAnOrphanException if one of the parameters has a parent object.
    */
    public ConditionalExpression(
            Expression condition, Expression true_expr, Expression false_expr) {
        super(Arrays.asList(condition, true_expr, false_expr));
        setParens(true);
    }

    @Override
    public ConditionalExpression clone() {
        return (ConditionalExpression)super.clone();
    }

    protected void printBare(PrintWriter o) {
        getCondition().print(o);
        o.print(" ? ");
        getTrueExpression().print(o);
        o.print(" : ");
        getFalseExpression().print(o);
    }

    public Expression getCondition() {
        return operand(0);
    }

    public Expression getTrueExpression() {
        return operand(1);
    }

    public Expression getFalseExpression() {
        return operand(2);
    }

}
