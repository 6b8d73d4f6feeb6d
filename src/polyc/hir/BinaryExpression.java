package polyc.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/**
* An expression with a lefthand operand, an infix operator and a righthand
* operand. The operator is not a child; it is shared by all expressions
* using it.
*/
public class BinaryExpression extends Expression {

    /** The operator; kept by {@link #clone()} through the shallow copy. */
    protected BinaryOperator op;

    /**
    * Creates a binary expression.
    *
    * @param lhs The lefthand expression.
    * @param op A binary operator.
    * @param rhs The righthand expression.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent
    * object.
    */
    public BinaryExpression(
            Expression lhs, BinaryOperator op, Expression rhs) {
        super(Arrays.asList(lhs, rhs));
        this.op = op;
    }

    @Override
    public BinaryExpression clone() {
        return (BinaryExpression)super.clone();
    }

    protected void printBare(PrintWriter o) {
        getLHS().print(o);
        op.print(o);
        getRHS().print(o);
    }

    public Expression getLHS() {
        return operand(0);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expression getRHS() {
        return operand(1);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((BinaryExpression)o).op);
    }

}
