package polyc.hir;

import java.io.PrintWriter;
import java.util.Collections;

/** Represents an expression having a prefix operator and an operand. */
public class UnaryExpression extends Expression {

    private UnaryOperator op;

    /**
    * Constructs a unary expression with the specified operator and expression.
    *
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(Collections.singletonList(expr));
        this.op = op;
    }

    @Override
    public UnaryExpression clone() {
        return (UnaryExpression)super.clone();
    }

    protected void printBare(PrintWriter o) {
        op.print(o);
        getExpression().print(o);
    }

    public Expression getExpression() {
        return operand(0);
    }

    public UnaryOperator getOperator() {
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

}
