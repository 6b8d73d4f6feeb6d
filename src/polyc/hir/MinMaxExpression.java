package polyc.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* A MIN or MAX over two or more operands. It prints as nested calls to the
* {@code min} or {@code max} helper macro, e.g. {@code min(a, min(b, c))};
* the tree printer defines the macros once before the tree.
*/
public class MinMaxExpression extends Expression {

    private boolean ismin;

    /**
    * @param ismin true for MIN, false for MAX.
    * @param operands two or more orphan expressions.
    * @throws IllegalArgumentException if fewer than two operands are given.
    */
    public MinMaxExpression(boolean ismin, List<Expression> operands) {
        super(checkArity(operands));
        this.ismin = ismin;
    }

    private static List<Expression> checkArity(List<Expression> operands) {
        if (operands.size() < 2) {
            throw new IllegalArgumentException(
                    "min/max needs at least two operands");
        }
        return operands;
    }

    @Override
    public MinMaxExpression clone() {
        return (MinMaxExpression)super.clone();
    }

    protected void printBare(PrintWriter o) {
        String name = (ismin) ? "min(" : "max(";
        int n = children.size();
        for (int i = 0; i < n - 1; i++) {
            o.print(name);
            operand(i).print(o);
            o.print(", ");
        }
        operand(n - 1).print(o);
        for (int i = 0; i < n - 1; i++) {
            o.print(")");
        }
    }

    public boolean isMinExpression() {
        return ismin;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && ismin == ((MinMaxExpression)o).ismin);
    }

}
