package polyc.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Represents a function call. Leaves of the generated tree hold the
* call-like expression {@code S(c0, c1, ..)} whose callee names the statement
* and whose arguments are the statement's original iterators expressed in
* generated iterators.
*/
public class FunctionCall extends Expression {

    public FunctionCall(Expression function, Expression... args) {
        this(function, Arrays.asList(args));
    }

    /**
    * @param function the callee, usually an identifier.
    * @param args the arguments, in order.
    * @throws NotAnOrphanException if the callee or an argument has a parent.
    */
    public FunctionCall(Expression function, List<Expression> args) {
        super(calleeAndArguments(function, args));
    }

    private static List<Expression> calleeAndArguments(
            Expression function, List<Expression> args) {
        List<Expression> ret = new ArrayList<Expression>(args.size() + 1);
        ret.add(function);
        ret.addAll(args);
        return ret;
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    protected void printBare(PrintWriter o) {
        getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(children.subList(1, children.size()), o);
        o.print(")");
    }

    /** Returns the expression that names the callee. */
    public Expression getName() {
        return operand(0);
    }

}
