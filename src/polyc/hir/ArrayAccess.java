package polyc.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents the access of an array element, e.g. {@code A[i][j + 1]}. An
* access without index prints as the bare array name.
*/
public class ArrayAccess extends Expression {

    /**
    * @throws NotAnOrphanException if <b>array</b> or an element of
    * <b>indices</b> has a parent object.
    */
    public ArrayAccess(Expression array, List<Expression> indices) {
        super(arrayAndIndices(array, indices));
    }

    private static List<Expression> arrayAndIndices(
            Expression array, List<Expression> indices) {
        List<Expression> ret = new ArrayList<Expression>(indices.size() + 1);
        ret.add(array);
        ret.addAll(indices);
        return ret;
    }

    @Override
    public ArrayAccess clone() {
        return (ArrayAccess)super.clone();
    }

    protected void printBare(PrintWriter o) {
        getArrayName().print(o);
        if (getNumIndices() > 0) {
            o.print("[");
            PrintTools.printListWithSeparator(
                    children.subList(1, children.size()), o, "][");
            o.print("]");
        }
    }

    /** Returns the expression being indexed, usually an identifier. */
    public Expression getArrayName() {
        return operand(0);
    }

    public int getNumIndices() {
        return children.size() - 1;
    }

}
