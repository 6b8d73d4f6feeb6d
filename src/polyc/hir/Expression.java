package polyc.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions, both the statement bodies read from a scop
* description and the index and bound expressions synthesized by the code
* generator. An expression owns its operands: each operand has exactly this
* expression as its parent, and adding an operand that already has a parent
* is an error.
*/
public abstract class Expression implements Cloneable, Traversable {

    private Traversable parent;

    /** The operands, in printing order; every element is an Expression. */
    protected List<Traversable> children;

    private boolean parens;

    /** Creates an expression without operands. */
    protected Expression() {
        parent = null;
        children = Collections.emptyList();
        parens = false;
    }

    /**
    * Creates an expression owning the given operands.
    *
    * @throws NotAnOrphanException if an operand already has a parent.
    */
    protected Expression(List<? extends Expression> operands) {
        parent = null;
        children = new ArrayList<Traversable>(operands.size());
        parens = false;
        for (Expression e : operands) {
            if (e.getParent() != null) {
                throw new NotAnOrphanException(e + " in " + getClass().getName());
            }
            children.add(e);
            e.parent = this;
        }
    }

    /** Returns the <var>n</var>th operand. */
    protected Expression operand(int n) {
        return (Expression)children.get(n);
    }

    /**
    * Returns a deep copy of this expression without a parent. Sub classes
    * with fields other than the operands keep them through the shallow copy
    * of {@link Object#clone()}.
    */
    @Override
    public Expression clone() {
        Expression copy;
        try {
            copy = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError(e.getMessage());
        }
        copy.parent = null;
        if (!children.isEmpty()) {
            copy.children = new ArrayList<Traversable>(children.size());
            for (Traversable t : children) {
                Expression child = ((Expression)t).clone();
                child.parent = copy;
                copy.children.add(child);
            }
        }
        return copy;
    }

    /**
    * Two expressions are equal if they are of the same class and have equal
    * operands. Sub classes with more state compare it after calling this.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Replaces the <var>index</var>th operand by <var>t</var>.
    *
    * @throws IllegalArgumentException if <var>t</var> is not an expression.
    * @throws NotAnOrphanException if <var>t</var> has a parent.
    */
    public void setChild(int index, Traversable t) {
        if (!(t instanceof Expression)) {
            throw new IllegalArgumentException("not an expression: " + t);
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t.toString());
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * Replaces this expression with <var>expr</var> in the parent of this
    * expression. <var>expr</var> must be an orphan; this expression becomes
    * one.
    *
    * @param expr the replacing expression.
    * @throws IllegalStateException if this expression has no parent.
    * @throws NotAnOrphanException if <var>expr</var> has a parent.
    */
    public void replaceWith(Expression expr) {
        if (parent == null) {
            throw new IllegalStateException("cannot replace a root expression");
        }
        int index = Tools.identityIndexOf(parent.getChildren(), this);
        if (index == -1) {
            throw new IllegalStateException(this + " is not a child of its parent");
        }
        parent.setChild(index, expr);
    }

    /** Makes the expression print inside parentheses, or not. */
    public void setParens(boolean f) {
        parens = f;
    }

    /** Prints the expression, in parentheses if it was asked to. */
    public void print(PrintWriter o) {
        if (parens) {
            o.print("(");
            printBare(o);
            o.print(")");
        } else {
            printBare(o);
        }
    }

    /** Prints the expression without outer parentheses. */
    protected abstract void printBare(PrintWriter o);

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
