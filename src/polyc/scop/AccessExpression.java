package polyc.scop;

import polyc.hir.Expression;
import polyc.poly.Relation;

import java.io.PrintWriter;
import java.util.Collections;

/**
* A memory access inside a statement body. It keeps the access relation from
* the statement domain to the accessed element, whether the access reads or
* writes, and the source expression as its only child, which is what it
* prints. A relation with an unnamed target stands for a bare expression,
* such as the use of a loop iterator, rather than an array element.
*/
public class AccessExpression extends Expression {

    private Relation relation;

    private boolean read;

    private boolean write;

    /**
    * Creates an access.
    *
    * @param relation the map from the statement domain to the element.
    * @param read true if the access reads.
    * @param write true if the access writes.
    * @param source the source expression of the access.
    */
    public AccessExpression(Relation relation, boolean read, boolean write,
            Expression source) {
        super(Collections.singletonList(source));
        this.relation = relation;
        this.read = read;
        this.write = write;
    }

    @Override
    public AccessExpression clone() {
        return (AccessExpression)super.clone();
    }

    protected void printBare(PrintWriter o) {
        getSource().print(o);
    }

    /** Returns the access relation. */
    public Relation getRelation() {
        return relation;
    }

    /** Returns the name of the accessed array, or null for a bare expression. */
    public String getName() {
        return relation.getSpace().getOutName();
    }

    /** Checks if the access refers to an array element or a named scalar. */
    public boolean isNamed() {
        return getName() != null;
    }

    public boolean isRead() {
        return read;
    }

    public boolean isWrite() {
        return write;
    }

    /** Used by the reader once it sees that the access is assigned. */
    void setAccessType(boolean read, boolean write) {
        this.read = read;
        this.write = write;
    }

    /** Returns the source expression. */
    public Expression getSource() {
        return operand(0);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        AccessExpression other = (AccessExpression)o;
        return (read == other.read && write == other.write &&
                relation.toString().equals(other.relation.toString()));
    }

}
