package polyc.scop;

import polyc.hir.DFIterator;
import polyc.hir.Expression;
import polyc.poly.Relation;

import java.util.List;

/**
* A statement of a scop: its name, its iteration domain and its body. The
* accesses of the body are numbered in depth-first pre-order; accesses are
* not searched inside other accesses.
*/
public class ScopStatement {

    private final String name;

    private final Relation domain;

    private final Expression body;

    /**
    * Creates a statement.
    *
    * @param name the name, which is also the tuple name of the domain.
    * @param domain the iteration domain.
    * @param body the body expression.
    */
    public ScopStatement(String name, Relation domain, Expression body) {
        this.name = name;
        this.domain = domain;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public Relation getDomain() {
        return domain;
    }

    /** Returns the body; callers that rewrite it work on a clone. */
    public Expression getBody() {
        return body;
    }

    /**
    * Returns the accesses of the given expression in traversal order.
    */
    public static List<AccessExpression> getAccesses(Expression expr) {
        DFIterator<AccessExpression> iter =
                new DFIterator<AccessExpression>(expr, AccessExpression.class);
        iter.pruneOn(AccessExpression.class);
        return iter.getList();
    }

    /** Returns the accesses of the body in traversal order. */
    public List<AccessExpression> getAccesses() {
        return getAccesses(body);
    }

    /** Returns the number of accesses in the body. */
    public int countAccesses() {
        return getAccesses().size();
    }

    @Override
    public String toString() {
        return name + ": " + body;
    }

}
